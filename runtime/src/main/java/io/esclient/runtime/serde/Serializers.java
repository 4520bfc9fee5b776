/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.serde;

import io.esclient.runtime.errors.SerializationException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import software.amazon.smithy.utils.MediaType;

/**
 * Registry of {@link Serializer}s keyed by mimetype.
 *
 * <p>Response bodies are deserialized with the serializer registered for the
 * response's content type. Elasticsearch's versioned mimetypes such as
 * {@code application/vnd.elasticsearch+json;compatible-with=8} resolve to the
 * plain JSON and NDJSON serializers.
 */
public final class Serializers {

    private static final String COMPAT_PREFIX = "vnd.elasticsearch+";

    private final Map<String, Serializer> serializers = new LinkedHashMap<>();
    private final Serializer defaultSerializer;

    /**
     * Creates the standard registry with JSON as the default.
     */
    public Serializers() {
        this(List.of(new JsonSerializer(), new NdjsonSerializer(), new TextSerializer()), JsonSerializer.MIMETYPE);
    }

    /**
     * @param serializers Serializers to register, later ones replacing earlier ones with the same mimetype.
     * @param defaultMimetype Mimetype of the serializer used when no content type is known.
     */
    public Serializers(Collection<? extends Serializer> serializers, String defaultMimetype) {
        for (Serializer serializer : serializers) {
            this.serializers.put(serializer.mimetype(), serializer);
        }
        Serializer found = this.serializers.get(defaultMimetype);
        if (found == null) {
            throw new IllegalArgumentException("Cannot find default serializer (" + defaultMimetype + ")");
        }
        this.defaultSerializer = found;
    }

    public Serializer defaultSerializer() {
        return defaultSerializer;
    }

    /**
     * Serializes a request body.
     *
     * @param data Body to serialize.
     * @param contentType Content type of the request, or {@code null} to use the default.
     * @return Returns the serialized body.
     */
    public String dumps(Object data, String contentType) {
        return serializerFor(contentType).dumps(data);
    }

    /**
     * Deserializes a response body.
     *
     * @param data Raw response text.
     * @param contentType Content type of the response, or {@code null} to use the default.
     * @return Returns the deserialized body.
     * @throws SerializationException if no serializer handles the content type.
     */
    public Object loads(String data, String contentType) {
        return serializerFor(contentType).loads(data);
    }

    /**
     * Finds the serializer for a content type, ignoring its parameters.
     *
     * @param contentType Content type to resolve, may be {@code null}.
     * @return Returns the matching serializer.
     * @throws SerializationException if no serializer handles the content type.
     */
    public Serializer serializerFor(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return defaultSerializer;
        }
        String mimetype = normalize(contentType);
        Serializer serializer = serializers.get(mimetype);
        if (serializer == null) {
            throw new SerializationException("Unknown mimetype, unable to deserialize: " + contentType);
        }
        return serializer;
    }

    private static String normalize(String contentType) {
        MediaType mediaType;
        try {
            mediaType = MediaType.from(contentType);
        } catch (RuntimeException e) {
            throw new SerializationException("Invalid mimetype: " + contentType, e);
        }
        String subtype = mediaType.getSubtype();
        if (subtype.startsWith(COMPAT_PREFIX)) {
            subtype = subtype.substring(COMPAT_PREFIX.length());
            if (subtype.equals("x-ndjson")) {
                return NdjsonSerializer.MIMETYPE;
            }
        }
        return mediaType.getType() + "/" + subtype;
    }
}
