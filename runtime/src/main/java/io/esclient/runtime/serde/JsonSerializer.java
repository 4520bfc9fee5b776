/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.serde;

import io.esclient.runtime.errors.SerializationException;
import java.lang.reflect.Array;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import software.amazon.smithy.model.loader.ModelSyntaxException;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.NodeMapper;
import software.amazon.smithy.model.node.ObjectNode;

/**
 * Serializes values to compact JSON and parses JSON responses into {@link Node}s.
 *
 * <p>Strings are assumed to already be JSON and are passed through untouched.
 * Maps, iterables, arrays, numbers, booleans, {@link Node}s, {@code java.time}
 * values, UUIDs and enums are converted directly; anything else goes through
 * a {@link NodeMapper}.
 */
public final class JsonSerializer implements Serializer {

    public static final String MIMETYPE = "application/json";

    private final NodeMapper mapper = new NodeMapper();

    @Override
    public String mimetype() {
        return MIMETYPE;
    }

    @Override
    public Object loads(String data) {
        try {
            return Node.parse(data);
        } catch (ModelSyntaxException e) {
            throw new SerializationException("Unable to deserialize JSON: " + e.getMessage(), e);
        }
    }

    @Override
    public String dumps(Object data) {
        if (data instanceof CharSequence text) {
            return text.toString();
        }
        try {
            return Node.printJson(toNode(data));
        } catch (SerializationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SerializationException("Unable to serialize " + data + " (type: "
                    + data.getClass().getName() + ")", e);
        }
    }

    /**
     * Converts a value into a {@link Node}.
     *
     * @param value Value to convert, may be {@code null}.
     * @return Returns the converted node.
     */
    public Node toNode(Object value) {
        if (value == null) {
            return Node.nullNode();
        } else if (value instanceof Node node) {
            return node;
        } else if (value instanceof Optional<?> optional) {
            return optional.map(this::toNode).orElse(Node.nullNode());
        } else if (value instanceof CharSequence || value instanceof Character) {
            return Node.from(value.toString());
        } else if (value instanceof Boolean bool) {
            return Node.from(bool);
        } else if (value instanceof Number number) {
            return Node.from(number);
        } else if (value instanceof TemporalAccessor || value instanceof UUID) {
            return Node.from(value.toString());
        } else if (value instanceof Enum<?> constant) {
            return Node.from(constant.name());
        } else if (value instanceof Map<?, ?> map) {
            ObjectNode.Builder builder = ObjectNode.builder();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() == null) {
                    throw new SerializationException("Unable to serialize a map with a null key");
                }
                builder.withMember(entry.getKey().toString(), toNode(entry.getValue()));
            }
            return builder.build();
        } else if (value instanceof Iterable<?> iterable) {
            List<Node> elements = new ArrayList<>();
            for (Object element : iterable) {
                elements.add(toNode(element));
            }
            return ArrayNode.fromNodes(elements);
        } else if (value.getClass().isArray()) {
            List<Node> elements = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                elements.add(toNode(Array.get(value, i)));
            }
            return ArrayNode.fromNodes(elements);
        }
        return mapper.serialize(value);
    }
}
