/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.serde;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes newline-delimited JSON as used by the bulk style APIs.
 *
 * <p>An iterable body becomes one JSON document per line. A string body is
 * sent as-is. The serialized text always ends with a newline.
 */
public final class NdjsonSerializer implements Serializer {

    public static final String MIMETYPE = "application/x-ndjson";

    private final JsonSerializer json;

    public NdjsonSerializer() {
        this(new JsonSerializer());
    }

    public NdjsonSerializer(JsonSerializer json) {
        this.json = json;
    }

    @Override
    public String mimetype() {
        return MIMETYPE;
    }

    @Override
    public Object loads(String data) {
        List<Object> documents = new ArrayList<>();
        for (String line : data.split("\n")) {
            if (!line.isBlank()) {
                documents.add(json.loads(line));
            }
        }
        return documents;
    }

    @Override
    public String dumps(Object data) {
        String serialized;
        if (data instanceof CharSequence text) {
            serialized = text.toString();
        } else if (data instanceof Iterable<?> lines) {
            StringBuilder builder = new StringBuilder();
            for (Object line : lines) {
                builder.append(json.dumps(line)).append('\n');
            }
            serialized = builder.toString();
        } else {
            serialized = json.dumps(data);
        }
        return serialized.endsWith("\n") ? serialized : serialized + "\n";
    }
}
