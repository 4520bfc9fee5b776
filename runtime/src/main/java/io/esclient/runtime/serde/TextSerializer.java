/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.serde;

import io.esclient.runtime.errors.SerializationException;

public final class TextSerializer implements Serializer {

    public static final String MIMETYPE = "text/plain";

    @Override
    public String mimetype() {
        return MIMETYPE;
    }

    @Override
    public Object loads(String data) {
        return data;
    }

    @Override
    public String dumps(Object data) {
        if (data instanceof CharSequence text) {
            return text.toString();
        }
        throw new SerializationException("Cannot serialize " + data + " into text.");
    }
}
