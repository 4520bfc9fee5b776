/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.serde;

/**
 * Converts request bodies to text and response bodies back to values for one mimetype.
 */
public interface Serializer {

    /**
     * @return Returns the mimetype handled by the serializer.
     */
    String mimetype();

    /**
     * Deserializes a response body.
     *
     * @param data Raw response body.
     * @return Returns the deserialized value.
     * @throws io.esclient.runtime.errors.SerializationException if the data is malformed.
     */
    Object loads(String data);

    /**
     * Serializes a request body.
     *
     * @param data Value to serialize.
     * @return Returns the serialized text.
     * @throws io.esclient.runtime.errors.SerializationException if the value can't be serialized.
     */
    String dumps(Object data);
}
