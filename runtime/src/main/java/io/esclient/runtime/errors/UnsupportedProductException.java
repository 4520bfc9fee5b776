/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.errors;

/**
 * Raised on every request once the client has determined that the server
 * it talks to is not a supported Elasticsearch distribution.
 */
public class UnsupportedProductException extends TransportException {

    public UnsupportedProductException(String message) {
        super(message);
    }
}
