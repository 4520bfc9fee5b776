/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.errors;

/**
 * Error returned by the server with a 409 status code.
 */
public class ConflictException extends ApiException {

    public ConflictException(Object body) {
        super(409, body);
    }
}
