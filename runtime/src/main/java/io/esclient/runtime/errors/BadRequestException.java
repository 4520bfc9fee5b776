/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.errors;

/**
 * Error returned by the server with a 400 status code.
 */
public class BadRequestException extends ApiException {

    public BadRequestException(Object body) {
        super(400, body);
    }
}
