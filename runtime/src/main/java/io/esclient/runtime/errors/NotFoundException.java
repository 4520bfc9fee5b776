/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.errors;

/**
 * Error returned by the server with a 404 status code.
 */
public class NotFoundException extends ApiException {

    public NotFoundException(Object body) {
        super(404, body);
    }
}
