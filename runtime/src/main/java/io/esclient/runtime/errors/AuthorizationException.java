/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.errors;

/**
 * Error returned by the server with a 403 status code.
 */
public class AuthorizationException extends ApiException {

    public AuthorizationException(Object body) {
        super(403, body);
    }
}
