/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.errors;

/**
 * Error returned by the server with a 401 status code.
 */
public class AuthenticationException extends ApiException {

    public AuthenticationException(Object body) {
        super(401, body);
    }
}
