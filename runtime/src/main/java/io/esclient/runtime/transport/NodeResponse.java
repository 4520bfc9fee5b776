/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Raw response returned by a node.
 *
 * @param status HTTP status code.
 * @param headers Response headers, with lower-cased names.
 * @param body Response body as text, empty when there is none.
 */
public record NodeResponse(int status, Map<String, String> headers, String body) {

    public NodeResponse {
        Map<String, String> lowered = new TreeMap<>();
        headers.forEach((name, value) -> lowered.put(name.toLowerCase(Locale.ROOT), value));
        headers = Map.copyOf(lowered);
        body = body == null ? "" : body;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
