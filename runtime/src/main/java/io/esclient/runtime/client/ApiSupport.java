/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.client;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Helpers called by generated client methods.
 */
public final class ApiSupport {

    /**
     * Query parameters accepted by every API.
     */
    public static final List<String> GLOBAL_PARAMS = List.of("pretty", "human", "error_trace", "format", "filter_path");

    /**
     * Query parameters consumed by the transport.
     */
    public static final List<String> TRANSPORT_PARAMS = List.of("request_timeout", "ignore");

    /**
     * Per-call options turned into request headers rather than query parameters.
     *
     * <p>{@code headers} is a map of extra headers, {@code opaque_id} becomes
     * {@code x-opaque-id}, and {@code http_auth} or {@code api_key} become the
     * {@code authorization} header.
     */
    public static final List<String> REQUEST_OPTIONS = List.of("headers", "opaque_id", "http_auth", "api_key");

    public static final String COMPATIBILITY_MIMETYPE = "application/vnd.elasticsearch+json;compatible-with=8";
    public static final String API_VERSIONING_ENV = "ELASTIC_CLIENT_APIVERSIONING";

    private static final Set<String> COMPATIBLE_MIMETYPES = Set.of("application/json", "application/x-ndjson");
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private ApiSupport() {}

    /**
     * Checks whether a value is left out of a path: {@code null}, an empty
     * string, an empty collection, an empty map or an empty array.
     *
     * @param value Value to check.
     * @return Returns true if the value is empty.
     */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        } else if (value instanceof CharSequence text) {
            return text.length() == 0;
        } else if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        } else if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        } else if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return false;
    }

    /**
     * Fails when a required argument is empty.
     *
     * @param value Argument value.
     * @param name Name of the argument.
     * @throws IllegalArgumentException if the value is empty.
     */
    public static void requireNonEmpty(Object value, String name) {
        if (isEmpty(value)) {
            throw new IllegalArgumentException("Empty value passed for a required argument '" + name + "'.");
        }
    }

    /**
     * Fails when any of several required arguments is empty.
     *
     * @param values Argument values.
     * @throws IllegalArgumentException if any value is empty.
     */
    public static void requireAllNonEmpty(Object... values) {
        for (Object value : values) {
            if (isEmpty(value)) {
                throw new IllegalArgumentException("Empty value passed for a required argument.");
            }
        }
    }

    /**
     * Converts a value to its string form in a path or query string.
     *
     * <p>Collections and arrays become comma-separated lists, booleans
     * {@code true}/{@code false}, dates and times ISO-8601.
     *
     * @param value Value to convert.
     * @return Returns the string form.
     */
    public static String escape(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(ApiSupport::escape).collect(Collectors.joining(","));
        } else if (value != null && value.getClass().isArray()) {
            List<String> parts = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                parts.add(escape(Array.get(value, i)));
            }
            return String.join(",", parts);
        } else if (value instanceof TemporalAccessor) {
            return value.toString();
        } else if (value instanceof Enum<?> constant) {
            return constant.toString();
        }
        return String.valueOf(value);
    }

    /**
     * Wraps a single value in a list. Collections and arrays are copied.
     *
     * @param value Value to wrap.
     * @return Returns the list.
     */
    public static List<Object> toList(Object value) {
        List<Object> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            result.addAll(collection);
        } else if (value != null && value.getClass().isArray()) {
            for (int i = 0; i < Array.getLength(value); i++) {
                result.add(Array.get(value, i));
            }
        } else {
            result.add(value);
        }
        return result;
    }

    /**
     * Builds a path from its parts, skipping empty ones.
     *
     * <p>Each part is escaped and percent-encoded, keeping {@code ,} and
     * {@code *} readable.
     *
     * @param parts Static segments and argument values.
     * @return Returns the path, starting with {@code /}.
     */
    public static String makePath(Object... parts) {
        return "/" + Arrays.stream(parts)
                .filter(part -> !isEmpty(part))
                .map(part -> quote(escape(part)))
                .collect(Collectors.joining("/"));
    }

    static String quote(String value) {
        StringBuilder result = new StringBuilder();
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '.' || c == '_' || c == '~' || c == ',' || c == '*') {
                result.append((char) c);
            } else {
                result.append('%').append(HEX[c >> 4]).append(HEX[c & 0xF]);
            }
        }
        return result.toString();
    }

    /**
     * Validates and converts the query parameters of a call.
     *
     * <p>Parameters with a {@code null} value are dropped. Besides the given
     * names, the global and transport parameters are always accepted. Request
     * options are accepted and left to {@link #headers(Map, String, String)}.
     *
     * @param params Parameters passed by the caller, may be {@code null}.
     * @param allowed Names of the API's query parameters.
     * @return Returns the converted parameters, in the caller's order.
     * @throws IllegalArgumentException if a parameter isn't accepted by the API.
     */
    public static Map<String, String> queryParams(Map<String, ?> params, String... allowed) {
        Map<String, String> result = new LinkedHashMap<>();
        if (params == null) {
            return result;
        }
        Set<String> accepted = new LinkedHashSet<>(Arrays.asList(allowed));
        accepted.addAll(GLOBAL_PARAMS);
        accepted.addAll(TRANSPORT_PARAMS);
        accepted.addAll(REQUEST_OPTIONS);
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            if (!accepted.contains(entry.getKey())) {
                throw new IllegalArgumentException("Unknown query parameter '" + entry.getKey()
                        + "', expected one of: " + String.join(", ", accepted));
            }
            if (entry.getValue() != null && !REQUEST_OPTIONS.contains(entry.getKey())) {
                result.put(entry.getKey(), escape(entry.getValue()));
            }
        }
        return result;
    }

    /**
     * Builds the headers of a call.
     *
     * <p>Headers passed in the {@code headers} option come first, with their
     * names in lower case. The mimetype headers are only added when the caller
     * didn't set them. When {@code ELASTIC_CLIENT_APIVERSIONING} is
     * {@code true} or {@code 1}, JSON and NDJSON mimetypes are replaced with
     * the compatibility mimetype.
     *
     * <p>{@code http_auth} is either a Base64 encoded {@code user:password}
     * or a {@code [user, password]} pair, {@code api_key} either a Base64
     * encoded {@code id:key} or an {@code [id, key]} pair.
     *
     * @param params Parameters passed by the caller, may be {@code null}.
     * @param accept Comma-separated response mimetypes, may be {@code null}.
     * @param contentType Request mimetype, may be {@code null}.
     * @return Returns the headers.
     * @throws IllegalArgumentException if both {@code http_auth} and {@code api_key} are given.
     */
    public static Map<String, String> headers(Map<String, ?> params, String accept, String contentType) {
        return headers(params, accept, contentType, System::getenv);
    }

    static Map<String, String> headers(
            Map<String, ?> params,
            String accept,
            String contentType,
            Function<String, String> env
    ) {
        Map<String, ?> options = params == null ? Map.of() : params;
        Map<String, String> headers = new LinkedHashMap<>();
        if (options.get("headers") instanceof Map<?, ?> extra) {
            extra.forEach((name, value) -> headers.put(String.valueOf(name).toLowerCase(Locale.ROOT),
                    String.valueOf(value)));
        } else if (options.get("headers") != null) {
            throw new IllegalArgumentException("The 'headers' option must be a map of header names to values");
        }
        if (options.get("opaque_id") != null) {
            headers.put("x-opaque-id", String.valueOf(options.get("opaque_id")));
        }

        String versioning = env.apply(API_VERSIONING_ENV);
        boolean compat = "true".equals(versioning) || "1".equals(versioning);
        if (accept != null && !accept.isEmpty()) {
            headers.putIfAbsent("accept", compat ? compatible(accept) : accept);
        }
        if (contentType != null && !contentType.isEmpty()) {
            headers.putIfAbsent("content-type", compat ? compatible(contentType) : contentType);
        }

        Object httpAuth = options.get("http_auth");
        Object apiKey = options.get("api_key");
        if (httpAuth != null && apiKey != null) {
            throw new IllegalArgumentException("Only one of 'http_auth' and 'api_key' may be passed at a time");
        } else if (httpAuth != null) {
            headers.put("authorization", "Basic " + authValue(httpAuth));
        } else if (apiKey != null) {
            headers.put("authorization", "ApiKey " + authValue(apiKey));
        }
        return headers;
    }

    // A pair is joined with ':' and encoded, a string is already encoded.
    private static String authValue(Object value) {
        if (value instanceof CharSequence) {
            return value.toString();
        }
        List<String> parts = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            collection.forEach(part -> parts.add(String.valueOf(part)));
        } else if (value.getClass().isArray()) {
            for (int i = 0; i < Array.getLength(value); i++) {
                parts.add(String.valueOf(Array.get(value, i)));
            }
        } else {
            throw new IllegalArgumentException("Credentials must be an encoded string or a pair, got "
                    + value.getClass().getName());
        }
        return Base64.getEncoder().encodeToString(String.join(":", parts).getBytes(StandardCharsets.UTF_8));
    }

    private static String compatible(String mimetypes) {
        return Arrays.stream(mimetypes.split(","))
                .map(String::trim)
                .map(mimetype -> COMPATIBLE_MIMETYPES.contains(mimetype) ? COMPATIBILITY_MIMETYPE : mimetype)
                .distinct()
                .collect(Collectors.joining(","));
    }
}
