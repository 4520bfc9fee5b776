/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.runtime.transport;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the value of the {@code x-elastic-client-meta} header.
 */
public final class ClientMeta {

    public static final String HEADER = "x-elastic-client-meta";

    private static final Pattern VERSION = Pattern.compile("^([0-9]+)\\.([0-9]+)(?:\\.([0-9]+))?(.*)$");
    private static final String FALLBACK_VERSION = "0.0.0";

    private ClientMeta() {}

    /**
     * Gets the header value for this client.
     *
     * @param async Whether the request is sent by the asynchronous transport.
     * @return Returns the header value.
     */
    public static String header(boolean async) {
        String client = formatVersion(clientVersion());
        String java = javaVersion();
        String value = "es=" + client + ",jv=" + java + ",t=" + client + ",hc=" + java;
        return async ? value + ",a=1" : value;
    }

    /**
     * Shortens a version to its numeric part, suffixed with {@code p} for pre-releases.
     *
     * <p>{@code 8.1.0-SNAPSHOT} becomes {@code 8.1.0p}.
     *
     * @param version Version to format.
     * @return Returns the formatted version.
     */
    public static String formatVersion(String version) {
        Matcher matcher = VERSION.matcher(version.trim());
        if (!matcher.matches()) {
            return version;
        }
        StringBuilder result = new StringBuilder(matcher.group(1)).append('.').append(matcher.group(2));
        if (matcher.group(3) != null) {
            result.append('.').append(matcher.group(3));
        }
        if (!matcher.group(4).isEmpty()) {
            result.append('p');
        }
        return result.toString();
    }

    static String javaVersion() {
        Runtime.Version version = Runtime.version();
        String result = version.feature() + "." + version.interim() + "." + version.update();
        return version.pre().isPresent() ? result + "p" : result;
    }

    static String clientVersion() {
        String version = ClientMeta.class.getPackage().getImplementationVersion();
        return version == null ? FALLBACK_VERSION : version;
    }
}
