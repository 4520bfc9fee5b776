/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package io.esclient.codegen;

import io.esclient.codegen.spec.ApiDefinition;
import io.esclient.codegen.spec.RestApiSpecReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Loads the API definitions under {@code src/test/resources/io/esclient/codegen}.
 */
public final class ApiFixtures {

    private ApiFixtures() {}

    public static Path directory() {
        return directory("api");
    }

    public static Path directory(String name) {
        try {
            return Path.of(ApiFixtures.class.getResource("/io/esclient/codegen/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static List<ApiDefinition> all() {
        return new RestApiSpecReader(null, Set.of()).read(List.of(directory()));
    }

    public static ApiDefinition api(String fullName) {
        return all().stream()
                .filter(api -> api.fullName().equals(fullName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No fixture for " + fullName));
    }
}
