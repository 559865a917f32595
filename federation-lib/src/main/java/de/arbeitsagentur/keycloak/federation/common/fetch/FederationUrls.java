/*
 * Copyright 2026 Bundesagentur für Arbeit
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.arbeitsagentur.keycloak.federation.common.fetch;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public final class FederationUrls {
    public static final String WELL_KNOWN_PATH = ".well-known/openid-federation";

    private FederationUrls() {
    }

    /**
     * Entity configuration location of a subject: the subject with exactly one trailing slash,
     * followed by {@value #WELL_KNOWN_PATH}.
     */
    public static String wellKnownUrl(String subject) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject must not be blank");
        }
        String base = subject.endsWith("/") ? subject : subject + "/";
        return base + WELL_KNOWN_PATH;
    }

    /**
     * Fetch endpoint request for the statement a superior issues about {@code subject}.
     */
    public static String fetchUrl(String federationApiEndpoint, String subject) {
        String separator = federationApiEndpoint.contains("?") ? "&" : "?";
        return federationApiEndpoint + separator + "sub=" + URLEncoder.encode(subject, StandardCharsets.UTF_8);
    }

    /**
     * Compares entity identifiers, ignoring a single trailing slash.
     */
    public static boolean sameEntity(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        return stripTrailingSlash(left).equals(stripTrailingSlash(right));
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
