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

import de.arbeitsagentur.keycloak.federation.common.error.FetchException;

/**
 * Outcome of fetching one URL: either the trimmed response body or the failure.
 */
public record FetchResult(String url, String body, FetchException error) {

    public static FetchResult success(String url, String body) {
        return new FetchResult(url, body, null);
    }

    public static FetchResult failure(String url, FetchException error) {
        return new FetchResult(url, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws FetchException the recorded failure
     */
    public String bodyOrThrow() {
        if (error != null) {
            throw error;
        }
        return body;
    }
}
