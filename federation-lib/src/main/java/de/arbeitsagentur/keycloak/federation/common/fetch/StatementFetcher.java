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

import java.util.List;

/**
 * Retrieves federation documents (entity configurations, subordinate statements).
 */
public interface StatementFetcher {

    /**
     * Fetches all URLs concurrently. Returns exactly one result per URL, in input order; a failing
     * URL yields a failed {@link FetchResult} and never affects the other members of the batch.
     */
    List<FetchResult> fetch(List<String> urls, FetchParams params);

    default FetchResult fetch(String url, FetchParams params) {
        return fetch(List.of(url), params).get(0);
    }
}
