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

import java.time.Duration;

/**
 * Transport settings applied to one batch of document requests.
 *
 * @param connectTimeout TCP connect timeout
 * @param requestTimeout timeout of a single request once connected
 * @param deadline       upper bound for the whole batch; members still pending afterwards fail
 * @param userAgent      value of the {@code User-Agent} header, may be null
 */
public record FetchParams(
        Duration connectTimeout,
        Duration requestTimeout,
        Duration deadline,
        String userAgent
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(15);

    public FetchParams {
        connectTimeout = positiveOrDefault(connectTimeout, DEFAULT_CONNECT_TIMEOUT);
        requestTimeout = positiveOrDefault(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
        deadline = positiveOrDefault(deadline, DEFAULT_DEADLINE);
    }

    public static FetchParams defaults() {
        return new FetchParams(null, null, null, null);
    }

    public FetchParams withDeadline(Duration newDeadline) {
        return new FetchParams(connectTimeout, requestTimeout, newDeadline, userAgent);
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback) {
        return value != null && !value.isNegative() && !value.isZero() ? value : fallback;
    }
}
