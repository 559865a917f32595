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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FederationUrlsTest {

    @Test
    void wellKnownUrlAddsExactlyOneSlash() {
        assertThat(FederationUrls.wellKnownUrl("https://leaf.example"))
                .isEqualTo("https://leaf.example/.well-known/openid-federation");
        assertThat(FederationUrls.wellKnownUrl("https://leaf.example/"))
                .isEqualTo("https://leaf.example/.well-known/openid-federation");
        assertThat(FederationUrls.wellKnownUrl("https://example.org/tenants/a"))
                .isEqualTo("https://example.org/tenants/a/.well-known/openid-federation");
    }

    @Test
    void wellKnownUrlRejectsBlankSubject() {
        assertThatThrownBy(() -> FederationUrls.wellKnownUrl(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fetchUrlEncodesSubject() {
        assertThat(FederationUrls.fetchUrl("https://ta.example/fetch", "https://leaf.example/"))
                .isEqualTo("https://ta.example/fetch?sub=https%3A%2F%2Fleaf.example%2F");
        assertThat(FederationUrls.fetchUrl("https://ta.example/fetch?format=jwt", "https://leaf.example"))
                .isEqualTo("https://ta.example/fetch?format=jwt&sub=https%3A%2F%2Fleaf.example");
    }

    @Test
    void sameEntityIgnoresTrailingSlash() {
        assertThat(FederationUrls.sameEntity("https://ta.example", "https://ta.example/")).isTrue();
        assertThat(FederationUrls.sameEntity("https://ta.example", "https://other.example")).isFalse();
        assertThat(FederationUrls.sameEntity(null, "https://ta.example")).isFalse();
    }
}
