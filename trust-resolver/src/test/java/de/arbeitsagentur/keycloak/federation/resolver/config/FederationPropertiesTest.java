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
package de.arbeitsagentur.keycloak.federation.resolver.config;

import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import de.arbeitsagentur.keycloak.federation.common.fetch.FetchParams;
import de.arbeitsagentur.keycloak.federation.common.trust.TrustAnchor;
import de.arbeitsagentur.keycloak.federation.common.trust.TrustChainResolver;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FederationPropertiesTest {

    @Test
    void unsetValuesFallBackToDefaults() {
        FederationProperties properties = new FederationProperties(null, null, null, null, null, null, null, null);

        assertThat(properties.trustAnchors()).isEmpty();
        assertThat(properties.resolvedMaxAuthorityHints()).isZero();
        assertThat(properties.resolvedMaxPathLength()).isEqualTo(TrustChainResolver.DEFAULT_MAX_PATH_LENGTH);
        assertThat(properties.userAgent()).isEqualTo(FederationProperties.DEFAULT_USER_AGENT);
        assertThat(properties.allowedTrustMarks()).isEmpty();
        FetchParams params = properties.fetchParams();
        assertThat(params.connectTimeout()).isEqualTo(FetchParams.DEFAULT_CONNECT_TIMEOUT);
        assertThat(params.requestTimeout()).isEqualTo(FetchParams.DEFAULT_REQUEST_TIMEOUT);
        assertThat(params.deadline()).isEqualTo(FetchParams.DEFAULT_DEADLINE);
    }

    @Test
    void configuredTimeoutsReachFetchParams() {
        FederationProperties properties = new FederationProperties(List.of(), 3, 2,
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3), "probe/1.0", List.of());

        FetchParams params = properties.fetchParams();

        assertThat(properties.resolvedMaxAuthorityHints()).isEqualTo(3);
        assertThat(properties.resolvedMaxPathLength()).isEqualTo(2);
        assertThat(params.connectTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(params.requestTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(params.deadline()).isEqualTo(Duration.ofSeconds(3));
        assertThat(params.userAgent()).isEqualTo("probe/1.0");
    }

    @Test
    void trustAnchorWithInlineJwksPinsKeys() throws Exception {
        ECKey key = new ECKeyGenerator(Curve.P_256).keyID("ta-1").generate();
        String jwks = new JWKSet(key.toPublicJWK()).toString();

        TrustAnchor pinned = new FederationProperties.TrustAnchorProperties("https://ta.example/", jwks).toTrustAnchor();
        TrustAnchor open = new FederationProperties.TrustAnchorProperties("https://ta.example/", null).toTrustAnchor();

        assertThat(pinned.hasPinnedKeys()).isTrue();
        assertThat(pinned.pinnedKeys().kids()).containsExactly("ta-1");
        assertThat(open.hasPinnedKeys()).isFalse();
    }

    @Test
    void invalidInlineJwksIsRejected() {
        FederationProperties.TrustAnchorProperties anchor =
                new FederationProperties.TrustAnchorProperties("https://ta.example/", "{not json");

        assertThatThrownBy(anchor::toTrustAnchor)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("https://ta.example/");
    }
}
