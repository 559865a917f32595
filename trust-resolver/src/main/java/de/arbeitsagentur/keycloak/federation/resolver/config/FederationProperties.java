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

import com.nimbusds.jose.jwk.JWKSet;
import de.arbeitsagentur.keycloak.federation.common.fetch.FetchParams;
import de.arbeitsagentur.keycloak.federation.common.statement.FederationKeySet;
import de.arbeitsagentur.keycloak.federation.common.trust.TrustAnchor;
import de.arbeitsagentur.keycloak.federation.common.trust.TrustChainResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.text.ParseException;
import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "federation")
@Validated
public record FederationProperties(
        @Valid List<TrustAnchorProperties> trustAnchors,
        @PositiveOrZero Integer maxAuthorityHints,
        @PositiveOrZero Integer maxPathLength,
        Duration connectTimeout,
        Duration requestTimeout,
        Duration fetchDeadline,
        String userAgent,
        List<String> allowedTrustMarks
) {
    public static final String DEFAULT_USER_AGENT = "federation-trust-resolver";

    public List<TrustAnchorProperties> trustAnchors() {
        return trustAnchors != null ? trustAnchors : List.of();
    }

    /**
     * Upper bound of authority hints followed per entity; 0 means unlimited.
     */
    public int resolvedMaxAuthorityHints() {
        return maxAuthorityHints != null ? maxAuthorityHints : 0;
    }

    public int resolvedMaxPathLength() {
        return maxPathLength != null && maxPathLength > 0
                ? maxPathLength
                : TrustChainResolver.DEFAULT_MAX_PATH_LENGTH;
    }

    public String userAgent() {
        return userAgent != null && !userAgent.isBlank() ? userAgent : DEFAULT_USER_AGENT;
    }

    public List<String> allowedTrustMarks() {
        return allowedTrustMarks != null ? allowedTrustMarks : List.of();
    }

    public FetchParams fetchParams() {
        return new FetchParams(connectTimeout, requestTimeout, fetchDeadline, userAgent());
    }

    public List<TrustAnchor> resolvedTrustAnchors() {
        return trustAnchors().stream().map(TrustAnchorProperties::toTrustAnchor).toList();
    }

    /**
     * @param subject entity identifier of the anchor
     * @param jwks    optional JWK Set JSON the anchor's entity configuration must be signed with
     */
    public record TrustAnchorProperties(@NotBlank String subject, String jwks) {

        public TrustAnchor toTrustAnchor() {
            if (jwks == null || jwks.isBlank()) {
                return TrustAnchor.of(subject);
            }
            try {
                return new TrustAnchor(subject, FederationKeySet.of(JWKSet.parse(jwks)));
            } catch (ParseException e) {
                throw new IllegalStateException("Invalid pinned jwks for trust anchor " + subject, e);
            }
        }
    }
}
