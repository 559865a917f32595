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

import de.arbeitsagentur.keycloak.federation.common.crypto.NimbusSignatureVerifier;
import de.arbeitsagentur.keycloak.federation.common.crypto.SignatureVerifier;
import de.arbeitsagentur.keycloak.federation.common.fetch.HttpStatementFetcher;
import de.arbeitsagentur.keycloak.federation.common.fetch.StatementFetcher;
import de.arbeitsagentur.keycloak.federation.common.trust.TrustAnchor;
import de.arbeitsagentur.keycloak.federation.common.trust.TrustChainResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FederationConfiguration {
    private static final Logger LOG = LoggerFactory.getLogger(FederationConfiguration.class);

    @Bean
    public StatementFetcher statementFetcher(FederationProperties properties) {
        return new HttpStatementFetcher(properties.fetchParams());
    }

    @Bean
    public SignatureVerifier signatureVerifier() {
        return new NimbusSignatureVerifier();
    }

    @Bean
    public TrustChainResolver trustChainResolver(StatementFetcher statementFetcher,
                                                 SignatureVerifier signatureVerifier,
                                                 FederationProperties properties) {
        TrustChainResolver.Builder builder = TrustChainResolver.builder(statementFetcher)
                .verifier(signatureVerifier)
                .fetchParams(properties.fetchParams())
                .maxAuthorityHints(properties.resolvedMaxAuthorityHints())
                .maxPathLength(properties.resolvedMaxPathLength())
                .allowedTrustMarks(properties.allowedTrustMarks());
        for (TrustAnchor anchor : properties.resolvedTrustAnchors()) {
            builder.trustAnchor(anchor);
        }
        if (properties.trustAnchors().isEmpty()) {
            LOG.warn("No trust anchors configured, every entity without authority hints ends a chain");
        } else {
            LOG.info("Configured trust anchors: {}", properties.trustAnchors().stream()
                    .map(FederationProperties.TrustAnchorProperties::subject).toList());
        }
        return builder.build();
    }
}
