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
package de.arbeitsagentur.keycloak.federation.common.trust;

import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import de.arbeitsagentur.keycloak.federation.common.error.FetchException;
import de.arbeitsagentur.keycloak.federation.common.fetch.FederationUrls;
import de.arbeitsagentur.keycloak.federation.common.fetch.FetchParams;
import de.arbeitsagentur.keycloak.federation.common.fetch.FetchResult;
import de.arbeitsagentur.keycloak.federation.common.fetch.StatementFetcher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds signed federation documents and serves them from memory.
 */
public final class FederationFixtures {
    public static final JOSEObjectType ENTITY_STATEMENT_TYPE = new JOSEObjectType("entity-statement+jwt");

    private FederationFixtures() {
    }

    public static ECKey newKey(String kid) {
        try {
            return new ECKeyGenerator(Curve.P_256)
                    .keyUse(KeyUse.SIGNATURE)
                    .keyID(kid)
                    .generate();
        } catch (Exception e) {
            throw new IllegalStateException("Unable to generate EC key", e);
        }
    }

    public static String sign(ECKey key, JWTClaimsSet claims) {
        try {
            JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.ES256)
                    .keyID(key.getKeyID())
                    .type(ENTITY_STATEMENT_TYPE)
                    .build();
            SignedJWT jwt = new SignedJWT(header, claims);
            jwt.sign(new ECDSASigner(key));
            return jwt.serialize();
        } catch (Exception e) {
            throw new IllegalStateException("Unable to sign statement", e);
        }
    }

    public static Map<String, Object> publicJwks(ECKey... keys) {
        return new JWKSet(List.<JWK>of(keys)).toPublicJWKSet().toJSONObject();
    }

    /**
     * A federation participant with one signing key.
     */
    public static final class Entity {
        private final String subject;
        private final ECKey key;
        private List<String> authorityHints = List.of();
        private String federationApiEndpoint;

        public Entity(String subject, String kid) {
            this(subject, newKey(kid));
        }

        public Entity(String subject, ECKey key) {
            this.subject = subject;
            this.key = key;
        }

        public Entity authorityHints(String... hints) {
            this.authorityHints = List.of(hints);
            return this;
        }

        public Entity federationApiEndpoint(String endpoint) {
            this.federationApiEndpoint = endpoint;
            return this;
        }

        public String subject() {
            return subject;
        }

        public ECKey key() {
            return key;
        }

        public String entityConfiguration() {
            JWTClaimsSet.Builder claims = baseClaims(subject)
                    .claim("jwks", publicJwks(key));
            if (!authorityHints.isEmpty()) {
                claims.claim("authority_hints", authorityHints);
            }
            if (federationApiEndpoint != null) {
                claims.claim("metadata", Map.of("federation_entity",
                        Map.of("federation_api_endpoint", federationApiEndpoint)));
            }
            return sign(key, claims.build());
        }

        /** Statement about {@code subordinate} vouching for the subordinate's real key. */
        public String subordinateStatement(Entity subordinate) {
            return subordinateStatement(subordinate.subject(), subordinate.key());
        }

        public String subordinateStatement(String subordinateSubject, ECKey... vouchedKeys) {
            JWTClaimsSet claims = baseClaims(subordinateSubject)
                    .claim("jwks", publicJwks(vouchedKeys))
                    .build();
            return sign(key, claims);
        }

        private JWTClaimsSet.Builder baseClaims(String about) {
            Instant now = Instant.now();
            return new JWTClaimsSet.Builder()
                    .issuer(subject)
                    .subject(about)
                    .issueTime(Date.from(now))
                    .expirationTime(Date.from(now.plus(Duration.ofHours(1))));
        }

        public String wellKnownUrl() {
            return FederationUrls.wellKnownUrl(subject);
        }

        public String fetchUrlFor(Entity subordinate) {
            return FederationUrls.fetchUrl(federationApiEndpoint, subordinate.subject());
        }

        /** Serves the entity configuration and the statements about the given subordinates. */
        public Entity publish(InMemoryStatementFetcher fetcher, Entity... subordinates) {
            fetcher.serve(wellKnownUrl(), entityConfiguration());
            for (Entity subordinate : subordinates) {
                fetcher.serve(fetchUrlFor(subordinate), subordinateStatement(subordinate));
            }
            return this;
        }
    }

    /**
     * Serves documents by exact URL and records every batch it was asked for.
     * Unknown URLs fail like an HTTP 404.
     */
    public static final class InMemoryStatementFetcher implements StatementFetcher {
        private final Map<String, String> documents = new ConcurrentHashMap<>();
        private final List<List<String>> batches = new ArrayList<>();

        public InMemoryStatementFetcher serve(String url, String body) {
            documents.put(url, body);
            return this;
        }

        @Override
        public synchronized List<FetchResult> fetch(List<String> urls, FetchParams params) {
            batches.add(List.copyOf(urls));
            List<FetchResult> results = new ArrayList<>();
            for (String url : urls) {
                String body = documents.get(url);
                results.add(body != null
                        ? FetchResult.success(url, body)
                        : FetchResult.failure(url, new FetchException(url, "HTTP 404 from " + url)));
            }
            return results;
        }

        public synchronized List<List<String>> batches() {
            return List.copyOf(batches);
        }

        public synchronized List<String> requestedUrls() {
            return batches.stream().flatMap(List::stream).toList();
        }
    }
}
