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
package de.arbeitsagentur.keycloak.federation.common.statement;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import de.arbeitsagentur.keycloak.federation.common.error.MalformedTokenException;
import de.arbeitsagentur.keycloak.federation.common.error.UnknownKeyIdException;
import de.arbeitsagentur.keycloak.federation.common.error.UnsupportedFeatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Signing keys of a federation entity, indexed by {@code kid}.
 * <p>
 * Keys without a {@code kid} are retained in {@link #keys()} but can never be selected by
 * {@link #find(String)}. When several keys share a {@code kid} the first one wins.
 */
public final class FederationKeySet {
    private static final Logger LOG = LoggerFactory.getLogger(FederationKeySet.class);

    private final List<JWK> keys;
    private final Map<String, JWK> keysById;

    public FederationKeySet(List<JWK> keys) {
        this.keys = List.copyOf(keys);
        Map<String, JWK> index = new LinkedHashMap<>();
        for (JWK key : this.keys) {
            String kid = key.getKeyID();
            if (kid == null || kid.isBlank()) {
                continue;
            }
            if (index.putIfAbsent(kid, key) != null) {
                LOG.warn("Duplicate kid '{}' in key set, keeping the first occurrence", kid);
            }
        }
        this.keysById = Collections.unmodifiableMap(index);
    }

    public static FederationKeySet of(JWKSet jwkSet) {
        return new FederationKeySet(jwkSet.getKeys());
    }

    public static FederationKeySet fromPayload(EntityStatement statement) {
        return fromPayload(statement.payload());
    }

    /**
     * Extracts the key set embedded in the {@code jwks} claim. Both the JWK Set object form
     * ({@code {"keys": [...]}}) and a bare array of JWKs are accepted.
     *
     * @throws UnsupportedFeatureException if keys are only published by reference
     * @throws MalformedTokenException     if there is no usable {@code jwks} claim
     */
    public static FederationKeySet fromPayload(JsonNode payload) {
        if (payload == null) {
            throw new MalformedTokenException("Statement payload is missing");
        }
        JsonNode jwks = payload.path("jwks");
        if (jwks.isMissingNode() || jwks.isNull()) {
            if (payload.has("signed_jwks_uri") || payload.has("jwks_uri")) {
                throw new UnsupportedFeatureException(
                        "Key sets published by reference (jwks_uri, signed_jwks_uri) are not supported");
            }
            throw new MalformedTokenException("Statement carries no jwks claim");
        }
        JsonNode keyArray = jwks.isArray() ? jwks : jwks.path("keys");
        if (!keyArray.isArray()) {
            throw new MalformedTokenException("jwks claim must be a JWK Set or an array of JWKs");
        }
        List<JWK> keys = new ArrayList<>();
        for (JsonNode keyNode : keyArray) {
            try {
                keys.add(JWK.parse(keyNode.toString()));
            } catch (ParseException e) {
                throw new MalformedTokenException("Invalid JWK in jwks claim: " + e.getMessage(), e);
            }
        }
        return new FederationKeySet(keys);
    }

    public Optional<JWK> find(String kid) {
        if (kid == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keysById.get(kid));
    }

    /**
     * @throws UnknownKeyIdException naming the kid and the kids that are available
     */
    public JWK require(String kid) {
        return find(kid).orElseThrow(() -> new UnknownKeyIdException(kid, kids()));
    }

    public boolean contains(String kid) {
        return find(kid).isPresent();
    }

    public Set<String> kids() {
        return keysById.keySet();
    }

    public List<JWK> keys() {
        return keys;
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public String toString() {
        return "FederationKeySet" + kids();
    }
}
