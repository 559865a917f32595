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
package de.arbeitsagentur.keycloak.federation.common.crypto;

import com.nimbusds.jose.jwk.JWK;
import de.arbeitsagentur.keycloak.federation.common.error.SignatureVerificationException;
import de.arbeitsagentur.keycloak.federation.common.error.UnknownKeyIdException;
import de.arbeitsagentur.keycloak.federation.common.statement.EntityStatement;
import de.arbeitsagentur.keycloak.federation.common.statement.FederationKeySet;

/**
 * Verifies the signature of a compact JWS.
 */
public interface SignatureVerifier {

    /**
     * @throws SignatureVerificationException if the signature does not verify with {@code key}
     */
    void verify(String token, JWK key);

    /**
     * Selects the key named by the token's {@code kid} header and verifies with it.
     *
     * @throws UnknownKeyIdException if the kid is absent from {@code keySet}
     */
    default void verify(String token, FederationKeySet keySet) {
        EntityStatement statement = EntityStatement.parse(token);
        verify(statement.rawToken(), keySet.require(statement.kid()));
    }
}
