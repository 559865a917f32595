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

import com.nimbusds.jose.jwk.JWK;
import de.arbeitsagentur.keycloak.federation.common.crypto.SignatureVerifier;
import de.arbeitsagentur.keycloak.federation.common.error.MalformedTokenException;
import de.arbeitsagentur.keycloak.federation.common.error.SignatureVerificationException;
import de.arbeitsagentur.keycloak.federation.common.error.TrustChainException;
import de.arbeitsagentur.keycloak.federation.common.error.UnknownKeyIdException;
import de.arbeitsagentur.keycloak.federation.common.statement.EntityStatement;
import de.arbeitsagentur.keycloak.federation.common.statement.FederationKeySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The self-issued, self-signed statement of a federation entity, together with the outcome of
 * validating it against its superiors.
 * <p>
 * Superiors are classified in two steps. Fetching a superior's configuration puts it into one of:
 * <ul>
 *     <li>{@link #verifiedSuperiors()}: the superior's own configuration verified,</li>
 *     <li>{@link #failedSuperiors()}: the superior's configuration did not verify,</li>
 *     <li>{@link #unreachableSuperiors()}: the configuration could not be fetched, was malformed
 *     or used an unsupported feature.</li>
 * </ul>
 * The subordinate statements of verified superiors are then cross-checked with
 * {@link #validateBySuperiorStatement(String, EntityConfiguration)}; every outcome lands in
 * {@link #verifiedBySuperiors()}. A verified superior whose statement cannot be obtained (no fetch
 * endpoint, fetch failure) stays verified and is additionally recorded as unreachable for that step.
 * <p>
 * Instances are not thread-safe. A configuration is mutated only by the resolution task that
 * created it and is read-only once that task has finished.
 */
public final class EntityConfiguration {
    private static final Logger LOG = LoggerFactory.getLogger(EntityConfiguration.class);

    private final EntityStatement statement;
    private final FederationKeySet keySet;
    private final SignatureVerifier verifier;
    private ValidationState state = ValidationState.UNVALIDATED;

    private final Map<String, EntityConfiguration> verifiedSuperiors = new LinkedHashMap<>();
    private final Map<String, EntityConfiguration> failedSuperiors = new LinkedHashMap<>();
    private final Map<String, String> unreachableSuperiors = new LinkedHashMap<>();
    private final Map<String, Boolean> verifiedBySuperiors = new LinkedHashMap<>();
    private final Map<String, EntityStatement> superiorStatements = new LinkedHashMap<>();
    private final Map<String, String> failedBySuperiors = new LinkedHashMap<>();

    private EntityConfiguration(EntityStatement statement, FederationKeySet keySet, SignatureVerifier verifier) {
        this.statement = statement;
        this.keySet = keySet;
        this.verifier = verifier;
    }

    /**
     * Decodes an entity configuration. The signature is not checked; call {@link #validateSelf()}.
     *
     * @throws MalformedTokenException if the token is malformed, lacks {@code sub} or {@code jwks},
     *                                 or is not self-issued
     */
    public static EntityConfiguration parse(String token, SignatureVerifier verifier) {
        EntityStatement statement = EntityStatement.parse(token);
        String subject = statement.subject();
        if (subject == null || subject.isBlank()) {
            throw new MalformedTokenException("Entity configuration has no sub claim");
        }
        if (!subject.equals(statement.issuer())) {
            throw new MalformedTokenException("Entity configuration must be self-issued, but iss="
                    + statement.issuer() + " and sub=" + subject);
        }
        return new EntityConfiguration(statement, FederationKeySet.fromPayload(statement), verifier);
    }

    /**
     * Verifies the configuration with its own key set, selecting the key by the header {@code kid}.
     * Never returns false: a configuration that does not verify raises.
     *
     * @throws UnknownKeyIdException          if the kid is not in the configuration's own key set
     * @throws SignatureVerificationException if the signature does not verify
     */
    public boolean validateSelf() {
        try {
            JWK key = keySet.require(statement.kid());
            verifier.verify(statement.rawToken(), key);
        } catch (TrustChainException e) {
            state = ValidationState.INVALID;
            throw e;
        }
        state = ValidationState.VALID;
        return true;
    }

    /**
     * Verifies that {@code token}, a statement about a subordinate, was signed with one of this
     * entity's keys.
     */
    public boolean validateDescendantStatement(String token) {
        EntityStatement descendant = EntityStatement.parse(token);
        JWK key = keySet.require(descendant.kid());
        verifier.verify(descendant.rawToken(), key);
        return true;
    }

    /**
     * Cross-checks this entity against the statement {@code superior} issued about it: the superior
     * must verify itself and the statement, the statement must link the superior to this entity, and
     * the key set it vouches for must verify this entity's own configuration.
     * <p>
     * Never throws. A misbehaving superior only marks this one edge as failed.
     */
    public boolean validateBySuperiorStatement(String token, EntityConfiguration superior) {
        EntityStatement accepted = null;
        String failure = null;
        try {
            superior.validateSelf();
            superior.validateDescendantStatement(token);
            EntityStatement subordinate = EntityStatement.parse(token);
            if (!superior.subject().equals(subordinate.issuer())) {
                throw new TrustChainException("Statement issued by " + subordinate.issuer()
                        + " was served by " + superior.subject());
            }
            if (!subject().equals(subordinate.subject())) {
                throw new TrustChainException("Statement is about " + subordinate.subject()
                        + " instead of " + subject());
            }
            FederationKeySet vouchedKeys = FederationKeySet.fromPayload(subordinate);
            verifier.verify(statement.rawToken(), vouchedKeys.require(statement.kid()));
            accepted = subordinate;
        } catch (Exception e) {
            failure = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
        recordSuperiorStatement(superior.subject(), accepted, failure);
        return accepted != null;
    }

    private void recordSuperiorStatement(String superiorSubject, EntityStatement accepted, String failure) {
        unreachableSuperiors.remove(superiorSubject);
        verifiedBySuperiors.put(superiorSubject, accepted != null);
        if (accepted != null) {
            superiorStatements.put(superiorSubject, accepted);
            failedBySuperiors.remove(superiorSubject);
            LOG.debug("{} confirmed by superior {}", subject(), superiorSubject);
        } else {
            superiorStatements.remove(superiorSubject);
            failedBySuperiors.put(superiorSubject, failure);
            LOG.info("{} rejected by superior {}: {}", subject(), superiorSubject, failure);
        }
    }

    void addVerifiedSuperior(EntityConfiguration superior) {
        unreachableSuperiors.remove(superior.subject());
        failedSuperiors.remove(superior.subject());
        verifiedSuperiors.put(superior.subject(), superior);
    }

    void addFailedSuperior(String superiorSubject, EntityConfiguration superior) {
        unreachableSuperiors.remove(superiorSubject);
        verifiedSuperiors.remove(superiorSubject);
        failedSuperiors.put(superiorSubject, superior);
    }

    void addUnreachableSuperior(String superiorSubject, String reason) {
        verifiedBySuperiors.remove(superiorSubject);
        superiorStatements.remove(superiorSubject);
        failedBySuperiors.remove(superiorSubject);
        unreachableSuperiors.put(superiorSubject, reason);
    }

    public String subject() {
        return statement.subject();
    }

    public EntityStatement statement() {
        return statement;
    }

    public String rawToken() {
        return statement.rawToken();
    }

    public FederationKeySet keySet() {
        return keySet;
    }

    public List<String> authorityHints() {
        return statement.authorityHints();
    }

    public String federationApiEndpoint() {
        return statement.federationApiEndpoint();
    }

    public ValidationState state() {
        return state;
    }

    public boolean isValid() {
        return state == ValidationState.VALID;
    }

    public Map<String, EntityConfiguration> verifiedSuperiors() {
        return Collections.unmodifiableMap(verifiedSuperiors);
    }

    public Map<String, EntityConfiguration> failedSuperiors() {
        return Collections.unmodifiableMap(failedSuperiors);
    }

    /** Superior subject to the reason it could not be classified cryptographically. */
    public Map<String, String> unreachableSuperiors() {
        return Collections.unmodifiableMap(unreachableSuperiors);
    }

    /** Superior subject to the outcome of the cross-check, successful or not. */
    public Map<String, Boolean> verifiedBySuperiors() {
        return Collections.unmodifiableMap(verifiedBySuperiors);
    }

    /** Subordinate statements that passed the cross-check, by issuing superior. */
    public Map<String, EntityStatement> superiorStatements() {
        return Collections.unmodifiableMap(superiorStatements);
    }

    /** Superior subject to the reason its subordinate statement was rejected. */
    public Map<String, String> failedBySuperiors() {
        return Collections.unmodifiableMap(failedBySuperiors);
    }

    @Override
    public String toString() {
        return subject() + " valid " + state;
    }
}
