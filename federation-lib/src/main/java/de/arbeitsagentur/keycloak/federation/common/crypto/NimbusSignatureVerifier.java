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

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.AsymmetricJWK;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.proc.JWSVerifierFactory;
import de.arbeitsagentur.keycloak.federation.common.error.MalformedTokenException;
import de.arbeitsagentur.keycloak.federation.common.error.SignatureVerificationException;

import java.security.Key;
import java.text.ParseException;

/**
 * {@link SignatureVerifier} backed by Nimbus JOSE. Supports RSA and EC keys. Symmetric keys
 * are rejected: federation key sets are public.
 */
public class NimbusSignatureVerifier implements SignatureVerifier {
    private final JWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

    @Override
    public void verify(String token, JWK key) {
        if (key == null) {
            throw new SignatureVerificationException("No verification key supplied");
        }
        JWSObject jws;
        try {
            jws = JWSObject.parse(token);
        } catch (ParseException e) {
            throw new MalformedTokenException("Invalid JWS: " + e.getMessage(), e);
        }
        if (key.getAlgorithm() != null
                && !key.getAlgorithm().getName().equals(jws.getHeader().getAlgorithm().getName())) {
            throw new SignatureVerificationException("Key " + key.getKeyID() + " is restricted to "
                    + key.getAlgorithm() + " but the token is signed with " + jws.getHeader().getAlgorithm());
        }
        boolean verified;
        try {
            JWSVerifier verifier = verifierFactory.createJWSVerifier(jws.getHeader(), toVerificationKey(key));
            verified = jws.verify(verifier);
        } catch (JOSEException e) {
            throw new SignatureVerificationException(
                    "Unable to verify signature with key " + key.getKeyID() + ": " + e.getMessage(), e);
        }
        if (!verified) {
            throw new SignatureVerificationException("Signature does not verify with key " + key.getKeyID());
        }
    }

    private static Key toVerificationKey(JWK key) throws JOSEException {
        if (key instanceof OctetSequenceKey) {
            throw new SignatureVerificationException("Symmetric key " + key.getKeyID()
                    + " cannot verify federation statements");
        }
        if (key instanceof AsymmetricJWK asymmetric) {
            return asymmetric.toPublicKey();
        }
        throw new SignatureVerificationException("Unsupported key type " + key.getKeyType());
    }
}
