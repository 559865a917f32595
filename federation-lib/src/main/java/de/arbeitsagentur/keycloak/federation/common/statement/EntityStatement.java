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

import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSObject;
import de.arbeitsagentur.keycloak.federation.common.error.MalformedTokenException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A decoded federation JWS: entity configuration or subordinate statement.
 * <p>
 * Parsing only decodes the header and payload. The signature is <b>not</b> verified here;
 * use {@link de.arbeitsagentur.keycloak.federation.common.crypto.SignatureVerifier} against the
 * key set the statement claims to be signed with.
 */
public final class EntityStatement {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final String rawToken;
    private final JWSHeader header;
    private final JsonNode payload;

    private EntityStatement(String rawToken, JWSHeader header, JsonNode payload) {
        this.rawToken = rawToken;
        this.header = header;
        this.payload = payload;
    }

    /**
     * Decodes a compact JWS.
     *
     * @throws MalformedTokenException if the token is not a three-part JWS or a segment is not JSON
     */
    public static EntityStatement parse(String token) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Token must not be null or blank");
        }
        String compact = token.trim();
        JWSObject jws;
        try {
            jws = JWSObject.parse(compact);
        } catch (ParseException e) {
            throw new MalformedTokenException("Invalid JWS: " + e.getMessage(), e);
        }
        JsonNode payload;
        try {
            payload = OBJECT_MAPPER.readTree(jws.getPayload().toBytes());
        } catch (JacksonException e) {
            throw new MalformedTokenException("JWS payload is not valid JSON", e);
        }
        if (payload == null || !payload.isObject()) {
            throw new MalformedTokenException("JWS payload is not a JSON object");
        }
        return new EntityStatement(compact, jws.getHeader(), payload);
    }

    public String rawToken() {
        return rawToken;
    }

    public JWSHeader header() {
        return header;
    }

    public Map<String, Object> headerClaims() {
        return header.toJSONObject();
    }

    public JsonNode payload() {
        return payload;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> payloadClaims() {
        return OBJECT_MAPPER.convertValue(payload, Map.class);
    }

    public String kid() {
        return header.getKeyID();
    }

    public String algorithm() {
        return header.getAlgorithm() != null ? header.getAlgorithm().getName() : null;
    }

    public String type() {
        return header.getType() != null ? header.getType().toString() : null;
    }

    public String issuer() {
        return text(payload.path("iss"));
    }

    public String subject() {
        return text(payload.path("sub"));
    }

    /**
     * Declared superiors, in document order. Non-string entries are skipped.
     */
    public List<String> authorityHints() {
        JsonNode hints = payload.path("authority_hints");
        if (!hints.isArray()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (JsonNode hint : hints) {
            String value = text(hint);
            if (value != null && !value.isBlank()) {
                result.add(value);
            }
        }
        return List.copyOf(result);
    }

    /**
     * The {@code federation_api_endpoint} of the {@code federation_entity} metadata, or null.
     */
    public String federationApiEndpoint() {
        String endpoint = text(payload.path("metadata")
                .path("federation_entity")
                .path("federation_api_endpoint"));
        return endpoint == null || endpoint.isBlank() ? null : endpoint;
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    @Override
    public String toString() {
        return "EntityStatement[iss=" + issuer() + ", sub=" + subject() + ", kid=" + kid() + "]";
    }
}
