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
package de.arbeitsagentur.keycloak.federation.resolver.web;

import de.arbeitsagentur.keycloak.federation.common.error.FetchException;
import de.arbeitsagentur.keycloak.federation.common.error.MalformedTokenException;
import de.arbeitsagentur.keycloak.federation.common.error.SignatureVerificationException;
import de.arbeitsagentur.keycloak.federation.common.error.TrustChainCycleException;
import de.arbeitsagentur.keycloak.federation.common.error.UnknownKeyIdException;
import de.arbeitsagentur.keycloak.federation.common.error.UnsupportedFeatureException;
import de.arbeitsagentur.keycloak.federation.common.fetch.HttpStatementFetcher;
import de.arbeitsagentur.keycloak.federation.resolver.service.TrustChainReport;
import de.arbeitsagentur.keycloak.federation.resolver.service.TrustChainService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/federation/trust-chain")
public class TrustChainController {
    private static final Logger LOG = LoggerFactory.getLogger(TrustChainController.class);

    private final TrustChainService trustChainService;

    public TrustChainController(TrustChainService trustChainService) {
        this.trustChainService = trustChainService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public TrustChainReport resolve(@RequestParam("subject") String subject) {
        return trustChainService.resolveSubject(subject);
    }

    @PostMapping(consumes = {HttpStatementFetcher.ENTITY_STATEMENT_MEDIA_TYPE, MediaType.TEXT_PLAIN_VALUE},
            produces = MediaType.APPLICATION_JSON_VALUE)
    public TrustChainReport resolveEntityConfiguration(@RequestBody String entityConfiguration) {
        return trustChainService.resolveEntityConfiguration(entityConfiguration);
    }

    @ExceptionHandler({MalformedTokenException.class, UnknownKeyIdException.class,
            SignatureVerificationException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleInvalidInput(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, errorCode(e), e);
    }

    @ExceptionHandler(FetchException.class)
    public ResponseEntity<Map<String, String>> handleFetchFailure(FetchException e) {
        return error(HttpStatus.BAD_GATEWAY, "fetch_failed", e);
    }

    @ExceptionHandler({TrustChainCycleException.class, UnsupportedFeatureException.class})
    public ResponseEntity<Map<String, String>> handleUnresolvable(RuntimeException e) {
        return error(HttpStatus.UNPROCESSABLE_CONTENT, errorCode(e), e);
    }

    private static String errorCode(RuntimeException e) {
        if (e instanceof MalformedTokenException) {
            return "malformed_token";
        }
        if (e instanceof UnknownKeyIdException) {
            return "unknown_kid";
        }
        if (e instanceof SignatureVerificationException) {
            return "invalid_signature";
        }
        if (e instanceof TrustChainCycleException) {
            return "trust_chain_cycle";
        }
        if (e instanceof UnsupportedFeatureException) {
            return "unsupported_feature";
        }
        return "invalid_request";
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, RuntimeException e) {
        LOG.warn("Trust chain request failed with {}: {}", status.value(), e.getMessage());
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
