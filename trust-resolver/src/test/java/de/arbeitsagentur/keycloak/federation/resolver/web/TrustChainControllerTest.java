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
import de.arbeitsagentur.keycloak.federation.common.error.TrustChainCycleException;
import de.arbeitsagentur.keycloak.federation.common.error.UnknownKeyIdException;
import de.arbeitsagentur.keycloak.federation.common.error.UnsupportedFeatureException;
import de.arbeitsagentur.keycloak.federation.resolver.service.TrustChainReport;
import de.arbeitsagentur.keycloak.federation.resolver.service.TrustChainService;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TrustChainControllerTest {
    private final TrustChainService service = mock(TrustChainService.class);
    private final TrustChainController controller = new TrustChainController(service);

    @Test
    void delegatesSubjectResolution() {
        TrustChainReport report = new TrustChainReport("https://rp.example/", false, List.of(), List.of());
        when(service.resolveSubject("https://rp.example/")).thenReturn(report);

        assertThat(controller.resolve("https://rp.example/")).isSameAs(report);
    }

    @Test
    void delegatesSuppliedEntityConfiguration() {
        TrustChainReport report = new TrustChainReport("https://rp.example/", true, List.of(), List.of());
        when(service.resolveEntityConfiguration("a.b.c")).thenReturn(report);

        assertThat(controller.resolveEntityConfiguration("a.b.c")).isSameAs(report);
        verify(service).resolveEntityConfiguration("a.b.c");
    }

    @Test
    void invalidTokensMapToBadRequest() {
        ResponseEntity<Map<String, String>> malformed =
                controller.handleInvalidInput(new MalformedTokenException("Invalid JWS"));
        ResponseEntity<Map<String, String>> unknownKid =
                controller.handleInvalidInput(new UnknownKeyIdException("k9", Set.of("k1")));

        assertThat(malformed.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(malformed.getBody()).containsEntry("error", "malformed_token")
                .containsEntry("message", "Invalid JWS");
        assertThat(unknownKid.getBody()).containsEntry("error", "unknown_kid");
    }

    @Test
    void unreachableLeafMapsToBadGateway() {
        ResponseEntity<Map<String, String>> response = controller.handleFetchFailure(
                new FetchException("https://rp.example/.well-known/openid-federation", "HTTP 404"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody()).containsEntry("error", "fetch_failed");
    }

    @Test
    void unresolvableFederationMapsToUnprocessableContent() {
        ResponseEntity<Map<String, String>> cycle = controller.handleUnresolvable(
                new TrustChainCycleException(List.of("https://a.example/", "https://b.example/"), "https://a.example/"));
        ResponseEntity<Map<String, String>> unsupported = controller.handleUnresolvable(
                new UnsupportedFeatureException("jwks_uri is not supported"));

        assertThat(cycle.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_CONTENT);
        assertThat(cycle.getBody()).containsEntry("error", "trust_chain_cycle");
        assertThat(unsupported.getBody()).containsEntry("error", "unsupported_feature");
    }
}
