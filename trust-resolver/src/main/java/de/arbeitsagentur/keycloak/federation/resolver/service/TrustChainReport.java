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
package de.arbeitsagentur.keycloak.federation.resolver.service;

import de.arbeitsagentur.keycloak.federation.common.trust.ValidationState;

import java.util.List;
import java.util.Map;

/**
 * JSON view of a trust chain resolution.
 *
 * @param subject the leaf the chains start from
 * @param trusted whether at least one chain reached a trust anchor
 * @param chains  the complete chains, leaf first
 * @param nodes   every entity visited while resolving, leaf first
 */
public record TrustChainReport(
        String subject,
        boolean trusted,
        List<Chain> chains,
        List<Node> nodes
) {

    /**
     * @param tokens the chain in trust_chain order: leaf configuration, subordinate statements upwards,
     *               anchor configuration
     */
    public record Chain(String trustAnchor, List<String> subjects, List<String> tokens) {
    }

    public record Node(
            String subject,
            ValidationState state,
            List<String> verifiedSuperiors,
            List<String> failedSuperiors,
            Map<String, String> unreachableSuperiors,
            Map<String, Boolean> verifiedBySuperiors,
            Map<String, String> failedBySuperiors
    ) {
    }
}
