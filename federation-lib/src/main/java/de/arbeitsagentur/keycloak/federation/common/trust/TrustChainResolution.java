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

import java.util.List;

/**
 * Result of resolving a leaf: the leaf (whose superior maps reach every visited node) and every
 * complete chain that was found.
 */
public record TrustChainResolution(EntityConfiguration leaf, List<TrustChain> chains) {

    public TrustChainResolution {
        chains = List.copyOf(chains);
    }

    public boolean isTrusted() {
        return !chains.isEmpty();
    }

    public List<String> trustAnchors() {
        return chains.stream()
                .map(chain -> chain.trustAnchor().subject())
                .distinct()
                .toList();
    }
}
