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

import de.arbeitsagentur.keycloak.federation.common.statement.FederationKeySet;

/**
 * A trust anchor accepted as the end of a chain.
 *
 * @param subject    entity identifier of the anchor
 * @param pinnedKeys keys the anchor's entity configuration must verify with, or null to accept the
 *                   keys the anchor publishes itself
 */
public record TrustAnchor(String subject, FederationKeySet pinnedKeys) {

    public TrustAnchor {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Trust anchor subject must not be blank");
        }
    }

    public static TrustAnchor of(String subject) {
        return new TrustAnchor(subject, null);
    }

    public boolean hasPinnedKeys() {
        return pinnedKeys != null && !pinnedKeys.isEmpty();
    }
}
