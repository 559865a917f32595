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

import de.arbeitsagentur.keycloak.federation.common.statement.EntityStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * A verified path from a leaf entity to a trust anchor.
 *
 * @param entities   entity configurations, leaf first and trust anchor last
 * @param statements {@code statements[i]} is the subordinate statement {@code entities[i + 1]}
 *                   issued about {@code entities[i]}
 */
public record TrustChain(List<EntityConfiguration> entities, List<EntityStatement> statements) {

    public TrustChain {
        entities = List.copyOf(entities);
        statements = List.copyOf(statements);
        if (entities.isEmpty()) {
            throw new IllegalArgumentException("A trust chain needs at least one entity");
        }
        if (statements.size() != entities.size() - 1) {
            throw new IllegalArgumentException("Expected " + (entities.size() - 1)
                    + " subordinate statements but got " + statements.size());
        }
    }

    public EntityConfiguration leaf() {
        return entities.get(0);
    }

    public EntityConfiguration trustAnchor() {
        return entities.get(entities.size() - 1);
    }

    public List<String> subjects() {
        return entities.stream().map(EntityConfiguration::subject).toList();
    }

    /**
     * The chain as compact JWS strings in {@code trust_chain} order: the leaf's entity
     * configuration, every subordinate statement upwards, then the anchor's entity configuration.
     */
    public List<String> toTokens() {
        List<String> tokens = new ArrayList<>(statements.size() + 2);
        tokens.add(leaf().rawToken());
        for (EntityStatement statement : statements) {
            tokens.add(statement.rawToken());
        }
        if (entities.size() > 1) {
            tokens.add(trustAnchor().rawToken());
        }
        return List.copyOf(tokens);
    }
}
