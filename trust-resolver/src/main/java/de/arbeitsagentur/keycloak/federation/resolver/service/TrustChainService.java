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

import de.arbeitsagentur.keycloak.federation.common.trust.EntityConfiguration;
import de.arbeitsagentur.keycloak.federation.common.trust.TrustChain;
import de.arbeitsagentur.keycloak.federation.common.trust.TrustChainResolution;
import de.arbeitsagentur.keycloak.federation.common.trust.TrustChainResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class TrustChainService {
    private static final Logger LOG = LoggerFactory.getLogger(TrustChainService.class);

    private final TrustChainResolver resolver;

    public TrustChainService(TrustChainResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Fetches the subject's entity configuration and resolves its trust chains.
     */
    public TrustChainReport resolveSubject(String subject) {
        LOG.info("Resolving trust chains for {}", subject);
        return report(resolver.resolveSubject(subject));
    }

    /**
     * Resolves the trust chains of a leaf whose entity configuration the caller already holds.
     */
    public TrustChainReport resolveEntityConfiguration(String entityConfiguration) {
        EntityConfiguration leaf = resolver.parse(entityConfiguration);
        LOG.info("Resolving trust chains for supplied entity configuration of {}", leaf.subject());
        return report(resolver.resolve(leaf));
    }

    private TrustChainReport report(TrustChainResolution resolution) {
        List<TrustChainReport.Chain> chains = resolution.chains().stream()
                .map(TrustChainService::chain)
                .toList();
        LOG.info("{} trust chain(s) found for {}", chains.size(), resolution.leaf().subject());
        return new TrustChainReport(resolution.leaf().subject(), resolution.isTrusted(), chains,
                nodes(resolution.leaf()));
    }

    private static TrustChainReport.Chain chain(TrustChain chain) {
        return new TrustChainReport.Chain(chain.trustAnchor().subject(), chain.subjects(), chain.toTokens());
    }

    private static List<TrustChainReport.Node> nodes(EntityConfiguration leaf) {
        Map<String, TrustChainReport.Node> nodes = new LinkedHashMap<>();
        Deque<EntityConfiguration> queue = new ArrayDeque<>();
        queue.add(leaf);
        while (!queue.isEmpty()) {
            EntityConfiguration entity = queue.poll();
            if (nodes.containsKey(entity.subject())) {
                continue;
            }
            nodes.put(entity.subject(), node(entity));
            queue.addAll(entity.verifiedSuperiors().values());
            queue.addAll(entity.failedSuperiors().values());
        }
        return List.copyOf(nodes.values());
    }

    private static TrustChainReport.Node node(EntityConfiguration entity) {
        return new TrustChainReport.Node(
                entity.subject(),
                entity.state(),
                List.copyOf(entity.verifiedSuperiors().keySet()),
                List.copyOf(entity.failedSuperiors().keySet()),
                entity.unreachableSuperiors(),
                entity.verifiedBySuperiors(),
                entity.failedBySuperiors());
    }
}
