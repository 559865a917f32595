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

import de.arbeitsagentur.keycloak.federation.common.crypto.NimbusSignatureVerifier;
import de.arbeitsagentur.keycloak.federation.common.crypto.SignatureVerifier;
import de.arbeitsagentur.keycloak.federation.common.error.FetchException;
import de.arbeitsagentur.keycloak.federation.common.error.MalformedTokenException;
import de.arbeitsagentur.keycloak.federation.common.error.SignatureVerificationException;
import de.arbeitsagentur.keycloak.federation.common.error.TrustChainCycleException;
import de.arbeitsagentur.keycloak.federation.common.error.TrustChainException;
import de.arbeitsagentur.keycloak.federation.common.error.UnknownKeyIdException;
import de.arbeitsagentur.keycloak.federation.common.error.UnsupportedFeatureException;
import de.arbeitsagentur.keycloak.federation.common.fetch.FederationUrls;
import de.arbeitsagentur.keycloak.federation.common.fetch.FetchParams;
import de.arbeitsagentur.keycloak.federation.common.fetch.FetchResult;
import de.arbeitsagentur.keycloak.federation.common.fetch.StatementFetcher;
import de.arbeitsagentur.keycloak.federation.common.statement.EntityStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Discovers and validates trust chains by walking authority hints upwards from a leaf entity.
 * <p>
 * Each level of authority hints is fetched as one concurrent batch; the walk itself is sequential.
 * Failures of single superiors are recorded on the entity that declared them and never abort the
 * walk. Cycles in the authority hints and unsupported features do abort it.
 */
public class TrustChainResolver {
    private static final Logger LOG = LoggerFactory.getLogger(TrustChainResolver.class);
    public static final int DEFAULT_MAX_PATH_LENGTH = 5;

    private final StatementFetcher fetcher;
    private final SignatureVerifier verifier;
    private final FetchParams fetchParams;
    private final int maxAuthorityHints;
    private final int maxPathLength;
    private final Map<String, TrustAnchor> trustAnchors;
    private final List<String> allowedTrustMarks;

    private TrustChainResolver(Builder builder) {
        this.fetcher = builder.fetcher;
        this.verifier = builder.verifier;
        this.fetchParams = builder.fetchParams;
        this.maxAuthorityHints = builder.maxAuthorityHints;
        this.maxPathLength = builder.maxPathLength;
        this.trustAnchors = Map.copyOf(builder.trustAnchors);
        this.allowedTrustMarks = List.copyOf(builder.allowedTrustMarks);
    }

    public static Builder builder(StatementFetcher fetcher) {
        return new Builder(fetcher);
    }

    public EntityConfiguration parse(String token) {
        return EntityConfiguration.parse(token, verifier);
    }

    /**
     * Fetches and decodes the entity configuration published at the subject's well-known location.
     *
     * @throws FetchException          if the document cannot be retrieved
     * @throws MalformedTokenException if it is not a well-formed entity configuration
     */
    public EntityConfiguration fetchEntityConfiguration(String subject) {
        String url = FederationUrls.wellKnownUrl(subject);
        LOG.info("Starting Entity Configuration Request for {}", url);
        FetchResult result = fetcher.fetch(url, fetchParams);
        return parse(result.bodyOrThrow());
    }

    public Map<String, EntityConfiguration> getSuperiors(EntityConfiguration entity) {
        return getSuperiors(entity, List.of(), maxAuthorityHints);
    }

    /**
     * Fetches the entity configurations of the entity's superiors and classifies each of them as
     * verified, failed or unreachable on {@code entity}.
     *
     * @param authorityHints    superiors to fetch; empty means the entity's declared hints
     * @param maxAuthorityHints if positive, only the first {@code maxAuthorityHints} hints are used
     * @return the entity's verified superiors
     */
    public Map<String, EntityConfiguration> getSuperiors(EntityConfiguration entity,
                                                         List<String> authorityHints,
                                                         int maxAuthorityHints) {
        List<String> hints = limitHints(entity,
                authorityHints == null || authorityHints.isEmpty() ? entity.authorityHints() : authorityHints,
                maxAuthorityHints);
        if (hints.isEmpty()) {
            return entity.verifiedSuperiors();
        }
        List<String> urls = new ArrayList<>(hints.size());
        for (String hint : hints) {
            String url = FederationUrls.wellKnownUrl(hint);
            LOG.info("Starting Entity Configuration Request for {}", url);
            urls.add(url);
        }
        List<FetchResult> results = fetchBatch(urls);
        for (int i = 0; i < hints.size(); i++) {
            classifySuperior(entity, hints.get(i), results.get(i));
        }
        return entity.verifiedSuperiors();
    }

    private List<String> limitHints(EntityConfiguration entity, List<String> hints, int max) {
        if (max <= 0 || hints.size() <= max) {
            return hints;
        }
        LOG.warn("Found {} authority hints for {} but the maximum is set to {}. "
                        + "The following authorities will be ignored: {}",
                hints.size(), entity.subject(), max, String.join(", ", hints.subList(max, hints.size())));
        return List.copyOf(hints.subList(0, max));
    }

    private void classifySuperior(EntityConfiguration entity, String hint, FetchResult result) {
        if (!result.isSuccess()) {
            entity.addUnreachableSuperior(hint, result.error().getMessage());
            return;
        }
        EntityConfiguration superior;
        try {
            superior = parse(result.body());
        } catch (MalformedTokenException e) {
            LOG.warn("Malformed entity configuration for superior {} of {}: {}",
                    hint, entity.subject(), e.getMessage());
            entity.addUnreachableSuperior(hint, "Malformed entity configuration: " + e.getMessage());
            return;
        } catch (UnsupportedFeatureException e) {
            LOG.warn("Entity configuration of superior {} of {} cannot be processed: {}",
                    hint, entity.subject(), e.getMessage());
            entity.addUnreachableSuperior(hint, "Unsupported entity configuration: " + e.getMessage());
            return;
        }
        if (!FederationUrls.sameEntity(hint, superior.subject())) {
            LOG.warn("Entity configuration fetched for {} declares subject {}", hint, superior.subject());
            entity.addFailedSuperior(hint, superior);
            return;
        }
        try {
            superior.validateSelf();
            entity.addVerifiedSuperior(superior);
            LOG.debug("Superior {} of {} verified", superior.subject(), entity.subject());
        } catch (UnknownKeyIdException | SignatureVerificationException e) {
            LOG.warn("Entity configuration of superior {} does not verify: {}", superior.subject(), e.getMessage());
            entity.addFailedSuperior(superior.subject(), superior);
        }
    }

    /**
     * Fetches the subordinate statement each superior issues about {@code entity} from the
     * superior's {@code federation_api_endpoint} and cross-checks it. Superiors without that
     * endpoint, or whose endpoint cannot be reached, are recorded as unreachable.
     *
     * @return the entity's cross-check outcomes by superior subject
     */
    public Map<String, Boolean> validateBySuperiors(EntityConfiguration entity,
                                                    Collection<EntityConfiguration> superiors) {
        List<EntityConfiguration> reachable = new ArrayList<>();
        List<String> urls = new ArrayList<>();
        for (EntityConfiguration superior : superiors) {
            String endpoint = superior.federationApiEndpoint();
            if (endpoint == null) {
                LOG.warn("Missing federation_api_endpoint in federation_entity metadata for {} by {}.",
                        entity.subject(), superior.subject());
                entity.addUnreachableSuperior(superior.subject(),
                        "Missing federation_api_endpoint in federation_entity metadata");
                continue;
            }
            String url = FederationUrls.fetchUrl(endpoint, entity.subject());
            LOG.info("Starting Entity Statement Request for {}", url);
            reachable.add(superior);
            urls.add(url);
        }
        if (urls.isEmpty()) {
            return entity.verifiedBySuperiors();
        }
        List<FetchResult> results = fetchBatch(urls);
        for (int i = 0; i < reachable.size(); i++) {
            EntityConfiguration superior = reachable.get(i);
            FetchResult result = results.get(i);
            if (result.isSuccess()) {
                entity.validateBySuperiorStatement(result.body(), superior);
            } else {
                entity.addUnreachableSuperior(superior.subject(), result.error().getMessage());
            }
        }
        return entity.verifiedBySuperiors();
    }

    private List<FetchResult> fetchBatch(List<String> urls) {
        List<FetchResult> results = fetcher.fetch(urls, fetchParams);
        if (results == null || results.size() != urls.size()) {
            throw new IllegalStateException("Fetcher returned " + (results == null ? 0 : results.size())
                    + " results for " + urls.size() + " urls");
        }
        return results;
    }

    public TrustChainResolution resolveSubject(String subject) {
        return resolve(fetchEntityConfiguration(subject));
    }

    public TrustChainResolution resolve(String entityConfigurationToken) {
        return resolve(parse(entityConfigurationToken));
    }

    /**
     * Builds every trust chain from {@code leaf} to a trust anchor.
     * <p>
     * A node ends a chain if it is a configured trust anchor or, when no anchor is configured, if
     * it declares no authority hints. Every verified superior is descended into, so the superior
     * maps of all visited nodes are populated; only paths whose every edge passed the cross-check
     * become chains.
     *
     * @throws UnsupportedFeatureException if trust mark filtering was requested
     * @throws TrustChainCycleException    if a subject is met again on the path that led to it
     */
    public TrustChainResolution resolve(EntityConfiguration leaf) {
        if (!allowedTrustMarks.isEmpty()) {
            throw new UnsupportedFeatureException(
                    "Filtering by allowed trust marks is not supported: " + allowedTrustMarks);
        }
        leaf.validateSelf();
        List<TrustChain> chains = new ArrayList<>();
        walk(leaf, List.of(leaf), List.of(), true, chains);
        LOG.info("Found {} trust chain(s) for {}", chains.size(), leaf.subject());
        return new TrustChainResolution(leaf, chains);
    }

    private void walk(EntityConfiguration node,
                      List<EntityConfiguration> path,
                      List<EntityStatement> statements,
                      boolean edgesVerified,
                      List<TrustChain> chains) {
        TrustAnchor anchor = configuredAnchor(node.subject());
        if (anchor != null || (trustAnchors.isEmpty() && node.authorityHints().isEmpty())) {
            if (edgesVerified && acceptsAnchor(node, anchor)) {
                chains.add(new TrustChain(path, statements));
            }
            return;
        }
        if (node.authorityHints().isEmpty()) {
            LOG.debug("{} declares no authority hints and is not a configured trust anchor", node.subject());
            return;
        }
        if (path.size() - 1 >= maxPathLength) {
            LOG.warn("Maximum path length {} reached at {}, not resolving its superiors", maxPathLength, node.subject());
            return;
        }
        List<String> pathSubjects = path.stream().map(EntityConfiguration::subject).toList();
        List<String> hints = limitHints(node, node.authorityHints(), maxAuthorityHints);
        for (String hint : hints) {
            requireNotOnPath(pathSubjects, hint);
        }

        List<EntityConfiguration> superiors = List.copyOf(getSuperiors(node, hints, 0).values());
        validateBySuperiors(node, superiors);

        for (EntityConfiguration superior : superiors) {
            requireNotOnPath(pathSubjects, superior.subject());
            boolean edgeVerified = Boolean.TRUE.equals(node.verifiedBySuperiors().get(superior.subject()));
            List<EntityStatement> nextStatements = statements;
            if (edgeVerified) {
                nextStatements = append(statements, node.superiorStatements().get(superior.subject()));
            }
            walk(superior, append(path, superior), nextStatements, edgesVerified && edgeVerified, chains);
        }
    }

    private static void requireNotOnPath(List<String> pathSubjects, String subject) {
        for (String visited : pathSubjects) {
            if (FederationUrls.sameEntity(visited, subject)) {
                throw new TrustChainCycleException(pathSubjects, subject);
            }
        }
    }

    private TrustAnchor configuredAnchor(String subject) {
        for (TrustAnchor anchor : trustAnchors.values()) {
            if (FederationUrls.sameEntity(anchor.subject(), subject)) {
                return anchor;
            }
        }
        return null;
    }

    private boolean acceptsAnchor(EntityConfiguration node, TrustAnchor anchor) {
        if (anchor == null || !anchor.hasPinnedKeys()) {
            return true;
        }
        try {
            verifier.verify(node.rawToken(), anchor.pinnedKeys());
            return true;
        } catch (TrustChainException e) {
            LOG.warn("Entity configuration of trust anchor {} does not match the pinned keys: {}",
                    node.subject(), e.getMessage());
            return false;
        }
    }

    private static <T> List<T> append(List<T> list, T element) {
        List<T> copy = new ArrayList<>(list.size() + 1);
        copy.addAll(list);
        copy.add(element);
        return copy;
    }

    public static final class Builder {
        private final StatementFetcher fetcher;
        private SignatureVerifier verifier = new NimbusSignatureVerifier();
        private FetchParams fetchParams = FetchParams.defaults();
        private int maxAuthorityHints;
        private int maxPathLength = DEFAULT_MAX_PATH_LENGTH;
        private final Map<String, TrustAnchor> trustAnchors = new LinkedHashMap<>();
        private final List<String> allowedTrustMarks = new ArrayList<>();

        private Builder(StatementFetcher fetcher) {
            this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        }

        public Builder verifier(SignatureVerifier verifier) {
            this.verifier = Objects.requireNonNull(verifier, "verifier");
            return this;
        }

        public Builder fetchParams(FetchParams fetchParams) {
            this.fetchParams = fetchParams != null ? fetchParams : FetchParams.defaults();
            return this;
        }

        /** Upper bound of authority hints followed per entity; zero or negative means unlimited. */
        public Builder maxAuthorityHints(int maxAuthorityHints) {
            this.maxAuthorityHints = Math.max(0, maxAuthorityHints);
            return this;
        }

        /** Maximum number of superior hops between the leaf and a trust anchor. */
        public Builder maxPathLength(int maxPathLength) {
            if (maxPathLength < 1) {
                throw new IllegalArgumentException("maxPathLength must be at least 1, got " + maxPathLength);
            }
            this.maxPathLength = maxPathLength;
            return this;
        }

        public Builder trustAnchor(String subject) {
            return trustAnchor(TrustAnchor.of(subject));
        }

        public Builder trustAnchor(TrustAnchor anchor) {
            trustAnchors.put(anchor.subject(), anchor);
            return this;
        }

        public Builder allowedTrustMarks(Collection<String> trustMarkIds) {
            allowedTrustMarks.clear();
            if (trustMarkIds != null) {
                allowedTrustMarks.addAll(trustMarkIds);
            }
            return this;
        }

        public TrustChainResolver build() {
            return new TrustChainResolver(this);
        }
    }
}
