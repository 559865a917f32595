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
package de.arbeitsagentur.keycloak.federation.common.error;

import java.util.List;

public class TrustChainCycleException extends TrustChainException {
    private final List<String> path;
    private final String subject;

    public TrustChainCycleException(List<String> path, String subject) {
        super("Authority hints form a cycle: " + String.join(" -> ", path) + " -> " + subject);
        this.path = List.copyOf(path);
        this.subject = subject;
    }

    /** Subjects of the active resolution path, leaf first. */
    public List<String> path() {
        return path;
    }

    public String subject() {
        return subject;
    }
}
