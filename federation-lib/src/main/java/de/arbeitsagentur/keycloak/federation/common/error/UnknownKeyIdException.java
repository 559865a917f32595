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

import java.util.Set;

public class UnknownKeyIdException extends TrustChainException {
    private final String kid;
    private final Set<String> availableKids;

    public UnknownKeyIdException(String kid, Set<String> availableKids) {
        super("Key id '" + kid + "' not found in " + availableKids);
        this.kid = kid;
        this.availableKids = Set.copyOf(availableKids);
    }

    public String kid() {
        return kid;
    }

    public Set<String> availableKids() {
        return availableKids;
    }
}
