/*
 * Copyright 2026 The Chain of Product Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.chainofproduct;

import static java.util.Objects.requireNonNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link KeyRegistry} backed by a map. Safe for concurrent use.
 */
public final class InMemoryKeyRegistry implements KeyRegistry {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryKeyRegistry.class);

    private final Map<String, PartyKeys> keys = new ConcurrentHashMap<>();

    public InMemoryKeyRegistry register(PartyKeys partyKeys) {
        requireNonNull(partyKeys, "partyKeys");
        var previous = keys.put(partyKeys.id(), partyKeys);
        if (previous != null) {
            logger.info("Replaced registered keys for party {}", partyKeys.id());
        }
        return this;
    }

    public InMemoryKeyRegistry register(LocalParty party) {
        return register(party.publicKeys());
    }

    @Override
    public PartyKeys getPublicKeys(String partyId) throws NotFoundException {
        var result = keys.get(requireNonNull(partyId, "partyId"));
        if (result == null) {
            throw new NotFoundException("No keys registered for party '" + partyId + "'");
        }
        return result;
    }
}
