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

/**
 * Looks up the published public keys of a party. Implementations typically call out to an identity service. The
 * protocols only ever call {@link #getPublicKeys(String)} and never cache the result.
 */
public interface KeyRegistry {

    /**
     * Returns the public keys registered for the given party.
     *
     * @throws NotFoundException if no keys are registered for the party.
     */
    PartyKeys getPublicKeys(String partyId) throws NotFoundException;
}
