// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Set;

/**
 * Provides access to the key value and singleton states of a single service, by state ID.
 */
public interface ReadableStates {

    /**
     * Gets the {@link ReadableKVState} with the given state ID.
     *
     * @param stateId The state ID
     * @return The state
     * @throws IllegalArgumentException if the state ID is unknown or not a key value state
     * @param <K> The key type
     * @param <V> The value type
     */
    @NonNull
    <K, V> ReadableKVState<K, V> get(int stateId);

    /**
     * Gets the {@link ReadableSingletonState} with the given state ID.
     *
     * @param stateId The state ID
     * @return The state
     * @throws IllegalArgumentException if the state ID is unknown or not a singleton state
     * @param <T> The value type
     */
    @NonNull
    <T> ReadableSingletonState<T> getSingleton(int stateId);

    /**
     * Gets whether the given state ID is known.
     *
     * @param stateId The state ID
     * @return true if a state is registered under the ID
     */
    boolean contains(int stateId);

    /**
     * Gets all known state IDs.
     *
     * @return the state IDs
     */
    @NonNull
    Set<Integer> stateIds();
}
