// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.memory;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.ledgerflow.state.spi.ReadableKVState;
import org.ledgerflow.state.spi.ReadableSingletonState;
import org.ledgerflow.state.spi.ReadableStates;

/**
 * An implementation of {@link ReadableStates} that looks up states in a map keyed by state ID.
 */
public class MapReadableStates implements ReadableStates {

    private final Map<Integer, ?> states;

    /**
     * Create a new instance.
     *
     * @param states the states, keyed by state ID
     */
    public MapReadableStates(@NonNull final Map<Integer, ?> states) {
        this.states = requireNonNull(states);
    }

    @NonNull
    @Override
    @SuppressWarnings("unchecked")
    public <K, V> ReadableKVState<K, V> get(final int stateId) {
        final var state = states.get(stateId);
        if (!(state instanceof ReadableKVState)) {
            throw new IllegalArgumentException("Unknown key value state " + stateId);
        }
        return (ReadableKVState<K, V>) state;
    }

    @NonNull
    @Override
    @SuppressWarnings("unchecked")
    public <T> ReadableSingletonState<T> getSingleton(final int stateId) {
        final var state = states.get(stateId);
        if (!(state instanceof ReadableSingletonState)) {
            throw new IllegalArgumentException("Unknown singleton state " + stateId);
        }
        return (ReadableSingletonState<T>) state;
    }

    @Override
    public boolean contains(final int stateId) {
        return states.containsKey(stateId);
    }

    @NonNull
    @Override
    public Set<Integer> stateIds() {
        return Collections.unmodifiableSet(states.keySet());
    }

    /**
     * Creates a new {@link Builder}.
     *
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A convenience builder.
     */
    public static final class Builder {
        private final Map<Integer, Object> states = new HashMap<>();

        Builder() {}

        /**
         * Adds a key value state.
         *
         * @param state the state
         * @return this builder
         */
        @NonNull
        public Builder state(@NonNull final ReadableKVState<?, ?> state) {
            states.put(state.getStateId(), state);
            return this;
        }

        /**
         * Adds a singleton state.
         *
         * @param state the state
         * @return this builder
         */
        @NonNull
        public Builder state(@NonNull final ReadableSingletonState<?> state) {
            states.put(state.getStateId(), state);
            return this;
        }

        /**
         * Builds the states.
         *
         * @return the states
         */
        @NonNull
        public MapReadableStates build() {
            return new MapReadableStates(new HashMap<>(states));
        }
    }
}
