// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.memory;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.ledgerflow.state.spi.CommittableWritableStates;
import org.ledgerflow.state.spi.WritableKVState;
import org.ledgerflow.state.spi.WritableKVStateBase;
import org.ledgerflow.state.spi.WritableSingletonState;
import org.ledgerflow.state.spi.WritableSingletonStateBase;
import org.ledgerflow.state.spi.WritableStates;

/**
 * An implementation of {@link WritableStates} that looks up states in a map keyed by state ID, and
 * commits or resets all of them together.
 */
public class MapWritableStates implements CommittableWritableStates {

    private final Map<Integer, ?> states;

    /**
     * Create a new instance.
     *
     * @param states the states, keyed by state ID
     */
    public MapWritableStates(@NonNull final Map<Integer, ?> states) {
        this.states = requireNonNull(states);
    }

    @NonNull
    @Override
    @SuppressWarnings("unchecked")
    public <K, V> WritableKVState<K, V> get(final int stateId) {
        final var state = states.get(stateId);
        if (!(state instanceof WritableKVState)) {
            throw new IllegalArgumentException("Unknown key value state " + stateId);
        }
        return (WritableKVState<K, V>) state;
    }

    @NonNull
    @Override
    @SuppressWarnings("unchecked")
    public <T> WritableSingletonState<T> getSingleton(final int stateId) {
        final var state = states.get(stateId);
        if (!(state instanceof WritableSingletonState)) {
            throw new IllegalArgumentException("Unknown singleton state " + stateId);
        }
        return (WritableSingletonState<T>) state;
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

    @Override
    public void commit() {
        for (final var state : states.values()) {
            if (state instanceof WritableKVStateBase<?, ?> kvState) {
                kvState.commit();
            } else if (state instanceof WritableSingletonStateBase<?> singletonState) {
                singletonState.commit();
            }
        }
    }

    @Override
    public void reset() {
        for (final var state : states.values()) {
            if (state instanceof WritableKVStateBase<?, ?> kvState) {
                kvState.reset();
            } else if (state instanceof WritableSingletonStateBase<?> singletonState) {
                singletonState.reset();
            }
        }
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
        public Builder state(@NonNull final WritableKVState<?, ?> state) {
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
        public Builder state(@NonNull final WritableSingletonState<?> state) {
            states.put(state.getStateId(), state);
            return this;
        }

        /**
         * Builds the states.
         *
         * @return the states
         */
        @NonNull
        public MapWritableStates build() {
            return new MapWritableStates(new HashMap<>(states));
        }
    }
}
