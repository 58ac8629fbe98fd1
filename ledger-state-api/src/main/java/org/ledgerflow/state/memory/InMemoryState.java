// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.memory;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.ledgerflow.state.spi.CommittableWritableStates;
import org.ledgerflow.state.spi.ReadableStates;

/**
 * Holds the committed data of one service in memory, and hands out fresh readable and writable
 * views over it. Every call to {@link #getWritableStates()} returns a new set of buffers; nothing
 * reaches the committed data until those buffers are committed.
 *
 * <p>Key value data is kept in insertion order so that iteration is deterministic.
 */
public class InMemoryState {

    private final Map<Integer, StateDefinition> definitions = new LinkedHashMap<>();
    private final Map<Integer, Map<Object, Object>> kvData = new HashMap<>();
    private final Map<Integer, AtomicReference<Object>> singletonData = new HashMap<>();

    /**
     * Registers a key value state.
     *
     * @param stateId the state ID
     * @param label the state label
     * @return this state
     * @throws IllegalArgumentException if the state ID is already registered
     */
    @NonNull
    public InMemoryState registerKeyValue(final int stateId, @NonNull final String label) {
        register(new StateDefinition(stateId, requireNonNull(label), false));
        kvData.put(stateId, new LinkedHashMap<>());
        return this;
    }

    /**
     * Registers a singleton state.
     *
     * @param stateId the state ID
     * @param label the state label
     * @return this state
     * @throws IllegalArgumentException if the state ID is already registered
     */
    @NonNull
    public InMemoryState registerSingleton(final int stateId, @NonNull final String label) {
        register(new StateDefinition(stateId, requireNonNull(label), true));
        singletonData.put(stateId, new AtomicReference<>());
        return this;
    }

    /**
     * Returns read-only views of the committed data.
     *
     * @return the readable states
     */
    @NonNull
    public ReadableStates getReadableStates() {
        final var builder = MapReadableStates.builder();
        for (final var definition : definitions.values()) {
            final int id = definition.stateId();
            if (definition.singleton()) {
                builder.state(new FunctionReadableSingletonState<>(id, singletonData.get(id)::get));
            } else {
                builder.state(new MapReadableKVState<>(id, definition.label(), kvData.get(id)));
            }
        }
        return builder.build();
    }

    /**
     * Returns new buffered writable views of the committed data.
     *
     * @return the writable states
     */
    @NonNull
    public CommittableWritableStates getWritableStates() {
        final var builder = MapWritableStates.builder();
        for (final var definition : definitions.values()) {
            final int id = definition.stateId();
            if (definition.singleton()) {
                final var ref = singletonData.get(id);
                builder.state(new FunctionWritableSingletonState<>(id, ref::get, ref::set));
            } else {
                builder.state(new MapWritableKVState<>(id, definition.label(), kvData.get(id)));
            }
        }
        return builder.build();
    }

    private void register(@NonNull final StateDefinition definition) {
        if (definitions.containsKey(definition.stateId())) {
            throw new IllegalArgumentException("State " + definition.stateId() + " is already registered");
        }
        definitions.put(definition.stateId(), definition);
    }

    private record StateDefinition(int stateId, @NonNull String label, boolean singleton) {}
}
