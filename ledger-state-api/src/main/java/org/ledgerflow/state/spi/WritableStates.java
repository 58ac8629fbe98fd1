// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A {@link ReadableStates} whose states can be modified.
 */
public interface WritableStates extends ReadableStates {

    @NonNull
    @Override
    <K, V> WritableKVState<K, V> get(int stateId);

    @NonNull
    @Override
    <T> WritableSingletonState<T> getSingleton(int stateId);
}
