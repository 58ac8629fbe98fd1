// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Provides access to a singleton value in state.
 *
 * @param <T> The type of the value
 */
public interface ReadableSingletonState<T> {

    /**
     * Gets the state ID of this state.
     *
     * @return The state ID
     */
    int getStateId();

    /**
     * Gets the singleton value.
     *
     * @return The value, or null if the singleton was never set
     */
    @Nullable
    T get();

    /**
     * Gets whether the value of this singleton has been read since the last reset.
     *
     * @return true if {@link #get()} was called
     */
    boolean isRead();
}
