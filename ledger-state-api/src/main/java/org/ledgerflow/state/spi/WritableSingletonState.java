// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A {@link ReadableSingletonState} whose value can be replaced.
 *
 * @param <T> The type of the value
 */
public interface WritableSingletonState<T> extends ReadableSingletonState<T> {

    /**
     * Sets the singleton value.
     *
     * @param value the new value
     */
    void put(@NonNull T value);

    /**
     * Gets whether {@link #put(Object)} was called since the last commit or reset.
     *
     * @return true if the value was modified
     */
    boolean isModified();
}
