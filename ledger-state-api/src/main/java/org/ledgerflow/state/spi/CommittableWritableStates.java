// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.state.spi;

/**
 * A {@link WritableStates} whose buffered modifications can be flushed to, or discarded from, the
 * underlying data sources as a unit.
 */
public interface CommittableWritableStates extends WritableStates {

    /**
     * Flushes every buffered modification of every state.
     */
    void commit();

    /**
     * Discards every buffered modification of every state.
     */
    void reset();
}
