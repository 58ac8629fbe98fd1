// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.app.spi.store;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Creates stores by their interface type.
 */
public interface StoreFactory {

    /**
     * Returns a read-only store of the given type.
     *
     * @param storeInterface the store interface
     * @return the store
     * @param <T> the store type
     * @throws IllegalArgumentException if the store type is unknown
     */
    @NonNull
    <T> T readableStore(@NonNull Class<T> storeInterface);

    /**
     * Returns a writable store of the given type.
     *
     * @param storeInterface the store interface
     * @return the store
     * @param <T> the store type
     * @throws IllegalArgumentException if the store type is unknown
     */
    @NonNull
    <T> T writableStore(@NonNull Class<T> storeInterface);
}
