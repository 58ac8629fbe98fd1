// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.app.spi.workflows;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A handler of one kind of operation.
 *
 * @param <B> the operation body type
 * @param <R> the type of the handling result
 */
public interface TransactionHandler<B, R> {

    /**
     * Validates the operation body without looking at state.
     *
     * @param body the operation body
     * @throws HandleException if the body is invalid
     */
    default void pureChecks(@NonNull final B body) throws HandleException {
        // Most bodies have nothing to check without state
    }

    /**
     * Checks every remaining precondition against state and then applies the operation.
     * Implementations must not write to any store before every precondition has been checked.
     *
     * @param context the handle context
     * @param body the operation body
     * @return the result of the operation
     * @throws HandleException if a precondition fails
     */
    @NonNull
    R handle(@NonNull HandleContext context, @NonNull B body) throws HandleException;
}
