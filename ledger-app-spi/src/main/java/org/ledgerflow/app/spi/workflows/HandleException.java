// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.app.spi.workflows;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A runtime exception that wraps a {@link ResponseCode} other than {@link ResponseCode#OK}. Thrown
 * by handlers when a precondition fails; the owner of the writable state discards every buffered
 * modification when it sees one.
 */
public class HandleException extends RuntimeException {

    private final ResponseCode status;

    public HandleException(@NonNull final ResponseCode status) {
        super(requireNonNull(status).name());
        this.status = status;
    }

    public HandleException(@NonNull final ResponseCode status, @NonNull final String message) {
        super(requireNonNull(status).name() + ": " + requireNonNull(message));
        this.status = status;
    }

    /**
     * Returns the status code of the failure.
     *
     * @return the status
     */
    @NonNull
    public ResponseCode getStatus() {
        return status;
    }

    /**
     * Throws a {@code HandleException} with the given code if the flag is false.
     *
     * @param flag the condition that must hold
     * @param code the status to report if it does not
     * @throws HandleException if the flag is false
     */
    public static void validateTrue(final boolean flag, @NonNull final ResponseCode code) {
        if (!flag) {
            throw new HandleException(code);
        }
    }

    /**
     * Throws a {@code HandleException} with the given code if the flag is true.
     *
     * @param flag the condition that must not hold
     * @param code the status to report if it does
     * @throws HandleException if the flag is true
     */
    public static void validateFalse(final boolean flag, @NonNull final ResponseCode code) {
        validateTrue(!flag, code);
    }

    @Override
    public String toString() {
        final var message = getMessage();
        if (status.name().equals(message)) {
            return "HandleException{" + "status=" + status + '}';
        }
        return "HandleException{" + "status=" + status + ", message='" + message + '\'' + '}';
    }
}
