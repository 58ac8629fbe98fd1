// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.app.spi.workflows;

/**
 * The outcome of handling an operation. Every value other than {@link #OK} names the first
 * precondition that failed.
 */
public enum ResponseCode {
    /** The operation was applied. */
    OK,
    /** The caller lacks the privilege an administrator- or owner-gated operation requires. */
    UNAUTHORIZED,
    /** A zero or otherwise disallowed amount was supplied. */
    INVALID_AMOUNT,
    /** The sender lacks funds for a transfer. */
    INSUFFICIENT_BALANCE,
    /** An account referenced by the operation has not been registered. */
    NOT_REGISTERED,
    /** The account is already registered. */
    ALREADY_REGISTERED,
    /** Algorithmic redistribution was attempted while it is switched off. */
    REDISTRIBUTION_LOCKED,
    /** Algorithmic redistribution was attempted against an empty pool. */
    NO_REWARDS,
    /** An account number is negative. */
    INVALID_ACCOUNT_ID,
    /** The supplied block height is negative, or behind a block already recorded for an account. */
    INVALID_BLOCK_HEIGHT,
    /** A redistribution batch names more beneficiaries than allowed. */
    BATCH_SIZE_LIMIT_EXCEEDED,
    /** A payout would take the redistribution pool below zero. */
    REDISTRIBUTION_POOL_UNDERFLOW,
    /** A balance, supply or holdings counter would exceed its maximum value. */
    AMOUNT_OVERFLOW
}
