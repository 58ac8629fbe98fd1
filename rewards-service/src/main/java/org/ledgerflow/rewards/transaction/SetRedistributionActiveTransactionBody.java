// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.transaction;

/**
 * Switches algorithmic redistribution on or off.
 *
 * @param active the new state
 */
public record SetRedistributionActiveTransactionBody(boolean active) {}
