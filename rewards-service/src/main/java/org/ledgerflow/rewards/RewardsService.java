// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.app.spi.workflows.HandleException;
import org.ledgerflow.rewards.state.Account;

/**
 * The public surface of the fee rewards ledger.
 *
 * <p>Every mutating operation takes the authenticated caller and the current block height
 * supplied by the host. Each one is atomic: it either applies all of its effects, or throws a
 * {@link HandleException} naming the first failed precondition and leaves state untouched.
 * Mutating operations are serialized.
 *
 * <p>Queries read committed state only. For an account that is not registered they return the
 * default values of a fresh record (zero balance, zero score, zero pending rewards) without
 * creating one.
 */
public interface RewardsService {

    /**
     * Registers an account with the initial participation score. The caller must be the account
     * itself or the administrator.
     *
     * @param caller the authenticated caller
     * @param currentBlock the current block height
     * @param accountId the account to register
     */
    void register(@NonNull AccountId caller, long currentBlock, @NonNull AccountId accountId);

    /**
     * Mints new units to a registered recipient. Administrator only.
     *
     * @param caller the authenticated caller
     * @param currentBlock the current block height
     * @param amount the positive amount to mint
     * @param recipient the recipient
     */
    void mint(@NonNull AccountId caller, long currentBlock, long amount, @NonNull AccountId recipient);

    /**
     * Transfers units between registered accounts, moving the fee into the redistribution pool.
     * The caller must be the sender.
     *
     * @param caller the authenticated caller
     * @param currentBlock the current block height
     * @param amount the positive amount debited from the sender
     * @param sender the sender
     * @param recipient the recipient
     */
    void transfer(
            @NonNull AccountId caller,
            long currentBlock,
            long amount,
            @NonNull AccountId sender,
            @NonNull AccountId recipient);

    /**
     * Switches algorithmic redistribution on or off. Administrator only.
     *
     * @param caller the authenticated caller
     * @param currentBlock the current block height
     * @param active the new state
     * @return the new state
     */
    boolean setRedistributionActive(@NonNull AccountId caller, long currentBlock, boolean active);

    /**
     * Pays time- and velocity-weighted shares of the pool to the given beneficiaries, in list
     * order. Administrator only.
     *
     * @param caller the authenticated caller
     * @param currentBlock the current block height
     * @param beneficiaries the beneficiaries, at most the configured batch size
     * @return the payout of each beneficiary, zero for ineligible ones, in input order
     */
    @NonNull
    List<Long> executeAlgorithmicRedistribution(
            @NonNull AccountId caller, long currentBlock, @NonNull List<AccountId> beneficiaries);

    long getBalance(@NonNull AccountId accountId);

    long getParticipationScore(@NonNull AccountId accountId);

    @NonNull
    BigInteger getCumulativeHoldings(@NonNull AccountId accountId);

    /**
     * Returns the base share of the pool the account could claim right now, before time and
     * velocity adjustments.
     *
     * @param accountId the account
     * @return the base share
     */
    long getPendingRewards(@NonNull AccountId accountId);

    @NonNull
    Optional<Account> getAccount(@NonNull AccountId accountId);

    long getRedistributionPool();

    long getTotalSupply();

    long getTotalParticipationScore();

    boolean isRedistributionActive();

    long getRegisteredCount();
}
