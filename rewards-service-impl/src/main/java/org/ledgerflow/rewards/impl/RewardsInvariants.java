// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.ledgerflow.rewards.ReadableAccountStore;
import org.ledgerflow.rewards.ReadableRewardsGlobalsStore;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.state.RewardsGlobals;

/**
 * Recounts the account state and compares the result with the incrementally maintained global
 * counters. The conserved quantity is {@code sum(balances) + pool == totalSupply}: transfer fees
 * leave the accounts for the pool, and payouts bring them back.
 */
public final class RewardsInvariants {

    private RewardsInvariants() {
        // Utility class
    }

    /**
     * Returns a description of every invariant the given stores violate.
     *
     * @param accountStore the accounts
     * @param globalsStore the global counters
     * @param maxParticipationScore the upper bound of every score
     * @return the violations, empty if the state is consistent
     */
    @NonNull
    public static List<String> violations(
            @NonNull final ReadableAccountStore accountStore,
            @NonNull final ReadableRewardsGlobalsStore globalsStore,
            final long maxParticipationScore) {
        requireNonNull(accountStore);
        requireNonNull(globalsStore);
        final List<Account> accounts = new ArrayList<>();
        final var ids = accountStore.accountIds();
        while (ids.hasNext()) {
            accounts.add(requireNonNull(accountStore.getAccountById(ids.next())));
        }
        return violations(accounts, globalsStore.get(), maxParticipationScore);
    }

    /**
     * Returns a description of every invariant the given accounts and globals violate.
     *
     * @param accounts every registered account
     * @param globals the global counters
     * @param maxParticipationScore the upper bound of every score
     * @return the violations, empty if the state is consistent
     */
    @NonNull
    public static List<String> violations(
            @NonNull final Iterable<Account> accounts,
            @NonNull final RewardsGlobals globals,
            final long maxParticipationScore) {
        requireNonNull(accounts);
        requireNonNull(globals);
        final List<String> violations = new ArrayList<>();
        var balances = BigInteger.ZERO;
        var scores = BigInteger.ZERO;
        long count = 0;
        for (final var account : accounts) {
            balances = balances.add(BigInteger.valueOf(account.balance()));
            scores = scores.add(BigInteger.valueOf(account.participationScore()));
            count++;
            if (account.participationScore() > maxParticipationScore) {
                violations.add("Score of " + account.accountId() + " is " + account.participationScore()
                        + ", above " + maxParticipationScore);
            }
        }
        final var held = balances.add(BigInteger.valueOf(globals.redistributionPool()));
        if (!held.equals(BigInteger.valueOf(globals.totalSupply()))) {
            violations.add("Balances plus pool are " + held + " but total supply is " + globals.totalSupply());
        }
        if (!scores.equals(BigInteger.valueOf(globals.totalParticipationScore()))) {
            violations.add("Scores sum to " + scores + " but the aggregate is " + globals.totalParticipationScore());
        }
        if (count != globals.registeredCount()) {
            violations.add(count + " accounts exist but the registered count is " + globals.registeredCount());
        }
        return violations;
    }

    /**
     * Throws if the given stores violate any invariant.
     *
     * @param accountStore the accounts
     * @param globalsStore the global counters
     * @param maxParticipationScore the upper bound of every score
     * @throws IllegalStateException listing the violations
     */
    public static void verify(
            @NonNull final ReadableAccountStore accountStore,
            @NonNull final ReadableRewardsGlobalsStore globalsStore,
            final long maxParticipationScore) {
        final var violations = violations(accountStore, globalsStore, maxParticipationScore);
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Rewards state is inconsistent: " + String.join("; ", violations));
        }
    }
}
