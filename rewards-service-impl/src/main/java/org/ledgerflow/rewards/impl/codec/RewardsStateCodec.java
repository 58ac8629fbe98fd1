// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.codec;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.app.spi.workflows.HandleException;
import org.ledgerflow.rewards.ReadableAccountStore;
import org.ledgerflow.rewards.ReadableRewardsGlobalsStore;
import org.ledgerflow.rewards.state.Account;
import org.ledgerflow.rewards.state.RewardsGlobals;

/**
 * Writes and reads a JSON snapshot of the whole rewards state: the global counters and every
 * account, in the iteration order of the account state. All quantities are JSON integers, so a
 * snapshot round-trips exactly.
 */
@Singleton
public class RewardsStateCodec {

    /** The snapshot format this codec writes and accepts. */
    public static final int FORMAT_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    @Inject
    public RewardsStateCodec() {
        // No configuration
    }

    /**
     * Encodes the state visible through the given stores.
     *
     * @param accountStore the accounts
     * @param globalsStore the global counters
     * @return the JSON snapshot
     */
    @NonNull
    public String encode(
            @NonNull final ReadableAccountStore accountStore, @NonNull final ReadableRewardsGlobalsStore globalsStore) {
        requireNonNull(accountStore);
        requireNonNull(globalsStore);
        final List<Account> accounts = new ArrayList<>();
        final var ids = accountStore.accountIds();
        while (ids.hasNext()) {
            accounts.add(requireNonNull(accountStore.getAccountById(ids.next())));
        }
        return encode(new RewardsSnapshot(globalsStore.get(), accounts));
    }

    /**
     * Encodes a snapshot.
     *
     * @param snapshot the snapshot
     * @return the JSON snapshot
     */
    @NonNull
    public String encode(@NonNull final RewardsSnapshot snapshot) {
        requireNonNull(snapshot);
        final var globals = snapshot.globals();
        final var document = new SnapshotDocument(
                FORMAT_VERSION,
                new GlobalsDocument(
                        globals.redistributionPool(),
                        globals.totalSupply(),
                        globals.totalParticipationScore(),
                        globals.redistributionActive(),
                        globals.registeredCount()),
                snapshot.accounts().stream()
                        .map(account -> new AccountDocument(
                                account.accountId().accountNum(),
                                account.balance(),
                                account.participationScore(),
                                account.lastActivityBlock(),
                                account.lastClaimBlock(),
                                account.cumulativeHoldings()))
                        .toList());
        try {
            return MAPPER.writeValueAsString(document);
        } catch (final JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Decodes a snapshot. The result is structurally valid; whether its counters agree with its
     * accounts is for the caller to check.
     *
     * @param json the JSON snapshot
     * @return the snapshot
     * @throws IllegalArgumentException if the JSON is malformed, of another format version, or
     *     holds a negative quantity or duplicate account
     */
    @NonNull
    public RewardsSnapshot decode(@NonNull final String json) {
        requireNonNull(json);
        final SnapshotDocument document;
        try {
            document = MAPPER.readValue(json, SnapshotDocument.class);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid rewards snapshot: " + e.getOriginalMessage(), e);
        }
        if (document.version() != FORMAT_VERSION) {
            throw new IllegalArgumentException("Unsupported rewards snapshot version " + document.version());
        }
        if (document.globals() == null || document.accounts() == null) {
            throw new IllegalArgumentException("Rewards snapshot must have globals and accounts");
        }
        final var g = document.globals();
        final RewardsGlobals globals;
        final List<Account> accounts = new ArrayList<>(document.accounts().size());
        try {
            globals = new RewardsGlobals(
                    g.redistributionPool(),
                    g.totalSupply(),
                    g.totalParticipationScore(),
                    g.redistributionActive(),
                    g.registeredCount());
            for (final var a : document.accounts()) {
                if (a == null || a.cumulativeHoldings() == null) {
                    throw new IllegalArgumentException("Rewards snapshot has an incomplete account entry");
                }
                accounts.add(new Account(
                        AccountId.of(a.accountNum()),
                        a.balance(),
                        a.participationScore(),
                        a.lastActivityBlock(),
                        a.lastClaimBlock(),
                        a.cumulativeHoldings()));
            }
        } catch (final HandleException e) {
            throw new IllegalArgumentException("Invalid account id in rewards snapshot", e);
        }
        if (accounts.stream().map(Account::accountId).distinct().count() != accounts.size()) {
            throw new IllegalArgumentException("Rewards snapshot lists an account more than once");
        }
        return new RewardsSnapshot(globals, accounts);
    }

    /** The JSON shape of a snapshot. */
    public record SnapshotDocument(int version, GlobalsDocument globals, List<AccountDocument> accounts) {}

    /** The JSON shape of the global counters. */
    public record GlobalsDocument(
            long redistributionPool,
            long totalSupply,
            long totalParticipationScore,
            boolean redistributionActive,
            long registeredCount) {}

    /** The JSON shape of one account. */
    public record AccountDocument(
            long accountNum,
            long balance,
            long participationScore,
            long lastActivityBlock,
            long lastClaimBlock,
            BigInteger cumulativeHoldings) {}
}
