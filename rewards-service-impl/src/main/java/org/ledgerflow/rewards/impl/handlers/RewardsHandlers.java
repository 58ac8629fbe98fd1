// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.handlers;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Holds every handler of the rewards service.
 */
@Singleton
public class RewardsHandlers {

    private final RegisterAccountHandler registerAccountHandler;
    private final MintHandler mintHandler;
    private final TransferHandler transferHandler;
    private final SetRedistributionActiveHandler setRedistributionActiveHandler;
    private final AlgorithmicRedistributionHandler algorithmicRedistributionHandler;

    @Inject
    public RewardsHandlers(
            @NonNull final RegisterAccountHandler registerAccountHandler,
            @NonNull final MintHandler mintHandler,
            @NonNull final TransferHandler transferHandler,
            @NonNull final SetRedistributionActiveHandler setRedistributionActiveHandler,
            @NonNull final AlgorithmicRedistributionHandler algorithmicRedistributionHandler) {
        this.registerAccountHandler = requireNonNull(registerAccountHandler);
        this.mintHandler = requireNonNull(mintHandler);
        this.transferHandler = requireNonNull(transferHandler);
        this.setRedistributionActiveHandler = requireNonNull(setRedistributionActiveHandler);
        this.algorithmicRedistributionHandler = requireNonNull(algorithmicRedistributionHandler);
    }

    public RegisterAccountHandler registerAccountHandler() {
        return registerAccountHandler;
    }

    public MintHandler mintHandler() {
        return mintHandler;
    }

    public TransferHandler transferHandler() {
        return transferHandler;
    }

    public SetRedistributionActiveHandler setRedistributionActiveHandler() {
        return setRedistributionActiveHandler;
    }

    public AlgorithmicRedistributionHandler algorithmicRedistributionHandler() {
        return algorithmicRedistributionHandler;
    }
}
