// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import dagger.BindsInstance;
import dagger.Component;
import edu.umd.cs.findbugs.annotations.NonNull;
import javax.inject.Singleton;
import org.ledgerflow.rewards.RewardsService;
import org.ledgerflow.rewards.config.RewardsConfig;
import org.ledgerflow.rewards.impl.handlers.RewardsHandlers;
import org.ledgerflow.state.memory.InMemoryState;

/**
 * The object graph of one rewards ledger. The state passed to the builder must have the
 * {@link org.ledgerflow.rewards.impl.schemas.V0100RewardsSchema} states registered.
 */
@Singleton
@Component(modules = RewardsModule.class)
public interface RewardsComponent {

    RewardsService rewardsService();

    RewardsServiceImpl rewardsServiceImpl();

    RewardsHandlers handlers();

    @Component.Builder
    interface Builder {
        @BindsInstance
        Builder config(@NonNull RewardsConfig config);

        @BindsInstance
        Builder state(@NonNull InMemoryState state);

        RewardsComponent build();
    }
}
