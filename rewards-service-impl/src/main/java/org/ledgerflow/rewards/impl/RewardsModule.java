// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import dagger.Binds;
import dagger.Module;
import javax.inject.Singleton;
import org.ledgerflow.app.spi.authorization.Authorizer;
import org.ledgerflow.rewards.RewardsService;

/**
 * Binds the rewards service and its collaborators.
 */
@Module
public interface RewardsModule {

    @Binds
    @Singleton
    RewardsService bindRewardsService(RewardsServiceImpl rewardsService);

    @Binds
    @Singleton
    Authorizer bindAuthorizer(ConfigAuthorizer authorizer);
}
