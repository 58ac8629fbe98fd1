// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.ledgerflow.app.spi.authorization.Authorizer;
import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.rewards.config.RewardsConfig;

/**
 * An {@link Authorizer} that recognizes the single administrator account named in
 * {@link RewardsConfig#adminAccount()}.
 */
@Singleton
public class ConfigAuthorizer implements Authorizer {

    private final AccountId adminAccountId;

    @Inject
    public ConfigAuthorizer(@NonNull final RewardsConfig config) {
        this.adminAccountId = requireNonNull(config).adminAccountId();
    }

    @Override
    public boolean isSuperUser(@NonNull final AccountId accountId) {
        return adminAccountId.equals(requireNonNull(accountId));
    }
}
