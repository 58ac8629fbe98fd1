// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.app.spi.authorization;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.ledgerflow.app.spi.ids.AccountId;

/**
 * Decides which accounts hold administrator privilege.
 */
public interface Authorizer {

    /**
     * Gets whether the given account is the distinguished administrator.
     *
     * @param accountId the account
     * @return true if the account is the administrator
     */
    boolean isSuperUser(@NonNull AccountId accountId);
}
