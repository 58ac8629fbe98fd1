// SPDX-License-Identifier: Apache-2.0
package org.ledgerflow.rewards.impl.test;

import static org.mockito.BDDMockito.given;

import org.ledgerflow.app.spi.ids.AccountId;
import org.ledgerflow.app.spi.store.StoreFactory;
import org.ledgerflow.app.spi.workflows.HandleContext;
import org.ledgerflow.rewards.WritableAccountStore;
import org.ledgerflow.rewards.WritableRewardsGlobalsStore;
import org.mockito.Mock;

public class RewardsHandlerTestBase extends RewardsTestBase {

    @Mock
    protected HandleContext handleContext;

    @Mock
    protected StoreFactory storeFactory;

    protected void givenPayer(final AccountId payer) {
        given(handleContext.payer()).willReturn(payer);
    }

    protected void givenStores(final long currentBlock) {
        given(handleContext.currentBlock()).willReturn(currentBlock);
        givenStoresOnly();
    }

    protected void givenStoresOnly() {
        given(handleContext.storeFactory()).willReturn(storeFactory);
        given(storeFactory.writableStore(WritableAccountStore.class)).willReturn(writableAccountStore);
        given(storeFactory.writableStore(WritableRewardsGlobalsStore.class)).willReturn(writableGlobalsStore);
    }
}
