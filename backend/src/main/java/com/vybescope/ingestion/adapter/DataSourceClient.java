package com.vybescope.ingestion.adapter;

import com.vybescope.domain.TokenHolder;
import com.vybescope.domain.TokenStats;
import com.vybescope.domain.TransferBatch;
import com.vybescope.domain.WalletSnapshot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the blockchain data provider. All methods throw
 * {@link ProviderUnavailableException} once transient failures are exhausted.
 */
public interface DataSourceClient {

    /**
     * Transfers into and out of {@code address} with timestamp strictly after {@code since},
     * ascending by timestamp. No events when there was no activity.
     */
    TransferBatch getWalletTransactions(String address, Instant since);

    /**
     * Transfers of {@code tokenMint} worth at least {@code minAmount} USD with timestamp strictly
     * after {@code since} (provider default lookback when null), ascending by timestamp.
     */
    TransferBatch getTokenLargeTransactions(String tokenMint, BigDecimal minAmount, Instant since);

    default TransferBatch getTokenLargeTransactions(String tokenMint, BigDecimal minAmount) {
        return getTokenLargeTransactions(tokenMint, minAmount, null);
    }

    TokenStats getTokenStats(String tokenMint);

    WalletSnapshot getWalletSnapshot(String address);

    List<TokenHolder> getTopTokenHolders(String tokenMint, int count);
}
