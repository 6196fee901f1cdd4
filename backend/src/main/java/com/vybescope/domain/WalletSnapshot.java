package com.vybescope.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Current token balances of a wallet as reported by the provider.
 */
public record WalletSnapshot(
        String ownerAddress,
        BigDecimal totalValueUsd,
        BigDecimal totalValueUsd1dChange,
        int tokenCount,
        List<TokenBalance> tokens
) {

    public static WalletSnapshot empty(String ownerAddress) {
        return new WalletSnapshot(ownerAddress, BigDecimal.ZERO, BigDecimal.ZERO, 0, List.of());
    }

    public record TokenBalance(
            String mintAddress,
            String symbol,
            String name,
            BigDecimal amount,
            BigDecimal valueUsd,
            BigDecimal priceUsd,
            BigDecimal priceUsd1dChange
    ) {
    }
}
