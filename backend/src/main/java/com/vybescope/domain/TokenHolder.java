package com.vybescope.domain;

import java.math.BigDecimal;

public record TokenHolder(
        int rank,
        String ownerAddress,
        String ownerName,
        BigDecimal balance,
        BigDecimal valueUsd,
        BigDecimal percentageOfSupply
) {
}
