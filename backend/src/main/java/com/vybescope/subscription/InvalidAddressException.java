package com.vybescope.subscription;

import lombok.Getter;

/**
 * Address or mint failed Base58 validation. No state was changed.
 */
@Getter
public class InvalidAddressException extends RuntimeException {

    private final String address;

    public InvalidAddressException(String address) {
        super("Invalid Solana address: " + address);
        this.address = address;
    }
}
