package com.vybescope.alert;

public enum CycleType {
    WALLET_TRACKING,
    WHALE_ALERT
}
