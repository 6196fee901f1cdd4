package com.vybescope.domain;

public enum NotificationKind {
    WALLET_TRANSFER,
    WHALE_ALERT
}
