package com.openfashion.vaultservice.model;

public enum OutboxStatus {
    PENDING,
    PROCESSED
}
