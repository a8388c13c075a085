package com.openfashion.vaultservice.service;

public interface InFlightLockService {

    boolean acquire(String key);

    void release(String key);
}
