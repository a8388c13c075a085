package com.openfashion.vaultservice.service.imp;

import com.openfashion.vaultservice.service.InFlightLockService;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

@Service
public class RedisInFlightLockService implements InFlightLockService {

    private static final String RELEASE_SCRIPT = "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "return redis.call('del', KEYS[1]) " +
            "else return 0 end";

    private final RedisTemplate<String, String> lockTemplate;

    @Value("${app.vault.in-flight-lock-ttl-seconds:30}")
    private int ttlSeconds;

    private Duration lockTimeout;

    private final String ownerId = UUID.randomUUID().toString();

    public RedisInFlightLockService(@Qualifier("lockTemplate") RedisTemplate<String, String> lockTemplate) {
        this.lockTemplate = lockTemplate;
    }

    @PostConstruct
    public void init() {
        lockTimeout = Duration.ofSeconds(ttlSeconds);
    }

    @Override
    public boolean acquire(String key) {
        Boolean success = lockTemplate.opsForValue()
                .setIfAbsent(key, ownerId, lockTimeout);

        return Boolean.TRUE.equals(success);
    }

    @Override
    public void release(String key) {
        lockTemplate.execute(new DefaultRedisScript<>(RELEASE_SCRIPT, Long.class),
                Collections.singletonList(key), ownerId);
    }
}
