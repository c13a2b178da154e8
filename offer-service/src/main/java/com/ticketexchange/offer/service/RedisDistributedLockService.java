package com.ticketexchange.offer.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

/**
 * SET NX lock keeping background jobs to one runner across instances. Per-offer
 * correctness rests on the database row lock, so an unreachable Redis only means
 * the job skips a round.
 */
@Service
@Slf4j
public class RedisDistributedLockService implements DistributedLockService {

    private static final String KEY_PREFIX = "offer-service:lock:";

    // Lua script for atomic lock release
    private static final String RELEASE_LOCK_SCRIPT =
        "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
        "  return redis.call('DEL', KEYS[1]) " +
        "else " +
        "  return 0 " +
        "end";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> releaseLockScript;

    @Autowired
    public RedisDistributedLockService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.releaseLockScript = new DefaultRedisScript<>(RELEASE_LOCK_SCRIPT, Long.class);
    }

    @Override
    public String acquireLock(String lockKey, Duration ttl) {
        String lockToken = UUID.randomUUID().toString();

        try {
            Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(KEY_PREFIX + lockKey, lockToken, ttl);

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Acquired lock: {} with token: {}", lockKey, lockToken);
                return lockToken;
            }
            log.debug("Lock {} is held elsewhere", lockKey);
            return null;
        } catch (Exception e) {
            log.warn("Error acquiring lock: {}", lockKey, e);
            return null;
        }
    }

    @Override
    public boolean releaseLock(String lockKey, String lockToken) {
        try {
            Long result = redisTemplate.execute(
                releaseLockScript,
                Collections.singletonList(KEY_PREFIX + lockKey),
                lockToken
            );

            boolean released = result != null && result == 1;
            if (released) {
                log.debug("Released lock: {} with token: {}", lockKey, lockToken);
            } else {
                log.warn("Lock {} had already expired or changed owner before release", lockKey);
            }
            return released;
        } catch (Exception e) {
            log.error("Error releasing lock: {} with token: {}", lockKey, lockToken, e);
            return false;
        }
    }

    @Override
    public boolean runWithLock(String lockKey, Duration ttl, Runnable task) {
        String lockToken = acquireLock(lockKey, ttl);
        if (lockToken == null) {
            return false;
        }

        try {
            task.run();
            return true;
        } finally {
            releaseLock(lockKey, lockToken);
        }
    }
}
