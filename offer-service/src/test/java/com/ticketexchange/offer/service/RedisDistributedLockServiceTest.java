package com.ticketexchange.offer.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisDistributedLockServiceTest {

    private static final String SWEEP_KEY = "offer-service:lock:offer_expiry_sweep";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisDistributedLockService lockService;

    @BeforeEach
    void setUp() {
        lockService = new RedisDistributedLockService(redisTemplate);
    }

    // ─── acquireLock ─────────────────────────────────────────────────────

    @Test
    void acquireLock_Success_ReturnsToken() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(SWEEP_KEY), anyString(), eq(Duration.ofSeconds(30))))
            .thenReturn(true);

        String token = lockService.acquireLock(DistributedLockService.expirySweepLock(), Duration.ofSeconds(30));

        assertNotNull(token);
    }

    @Test
    void acquireLock_HeldElsewhere_ReturnsNull() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertNull(lockService.acquireLock("offer_expiry_sweep", Duration.ofSeconds(30)));
    }

    @Test
    void acquireLock_RedisException_ReturnsNull() {
        when(redisTemplate.opsForValue()).thenThrow(new RuntimeException("Redis down"));

        assertNull(lockService.acquireLock("offer_expiry_sweep", Duration.ofSeconds(30)));
    }

    // ─── releaseLock ─────────────────────────────────────────────────────

    @Test
    void releaseLock_Owner_ReturnsTrue() {
        when(redisTemplate.execute(any(DefaultRedisScript.class), eq(Collections.singletonList(SWEEP_KEY)), eq("token-123")))
            .thenReturn(1L);

        assertTrue(lockService.releaseLock("offer_expiry_sweep", "token-123"));
    }

    @Test
    void releaseLock_NotOwner_ReturnsFalse() {
        when(redisTemplate.execute(any(DefaultRedisScript.class), anyList(), anyString())).thenReturn(0L);

        assertFalse(lockService.releaseLock("offer_expiry_sweep", "wrong-token"));
    }

    @Test
    void releaseLock_RedisException_ReturnsFalse() {
        when(redisTemplate.execute(any(DefaultRedisScript.class), anyList(), anyString()))
            .thenThrow(new RuntimeException("Redis error"));

        assertFalse(lockService.releaseLock("offer_expiry_sweep", "token-123"));
    }

    // ─── runWithLock ─────────────────────────────────────────────────────

    @Test
    void runWithLock_Acquired_RunsTaskAndReleases() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(SWEEP_KEY), anyString(), any(Duration.class))).thenReturn(true);
        when(redisTemplate.execute(any(DefaultRedisScript.class), anyList(), anyString())).thenReturn(1L);
        AtomicBoolean ran = new AtomicBoolean(false);

        boolean result = lockService.runWithLock("offer_expiry_sweep", Duration.ofMinutes(5), () -> ran.set(true));

        assertTrue(result);
        assertTrue(ran.get());
        verify(redisTemplate).execute(any(DefaultRedisScript.class), anyList(), anyString());
    }

    @Test
    void runWithLock_TaskThrows_StillReleases() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        when(redisTemplate.execute(any(DefaultRedisScript.class), anyList(), anyString())).thenReturn(1L);

        assertThrows(IllegalStateException.class, () -> lockService.runWithLock("offer_expiry_sweep",
            Duration.ofMinutes(5), () -> { throw new IllegalStateException("boom"); }));

        verify(redisTemplate).execute(any(DefaultRedisScript.class), anyList(), anyString());
    }

    @Test
    void runWithLock_NotAcquired_SkipsTask() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);
        AtomicBoolean ran = new AtomicBoolean(false);

        assertFalse(lockService.runWithLock("offer_expiry_sweep", Duration.ofMinutes(5), () -> ran.set(true)));
        assertFalse(ran.get());
        verify(redisTemplate, never()).execute(any(DefaultRedisScript.class), anyList(), anyString());
    }
}
