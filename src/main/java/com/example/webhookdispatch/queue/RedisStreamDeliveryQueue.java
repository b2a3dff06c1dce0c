package com.example.webhookdispatch.queue;

import com.example.webhookdispatch.config.RedisStreamConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

/**
 * 多实例模式：投递任务写入 Redis Stream，延迟任务写入按到期时间排序的 ZSET，
 * 由 {@link DelayedDeliveryPromoter} 到期后转入 Stream。
 * Redis 短暂不可用时重试写入；仍失败则抛出，由调用方记录日志，记录本身由 RetrySweeperService 兜底。
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "redis")
public class RedisStreamDeliveryQueue implements DeliveryQueue {

    static final long MAX_STREAM_LENGTH = 10_000;

    private final StringRedisTemplate redisTemplate;

    @Override
    @Retryable(retryFor = RuntimeException.class, maxAttempts = 3, backoff = @Backoff(delay = 200, multiplier = 2.0))
    public void enqueue(UUID deliveryId) {
        redisTemplate.opsForStream().add(RedisStreamConfig.STREAM_KEY,
                Collections.singletonMap(RedisStreamConfig.FIELD_DELIVERY_ID, deliveryId.toString()));
        // 裁剪 Stream 长度（近似模式）
        redisTemplate.opsForStream().trim(RedisStreamConfig.STREAM_KEY, MAX_STREAM_LENGTH, true);
        log.debug("Dispatched delivery {} via Redis Stream", deliveryId);
    }

    @Override
    @Retryable(retryFor = RuntimeException.class, maxAttempts = 3, backoff = @Backoff(delay = 200, multiplier = 2.0))
    public void enqueueDelayed(UUID deliveryId, Duration delay) {
        long dueAt = System.currentTimeMillis() + delay.toMillis();
        redisTemplate.opsForZSet().add(RedisStreamConfig.DELAYED_KEY, deliveryId.toString(), dueAt);
        log.debug("Delivery {} parked until {}", deliveryId, dueAt);
    }
}
