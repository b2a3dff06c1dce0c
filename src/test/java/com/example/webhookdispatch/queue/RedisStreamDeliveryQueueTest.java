package com.example.webhookdispatch.queue;

import com.example.webhookdispatch.config.RedisStreamConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisStreamDeliveryQueueTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private StreamOperations<String, Object, Object> streamOps;
    @Mock
    private ZSetOperations<String, String> zSetOps;

    private RedisStreamDeliveryQueue queue;

    @BeforeEach
    void setUp() {
        queue = new RedisStreamDeliveryQueue(redisTemplate);
    }

    @Test
    void testEnqueueAddsDeliveryIdToStreamAndTrims() {
        when(redisTemplate.opsForStream()).thenReturn(streamOps);
        UUID id = UUID.randomUUID();

        queue.enqueue(id);

        InOrder inOrder = inOrder(streamOps);
        inOrder.verify(streamOps).add(eq(RedisStreamConfig.STREAM_KEY),
                eq(Map.of(RedisStreamConfig.FIELD_DELIVERY_ID, id.toString())));
        inOrder.verify(streamOps).trim(RedisStreamConfig.STREAM_KEY, RedisStreamDeliveryQueue.MAX_STREAM_LENGTH, true);
        verifyNoInteractions(zSetOps);
    }

    @Test
    void testEnqueueDelayedScoresByDueTime() {
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        UUID id = UUID.randomUUID();
        long delayMs = Duration.ofSeconds(300).toMillis();

        long before = System.currentTimeMillis();
        queue.enqueueDelayed(id, Duration.ofSeconds(300));
        long after = System.currentTimeMillis();

        verify(zSetOps).add(eq(RedisStreamConfig.DELAYED_KEY), eq(id.toString()),
                doubleThat(score -> score >= before + delayMs && score <= after + delayMs));
        verify(redisTemplate, never()).opsForStream();
    }
}
