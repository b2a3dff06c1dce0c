package com.example.webhookdispatch.queue;

import com.example.webhookdispatch.config.RedisStreamConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 投递消息的死信流。
 *
 * <p>只接收队列层面的毒消息：同一条 Stream 消息被认领 {@value #MAX_DELIVERY_COUNT} 次仍未 ACK，
 * 说明每次处理都让消费者进程崩溃。投递记录本身停留在 IN_PROGRESS，由 RetrySweeperService 按过期认领回收；
 * HTTP 层面的失败走投递记录的重试策略，不进入这里。
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "redis")
public class DeadLetterService {

    public static final String DLQ_STREAM_KEY = "webhook:deliveries:dlq";
    public static final int MAX_DELIVERY_COUNT = 5;

    static final String FIELD_ORIGINAL_MESSAGE_ID = "originalMessageId";
    static final String FIELD_QUEUE_DELIVERIES = "queueDeliveries";
    static final String FIELD_REASON = "reason";
    static final String FIELD_DEAD_AT = "deadAt";

    private final StringRedisTemplate redisTemplate;

    /**
     * @param queueDeliveries 消息被投递给消费者的次数（XPENDING 的 delivery count）
     */
    public boolean isPoison(long queueDeliveries) {
        return queueDeliveries >= MAX_DELIVERY_COUNT;
    }

    /**
     * 写入死信流后从投递组 ACK 原消息。
     * 写入失败时不 ACK，消息留在 Pending List，下一轮恢复再试。
     *
     * @return 是否已转入死信流
     */
    public boolean deadLetter(MapRecord<String, String, String> message, long queueDeliveries) {
        String deliveryId = message.getValue().getOrDefault(RedisStreamConfig.FIELD_DELIVERY_ID, "");

        Map<String, String> entry = new LinkedHashMap<>();
        entry.put(RedisStreamConfig.FIELD_DELIVERY_ID, deliveryId);
        entry.put(FIELD_ORIGINAL_MESSAGE_ID, message.getId().getValue());
        entry.put(FIELD_QUEUE_DELIVERIES, String.valueOf(queueDeliveries));
        entry.put(FIELD_REASON, "Not acknowledged after " + queueDeliveries + " queue deliveries");
        entry.put(FIELD_DEAD_AT, Instant.now().toString());

        RecordId deadId;
        try {
            deadId = redisTemplate.opsForStream().add(DLQ_STREAM_KEY, entry);
        } catch (RuntimeException e) {
            log.error("Failed to dead-letter delivery {} (message {}): {}",
                    deliveryId, message.getId(), e.getMessage(), e);
            return false;
        }

        redisTemplate.opsForStream().acknowledge(
                RedisStreamConfig.STREAM_KEY,
                RedisStreamConfig.GROUP_NAME,
                message.getId());
        log.warn("Delivery {} dead-lettered as {} after {} queue deliveries (message {})",
                deliveryId, deadId, queueDeliveries, message.getId());
        return true;
    }
}
