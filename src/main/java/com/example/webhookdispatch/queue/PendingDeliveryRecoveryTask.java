package com.example.webhookdispatch.queue;

import com.example.webhookdispatch.config.RedisStreamConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.PendingMessagesSummary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 定时任务：恢复 Pending List 中长时间未确认的投递消息（消费者在处理中宕机）。
 * XCLAIM 到当前消费者后重新处理，超过最大次数的移入死信队列。
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "redis")
public class PendingDeliveryRecoveryTask {

    // 消息空闲超过此时间视为需要恢复（大于单次投递超时）
    private static final long PENDING_IDLE_TIME_MS = 60_000;

    private static final int MAX_RECOVER_COUNT = 100;

    private final StringRedisTemplate redisTemplate;
    private final DeliveryStreamConsumer consumer;
    private final DeadLetterService deadLetterService;

    /**
     * 每 30 秒执行一次 Pending 恢复检查
     */
    @Scheduled(fixedDelay = 30_000)
    public void recoverPendingMessages() {
        try {
            PendingMessagesSummary summary = redisTemplate.opsForStream().pending(
                    RedisStreamConfig.STREAM_KEY,
                    RedisStreamConfig.GROUP_NAME);

            if (summary == null || summary.getTotalPendingMessages() == 0) {
                return;
            }

            // 扫描整个组的 Pending 列表，包括已下线实例遗留的消息
            PendingMessages pendingMessages = redisTemplate.opsForStream().pending(
                    RedisStreamConfig.STREAM_KEY,
                    RedisStreamConfig.GROUP_NAME,
                    Range.unbounded(),
                    MAX_RECOVER_COUNT);

            for (PendingMessage pm : pendingMessages) {
                long idleTimeMs = pm.getElapsedTimeSinceLastDelivery().toMillis();
                if (idleTimeMs <= PENDING_IDLE_TIME_MS) {
                    continue;
                }
                log.info("Recovering pending delivery message: id={}, idleTime={}ms, deliveryCount={}",
                        pm.getId(), idleTimeMs, pm.getTotalDeliveryCount());

                List<MapRecord<String, Object, Object>> claimed = redisTemplate.opsForStream().claim(
                        RedisStreamConfig.STREAM_KEY,
                        RedisStreamConfig.GROUP_NAME,
                        RedisStreamConfig.CONSUMER_NAME,
                        Duration.ofMillis(PENDING_IDLE_TIME_MS),
                        pm.getId());

                for (MapRecord<String, Object, Object> record : claimed) {
                    MapRecord<String, String, String> stringRecord = toStringRecord(record);
                    if (deadLetterService.isPoison(pm.getTotalDeliveryCount())) {
                        deadLetterService.deadLetter(stringRecord, pm.getTotalDeliveryCount());
                    } else {
                        consumer.onMessage(stringRecord);
                    }
                }
            }
        } catch (Exception e) {
            log.error("Error during pending message recovery: {}", e.getMessage(), e);
        }
    }

    private MapRecord<String, String, String> toStringRecord(MapRecord<String, Object, Object> record) {
        Map<String, String> stringMap = record.getValue().entrySet().stream()
                .collect(Collectors.toMap(
                        e -> e.getKey().toString(),
                        e -> e.getValue() != null ? e.getValue().toString() : ""));
        return MapRecord.create(record.getStream(), stringMap).withId(record.getId());
    }
}
