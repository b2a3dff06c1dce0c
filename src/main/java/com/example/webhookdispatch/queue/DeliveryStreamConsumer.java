package com.example.webhookdispatch.queue;

import com.example.webhookdispatch.config.RedisStreamConfig;
import com.example.webhookdispatch.service.DeliveryWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.stream.StreamListener;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Redis Stream 消费者：取出投递 ID 交给 Worker。
 * Worker 不抛异常，处理完即 ACK；进程在处理中崩溃时消息留在 Pending List，由恢复任务重新认领。
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "redis")
public class DeliveryStreamConsumer implements StreamListener<String, MapRecord<String, String, String>> {

    private final DeliveryWorker worker;
    private final StringRedisTemplate redisTemplate;

    @Override
    public void onMessage(MapRecord<String, String, String> message) {
        String deliveryId = message.getValue().get(RedisStreamConfig.FIELD_DELIVERY_ID);
        UUID id;
        try {
            id = UUID.fromString(deliveryId);
        } catch (IllegalArgumentException | NullPointerException e) {
            // 无效消息，直接 ACK 丢弃
            log.warn("Dropping malformed delivery message {}: {}", message.getId(), deliveryId);
            acknowledge(message);
            return;
        }

        log.debug("Received delivery {} from Redis Stream", id);
        worker.process(id);
        acknowledge(message);
    }

    private void acknowledge(MapRecord<String, String, String> message) {
        redisTemplate.opsForStream().acknowledge(
                RedisStreamConfig.STREAM_KEY,
                RedisStreamConfig.GROUP_NAME,
                message.getId());
        log.debug("Message acknowledged: {}", message.getId());
    }
}
