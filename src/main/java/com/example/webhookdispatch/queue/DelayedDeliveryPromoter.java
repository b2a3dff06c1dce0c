package com.example.webhookdispatch.queue;

import com.example.webhookdispatch.config.RedisStreamConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

/**
 * 定时任务：把 ZSET 中已到期的延迟投递转入 Stream。
 * 先 ZREM 再入队，多实例同时扫描时只有删除成功的实例会入队。
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "redis")
public class DelayedDeliveryPromoter {

    private static final int MAX_PROMOTE_COUNT = 100;

    private final StringRedisTemplate redisTemplate;
    private final RedisStreamDeliveryQueue deliveryQueue;

    @Scheduled(fixedDelay = 1_000)
    public void promoteDueDeliveries() {
        try {
            Set<String> due = redisTemplate.opsForZSet().rangeByScore(
                    RedisStreamConfig.DELAYED_KEY, 0, System.currentTimeMillis(), 0, MAX_PROMOTE_COUNT);
            if (due == null || due.isEmpty()) {
                return;
            }
            for (String id : due) {
                Long removed = redisTemplate.opsForZSet().remove(RedisStreamConfig.DELAYED_KEY, id);
                if (removed != null && removed > 0) {
                    deliveryQueue.enqueue(UUID.fromString(id));
                }
            }
            log.debug("Promoted {} delayed deliveries", due.size());
        } catch (Exception e) {
            // 已移出 ZSET 但未入队的记录由 RetrySweeperService 按 next_retry_at 补投
            log.error("Error promoting delayed deliveries: {}", e.getMessage(), e);
        }
    }
}
