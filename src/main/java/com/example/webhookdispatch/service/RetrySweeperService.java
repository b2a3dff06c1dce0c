package com.example.webhookdispatch.service;

import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.model.WebhookDelivery;
import com.example.webhookdispatch.queue.DeliveryQueue;
import com.example.webhookdispatch.repository.WebhookDeliveryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 重试兜底任务：Worker 自己安排的延迟任务丢失时（进程重启、队列故障），
 * 把已到期的 RETRYING 记录和长时间未处理的 PENDING 记录重新入队，并回收崩溃 Worker 遗留的认领。
 * 重复入队是安全的，Worker 的认领保证同一投递不会并发发送。
 */
@Service
@Slf4j
public class RetrySweeperService {

    static final String ABANDONED = "Delivery attempt abandoned";

    private final WebhookDeliveryRepository deliveryRepository;
    private final EndpointRegistryService endpointRegistry;
    private final DeliveryQueue deliveryQueue;
    private final int batchSize;
    private final long pendingGraceMinutes;
    private final long staleClaimMinutes;

    public RetrySweeperService(WebhookDeliveryRepository deliveryRepository,
            EndpointRegistryService endpointRegistry,
            DeliveryQueue deliveryQueue,
            @Value("${app.webhook.sweeper.batch-size:100}") int batchSize,
            @Value("${app.webhook.sweeper.pending-grace-minutes:10}") long pendingGraceMinutes,
            @Value("${app.webhook.sweeper.stale-claim-minutes:5}") long staleClaimMinutes) {
        this.deliveryRepository = deliveryRepository;
        this.endpointRegistry = endpointRegistry;
        this.deliveryQueue = deliveryQueue;
        this.batchSize = batchSize;
        this.pendingGraceMinutes = pendingGraceMinutes;
        this.staleClaimMinutes = staleClaimMinutes;
    }

    /**
     * 定时任务：默认每 5 分钟执行一次
     */
    @Scheduled(fixedDelayString = "${app.webhook.sweeper.interval-ms:300000}",
            initialDelayString = "${app.webhook.sweeper.initial-delay-ms:60000}")
    public void scheduledSweep() {
        try {
            recoverStaleClaims();
            sweepStalePending();
            sweepDueRetries(batchSize);
        } catch (Exception e) {
            log.error("Error during webhook retry sweep: {}", e.getMessage(), e);
        }
    }

    /**
     * 重新入队已到重试时间的 RETRYING 记录。
     *
     * @param limit 本次最多处理条数
     * @return 入队条数
     */
    public int sweepDueRetries(int limit) {
        List<UUID> due = deliveryRepository.findDueRetryIds(DeliveryStatus.RETRYING, LocalDateTime.now(),
                PageRequest.of(0, limit));
        int count = enqueueAll(due);
        if (count > 0) {
            log.info("Queued {} webhook retries", count);
        }
        return count;
    }

    public int sweepDueRetries() {
        return sweepDueRetries(batchSize);
    }

    /**
     * 重新入队创建后超过宽限期仍为 PENDING 的记录（分发时入队失败）。
     *
     * @return 入队条数
     */
    public int sweepStalePending() {
        LocalDateTime createdBefore = LocalDateTime.now().minusMinutes(pendingGraceMinutes);
        List<UUID> stale = deliveryRepository.findStalePendingIds(DeliveryStatus.PENDING, createdBefore,
                PageRequest.of(0, batchSize));
        int count = enqueueAll(stale);
        if (count > 0) {
            log.warn("Re-queued {} webhook deliveries stuck in PENDING", count);
        }
        return count;
    }

    /**
     * 回收认领超时的 IN_PROGRESS 记录：仍有次数的转回 RETRYING（立即到期），否则置为 FAILED。
     *
     * @return 回收条数
     */
    public int recoverStaleClaims() {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime cutoff = now.minusMinutes(staleClaimMinutes);
        List<WebhookDelivery> stale = deliveryRepository.findByStatusAndClaimedAtBefore(
                DeliveryStatus.IN_PROGRESS, cutoff, PageRequest.of(0, batchSize));

        int recovered = 0;
        for (WebhookDelivery delivery : stale) {
            if (delivery.getAttemptCount() < delivery.getMaxAttempts()) {
                recovered += deliveryRepository.releaseStaleClaim(delivery.getId(), DeliveryStatus.IN_PROGRESS,
                        DeliveryStatus.RETRYING, cutoff, now);
            } else if (deliveryRepository.abandonStaleClaim(delivery.getId(), DeliveryStatus.IN_PROGRESS,
                    DeliveryStatus.FAILED, cutoff, ABANDONED) > 0) {
                endpointRegistry.recordFailure(delivery.getEndpoint().getId());
                recovered++;
            }
        }
        if (recovered > 0) {
            log.warn("Recovered {} stale webhook delivery claims", recovered);
        }
        return recovered;
    }

    private int enqueueAll(List<UUID> ids) {
        int count = 0;
        for (UUID id : ids) {
            try {
                deliveryQueue.enqueue(id);
                count++;
            } catch (Exception e) {
                log.error("Failed to re-queue webhook delivery {}", id, e);
            }
        }
        return count;
    }
}
