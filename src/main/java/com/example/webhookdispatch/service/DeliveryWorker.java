package com.example.webhookdispatch.service;

import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.model.WebhookDelivery;
import com.example.webhookdispatch.model.WebhookEndpoint;
import com.example.webhookdispatch.queue.DeliveryQueue;
import com.example.webhookdispatch.repository.WebhookDeliveryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * 投递执行器：处理一个出队的投递任务，完成一次签名 POST 并推进状态机。
 *
 * <p>状态迁移：PENDING/RETRYING -(认领)-> IN_PROGRESS -> SUCCESS | RETRYING | FAILED。
 * 认领是条件更新，同一投递被队列重复投递或被 RetrySweeperService 重复入队时只有一个 Worker 会发请求。
 * 每次调用最多一次 HTTP 请求，异常不会抛给队列，避免队列自身的重投与这里的重试计数叠加。
 */
@Service
@Slf4j
public class DeliveryWorker {

    static final int RESPONSE_BODY_LIMIT = 1000;
    static final int ERROR_DETAIL_LIMIT = 200;
    static final String ENDPOINT_DISABLED = "Endpoint is disabled";

    private final WebhookDeliveryRepository deliveryRepository;
    private final EndpointRegistryService endpointRegistry;
    private final WebhookSender sender;
    private final DeliveryQueue deliveryQueue;
    private final DeliveryRetryPolicy retryPolicy;
    private final MeterRegistry meterRegistry;
    private final Duration timeout;

    public DeliveryWorker(WebhookDeliveryRepository deliveryRepository,
            EndpointRegistryService endpointRegistry,
            WebhookSender sender,
            DeliveryQueue deliveryQueue,
            DeliveryRetryPolicy retryPolicy,
            MeterRegistry meterRegistry,
            @Value("${app.webhook.timeout-seconds:30}") long timeoutSeconds) {
        this.deliveryRepository = deliveryRepository;
        this.endpointRegistry = endpointRegistry;
        this.sender = sender;
        this.deliveryQueue = deliveryQueue;
        this.retryPolicy = retryPolicy;
        this.meterRegistry = meterRegistry;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * 处理一个投递任务。
     *
     * @param deliveryId 投递记录 ID
     */
    public void process(UUID deliveryId) {
        try {
            doProcess(deliveryId);
        } catch (Exception e) {
            // 认领后崩溃的记录停留在 IN_PROGRESS，由 RetrySweeperService 回收
            log.error("Unexpected error while processing webhook delivery {}", deliveryId, e);
        }
    }

    private void doProcess(UUID deliveryId) {
        Optional<WebhookDelivery> found = deliveryRepository.findById(deliveryId);
        if (found.isEmpty()) {
            log.error("WebhookDelivery {} not found", deliveryId);
            return;
        }
        WebhookDelivery delivery = found.get();

        if (delivery.getStatus() == DeliveryStatus.SUCCESS) {
            log.info("Webhook {} already delivered, skipping", deliveryId);
            return;
        }

        WebhookEndpoint endpoint = delivery.getEndpoint();
        if (!endpoint.isActive()) {
            if (deliveryRepository.failUnclaimed(deliveryId, ENDPOINT_DISABLED) > 0) {
                count("disabled");
                log.info("Webhook {} skipped - endpoint disabled", deliveryId);
            }
            return;
        }

        if (deliveryRepository.claim(deliveryId, LocalDateTime.now()) == 0) {
            log.info("Webhook {} not claimable (status {}), skipping", deliveryId, delivery.getStatus());
            return;
        }

        // 重新加载认领后的记录（attemptCount 已加一）
        WebhookDelivery claimed = deliveryRepository.findById(deliveryId).orElseThrow();
        attempt(claimed, endpoint);
    }

    private void attempt(WebhookDelivery delivery, WebhookEndpoint endpoint) {
        try {
            WebhookSender.SendResult result = sender.send(endpoint.getUrl(), delivery.getEvent(),
                    delivery.getId().toString(), delivery.getPayload(), endpoint.getSecret(), timeout);

            delivery.setResponseStatusCode(result.statusCode());
            delivery.setResponseBody(truncate(result.body(), RESPONSE_BODY_LIMIT));

            if (result.isSuccess()) {
                markSuccess(delivery);
                return;
            }
            delivery.setErrorMessage("HTTP " + result.statusCode() + ": " + truncate(result.body(), ERROR_DETAIL_LIMIT));
        } catch (HttpTimeoutException e) {
            delivery.setErrorMessage(truncate("Timeout: " + e.getMessage(), RESPONSE_BODY_LIMIT));
        } catch (IOException e) {
            delivery.setErrorMessage(truncate("Request error: " + e.getMessage(), RESPONSE_BODY_LIMIT));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            delivery.setErrorMessage("Unexpected error: interrupted");
        } catch (RuntimeException e) {
            log.error("Webhook delivery {} failed unexpectedly", delivery.getId(), e);
            delivery.setErrorMessage(truncate("Unexpected error: " + e.getMessage(), RESPONSE_BODY_LIMIT));
        }
        handleFailure(delivery);
    }

    private void markSuccess(WebhookDelivery delivery) {
        delivery.setStatus(DeliveryStatus.SUCCESS);
        delivery.setDeliveredAt(LocalDateTime.now());
        delivery.setNextRetryAt(null);
        delivery.setErrorMessage(null);
        delivery.setClaimedAt(null);
        deliveryRepository.save(delivery);

        endpointRegistry.recordSuccess(delivery.getEndpoint().getId());
        count("success");
        log.info("Webhook {} delivered successfully", delivery.getId());
    }

    private void handleFailure(WebhookDelivery delivery) {
        delivery.setClaimedAt(null);
        if (retryPolicy.hasAttemptsLeft(delivery.getAttemptCount(), delivery.getMaxAttempts())) {
            Duration delay = retryPolicy.delayFor(delivery.getAttemptCount());
            delivery.setStatus(DeliveryStatus.RETRYING);
            delivery.setNextRetryAt(LocalDateTime.now().plus(delay));
            deliveryRepository.save(delivery);

            deliveryQueue.enqueueDelayed(delivery.getId(), delay);
            count("retrying");
            log.warn("Webhook {} failed, retry {}/{} scheduled in {}s: {}", delivery.getId(),
                    delivery.getAttemptCount(), delivery.getMaxAttempts(), delay.toSeconds(),
                    delivery.getErrorMessage());
        } else {
            delivery.setStatus(DeliveryStatus.FAILED);
            delivery.setNextRetryAt(null);
            deliveryRepository.save(delivery);

            endpointRegistry.recordFailure(delivery.getEndpoint().getId());
            count("failed");
            log.error("Webhook {} permanently failed after {} attempts: {}", delivery.getId(),
                    delivery.getAttemptCount(), delivery.getErrorMessage());
        }
    }

    private void count(String outcome) {
        meterRegistry.counter("webhook.deliveries", "outcome", outcome).increment();
    }

    static String truncate(String value, int limit) {
        if (value == null) {
            return null;
        }
        return value.length() <= limit ? value : value.substring(0, limit);
    }
}
