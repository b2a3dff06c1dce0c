package com.example.webhookdispatch.service;

import com.example.webhookdispatch.exception.ResourceNotFoundException;
import com.example.webhookdispatch.exception.ValidationException;
import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.model.WebhookDelivery;
import com.example.webhookdispatch.queue.DeliveryQueue;
import com.example.webhookdispatch.repository.WebhookDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

import static com.example.webhookdispatch.repository.DeliverySpecifications.forEndpoint;
import static com.example.webhookdispatch.repository.DeliverySpecifications.forEvent;
import static com.example.webhookdispatch.repository.DeliverySpecifications.ownedBy;
import static com.example.webhookdispatch.repository.DeliverySpecifications.withStatus;

/**
 * 投递历史查询与手动重试。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryHistoryService {

    private static final Set<DeliveryStatus> RETRIABLE =
            EnumSet.of(DeliveryStatus.PENDING, DeliveryStatus.RETRYING, DeliveryStatus.FAILED);

    private final WebhookDeliveryRepository deliveryRepository;
    private final DeliveryQueue deliveryQueue;

    /**
     * 按接收端、状态、事件过滤当前用户的投递记录。
     */
    public Page<WebhookDelivery> list(Long ownerId, UUID endpointId, DeliveryStatus status, String event,
            Pageable pageable) {
        Specification<WebhookDelivery> spec = Specification.where(ownedBy(ownerId))
                .and(forEndpoint(endpointId))
                .and(withStatus(status))
                .and(forEvent(event));
        return deliveryRepository.findAll(spec, pageable);
    }

    public WebhookDelivery get(Long ownerId, UUID deliveryId) {
        return deliveryRepository.findById(deliveryId)
                .filter(d -> d.getEndpoint().getOwnerId().equals(ownerId))
                .orElseThrow(() -> new ResourceNotFoundException("Webhook delivery", deliveryId));
    }

    /**
     * 手动重试：尝试次数清零、回到 PENDING 并重新入队。成功或正在发送的记录不允许重试。
     *
     * @return 重置后的记录
     */
    public WebhookDelivery retry(Long ownerId, UUID deliveryId) {
        WebhookDelivery delivery = get(ownerId, deliveryId);
        if (delivery.getStatus() == DeliveryStatus.SUCCESS) {
            throw new ValidationException("Cannot retry successful delivery");
        }
        if (deliveryRepository.resetForRetry(deliveryId, RETRIABLE, DeliveryStatus.PENDING) == 0) {
            throw new ValidationException("Delivery is currently being sent");
        }
        deliveryQueue.enqueue(deliveryId);
        log.info("Webhook {} reset and queued for manual retry", deliveryId);
        return get(ownerId, deliveryId);
    }
}
