package com.example.webhookdispatch.repository;

import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.model.WebhookDelivery;
import org.springframework.data.jpa.domain.Specification;

import java.util.UUID;

/**
 * 投递历史查询条件。参数为 null 时不参与过滤。
 */
public final class DeliverySpecifications {

    private DeliverySpecifications() {
    }

    public static Specification<WebhookDelivery> ownedBy(Long ownerId) {
        return (root, query, cb) -> cb.equal(root.get("endpoint").get("ownerId"), ownerId);
    }

    public static Specification<WebhookDelivery> forEndpoint(UUID endpointId) {
        return (root, query, cb) -> endpointId == null ? null
                : cb.equal(root.get("endpoint").get("id"), endpointId);
    }

    public static Specification<WebhookDelivery> withStatus(DeliveryStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<WebhookDelivery> forEvent(String event) {
        return (root, query, cb) -> event == null || event.isBlank() ? null : cb.equal(root.get("event"), event);
    }
}
