package com.example.webhookdispatch.dto;

import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.model.WebhookDelivery;
import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 投递记录视图。payload 按存储的原始 JSON 输出。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryResponse {
    private UUID id;
    private UUID endpointId;
    private String endpointName;
    private String event;
    @JsonRawValue
    private String payload;
    private DeliveryStatus status;
    private int attemptCount;
    private int maxAttempts;
    private Integer responseStatusCode;
    private String responseBody;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime deliveredAt;
    private LocalDateTime nextRetryAt;

    public static DeliveryResponse from(WebhookDelivery delivery) {
        return DeliveryResponse.builder()
                .id(delivery.getId())
                .endpointId(delivery.getEndpoint().getId())
                .endpointName(delivery.getEndpoint().getName())
                .event(delivery.getEvent())
                .payload(delivery.getPayload())
                .status(delivery.getStatus())
                .attemptCount(delivery.getAttemptCount())
                .maxAttempts(delivery.getMaxAttempts())
                .responseStatusCode(delivery.getResponseStatusCode())
                .responseBody(delivery.getResponseBody())
                .errorMessage(delivery.getErrorMessage())
                .createdAt(delivery.getCreatedAt())
                .deliveredAt(delivery.getDeliveredAt())
                .nextRetryAt(delivery.getNextRetryAt())
                .build();
    }
}
