package com.example.webhookdispatch.dto;

import com.example.webhookdispatch.model.WebhookEndpoint;
import com.example.webhookdispatch.service.EndpointRegistryService;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 接收端视图。密钥只在创建时返回一次，其余场景为 null 并被省略。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EndpointResponse {
    private UUID id;
    private String name;
    private String url;
    private List<String> events;
    private boolean active;
    private int failureCount;
    private LocalDateTime lastSuccessAt;
    private LocalDateTime lastFailureAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private String secret;
    private EndpointRegistryService.DeliveryStats stats;

    public static EndpointResponse from(WebhookEndpoint endpoint) {
        List<String> events = new ArrayList<>(endpoint.getEvents());
        Collections.sort(events);
        return EndpointResponse.builder()
                .id(endpoint.getId())
                .name(endpoint.getName())
                .url(endpoint.getUrl())
                .events(events)
                .active(endpoint.isActive())
                .failureCount(endpoint.getFailureCount())
                .lastSuccessAt(endpoint.getLastSuccessAt())
                .lastFailureAt(endpoint.getLastFailureAt())
                .createdAt(endpoint.getCreatedAt())
                .updatedAt(endpoint.getUpdatedAt())
                .build();
    }

    public static EndpointResponse withSecret(WebhookEndpoint endpoint) {
        EndpointResponse response = from(endpoint);
        response.setSecret(endpoint.getSecret());
        return response;
    }
}
