package com.example.webhookdispatch.service;

import com.example.webhookdispatch.exception.ValidationException;
import com.example.webhookdispatch.model.WebhookEndpoint;
import com.example.webhookdispatch.model.WebhookEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 测试投递：同步发送一次模拟事件，不写投递记录、不重试，结果直接返回给调用方。
 */
@Service
@Slf4j
public class WebhookTestService {

    static final String TEST_DELIVERY_ID = "test";
    static final int RESPONSE_LIMIT = 500;

    private final EndpointRegistryService endpointRegistry;
    private final WebhookSender sender;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public WebhookTestService(EndpointRegistryService endpointRegistry,
            WebhookSender sender,
            ObjectMapper objectMapper,
            @Value("${app.webhook.test-timeout-seconds:10}") long timeoutSeconds) {
        this.endpointRegistry = endpointRegistry;
        this.sender = sender;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * 向接收端发送测试事件。
     *
     * @param ownerId    所属用户
     * @param endpointId 接收端 ID
     * @param event      模拟的事件名，为空时使用 application.created
     * @return 测试结果
     */
    public TestDeliveryResult sendTest(Long ownerId, UUID endpointId, String event) {
        String baseEvent = event == null || event.isBlank() ? WebhookEventType.APPLICATION_CREATED.getValue() : event;
        if (!WebhookEventType.isKnown(baseEvent)) {
            throw new ValidationException("Unknown event: " + baseEvent);
        }
        WebhookEndpoint endpoint = endpointRegistry.get(ownerId, endpointId);
        String testEvent = baseEvent + ".test";

        try {
            WebhookSender.SendResult result = sender.send(endpoint.getUrl(), testEvent, TEST_DELIVERY_ID,
                    buildPayload(testEvent, endpoint), endpoint.getSecret(), timeout);
            log.info("Test webhook to endpoint {} returned HTTP {}", endpointId, result.statusCode());
            return new TestDeliveryResult(result.isSuccess(), result.statusCode(),
                    DeliveryWorker.truncate(result.body(), RESPONSE_LIMIT), null);
        } catch (HttpTimeoutException e) {
            return new TestDeliveryResult(false, null, null, "Request timed out");
        } catch (IOException e) {
            return new TestDeliveryResult(false, null, null, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new TestDeliveryResult(false, null, null, "Interrupted");
        }
    }

    private String buildPayload(String testEvent, WebhookEndpoint endpoint) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "This is a test webhook from Job Application Tracker");
        data.put("endpoint_id", endpoint.getId().toString());
        data.put("endpoint_name", endpoint.getName());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", testEvent);
        payload.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC).toString());
        payload.put("data", data);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize test payload", e);
        }
    }

    /**
     * 测试投递结果
     */
    public record TestDeliveryResult(boolean success, Integer statusCode, String response, String error) {
    }
}
