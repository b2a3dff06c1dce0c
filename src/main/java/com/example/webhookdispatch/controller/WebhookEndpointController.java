package com.example.webhookdispatch.controller;

import com.example.webhookdispatch.dto.EndpointRequest;
import com.example.webhookdispatch.dto.EndpointResponse;
import com.example.webhookdispatch.model.WebhookEndpoint;
import com.example.webhookdispatch.model.WebhookEventType;
import com.example.webhookdispatch.service.EndpointRegistryService;
import com.example.webhookdispatch.service.WebhookTestService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 接收端管理接口。调用方身份由上游网关通过 X-Owner-Id 传入。
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookEndpointController {

    public static final String OWNER_HEADER = "X-Owner-Id";

    private final EndpointRegistryService endpointRegistry;
    private final WebhookTestService testService;

    /**
     * 可订阅事件目录
     */
    @GetMapping("/events")
    public List<Map<String, String>> events() {
        return Arrays.stream(WebhookEventType.values())
                .map(type -> {
                    Map<String, String> item = new LinkedHashMap<>();
                    item.put("event", type.getValue());
                    item.put("description", type.getDescription());
                    return item;
                })
                .toList();
    }

    @GetMapping("/endpoints")
    public List<EndpointResponse> list(@RequestHeader(OWNER_HEADER) Long ownerId) {
        return endpointRegistry.list(ownerId).stream()
                .map(endpoint -> {
                    EndpointResponse response = EndpointResponse.from(endpoint);
                    response.setStats(endpointRegistry.deliveryStats(endpoint.getId()));
                    return response;
                })
                .toList();
    }

    /**
     * 创建接收端，响应中包含密钥（仅此一次）
     */
    @PostMapping("/endpoints")
    public ResponseEntity<EndpointResponse> create(@RequestHeader(OWNER_HEADER) Long ownerId,
            @RequestBody EndpointRequest request) {
        WebhookEndpoint created = endpointRegistry.create(ownerId, request.getName(), request.getUrl(),
                request.getEvents(), request.getSecret());
        return ResponseEntity.status(HttpStatus.CREATED).body(EndpointResponse.withSecret(created));
    }

    @GetMapping("/endpoints/{id}")
    public EndpointResponse get(@RequestHeader(OWNER_HEADER) Long ownerId, @PathVariable UUID id) {
        EndpointResponse response = EndpointResponse.from(endpointRegistry.get(ownerId, id));
        response.setStats(endpointRegistry.deliveryStats(id));
        return response;
    }

    @PatchMapping("/endpoints/{id}")
    public EndpointResponse update(@RequestHeader(OWNER_HEADER) Long ownerId, @PathVariable UUID id,
            @RequestBody EndpointRequest request) {
        WebhookEndpoint updated = endpointRegistry.update(ownerId, id, request.getName(), request.getUrl(),
                request.getEvents(), request.getActive());
        return EndpointResponse.from(updated);
    }

    @DeleteMapping("/endpoints/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(OWNER_HEADER) Long ownerId, @PathVariable UUID id) {
        endpointRegistry.delete(ownerId, id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/endpoints/{id}/regenerate-secret")
    public Map<String, String> regenerateSecret(@RequestHeader(OWNER_HEADER) Long ownerId,
            @PathVariable UUID id) {
        return Map.of("secret", endpointRegistry.regenerateSecret(ownerId, id));
    }

    /**
     * 同步发送测试事件，接收端未返回 2xx 时响应 400
     */
    @PostMapping("/endpoints/{id}/test")
    public ResponseEntity<WebhookTestService.TestDeliveryResult> test(@RequestHeader(OWNER_HEADER) Long ownerId,
            @PathVariable UUID id,
            @RequestBody(required = false) Map<String, String> request) {
        String event = request != null ? request.get("event") : null;
        WebhookTestService.TestDeliveryResult result = testService.sendTest(ownerId, id, event);
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }
}
