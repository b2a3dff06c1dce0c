package com.example.webhookdispatch.service;

import com.example.webhookdispatch.model.WebhookDelivery;
import com.example.webhookdispatch.model.WebhookEndpoint;
import com.example.webhookdispatch.queue.DeliveryQueue;
import com.example.webhookdispatch.repository.WebhookDeliveryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 事件分发：为每个匹配的接收端创建一条 PENDING 投递记录并入队。
 * 记录创建是同步的，网络发送是异步的；本类从不向调用方抛出异常。
 * 查询与写入都在独立事务（REQUIRES_NEW）中执行：记录在入队前已提交，Worker 一定能读到；
 * 写入失败也不会把调用方的事务标记为 rollback-only。
 */
@Service
@Slf4j
public class WebhookDispatcher {

    private final EndpointRegistryService endpointRegistry;
    private final WebhookDeliveryRepository deliveryRepository;
    private final DeliveryQueue deliveryQueue;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNew;
    private final int maxAttempts;

    public WebhookDispatcher(EndpointRegistryService endpointRegistry,
            WebhookDeliveryRepository deliveryRepository,
            DeliveryQueue deliveryQueue,
            ObjectMapper objectMapper,
            PlatformTransactionManager transactionManager,
            @Value("${app.webhook.max-attempts:3}") int maxAttempts) {
        this.endpointRegistry = endpointRegistry;
        this.deliveryRepository = deliveryRepository;
        this.deliveryQueue = deliveryQueue;
        this.objectMapper = objectMapper;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.maxAttempts = maxAttempts;
    }

    /**
     * 分发事件给该用户所有订阅了此事件的接收端。
     *
     * @param eventName 事件名，如 application.created
     * @param data      事件数据
     * @param ownerId   接收端所属用户
     * @return 成功入队的投递数
     */
    public int dispatch(String eventName, Map<String, Object> data, Long ownerId) {
        List<WebhookEndpoint> endpoints;
        try {
            endpoints = requiresNew.execute(status -> endpointRegistry.listActiveSubscribers(eventName, ownerId));
        } catch (Exception e) {
            log.error("Failed to load webhook subscribers for event {} (owner {})", eventName, ownerId, e);
            return 0;
        }

        int queued = 0;
        for (WebhookEndpoint endpoint : endpoints) {
            try {
                String payload = buildPayload(eventName, data);
                WebhookDelivery delivery = requiresNew.execute(status -> deliveryRepository.save(
                        WebhookDelivery.builder()
                                .endpoint(endpoint)
                                .event(eventName)
                                .payload(payload)
                                .maxAttempts(maxAttempts)
                                .build()));

                // 入队失败时记录仍为 PENDING，由 RetrySweeperService 补投
                deliveryQueue.enqueue(delivery.getId());
                queued++;
                log.info("Queued webhook delivery {} for {} to {}", delivery.getId(), eventName, endpoint.getName());
            } catch (Exception e) {
                log.error("Failed to queue webhook {} for endpoint {}", eventName, endpoint.getId(), e);
            }
        }
        return queued;
    }

    private String buildPayload(String eventName, Map<String, Object> data) throws JsonProcessingException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", eventName);
        payload.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC).toString());
        payload.put("data", data == null ? Collections.emptyMap() : data);
        return objectMapper.writeValueAsString(payload);
    }
}
