package com.example.webhookdispatch.service;

import com.example.webhookdispatch.exception.ResourceNotFoundException;
import com.example.webhookdispatch.exception.ValidationException;
import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.model.WebhookEndpoint;
import com.example.webhookdispatch.model.WebhookEventType;
import com.example.webhookdispatch.repository.WebhookDeliveryRepository;
import com.example.webhookdispatch.repository.WebhookEndpointRepository;
import com.example.webhookdispatch.utils.UrlValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * 接收端注册表：增删改查、密钥轮换、分发筛选与失败计数。
 */
@Service
@Slf4j
public class EndpointRegistryService {

    public static final int DEFAULT_AUTO_DISABLE_THRESHOLD = 10;

    private static final int SECRET_BYTES = 32;
    private static final int MAX_NAME_LENGTH = 100;
    private static final int MIN_SECRET_LENGTH = 32;
    private static final int MAX_SECRET_LENGTH = 64;

    private final WebhookEndpointRepository endpointRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final UrlValidator urlValidator;
    private final int autoDisableThreshold;
    private final SecureRandom random = new SecureRandom();

    public EndpointRegistryService(WebhookEndpointRepository endpointRepository,
            WebhookDeliveryRepository deliveryRepository,
            UrlValidator urlValidator,
            @Value("${app.webhook.auto-disable-threshold:10}") int autoDisableThreshold) {
        this.endpointRepository = endpointRepository;
        this.deliveryRepository = deliveryRepository;
        this.urlValidator = urlValidator;
        this.autoDisableThreshold = autoDisableThreshold;
    }

    /**
     * 创建接收端，未提供密钥时生成 32 字节随机密钥。
     *
     * @throws ValidationException URL 非法、事件为空或包含未知事件、密钥长度不在 32~64 之间
     */
    @Transactional
    public WebhookEndpoint create(Long ownerId, String name, String url, Collection<String> events, String secret) {
        validateName(name);
        validateUrl(url);
        Set<String> validatedEvents = validateEvents(events);
        if (secret != null) {
            validateSecret(secret);
        }

        WebhookEndpoint endpoint = WebhookEndpoint.builder()
                .ownerId(ownerId)
                .name(name.trim())
                .url(url.trim())
                .events(validatedEvents)
                .secret(secret == null ? generateSecret() : secret)
                .active(true)
                .build();
        WebhookEndpoint saved = endpointRepository.save(endpoint);
        log.info("Created webhook endpoint {} for owner {} with events {}", saved.getId(), ownerId, validatedEvents);
        return saved;
    }

    public WebhookEndpoint create(Long ownerId, String name, String url, Collection<String> events) {
        return create(ownerId, name, url, events, null);
    }

    /**
     * 部分更新，null 字段保持不变。
     */
    @Transactional
    public WebhookEndpoint update(Long ownerId, UUID id, String name, String url, Collection<String> events,
            Boolean active) {
        WebhookEndpoint endpoint = get(ownerId, id);
        if (name != null) {
            validateName(name);
            endpoint.setName(name.trim());
        }
        if (url != null) {
            validateUrl(url);
            endpoint.setUrl(url.trim());
        }
        if (events != null) {
            endpoint.setEvents(validateEvents(events));
        }
        if (active != null) {
            endpoint.setActive(active);
        }
        return endpointRepository.save(endpoint);
    }

    /**
     * 删除接收端，其投递记录级联删除。
     */
    @Transactional
    public void delete(Long ownerId, UUID id) {
        WebhookEndpoint endpoint = get(ownerId, id);
        int deliveries = deliveryRepository.deleteByEndpointId(endpoint.getId());
        endpointRepository.deleteById(endpoint.getId());
        log.info("Deleted webhook endpoint {} and {} deliveries", id, deliveries);
    }

    public WebhookEndpoint get(Long ownerId, UUID id) {
        return endpointRepository.findByIdAndOwnerId(id, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook endpoint", id));
    }

    public List<WebhookEndpoint> list(Long ownerId) {
        return endpointRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    /**
     * 轮换密钥。新密钥只在此处返回一次，接收方需要同步更新。
     *
     * @return 新密钥
     */
    @Transactional
    public String regenerateSecret(Long ownerId, UUID id) {
        WebhookEndpoint endpoint = get(ownerId, id);
        String secret = generateSecret();
        endpoint.setSecret(secret);
        endpointRepository.save(endpoint);
        log.info("Regenerated secret for webhook endpoint {}", id);
        return secret;
    }

    /**
     * 分发筛选：属于该用户、已启用、失败次数低于阈值且订阅了该事件。
     */
    public List<WebhookEndpoint> listActiveSubscribers(String eventName, Long ownerId) {
        return endpointRepository.findActiveSubscribers(ownerId, eventName, autoDisableThreshold);
    }

    public void recordSuccess(UUID endpointId) {
        endpointRepository.markSuccess(endpointId, LocalDateTime.now());
    }

    public void recordFailure(UUID endpointId) {
        endpointRepository.markFailure(endpointId, LocalDateTime.now());
    }

    /**
     * 最近 24 小时投递统计。
     */
    public DeliveryStats deliveryStats(UUID endpointId) {
        long total = 0;
        long successful = 0;
        long failed = 0;
        for (Object[] row : deliveryRepository.countByStatusSince(endpointId, LocalDateTime.now().minusHours(24))) {
            DeliveryStatus status = (DeliveryStatus) row[0];
            long count = ((Number) row[1]).longValue();
            total += count;
            if (status == DeliveryStatus.SUCCESS) {
                successful = count;
            } else if (status == DeliveryStatus.FAILED) {
                failed = count;
            }
        }
        return new DeliveryStats(total, successful, failed);
    }

    public int getAutoDisableThreshold() {
        return autoDisableThreshold;
    }

    private String generateSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Name must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }

    private void validateSecret(String secret) {
        if (secret.length() < MIN_SECRET_LENGTH || secret.length() > MAX_SECRET_LENGTH) {
            throw new ValidationException("Secret must be between " + MIN_SECRET_LENGTH + " and "
                    + MAX_SECRET_LENGTH + " characters");
        }
        if (secret.chars().anyMatch(Character::isWhitespace)) {
            throw new ValidationException("Secret must not contain whitespace");
        }
    }

    private void validateUrl(String url) {
        try {
            urlValidator.validate(url);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid URL: " + e.getMessage());
        }
    }

    private Set<String> validateEvents(Collection<String> events) {
        if (events == null || events.isEmpty()) {
            throw new ValidationException("At least one event is required");
        }
        Set<String> result = new LinkedHashSet<>();
        for (String event : events) {
            if (!WebhookEventType.isKnown(event)) {
                throw new ValidationException("Unknown event: " + event);
            }
            result.add(event);
        }
        return result;
    }

    /**
     * 24 小时投递统计
     */
    public record DeliveryStats(long total24h, long successful24h, long failed24h) {
    }
}
