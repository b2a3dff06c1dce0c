package com.example.webhookdispatch.service;

import com.example.webhookdispatch.exception.ValidationException;
import com.example.webhookdispatch.model.CleanupConfig;
import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.repository.CleanupConfigRepository;
import com.example.webhookdispatch.repository.WebhookDeliveryRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 投递记录保留期清理：只删除终态（SUCCESS / FAILED）记录。
 * 长时间停留在 PENDING / RETRYING 的记录说明有问题，保留以便排查。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CleanupSchedulerService {

    public static final int DEFAULT_RETENTION_DAYS = 30;

    private final CleanupConfigRepository configRepository;
    private final WebhookDeliveryRepository deliveryRepository;

    /**
     * 初始化默认配置
     */
    @PostConstruct
    public void initDefaultConfig() {
        if (configRepository.count() == 0) {
            configRepository.save(defaultConfig());
            log.info("Initialized default delivery cleanup config: retentionDays={}, enabled=true",
                    DEFAULT_RETENTION_DAYS);
        }
    }

    /**
     * 定时任务：每天凌晨 2 点执行清理
     */
    @Scheduled(cron = "${app.webhook.cleanup.cron:0 0 2 * * ?}")
    @Transactional
    public void scheduledCleanup() {
        log.info("Scheduled delivery cleanup triggered");
        runCleanup();
    }

    /**
     * 按当前配置执行清理（定时任务与手动触发共用）
     */
    @Transactional
    public CleanupResult runCleanup() {
        CleanupConfig config = getConfig();

        if (!config.getEnabled()) {
            log.info("Delivery cleanup is disabled, skipping");
            return new CleanupResult(false, 0L, "Cleanup is disabled");
        }

        long deleted = cleanup(config.getRetentionDays());

        config.setLastRunAt(LocalDateTime.now());
        config.setLastCleanupCount(deleted);
        configRepository.save(config);

        return new CleanupResult(true, deleted, "Successfully deleted " + deleted + " deliveries");
    }

    /**
     * 删除创建时间早于 olderThanDays 天的终态投递记录。
     *
     * @param olderThanDays 保留天数
     * @return 删除记录数
     */
    @Transactional
    public long cleanup(int olderThanDays) {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(olderThanDays);
        log.info("Starting delivery cleanup: deleting terminal deliveries older than {} ({} days)",
                cutoff, olderThanDays);

        int deleted = deliveryRepository.deleteByStatusInAndCreatedAtBefore(DeliveryStatus.TERMINAL, cutoff);

        log.info("Cleaned up {} old webhook deliveries", deleted);
        return deleted;
    }

    public long cleanup() {
        return cleanup(DEFAULT_RETENTION_DAYS);
    }

    /**
     * 获取当前配置（如果不存在则创建默认配置）
     */
    public CleanupConfig getConfig() {
        return configRepository.findAll().stream()
                .findFirst()
                .orElseGet(() -> configRepository.save(defaultConfig()));
    }

    /**
     * 更新配置
     */
    @Transactional
    public CleanupConfig updateConfig(Integer retentionDays, Boolean enabled) {
        if (retentionDays == null || retentionDays < 1) {
            throw new ValidationException("retentionDays must be a positive number of days");
        }
        if (enabled == null) {
            throw new ValidationException("enabled is required");
        }
        CleanupConfig config = getConfig();
        config.setRetentionDays(retentionDays);
        config.setEnabled(enabled);
        config.setUpdatedAt(LocalDateTime.now());
        return configRepository.save(config);
    }

    private CleanupConfig defaultConfig() {
        return CleanupConfig.builder()
                .retentionDays(DEFAULT_RETENTION_DAYS)
                .enabled(true)
                .updatedAt(LocalDateTime.now())
                .build();
    }

    public record CleanupResult(boolean executed, Long deletedCount, String message) {
    }
}
