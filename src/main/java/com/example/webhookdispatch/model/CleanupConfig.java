package com.example.webhookdispatch.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

/**
 * 投递记录保留期配置（单行）。
 */
@Entity
@Table(name = "delivery_cleanup_config")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupConfig {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 终态投递记录保留天数
     */
    @Builder.Default
    private Integer retentionDays = 30;

    /**
     * 是否启用定时清理
     */
    @Builder.Default
    private Boolean enabled = true;

    /**
     * 上次执行时间
     */
    private LocalDateTime lastRunAt;

    /**
     * 上次删除的记录数
     */
    @Builder.Default
    private Long lastCleanupCount = 0L;

    private LocalDateTime updatedAt;
}
