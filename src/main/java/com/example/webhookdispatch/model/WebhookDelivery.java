package com.example.webhookdispatch.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 一次事件到一个接收端的投递记录（含全部尝试）。
 * payload 在分发时序列化后写入，之后不再修改，签名与发送都基于这份原始文本。
 */
@Entity
@Table(name = "webhook_deliveries", indexes = {
        @Index(name = "idx_delivery_status_retry", columnList = "status, nextRetryAt"),
        @Index(name = "idx_delivery_endpoint_created", columnList = "endpoint_id, createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDelivery {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "endpoint_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private WebhookEndpoint endpoint;

    @Column(nullable = false, length = 50)
    private String event;

    @ToString.Exclude
    @Column(nullable = false, columnDefinition = "TEXT", updatable = false)
    private String payload;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeliveryStatus status = DeliveryStatus.PENDING;

    @Builder.Default
    private int attemptCount = 0;

    @Builder.Default
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    private Integer responseStatusCode;

    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String responseBody;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private LocalDateTime createdAt;

    // 仅 SUCCESS 时有值
    private LocalDateTime deliveredAt;

    // 仅 RETRYING 时有值
    private LocalDateTime nextRetryAt;

    // 进入 IN_PROGRESS 的时间，用于回收崩溃 Worker 遗留的认领
    private LocalDateTime claimedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
