package com.example.webhookdispatch.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * 用户配置的 Webhook 接收端。
 */
@Entity
@Table(name = "webhook_endpoints", indexes = {
        @Index(name = "idx_endpoint_owner_active", columnList = "ownerId, active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEndpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private Long ownerId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 2048)
    private String url;

    // 出站签名需要明文密钥
    @ToString.Exclude
    @Column(nullable = false, length = 64)
    private String secret;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "webhook_endpoint_events", joinColumns = @JoinColumn(name = "endpoint_id"))
    @Column(name = "event", nullable = false, length = 50)
    private Set<String> events = new HashSet<>();

    @Builder.Default
    private boolean active = true;

    // 连续永久失败次数，任意一次成功归零
    @Builder.Default
    private int failureCount = 0;

    private LocalDateTime lastSuccessAt;

    private LocalDateTime lastFailureAt;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
