package com.example.webhookdispatch.repository;

import com.example.webhookdispatch.model.WebhookEndpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Webhook 接收端仓储接口。
 */
@Repository
public interface WebhookEndpointRepository extends JpaRepository<WebhookEndpoint, UUID> {

    /**
     * 查询可接收指定事件的接收端：属于该用户、已启用、失败次数未达阈值且订阅了该事件。
     * 这是分发的唯一入口条件。
     *
     * @param ownerId   用户 ID
     * @param event     事件名
     * @param threshold 自动停用阈值
     * @return 接收端列表
     */
    @Query("SELECT e FROM WebhookEndpoint e WHERE e.ownerId = :ownerId AND e.active = true "
            + "AND e.failureCount < :threshold AND :event MEMBER OF e.events")
    List<WebhookEndpoint> findActiveSubscribers(@Param("ownerId") Long ownerId,
                                                @Param("event") String event,
                                                @Param("threshold") int threshold);

    List<WebhookEndpoint> findByOwnerIdOrderByCreatedAtDesc(Long ownerId);

    Optional<WebhookEndpoint> findByIdAndOwnerId(UUID id, Long ownerId);

    /**
     * 投递成功：失败计数归零（原子更新，不依赖内存中的旧值）。
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEndpoint e SET e.failureCount = 0, e.lastSuccessAt = :now WHERE e.id = :id")
    int markSuccess(@Param("id") UUID id, @Param("now") LocalDateTime now);

    /**
     * 永久失败：失败计数原子加一。
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WebhookEndpoint e SET e.failureCount = e.failureCount + 1, e.lastFailureAt = :now WHERE e.id = :id")
    int markFailure(@Param("id") UUID id, @Param("now") LocalDateTime now);
}
