package com.example.webhookdispatch.repository;

import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.model.WebhookDelivery;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * 投递记录仓储接口。
 * 所有状态迁移都用带条件的 UPDATE 完成，保证多个 Worker 并发时只有一个能生效。
 */
@Repository
public interface WebhookDeliveryRepository
                extends JpaRepository<WebhookDelivery, UUID>, JpaSpecificationExecutor<WebhookDelivery> {

        /**
         * 认领一次投递：仅当状态在 claimable 中且尚有剩余次数时转为 IN_PROGRESS 并累加尝试次数。
         *
         * @return 1 表示认领成功，0 表示已被其他 Worker 认领或状态不允许
         */
        @Transactional
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Query("UPDATE WebhookDelivery d SET d.status = :claimed, d.attemptCount = d.attemptCount + 1, "
                        + "d.claimedAt = :now, d.nextRetryAt = NULL "
                        + "WHERE d.id = :id AND d.status IN :claimable AND d.attemptCount < d.maxAttempts")
        int claim(@Param("id") UUID id,
                  @Param("claimable") Collection<DeliveryStatus> claimable,
                  @Param("claimed") DeliveryStatus claimed,
                  @Param("now") LocalDateTime now);

        default int claim(UUID id, LocalDateTime now) {
                return claim(id, DeliveryStatus.CLAIMABLE, DeliveryStatus.IN_PROGRESS, now);
        }

        /**
         * 接收端已停用：直接置为 FAILED，不安排重试。
         */
        @Transactional
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Query("UPDATE WebhookDelivery d SET d.status = :failed, d.errorMessage = :message, d.nextRetryAt = NULL "
                        + "WHERE d.id = :id AND d.status IN :claimable")
        int failUnclaimed(@Param("id") UUID id,
                          @Param("claimable") Collection<DeliveryStatus> claimable,
                          @Param("failed") DeliveryStatus failed,
                          @Param("message") String message);

        default int failUnclaimed(UUID id, String message) {
                return failUnclaimed(id, DeliveryStatus.CLAIMABLE, DeliveryStatus.FAILED, message);
        }

        /**
         * 手动重试：重置尝试次数、清空上次尝试的响应与错误并回到 PENDING。
         */
        @Transactional
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Query("UPDATE WebhookDelivery d SET d.status = :pending, d.attemptCount = 0, d.errorMessage = NULL, "
                        + "d.responseStatusCode = NULL, d.responseBody = NULL, "
                        + "d.nextRetryAt = NULL, d.claimedAt = NULL WHERE d.id = :id AND d.status IN :resettable")
        int resetForRetry(@Param("id") UUID id,
                          @Param("resettable") Collection<DeliveryStatus> resettable,
                          @Param("pending") DeliveryStatus pending);

        /**
         * 回收过期认领：仍有剩余次数的记录转回 RETRYING，立即到期。
         */
        @Transactional
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Query("UPDATE WebhookDelivery d SET d.status = :retrying, d.nextRetryAt = :now, d.claimedAt = NULL "
                        + "WHERE d.id = :id AND d.status = :claimed AND d.claimedAt < :cutoff")
        int releaseStaleClaim(@Param("id") UUID id,
                              @Param("claimed") DeliveryStatus claimed,
                              @Param("retrying") DeliveryStatus retrying,
                              @Param("cutoff") LocalDateTime cutoff,
                              @Param("now") LocalDateTime now);

        /**
         * 回收过期认领：次数已用完的记录直接置为 FAILED。
         */
        @Transactional
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Query("UPDATE WebhookDelivery d SET d.status = :failed, d.errorMessage = :message, d.claimedAt = NULL "
                        + "WHERE d.id = :id AND d.status = :claimed AND d.claimedAt < :cutoff")
        int abandonStaleClaim(@Param("id") UUID id,
                              @Param("claimed") DeliveryStatus claimed,
                              @Param("failed") DeliveryStatus failed,
                              @Param("cutoff") LocalDateTime cutoff,
                              @Param("message") String message);

        /**
         * 查询已到重试时间的记录 ID，按到期时间升序。
         */
        @Query("SELECT d.id FROM WebhookDelivery d WHERE d.status = :status AND d.nextRetryAt <= :now "
                        + "ORDER BY d.nextRetryAt ASC")
        List<UUID> findDueRetryIds(@Param("status") DeliveryStatus status,
                                   @Param("now") LocalDateTime now,
                                   Pageable pageable);

        /**
         * 查询创建后一直未被处理的 PENDING 记录 ID（入队丢失）。
         */
        @Query("SELECT d.id FROM WebhookDelivery d WHERE d.status = :status AND d.createdAt < :createdBefore "
                        + "ORDER BY d.createdAt ASC")
        List<UUID> findStalePendingIds(@Param("status") DeliveryStatus status,
                                       @Param("createdBefore") LocalDateTime createdBefore,
                                       Pageable pageable);

        List<WebhookDelivery> findByStatusAndClaimedAtBefore(DeliveryStatus status, LocalDateTime cutoff,
                                                             Pageable pageable);

        /**
         * 删除指定时间之前创建的终态记录
         *
         * @param statuses 终态集合
         * @param cutoff   截止时间
         * @return 删除记录数
         */
        @Transactional
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Query("DELETE FROM WebhookDelivery d WHERE d.status IN :statuses AND d.createdAt < :cutoff")
        int deleteByStatusInAndCreatedAtBefore(@Param("statuses") Collection<DeliveryStatus> statuses,
                                               @Param("cutoff") LocalDateTime cutoff);

        @Transactional
        @Modifying(clearAutomatically = true, flushAutomatically = true)
        @Query("DELETE FROM WebhookDelivery d WHERE d.endpoint.id = :endpointId")
        int deleteByEndpointId(@Param("endpointId") UUID endpointId);

        /**
         * 按状态统计某接收端在指定时间之后的投递数
         *
         * @return 每行为 [DeliveryStatus, Long]
         */
        @Query("SELECT d.status, COUNT(d) FROM WebhookDelivery d WHERE d.endpoint.id = :endpointId "
                        + "AND d.createdAt >= :since GROUP BY d.status")
        List<Object[]> countByStatusSince(@Param("endpointId") UUID endpointId,
                                          @Param("since") LocalDateTime since);
}
