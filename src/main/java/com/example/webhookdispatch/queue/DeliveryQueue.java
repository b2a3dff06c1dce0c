package com.example.webhookdispatch.queue;

import java.time.Duration;
import java.util.UUID;

/**
 * 投递任务队列。任务只携带投递记录 ID，至少一次语义：同一 ID 可能被多次取出，
 * 重复执行由 {@link com.example.webhookdispatch.service.DeliveryWorker} 的认领保证幂等。
 */
public interface DeliveryQueue {

    /**
     * 立即入队。
     *
     * @param deliveryId 投递记录 ID
     */
    void enqueue(UUID deliveryId);

    /**
     * 延迟入队，用于重试退避。
     *
     * @param deliveryId 投递记录 ID
     * @param delay      延迟时长
     */
    void enqueueDelayed(UUID deliveryId, Duration delay);
}
