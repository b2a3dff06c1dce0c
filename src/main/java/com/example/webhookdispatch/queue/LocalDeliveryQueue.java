package com.example.webhookdispatch.queue;

import com.example.webhookdispatch.service.DeliveryWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Lazy;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * 单实例模式：投递任务交给本地线程池执行。
 * 延迟任务只保存在内存中，进程重启后由 RetrySweeperService 按 next_retry_at 补投。
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "async", matchIfMissing = true)
public class LocalDeliveryQueue implements DeliveryQueue {

    private final TaskScheduler taskScheduler;
    private final DeliveryWorker worker;

    // Worker 依赖队列安排重试，这里延迟注入打破循环
    public LocalDeliveryQueue(@Qualifier("deliveryTaskScheduler") TaskScheduler taskScheduler,
            @Lazy DeliveryWorker worker) {
        this.taskScheduler = taskScheduler;
        this.worker = worker;
    }

    @Override
    public void enqueue(UUID deliveryId) {
        log.debug("Dispatching delivery {} via local scheduler", deliveryId);
        taskScheduler.schedule(() -> worker.process(deliveryId), Instant.now());
    }

    @Override
    public void enqueueDelayed(UUID deliveryId, Duration delay) {
        taskScheduler.schedule(() -> worker.process(deliveryId), Instant.now().plus(delay));
    }
}
