package com.example.webhookdispatch.queue;

import com.example.webhookdispatch.service.DeliveryWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.UUID;

import static org.mockito.Mockito.*;

class LocalDeliveryQueueTest {

    private ThreadPoolTaskScheduler scheduler;
    private DeliveryWorker worker;
    private LocalDeliveryQueue queue;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.initialize();
        worker = mock(DeliveryWorker.class);
        queue = new LocalDeliveryQueue(scheduler, worker);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void testEnqueueRunsWorker() {
        UUID id = UUID.randomUUID();

        queue.enqueue(id);

        verify(worker, timeout(2_000)).process(id);
    }

    @Test
    void testDelayedEnqueueWaits() {
        UUID id = UUID.randomUUID();

        queue.enqueueDelayed(id, Duration.ofMillis(500));

        verify(worker, after(200).never()).process(id);
        verify(worker, timeout(2_000)).process(id);
    }
}
