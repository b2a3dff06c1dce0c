package com.example.webhookdispatch.service;

import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.model.WebhookDelivery;
import com.example.webhookdispatch.model.WebhookEndpoint;
import com.example.webhookdispatch.queue.DeliveryQueue;
import com.example.webhookdispatch.repository.WebhookDeliveryRepository;
import com.example.webhookdispatch.repository.WebhookEndpointRepository;
import com.example.webhookdispatch.utils.UrlValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DataJpaTest
class RetrySweeperServiceTest {

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    @Autowired
    private WebhookEndpointRepository endpointRepository;

    private DeliveryQueue deliveryQueue;
    private RetrySweeperService sweeper;
    private WebhookEndpoint endpoint;

    @BeforeEach
    void setUp() {
        deliveryQueue = mock(DeliveryQueue.class);
        EndpointRegistryService registry = new EndpointRegistryService(endpointRepository, deliveryRepository,
                new UrlValidator(false, ""), 10);
        sweeper = new RetrySweeperService(deliveryRepository, registry, deliveryQueue, 100, 10, 5);
        endpoint = endpointRepository.save(WebhookEndpoint.builder()
                .ownerId(1L)
                .name("crm")
                .url("https://example.com/hook")
                .secret("s")
                .events(Set.of("application.created"))
                .build());
    }

    private WebhookDelivery delivery(DeliveryStatus status, int attempts) {
        return WebhookDelivery.builder()
                .endpoint(endpoint)
                .event("application.created")
                .payload("{}")
                .status(status)
                .attemptCount(attempts)
                .build();
    }

    @Test
    void testSweepQueuesOnlyDueRetries() {
        WebhookDelivery due = delivery(DeliveryStatus.RETRYING, 1);
        due.setNextRetryAt(LocalDateTime.now().minusSeconds(5));
        UUID dueId = deliveryRepository.save(due).getId();

        WebhookDelivery notYet = delivery(DeliveryStatus.RETRYING, 1);
        notYet.setNextRetryAt(LocalDateTime.now().plusMinutes(5));
        deliveryRepository.save(notYet);

        deliveryRepository.save(delivery(DeliveryStatus.PENDING, 0));

        assertEquals(1, sweeper.sweepDueRetries());
        verify(deliveryQueue).enqueue(dueId);
        verifyNoMoreInteractions(deliveryQueue);
    }

    @Test
    void testSweepRespectsLimit() {
        for (int i = 0; i < 5; i++) {
            WebhookDelivery due = delivery(DeliveryStatus.RETRYING, 1);
            due.setNextRetryAt(LocalDateTime.now().minusMinutes(i + 1));
            deliveryRepository.save(due);
        }

        assertEquals(2, sweeper.sweepDueRetries(2));
        verify(deliveryQueue, times(2)).enqueue(any(UUID.class));
    }

    @Test
    void testStalePendingIsRequeued() {
        WebhookDelivery stale = delivery(DeliveryStatus.PENDING, 0);
        stale.setCreatedAt(LocalDateTime.now().minusMinutes(30));
        UUID staleId = deliveryRepository.save(stale).getId();
        deliveryRepository.save(delivery(DeliveryStatus.PENDING, 0));

        assertEquals(1, sweeper.sweepStalePending());
        verify(deliveryQueue).enqueue(staleId);
    }

    @Test
    void testStaleClaimsAreRecovered() {
        WebhookDelivery retriable = delivery(DeliveryStatus.IN_PROGRESS, 1);
        retriable.setClaimedAt(LocalDateTime.now().minusMinutes(10));
        UUID retriableId = deliveryRepository.save(retriable).getId();

        WebhookDelivery exhausted = delivery(DeliveryStatus.IN_PROGRESS, 3);
        exhausted.setClaimedAt(LocalDateTime.now().minusMinutes(10));
        UUID exhaustedId = deliveryRepository.save(exhausted).getId();

        WebhookDelivery fresh = delivery(DeliveryStatus.IN_PROGRESS, 1);
        fresh.setClaimedAt(LocalDateTime.now());
        UUID freshId = deliveryRepository.save(fresh).getId();

        assertEquals(2, sweeper.recoverStaleClaims());

        WebhookDelivery released = deliveryRepository.findById(retriableId).orElseThrow();
        assertEquals(DeliveryStatus.RETRYING, released.getStatus());
        assertNotNull(released.getNextRetryAt());
        assertNull(released.getClaimedAt());

        WebhookDelivery abandoned = deliveryRepository.findById(exhaustedId).orElseThrow();
        assertEquals(DeliveryStatus.FAILED, abandoned.getStatus());
        assertEquals(RetrySweeperService.ABANDONED, abandoned.getErrorMessage());
        assertEquals(1, endpointRepository.findById(endpoint.getId()).orElseThrow().getFailureCount());

        assertEquals(DeliveryStatus.IN_PROGRESS, deliveryRepository.findById(freshId).orElseThrow().getStatus());
    }

    @Test
    void testEnqueueErrorsDoNotStopSweep() {
        for (int i = 0; i < 3; i++) {
            WebhookDelivery due = delivery(DeliveryStatus.RETRYING, 1);
            due.setNextRetryAt(LocalDateTime.now().minusMinutes(1));
            deliveryRepository.save(due);
        }
        doThrow(new IllegalStateException("queue down")).doNothing().when(deliveryQueue).enqueue(any(UUID.class));

        assertEquals(2, sweeper.sweepDueRetries());
        verify(deliveryQueue, times(3)).enqueue(any(UUID.class));
    }
}
