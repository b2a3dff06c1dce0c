package com.example.webhookdispatch.repository;

import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.model.WebhookDelivery;
import com.example.webhookdispatch.model.WebhookEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class WebhookDeliveryRepositoryTest {

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    @Autowired
    private WebhookEndpointRepository endpointRepository;

    private WebhookEndpoint endpoint;

    @BeforeEach
    void setUp() {
        endpoint = endpointRepository.save(WebhookEndpoint.builder()
                .ownerId(1L)
                .name("crm")
                .url("https://example.com/hook")
                .secret("s")
                .events(Set.of("application.created"))
                .build());
    }

    private WebhookDelivery save(DeliveryStatus status, int attempts, LocalDateTime createdAt) {
        return deliveryRepository.save(WebhookDelivery.builder()
                .endpoint(endpoint)
                .event("application.created")
                .payload("{}")
                .status(status)
                .attemptCount(attempts)
                .createdAt(createdAt)
                .build());
    }

    @Test
    void testClaimSucceedsOnlyOnce() {
        UUID id = save(DeliveryStatus.PENDING, 0, null).getId();

        assertEquals(1, deliveryRepository.claim(id, LocalDateTime.now()));
        assertEquals(0, deliveryRepository.claim(id, LocalDateTime.now()));

        WebhookDelivery claimed = deliveryRepository.findById(id).orElseThrow();
        assertEquals(DeliveryStatus.IN_PROGRESS, claimed.getStatus());
        assertEquals(1, claimed.getAttemptCount());
        assertNotNull(claimed.getClaimedAt());
    }

    @Test
    void testClaimRespectsStatusAndAttemptBudget() {
        UUID success = save(DeliveryStatus.SUCCESS, 1, null).getId();
        UUID failed = save(DeliveryStatus.FAILED, 3, null).getId();
        UUID exhausted = save(DeliveryStatus.RETRYING, 3, null).getId();
        UUID retrying = save(DeliveryStatus.RETRYING, 1, null).getId();

        assertEquals(0, deliveryRepository.claim(success, LocalDateTime.now()));
        assertEquals(0, deliveryRepository.claim(failed, LocalDateTime.now()));
        assertEquals(0, deliveryRepository.claim(exhausted, LocalDateTime.now()));
        assertEquals(1, deliveryRepository.claim(retrying, LocalDateTime.now()));
        assertEquals(2, deliveryRepository.findById(retrying).orElseThrow().getAttemptCount());
    }

    @Test
    void testResetForRetrySkipsInProgress() {
        UUID failed = save(DeliveryStatus.FAILED, 3, null).getId();
        UUID inProgress = save(DeliveryStatus.IN_PROGRESS, 1, null).getId();

        assertEquals(1, deliveryRepository.resetForRetry(failed,
                Set.of(DeliveryStatus.PENDING, DeliveryStatus.RETRYING, DeliveryStatus.FAILED),
                DeliveryStatus.PENDING));
        assertEquals(0, deliveryRepository.resetForRetry(inProgress,
                Set.of(DeliveryStatus.PENDING, DeliveryStatus.RETRYING, DeliveryStatus.FAILED),
                DeliveryStatus.PENDING));

        WebhookDelivery reset = deliveryRepository.findById(failed).orElseThrow();
        assertEquals(DeliveryStatus.PENDING, reset.getStatus());
        assertEquals(0, reset.getAttemptCount());
    }

    @Test
    void testFindDueRetryIds() {
        WebhookDelivery due = save(DeliveryStatus.RETRYING, 1, null);
        due.setNextRetryAt(LocalDateTime.now().minusMinutes(1));
        deliveryRepository.save(due);
        WebhookDelivery later = save(DeliveryStatus.RETRYING, 1, null);
        later.setNextRetryAt(LocalDateTime.now().plusMinutes(10));
        deliveryRepository.save(later);

        List<UUID> ids = deliveryRepository.findDueRetryIds(DeliveryStatus.RETRYING, LocalDateTime.now(),
                PageRequest.of(0, 10));

        assertEquals(List.of(due.getId()), ids);
    }

    @Test
    void testDeleteOnlyOldTerminalDeliveries() {
        LocalDateTime old = LocalDateTime.now().minusDays(31);
        save(DeliveryStatus.SUCCESS, 1, old);
        save(DeliveryStatus.FAILED, 3, old);
        UUID oldPending = save(DeliveryStatus.PENDING, 0, old).getId();
        UUID recent = save(DeliveryStatus.SUCCESS, 1, LocalDateTime.now().minusDays(1)).getId();

        int deleted = deliveryRepository.deleteByStatusInAndCreatedAtBefore(DeliveryStatus.TERMINAL,
                LocalDateTime.now().minusDays(30));

        assertEquals(2, deleted);
        assertTrue(deliveryRepository.existsById(oldPending));
        assertTrue(deliveryRepository.existsById(recent));
    }

    @Test
    void testCountByStatusSince() {
        save(DeliveryStatus.SUCCESS, 1, null);
        save(DeliveryStatus.SUCCESS, 1, null);
        save(DeliveryStatus.FAILED, 3, null);
        save(DeliveryStatus.SUCCESS, 1, LocalDateTime.now().minusDays(2));

        List<Object[]> rows = deliveryRepository.countByStatusSince(endpoint.getId(),
                LocalDateTime.now().minusHours(24));

        long success = rows.stream().filter(r -> r[0] == DeliveryStatus.SUCCESS)
                .mapToLong(r -> ((Number) r[1]).longValue()).sum();
        long failed = rows.stream().filter(r -> r[0] == DeliveryStatus.FAILED)
                .mapToLong(r -> ((Number) r[1]).longValue()).sum();
        assertEquals(2, success);
        assertEquals(1, failed);
    }
}
