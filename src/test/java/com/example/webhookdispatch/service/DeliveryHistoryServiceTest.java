package com.example.webhookdispatch.service;

import com.example.webhookdispatch.exception.ResourceNotFoundException;
import com.example.webhookdispatch.exception.ValidationException;
import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.model.WebhookDelivery;
import com.example.webhookdispatch.model.WebhookEndpoint;
import com.example.webhookdispatch.queue.DeliveryQueue;
import com.example.webhookdispatch.repository.WebhookDeliveryRepository;
import com.example.webhookdispatch.repository.WebhookEndpointRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DataJpaTest
class DeliveryHistoryServiceTest {

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    @Autowired
    private WebhookEndpointRepository endpointRepository;

    private DeliveryQueue deliveryQueue;
    private DeliveryHistoryService historyService;
    private WebhookEndpoint crm;
    private WebhookEndpoint slack;

    @BeforeEach
    void setUp() {
        deliveryQueue = mock(DeliveryQueue.class);
        historyService = new DeliveryHistoryService(deliveryRepository, deliveryQueue);
        crm = endpoint(1L, "crm");
        slack = endpoint(1L, "slack");
    }

    private WebhookEndpoint endpoint(Long ownerId, String name) {
        return endpointRepository.save(WebhookEndpoint.builder()
                .ownerId(ownerId)
                .name(name)
                .url("https://example.com/" + name)
                .secret("s")
                .events(Set.of("application.created", "company.created"))
                .build());
    }

    private UUID save(WebhookEndpoint endpoint, String event, DeliveryStatus status, int attempts,
            int minutesAgo) {
        return deliveryRepository.save(WebhookDelivery.builder()
                .endpoint(endpoint)
                .event(event)
                .payload("{}")
                .status(status)
                .attemptCount(attempts)
                .errorMessage(status == DeliveryStatus.FAILED ? "HTTP 500: boom" : null)
                .responseStatusCode(status == DeliveryStatus.FAILED ? 500 : null)
                .responseBody(status == DeliveryStatus.FAILED ? "boom" : null)
                .createdAt(LocalDateTime.now().minusMinutes(minutesAgo))
                .build()).getId();
    }

    private PageRequest newestFirst() {
        return PageRequest.of(0, 20, Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    @Test
    void testListFilters() {
        UUID newest = save(crm, "application.created", DeliveryStatus.SUCCESS, 1, 1);
        save(crm, "company.created", DeliveryStatus.FAILED, 3, 5);
        save(slack, "application.created", DeliveryStatus.FAILED, 3, 10);
        save(endpoint(2L, "foreign"), "application.created", DeliveryStatus.SUCCESS, 1, 0);

        Page<WebhookDelivery> all = historyService.list(1L, null, null, null, newestFirst());
        assertEquals(3, all.getTotalElements());
        assertEquals(newest, all.getContent().get(0).getId());

        assertEquals(2, historyService.list(1L, crm.getId(), null, null, newestFirst()).getTotalElements());
        assertEquals(2, historyService.list(1L, null, DeliveryStatus.FAILED, null, newestFirst())
                .getTotalElements());
        assertEquals(1, historyService.list(1L, crm.getId(), DeliveryStatus.FAILED, "company.created",
                newestFirst()).getTotalElements());
    }

    @Test
    void testGetChecksOwnership() {
        UUID id = save(crm, "application.created", DeliveryStatus.SUCCESS, 1, 0);

        assertEquals(id, historyService.get(1L, id).getId());
        assertThrows(ResourceNotFoundException.class, () -> historyService.get(2L, id));
    }

    @Test
    void testRetryResetsAndRequeues() {
        UUID id = save(crm, "application.created", DeliveryStatus.FAILED, 3, 0);

        WebhookDelivery retried = historyService.retry(1L, id);

        assertEquals(DeliveryStatus.PENDING, retried.getStatus());
        assertEquals(0, retried.getAttemptCount());
        assertNull(retried.getErrorMessage());
        assertNull(retried.getResponseStatusCode());
        assertNull(retried.getResponseBody());
        assertNull(retried.getNextRetryAt());
        verify(deliveryQueue).enqueue(id);
    }

    @Test
    void testRetryOfSuccessfulDeliveryIsRejected() {
        UUID id = save(crm, "application.created", DeliveryStatus.SUCCESS, 1, 0);

        ValidationException e = assertThrows(ValidationException.class, () -> historyService.retry(1L, id));
        assertEquals("Cannot retry successful delivery", e.getMessage());
        verifyNoInteractions(deliveryQueue);
    }

    @Test
    void testRetryOfInFlightDeliveryIsRejected() {
        UUID id = save(crm, "application.created", DeliveryStatus.IN_PROGRESS, 1, 0);

        assertThrows(ValidationException.class, () -> historyService.retry(1L, id));
        verifyNoInteractions(deliveryQueue);
    }
}
