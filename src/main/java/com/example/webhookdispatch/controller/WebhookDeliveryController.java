package com.example.webhookdispatch.controller;

import com.example.webhookdispatch.dto.DeliveryResponse;
import com.example.webhookdispatch.exception.ValidationException;
import com.example.webhookdispatch.model.DeliveryStatus;
import com.example.webhookdispatch.service.DeliveryHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

import static com.example.webhookdispatch.controller.WebhookEndpointController.OWNER_HEADER;

/**
 * 投递历史与手动重试接口。
 */
@RestController
@RequestMapping("/api/webhooks/deliveries")
@RequiredArgsConstructor
public class WebhookDeliveryController {

    private static final int MAX_PAGE_SIZE = 100;

    private final DeliveryHistoryService historyService;

    /**
     * 按条件分页查询，最新的在前
     */
    @GetMapping
    public Page<DeliveryResponse> list(@RequestHeader(OWNER_HEADER) Long ownerId,
            @RequestParam(required = false) UUID endpoint,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String event,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return historyService.list(ownerId, endpoint, parseStatus(status), event, pageable)
                .map(DeliveryResponse::from);
    }

    @GetMapping("/{id}")
    public DeliveryResponse get(@RequestHeader(OWNER_HEADER) Long ownerId, @PathVariable UUID id) {
        return DeliveryResponse.from(historyService.get(ownerId, id));
    }

    @PostMapping("/{id}/retry")
    public DeliveryResponse retry(@RequestHeader(OWNER_HEADER) Long ownerId, @PathVariable UUID id) {
        return DeliveryResponse.from(historyService.retry(ownerId, id));
    }

    private DeliveryStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return DeliveryStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }
}
