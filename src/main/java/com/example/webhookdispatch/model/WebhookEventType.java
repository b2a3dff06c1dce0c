package com.example.webhookdispatch.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * 可订阅的事件目录（封闭集合，新增事件需要发版）。
 */
@Getter
@RequiredArgsConstructor
public enum WebhookEventType {
    APPLICATION_CREATED("application.created", "Application Created"),
    APPLICATION_UPDATED("application.updated", "Application Updated"),
    APPLICATION_DELETED("application.deleted", "Application Deleted"),
    APPLICATION_STATUS_CHANGED("application.status_changed", "Application Status Changed"),
    INTERVIEW_CREATED("interview.created", "Interview Created"),
    INTERVIEW_UPDATED("interview.updated", "Interview Updated"),
    INTERVIEW_COMPLETED("interview.completed", "Interview Completed"),
    INTERVIEW_CANCELLED("interview.cancelled", "Interview Cancelled"),
    COMPANY_CREATED("company.created", "Company Created");

    private final String value;
    private final String description;

    public static Optional<WebhookEventType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }

    public static boolean isKnown(String value) {
        return fromValue(value).isPresent();
    }
}
