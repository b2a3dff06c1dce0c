package com.example.webhookdispatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 投递状态。
 * PENDING -> IN_PROGRESS -> {SUCCESS, RETRYING, FAILED}，RETRYING -> IN_PROGRESS 可重入。
 * IN_PROGRESS 只在一次 HTTP 尝试期间持有（认领锁）。
 */
public enum DeliveryStatus {
    PENDING,
    IN_PROGRESS,
    SUCCESS,
    FAILED,
    RETRYING;

    /**
     * 可被 Worker 认领的状态
     */
    public static final Set<DeliveryStatus> CLAIMABLE = EnumSet.of(PENDING, RETRYING);

    /**
     * 终态，仅终态记录会被保留期清理
     */
    public static final Set<DeliveryStatus> TERMINAL = EnumSet.of(SUCCESS, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 解析外部传入的状态值（大小写不敏感）。
     *
     * @param value 状态值，如 "failed"
     * @return 状态枚举
     * @throws IllegalArgumentException 未知状态
     */
    public static DeliveryStatus fromValue(String value) {
        for (DeliveryStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown delivery status: " + value);
    }
}
