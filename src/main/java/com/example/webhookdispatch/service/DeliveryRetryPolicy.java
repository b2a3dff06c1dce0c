package com.example.webhookdispatch.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;

/**
 * 固定阶梯退避：第 n 次失败后等待 delays[min(n-1, len-1)]，默认 1 分钟、5 分钟、15 分钟。
 */
@Component
public class DeliveryRetryPolicy {

    private final long[] delaySeconds;

    public DeliveryRetryPolicy(@Value("${app.webhook.retry-delays:60,300,900}") long[] delaySeconds) {
        if (delaySeconds == null || delaySeconds.length == 0) {
            throw new IllegalArgumentException("At least one retry delay is required");
        }
        for (long delay : delaySeconds) {
            if (delay < 0) {
                throw new IllegalArgumentException("Retry delay must be >= 0, got: " + delay);
            }
        }
        this.delaySeconds = Arrays.copyOf(delaySeconds, delaySeconds.length);
    }

    /**
     * 计算下一次重试前的等待时间。
     *
     * @param attemptCount 已完成的尝试次数（从 1 开始）
     * @return 等待时长
     */
    public Duration delayFor(int attemptCount) {
        int index = Math.min(Math.max(attemptCount - 1, 0), delaySeconds.length - 1);
        return Duration.ofSeconds(delaySeconds[index]);
    }

    /**
     * 是否还能再尝试
     */
    public boolean hasAttemptsLeft(int attemptCount, int maxAttempts) {
        return attemptCount < maxAttempts;
    }
}
