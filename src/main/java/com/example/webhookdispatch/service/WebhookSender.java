package com.example.webhookdispatch.service;

import com.example.webhookdispatch.security.WebhookSigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * 签名并发送单次 Webhook 请求。不做重试，重试策略由调用方决定。
 */
@Component
@Slf4j
public class WebhookSender {

    public static final String HEADER_EVENT = "X-Webhook-Event";
    public static final String HEADER_SIGNATURE = "X-Webhook-Signature";
    public static final String HEADER_TIMESTAMP = "X-Webhook-Timestamp";
    public static final String HEADER_DELIVERY_ID = "X-Webhook-Delivery-ID";

    private final HttpClient httpClient;
    private final WebhookSigner signer;
    private final String userAgent;

    public WebhookSender(HttpClient webhookHttpClient, WebhookSigner signer,
            @Value("${app.webhook.user-agent:JobTracker-Webhook/1.0}") String userAgent) {
        this.httpClient = webhookHttpClient;
        this.signer = signer;
        this.userAgent = userAgent;
    }

    /**
     * POST 一次签名请求。
     *
     * @param url        目标地址
     * @param event      事件名
     * @param deliveryId 投递 ID（测试请求为 "test"）
     * @param payload    原始 JSON 文本，按原样发送并签名
     * @param secret     接收端密钥
     * @param timeout    整体请求超时
     * @return 响应结果（任何状态码都会返回）
     * @throws java.net.http.HttpTimeoutException 超时
     * @throws IOException                        连接或传输错误
     * @throws InterruptedException               线程被中断
     */
    public SendResult send(String url, String event, String deliveryId, String payload, String secret,
            Duration timeout) throws IOException, InterruptedException {
        byte[] body = payload.getBytes(StandardCharsets.UTF_8);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("User-Agent", userAgent)
                .header(HEADER_EVENT, event)
                .header(HEADER_SIGNATURE, signer.signatureHeader(body, secret))
                .header(HEADER_TIMESTAMP, String.valueOf(Instant.now().getEpochSecond()))
                .header(HEADER_DELIVERY_ID, deliveryId)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        log.debug("{} -> HTTP {} (delivery {})", url, response.statusCode(), deliveryId);
        return new SendResult(response.statusCode(), response.body() == null ? "" : response.body());
    }

    /**
     * 单次发送结果
     */
    public record SendResult(int statusCode, String body) {

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
