package com.example.webhookdispatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 出站 HTTP 客户端。整体请求超时由每次请求单独设置（投递 30s，测试 10s）。
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public HttpClient webhookHttpClient(
            @Value("${app.webhook.connect-timeout-seconds:5}") long connectTimeoutSeconds) {
        // 明文 HTTP 不做 h2c 升级，部分接收端处理不了 Upgrade 头
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }
}
