package com.example.webhookdispatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 创建 / 更新接收端的请求体。更新时 null 字段保持不变。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EndpointRequest {
    private String name;
    private String url;
    private List<String> events;
    private String secret;
    private Boolean active;
}
