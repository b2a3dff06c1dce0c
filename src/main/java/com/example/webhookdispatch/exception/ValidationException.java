package com.example.webhookdispatch.exception;

/**
 * 请求参数校验失败（非法 URL、空事件集合、未知事件等），同步返回 400，不进入投递流程。
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
