package com.example.webhookdispatch.exception;

/**
 * 资源不存在或不属于当前用户。
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
