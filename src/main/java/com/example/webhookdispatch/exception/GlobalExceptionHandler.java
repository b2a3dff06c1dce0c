package com.example.webhookdispatch.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理逻辑
 * 确保所有未捕获的异常都不会向调用方泄露堆栈信息。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException e, HttpServletRequest request) {
        log.debug("[Validation] Path: {}, Error: {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e,
            HttpServletRequest request) {
        log.debug("[NotFound] Path: {}, Error: {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getMessage(), request);
    }

    /**
     * 缺少请求头、参数类型错误、请求体无法解析
     */
    @ExceptionHandler({ MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e, HttpServletRequest request) {
        log.debug("[BadRequest] Path: {}, Error: {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request", request);
    }

    /**
     * 处理资源未找到异常 (404)
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException e,
            HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}", request.getRequestURI());
        return error(HttpStatus.NOT_FOUND, "Not Found", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact administrator.", request);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message,
            HttpServletRequest request) {
        Map<String, Object> error = new HashMap<>();
        error.put("status", status.value());
        error.put("error", status.getReasonPhrase());
        error.put("message", message);
        error.put("path", request.getRequestURI());
        return new ResponseEntity<>(error, status);
    }
}
