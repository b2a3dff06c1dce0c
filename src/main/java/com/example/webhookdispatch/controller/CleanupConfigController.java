package com.example.webhookdispatch.controller;

import com.example.webhookdispatch.model.CleanupConfig;
import com.example.webhookdispatch.service.CleanupSchedulerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 投递记录保留期配置接口。
 */
@RestController
@RequestMapping("/api/cleanup")
@RequiredArgsConstructor
public class CleanupConfigController {

    private final CleanupSchedulerService cleanupService;

    @GetMapping("/config")
    public ResponseEntity<CleanupConfig> getConfig() {
        return ResponseEntity.ok(cleanupService.getConfig());
    }

    /**
     * 更新保留天数与开关
     */
    @PutMapping("/config")
    public ResponseEntity<CleanupConfig> updateConfig(@RequestBody Map<String, Object> request) {
        Integer retentionDays = request.get("retentionDays") instanceof Number n ? n.intValue() : null;
        Boolean enabled = request.get("enabled") instanceof Boolean b ? b : null;
        return ResponseEntity.ok(cleanupService.updateConfig(retentionDays, enabled));
    }

    /**
     * 手动触发清理
     */
    @PostMapping("/run")
    public ResponseEntity<CleanupSchedulerService.CleanupResult> runCleanup() {
        return ResponseEntity.ok(cleanupService.runCleanup());
    }
}
