package com.example.webhookdispatch.repository;

import com.example.webhookdispatch.model.CleanupConfig;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * 清理配置仓储接口。
 */
public interface CleanupConfigRepository extends JpaRepository<CleanupConfig, Long> {
}
