package com.localguide.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * API 요청 로그 엔티티 (/api/** 요청 1건당 1행)
 */
@Entity
@Table(name = "api_logs", indexes = {
    @Index(name = "idx_api_log_endpoint", columnList = "endpoint"),
    @Index(name = "idx_api_log_user", columnList = "user_id"),
    @Index(name = "idx_api_log_created_at", columnList = "created_at"),
    @Index(name = "idx_api_log_status", columnList = "status_code")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 10)
    private String method;

    @Column(nullable = false, length = 500)
    private String endpoint; // /api/food/recommendations 등

    @Column(name = "query_string", length = 1000)
    private String queryString; // ?q=jugaad 등

    @Column(name = "user_id", length = 36)
    private String userId; // X-User-Id 헤더 (없으면 null)

    @Column(name = "ip_address", length = 50)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @Column(name = "request_body", columnDefinition = "TEXT")
    private String requestBody;

    @Column(name = "response_body", columnDefinition = "TEXT")
    private String responseBody; // 앞부분만 저장

    @Column(name = "status_code", nullable = false)
    private Integer statusCode;

    @Column(name = "response_time_ms", nullable = false)
    private Long responseTimeMs;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
