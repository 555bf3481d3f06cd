package com.localguide.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localguide.config.GuideProperties;
import com.localguide.entity.ApiLog;
import com.localguide.repository.ApiLogRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API 로깅 서비스 (비동기 처리)
 * 요청 정보는 인터셉터에서 ApiLog로 미리 뽑아서 넘김 (요청 객체는 비동기 스레드에서 쓰지 않음)
 */
@Service
@RequiredArgsConstructor
public class ApiLogService {

    private static final Logger logger = LoggerFactory.getLogger(ApiLogService.class);
    private static final Logger apiLogger = LoggerFactory.getLogger("API_LOGGER");

    // 응답 본문 최대 길이 (너무 긴 응답은 잘라서 저장)
    static final int MAX_RESPONSE_BODY_LENGTH = 5000;
    static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final ApiLogRepository apiLogRepository;
    private final ObjectMapper objectMapper;
    private final GuideProperties properties;
    private final Clock clock;

    /**
     * 비동기로 API 로그를 저장하고 API_LOGGER에 JSON 한 줄로 남김
     */
    @Async("apiLogExecutor")
    public void save(ApiLog apiLog) {
        try {
            apiLog.setResponseBody(truncate(apiLog.getResponseBody(), MAX_RESPONSE_BODY_LENGTH));
            apiLog.setErrorMessage(truncate(apiLog.getErrorMessage(), MAX_ERROR_MESSAGE_LENGTH));
            if (apiLog.getCreatedAt() == null) {
                apiLog.setCreatedAt(LocalDateTime.now(clock));
            }
            apiLogRepository.save(apiLog);
            logToFile(apiLog);
        } catch (Exception e) {
            logger.error("[ApiLogService] save - failed to persist API log, endpoint: {}", apiLog.getEndpoint(), e);
        }
    }

    /**
     * 보존 기간 지난 로그 삭제 (매일 새벽 3시)
     */
    @Scheduled(cron = "${guide.api-log.purge-cron:0 0 3 * * *}")
    @Transactional
    public int purgeExpiredLogs() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(properties.getApiLog().getRetentionDays());
        int deleted = apiLogRepository.deleteOldLogs(cutoff);
        logger.info("[ApiLogService] purgeExpiredLogs - cutoff: {}, deleted: {}", cutoff, deleted);
        return deleted;
    }

    private void logToFile(ApiLog apiLog) {
        try {
            Map<String, Object> logEntry = new LinkedHashMap<>();
            logEntry.put("timestamp", apiLog.getCreatedAt().toString());
            logEntry.put("method", apiLog.getMethod());
            logEntry.put("endpoint", apiLog.getEndpoint());
            if (apiLog.getQueryString() != null) {
                logEntry.put("query", apiLog.getQueryString());
            }
            if (apiLog.getUserId() != null) {
                logEntry.put("userId", apiLog.getUserId());
            }
            logEntry.put("ipAddress", apiLog.getIpAddress());
            logEntry.put("statusCode", apiLog.getStatusCode());
            logEntry.put("responseTimeMs", apiLog.getResponseTimeMs());
            if (apiLog.getErrorMessage() != null) {
                logEntry.put("error", apiLog.getErrorMessage());
            }
            apiLogger.info(objectMapper.writeValueAsString(logEntry));
        } catch (Exception e) {
            logger.error("[ApiLogService] logToFile - failed to write JSON log", e);
        }
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength) + "... (truncated)";
    }
}
