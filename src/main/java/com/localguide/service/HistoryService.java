package com.localguide.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localguide.config.GuideProperties;
import com.localguide.dto.response.HistoryEntry;
import com.localguide.model.ContentType;
import com.localguide.service.matching.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 사용자별 추천/검색 이력 (Redis 리스트, 최신순)
 * key: history:{userId}, 최대 guide.history.max-entries개, guide.history.ttl-days 후 만료
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryService {

    static final String KEY_PREFIX = "history:";

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;
    private final GuideProperties properties;
    private final Clock clock;

    /**
     * 이력 1건 기록. Redis 장애 시 경고만 남기고 요청은 계속 진행
     */
    public void record(String userId, ContentType type, String query, int resultCount) {
        if (TextNormalizer.isBlank(userId)) {
            return;
        }
        HistoryEntry entry = HistoryEntry.builder()
            .userId(userId)
            .type(type)
            .query(query)
            .resultCount(resultCount)
            .timestamp(clock.millis())
            .build();

        String key = KEY_PREFIX + userId;
        GuideProperties.History config = properties.getHistory();
        try {
            redisTemplate.opsForList().leftPush(key, entry);
            redisTemplate.opsForList().trim(key, 0, config.getMaxEntries() - 1);
            redisTemplate.expire(key, Duration.ofDays(config.getTtlDays()));
            log.debug("[HistoryService] record - userId: {}, type: {}, query: {}", userId, type, query);
        } catch (DataAccessException e) {
            log.warn("[HistoryService] record - Redis write failed, userId: {}, error: {}", userId, e.getMessage());
        }
    }

    public List<HistoryEntry> history(String userId, int limit) {
        int size = Math.max(1, Math.min(limit, properties.getHistory().getMaxEntries()));
        List<Object> raw = redisTemplate.opsForList().range(KEY_PREFIX + userId, 0, size - 1);

        List<HistoryEntry> entries = new ArrayList<>();
        if (raw == null) {
            return entries;
        }
        for (Object value : raw) {
            if (value instanceof HistoryEntry) {
                entries.add((HistoryEntry) value);
            } else {
                // 타입 정보 없이 저장된 JSON은 Map으로 돌아옴
                entries.add(objectMapper.convertValue(value, HistoryEntry.class));
            }
        }
        log.info("[HistoryService] history - userId: {}, count: {}", userId, entries.size());
        return entries;
    }
}
