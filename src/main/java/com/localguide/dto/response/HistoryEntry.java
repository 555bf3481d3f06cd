package com.localguide.dto.response;

import com.localguide.model.ContentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 추천/검색 이력 1건 (Redis 리스트에 JSON으로 저장)
 * timestamp는 epoch millis
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryEntry {
    private String userId;
    private ContentType type;
    private String query;
    private int resultCount;
    private long timestamp;
}
