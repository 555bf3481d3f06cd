package com.localguide.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 문화 콘텐츠 검색 결과 1건 (지역 정보 / 관습 / 축제)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CulturalSearchResult {
    private String id; // region-delhi, custom-delhi-0, festival-holi
    private String type; // 항상 cultural
    private String kind; // region | custom | festival
    private String region; // 축제는 null
    private String title;
    private String description;
    private double relevanceScore;
    private Map<String, Object> metadata;
}
