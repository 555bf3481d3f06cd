package com.localguide.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 지역별 대표 용어 (저장하지 않는 파생 값)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionalVariation {
    private String region;
    private String term;
    private String translation;
    private double confidence;
    private String context;
    private int popularity;
    private List<String> usageExamples; // 최대 2개
    private List<String> alternativeTerms; // 같은 지역의 다른 용어
}
