package com.localguide.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 번역 결과 DTO
 * isUnknown, isFuzzyMatch는 해당할 때만 true로 채우고 나머지는 null (응답에서 생략)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TranslationResult {
    private String originalText;
    private String translatedText;
    private double confidence;
    private String context;
    private String sourceLanguage;
    private String targetLanguage;
    private String region;
    @Builder.Default
    private List<Alternative> alternatives = new ArrayList<>();
    @Builder.Default
    private List<String> usageExamples = new ArrayList<>();
    @JsonProperty("isFuzzyMatch")
    private Boolean fuzzyMatch;
    @JsonProperty("isUnknown")
    private Boolean unknown;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Alternative {
        private String text;
        private double confidence;
        private String context;
    }
}
