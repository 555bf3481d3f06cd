package com.localguide.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 번역 후보 1개. 범위/필수 검증은 SlangTermValidator가 담당
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TranslationDto {
    private String text;
    private String targetLanguage;
    private String context;
    private Double confidence;
}
