package com.localguide.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 번역 요청 DTO
 * text가 빈 문자열이면 400이 아니라 isUnknown 결과를 돌려준다
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TranslateRequest {

    @NotNull
    @Size(max = 500)
    private String text;

    private String sourceLanguage; // 생략 시 guide.translation.source-language
    private String targetLanguage; // 생략 시 guide.translation.target-language
    private String region; // 선호 지역
}
