package com.localguide.dto.request;

import com.localguide.dto.TranslationDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 슬랭 용어 부분 수정. null 필드는 기존 값 유지, 컬렉션은 주어지면 통째로 교체
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlangTermUpdateRequest {
    private String term;
    private String language;
    private String region;
    private String context;
    private Integer popularity;
    private List<@NotNull @Valid TranslationDto> translations;
    private List<String> usageExamples;
}
