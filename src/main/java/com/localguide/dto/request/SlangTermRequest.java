package com.localguide.dto.request;

import com.localguide.dto.TranslationDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 슬랭 용어 등록 요청
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlangTermRequest {

    @NotBlank
    private String term;

    @NotBlank
    private String language;

    @NotBlank
    private String region;

    @NotBlank
    private String context;

    private Integer popularity;

    @NotEmpty
    @Builder.Default
    private List<@NotNull @Valid TranslationDto> translations = new ArrayList<>();

    @Builder.Default
    private List<String> usageExamples = new ArrayList<>();
}
