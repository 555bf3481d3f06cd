package com.localguide.dto.response;

import com.localguide.dto.TranslationDto;
import com.localguide.entity.SlangTerm;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlangTermResponse {
    private String id;
    private String term;
    private String language;
    private String region;
    private String context;
    private int popularity;
    private List<TranslationDto> translations;
    private List<String> usageExamples;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static SlangTermResponse from(SlangTerm entity) {
        List<TranslationDto> translations = new ArrayList<>();
        entity.getTranslations().forEach(t ->
            translations.add(new TranslationDto(t.getText(), t.getTargetLanguage(), t.getContext(), t.getConfidence())));

        return SlangTermResponse.builder()
            .id(entity.getId())
            .term(entity.getTerm())
            .language(entity.getLanguage())
            .region(entity.getRegion())
            .context(entity.getContext())
            .popularity(entity.getPopularity() != null ? entity.getPopularity() : 0)
            .translations(translations)
            .usageExamples(new ArrayList<>(entity.getUsageExamples()))
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }
}
