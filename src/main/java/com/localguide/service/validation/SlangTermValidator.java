package com.localguide.service.validation;

import com.localguide.config.GuideProperties;
import com.localguide.entity.SlangTerm;
import com.localguide.entity.Translation;
import com.localguide.exception.ValidationException;
import com.localguide.service.matching.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 슬랭 용어 의미 검증. 실패 항목을 모두 모아서 한 번에 던진다
 */
@Component
@RequiredArgsConstructor
public class SlangTermValidator {

    public static final Set<String> CONTEXTS = Set.of("formal", "casual", "slang");

    private final GuideProperties properties;

    public void validate(SlangTerm term) {
        List<String> errors = new ArrayList<>();
        List<String> languages = properties.getTranslation().getAllowedLanguages();

        if (TextNormalizer.isBlank(term.getTerm())) {
            errors.add("term: must not be empty");
        } else if (TextNormalizer.normalize(term.getTerm()).isEmpty()) {
            errors.add("term: must contain at least one letter or digit");
        }
        if (term.getLanguage() == null || !languages.contains(term.getLanguage())) {
            errors.add("language: must be one of " + languages);
        }
        if (TextNormalizer.isBlank(term.getRegion())) {
            errors.add("region: must not be empty");
        }
        if (term.getContext() == null || !CONTEXTS.contains(term.getContext())) {
            errors.add("context: must be one of [formal, casual, slang]");
        }
        if (term.getPopularity() == null || term.getPopularity() < 0 || term.getPopularity() > 100) {
            errors.add("popularity: must be between 0 and 100");
        }

        List<Translation> translations = term.getTranslations();
        if (translations == null || translations.isEmpty()) {
            errors.add("translations: at least one translation is required");
        } else {
            for (int i = 0; i < translations.size(); i++) {
                validateTranslation(translations.get(i), i, languages, errors);
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid slang term", errors);
        }
    }

    private void validateTranslation(Translation translation, int index, List<String> languages, List<String> errors) {
        String prefix = "translations[" + index + "].";
        if (TextNormalizer.isBlank(translation.getText())) {
            errors.add(prefix + "text: must not be empty");
        }
        if (translation.getTargetLanguage() == null || !languages.contains(translation.getTargetLanguage())) {
            errors.add(prefix + "targetLanguage: must be one of " + languages);
        }
        if (translation.getContext() != null && !CONTEXTS.contains(translation.getContext())) {
            errors.add(prefix + "context: must be one of [formal, casual, slang]");
        }
        Double confidence = translation.getConfidence();
        if (confidence == null || confidence < 0.0 || confidence > 1.0) {
            errors.add(prefix + "confidence: must be between 0 and 1");
        }
    }
}
