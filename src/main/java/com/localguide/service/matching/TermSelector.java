package com.localguide.service.matching;

import com.localguide.entity.SlangTerm;
import com.localguide.entity.Translation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 후보 용어/번역 중 하나를 고르는 규칙
 * 동점이면 먼저 나온 후보가 이긴다 (입력 순서가 결과에 영향)
 */
public final class TermSelector {

    private TermSelector() {
    }

    /**
     * 선호 지역(대소문자 무시)과 일치하는 첫 후보, 없으면 인기도 최고 후보
     */
    public static SlangTerm selectBestMatch(List<SlangTerm> terms, String preferredRegion) {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("No terms provided for selection");
        }

        if (!TextNormalizer.isBlank(preferredRegion)) {
            for (SlangTerm term : terms) {
                if (term.getRegion() != null && term.getRegion().equalsIgnoreCase(preferredRegion.trim())) {
                    return term;
                }
            }
        }

        SlangTerm best = terms.get(0);
        for (SlangTerm term : terms) {
            if (popularity(term) > popularity(best)) {
                best = term;
            }
        }
        return best;
    }

    /**
     * 선호 context와 일치하는 첫 번역, 없으면 confidence 최고 번역
     */
    public static Translation selectBestTranslation(List<Translation> translations, String preferredContext) {
        if (translations == null || translations.isEmpty()) {
            throw new IllegalArgumentException("No translations provided for selection");
        }

        if (preferredContext != null) {
            for (Translation translation : translations) {
                if (preferredContext.equals(translation.getContext())) {
                    return translation;
                }
            }
        }

        Translation best = translations.get(0);
        for (Translation translation : translations) {
            if (confidence(translation) > confidence(best)) {
                best = translation;
            }
        }
        return best;
    }

    /**
     * 선택된 번역을 뺀 나머지를 같은 선호 순서(선호 context 먼저, 그다음 confidence 내림차순)로 최대 limit개
     */
    public static List<Translation> alternatives(List<Translation> translations, Translation chosen,
                                                 String preferredContext, int limit) {
        Comparator<Translation> preference = Comparator
            .comparing((Translation t) -> preferredContext != null && preferredContext.equals(t.getContext()) ? 0 : 1)
            .thenComparing(TermSelector::confidence, Comparator.reverseOrder());

        List<Translation> rest = new ArrayList<>(translations);
        rest.remove(chosen);
        return rest.stream()
            .sorted(preference)
            .limit(limit)
            .collect(Collectors.toList());
    }

    /**
     * targetLanguage 번역만 추림 (저장 순서 유지)
     */
    public static List<Translation> translationsFor(SlangTerm term, String targetLanguage) {
        return term.getTranslations().stream()
            .filter(t -> targetLanguage.equals(t.getTargetLanguage()))
            .collect(Collectors.toList());
    }

    /**
     * (정규화 용어, 지역, 언어) 기준 중복 제거. 처음 나온 항목을 남긴다
     */
    public static List<SlangTerm> deduplicate(List<SlangTerm> terms) {
        Map<String, SlangTerm> unique = new LinkedHashMap<>();
        for (SlangTerm term : terms) {
            unique.putIfAbsent(dedupeKey(term), term);
        }
        return new ArrayList<>(unique.values());
    }

    static String dedupeKey(SlangTerm term) {
        String region = term.getRegion() == null ? "" : term.getRegion().toLowerCase(Locale.ROOT);
        return TextNormalizer.normalize(term.getTerm()) + "-" + region + "-" + term.getLanguage();
    }

    private static int popularity(SlangTerm term) {
        return term.getPopularity() == null ? 0 : term.getPopularity();
    }

    private static double confidence(Translation translation) {
        return translation.getConfidence() == null ? 0.0 : translation.getConfidence();
    }
}
