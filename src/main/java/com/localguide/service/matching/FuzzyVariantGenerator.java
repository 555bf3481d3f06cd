package com.localguide.service.matching;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 정확 일치 실패 시 사용하는 철자 변형 후보 생성기
 * 편집 거리 기반이 아니라 고정된 변형 5개만 만든다 (음차 표기 흔들림 대응용)
 */
public final class FuzzyVariantGenerator {

    static final int MIN_VARIANT_LENGTH = 3;

    private FuzzyVariantGenerator() {
    }

    /**
     * @param normalized TextNormalizer로 정규화된 검색어
     * @return 원문과 다르고 3글자 이상인 변형들 (생성 순서 유지, 중복 제거)
     */
    public static List<String> variants(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return List.of();
        }

        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(normalized.substring(0, normalized.length() - 1)); // 마지막 글자 제거
        candidates.add(normalized + "a");
        candidates.add(normalized + "i");
        candidates.add(normalized.replace("a", "aa")); // 모음 늘이기
        candidates.add(normalized.replace("i", "ee"));

        List<String> variants = new ArrayList<>();
        for (String candidate : candidates) {
            if (!candidate.equals(normalized) && candidate.length() >= MIN_VARIANT_LENGTH) {
                variants.add(candidate);
            }
        }
        return variants;
    }
}
