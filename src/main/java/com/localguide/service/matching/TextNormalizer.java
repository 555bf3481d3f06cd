package com.localguide.service.matching;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 검색어 정규화: 소문자 + trim + 구두점/기호 제거
 * 데바나가리 등 비라틴 문자는 그대로 둠
 */
public final class TextNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT).trim()).replaceAll("");
    }

    public static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }
}
