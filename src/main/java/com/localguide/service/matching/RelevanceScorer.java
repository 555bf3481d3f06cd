package com.localguide.service.matching;

import java.util.Locale;

/**
 * 검색 결과 정렬용 휴리스틱 점수
 * 점수는 정렬에만 쓰고 컷오프 없음
 */
public final class RelevanceScorer {

    public static final double EXACT_SCORE = 100;
    public static final double PREFIX_SCORE = 80;
    public static final double CONTAINS_SCORE = 60;
    public static final double SIMILAR_LENGTH_SCORE = 30;
    public static final double WORD_MATCH_BONUS = 40;
    public static final double MAX_POPULARITY_BONUS = 20;

    private RelevanceScorer() {
    }

    /**
     * 슬랭 용어 검색용: 정확(100) > 접두(80) > 포함(60) > 길이차 2 이하(30) + 인기도 보너스(최대 20)
     */
    public static double termRelevance(String candidate, String query, int popularity) {
        String candidateLower = lower(candidate);
        String queryLower = lower(query);

        double score = tierScore(candidateLower, queryLower);
        if (score == 0 && Math.abs(candidateLower.length() - queryLower.length()) <= 2) {
            score = SIMILAR_LENGTH_SCORE;
        }

        score += Math.min(MAX_POPULARITY_BONUS, popularity / 5.0);
        return score;
    }

    /**
     * 문화 콘텐츠 검색용: 정확/접두/포함 단계 점수 + 공백 단위 토큰 일치 시 +40
     */
    public static double culturalRelevance(String query, String text) {
        String textLower = lower(text);
        String queryLower = lower(query);

        double score = tierScore(textLower, queryLower);

        for (String word : textLower.split("\\s+")) {
            if (word.equals(queryLower)) {
                score += WORD_MATCH_BONUS;
                break;
            }
        }
        return score;
    }

    private static double tierScore(String text, String query) {
        if (text.equals(query)) {
            return EXACT_SCORE;
        } else if (text.startsWith(query)) {
            return PREFIX_SCORE;
        } else if (text.contains(query)) {
            return CONTAINS_SCORE;
        }
        return 0;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
