package com.localguide.service.ranking;

import com.localguide.dto.response.FoodRecommendation;
import com.localguide.entity.OperatingSlot;

import java.time.DayOfWeek;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 음식 추천 정렬/반경 필터
 */
public final class RecommendationRanker {

    public static final String CLOSED_TODAY = "Check operating hours";

    /** 안전 평점 내림차순, 같으면 거리 오름차순 */
    public static final Comparator<FoodRecommendation> SAFETY_THEN_DISTANCE = Comparator
        .comparingDouble(RecommendationRanker::overall).reversed()
        .thenComparingDouble(FoodRecommendation::getDistance);

    private RecommendationRanker() {
    }

    /**
     * 반경 밖 후보를 버리고 안전 평점/거리 순으로 정렬 후 limit개
     */
    public static List<FoodRecommendation> rankWithinRadius(List<FoodRecommendation> candidates,
                                                            double radiusKm, int limit) {
        return candidates.stream()
            .filter(r -> r.getDistance() <= radiusKm)
            .sorted(SAFETY_THEN_DISTANCE)
            .limit(limit)
            .collect(Collectors.toList());
    }

    /**
     * 검색용: 메뉴 이름에 검색어가 포함된 결과 우선, 그다음 안전 평점 내림차순
     */
    public static List<FoodRecommendation> rankByNameMatch(List<FoodRecommendation> candidates,
                                                           String query, int limit) {
        String queryLower = query == null ? "" : query.toLowerCase(Locale.ROOT);
        Comparator<FoodRecommendation> nameMatchFirst = Comparator
            .comparing((FoodRecommendation r) -> nameMatches(r, queryLower) ? 0 : 1)
            .thenComparing(Comparator.comparingDouble(RecommendationRanker::overall).reversed());

        return candidates.stream()
            .sorted(nameMatchFirst)
            .limit(limit)
            .collect(Collectors.toList());
    }

    /**
     * 오늘 첫 영업 구간 "HH:mm - HH:mm", 오늘 영업 정보가 없으면 CLOSED_TODAY
     */
    public static String bestTime(List<OperatingSlot> operatingHours, DayOfWeek today) {
        if (operatingHours != null) {
            for (OperatingSlot slot : operatingHours) {
                if (slot.getDay() == today) {
                    return slot.getOpen() + " - " + slot.getClose();
                }
            }
        }
        return CLOSED_TODAY;
    }

    private static boolean nameMatches(FoodRecommendation recommendation, String queryLower) {
        return recommendation.getName() != null
            && recommendation.getName().toLowerCase(Locale.ROOT).contains(queryLower);
    }

    private static double overall(FoodRecommendation recommendation) {
        if (recommendation.getSafetyRating() == null || recommendation.getSafetyRating().getOverall() == null) {
            return 0.0;
        }
        return recommendation.getSafetyRating().getOverall();
    }
}
