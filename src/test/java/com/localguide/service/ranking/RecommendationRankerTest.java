package com.localguide.service.ranking;

import com.localguide.dto.SafetyRatingDto;
import com.localguide.dto.response.FoodRecommendation;
import com.localguide.entity.OperatingSlot;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationRankerTest {

    @Test
    void excludesCandidatesOutsideRadius() {
        FoodRecommendation near = recommendation("near", "Vada Pav", 4.0, 3.0);
        FoodRecommendation far = recommendation("far", "Vada Pav", 4.9, 12.0);

        assertThat(RecommendationRanker.rankWithinRadius(List.of(near, far), 10.0, 20))
            .extracting(FoodRecommendation::getVendorId)
            .containsExactly("near");
    }

    @Test
    void ordersBySafetyThenDistance() {
        FoodRecommendation a = recommendation("a", "Dosa", 4.2, 1.0);
        FoodRecommendation b = recommendation("b", "Dosa", 4.5, 4.0);
        FoodRecommendation c = recommendation("c", "Dosa", 4.5, 2.0);

        assertThat(RecommendationRanker.rankWithinRadius(List.of(a, b, c), 5.0, 20))
            .extracting(FoodRecommendation::getVendorId)
            .containsExactly("c", "b", "a");
    }

    @Test
    void boundaryDistanceIsIncludedAndLimitApplies() {
        FoodRecommendation edge = recommendation("edge", "Dosa", 3.0, 5.0);
        FoodRecommendation inner = recommendation("inner", "Dosa", 4.0, 1.0);

        assertThat(RecommendationRanker.rankWithinRadius(List.of(edge, inner), 5.0, 20)).hasSize(2);
        assertThat(RecommendationRanker.rankWithinRadius(List.of(edge, inner), 5.0, 1))
            .extracting(FoodRecommendation::getVendorId)
            .containsExactly("inner");
    }

    @Test
    void nameMatchesComeFirst() {
        FoodRecommendation dosa = recommendation("1", "Masala Dosa", 3.5, 1.0);
        FoodRecommendation biryani = recommendation("2", "Biryani", 4.8, 1.0);

        assertThat(RecommendationRanker.rankByNameMatch(List.of(biryani, dosa), "DOSA", 15))
            .extracting(FoodRecommendation::getVendorId)
            .containsExactly("1", "2");
    }

    @Test
    void bestTimeUsesFirstSlotOfToday() {
        List<OperatingSlot> hours = List.of(
            new OperatingSlot(DayOfWeek.MONDAY, "06:30", "11:00"),
            new OperatingSlot(DayOfWeek.MONDAY, "15:30", "20:30"),
            new OperatingSlot(DayOfWeek.TUESDAY, "07:00", "15:00"));

        assertThat(RecommendationRanker.bestTime(hours, DayOfWeek.MONDAY)).isEqualTo("06:30 - 11:00");
        assertThat(RecommendationRanker.bestTime(hours, DayOfWeek.SUNDAY)).isEqualTo(RecommendationRanker.CLOSED_TODAY);
        assertThat(RecommendationRanker.bestTime(null, DayOfWeek.SUNDAY)).isEqualTo(RecommendationRanker.CLOSED_TODAY);
    }

    private static FoodRecommendation recommendation(String vendorId, String name, double overall, double distance) {
        return FoodRecommendation.builder()
            .vendorId(vendorId)
            .name(name)
            .safetyRating(SafetyRatingDto.builder().overall(overall).build())
            .distance(distance)
            .build();
    }
}
