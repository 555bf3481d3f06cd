package com.localguide.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 음식 추천 필터 (모두 선택)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationFilters {
    private Boolean vegetarianOnly;
    private Boolean veganOnly;
    private String spiceLevel; // mild | medium | hot | very-hot

    @Positive
    private Double maxPrice; // 벤더 가격 상한 기준

    @DecimalMin("1.0")
    @DecimalMax("5.0")
    private Double minSafetyRating;

    @Positive
    private Double radiusKm;
}
