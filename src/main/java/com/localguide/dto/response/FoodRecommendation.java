package com.localguide.dto.response;

import com.localguide.dto.DietaryInfoDto;
import com.localguide.dto.LocationDto;
import com.localguide.dto.PriceRangeDto;
import com.localguide.dto.SafetyRatingDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 추천 결과 1건 = 메뉴 정보 + 판매 벤더의 평점/가격/영업시간 + 기준점으로부터 거리
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FoodRecommendation {
    private String vendorId;
    private String vendorName;
    private String foodItemId;
    private String name;
    private String description;
    private String category;
    private LocationDto location;
    private SafetyRatingDto safetyRating;
    private PriceRangeDto priceRange;
    private DietaryInfoDto dietaryInfo;
    private String spiceLevel;
    private String bestTime;
    private List<String> hygieneNotes;
    private double distance; // km
}
