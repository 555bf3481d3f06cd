package com.localguide.dto.request;

import com.localguide.dto.LocationDto;
import com.localguide.dto.OperatingSlotDto;
import com.localguide.dto.PriceRangeDto;
import com.localguide.dto.SafetyRatingDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 벤더 등록 요청
 * 메뉴는 foodItemIds 또는 foodItemNames(시드 데이터용)로 지정
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FoodVendorRequest {

    @NotBlank
    private String name;

    @NotNull
    @Valid
    private LocationDto location;

    @Builder.Default
    private List<String> foodItemIds = new ArrayList<>();

    @Builder.Default
    private List<String> foodItemNames = new ArrayList<>();

    @NotNull
    @Valid
    private SafetyRatingDto safetyRating;

    @NotNull
    @Valid
    private PriceRangeDto priceRange;

    @Valid
    @Builder.Default
    private List<OperatingSlotDto> operatingHours = new ArrayList<>();

    @Builder.Default
    private List<String> hygieneNotes = new ArrayList<>();
}
