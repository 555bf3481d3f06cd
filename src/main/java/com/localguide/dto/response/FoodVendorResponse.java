package com.localguide.dto.response;

import com.localguide.dto.LocationDto;
import com.localguide.dto.OperatingSlotDto;
import com.localguide.dto.PriceRangeDto;
import com.localguide.dto.SafetyRatingDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FoodVendorResponse {
    private String id;
    private String name;
    private LocationDto location;
    private List<String> foodItemIds;
    private SafetyRatingDto safetyRating;
    private PriceRangeDto priceRange;
    private List<OperatingSlotDto> operatingHours;
    private List<String> hygieneNotes;
}
