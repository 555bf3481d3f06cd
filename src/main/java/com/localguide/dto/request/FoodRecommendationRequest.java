package com.localguide.dto.request;

import com.localguide.dto.LocationDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FoodRecommendationRequest {

    @NotNull
    @Valid
    private LocationDto location;

    @Valid
    private RecommendationFilters filters;
}
