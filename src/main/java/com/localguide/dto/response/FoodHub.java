package com.localguide.dto.response;

import com.localguide.dto.LocationDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FoodHub {
    private String name;
    private LocationDto location;
    private String description;
    @Builder.Default
    private List<String> popularItems = new ArrayList<>();
    private String bestTimeToVisit;
    @Builder.Default
    private List<String> safetyTips = new ArrayList<>();
}
