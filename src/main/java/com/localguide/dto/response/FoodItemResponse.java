package com.localguide.dto.response;

import com.localguide.dto.DietaryInfoDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FoodItemResponse {
    private String id;
    private String name;
    private String description;
    private String category;
    private String region;
    private List<String> ingredients;
    private DietaryInfoDto dietaryInfo;
    private Integer preparationTime;
    private String spiceLevel;
}
