package com.localguide.dto.request;

import com.localguide.dto.DietaryInfoDto;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
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
public class FoodItemRequest {

    @NotBlank
    private String name;

    private String description;

    @NotBlank
    private String category;

    private String region;

    @Builder.Default
    private List<String> ingredients = new ArrayList<>();

    private DietaryInfoDto dietaryInfo;

    @PositiveOrZero
    private Integer preparationTime;

    @Pattern(regexp = "mild|medium|hot|very-hot")
    private String spiceLevel;
}
