package com.localguide.dto;

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
public class DietaryInfoDto {
    private boolean vegetarian;
    private boolean vegan;
    private boolean glutenFree;
    @Builder.Default
    private List<String> allergens = new ArrayList<>();
}
