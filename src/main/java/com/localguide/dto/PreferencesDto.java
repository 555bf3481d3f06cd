package com.localguide.dto;

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
public class PreferencesDto {
    @Builder.Default
    private List<String> dietaryRestrictions = new ArrayList<>();
    private String spicePreference;
    @Builder.Default
    private List<String> preferredRegions = new ArrayList<>();
    private String languagePreference;
    @PositiveOrZero
    private Double budgetMin;
    @PositiveOrZero
    private Double budgetMax;
}
