package com.localguide.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FoodStatistics {
    private long totalVendors;
    private long totalFoodItems;
    private long vegetarianItems;
    private Map<String, Long> vendorsByCity;
    private Map<String, Long> itemsByCategory;
    private double averageSafetyRating;
}
