package com.localguide.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CulturalRegionGroup {
    private String region;
    private double topScore;
    private List<CulturalSearchResult> results;
}
