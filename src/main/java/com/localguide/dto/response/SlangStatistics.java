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
public class SlangStatistics {
    private long totalTerms;
    private Map<String, Long> termsByLanguage;
    private Map<String, Long> termsByRegion;
    private double averagePopularity;
}
