package com.localguide.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 벤더 위생/안전 평점 (각 항목 1 ~ 5)
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafetyRating {

    @Column(name = "safety_overall", nullable = false)
    private Double overall;

    @Column(name = "safety_hygiene", nullable = false)
    private Double hygiene;

    @Column(name = "safety_freshness", nullable = false)
    private Double freshness;

    @Column(name = "safety_popularity", nullable = false)
    private Double popularity;

    @Column(name = "review_count", nullable = false)
    private Integer reviewCount;

    @Column(name = "safety_updated_at")
    private LocalDateTime lastUpdated;
}
