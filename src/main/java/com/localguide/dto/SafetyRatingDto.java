package com.localguide.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafetyRatingDto {

    @NotNull @DecimalMin("1.0") @DecimalMax("5.0")
    private Double overall;

    @NotNull @DecimalMin("1.0") @DecimalMax("5.0")
    private Double hygiene;

    @NotNull @DecimalMin("1.0") @DecimalMax("5.0")
    private Double freshness;

    @NotNull @DecimalMin("1.0") @DecimalMax("5.0")
    private Double popularity;

    @NotNull @Min(0)
    private Integer reviewCount;

    private LocalDateTime lastUpdated; // 응답 전용 (요청 값은 무시)
}
