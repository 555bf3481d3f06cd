package com.localguide.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceRange {

    @Column(name = "price_min", nullable = false)
    private Double min;

    @Column(name = "price_max", nullable = false)
    private Double max;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency; // ISO 4217, 기본 INR
}
