package com.localguide.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceRangeDto {

    @NotNull @PositiveOrZero
    private Double min;

    @NotNull @PositiveOrZero
    private Double max;

    @Size(min = 3, max = 3)
    private String currency = "INR";
}
