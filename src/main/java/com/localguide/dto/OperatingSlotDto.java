package com.localguide.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OperatingSlotDto {

    @NotNull
    private DayOfWeek day; // MONDAY ~ SUNDAY

    @NotNull
    @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$")
    private String open;

    @NotNull
    @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$")
    private String close;
}
