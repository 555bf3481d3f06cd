package com.localguide.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;

/**
 * 요일별 영업 시간 (HH:mm 문자열)
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OperatingSlot {

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    private DayOfWeek day;

    @Column(name = "open_time", nullable = false, length = 5)
    private String open;

    @Column(name = "close_time", nullable = false, length = 5)
    private String close;
}
