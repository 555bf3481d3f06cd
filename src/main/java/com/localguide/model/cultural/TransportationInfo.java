package com.localguide.model.cultural;

import com.localguide.dto.PriceRangeDto;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransportationInfo {
    private List<String> publicTransport = new ArrayList<>();
    private List<String> tips = new ArrayList<>();
    private List<PriceRangeDto> costs = new ArrayList<>(); // publicTransport와 같은 순서
}
