package com.localguide.model.cultural;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EtiquetteRule {
    private String context;
    private List<String> rules = new ArrayList<>();
    private String importance; // high | medium | low
}
