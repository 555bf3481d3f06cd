package com.localguide.model.cultural;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegionalInfo {
    private String region;
    private List<String> languages = new ArrayList<>();
    private List<Custom> customs = new ArrayList<>();
    private List<Festival> festivals = new ArrayList<>();
    private List<EtiquetteRule> etiquette = new ArrayList<>();
    private TransportationInfo transportation;
}
