package com.localguide.model.cultural;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BargainingTip {
    private String context;
    private List<String> tips = new ArrayList<>();
    private String expectedDiscount;
    private List<String> culturalNotes = new ArrayList<>();
}
