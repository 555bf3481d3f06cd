package com.localguide.model.cultural;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Custom {
    private String name;
    private String description;
    private String significance;
    private List<String> dosDonts = new ArrayList<>();
}
