package com.localguide.model.cultural;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Festival {
    private String name;
    private String date; // 음력 기준이라 해마다 바뀌는 경우가 많아 자유 텍스트
    private String significance;
    private List<String> celebrations = new ArrayList<>();
    private List<String> regions = new ArrayList<>();
    private List<String> dosDonts = new ArrayList<>();
}
