package com.localguide.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * guide.* 설정 바인딩
 * 매칭/랭킹 상수 중 운영에서 바꿀 수 있는 값만 여기로 뺌 (신뢰도 감쇠 등 고정 상수는 코드에 둠)
 */
@Data
@ConfigurationProperties(prefix = "guide")
public class GuideProperties {

    private Translation translation = new Translation();
    private Food food = new Food();
    private History history = new History();
    private ApiLog apiLog = new ApiLog();
    private Seed seed = new Seed();
    private Cultural cultural = new Cultural();

    @Data
    public static class Translation {
        private String sourceLanguage = "hindi";
        private String targetLanguage = "english";
        private String defaultContext = "casual";
        private List<String> allowedLanguages = new ArrayList<>(List.of("hindi", "english"));
    }

    @Data
    public static class Food {
        private double defaultRadiusKm = 5.0;
        private double crossReferenceRadiusKm = 10.0;
        private double hubRadiusKm = 50.0;
        private int recommendationLimit = 20;
        private int searchLimit = 15;
        private double defaultMinSafetyRating = 3.0;
        // 도시명(소문자) -> 중심 좌표
        private Map<String, CityCenter> cityCenters = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CityCenter {
        private double latitude;
        private double longitude;
    }

    @Data
    public static class History {
        private int maxEntries = 50;
        private long ttlDays = 30;
    }

    @Data
    public static class ApiLog {
        private int retentionDays = 30;
        private String purgeCron = "0 0 3 * * *";
    }

    @Data
    public static class Seed {
        private boolean enabled = false;
    }

    @Data
    public static class Cultural {
        private String catalogLocation = "classpath:cultural/catalog.json";
    }
}
