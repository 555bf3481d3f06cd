package com.localguide;

import com.localguide.model.cultural.CulturalCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class LocalGuideApplicationTests {

    @Autowired
    private CulturalCatalog culturalCatalog;

    @Test
    void contextLoads() {
        assertThat(culturalCatalog.getRegions()).containsKeys("delhi", "mumbai");
        assertThat(culturalCatalog.getFestivals()).containsKeys("diwali", "holi");
    }
}
