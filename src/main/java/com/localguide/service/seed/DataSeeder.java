package com.localguide.service.seed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.localguide.dto.request.FoodItemRequest;
import com.localguide.dto.request.FoodVendorRequest;
import com.localguide.dto.request.SlangTermRequest;
import com.localguide.exception.ConflictException;
import com.localguide.repository.FoodVendorRepository;
import com.localguide.service.FoodRecommendationService;
import com.localguide.service.SlangTranslationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * 기동 시 seed/*.json 을 서비스 계층을 통해 적재
 * 이미 있는 용어/메뉴는 건너뛰고, 벤더는 테이블이 비어 있을 때만 넣는다
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "guide.seed", name = "enabled", havingValue = "true")
public class DataSeeder implements ApplicationRunner {

    static final String SLANG_TERMS = "classpath:seed/slang-terms.json";
    static final String FOOD_ITEMS = "classpath:seed/food-items.json";
    static final String FOOD_VENDORS = "classpath:seed/food-vendors.json";

    private final SlangTranslationService slangTranslationService;
    private final FoodRecommendationService foodRecommendationService;
    private final FoodVendorRepository foodVendorRepository;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) {
        long start = System.currentTimeMillis();

        int terms = seedSlangTerms();
        int items = seedFoodItems();
        int vendors = seedVendors();

        log.info("[DataSeeder] run - slangTerms: {}, foodItems: {}, vendors: {}, elapsedMs: {}",
            terms, items, vendors, System.currentTimeMillis() - start);
    }

    int seedSlangTerms() {
        List<SlangTermRequest> requests = read(SLANG_TERMS, new TypeReference<List<SlangTermRequest>>() {});
        int inserted = 0;
        for (SlangTermRequest request : requests) {
            try {
                slangTranslationService.add(request);
                inserted++;
            } catch (ConflictException e) {
                log.debug("[DataSeeder] seedSlangTerms - skip existing term: {}", request.getTerm());
            }
        }
        return inserted;
    }

    int seedFoodItems() {
        List<FoodItemRequest> requests = read(FOOD_ITEMS, new TypeReference<List<FoodItemRequest>>() {});
        int inserted = 0;
        for (FoodItemRequest request : requests) {
            try {
                foodRecommendationService.addFoodItem(request);
                inserted++;
            } catch (ConflictException e) {
                log.debug("[DataSeeder] seedFoodItems - skip existing item: {}", request.getName());
            }
        }
        return inserted;
    }

    int seedVendors() {
        if (foodVendorRepository.count() > 0) {
            log.debug("[DataSeeder] seedVendors - vendors already present, skipping");
            return 0;
        }
        List<FoodVendorRequest> requests = read(FOOD_VENDORS, new TypeReference<List<FoodVendorRequest>>() {});
        for (FoodVendorRequest request : requests) {
            foodRecommendationService.addVendor(request);
        }
        return requests.size();
    }

    private <T> List<T> read(String location, TypeReference<List<T>> type) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read seed file " + location, e);
        }
    }
}
