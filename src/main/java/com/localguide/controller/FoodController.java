package com.localguide.controller;

import com.localguide.dto.LocationDto;
import com.localguide.dto.SafetyRatingDto;
import com.localguide.dto.request.FoodItemRequest;
import com.localguide.dto.request.FoodRecommendationRequest;
import com.localguide.dto.request.FoodVendorRequest;
import com.localguide.dto.response.ApiResponse;
import com.localguide.dto.response.FoodHub;
import com.localguide.dto.response.FoodItemResponse;
import com.localguide.dto.response.FoodRecommendation;
import com.localguide.dto.response.FoodStatistics;
import com.localguide.dto.response.FoodVendorResponse;
import com.localguide.interceptor.ApiLoggingInterceptor;
import com.localguide.model.ContentType;
import com.localguide.service.FoodRecommendationService;
import com.localguide.service.HistoryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 음식 추천 및 벤더 관리 REST API 컨트롤러
 */
@RestController
@RequestMapping("/api/food")
@CrossOrigin(origins = {"https://localguide.vercel.app", "http://localhost:3000"})
@Validated
public class FoodController {

    @Autowired
    private FoodRecommendationService foodRecommendationService;

    @Autowired
    private HistoryService historyService;

    /**
     * 위치 기반 추천 API
     * POST /api/food/recommendations
     */
    @PostMapping("/recommendations")
    public ResponseEntity<ApiResponse<List<FoodRecommendation>>> recommend(
            @Valid @RequestBody FoodRecommendationRequest request,
            @RequestHeader(value = ApiLoggingInterceptor.USER_ID_HEADER, required = false) String userId
    ) {
        List<FoodRecommendation> recommendations =
            foodRecommendationService.recommend(request.getLocation(), request.getFilters());

        if (userId != null) {
            LocationDto location = request.getLocation();
            String query = location.getCity() != null
                ? location.getCity()
                : location.getLatitude() + "," + location.getLongitude();
            historyService.record(userId, ContentType.FOOD, query, recommendations.size());
        }
        return ResponseEntity.ok(ApiResponse.ok(recommendations));
    }

    /**
     * 카테고리별 조회
     * GET /api/food/category/{category}?lat=&lng=
     */
    @GetMapping("/category/{category}")
    public ResponseEntity<ApiResponse<List<FoodRecommendation>>> byCategory(
            @PathVariable String category,
            @RequestParam @DecimalMin("-90.0") @DecimalMax("90.0") Double lat,
            @RequestParam @DecimalMin("-180.0") @DecimalMax("180.0") Double lng
    ) {
        LocationDto location = LocationDto.builder().latitude(lat).longitude(lng).build();
        return ResponseEntity.ok(ApiResponse.ok(foodRecommendationService.byCategory(category, location)));
    }

    /**
     * 메뉴 검색
     * GET /api/food/search?q=&lat=&lng=
     */
    @GetMapping("/search")
    public ResponseEntity<ApiResponse<List<FoodRecommendation>>> search(
            @RequestParam("q") String query,
            @RequestParam @DecimalMin("-90.0") @DecimalMax("90.0") Double lat,
            @RequestParam @DecimalMin("-180.0") @DecimalMax("180.0") Double lng,
            @RequestHeader(value = ApiLoggingInterceptor.USER_ID_HEADER, required = false) String userId
    ) {
        LocationDto location = LocationDto.builder().latitude(lat).longitude(lng).build();
        List<FoodRecommendation> results = foodRecommendationService.search(query, location);
        if (userId != null) {
            historyService.record(userId, ContentType.FOOD, query, results.size());
        }
        return ResponseEntity.ok(ApiResponse.ok(results));
    }

    @GetMapping("/hubs/{city}")
    public ResponseEntity<ApiResponse<List<FoodHub>>> hubs(@PathVariable String city) {
        return ResponseEntity.ok(ApiResponse.ok(foodRecommendationService.popularHubs(city)));
    }

    @GetMapping("/safety/{vendorId}")
    public ResponseEntity<ApiResponse<SafetyRatingDto>> safety(@PathVariable String vendorId) {
        return ResponseEntity.ok(ApiResponse.ok(foodRecommendationService.rateSafety(vendorId)));
    }

    @PutMapping("/safety/{vendorId}")
    public ResponseEntity<ApiResponse<SafetyRatingDto>> updateSafety(
            @PathVariable String vendorId,
            @Valid @RequestBody SafetyRatingDto rating
    ) {
        SafetyRatingDto updated = foodRecommendationService.updateSafetyRating(vendorId, rating);
        return ResponseEntity.ok(ApiResponse.ok(updated, "Safety rating updated"));
    }

    @PostMapping("/vendors")
    public ResponseEntity<ApiResponse<FoodVendorResponse>> addVendor(@Valid @RequestBody FoodVendorRequest request) {
        FoodVendorResponse created = foodRecommendationService.addVendor(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created, "Vendor added"));
    }

    @PostMapping("/items")
    public ResponseEntity<ApiResponse<FoodItemResponse>> addItem(@Valid @RequestBody FoodItemRequest request) {
        FoodItemResponse created = foodRecommendationService.addFoodItem(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created, "Food item added"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<FoodStatistics>> statistics() {
        return ResponseEntity.ok(ApiResponse.ok(foodRecommendationService.statistics()));
    }
}
