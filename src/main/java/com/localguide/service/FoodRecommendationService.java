package com.localguide.service;

import com.localguide.config.GuideProperties;
import com.localguide.dto.DietaryInfoDto;
import com.localguide.dto.LocationDto;
import com.localguide.dto.OperatingSlotDto;
import com.localguide.dto.PriceRangeDto;
import com.localguide.dto.SafetyRatingDto;
import com.localguide.dto.request.FoodItemRequest;
import com.localguide.dto.request.FoodVendorRequest;
import com.localguide.dto.request.RecommendationFilters;
import com.localguide.dto.response.FoodHub;
import com.localguide.dto.response.FoodItemResponse;
import com.localguide.dto.response.FoodRecommendation;
import com.localguide.dto.response.FoodStatistics;
import com.localguide.dto.response.FoodVendorResponse;
import com.localguide.entity.FoodItem;
import com.localguide.entity.FoodVendor;
import com.localguide.entity.OperatingSlot;
import com.localguide.entity.PriceRange;
import com.localguide.entity.SafetyRating;
import com.localguide.entity.VendorLocation;
import com.localguide.exception.ConflictException;
import com.localguide.exception.NotFoundException;
import com.localguide.exception.ValidationException;
import com.localguide.repository.FoodItemRepository;
import com.localguide.repository.FoodVendorRepository;
import com.localguide.repository.projection.VendorOffering;
import com.localguide.service.geo.GeoDistance;
import com.localguide.service.matching.TextNormalizer;
import com.localguide.service.ranking.RecommendationRanker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 음식 추천 서비스
 * 반경 조회는 DB(Haversine SQL)에서 1차로 거르고, 거리는 GeoDistance로 다시 계산해 최종 필터/정렬
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FoodRecommendationService {

    static final int SEARCH_CANDIDATE_LIMIT = 50;
    static final Set<String> SPICE_LEVELS = Set.of("mild", "medium", "hot", "very-hot");

    private final FoodVendorRepository foodVendorRepository;
    private final FoodItemRepository foodItemRepository;
    private final GuideProperties properties;
    private final Clock clock;

    /**
     * 위치 기반 추천: 필터 통과 (벤더, 메뉴) 쌍을 안전 평점 내림차순, 거리 오름차순으로 최대 20개
     */
    @Transactional(readOnly = true)
    public List<FoodRecommendation> recommend(LocationDto location, RecommendationFilters filters) {
        requireValidLocation(location);
        GuideProperties.Food config = properties.getFood();
        RecommendationFilters effective = filters != null ? filters : new RecommendationFilters();
        double radiusKm = effective.getRadiusKm() != null ? effective.getRadiusKm() : config.getDefaultRadiusKm();
        double minSafetyRating = effective.getMinSafetyRating() != null
            ? effective.getMinSafetyRating() : config.getDefaultMinSafetyRating();
        log.debug("[FoodRecommendationService] recommend - lat: {}, lng: {}, radiusKm: {}, filters: {}",
            location.getLatitude(), location.getLongitude(), radiusKm, effective);

        try {
            List<String> vendorIds = foodVendorRepository.findIdsWithinRadius(
                location.getLatitude(), location.getLongitude(), radiusKm);
            if (vendorIds.isEmpty()) {
                log.info("[FoodRecommendationService] recommend - no vendors within {}km of {}", radiusKm, location.getCity());
                return List.of();
            }

            List<VendorOffering> offerings = foodVendorRepository.findOfferings(vendorIds,
                Boolean.TRUE.equals(effective.getVegetarianOnly()),
                Boolean.TRUE.equals(effective.getVeganOnly()),
                TextNormalizer.isBlank(effective.getSpiceLevel()) ? null : effective.getSpiceLevel().trim(),
                effective.getMaxPrice(),
                minSafetyRating);

            List<FoodRecommendation> ranked = RecommendationRanker.rankWithinRadius(
                toRecommendations(offerings, location), radiusKm, config.getRecommendationLimit());
            log.info("[FoodRecommendationService] recommend - city: {}, count: {}", location.getCity(), ranked.size());
            return ranked;
        } catch (DataAccessException e) {
            log.error("[FoodRecommendationService] recommend - lookup failed, location: {}", location, e);
            throw e;
        }
    }

    /**
     * 카테고리 조회: 카테고리 메뉴 x 10km 안의 판매 벤더, 최대 15개
     */
    @Transactional(readOnly = true)
    public List<FoodRecommendation> byCategory(String category, LocationDto location) {
        requireValidLocation(location);
        log.debug("[FoodRecommendationService] byCategory - category: {}, lat: {}, lng: {}",
            category, location.getLatitude(), location.getLongitude());
        if (TextNormalizer.isBlank(category)) {
            return List.of();
        }

        List<FoodItem> items = foodItemRepository.findByCategoryIgnoreCase(category.trim());
        double radiusKm = properties.getFood().getCrossReferenceRadiusKm();
        List<FoodRecommendation> candidates = crossReference(items, location, radiusKm);

        List<FoodRecommendation> ranked = RecommendationRanker.rankWithinRadius(
            candidates, radiusKm, properties.getFood().getSearchLimit());
        log.info("[FoodRecommendationService] byCategory - category: {}, count: {}", category, ranked.size());
        return ranked;
    }

    /**
     * 자유 검색: 이름/설명/카테고리 부분 일치 메뉴 x 10km 안의 판매 벤더
     * 이름에 검색어가 들어간 결과가 평점과 관계없이 먼저 온다
     */
    @Transactional(readOnly = true)
    public List<FoodRecommendation> search(String query, LocationDto location) {
        requireValidLocation(location);
        log.debug("[FoodRecommendationService] search - query: {}, lat: {}, lng: {}",
            query, location.getLatitude(), location.getLongitude());
        if (TextNormalizer.isBlank(query)) {
            return List.of();
        }

        String trimmed = query.trim();
        List<FoodItem> items = foodItemRepository.searchText(trimmed, PageRequest.of(0, SEARCH_CANDIDATE_LIMIT));
        double radiusKm = properties.getFood().getCrossReferenceRadiusKm();
        List<FoodRecommendation> withinRadius = crossReference(items, location, radiusKm).stream()
            .filter(r -> r.getDistance() <= radiusKm)
            .collect(Collectors.toList());

        List<FoodRecommendation> ranked = RecommendationRanker.rankByNameMatch(
            withinRadius, trimmed, properties.getFood().getSearchLimit());
        log.info("[FoodRecommendationService] search - query: {}, count: {}", query, ranked.size());
        return ranked;
    }

    private List<FoodRecommendation> crossReference(List<FoodItem> items, LocationDto location, double radiusKm) {
        if (items.isEmpty()) {
            return List.of();
        }
        List<String> vendorIds = foodVendorRepository.findIdsWithinRadius(
            location.getLatitude(), location.getLongitude(), radiusKm);
        if (vendorIds.isEmpty()) {
            return List.of();
        }
        List<String> itemIds = items.stream().map(FoodItem::getId).collect(Collectors.toList());
        return toRecommendations(foodVendorRepository.findOfferingsForItems(vendorIds, itemIds), location);
    }

    /**
     * 도시별 음식 허브: 도시 중심 50km 안 벤더를 (도시, 위도*100 내림, 경도*100 내림) 칸으로 묶음
     * 중심은 설정된 도시 좌표, 없으면 해당 도시 벤더들의 평균 좌표. 모르는 도시는 빈 목록
     */
    @Transactional(readOnly = true)
    public List<FoodHub> popularHubs(String city) {
        log.debug("[FoodRecommendationService] popularHubs - city: {}", city);
        if (TextNormalizer.isBlank(city)) {
            return List.of();
        }

        GuideProperties.CityCenter center = resolveCityCenter(city.trim());
        if (center == null) {
            log.info("[FoodRecommendationService] popularHubs - unknown city: {}", city);
            return List.of();
        }

        double radiusKm = properties.getFood().getHubRadiusKm();
        List<String> vendorIds = foodVendorRepository.findIdsWithinRadius(center.getLatitude(), center.getLongitude(), radiusKm);
        Map<String, FoodVendor> vendorsById = foodVendorRepository.findAllById(vendorIds).stream()
            .collect(Collectors.toMap(FoodVendor::getId, Function.identity()));

        DayOfWeek today = LocalDate.now(clock).getDayOfWeek();
        Map<String, FoodHub> hubs = new LinkedHashMap<>();
        for (String vendorId : vendorIds) {
            FoodVendor vendor = vendorsById.get(vendorId);
            if (vendor == null) {
                continue;
            }
            VendorLocation vendorLocation = vendor.getLocation();
            double distance = GeoDistance.haversineKm(center.getLatitude(), center.getLongitude(),
                vendorLocation.getLatitude(), vendorLocation.getLongitude());
            if (distance > radiusKm) {
                continue;
            }

            String vendorCity = vendorLocation.getCity();
            String areaKey = vendorCity + "-" + (long) Math.floor(vendorLocation.getLatitude() * 100)
                + "-" + (long) Math.floor(vendorLocation.getLongitude() * 100);
            FoodHub hub = hubs.computeIfAbsent(areaKey, key -> FoodHub.builder()
                .name(vendorCity + " Food Hub")
                .location(toLocationDto(vendorLocation))
                .description("Popular food area in " + vendorCity)
                .bestTimeToVisit(RecommendationRanker.bestTime(vendor.getOperatingHours(), today))
                .safetyTips(new ArrayList<>(List.of("Accessible by local transport in " + vendorCity)))
                .build());

            for (FoodItem item : vendor.getFoodItems()) {
                if (!hub.getPopularItems().contains(item.getName())) {
                    hub.getPopularItems().add(item.getName());
                }
            }
        }

        List<FoodHub> result = new ArrayList<>(hubs.values());
        result.sort(Comparator.comparingInt((FoodHub h) -> h.getPopularItems().size()).reversed());
        log.info("[FoodRecommendationService] popularHubs - city: {}, count: {}", city, result.size());
        return result;
    }

    private GuideProperties.CityCenter resolveCityCenter(String city) {
        GuideProperties.CityCenter configured = properties.getFood().getCityCenters().get(city.toLowerCase(Locale.ROOT));
        if (configured != null) {
            return configured;
        }

        List<FoodVendor> cityVendors = foodVendorRepository.findByLocationCityIgnoreCase(city);
        if (cityVendors.isEmpty()) {
            return null;
        }
        double latitude = cityVendors.stream().mapToDouble(v -> v.getLocation().getLatitude()).average().orElse(0);
        double longitude = cityVendors.stream().mapToDouble(v -> v.getLocation().getLongitude()).average().orElse(0);
        return new GuideProperties.CityCenter(latitude, longitude);
    }

    @Transactional(readOnly = true)
    public SafetyRatingDto rateSafety(String vendorId) {
        log.debug("[FoodRecommendationService] rateSafety - vendorId: {}", vendorId);
        FoodVendor vendor = foodVendorRepository.findById(vendorId)
            .orElseThrow(() -> NotFoundException.of("Vendor", vendorId));
        return toSafetyDto(vendor.getSafetyRating());
    }

    @Transactional
    public SafetyRatingDto updateSafetyRating(String vendorId, SafetyRatingDto rating) {
        log.debug("[FoodRecommendationService] updateSafetyRating - vendorId: {}, overall: {}", vendorId, rating.getOverall());
        List<String> errors = new ArrayList<>();
        validateRating(rating, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid safety rating", errors);
        }

        FoodVendor vendor = foodVendorRepository.findById(vendorId)
            .orElseThrow(() -> NotFoundException.of("Vendor", vendorId));
        vendor.setSafetyRating(toSafetyRating(rating));
        foodVendorRepository.save(vendor);

        log.info("[FoodRecommendationService] updateSafetyRating - vendorId: {}, overall: {}", vendorId, rating.getOverall());
        return toSafetyDto(vendor.getSafetyRating());
    }

    @Transactional
    public FoodItemResponse addFoodItem(FoodItemRequest request) {
        log.debug("[FoodRecommendationService] addFoodItem - name: {}, category: {}", request.getName(), request.getCategory());
        List<String> errors = new ArrayList<>();
        if (TextNormalizer.isBlank(request.getName())) {
            errors.add("name: must not be empty");
        }
        if (TextNormalizer.isBlank(request.getCategory())) {
            errors.add("category: must not be empty");
        }
        if (request.getSpiceLevel() != null && !SPICE_LEVELS.contains(request.getSpiceLevel())) {
            errors.add("spiceLevel: must be one of [mild, medium, hot, very-hot]");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid food item", errors);
        }

        String region = request.getRegion() != null ? request.getRegion().trim() : "";
        if (foodItemRepository.existsByNameIgnoreCaseAndRegionIgnoreCase(request.getName().trim(), region)) {
            throw new ConflictException("Food item \"" + request.getName() + "\" already exists for region \"" + region + "\"");
        }

        FoodItem item = new FoodItem();
        item.setName(request.getName().trim());
        item.setDescription(request.getDescription());
        item.setCategory(request.getCategory().trim());
        item.setRegion(region);
        item.setIngredients(request.getIngredients() != null ? new ArrayList<>(request.getIngredients()) : new ArrayList<>());
        DietaryInfoDto dietary = request.getDietaryInfo() != null ? request.getDietaryInfo() : new DietaryInfoDto();
        item.setVegetarian(dietary.isVegetarian());
        item.setVegan(dietary.isVegan());
        item.setGlutenFree(dietary.isGlutenFree());
        item.setAllergens(dietary.getAllergens() != null ? new ArrayList<>(dietary.getAllergens()) : new ArrayList<>());
        item.setPreparationTime(request.getPreparationTime());
        item.setSpiceLevel(request.getSpiceLevel());

        FoodItem saved = foodItemRepository.save(item);
        log.info("[FoodRecommendationService] addFoodItem - saved id: {}, name: {}", saved.getId(), saved.getName());
        return toItemResponse(saved);
    }

    @Transactional
    public FoodVendorResponse addVendor(FoodVendorRequest request) {
        log.debug("[FoodRecommendationService] addVendor - name: {}", request.getName());
        List<String> errors = new ArrayList<>();
        if (TextNormalizer.isBlank(request.getName())) {
            errors.add("name: must not be empty");
        }
        LocationDto location = request.getLocation();
        if (location == null || !GeoDistance.isValidCoordinate(location.getLatitude(), location.getLongitude())) {
            errors.add("location: latitude must be within [-90, 90] and longitude within [-180, 180]");
        } else if (TextNormalizer.isBlank(location.getCity())) {
            errors.add("location.city: must not be empty");
        }
        PriceRangeDto price = request.getPriceRange();
        if (price == null || price.getMin() == null || price.getMax() == null) {
            errors.add("priceRange: min and max are required");
        } else if (price.getMax() < price.getMin()) {
            errors.add("priceRange: max must be greater than or equal to min");
        }
        if (request.getSafetyRating() == null) {
            errors.add("safetyRating: must not be null");
        } else {
            validateRating(request.getSafetyRating(), errors);
        }
        List<FoodItem> items = resolveFoodItems(request, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid food vendor", errors);
        }

        FoodVendor vendor = new FoodVendor();
        vendor.setName(request.getName().trim());
        vendor.setLocation(VendorLocation.builder()
            .latitude(location.getLatitude())
            .longitude(location.getLongitude())
            .address(location.getAddress())
            .city(location.getCity().trim())
            .state(location.getState())
            .country(location.getCountry() != null ? location.getCountry() : "India")
            .build());
        vendor.setFoodItems(items);
        vendor.setSafetyRating(toSafetyRating(request.getSafetyRating()));
        vendor.setPriceRange(new PriceRange(price.getMin(), price.getMax(),
            price.getCurrency() != null ? price.getCurrency().toUpperCase(Locale.ROOT) : "INR"));
        List<OperatingSlot> hours = new ArrayList<>();
        if (request.getOperatingHours() != null) {
            for (OperatingSlotDto slot : request.getOperatingHours()) {
                hours.add(new OperatingSlot(slot.getDay(), slot.getOpen(), slot.getClose()));
            }
        }
        vendor.setOperatingHours(hours);
        vendor.setHygieneNotes(request.getHygieneNotes() != null ? new ArrayList<>(request.getHygieneNotes()) : new ArrayList<>());

        FoodVendor saved = foodVendorRepository.save(vendor);
        log.info("[FoodRecommendationService] addVendor - saved id: {}, name: {}, city: {}",
            saved.getId(), saved.getName(), saved.getLocation().getCity());
        return toVendorResponse(saved);
    }

    private List<FoodItem> resolveFoodItems(FoodVendorRequest request, List<String> errors) {
        List<FoodItem> items = new ArrayList<>();
        if (request.getFoodItemIds() != null) {
            for (String id : request.getFoodItemIds()) {
                foodItemRepository.findById(id).ifPresentOrElse(items::add,
                    () -> errors.add("foodItemIds: unknown food item " + id));
            }
        }
        if (request.getFoodItemNames() != null) {
            for (String name : request.getFoodItemNames()) {
                foodItemRepository.findFirstByNameIgnoreCase(name).ifPresentOrElse(items::add,
                    () -> errors.add("foodItemNames: unknown food item " + name));
            }
        }
        return items;
    }

    @Transactional(readOnly = true)
    public FoodStatistics statistics() {
        Double average = foodVendorRepository.averageSafetyRating();
        return FoodStatistics.builder()
            .totalVendors(foodVendorRepository.count())
            .totalFoodItems(foodItemRepository.count())
            .vegetarianItems(foodItemRepository.countByVegetarianTrue())
            .vendorsByCity(toCountMap(foodVendorRepository.countByCity()))
            .itemsByCategory(toCountMap(foodItemRepository.countByCategory()))
            .averageSafetyRating(average != null ? average : 0.0)
            .build();
    }

    private List<FoodRecommendation> toRecommendations(List<VendorOffering> offerings, LocationDto origin) {
        DayOfWeek today = LocalDate.now(clock).getDayOfWeek();
        List<FoodRecommendation> recommendations = new ArrayList<>();
        for (VendorOffering offering : offerings) {
            recommendations.add(toRecommendation(offering.getVendor(), offering.getItem(), origin, today));
        }
        return recommendations;
    }

    private FoodRecommendation toRecommendation(FoodVendor vendor, FoodItem item, LocationDto origin, DayOfWeek today) {
        VendorLocation vendorLocation = vendor.getLocation();
        double distance = GeoDistance.haversineKm(origin.getLatitude(), origin.getLongitude(),
            vendorLocation.getLatitude(), vendorLocation.getLongitude());

        return FoodRecommendation.builder()
            .vendorId(vendor.getId())
            .vendorName(vendor.getName())
            .foodItemId(item.getId())
            .name(item.getName())
            .description(item.getDescription())
            .category(item.getCategory())
            .location(toLocationDto(vendorLocation))
            .safetyRating(toSafetyDto(vendor.getSafetyRating()))
            .priceRange(toPriceDto(vendor.getPriceRange()))
            .dietaryInfo(toDietaryDto(item))
            .spiceLevel(item.getSpiceLevel())
            .bestTime(RecommendationRanker.bestTime(vendor.getOperatingHours(), today))
            .hygieneNotes(new ArrayList<>(vendor.getHygieneNotes()))
            .distance(distance)
            .build();
    }

    private void requireValidLocation(LocationDto location) {
        if (location == null || !GeoDistance.isValidCoordinate(location.getLatitude(), location.getLongitude())) {
            throw new ValidationException("Invalid location",
                List.of("location: latitude must be within [-90, 90] and longitude within [-180, 180]"));
        }
    }

    private static void validateRating(SafetyRatingDto rating, List<String> errors) {
        checkScore("safetyRating.overall", rating.getOverall(), errors);
        checkScore("safetyRating.hygiene", rating.getHygiene(), errors);
        checkScore("safetyRating.freshness", rating.getFreshness(), errors);
        checkScore("safetyRating.popularity", rating.getPopularity(), errors);
        if (rating.getReviewCount() == null || rating.getReviewCount() < 0) {
            errors.add("safetyRating.reviewCount: must be zero or greater");
        }
    }

    private static void checkScore(String field, Double value, List<String> errors) {
        if (value == null || value < 1.0 || value > 5.0) {
            errors.add(field + ": must be between 1 and 5");
        }
    }

    private SafetyRating toSafetyRating(SafetyRatingDto dto) {
        return SafetyRating.builder()
            .overall(dto.getOverall())
            .hygiene(dto.getHygiene())
            .freshness(dto.getFreshness())
            .popularity(dto.getPopularity())
            .reviewCount(dto.getReviewCount())
            .lastUpdated(LocalDateTime.now(clock))
            .build();
    }

    static LocationDto toLocationDto(VendorLocation location) {
        return LocationDto.builder()
            .latitude(location.getLatitude())
            .longitude(location.getLongitude())
            .address(location.getAddress())
            .city(location.getCity())
            .state(location.getState())
            .country(location.getCountry())
            .build();
    }

    static SafetyRatingDto toSafetyDto(SafetyRating rating) {
        if (rating == null) {
            return null;
        }
        return SafetyRatingDto.builder()
            .overall(rating.getOverall())
            .hygiene(rating.getHygiene())
            .freshness(rating.getFreshness())
            .popularity(rating.getPopularity())
            .reviewCount(rating.getReviewCount())
            .lastUpdated(rating.getLastUpdated())
            .build();
    }

    private static PriceRangeDto toPriceDto(PriceRange price) {
        return price == null ? null : new PriceRangeDto(price.getMin(), price.getMax(), price.getCurrency());
    }

    private static DietaryInfoDto toDietaryDto(FoodItem item) {
        return DietaryInfoDto.builder()
            .vegetarian(item.isVegetarian())
            .vegan(item.isVegan())
            .glutenFree(item.isGlutenFree())
            .allergens(new ArrayList<>(item.getAllergens()))
            .build();
    }

    private static FoodItemResponse toItemResponse(FoodItem item) {
        return FoodItemResponse.builder()
            .id(item.getId())
            .name(item.getName())
            .description(item.getDescription())
            .category(item.getCategory())
            .region(item.getRegion())
            .ingredients(new ArrayList<>(item.getIngredients()))
            .dietaryInfo(toDietaryDto(item))
            .preparationTime(item.getPreparationTime())
            .spiceLevel(item.getSpiceLevel())
            .build();
    }

    private static FoodVendorResponse toVendorResponse(FoodVendor vendor) {
        return FoodVendorResponse.builder()
            .id(vendor.getId())
            .name(vendor.getName())
            .location(toLocationDto(vendor.getLocation()))
            .foodItemIds(vendor.getFoodItems().stream().map(FoodItem::getId).collect(Collectors.toList()))
            .safetyRating(toSafetyDto(vendor.getSafetyRating()))
            .priceRange(toPriceDto(vendor.getPriceRange()))
            .operatingHours(vendor.getOperatingHours().stream()
                .map(s -> new OperatingSlotDto(s.getDay(), s.getOpen(), s.getClose()))
                .collect(Collectors.toList()))
            .hygieneNotes(new ArrayList<>(vendor.getHygieneNotes()))
            .build();
    }

    private static Map<String, Long> toCountMap(List<Object[]> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : rows) {
            counts.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }
}
