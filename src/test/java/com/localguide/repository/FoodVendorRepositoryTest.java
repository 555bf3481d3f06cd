package com.localguide.repository;

import com.localguide.entity.FoodItem;
import com.localguide.entity.FoodVendor;
import com.localguide.entity.PriceRange;
import com.localguide.entity.SafetyRating;
import com.localguide.entity.VendorLocation;
import com.localguide.repository.projection.VendorOffering;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
class FoodVendorRepositoryTest {

    @Autowired
    private FoodVendorRepository foodVendorRepository;

    @Autowired
    private FoodItemRepository foodItemRepository;

    private FoodVendor chandniChowk;
    private FoodVendor connaughtPlace;

    @BeforeEach
    void setUp() {
        FoodItem chaat = foodItemRepository.save(item("Aloo Tikki", true, true, "medium"));
        FoodItem kebab = foodItemRepository.save(item("Seekh Kebab", false, false, "hot"));

        chandniChowk = foodVendorRepository.save(vendor("Chandni Chowk Chaat", 28.6562, 77.2300, "Delhi", 4.5, 150.0, chaat, kebab));
        connaughtPlace = foodVendorRepository.save(vendor("CP Kebab Corner", 28.6315, 77.2167, "Delhi", 2.5, 400.0, kebab));
        foodVendorRepository.save(vendor("Juhu Pav Bhaji", 19.0990, 72.8265, "Mumbai", 4.0, 120.0, chaat));
        foodVendorRepository.flush();
    }

    @Test
    void radiusQueryReturnsNearestFirst() {
        List<String> ids = foodVendorRepository.findIdsWithinRadius(28.6139, 77.2090, 10.0);

        assertThat(ids).containsExactly(connaughtPlace.getId(), chandniChowk.getId());
    }

    @Test
    void radiusQueryExcludesDistantVendors() {
        assertThat(foodVendorRepository.findIdsWithinRadius(28.6139, 77.2090, 3.0))
            .containsExactly(connaughtPlace.getId());
    }

    @Test
    void offeringsApplySafetyFloor() {
        List<VendorOffering> offerings = foodVendorRepository.findOfferings(
            List.of(chandniChowk.getId(), connaughtPlace.getId()), false, false, null, null, 3.0);

        assertThat(offerings).extracting(o -> o.getVendor().getName())
            .containsOnly("Chandni Chowk Chaat");
        assertThat(offerings).hasSize(2);
    }

    @Test
    void offeringsApplyDietaryAndSpiceFilters() {
        List<VendorOffering> vegetarian = foodVendorRepository.findOfferings(
            List.of(chandniChowk.getId(), connaughtPlace.getId()), true, false, null, null, 1.0);
        List<VendorOffering> hot = foodVendorRepository.findOfferings(
            List.of(chandniChowk.getId(), connaughtPlace.getId()), false, false, "HOT", null, 1.0);

        assertThat(vegetarian).extracting(o -> o.getItem().getName()).containsExactly("Aloo Tikki");
        assertThat(hot).extracting(o -> o.getItem().getName()).containsOnly("Seekh Kebab");
        assertThat(hot).hasSize(2);
    }

    @Test
    void offeringsApplyMaxPrice() {
        List<VendorOffering> offerings = foodVendorRepository.findOfferings(
            List.of(chandniChowk.getId(), connaughtPlace.getId()), false, false, null, 200.0, 1.0);

        assertThat(offerings).extracting(o -> o.getVendor().getId()).containsOnly(chandniChowk.getId());
    }

    @Test
    void vendorsAreFoundByCityIgnoringCase() {
        assertThat(foodVendorRepository.findByLocationCityIgnoreCase("delhi")).hasSize(2);
        assertThat(foodVendorRepository.averageSafetyRating()).isCloseTo(3.667, within(0.01));
    }

    private static FoodItem item(String name, boolean vegetarian, boolean vegan, String spiceLevel) {
        FoodItem item = new FoodItem();
        item.setName(name);
        item.setCategory("street food");
        item.setRegion("north india");
        item.setVegetarian(vegetarian);
        item.setVegan(vegan);
        item.setSpiceLevel(spiceLevel);
        return item;
    }

    private static FoodVendor vendor(String name, double lat, double lng, String city,
                                     double safety, double maxPrice, FoodItem... items) {
        FoodVendor vendor = new FoodVendor();
        vendor.setName(name);
        vendor.setLocation(VendorLocation.builder().latitude(lat).longitude(lng).city(city).country("India").build());
        vendor.setSafetyRating(SafetyRating.builder()
            .overall(safety).hygiene(safety).freshness(safety).popularity(safety).reviewCount(10).build());
        vendor.setPriceRange(new PriceRange(50.0, maxPrice, "INR"));
        vendor.getFoodItems().addAll(List.of(items));
        return vendor;
    }
}
