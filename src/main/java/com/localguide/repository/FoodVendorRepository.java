package com.localguide.repository;

import com.localguide.entity.FoodVendor;
import com.localguide.repository.projection.VendorOffering;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface FoodVendorRepository extends JpaRepository<FoodVendor, String> {

    /**
     * 원형 거리 내의 벤더 id 조회 (Haversine 공식, R = 6371km)
     * GeoDistance.haversineKm와 같은 식 (asin 형태)
     * @param latitude 기준 위도
     * @param longitude 기준 경도
     * @param radiusKm 반경 (km)
     * @return 반경 내 벤더 id (가까운 순)
     */
    @Query(value = """
        SELECT v.id FROM food_vendors v
        WHERE (
            2 * 6371 * asin(sqrt(
                power(sin(radians(v.latitude - :latitude) / 2), 2) +
                cos(radians(:latitude)) * cos(radians(v.latitude)) *
                power(sin(radians(v.longitude - :longitude) / 2), 2)
            ))
        ) <= :radiusKm
        ORDER BY (
            2 * 6371 * asin(sqrt(
                power(sin(radians(v.latitude - :latitude) / 2), 2) +
                cos(radians(:latitude)) * cos(radians(v.latitude)) *
                power(sin(radians(v.longitude - :longitude) / 2), 2)
            ))
        ) ASC
        """, nativeQuery = true)
    List<String> findIdsWithinRadius(
        @Param("latitude") double latitude,
        @Param("longitude") double longitude,
        @Param("radiusKm") double radiusKm
    );

    /**
     * 지정 벤더들의 (벤더, 메뉴) 쌍 중 식단/가격/안전 필터를 통과하는 것
     * vegetarianOnly, veganOnly는 true일 때만 적용
     */
    @Query("SELECT new com.localguide.repository.projection.VendorOffering(v, i) "
        + "FROM FoodVendor v JOIN v.foodItems i "
        + "WHERE v.id IN :vendorIds "
        + "AND (:vegetarianOnly = false OR i.vegetarian = true) "
        + "AND (:veganOnly = false OR i.vegan = true) "
        + "AND (:spiceLevel IS NULL OR LOWER(i.spiceLevel) = LOWER(:spiceLevel)) "
        + "AND (:maxPrice IS NULL OR v.priceRange.max <= :maxPrice) "
        + "AND v.safetyRating.overall >= :minSafetyRating")
    List<VendorOffering> findOfferings(@Param("vendorIds") Collection<String> vendorIds,
                                       @Param("vegetarianOnly") boolean vegetarianOnly,
                                       @Param("veganOnly") boolean veganOnly,
                                       @Param("spiceLevel") String spiceLevel,
                                       @Param("maxPrice") Double maxPrice,
                                       @Param("minSafetyRating") double minSafetyRating);

    /**
     * 지정 메뉴를 판매하는 벤더들 중 지정 id 집합에 속한 것 (카테고리/검색 교차 조회용)
     */
    @Query("SELECT new com.localguide.repository.projection.VendorOffering(v, i) "
        + "FROM FoodVendor v JOIN v.foodItems i "
        + "WHERE v.id IN :vendorIds AND i.id IN :itemIds")
    List<VendorOffering> findOfferingsForItems(@Param("vendorIds") Collection<String> vendorIds,
                                               @Param("itemIds") Collection<String> itemIds);

    List<FoodVendor> findByLocationCityIgnoreCase(String city);

    @Query("SELECT v.location.city, COUNT(v) FROM FoodVendor v GROUP BY v.location.city")
    List<Object[]> countByCity();

    @Query("SELECT AVG(v.safetyRating.overall) FROM FoodVendor v")
    Double averageSafetyRating();
}
