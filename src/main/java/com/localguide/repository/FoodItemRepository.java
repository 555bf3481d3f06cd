package com.localguide.repository;

import com.localguide.entity.FoodItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FoodItemRepository extends JpaRepository<FoodItem, String> {

    List<FoodItem> findByCategoryIgnoreCase(String category);

    Optional<FoodItem> findFirstByNameIgnoreCase(String name);

    boolean existsByNameIgnoreCaseAndRegionIgnoreCase(String name, String region);

    /**
     * 이름/설명/카테고리 부분 일치 검색
     */
    @Query("SELECT i FROM FoodItem i WHERE LOWER(i.name) LIKE LOWER(CONCAT('%', :query, '%')) "
        + "OR LOWER(i.description) LIKE LOWER(CONCAT('%', :query, '%')) "
        + "OR LOWER(i.category) LIKE LOWER(CONCAT('%', :query, '%')) "
        + "ORDER BY i.name ASC")
    List<FoodItem> searchText(@Param("query") String query, Pageable pageable);

    @Query("SELECT i.category, COUNT(i) FROM FoodItem i GROUP BY i.category")
    List<Object[]> countByCategory();

    long countByVegetarianTrue();
}
