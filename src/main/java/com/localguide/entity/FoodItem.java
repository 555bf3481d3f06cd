package com.localguide.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 음식 메뉴 (벤더와 다대다)
 */
@Entity
@Table(name = "food_items", indexes = {
    @Index(name = "idx_food_item_category", columnList = "category"),
    @Index(name = "idx_food_item_name", columnList = "name")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FoodItem {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false, length = 100)
    private String category; // street food, main course 등

    @Column(length = 100)
    private String region;

    @ElementCollection
    @CollectionTable(name = "food_item_ingredients", joinColumns = @JoinColumn(name = "food_item_id"))
    @OrderColumn(name = "position")
    @Column(name = "ingredient", length = 200)
    private List<String> ingredients = new ArrayList<>();

    @Column(nullable = false)
    private boolean vegetarian;

    @Column(nullable = false)
    private boolean vegan;

    @Column(name = "gluten_free", nullable = false)
    private boolean glutenFree;

    @ElementCollection
    @CollectionTable(name = "food_item_allergens", joinColumns = @JoinColumn(name = "food_item_id"))
    @OrderColumn(name = "position")
    @Column(name = "allergen", length = 100)
    private List<String> allergens = new ArrayList<>();

    @Column(name = "preparation_time")
    private Integer preparationTime; // 분

    @Column(name = "spice_level", length = 20)
    private String spiceLevel; // mild | medium | hot | very-hot

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        createdAt = LocalDateTime.now();
    }
}
