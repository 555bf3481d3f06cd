package com.localguide.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "food_vendors", indexes = {
    @Index(name = "idx_vendor_city", columnList = "city"),
    @Index(name = "idx_vendor_lat_lng", columnList = "latitude, longitude")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FoodVendor {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    @Embedded
    private VendorLocation location;

    @ManyToMany
    @JoinTable(name = "vendor_food_items",
        joinColumns = @JoinColumn(name = "vendor_id"),
        inverseJoinColumns = @JoinColumn(name = "food_item_id"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<FoodItem> foodItems = new ArrayList<>();

    @Embedded
    private SafetyRating safetyRating;

    @Embedded
    private PriceRange priceRange;

    @ElementCollection
    @CollectionTable(name = "vendor_operating_hours", joinColumns = @JoinColumn(name = "vendor_id"))
    @OrderColumn(name = "position")
    private List<OperatingSlot> operatingHours = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "vendor_hygiene_notes", joinColumns = @JoinColumn(name = "vendor_id"))
    @OrderColumn(name = "position")
    @Column(name = "note", length = 500)
    private List<String> hygieneNotes = new ArrayList<>();

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
