package com.localguide.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 사용자 취향 설정 (user_accounts에 임베드)
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserPreferences {

    @ElementCollection
    @CollectionTable(name = "user_dietary_restrictions", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "restriction", length = 100)
    private List<String> dietaryRestrictions = new ArrayList<>();

    @Column(name = "spice_preference", length = 20)
    private String spicePreference;

    @ElementCollection
    @CollectionTable(name = "user_preferred_regions", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "region", length = 100)
    private List<String> preferredRegions = new ArrayList<>();

    @Column(name = "language_preference", length = 20)
    private String languagePreference;

    @Column(name = "budget_min")
    private Double budgetMin;

    @Column(name = "budget_max")
    private Double budgetMax;
}
