package com.localguide.entity;

import com.localguide.service.matching.TextNormalizer;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 지역별 슬랭/구어 표현
 * translations, usageExamples는 수정 시 항상 통째로 교체됨 (부분 병합 없음)
 */
@Entity
@Table(name = "slang_terms", indexes = {
    @Index(name = "idx_slang_normalized_term", columnList = "normalized_term"),
    @Index(name = "idx_slang_region", columnList = "region"),
    @Index(name = "idx_slang_popularity", columnList = "popularity")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_slang_term_key", columnNames = {"normalized_term", "language", "region_key"})
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlangTerm {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 200)
    private String term;

    // 정확 일치 조회용 (TextNormalizer 결과)
    @Column(name = "normalized_term", nullable = false, length = 200)
    private String normalizedTerm;

    @Column(nullable = false, length = 20)
    private String language; // hindi, english

    @Column(nullable = false, length = 50)
    private String region;

    // 중복 키용 소문자 지역명, region과 항상 같이 바뀜
    @Column(name = "region_key", nullable = false, length = 50)
    private String regionKey;

    @Column(nullable = false, length = 20)
    private String context; // formal | casual | slang

    @Column(nullable = false)
    private Integer popularity = 50; // 0 ~ 100

    @ElementCollection
    @CollectionTable(name = "slang_translations", joinColumns = @JoinColumn(name = "slang_term_id"))
    @OrderColumn(name = "position")
    private List<Translation> translations = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "usage_examples", joinColumns = @JoinColumn(name = "slang_term_id"))
    @OrderColumn(name = "position")
    @Column(name = "example", length = 500)
    private List<String> usageExamples = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public void setTerm(String term) {
        this.term = term;
        this.normalizedTerm = TextNormalizer.normalize(term);
    }

    public void setRegion(String region) {
        this.region = region;
        this.regionKey = region == null ? null : region.trim().toLowerCase(Locale.ROOT);
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        refreshKeys();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        refreshKeys();
    }

    private void refreshKeys() {
        setTerm(term);
        setRegion(region);
        if (translations != null) {
            translations.forEach(tr -> tr.setText(tr.getText()));
        }
    }
}
