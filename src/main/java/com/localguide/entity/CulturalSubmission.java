package com.localguide.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 관리자가 제출한 문화 콘텐츠 (검토 대기). 기동 시 로드된 카탈로그에는 반영하지 않음
 */
@Entity
@Table(name = "cultural_submissions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CulturalSubmission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String region;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(length = 100)
    private String category;

    @Column(nullable = false, length = 20)
    private String status; // PENDING

    @Column(name = "submitted_at", nullable = false)
    private LocalDateTime submittedAt;

    @PrePersist
    protected void onCreate() {
        submittedAt = LocalDateTime.now();
        if (status == null) {
            status = "PENDING";
        }
    }
}
