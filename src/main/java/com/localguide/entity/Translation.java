package com.localguide.entity;

import com.localguide.service.matching.TextNormalizer;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 슬랭 용어의 번역 후보 1개 (slang_translations 테이블)
 */
@Embeddable
@Data
@NoArgsConstructor
public class Translation {

    @Column(name = "text", nullable = false, length = 500)
    private String text;

    // 역방향 번역 조회용 (TextNormalizer 결과), text와 항상 같이 바뀜
    @Column(name = "normalized_text", length = 500)
    private String normalizedText;

    @Column(name = "target_language", nullable = false, length = 50)
    private String targetLanguage;

    @Column(name = "context", length = 100)
    private String context; // formal | casual | slang

    @Column(name = "confidence", nullable = false)
    private Double confidence; // 0.0 ~ 1.0

    public Translation(String text, String targetLanguage, String context, Double confidence) {
        setText(text);
        this.targetLanguage = targetLanguage;
        this.context = context;
        this.confidence = confidence;
    }

    public void setText(String text) {
        this.text = text;
        this.normalizedText = TextNormalizer.normalize(text);
    }
}
