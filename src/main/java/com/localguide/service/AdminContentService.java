package com.localguide.service;

import com.localguide.dto.request.ContentSubmission;
import com.localguide.dto.request.CulturalContentSubmission;
import com.localguide.dto.request.FoodContentSubmission;
import com.localguide.dto.request.SlangContentSubmission;
import com.localguide.dto.response.FoodItemResponse;
import com.localguide.dto.response.SlangTermResponse;
import com.localguide.dto.response.SubmissionResult;
import com.localguide.entity.CulturalSubmission;
import com.localguide.exception.ValidationException;
import com.localguide.model.ContentType;
import com.localguide.repository.CulturalSubmissionRepository;
import com.localguide.service.matching.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 관리자 콘텐츠 제출 처리
 * slang/food는 바로 등록, cultural은 검토 대기로 저장 (기동 시 카탈로그는 건드리지 않음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminContentService {

    private final SlangTranslationService slangTranslationService;
    private final FoodRecommendationService foodRecommendationService;
    private final CulturalSubmissionRepository culturalSubmissionRepository;

    @Transactional
    public SubmissionResult submit(ContentSubmission submission) {
        if (submission == null) {
            throw new ValidationException("Content submission is required", List.of("type: must be one of [slang, food, cultural]"));
        }
        log.debug("[AdminContentService] submit - type: {}", submission.contentType());

        if (submission instanceof SlangContentSubmission) {
            SlangTermResponse created = slangTranslationService.add(((SlangContentSubmission) submission).getData());
            return new SubmissionResult(ContentType.SLANG, created.getId(), "CREATED");
        }
        if (submission instanceof FoodContentSubmission) {
            FoodItemResponse created = foodRecommendationService.addFoodItem(((FoodContentSubmission) submission).getData());
            return new SubmissionResult(ContentType.FOOD, created.getId(), "CREATED");
        }
        if (submission instanceof CulturalContentSubmission) {
            return submitCultural(((CulturalContentSubmission) submission).getData());
        }
        throw new ValidationException("Unsupported content type", List.of("type: must be one of [slang, food, cultural]"));
    }

    private SubmissionResult submitCultural(CulturalContentSubmission.CulturalEntry entry) {
        List<String> errors = new ArrayList<>();
        if (entry == null || TextNormalizer.isBlank(entry.getRegion())) {
            errors.add("data.region: must not be empty");
        }
        if (entry == null || TextNormalizer.isBlank(entry.getTitle())) {
            errors.add("data.title: must not be empty");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid cultural content", errors);
        }

        CulturalSubmission saved = culturalSubmissionRepository.save(CulturalSubmission.builder()
            .region(entry.getRegion().trim())
            .title(entry.getTitle().trim())
            .description(entry.getDescription())
            .category(entry.getCategory())
            .build());
        log.info("[AdminContentService] submit - cultural submission pending, id: {}, region: {}", saved.getId(), saved.getRegion());
        return new SubmissionResult(ContentType.CULTURAL, String.valueOf(saved.getId()), saved.getStatus());
    }
}
