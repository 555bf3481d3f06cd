package com.localguide.service;

import com.localguide.config.GuideProperties;
import com.localguide.dto.TranslationDto;
import com.localguide.dto.request.SlangTermRequest;
import com.localguide.dto.request.SlangTermUpdateRequest;
import com.localguide.dto.response.RegionalVariation;
import com.localguide.dto.response.SlangStatistics;
import com.localguide.dto.response.SlangTermResponse;
import com.localguide.dto.response.TranslationResult;
import com.localguide.entity.SlangTerm;
import com.localguide.entity.Translation;
import com.localguide.exception.ConflictException;
import com.localguide.exception.NotFoundException;
import com.localguide.exception.ValidationException;
import com.localguide.repository.SlangTermRepository;
import com.localguide.service.matching.FuzzyVariantGenerator;
import com.localguide.service.matching.RelevanceScorer;
import com.localguide.service.matching.TermSelector;
import com.localguide.service.matching.TextNormalizer;
import com.localguide.service.validation.SlangTermValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 슬랭 번역 서비스
 * 정확 일치 -> 철자 변형(fuzzy) -> unknown 순으로 내려가며 매칭한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlangTranslationService {

    static final int FUZZY_LOOKUP_LIMIT = 10;
    static final int SEARCH_LIMIT = 20;
    static final int SIMILAR_RESULT_LIMIT = 10;
    static final int REGION_LOOKUP_LIMIT = 50;
    static final int MAX_ALTERNATIVES = 3;
    static final int MAX_USAGE_EXAMPLES = 2;

    // fuzzy 매칭 신뢰도 감쇠
    static final double FUZZY_PENALTY = 0.2;
    static final double FUZZY_FLOOR = 0.3;

    // 역방향 번역 신뢰도 (좁은 검색 / 넓은 검색)
    static final double REVERSE_NARROW_CONFIDENCE = 0.8;
    static final double REVERSE_NARROW_ALTERNATIVE = 0.7;
    static final double REVERSE_BROAD_CONFIDENCE = 0.5;
    static final double REVERSE_BROAD_ALTERNATIVE = 0.4;

    static final double MISSING_TRANSLATION_CONFIDENCE = 0.5;
    static final int DEFAULT_POPULARITY = 50;

    private final SlangTermRepository slangTermRepository;
    private final SlangTermValidator slangTermValidator;
    private final GuideProperties properties;

    /**
     * 번역
     * @param text 원문 (빈 문자열이면 저장소 조회 없이 unknown)
     * @param sourceLanguage null이면 설정의 source-language
     * @param targetLanguage null이면 설정의 target-language
     * @param preferredRegion 선호 지역 (선택)
     */
    @Transactional(readOnly = true)
    public TranslationResult translate(String text, String sourceLanguage, String targetLanguage, String preferredRegion) {
        GuideProperties.Translation config = properties.getTranslation();
        String source = languageOrDefault(sourceLanguage, config.getSourceLanguage());
        String target = languageOrDefault(targetLanguage, config.getTargetLanguage());
        log.debug("[SlangTranslationService] translate - text: {}, source: {}, target: {}, region: {}",
            text, source, target, preferredRegion);

        boolean forward = source.equals(config.getSourceLanguage()) && target.equals(config.getTargetLanguage());
        boolean reverse = source.equals(config.getTargetLanguage()) && target.equals(config.getSourceLanguage());
        if (!forward && !reverse) {
            throw new ValidationException("Unsupported language pair",
                List.of("sourceLanguage/targetLanguage: " + source + " -> " + target + " is not supported"));
        }

        if (TextNormalizer.isBlank(text)) {
            return unknown(text, source, target, preferredRegion);
        }
        String normalized = TextNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            return unknown(text, source, target, preferredRegion);
        }

        try {
            TranslationResult result = forward
                ? translateForward(text, normalized, source, target, preferredRegion)
                : translateReverse(text, normalized, source, target, preferredRegion);
            log.info("[SlangTranslationService] translate - text: {}, translated: {}, confidence: {}, fuzzy: {}, unknown: {}",
                text, result.getTranslatedText(), result.getConfidence(), result.getFuzzyMatch(), result.getUnknown());
            return result;
        } catch (DataAccessException e) {
            log.error("[SlangTranslationService] translate - lookup failed, text: {}", text, e);
            throw e;
        }
    }

    private TranslationResult translateForward(String text, String normalized, String source, String target,
                                               String preferredRegion) {
        String preferredContext = properties.getTranslation().getDefaultContext();

        List<SlangTerm> exactMatches = slangTermRepository.findByNormalizedTermAndLanguageOrderByCreatedAtAsc(normalized, source);
        if (!exactMatches.isEmpty()) {
            SlangTerm bestMatch = TermSelector.selectBestMatch(exactMatches, preferredRegion);
            List<Translation> candidates = TermSelector.translationsFor(bestMatch, target);
            if (!candidates.isEmpty()) {
                return forwardResult(text, bestMatch, candidates, preferredContext, source, target, false);
            }
        }

        // 정확 일치 실패 -> 철자 변형 후보 (원문 언어만)
        List<SlangTerm> fuzzyMatches = findFuzzyMatches(normalized).stream()
            .filter(t -> source.equals(t.getLanguage()))
            .collect(Collectors.toList());
        if (!fuzzyMatches.isEmpty()) {
            SlangTerm bestMatch = TermSelector.selectBestMatch(fuzzyMatches, preferredRegion);
            List<Translation> candidates = TermSelector.translationsFor(bestMatch, target);
            if (!candidates.isEmpty()) {
                return forwardResult(text, bestMatch, candidates, preferredContext, source, target, true);
            }
        }

        return unknown(text, source, target, preferredRegion);
    }

    private TranslationResult forwardResult(String text, SlangTerm match, List<Translation> candidates,
                                            String preferredContext, String source, String target, boolean fuzzy) {
        Translation chosen = TermSelector.selectBestTranslation(candidates, preferredContext);
        List<TranslationResult.Alternative> alternatives = TermSelector
            .alternatives(candidates, chosen, preferredContext, MAX_ALTERNATIVES).stream()
            .map(t -> new TranslationResult.Alternative(t.getText(), adjust(t.getConfidence(), fuzzy), t.getContext()))
            .collect(Collectors.toList());

        return TranslationResult.builder()
            .originalText(text)
            .translatedText(chosen.getText())
            .confidence(adjust(chosen.getConfidence(), fuzzy))
            .context(chosen.getContext())
            .sourceLanguage(source)
            .targetLanguage(target)
            .region(match.getRegion())
            .alternatives(alternatives)
            .usageExamples(firstExamples(match))
            .fuzzyMatch(fuzzy ? Boolean.TRUE : null)
            .build();
    }

    /**
     * 역방향: 번역문에서 원문 용어를 찾는다 (좁은 검색 0.8 -> 넓은 검색 0.5)
     */
    private TranslationResult translateReverse(String text, String normalized, String source, String target,
                                               String preferredRegion) {
        List<SlangTerm> narrow = slangTermRepository
            .findByTranslationText(normalized, source, PageRequest.of(0, SEARCH_LIMIT)).stream()
            .filter(t -> target.equals(t.getLanguage()))
            .collect(Collectors.toList());
        if (!narrow.isEmpty()) {
            return reverseResult(text, narrow, preferredRegion, source, target,
                REVERSE_NARROW_CONFIDENCE, REVERSE_NARROW_ALTERNATIVE, false);
        }

        List<SlangTerm> broad = slangTermRepository
            .searchText(text.trim(), PageRequest.of(0, SEARCH_LIMIT)).stream()
            .filter(t -> target.equals(t.getLanguage()))
            .filter(t -> !TermSelector.translationsFor(t, source).isEmpty())
            .collect(Collectors.toList());
        if (!broad.isEmpty()) {
            return reverseResult(text, broad, preferredRegion, source, target,
                REVERSE_BROAD_CONFIDENCE, REVERSE_BROAD_ALTERNATIVE, true);
        }

        return unknown(text, source, target, preferredRegion);
    }

    private TranslationResult reverseResult(String text, List<SlangTerm> matches, String preferredRegion,
                                            String source, String target, double confidence,
                                            double alternativeConfidence, boolean fuzzy) {
        SlangTerm bestMatch = TermSelector.selectBestMatch(matches, preferredRegion);
        List<TranslationResult.Alternative> alternatives = matches.stream()
            .filter(t -> t != bestMatch)
            .limit(MAX_ALTERNATIVES)
            .map(t -> new TranslationResult.Alternative(t.getTerm(), alternativeConfidence, t.getContext()))
            .collect(Collectors.toList());

        return TranslationResult.builder()
            .originalText(text)
            .translatedText(bestMatch.getTerm())
            .confidence(confidence)
            .context(bestMatch.getContext())
            .sourceLanguage(source)
            .targetLanguage(target)
            .region(bestMatch.getRegion())
            .alternatives(alternatives)
            .usageExamples(firstExamples(bestMatch))
            .fuzzyMatch(fuzzy ? Boolean.TRUE : null)
            .build();
    }

    /**
     * 지역별 변형: 정확 일치(언어 무관) + fuzzy 후보를 지역별로 묶고 지역마다 가장 인기 있는 용어를 대표로
     */
    @Transactional(readOnly = true)
    public List<RegionalVariation> regionalVariations(String term) {
        log.debug("[SlangTranslationService] regionalVariations - term: {}", term);
        String normalized = TextNormalizer.normalize(term);
        if (normalized.isEmpty()) {
            return List.of();
        }

        try {
            List<SlangTerm> all = new ArrayList<>(slangTermRepository.findByNormalizedTermOrderByCreatedAtAsc(normalized));
            all.addAll(findFuzzyMatches(normalized));

            Map<String, List<SlangTerm>> byRegion = new LinkedHashMap<>();
            for (SlangTerm slangTerm : TermSelector.deduplicate(all)) {
                String key = slangTerm.getRegion().toLowerCase(Locale.ROOT);
                byRegion.computeIfAbsent(key, k -> new ArrayList<>()).add(slangTerm);
            }

            String target = properties.getTranslation().getTargetLanguage();
            List<RegionalVariation> variations = new ArrayList<>();
            for (List<SlangTerm> group : byRegion.values()) {
                variations.add(toVariation(group, target));
            }
            variations.sort(Comparator.comparingInt(RegionalVariation::getPopularity).reversed());

            log.info("[SlangTranslationService] regionalVariations - term: {}, regions: {}", term, variations.size());
            return variations;
        } catch (DataAccessException e) {
            log.error("[SlangTranslationService] regionalVariations - lookup failed, term: {}", term, e);
            throw e;
        }
    }

    private RegionalVariation toVariation(List<SlangTerm> group, String target) {
        SlangTerm representative = TermSelector.selectBestMatch(group, null);
        List<Translation> candidates = TermSelector.translationsFor(representative, target);
        Translation primary = candidates.isEmpty() ? null : TermSelector.selectBestTranslation(candidates, null);

        List<String> alternativeTerms = group.stream()
            .filter(t -> t != representative)
            .map(SlangTerm::getTerm)
            .collect(Collectors.toList());

        return RegionalVariation.builder()
            .region(group.get(0).getRegion())
            .term(representative.getTerm())
            .translation(primary != null ? primary.getText() : "")
            .confidence(primary != null ? primary.getConfidence() : MISSING_TRANSLATION_CONFIDENCE)
            .context(representative.getContext())
            .popularity(representative.getPopularity())
            .usageExamples(firstExamples(representative))
            .alternativeTerms(alternativeTerms)
            .build();
    }

    /**
     * 유사 용어 검색: 텍스트 검색 + fuzzy 후보를 관련도 순으로 최대 10개
     */
    @Transactional(readOnly = true)
    public List<SlangTermResponse> searchSimilar(String query) {
        log.debug("[SlangTranslationService] searchSimilar - query: {}", query);
        String normalized = TextNormalizer.normalize(query);
        if (normalized.isEmpty()) {
            return List.of();
        }

        try {
            List<SlangTerm> all = new ArrayList<>(slangTermRepository.searchText(normalized, PageRequest.of(0, SEARCH_LIMIT)));
            all.addAll(findFuzzyMatches(normalized));

            List<SlangTermResponse> results = TermSelector.deduplicate(all).stream()
                .sorted(Comparator.comparingDouble((SlangTerm t) ->
                    RelevanceScorer.termRelevance(t.getTerm(), normalized, t.getPopularity())).reversed())
                .limit(SIMILAR_RESULT_LIMIT)
                .map(SlangTermResponse::from)
                .collect(Collectors.toList());

            log.info("[SlangTranslationService] searchSimilar - query: {}, count: {}", query, results.size());
            return results;
        } catch (DataAccessException e) {
            log.error("[SlangTranslationService] searchSimilar - lookup failed, query: {}", query, e);
            throw e;
        }
    }

    /**
     * 철자 변형마다 부분 일치 조회 후 병합/중복 제거
     */
    List<SlangTerm> findFuzzyMatches(String normalized) {
        List<SlangTerm> matches = new ArrayList<>();
        for (String variant : FuzzyVariantGenerator.variants(normalized)) {
            matches.addAll(slangTermRepository.findFuzzy(variant, PageRequest.of(0, FUZZY_LOOKUP_LIMIT)));
        }
        return TermSelector.deduplicate(matches);
    }

    @Transactional
    public SlangTermResponse add(SlangTermRequest request) {
        log.debug("[SlangTranslationService] add - term: {}, region: {}", request.getTerm(), request.getRegion());

        SlangTerm entity = new SlangTerm();
        entity.setTerm(request.getTerm());
        entity.setLanguage(lower(request.getLanguage()));
        entity.setRegion(request.getRegion() != null ? request.getRegion().trim() : null);
        entity.setContext(lower(request.getContext()));
        entity.setPopularity(request.getPopularity() != null ? request.getPopularity() : DEFAULT_POPULARITY);
        entity.setTranslations(toTranslations(request.getTranslations()));
        entity.setUsageExamples(request.getUsageExamples() != null ? new ArrayList<>(request.getUsageExamples()) : new ArrayList<>());

        slangTermValidator.validate(entity);

        String normalized = TextNormalizer.normalize(entity.getTerm());
        if (slangTermRepository.existsDuplicate(normalized, entity.getLanguage(), entity.getRegion())) {
            throw new ConflictException("Slang term \"" + entity.getTerm() + "\" already exists for region \""
                + entity.getRegion() + "\"");
        }

        try {
            SlangTerm saved = slangTermRepository.saveAndFlush(entity);
            log.info("[SlangTranslationService] add - saved id: {}, term: {}, region: {}",
                saved.getId(), saved.getTerm(), saved.getRegion());
            return SlangTermResponse.from(saved);
        } catch (DataIntegrityViolationException e) {
            log.warn("[SlangTranslationService] add - concurrent duplicate, term: {}, region: {}",
                entity.getTerm(), entity.getRegion());
            throw new ConflictException("Slang term \"" + entity.getTerm() + "\" already exists for region \""
                + entity.getRegion() + "\"", e);
        }
    }

    /**
     * 부분 수정. 컬렉션은 통째로 교체되고, 키 필드(term/language/region)가 바뀔 때만 중복 재검사
     */
    @Transactional
    public SlangTermResponse update(String id, SlangTermUpdateRequest request) {
        log.debug("[SlangTranslationService] update - id: {}", id);
        SlangTerm entity = slangTermRepository.findById(id)
            .orElseThrow(() -> NotFoundException.of("Slang term", id));

        boolean keyChanged = changed(request.getTerm(), entity.getTerm())
            || changed(lower(request.getLanguage()), entity.getLanguage())
            || changed(request.getRegion(), entity.getRegion());

        if (request.getTerm() != null) {
            entity.setTerm(request.getTerm());
        }
        if (request.getLanguage() != null) {
            entity.setLanguage(lower(request.getLanguage()));
        }
        if (request.getRegion() != null) {
            entity.setRegion(request.getRegion().trim());
        }
        if (request.getContext() != null) {
            entity.setContext(lower(request.getContext()));
        }
        if (request.getPopularity() != null) {
            entity.setPopularity(request.getPopularity());
        }
        if (request.getTranslations() != null) {
            entity.getTranslations().clear();
            entity.getTranslations().addAll(toTranslations(request.getTranslations()));
        }
        if (request.getUsageExamples() != null) {
            entity.getUsageExamples().clear();
            entity.getUsageExamples().addAll(request.getUsageExamples());
        }

        slangTermValidator.validate(entity);

        if (keyChanged && slangTermRepository.existsDuplicateExcluding(
                TextNormalizer.normalize(entity.getTerm()), entity.getLanguage(), entity.getRegion(), id)) {
            throw new ConflictException("Slang term \"" + entity.getTerm() + "\" already exists for region \""
                + entity.getRegion() + "\"");
        }

        try {
            SlangTerm saved = slangTermRepository.saveAndFlush(entity);
            log.info("[SlangTranslationService] update - id: {}, keyChanged: {}", id, keyChanged);
            return SlangTermResponse.from(saved);
        } catch (DataIntegrityViolationException e) {
            log.warn("[SlangTranslationService] update - concurrent duplicate, id: {}, term: {}, region: {}",
                id, entity.getTerm(), entity.getRegion());
            throw new ConflictException("Slang term \"" + entity.getTerm() + "\" already exists for region \""
                + entity.getRegion() + "\"", e);
        }
    }

    @Transactional(readOnly = true)
    public SlangTermResponse findById(String id) {
        return slangTermRepository.findById(id)
            .map(SlangTermResponse::from)
            .orElseThrow(() -> NotFoundException.of("Slang term", id));
    }

    @Transactional
    public void delete(String id) {
        SlangTerm entity = slangTermRepository.findById(id)
            .orElseThrow(() -> NotFoundException.of("Slang term", id));
        slangTermRepository.delete(entity);
        log.info("[SlangTranslationService] delete - id: {}, term: {}", id, entity.getTerm());
    }

    @Transactional(readOnly = true)
    public List<SlangTermResponse> findByRegion(String region) {
        return slangTermRepository.findByRegionIgnoreCaseOrderByPopularityDesc(region, PageRequest.of(0, REGION_LOOKUP_LIMIT))
            .stream()
            .map(SlangTermResponse::from)
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<SlangTermResponse> popular(int limit) {
        return slangTermRepository.findAllByOrderByPopularityDescTermAsc(PageRequest.of(0, Math.max(1, limit)))
            .stream()
            .map(SlangTermResponse::from)
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public SlangStatistics statistics() {
        Double average = slangTermRepository.averagePopularity();
        return SlangStatistics.builder()
            .totalTerms(slangTermRepository.count())
            .termsByLanguage(toCountMap(slangTermRepository.countByLanguage()))
            .termsByRegion(toCountMap(slangTermRepository.countByRegion()))
            .averagePopularity(average != null ? average : 0.0)
            .build();
    }

    private TranslationResult unknown(String text, String source, String target, String preferredRegion) {
        return TranslationResult.builder()
            .originalText(text)
            .translatedText(text)
            .confidence(0.0)
            .context(properties.getTranslation().getDefaultContext())
            .sourceLanguage(source)
            .targetLanguage(target)
            .region(TextNormalizer.isBlank(preferredRegion) ? "unknown" : preferredRegion)
            .unknown(Boolean.TRUE)
            .build();
    }

    private static double adjust(Double confidence, boolean fuzzy) {
        double value = confidence != null ? confidence : 0.0;
        return fuzzy ? Math.max(FUZZY_FLOOR, value - FUZZY_PENALTY) : value;
    }

    private static List<String> firstExamples(SlangTerm term) {
        return term.getUsageExamples().stream().limit(MAX_USAGE_EXAMPLES).collect(Collectors.toList());
    }

    private static List<Translation> toTranslations(List<TranslationDto> dtos) {
        List<Translation> translations = new ArrayList<>();
        if (dtos != null) {
            for (TranslationDto dto : dtos) {
                if (dto == null) {
                    throw new ValidationException("Invalid slang term",
                        List.of("translations: must not contain null entries"));
                }
                translations.add(new Translation(dto.getText(), lower(dto.getTargetLanguage()),
                    lower(dto.getContext()), dto.getConfidence()));
            }
        }
        return translations;
    }

    private static Map<String, Long> toCountMap(List<Object[]> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : rows) {
            counts.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private static boolean changed(String requested, String current) {
        return requested != null && !Objects.equals(requested.trim(), current);
    }

    private static String languageOrDefault(String language, String fallback) {
        return TextNormalizer.isBlank(language) ? fallback : language.trim().toLowerCase(Locale.ROOT);
    }

    private static String lower(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}
