package com.localguide.service;

import com.localguide.dto.PriceRangeDto;
import com.localguide.dto.response.CulturalRegionGroup;
import com.localguide.dto.response.CulturalSearchResult;
import com.localguide.exception.NotFoundException;
import com.localguide.model.ContentType;
import com.localguide.model.cultural.BargainingTip;
import com.localguide.model.cultural.Custom;
import com.localguide.model.cultural.CulturalCatalog;
import com.localguide.model.cultural.EtiquetteRule;
import com.localguide.model.cultural.Festival;
import com.localguide.model.cultural.RegionalInfo;
import com.localguide.model.cultural.TransportationInfo;
import com.localguide.service.matching.RelevanceScorer;
import com.localguide.service.matching.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 문화 정보 조회 (기동 시 로드된 카탈로그만 읽음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CulturalService {

    static final int SEARCH_RESULT_LIMIT = 20;
    static final String GENERAL = "general";

    private final CulturalCatalog catalog;

    /**
     * 지역 정보. 카탈로그에 없는 지역은 기본 정보로 응답 (에러 아님)
     */
    public RegionalInfo regionalInfo(String region) {
        log.debug("[CulturalService] regionalInfo - region: {}", region);
        RegionalInfo info = catalog.getRegions().get(key(region));
        if (info == null) {
            log.info("[CulturalService] regionalInfo - no catalog entry, returning defaults for region: {}", region);
            return defaultInfo(region);
        }
        log.info("[CulturalService] regionalInfo - region: {}, customs: {}", region, info.getCustoms().size());
        return info;
    }

    public Festival festival(String name) {
        log.debug("[CulturalService] festival - name: {}", name);
        Festival festival = catalog.getFestivals().get(key(name));
        if (festival == null) {
            throw new NotFoundException("Festival '" + name + "' not found");
        }
        return festival;
    }

    public List<EtiquetteRule> etiquette(String context) {
        List<EtiquetteRule> rules = catalog.getEtiquette().getOrDefault(key(context), List.of());
        log.info("[CulturalService] etiquette - context: {}, rules: {}", context, rules.size());
        return rules;
    }

    /**
     * 흥정 팁: 도시 -> 주 -> general 순으로 먼저 찾은 것
     */
    public List<BargainingTip> bargainingTips(String city, String state) {
        Map<String, List<BargainingTip>> tips = catalog.getBargainingTips();
        List<BargainingTip> result = tips.get(key(city));
        if (result == null) {
            result = tips.get(key(state));
        }
        if (result == null) {
            result = tips.getOrDefault(GENERAL, List.of());
        }
        log.info("[CulturalService] bargainingTips - city: {}, state: {}, tips: {}", city, state, result.size());
        return result;
    }

    /**
     * 지역 정보/관습/축제를 한꺼번에 검색해 관련도 순으로 최대 20개
     * 같은 개념이 여러 종류로 잡혀도 중복 제거하지 않음
     */
    public List<CulturalSearchResult> search(String query, String region) {
        log.debug("[CulturalService] search - query: {}, region: {}", query, region);
        if (TextNormalizer.isBlank(query)) {
            return List.of();
        }
        String normalizedQuery = key(query);
        String regionFilter = TextNormalizer.isBlank(region) ? null : key(region);

        List<CulturalSearchResult> results = new ArrayList<>();
        for (Map.Entry<String, RegionalInfo> entry : catalog.getRegions().entrySet()) {
            String regionKey = entry.getKey();
            RegionalInfo info = entry.getValue();
            if (regionFilter != null && !regionKey.equals(regionFilter)) {
                continue;
            }

            if (regionKey.contains(normalizedQuery) || lower(info.getRegion()).contains(normalizedQuery)) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("languages", info.getLanguages());
                results.add(CulturalSearchResult.builder()
                    .id("region-" + regionKey)
                    .type(ContentType.CULTURAL.value())
                    .kind("region")
                    .region(info.getRegion())
                    .title(info.getRegion() + " Regional Information")
                    .description("Cultural information about " + info.getRegion())
                    .relevanceScore(RelevanceScorer.culturalRelevance(normalizedQuery, regionKey))
                    .metadata(metadata)
                    .build());
            }

            List<Custom> customs = info.getCustoms();
            for (int i = 0; i < customs.size(); i++) {
                Custom custom = customs.get(i);
                if (lower(custom.getName()).contains(normalizedQuery)
                        || lower(custom.getDescription()).contains(normalizedQuery)) {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("significance", custom.getSignificance());
                    metadata.put("dosDonts", custom.getDosDonts());
                    results.add(CulturalSearchResult.builder()
                        .id("custom-" + regionKey + "-" + i)
                        .type(ContentType.CULTURAL.value())
                        .kind("custom")
                        .region(info.getRegion())
                        .title(custom.getName())
                        .description(custom.getDescription())
                        .relevanceScore(RelevanceScorer.culturalRelevance(normalizedQuery, custom.getName()))
                        .metadata(metadata)
                        .build());
                }
            }
        }

        // 축제는 지역 필터와 무관하게 검색
        for (Map.Entry<String, Festival> entry : catalog.getFestivals().entrySet()) {
            String festivalKey = entry.getKey();
            Festival festival = entry.getValue();
            if (festivalKey.contains(normalizedQuery)
                    || lower(festival.getName()).contains(normalizedQuery)
                    || lower(festival.getSignificance()).contains(normalizedQuery)) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("date", festival.getDate());
                metadata.put("regions", festival.getRegions());
                results.add(CulturalSearchResult.builder()
                    .id("festival-" + festivalKey)
                    .type(ContentType.CULTURAL.value())
                    .kind("festival")
                    .title(festival.getName())
                    .description(festival.getSignificance())
                    .relevanceScore(RelevanceScorer.culturalRelevance(normalizedQuery, festivalKey))
                    .metadata(metadata)
                    .build());
            }
        }

        results.sort(Comparator.comparingDouble(CulturalSearchResult::getRelevanceScore).reversed());
        List<CulturalSearchResult> top = results.size() > SEARCH_RESULT_LIMIT
            ? new ArrayList<>(results.subList(0, SEARCH_RESULT_LIMIT))
            : results;
        log.info("[CulturalService] search - query: {}, results: {}", query, top.size());
        return top;
    }

    /**
     * search 결과를 지역명으로 묶음. 지역이 없는 결과(축제)는 General 그룹
     * 그룹 순서는 그룹 내 최고 점수 내림차순
     */
    public List<CulturalRegionGroup> searchGroupedByRegion(String query) {
        Map<String, CulturalRegionGroup> groups = new LinkedHashMap<>();
        for (CulturalSearchResult result : search(query, null)) {
            String regionName = result.getRegion() != null ? result.getRegion() : "General";
            CulturalRegionGroup group = groups.computeIfAbsent(regionName.toLowerCase(Locale.ROOT),
                k -> new CulturalRegionGroup(regionName, result.getRelevanceScore(), new ArrayList<>()));
            group.getResults().add(result);
            group.setTopScore(Math.max(group.getTopScore(), result.getRelevanceScore()));
        }

        List<CulturalRegionGroup> ordered = new ArrayList<>(groups.values());
        ordered.sort(Comparator.comparingDouble(CulturalRegionGroup::getTopScore).reversed());
        return ordered;
    }

    private RegionalInfo defaultInfo(String region) {
        TransportationInfo transportation = new TransportationInfo(
            new ArrayList<>(List.of("Bus", "Auto-rickshaw")),
            new ArrayList<>(List.of("Negotiate fare beforehand", "Keep small change ready")),
            new ArrayList<>(List.of(new PriceRangeDto(10.0, 100.0, "INR"))));
        return new RegionalInfo(region, new ArrayList<>(List.of("Hindi", "English")),
            new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), transportation);
    }

    private static String key(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
