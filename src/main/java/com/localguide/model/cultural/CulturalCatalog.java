package com.localguide.model.cultural;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 기동 시 한 번 로드되는 문화 정보 카탈로그 (읽기 전용)
 * 모든 키는 소문자로 정규화해서 보관
 */
public final class CulturalCatalog {

    private final Map<String, RegionalInfo> regions;
    private final Map<String, Festival> festivals;
    private final Map<String, List<EtiquetteRule>> etiquette;
    private final Map<String, List<BargainingTip>> bargainingTips;

    public CulturalCatalog(Map<String, RegionalInfo> regions,
                           Map<String, Festival> festivals,
                           Map<String, List<EtiquetteRule>> etiquette,
                           Map<String, List<BargainingTip>> bargainingTips) {
        this.regions = freeze(regions, CulturalCatalog::frozen);
        this.festivals = freeze(festivals, CulturalCatalog::frozen);
        this.etiquette = freezeLists(etiquette, CulturalCatalog::frozen);
        this.bargainingTips = freezeLists(bargainingTips, CulturalCatalog::frozen);
    }

    /**
     * JSON 문서에서 카탈로그 생성
     */
    public static CulturalCatalog read(InputStream json, ObjectMapper objectMapper) throws IOException {
        Document document = objectMapper.readValue(json, Document.class);
        return new CulturalCatalog(document.getRegions(), document.getFestivals(),
            document.getEtiquette(), document.getBargainingTips());
    }

    public Map<String, RegionalInfo> getRegions() {
        return regions;
    }

    public Map<String, Festival> getFestivals() {
        return festivals;
    }

    public Map<String, List<EtiquetteRule>> getEtiquette() {
        return etiquette;
    }

    public Map<String, List<BargainingTip>> getBargainingTips() {
        return bargainingTips;
    }

    private static <V> Map<String, V> freeze(Map<String, V> source, UnaryOperator<V> freezer) {
        Map<String, V> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> copy.put(key.toLowerCase(Locale.ROOT).trim(), freezer.apply(value)));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static <V> Map<String, List<V>> freezeLists(Map<String, List<V>> source, UnaryOperator<V> freezer) {
        Map<String, List<V>> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> copy.put(key.toLowerCase(Locale.ROOT).trim(), frozenList(value, freezer)));
        }
        return Collections.unmodifiableMap(copy);
    }

    // 하위 목록까지 불변 복사본으로 교체 (카탈로그 객체는 요청 간에 공유됨)
    private static RegionalInfo frozen(RegionalInfo info) {
        if (info == null) {
            return null;
        }
        return new RegionalInfo(info.getRegion(),
            frozenList(info.getLanguages(), UnaryOperator.identity()),
            frozenList(info.getCustoms(), CulturalCatalog::frozen),
            frozenList(info.getFestivals(), CulturalCatalog::frozen),
            frozenList(info.getEtiquette(), CulturalCatalog::frozen),
            frozen(info.getTransportation()));
    }

    private static Custom frozen(Custom custom) {
        return new Custom(custom.getName(), custom.getDescription(), custom.getSignificance(),
            frozenList(custom.getDosDonts(), UnaryOperator.identity()));
    }

    private static Festival frozen(Festival festival) {
        if (festival == null) {
            return null;
        }
        return new Festival(festival.getName(), festival.getDate(), festival.getSignificance(),
            frozenList(festival.getCelebrations(), UnaryOperator.identity()),
            frozenList(festival.getRegions(), UnaryOperator.identity()),
            frozenList(festival.getDosDonts(), UnaryOperator.identity()));
    }

    private static EtiquetteRule frozen(EtiquetteRule rule) {
        return new EtiquetteRule(rule.getContext(), frozenList(rule.getRules(), UnaryOperator.identity()),
            rule.getImportance());
    }

    private static BargainingTip frozen(BargainingTip tip) {
        return new BargainingTip(tip.getContext(), frozenList(tip.getTips(), UnaryOperator.identity()),
            tip.getExpectedDiscount(), frozenList(tip.getCulturalNotes(), UnaryOperator.identity()));
    }

    private static TransportationInfo frozen(TransportationInfo transportation) {
        if (transportation == null) {
            return null;
        }
        return new TransportationInfo(frozenList(transportation.getPublicTransport(), UnaryOperator.identity()),
            frozenList(transportation.getTips(), UnaryOperator.identity()),
            frozenList(transportation.getCosts(), UnaryOperator.identity()));
    }

    private static <V> List<V> frozenList(List<V> source, UnaryOperator<V> freezer) {
        if (source == null) {
            return List.of();
        }
        List<V> copy = new ArrayList<>(source.size());
        for (V value : source) {
            if (value != null) {
                copy.add(freezer.apply(value));
            }
        }
        return Collections.unmodifiableList(copy);
    }

    @Data
    static class Document {
        private Map<String, RegionalInfo> regions = new LinkedHashMap<>();
        private Map<String, Festival> festivals = new LinkedHashMap<>();
        private Map<String, List<EtiquetteRule>> etiquette = new LinkedHashMap<>();
        private Map<String, List<BargainingTip>> bargainingTips = new LinkedHashMap<>();
    }
}
