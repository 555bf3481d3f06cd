package com.localguide.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localguide.dto.response.CulturalRegionGroup;
import com.localguide.dto.response.CulturalSearchResult;
import com.localguide.exception.NotFoundException;
import com.localguide.model.cultural.BargainingTip;
import com.localguide.model.cultural.CulturalCatalog;
import com.localguide.model.cultural.Custom;
import com.localguide.model.cultural.EtiquetteRule;
import com.localguide.model.cultural.Festival;
import com.localguide.model.cultural.RegionalInfo;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CulturalServiceTest {

    private static CulturalCatalog catalog;

    private final CulturalService service = new CulturalService(catalog);

    @BeforeAll
    static void loadCatalog() throws IOException {
        try (InputStream in = CulturalServiceTest.class.getResourceAsStream("/cultural/catalog.json")) {
            catalog = CulturalCatalog.read(in, new ObjectMapper());
        }
    }

    @Test
    void knownRegionIsCaseInsensitive() {
        RegionalInfo info = service.regionalInfo(" DELHI ");

        assertThat(info.getRegion()).isEqualTo("Delhi");
        assertThat(info.getCustoms()).extracting(Custom::getName)
            .containsExactly("Namaste Greeting", "Removing Shoes");
        assertThat(info.getTransportation().getCosts()).hasSize(3);
    }

    @Test
    void unknownRegionGetsDefaults() {
        RegionalInfo info = service.regionalInfo("Goa");

        assertThat(info.getRegion()).isEqualTo("Goa");
        assertThat(info.getLanguages()).containsExactly("Hindi", "English");
        assertThat(info.getCustoms()).isEmpty();
        assertThat(info.getTransportation().getPublicTransport()).containsExactly("Bus", "Auto-rickshaw");
    }

    @Test
    void festivalLookup() {
        assertThat(service.festival("Holi").getDate()).isEqualTo("March (varies by lunar calendar)");

        assertThatThrownBy(() -> service.festival("pongal"))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("Festival 'pongal' not found");
    }

    @Test
    void etiquetteByContext() {
        assertThat(service.etiquette("Dining")).extracting(EtiquetteRule::getImportance)
            .containsExactly("high", "medium");
        assertThat(service.etiquette("nightlife")).isEmpty();
    }

    @Test
    void bargainingFallsBackCityStateGeneral() {
        assertThat(service.bargainingTips("Mumbai", "Maharashtra")).extracting(BargainingTip::getExpectedDiscount)
            .containsExactly("30-50% off initial price");
        assertThat(service.bargainingTips("New Delhi", "Delhi")).extracting(BargainingTip::getExpectedDiscount)
            .containsExactly("40-60% off initial price");
        assertThat(service.bargainingTips("Pune", "Maharashtra")).extracting(BargainingTip::getContext)
            .containsExactly("Auto-rickshaw");
        assertThat(service.bargainingTips(null, null)).hasSize(1);
    }

    @Test
    void searchFindsRegion() {
        List<CulturalSearchResult> results = service.search("Delhi", null);

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.getId()).isEqualTo("region-delhi");
            assertThat(r.getKind()).isEqualTo("region");
            assertThat(r.getType()).isEqualTo("cultural");
            assertThat(r.getTitle()).isEqualTo("Delhi Regional Information");
            assertThat(r.getDescription()).isEqualTo("Cultural information about Delhi");
            assertThat(r.getRelevanceScore()).isEqualTo(140.0);
        });
    }

    @Test
    void searchFindsCustomByName() {
        List<CulturalSearchResult> results = service.search("train", null);

        assertThat(results).extracting(CulturalSearchResult::getId).containsExactly("custom-mumbai-0");
        assertThat(results.get(0).getRelevanceScore()).isEqualTo(100.0);
    }

    @Test
    void searchMatchesFestivalSignificance() {
        assertThat(service.search("lights", null)).extracting(CulturalSearchResult::getId)
            .containsExactly("festival-diwali");
    }

    @Test
    void regionFilterDoesNotApplyToFestivals() {
        assertThat(service.search("shoes", "mumbai")).isEmpty();
        assertThat(service.search("shoes", "delhi")).extracting(CulturalSearchResult::getId)
            .containsExactly("custom-delhi-1");
        assertThat(service.search("holi", "mumbai")).extracting(CulturalSearchResult::getId)
            .containsExactly("festival-holi");
    }

    @Test
    void blankQueryReturnsNothing() {
        assertThat(service.search("  ", null)).isEmpty();
    }

    @Test
    void searchIsCappedAtTwenty() {
        Map<String, Festival> festivals = new LinkedHashMap<>();
        for (int i = 0; i < 25; i++) {
            festivals.put("mela " + i, new Festival("Mela " + i, "varies", "Village fair", new ArrayList<>(),
                new ArrayList<>(), new ArrayList<>()));
        }
        CulturalService crowded = new CulturalService(new CulturalCatalog(Map.of(), festivals, Map.of(), Map.of()));

        assertThat(crowded.search("mela", null)).hasSize(20);
    }

    @Test
    void groupedSearchPutsFestivalsUnderGeneral() {
        RegionalInfo goa = new RegionalInfo("Goa", new ArrayList<>(List.of("Konkani")),
            new ArrayList<>(List.of(new Custom("Carnival Parade", "Street parade before Lent", "Local tradition", new ArrayList<>()))),
            new ArrayList<>(), new ArrayList<>(), null);
        Festival carnival = new Festival("Carnival", "February", "Three days of music and floats",
            new ArrayList<>(), new ArrayList<>(List.of("Goa")), new ArrayList<>());
        CulturalService goaService = new CulturalService(
            new CulturalCatalog(Map.of("goa", goa), Map.of("carnival", carnival), Map.of(), Map.of()));

        List<CulturalRegionGroup> groups = goaService.searchGroupedByRegion("carnival");

        assertThat(groups).extracting(CulturalRegionGroup::getRegion).containsExactly("General", "Goa");
        assertThat(groups.get(0).getTopScore()).isEqualTo(140.0);
        assertThat(groups.get(1).getTopScore()).isEqualTo(120.0);
    }

    @Test
    void catalogIsReadOnly() {
        assertThatThrownBy(() -> catalog.getFestivals().remove("diwali"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> catalog.getEtiquette().get("dining").clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nestedCatalogListsAreReadOnly() {
        Festival diwali = service.festival("Diwali");
        RegionalInfo delhi = service.regionalInfo("delhi");

        assertThatThrownBy(() -> diwali.getCelebrations().add("Card games"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> delhi.getCustoms().clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> delhi.getCustoms().get(0).getDosDonts().remove(0))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> delhi.getFestivals().get(0).getRegions().add("Goa"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> delhi.getTransportation().getTips().clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(service.festival("diwali").getCelebrations()).doesNotContain("Card games");
    }
}
