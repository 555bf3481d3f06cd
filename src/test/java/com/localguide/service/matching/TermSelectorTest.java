package com.localguide.service.matching;

import com.localguide.entity.SlangTerm;
import com.localguide.entity.Translation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TermSelectorTest {

    @Test
    void preferredRegionBeatsPopularity() {
        SlangTerm mumbai = term("fundoo", "mumbai", 80);
        SlangTerm delhi = term("fundoo", "Delhi", 60);

        assertThat(TermSelector.selectBestMatch(List.of(mumbai, delhi), "delhi")).isSameAs(delhi);
    }

    @Test
    void fallsBackToMostPopularWithFirstWinningTies() {
        SlangTerm first = term("acha", "delhi", 70);
        SlangTerm second = term("acha", "mumbai", 90);
        SlangTerm third = term("acha", "pune", 90);

        assertThat(TermSelector.selectBestMatch(List.of(first, second, third), "kolkata")).isSameAs(second);
        assertThat(TermSelector.selectBestMatch(List.of(first, second, third), null)).isSameAs(second);
    }

    @Test
    void emptyCandidatesAreRejected() {
        assertThatThrownBy(() -> TermSelector.selectBestMatch(List.of(), "delhi"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TermSelector.selectBestTranslation(List.of(), "casual"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void preferredContextBeatsConfidence() {
        Translation slang = new Translation("awesome", "english", "slang", 0.9);
        Translation casual = new Translation("cool", "english", "casual", 0.8);

        assertThat(TermSelector.selectBestTranslation(List.of(slang, casual), "casual")).isSameAs(casual);
        assertThat(TermSelector.selectBestTranslation(List.of(slang, casual), "formal")).isSameAs(slang);
    }

    @Test
    void alternativesExcludeChosenAndFollowPreference() {
        Translation killingTime = new Translation("killing time", "english", "casual", 0.9);
        Translation leisure = new Translation("leisure activity", "english", "formal", 0.7);
        Translation pastime = new Translation("pastime", "english", "casual", 0.8);
        List<Translation> all = List.of(killingTime, leisure, pastime);

        List<Translation> alternatives = TermSelector.alternatives(all, killingTime, "casual", 3);

        assertThat(alternatives).containsExactly(pastime, leisure);
        assertThat(TermSelector.alternatives(all, killingTime, "casual", 1)).containsExactly(pastime);
    }

    @Test
    void translationsForFiltersByLanguage() {
        SlangTerm term = term("acha", "mumbai", 100);
        term.getTranslations().add(new Translation("okay", "english", "casual", 0.9));
        term.getTranslations().add(new Translation("ठीक है", "hindi", "casual", 0.9));

        assertThat(TermSelector.translationsFor(term, "english"))
            .extracting(Translation::getText)
            .containsExactly("okay");
    }

    @Test
    void deduplicateKeepsFirstPerTermRegionLanguage() {
        SlangTerm a = term("Jugaad", "Delhi", 95);
        SlangTerm b = term("jugaad!", "delhi", 10);
        SlangTerm c = term("jugaad", "mumbai", 50);

        assertThat(TermSelector.deduplicate(List.of(a, b, c))).containsExactly(a, c);
    }

    private static SlangTerm term(String text, String region, int popularity) {
        SlangTerm term = new SlangTerm();
        term.setTerm(text);
        term.setLanguage("hindi");
        term.setRegion(region);
        term.setContext("casual");
        term.setPopularity(popularity);
        term.setTranslations(new ArrayList<>());
        return term;
    }
}
