package com.localguide.service;

import com.localguide.config.GuideProperties;
import com.localguide.dto.TranslationDto;
import com.localguide.dto.request.SlangTermRequest;
import com.localguide.dto.request.SlangTermUpdateRequest;
import com.localguide.dto.response.SlangTermResponse;
import com.localguide.dto.response.TranslationResult;
import com.localguide.exception.ConflictException;
import com.localguide.repository.SlangTermRepository;
import com.localguide.service.validation.SlangTermValidator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 실제 저장소(H2)까지 거치는 번역 서비스 동작
 */
@DataJpaTest
class SlangTranslationServiceJpaTest {

    @TestConfiguration
    static class ServiceConfig {
        @Bean
        SlangTranslationService slangTranslationService(SlangTermRepository slangTermRepository) {
            GuideProperties properties = new GuideProperties();
            return new SlangTranslationService(slangTermRepository, new SlangTermValidator(properties), properties);
        }
    }

    @Autowired
    private SlangTranslationService service;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void reverseTranslationMatchesPunctuatedText() {
        service.add(request("koi baat nahi", "delhi", "it's okay"));

        TranslationResult result = service.translate("it's okay", "english", "hindi", null);

        assertThat(result.getTranslatedText()).isEqualTo("koi baat nahi");
        assertThat(result.getConfidence()).isEqualTo(0.8);
        assertThat(result.getUnknown()).isNull();
    }

    @Test
    void updateMovingOntoExistingKeyIsConflict() {
        service.add(request("bindaas", "mumbai", "carefree"));
        SlangTermResponse delhi = service.add(request("bindaas", "delhi", "carefree"));

        SlangTermUpdateRequest update = new SlangTermUpdateRequest();
        update.setRegion("MUMBAI");

        assertThatThrownBy(() -> service.update(delhi.getId(), update)).isInstanceOf(ConflictException.class);
    }

    @Test
    void updateReplacesStoredTranslations() {
        SlangTermResponse created = service.add(request("jugaad", "delhi", "creative fix"));

        SlangTermUpdateRequest update = new SlangTermUpdateRequest();
        update.setTranslations(List.of(new TranslationDto("hack", "english", "slang", 0.7)));
        service.update(created.getId(), update);
        entityManager.clear();

        assertThat(service.findById(created.getId()).getTranslations())
            .extracting(TranslationDto::getText)
            .containsExactly("hack");
        assertThat(service.translate("creative fix", "english", "hindi", null).getUnknown()).isTrue();
    }

    private static SlangTermRequest request(String term, String region, String english) {
        return SlangTermRequest.builder()
            .term(term)
            .language("hindi")
            .region(region)
            .context("casual")
            .popularity(80)
            .translations(new ArrayList<>(List.of(new TranslationDto(english, "english", "casual", 0.9))))
            .build();
    }
}
