package com.localguide.controller;

import com.localguide.dto.response.TranslationResult;
import com.localguide.exception.ConflictException;
import com.localguide.exception.NotFoundException;
import com.localguide.model.ContentType;
import com.localguide.service.ApiLogService;
import com.localguide.service.HistoryService;
import com.localguide.service.SlangTranslationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = TranslationController.class)
class TranslationControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    SlangTranslationService slangTranslationService;

    @MockBean
    HistoryService historyService;

    @MockBean
    ApiLogService apiLogService;

    @Test
    void translateWrapsResultInEnvelope() throws Exception {
        when(slangTranslationService.translate("jugaad", null, null, "delhi")).thenReturn(TranslationResult.builder()
            .originalText("jugaad")
            .translatedText("creative fix")
            .confidence(0.9)
            .sourceLanguage("hindi")
            .targetLanguage("english")
            .region("delhi")
            .build());

        mvc.perform(post("/api/translate").contentType("application/json")
                .content("{\"text\":\"jugaad\",\"region\":\"delhi\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.translatedText").value("creative fix"))
            .andExpect(jsonPath("$.data.confidence").value(0.9))
            .andExpect(jsonPath("$.data.isUnknown").doesNotExist());

        verify(historyService, never()).record(anyString(), any(), anyString(), anyInt());
    }

    @Test
    void unknownTranslationIsStillOkAndRecorded() throws Exception {
        when(slangTranslationService.translate("zzzz", null, null, null)).thenReturn(TranslationResult.builder()
            .originalText("zzzz")
            .translatedText("zzzz")
            .region("unknown")
            .unknown(true)
            .build());

        mvc.perform(post("/api/translate").contentType("application/json")
                .header("X-User-Id", "u-1")
                .content("{\"text\":\"zzzz\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.isUnknown").value(true))
            .andExpect(jsonPath("$.data.confidence").value(0.0));

        verify(historyService).record("u-1", ContentType.SLANG, "zzzz", 0);
    }

    @Test
    void missingTextIsValidationFailure() throws Exception {
        mvc.perform(post("/api/translate").contentType("application/json").content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("ValidationFailure"))
            .andExpect(jsonPath("$.details[0]").value("text: must not be null"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mvc.perform(post("/api/translate").contentType("application/json").content("{\"text\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BadRequest"));
    }

    @Test
    void unknownTermIdIsNotFound() throws Exception {
        when(slangTranslationService.findById("missing")).thenThrow(NotFoundException.of("Slang term", "missing"));

        mvc.perform(get("/api/translate/terms/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NotFound"))
            .andExpect(jsonPath("$.message").value("Slang term not found: missing"));
    }

    @Test
    void duplicateTermIsConflict() throws Exception {
        when(slangTranslationService.add(any())).thenThrow(new ConflictException("Slang term 'bindaas' already exists"));

        mvc.perform(post("/api/translate/terms").contentType("application/json")
                .content("{\"term\":\"bindaas\",\"language\":\"hindi\",\"region\":\"mumbai\",\"context\":\"slang\","
                    + "\"translations\":[{\"text\":\"carefree\",\"targetLanguage\":\"english\",\"confidence\":0.8}]}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Conflict"));
    }

    @Test
    void nullTranslationEntryIsValidationFailure() throws Exception {
        mvc.perform(post("/api/translate/terms").contentType("application/json")
                .content("{\"term\":\"bindaas\",\"language\":\"hindi\",\"region\":\"mumbai\",\"context\":\"slang\","
                    + "\"translations\":[null]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ValidationFailure"));

        verify(slangTranslationService, never()).add(any());
    }

    @Test
    void nullTranslationEntryInUpdateIsValidationFailure() throws Exception {
        mvc.perform(put("/api/translate/terms/t-1").contentType("application/json")
                .content("{\"translations\":[null]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ValidationFailure"));

        verify(slangTranslationService, never()).update(anyString(), any());
    }

    @Test
    void deleteReturnsMessage() throws Exception {
        mvc.perform(delete("/api/translate/terms/t-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Slang term deleted"));

        verify(slangTranslationService).delete("t-1");
    }

    @Test
    void popularLimitOutOfRangeIsRejected() throws Exception {
        mvc.perform(get("/api/translate/popular").param("limit", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ValidationFailure"));

        verify(slangTranslationService, never()).popular(anyInt());
    }
}
