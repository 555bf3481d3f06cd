package com.localguide.controller;

import com.localguide.dto.SafetyRatingDto;
import com.localguide.dto.response.FoodRecommendation;
import com.localguide.exception.NotFoundException;
import com.localguide.model.ContentType;
import com.localguide.service.ApiLogService;
import com.localguide.service.FoodRecommendationService;
import com.localguide.service.HistoryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = FoodController.class)
class FoodControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    FoodRecommendationService foodRecommendationService;

    @MockBean
    HistoryService historyService;

    @MockBean
    ApiLogService apiLogService;

    @Test
    void recommendationsAreRecordedByCity() throws Exception {
        when(foodRecommendationService.recommend(any(), any())).thenReturn(List.of(
            FoodRecommendation.builder().vendorId("v-1").vendorName("Sharma Chaat").name("Aloo Tikki").distance(1.2).build()));

        mvc.perform(post("/api/food/recommendations").contentType("application/json")
                .header("X-User-Id", "u-7")
                .content("{\"location\":{\"latitude\":28.65,\"longitude\":77.23,\"city\":\"Delhi\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].vendorName").value("Sharma Chaat"))
            .andExpect(jsonPath("$.data[0].distance").value(1.2));

        verify(historyService).record("u-7", ContentType.FOOD, "Delhi", 1);
    }

    @Test
    void recommendationsWithoutLocationAreRejected() throws Exception {
        mvc.perform(post("/api/food/recommendations").contentType("application/json").content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ValidationFailure"))
            .andExpect(jsonPath("$.details[0]").value("location: must not be null"));
    }

    @Test
    void recommendationsWithOutOfRangeLatitudeAreRejected() throws Exception {
        mvc.perform(post("/api/food/recommendations").contentType("application/json")
                .content("{\"location\":{\"latitude\":91.0,\"longitude\":77.23}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ValidationFailure"));

        verify(foodRecommendationService, never()).recommend(any(), any());
    }

    @Test
    void categoryWithInvalidCoordinatesIsRejected() throws Exception {
        mvc.perform(get("/api/food/category/street-food").param("lat", "100").param("lng", "77.2"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ValidationFailure"));
    }

    @Test
    void searchWithoutCoordinatesIsBadRequest() throws Exception {
        mvc.perform(get("/api/food/search").param("q", "dosa"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BadRequest"));
    }

    @Test
    void searchRecordsHistory() throws Exception {
        when(foodRecommendationService.search(eq("dosa"), any())).thenReturn(List.of());

        mvc.perform(get("/api/food/search").param("q", "dosa").param("lat", "19.07").param("lng", "72.87")
                .header("X-User-Id", "u-7"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").isEmpty());

        verify(historyService).record("u-7", ContentType.FOOD, "dosa", 0);
    }

    @Test
    void unknownVendorSafetyIsNotFound() throws Exception {
        when(foodRecommendationService.rateSafety("nope")).thenThrow(NotFoundException.of("Vendor", "nope"));

        mvc.perform(get("/api/food/safety/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NotFound"));
    }

    @Test
    void safetyScoresOutsideScaleAreRejected() throws Exception {
        mvc.perform(put("/api/food/safety/v-1").contentType("application/json")
                .content("{\"overall\":6.0,\"hygiene\":4.0,\"freshness\":4.0,\"popularity\":4.0,\"reviewCount\":3}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details[0]").value("overall: must be less than or equal to 5.0"));
    }

    @Test
    void safetyUpdateReturnsStoredRating() throws Exception {
        when(foodRecommendationService.updateSafetyRating(eq("v-1"), any())).thenReturn(
            SafetyRatingDto.builder().overall(4.5).hygiene(4.0).freshness(4.8).popularity(4.2).reviewCount(12).build());

        mvc.perform(put("/api/food/safety/v-1").contentType("application/json")
                .content("{\"overall\":4.5,\"hygiene\":4.0,\"freshness\":4.8,\"popularity\":4.2,\"reviewCount\":12}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Safety rating updated"))
            .andExpect(jsonPath("$.data.overall").value(4.5));
    }
}
