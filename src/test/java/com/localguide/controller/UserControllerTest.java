package com.localguide.controller;

import com.localguide.dto.PreferencesDto;
import com.localguide.dto.response.FavoriteResponse;
import com.localguide.dto.response.HistoryEntry;
import com.localguide.dto.response.UserResponse;
import com.localguide.exception.NotFoundException;
import com.localguide.exception.ValidationException;
import com.localguide.model.ContentType;
import com.localguide.service.ApiLogService;
import com.localguide.service.HistoryService;
import com.localguide.service.UserService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = UserController.class)
class UserControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    UserService userService;

    @MockBean
    HistoryService historyService;

    @MockBean
    ApiLogService apiLogService;

    @Test
    void createWithoutBodyUsesDefaults() throws Exception {
        when(userService.createUser(isNull())).thenReturn(UserResponse.builder()
            .id("u-1").preferences(PreferencesDto.builder().build()).build());

        mvc.perform(post("/api/users"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.id").value("u-1"))
            .andExpect(jsonPath("$.data.preferences.dietaryRestrictions").isEmpty());
    }

    @Test
    void invalidBudgetIsValidationFailure() throws Exception {
        when(userService.updatePreferences(eq("u-1"), any())).thenThrow(new ValidationException("Invalid preferences",
            List.of("budgetMax: must be greater than or equal to budgetMin")));

        mvc.perform(put("/api/users/u-1/preferences").contentType("application/json")
                .content("{\"budgetMin\":300,\"budgetMax\":100}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details[0]").value("budgetMax: must be greater than or equal to budgetMin"));
    }

    @Test
    void unknownUserIsNotFound() throws Exception {
        when(userService.getUser("ghost")).thenThrow(NotFoundException.of("User", "ghost"));

        mvc.perform(get("/api/users/ghost"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NotFound"));
    }

    @Test
    void addFavoriteReturnsCreated() throws Exception {
        when(userService.addFavorite(eq("u-1"), any())).thenReturn(FavoriteResponse.builder()
            .id(5L).userId("u-1").type(ContentType.FOOD).itemId("v-9").build());

        mvc.perform(post("/api/users/u-1/favorites").contentType("application/json")
                .content("{\"type\":\"food\",\"itemId\":\"v-9\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.message").value("Added to favorites"))
            .andExpect(jsonPath("$.data.type").value("food"));
    }

    @Test
    void favoriteWithUnknownTypeIsBadRequest() throws Exception {
        mvc.perform(post("/api/users/u-1/favorites").contentType("application/json")
                .content("{\"type\":\"music\",\"itemId\":\"x\"}"))
            .andExpect(status().isBadRequest());

        verify(userService, never()).addFavorite(any(), any());
    }

    @Test
    void nonNumericFavoriteIdIsBadRequest() throws Exception {
        mvc.perform(delete("/api/users/u-1/favorites/abc"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BadRequest"));
    }

    @Test
    void historyUsesDefaultLimit() throws Exception {
        when(historyService.history("u-1", 20)).thenReturn(List.of(HistoryEntry.builder()
            .userId("u-1").type(ContentType.SLANG).query("jugaad").resultCount(1).timestamp(1L).build()));

        mvc.perform(get("/api/users/u-1/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].query").value("jugaad"))
            .andExpect(jsonPath("$.data[0].type").value("slang"));
    }

    @Test
    void historyLimitAboveMaximumIsRejected() throws Exception {
        mvc.perform(get("/api/users/u-1/history").param("limit", "51"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ValidationFailure"));
    }
}
