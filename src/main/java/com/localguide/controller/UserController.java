package com.localguide.controller;

import com.localguide.dto.PreferencesDto;
import com.localguide.dto.request.FavoriteRequest;
import com.localguide.dto.response.ApiResponse;
import com.localguide.dto.response.FavoriteResponse;
import com.localguide.dto.response.HistoryEntry;
import com.localguide.dto.response.UserResponse;
import com.localguide.service.HistoryService;
import com.localguide.service.UserService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 사용자 선호/즐겨찾기/검색 이력 REST API 컨트롤러
 */
@RestController
@RequestMapping("/api/users")
@CrossOrigin(origins = {"https://localguide.vercel.app", "http://localhost:3000"})
@Validated
public class UserController {

    @Autowired
    private UserService userService;

    @Autowired
    private HistoryService historyService;

    @PostMapping
    public ResponseEntity<ApiResponse<UserResponse>> create(@Valid @RequestBody(required = false) PreferencesDto preferences) {
        UserResponse created = userService.createUser(preferences);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<ApiResponse<UserResponse>> get(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.ok(userService.getUser(userId)));
    }

    @PutMapping("/{userId}/preferences")
    public ResponseEntity<ApiResponse<UserResponse>> updatePreferences(
            @PathVariable String userId,
            @Valid @RequestBody PreferencesDto preferences
    ) {
        return ResponseEntity.ok(ApiResponse.ok(userService.updatePreferences(userId, preferences), "Preferences updated"));
    }

    @GetMapping("/{userId}/favorites")
    public ResponseEntity<ApiResponse<List<FavoriteResponse>>> favorites(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.ok(userService.favorites(userId)));
    }

    @PostMapping("/{userId}/favorites")
    public ResponseEntity<ApiResponse<FavoriteResponse>> addFavorite(
            @PathVariable String userId,
            @Valid @RequestBody FavoriteRequest request
    ) {
        FavoriteResponse created = userService.addFavorite(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created, "Added to favorites"));
    }

    @DeleteMapping("/{userId}/favorites/{favoriteId}")
    public ResponseEntity<ApiResponse<Void>> removeFavorite(@PathVariable String userId, @PathVariable Long favoriteId) {
        userService.removeFavorite(userId, favoriteId);
        return ResponseEntity.ok(ApiResponse.ok(null, "Removed from favorites"));
    }

    /**
     * 최근 검색/추천 이력 (최신순)
     * GET /api/users/{userId}/history?limit=20
     */
    @GetMapping("/{userId}/history")
    public ResponseEntity<ApiResponse<List<HistoryEntry>>> history(
            @PathVariable String userId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(50) int limit
    ) {
        return ResponseEntity.ok(ApiResponse.ok(historyService.history(userId, limit)));
    }
}
