package com.localguide.service;

import com.localguide.dto.PreferencesDto;
import com.localguide.dto.request.FavoriteRequest;
import com.localguide.dto.response.FavoriteResponse;
import com.localguide.dto.response.UserResponse;
import com.localguide.entity.Favorite;
import com.localguide.entity.UserAccount;
import com.localguide.entity.UserPreferences;
import com.localguide.exception.NotFoundException;
import com.localguide.exception.ValidationException;
import com.localguide.repository.FavoriteRepository;
import com.localguide.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 사용자 취향/즐겨찾기
 * 즐겨찾기 itemId는 참조 대상 존재 여부를 확인하지 않음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserAccountRepository userAccountRepository;
    private final FavoriteRepository favoriteRepository;
    private final Clock clock;

    @Transactional
    public UserResponse createUser(PreferencesDto preferences) {
        UserAccount account = new UserAccount();
        account.setPreferences(toPreferences(preferences));
        UserAccount saved = userAccountRepository.save(account);
        log.info("[UserService] createUser - id: {}", saved.getId());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(String userId) {
        return toResponse(findUser(userId));
    }

    @Transactional
    public UserResponse updatePreferences(String userId, PreferencesDto preferences) {
        UserAccount account = findUser(userId);
        // 컬렉션 포함 통째로 교체
        account.setPreferences(toPreferences(preferences));

        UserAccount saved = userAccountRepository.saveAndFlush(account);
        log.info("[UserService] updatePreferences - id: {}", userId);
        return toResponse(saved);
    }

    @Transactional
    public FavoriteResponse addFavorite(String userId, FavoriteRequest request) {
        findUser(userId);
        Favorite favorite = Favorite.builder()
            .userId(userId)
            .type(request.getType())
            .itemId(request.getItemId())
            .notes(request.getNotes())
            .dateAdded(LocalDateTime.now(clock))
            .build();
        Favorite saved = favoriteRepository.save(favorite);
        log.info("[UserService] addFavorite - userId: {}, type: {}, itemId: {}", userId, request.getType(), request.getItemId());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<FavoriteResponse> favorites(String userId) {
        findUser(userId);
        return favoriteRepository.findByUserIdOrderByDateAddedDesc(userId).stream()
            .map(UserService::toResponse)
            .collect(Collectors.toList());
    }

    @Transactional
    public void removeFavorite(String userId, Long favoriteId) {
        Favorite favorite = favoriteRepository.findByIdAndUserId(favoriteId, userId)
            .orElseThrow(() -> NotFoundException.of("Favorite", favoriteId));
        favoriteRepository.delete(favorite);
        log.info("[UserService] removeFavorite - userId: {}, favoriteId: {}", userId, favoriteId);
    }

    private UserAccount findUser(String userId) {
        return userAccountRepository.findById(userId)
            .orElseThrow(() -> NotFoundException.of("User", userId));
    }

    private static UserPreferences toPreferences(PreferencesDto dto) {
        UserPreferences preferences = new UserPreferences();
        if (dto == null) {
            return preferences;
        }
        if (dto.getBudgetMin() != null && dto.getBudgetMax() != null && dto.getBudgetMax() < dto.getBudgetMin()) {
            throw new ValidationException("Invalid preferences",
                List.of("budgetMax: must be greater than or equal to budgetMin"));
        }
        if (dto.getDietaryRestrictions() != null) {
            preferences.getDietaryRestrictions().addAll(dto.getDietaryRestrictions());
        }
        if (dto.getPreferredRegions() != null) {
            preferences.getPreferredRegions().addAll(dto.getPreferredRegions());
        }
        preferences.setSpicePreference(dto.getSpicePreference());
        preferences.setLanguagePreference(dto.getLanguagePreference());
        preferences.setBudgetMin(dto.getBudgetMin());
        preferences.setBudgetMax(dto.getBudgetMax());
        return preferences;
    }

    private static UserResponse toResponse(UserAccount account) {
        UserPreferences preferences = account.getPreferences() != null ? account.getPreferences() : new UserPreferences();
        return UserResponse.builder()
            .id(account.getId())
            .preferences(PreferencesDto.builder()
                .dietaryRestrictions(new ArrayList<>(preferences.getDietaryRestrictions()))
                .spicePreference(preferences.getSpicePreference())
                .preferredRegions(new ArrayList<>(preferences.getPreferredRegions()))
                .languagePreference(preferences.getLanguagePreference())
                .budgetMin(preferences.getBudgetMin())
                .budgetMax(preferences.getBudgetMax())
                .build())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }

    private static FavoriteResponse toResponse(Favorite favorite) {
        return FavoriteResponse.builder()
            .id(favorite.getId())
            .userId(favorite.getUserId())
            .type(favorite.getType())
            .itemId(favorite.getItemId())
            .notes(favorite.getNotes())
            .dateAdded(favorite.getDateAdded())
            .build();
    }
}
