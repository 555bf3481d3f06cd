package com.localguide.dto.response;

import com.localguide.dto.PreferencesDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {
    private String id;
    private PreferencesDto preferences;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
