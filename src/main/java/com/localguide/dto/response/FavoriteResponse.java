package com.localguide.dto.response;

import com.localguide.model.ContentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FavoriteResponse {
    private Long id;
    private String userId;
    private ContentType type;
    private String itemId;
    private String notes;
    private LocalDateTime dateAdded;
}
