package com.localguide.dto.request;

import com.localguide.model.ContentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FavoriteRequest {

    @NotNull
    private ContentType type;

    @NotBlank
    private String itemId;

    private String notes;
}
