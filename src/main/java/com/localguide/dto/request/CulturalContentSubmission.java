package com.localguide.dto.request;

import com.localguide.model.ContentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CulturalContentSubmission implements ContentSubmission {

    @NotNull
    @Valid
    private CulturalEntry data;

    @Override
    public ContentType contentType() {
        return ContentType.CULTURAL;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CulturalEntry {
        @NotBlank
        private String region;
        @NotBlank
        private String title;
        private String description;
        private String category;
    }
}
