package com.localguide.dto.request;

import com.localguide.model.ContentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FoodContentSubmission implements ContentSubmission {

    @NotNull
    @Valid
    private FoodItemRequest data;

    @Override
    public ContentType contentType() {
        return ContentType.FOOD;
    }
}
