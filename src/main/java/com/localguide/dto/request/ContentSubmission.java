package com.localguide.dto.request;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.localguide.model.ContentType;

/**
 * 관리자 콘텐츠 제출 (type 태그로 구분되는 variant)
 * 알 수 없는 type이나 type 누락은 역직렬화 단계에서 400
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SlangContentSubmission.class, name = "slang"),
    @JsonSubTypes.Type(value = FoodContentSubmission.class, name = "food"),
    @JsonSubTypes.Type(value = CulturalContentSubmission.class, name = "cultural")
})
public interface ContentSubmission {

    ContentType contentType();
}
