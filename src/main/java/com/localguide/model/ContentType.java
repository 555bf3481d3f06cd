package com.localguide.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 콘텐츠 종류 (즐겨찾기, 추천 이력, 관리자 제출 태그에서 공통 사용)
 */
public enum ContentType {
    SLANG,
    FOOD,
    CULTURAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ContentType from(String value) {
        if (value == null) {
            return null;
        }
        return ContentType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
