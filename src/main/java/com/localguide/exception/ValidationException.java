package com.localguide.exception;

import java.util.List;

/**
 * 의미 검증 실패 (400). 필드별 메시지를 모두 담는다
 */
public class ValidationException extends RuntimeException {

    private final List<String> details;

    public ValidationException(String message, List<String> details) {
        super(message);
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public ValidationException(String message) {
        this(message, List.of());
    }

    public List<String> getDetails() {
        return details;
    }
}
