package com.localguide.dto.response;

import com.localguide.model.ContentType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 관리자 콘텐츠 제출 결과: 저장된 종류와 id, 처리 상태
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionResult {
    private ContentType type;
    private String id;
    private String status; // CREATED | PENDING
}
