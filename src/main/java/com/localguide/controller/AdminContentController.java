package com.localguide.controller;

import com.localguide.dto.request.ContentSubmission;
import com.localguide.dto.response.ApiResponse;
import com.localguide.dto.response.SubmissionResult;
import com.localguide.service.AdminContentService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 관리자 콘텐츠 등록 API
 * POST /api/admin/content  { "type": "slang" | "food" | "cultural", "data": {...} }
 */
@RestController
@RequestMapping("/api/admin")
@CrossOrigin(origins = {"https://localguide.vercel.app", "http://localhost:3000"})
public class AdminContentController {

    @Autowired
    private AdminContentService adminContentService;

    @PostMapping("/content")
    public ResponseEntity<ApiResponse<SubmissionResult>> submit(@Valid @RequestBody ContentSubmission submission) {
        SubmissionResult result = adminContentService.submit(submission);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(result, "Content submitted"));
    }
}
