package com.localguide.controller;

import com.localguide.dto.request.SlangTermRequest;
import com.localguide.dto.request.SlangTermUpdateRequest;
import com.localguide.dto.request.TranslateRequest;
import com.localguide.dto.response.ApiResponse;
import com.localguide.dto.response.RegionalVariation;
import com.localguide.dto.response.SlangStatistics;
import com.localguide.dto.response.SlangTermResponse;
import com.localguide.dto.response.TranslationResult;
import com.localguide.interceptor.ApiLoggingInterceptor;
import com.localguide.model.ContentType;
import com.localguide.service.HistoryService;
import com.localguide.service.SlangTranslationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 슬랭 번역 및 용어 관리 REST API 컨트롤러
 */
@RestController
@RequestMapping("/api/translate")
@CrossOrigin(origins = {"https://localguide.vercel.app", "http://localhost:3000"})
@Validated
public class TranslationController {

    @Autowired
    private SlangTranslationService slangTranslationService;

    @Autowired
    private HistoryService historyService;

    /**
     * 번역 API
     * POST /api/translate
     * 모르는 표현도 200 + isUnknown=true 로 응답
     */
    @PostMapping
    public ResponseEntity<ApiResponse<TranslationResult>> translate(
            @Valid @RequestBody TranslateRequest request,
            @RequestHeader(value = ApiLoggingInterceptor.USER_ID_HEADER, required = false) String userId
    ) {
        TranslationResult result = slangTranslationService.translate(
            request.getText(), request.getSourceLanguage(), request.getTargetLanguage(), request.getRegion());

        if (userId != null) {
            int resultCount = Boolean.TRUE.equals(result.getUnknown()) ? 0 : 1;
            historyService.record(userId, ContentType.SLANG, request.getText(), resultCount);
        }
        return ResponseEntity.ok(ApiResponse.ok(result));
    }

    /**
     * 지역별 변형 조회
     * GET /api/translate/variations/{term}
     */
    @GetMapping("/variations/{term}")
    public ResponseEntity<ApiResponse<List<RegionalVariation>>> variations(@PathVariable String term) {
        return ResponseEntity.ok(ApiResponse.ok(slangTranslationService.regionalVariations(term)));
    }

    /**
     * 유사 용어 검색
     * GET /api/translate/search?q=
     */
    @GetMapping("/search")
    public ResponseEntity<ApiResponse<List<SlangTermResponse>>> search(
            @RequestParam("q") String query,
            @RequestHeader(value = ApiLoggingInterceptor.USER_ID_HEADER, required = false) String userId
    ) {
        List<SlangTermResponse> results = slangTranslationService.searchSimilar(query);
        if (userId != null) {
            historyService.record(userId, ContentType.SLANG, query, results.size());
        }
        return ResponseEntity.ok(ApiResponse.ok(results));
    }

    @PostMapping("/terms")
    public ResponseEntity<ApiResponse<SlangTermResponse>> addTerm(@Valid @RequestBody SlangTermRequest request) {
        SlangTermResponse created = slangTranslationService.add(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created, "Slang term added"));
    }

    @GetMapping("/terms/{id}")
    public ResponseEntity<ApiResponse<SlangTermResponse>> getTerm(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.ok(slangTranslationService.findById(id)));
    }

    @PutMapping("/terms/{id}")
    public ResponseEntity<ApiResponse<SlangTermResponse>> updateTerm(
            @PathVariable String id,
            @Valid @RequestBody SlangTermUpdateRequest request
    ) {
        return ResponseEntity.ok(ApiResponse.ok(slangTranslationService.update(id, request), "Slang term updated"));
    }

    @DeleteMapping("/terms/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteTerm(@PathVariable String id) {
        slangTranslationService.delete(id);
        return ResponseEntity.ok(ApiResponse.ok(null, "Slang term deleted"));
    }

    @GetMapping("/region/{region}")
    public ResponseEntity<ApiResponse<List<SlangTermResponse>>> byRegion(@PathVariable String region) {
        return ResponseEntity.ok(ApiResponse.ok(slangTranslationService.findByRegion(region)));
    }

    /**
     * 인기 용어
     * GET /api/translate/popular?limit=10
     */
    @GetMapping("/popular")
    public ResponseEntity<ApiResponse<List<SlangTermResponse>>> popular(
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit
    ) {
        return ResponseEntity.ok(ApiResponse.ok(slangTranslationService.popular(limit)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<SlangStatistics>> statistics() {
        return ResponseEntity.ok(ApiResponse.ok(slangTranslationService.statistics()));
    }
}
