package com.localguide.controller;

import com.localguide.dto.response.ApiResponse;
import com.localguide.dto.response.CulturalRegionGroup;
import com.localguide.dto.response.CulturalSearchResult;
import com.localguide.interceptor.ApiLoggingInterceptor;
import com.localguide.model.ContentType;
import com.localguide.model.cultural.BargainingTip;
import com.localguide.model.cultural.EtiquetteRule;
import com.localguide.model.cultural.Festival;
import com.localguide.model.cultural.RegionalInfo;
import com.localguide.service.CulturalService;
import com.localguide.service.HistoryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 지역 문화 정보 REST API 컨트롤러 (읽기 전용)
 */
@RestController
@RequestMapping("/api/culture")
@CrossOrigin(origins = {"https://localguide.vercel.app", "http://localhost:3000"})
public class CulturalController {

    @Autowired
    private CulturalService culturalService;

    @Autowired
    private HistoryService historyService;

    @GetMapping("/region/{region}")
    public ResponseEntity<ApiResponse<RegionalInfo>> region(@PathVariable String region) {
        return ResponseEntity.ok(ApiResponse.ok(culturalService.regionalInfo(region)));
    }

    @GetMapping("/festival/{name}")
    public ResponseEntity<ApiResponse<Festival>> festival(@PathVariable String name) {
        return ResponseEntity.ok(ApiResponse.ok(culturalService.festival(name)));
    }

    @GetMapping("/etiquette/{context}")
    public ResponseEntity<ApiResponse<List<EtiquetteRule>>> etiquette(@PathVariable String context) {
        return ResponseEntity.ok(ApiResponse.ok(culturalService.etiquette(context)));
    }

    /**
     * 흥정 팁
     * GET /api/culture/bargaining?city=&state=
     * 도시 -> 주 -> 일반 순으로 대체
     */
    @GetMapping("/bargaining")
    public ResponseEntity<ApiResponse<List<BargainingTip>>> bargaining(
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String state
    ) {
        return ResponseEntity.ok(ApiResponse.ok(culturalService.bargainingTips(city, state)));
    }

    /**
     * 문화 콘텐츠 검색
     * GET /api/culture/search?q=&region=
     */
    @GetMapping("/search")
    public ResponseEntity<ApiResponse<List<CulturalSearchResult>>> search(
            @RequestParam("q") String query,
            @RequestParam(required = false) String region,
            @RequestHeader(value = ApiLoggingInterceptor.USER_ID_HEADER, required = false) String userId
    ) {
        List<CulturalSearchResult> results = culturalService.search(query, region);
        if (userId != null) {
            historyService.record(userId, ContentType.CULTURAL, query, results.size());
        }
        return ResponseEntity.ok(ApiResponse.ok(results));
    }

    @GetMapping("/search/grouped")
    public ResponseEntity<ApiResponse<List<CulturalRegionGroup>>> searchGrouped(@RequestParam("q") String query) {
        return ResponseEntity.ok(ApiResponse.ok(culturalService.searchGroupedByRegion(query)));
    }
}
