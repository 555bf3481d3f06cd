package com.localguide.interceptor;

import com.localguide.entity.ApiLog;
import com.localguide.service.ApiLogService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;
import org.springframework.web.util.WebUtils;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

/**
 * API 요청/응답 로깅 Interceptor
 */
@Component
public class ApiLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(ApiLoggingInterceptor.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    static final String START_TIME_ATTRIBUTE = "apiLog.startTime";

    @Autowired
    private ApiLogService apiLogService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTRIBUTE, System.currentTimeMillis());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        try {
            Long startTime = (Long) request.getAttribute(START_TIME_ATTRIBUTE);
            if (startTime == null) {
                return;
            }

            // 요청 객체는 비동기 스레드로 넘기지 않고 여기서 값만 복사
            ApiLog apiLog = ApiLog.builder()
                .method(request.getMethod())
                .endpoint(request.getRequestURI())
                .queryString(request.getQueryString())
                .userId(request.getHeader(USER_ID_HEADER))
                .ipAddress(getClientIpAddress(request))
                .userAgent(request.getHeader("User-Agent"))
                .requestBody(getRequestBody(request))
                .responseBody(getResponseBody(response))
                .statusCode(response.getStatus())
                .responseTimeMs(System.currentTimeMillis() - startTime)
                .errorMessage(ex != null ? ex.getMessage() : null)
                .createdAt(LocalDateTime.now())
                .build();

            apiLogService.save(apiLog);
        } catch (Exception e) {
            logger.error("[ApiLoggingInterceptor] afterCompletion - failed to build API log, uri: {}", request.getRequestURI(), e);
        }
    }

    private String getRequestBody(HttpServletRequest request) {
        ContentCachingRequestWrapper wrapper = WebUtils.getNativeRequest(request, ContentCachingRequestWrapper.class);
        if (wrapper == null) {
            return null;
        }
        byte[] content = wrapper.getContentAsByteArray();
        return content.length > 0 ? new String(content, StandardCharsets.UTF_8) : null;
    }

    private String getResponseBody(HttpServletResponse response) {
        ContentCachingResponseWrapper wrapper = WebUtils.getNativeResponse(response, ContentCachingResponseWrapper.class);
        if (wrapper == null) {
            return null;
        }
        byte[] content = wrapper.getContentAsByteArray();
        return content.length > 0 ? new String(content, StandardCharsets.UTF_8) : null;
    }

    /**
     * 클라이언트 IP 추출 (프록시 헤더 우선, X-Forwarded-For는 첫 번째 값)
     */
    static String getClientIpAddress(HttpServletRequest request) {
        String[] headers = {"X-Forwarded-For", "X-Real-IP", "Proxy-Client-IP", "WL-Proxy-Client-IP"};
        String ip = null;
        for (String header : headers) {
            ip = request.getHeader(header);
            if (ip != null && !ip.isEmpty() && !"unknown".equalsIgnoreCase(ip)) {
                break;
            }
            ip = null;
        }
        if (ip == null) {
            ip = request.getRemoteAddr();
        }
        if (ip != null && ip.contains(",")) {
            ip = ip.split(",")[0].trim();
        }
        return ip;
    }
}
