package com.localguide.interceptor;

import com.localguide.entity.ApiLog;
import com.localguide.service.ApiLogService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ApiLoggingInterceptorTest {

    @Mock
    private ApiLogService apiLogService;

    @InjectMocks
    private ApiLoggingInterceptor interceptor;

    @Test
    void forwardedForUsesFirstAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        request.setRemoteAddr("10.0.0.1");

        assertThat(ApiLoggingInterceptor.getClientIpAddress(request)).isEqualTo("203.0.113.7");
    }

    @Test
    void unknownProxyHeaderFallsBackToRemoteAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Real-IP", "unknown");
        request.setRemoteAddr("192.168.0.5");

        assertThat(ApiLoggingInterceptor.getClientIpAddress(request)).isEqualTo("192.168.0.5");
    }

    @Test
    void completedRequestIsHandedToLogService() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/culture/search");
        request.setQueryString("q=holi");
        request.addHeader(ApiLoggingInterceptor.USER_ID_HEADER, "u-9");
        MockHttpServletResponse response = new MockHttpServletResponse();
        response.setStatus(200);

        interceptor.preHandle(request, response, new Object());
        interceptor.afterCompletion(request, response, new Object(), null);

        ArgumentCaptor<ApiLog> captor = ArgumentCaptor.forClass(ApiLog.class);
        verify(apiLogService).save(captor.capture());
        ApiLog apiLog = captor.getValue();
        assertThat(apiLog.getEndpoint()).isEqualTo("/api/culture/search");
        assertThat(apiLog.getQueryString()).isEqualTo("q=holi");
        assertThat(apiLog.getUserId()).isEqualTo("u-9");
        assertThat(apiLog.getStatusCode()).isEqualTo(200);
        assertThat(apiLog.getResponseTimeMs()).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void requestWithoutStartTimeIsNotLogged() {
        interceptor.afterCompletion(new MockHttpServletRequest(), new MockHttpServletResponse(), new Object(), null);

        verifyNoInteractions(apiLogService);
    }
}
