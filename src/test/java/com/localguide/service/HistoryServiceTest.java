package com.localguide.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localguide.config.GuideProperties;
import com.localguide.dto.response.HistoryEntry;
import com.localguide.model.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HistoryServiceTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_792_000_000_000L), ZoneOffset.UTC);

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ListOperations<String, Object> listOperations;

    private HistoryService historyService;

    @BeforeEach
    void setUp() {
        historyService = new HistoryService(redisTemplate, new ObjectMapper(), new GuideProperties(), clock);
    }

    @Test
    void recordPushesTrimsAndExpires() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);

        historyService.record("u-1", ContentType.SLANG, "jugaad", 1);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(listOperations).leftPush(eq("history:u-1"), captor.capture());
        HistoryEntry entry = (HistoryEntry) captor.getValue();
        assertThat(entry.getQuery()).isEqualTo("jugaad");
        assertThat(entry.getTimestamp()).isEqualTo(1_792_000_000_000L);
        verify(listOperations).trim("history:u-1", 0, 49);
        verify(redisTemplate).expire("history:u-1", Duration.ofDays(30));
    }

    @Test
    void blankUserIsIgnored() {
        historyService.record(" ", ContentType.FOOD, "dosa", 3);

        verifyNoInteractions(redisTemplate);
    }

    @Test
    void redisFailureDoesNotBreakCaller() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.leftPush(eq("history:u-1"), any()))
            .thenThrow(new RedisConnectionFailureException("redis down"));

        assertThatCode(() -> historyService.record("u-1", ContentType.FOOD, "dosa", 3)).doesNotThrowAnyException();
        verify(redisTemplate, never()).expire(any(), any(Duration.class));
    }

    @Test
    void historyConvertsStoredMaps() {
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("userId", "u-1");
        stored.put("type", "cultural");
        stored.put("query", "diwali");
        stored.put("resultCount", 1);
        stored.put("timestamp", 1_792_000_000_000L);
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.range("history:u-1", 0, 9)).thenReturn(List.of(stored));

        List<HistoryEntry> entries = historyService.history("u-1", 10);

        assertThat(entries).singleElement().satisfies(e -> {
            assertThat(e.getType()).isEqualTo(ContentType.CULTURAL);
            assertThat(e.getQuery()).isEqualTo("diwali");
        });
    }

    @Test
    void historyLimitIsClampedToMaxEntries() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.range("history:u-1", 0, 49)).thenReturn(null);

        assertThat(historyService.history("u-1", 500)).isEmpty();
    }
}
