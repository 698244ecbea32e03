/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.forecastcache.api.types.ForecastErrorKind;
import villagecompute.forecastcache.api.types.ForecastErrorType;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.api.types.RefreshResultType;
import villagecompute.forecastcache.api.types.ServedFrom;
import villagecompute.forecastcache.services.ForecastCacheService;
import villagecompute.forecastcache.services.UpsertStore;

/**
 * Unit tests for {@link ForecastRefreshJobHandler}.
 */
class ForecastRefreshJobHandlerTest {

    private static final ForecastIdentityType SEOUL = new ForecastIdentityType(null, 37.5665, 126.978);
    private static final ForecastIdentityType BUSAN = new ForecastIdentityType("owner-1", 35.1796, 129.0756);

    @Mock
    ForecastCacheService forecastCacheService;

    @Mock
    UpsertStore upsertStore;

    @Mock
    Tracer tracer;

    @InjectMocks
    ForecastRefreshJobHandler handler;

    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        meterRegistry = new SimpleMeterRegistry();
        handler.meterRegistry = meterRegistry;
        handler.clock = Clock.fixed(Instant.parse("2025-03-10T08:20:00Z"), ZoneOffset.UTC);

        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));
    }

    @Test
    void testHandlesType() {
        assertEquals(JobType.FORECAST_REFRESH, handler.handlesType());
    }

    @Test
    void testExecute_refreshesEveryTrackedIdentity() throws Exception {
        when(upsertStore.trackedIdentities()).thenReturn(List.of(SEOUL, BUSAN));
        when(forecastCacheService.refreshNow(any(), any(), any()))
                .thenReturn(new RefreshResultType(24, 0, ServedFrom.FRESH, null));

        handler.execute(1L, Map.of());

        ArgumentCaptor<ForecastWindowType> window = ArgumentCaptor.forClass(ForecastWindowType.class);
        verify(forecastCacheService).refreshNow(eq(SEOUL), window.capture(), eq(Granularity.HOURLY));
        verify(forecastCacheService).refreshNow(eq(BUSAN), any(), eq(Granularity.HOURLY));
        assertEquals(Instant.parse("2025-03-10T08:00:00Z"), window.getValue().from());
        assertEquals(ForecastRefreshJobHandler.DEFAULT_HOURS, window.getValue().expectedHours());
        assertEquals(2.0, meterRegistry.counter("forecast.refresh_job.total", "status", "success").count());
    }

    @Test
    void testExecute_payloadOverridesHoursAndGranularity() throws Exception {
        when(upsertStore.trackedIdentities()).thenReturn(List.of(SEOUL));
        when(forecastCacheService.refreshNow(any(), any(), any()))
                .thenReturn(new RefreshResultType(48, 0, ServedFrom.FRESH, null));

        handler.execute(2L, Map.of("hours", "48", "granularity", "daily"));

        ArgumentCaptor<ForecastWindowType> window = ArgumentCaptor.forClass(ForecastWindowType.class);
        verify(forecastCacheService).refreshNow(eq(SEOUL), window.capture(), eq(Granularity.DAILY));
        assertEquals(48, window.getValue().expectedHours());
    }

    @Test
    void testExecute_failingIdentityDoesNotAbortBatch() throws Exception {
        when(upsertStore.trackedIdentities()).thenReturn(List.of(SEOUL, BUSAN));
        when(forecastCacheService.refreshNow(eq(SEOUL), any(), any())).thenThrow(new IllegalStateException("boom"));
        when(forecastCacheService.refreshNow(eq(BUSAN), any(), any())).thenReturn(new RefreshResultType(6, 0,
                ServedFrom.STALE, ForecastErrorType.of(ForecastErrorKind.RATE_LIMITED, "quota")));

        handler.execute(3L, Map.of());

        verify(forecastCacheService, times(2)).refreshNow(any(), any(), any());
        assertEquals(2.0, meterRegistry.counter("forecast.refresh_job.total", "status", "failure").count());
    }

    @Test
    void testExecute_noIdentitiesIsNoop() throws Exception {
        when(upsertStore.trackedIdentities()).thenReturn(List.of());

        handler.execute(4L, Map.of());

        verify(forecastCacheService, never()).refreshNow(any(), any(), any());
    }
}
