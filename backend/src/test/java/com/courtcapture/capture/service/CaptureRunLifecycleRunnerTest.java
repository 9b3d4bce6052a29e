package com.courtcapture.capture.service;

import com.courtcapture.capture.model.CaptureRun;
import com.courtcapture.capture.persistence.CaptureRunRepository;
import com.courtcapture.config.CaptureProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CaptureRunLifecycleRunnerTest {
    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Mock
    private CaptureRunRepository repository;

    @Test
    void staleInProgressRunsAreClosedAsFailed() {
        CaptureProperties properties = new CaptureProperties();
        properties.getRuns().setStaleRunMinutes(60);
        when(repository.isDbReachable()).thenReturn(true);
        when(repository.findRunsInProgressStartedBefore(Instant.parse("2024-01-01T11:00:00Z"))).thenReturn(List.of(
            new CaptureRun(3L, "full-docket", 7L, List.of(1L), 5L, "IN_PROGRESS", NOW.minusSeconds(7200), null, null, null)
        ));

        int aborted = runner(properties).abortStaleRuns();

        assertThat(aborted).isEqualTo(1);
        verify(repository).completeRun(3L, NOW, "FAILED", "aborted_on_startup", null);
    }

    @Test
    void unreachableDatabaseSkipsCleanup() {
        when(repository.isDbReachable()).thenThrow(new IllegalStateException("connection refused"));

        assertThat(runner(new CaptureProperties()).abortStaleRuns()).isZero();
        verify(repository, never()).completeRun(anyLong(), any(), any(), any(), any());
    }

    private CaptureRunLifecycleRunner runner(CaptureProperties properties) {
        return new CaptureRunLifecycleRunner(repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
