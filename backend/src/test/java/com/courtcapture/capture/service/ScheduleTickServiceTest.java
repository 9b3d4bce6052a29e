package com.courtcapture.capture.service;

import com.courtcapture.capture.model.JobType;
import com.courtcapture.capture.model.Periodicity;
import com.courtcapture.capture.model.Recurrence;
import com.courtcapture.capture.model.RunOutcome;
import com.courtcapture.capture.model.Schedule;
import com.courtcapture.capture.model.ScheduleRunResult;
import com.courtcapture.capture.persistence.ScheduleStore;
import com.courtcapture.config.CaptureProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleTickServiceTest {
    private static final Instant NOW = Instant.parse("2024-01-01T09:00:00Z");

    @Mock
    private ScheduleStore scheduleStore;
    @Mock
    private ScheduleExecutor scheduleExecutor;

    @Test
    void startsDueSchedulesWithReschedulingAndSkipsRunningOnes() {
        CaptureProperties properties = new CaptureProperties();
        properties.getScheduler().setBatchSize(5);
        when(scheduleStore.findDue(NOW, 5)).thenReturn(List.of(schedule(1L), schedule(2L), schedule(3L)));
        when(scheduleExecutor.isRunning(1L)).thenReturn(false);
        when(scheduleExecutor.isRunning(2L)).thenReturn(true);
        when(scheduleExecutor.isRunning(3L)).thenReturn(false);
        when(scheduleExecutor.executeAsync(1L, true)).thenReturn(CompletableFuture.completedFuture(result(1L)));
        when(scheduleExecutor.executeAsync(3L, true)).thenThrow(new ActiveScheduleRunException(3L));

        int started = service(properties).tick();

        assertThat(started).isEqualTo(1);
        verify(scheduleExecutor, never()).executeAsync(2L, true);
    }

    @Test
    void disabledSchedulerDoesNotPoll() {
        CaptureProperties properties = new CaptureProperties();
        properties.getScheduler().setEnabled(false);

        service(properties).scheduledTick();

        verify(scheduleStore, never()).findDue(any(), anyInt());
        verify(scheduleExecutor, never()).executeAsync(anyLong(), anyBoolean());
    }

    @Test
    void unreadableScheduleTableSkipsTheTick() {
        when(scheduleStore.findDue(any(), anyInt())).thenThrow(new IllegalStateException("db down"));

        assertThat(service(new CaptureProperties()).tick()).isZero();
    }

    private ScheduleTickService service(CaptureProperties properties) {
        return new ScheduleTickService(scheduleStore, scheduleExecutor, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Schedule schedule(long id) {
        return new Schedule(
            id,
            JobType.FULL_DOCKET,
            7L,
            List.of(1L),
            new Recurrence(Periodicity.DAILY, null, LocalTime.of(8, 0)),
            null,
            NOW.minusSeconds(3600),
            Map.of(),
            true
        );
    }

    private static ScheduleRunResult result(long scheduleId) {
        return new ScheduleRunResult(
            10L,
            scheduleId,
            JobType.FULL_DOCKET,
            RunOutcome.SUCCESS,
            NOW,
            NOW,
            List.of(),
            List.of(),
            NOW.plusSeconds(82800)
        );
    }
}
