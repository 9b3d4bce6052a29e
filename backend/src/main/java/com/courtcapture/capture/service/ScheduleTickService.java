package com.courtcapture.capture.service;

import com.courtcapture.capture.model.Schedule;
import com.courtcapture.capture.persistence.ScheduleStore;
import com.courtcapture.config.CaptureProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class ScheduleTickService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleTickService.class);

    private final ScheduleStore scheduleStore;
    private final ScheduleExecutor scheduleExecutor;
    private final CaptureProperties properties;
    private final Clock clock;

    public ScheduleTickService(
        ScheduleStore scheduleStore,
        ScheduleExecutor scheduleExecutor,
        CaptureProperties properties,
        Clock clock
    ) {
        this.scheduleStore = scheduleStore;
        this.scheduleExecutor = scheduleExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(
        fixedDelayString = "${capture.scheduler.poll-interval-ms:60000}",
        initialDelayString = "${capture.scheduler.poll-interval-ms:60000}"
    )
    public void scheduledTick() {
        if (!properties.getScheduler().isEnabled()) {
            return;
        }
        tick();
    }

    /**
     * Submits every due schedule that is not already running, with rescheduling. Returns how many were started.
     */
    public int tick() {
        List<Schedule> due;
        try {
            due = scheduleStore.findDue(clock.instant(), properties.getScheduler().getBatchSize());
        } catch (RuntimeException e) {
            log.warn("Skipping schedule tick, due schedules could not be read", e);
            return 0;
        }
        int started = 0;
        for (Schedule schedule : due) {
            long scheduleId = schedule.id();
            if (scheduleExecutor.isRunning(scheduleId)) {
                log.debug("Schedule {} still running, skipped this tick", scheduleId);
                continue;
            }
            try {
                scheduleExecutor.executeAsync(scheduleId, true).whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Scheduled capture {} failed", scheduleId, error);
                    } else {
                        log.info(
                            "Scheduled capture {} run={} outcome={} next={}",
                            scheduleId,
                            result.jobRunId(),
                            result.outcome(),
                            result.nextExecution()
                        );
                    }
                });
                started++;
            } catch (ActiveScheduleRunException | ScheduleNotFoundException e) {
                log.debug("Schedule {} not started: {}", scheduleId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to submit schedule {}", scheduleId, e);
            }
        }
        if (started > 0) {
            log.info("Schedule tick started {} of {} due schedules", started, due.size());
        }
        return started;
    }
}
