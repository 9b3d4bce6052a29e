package com.courtcapture.capture.service;

import com.courtcapture.capture.model.CaptureRun;
import com.courtcapture.capture.model.RunOutcome;
import com.courtcapture.capture.persistence.CaptureRunRepository;
import com.courtcapture.config.CaptureProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Closes runs a previous process left IN_PROGRESS past the stale window.
 */
@Component
public class CaptureRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CaptureRunLifecycleRunner.class);

    static final String ABORTED_ON_STARTUP = "aborted_on_startup";

    private final CaptureRunRepository repository;
    private final CaptureProperties properties;
    private final Clock clock;

    public CaptureRunLifecycleRunner(CaptureRunRepository repository, CaptureProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        abortStaleRuns();
    }

    int abortStaleRuns() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (RuntimeException e) {
            log.debug("Database reachability check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping capture run cleanup because database is unreachable");
            return 0;
        }

        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getRuns().getStaleRunMinutes()));
        List<CaptureRun> stale = repository.findRunsInProgressStartedBefore(cutoff);
        for (CaptureRun run : stale) {
            repository.completeRun(run.id(), now, RunOutcome.TOTAL_FAILURE.runStatus(), ABORTED_ON_STARTUP, null);
            log.info("Aborted stale capture run {} startedAt={}", run.id(), run.startedAt());
        }
        return stale.size();
    }
}
