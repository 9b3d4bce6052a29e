package com.courtcapture.capture.model;

import java.time.Instant;
import java.util.List;

public record ScheduleRunResult(
    long jobRunId,
    Long scheduleId,
    JobType jobType,
    RunOutcome outcome,
    Instant startedAt,
    Instant finishedAt,
    List<CredentialCaptureOutcome> credentials,
    List<String> errors,
    Instant nextExecution
) {}
