package com.courtcapture.capture.service;

import com.courtcapture.capture.court.CourtConfigMissingException;
import com.courtcapture.capture.court.CourtConfigProvider;
import com.courtcapture.capture.credentials.CredentialResolutionException;
import com.courtcapture.capture.credentials.CredentialResolver;
import com.courtcapture.capture.dispatch.CaptureDispatcher;
import com.courtcapture.capture.model.CaptureErrorType;
import com.courtcapture.capture.model.CaptureJob;
import com.courtcapture.capture.model.CourtCombination;
import com.courtcapture.capture.model.CourtConfig;
import com.courtcapture.capture.model.CredentialCaptureOutcome;
import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.JobType;
import com.courtcapture.capture.model.PartsPayload;
import com.courtcapture.capture.model.PendingFilter;
import com.courtcapture.capture.model.RunOutcome;
import com.courtcapture.capture.model.Schedule;
import com.courtcapture.capture.model.ScheduleRunResult;
import com.courtcapture.capture.model.SubCaptureOutcome;
import com.courtcapture.capture.persistence.CaptureRunRepository;
import com.courtcapture.capture.persistence.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs capture jobs end to end: opens the run record, resolves credentials, captures each credential in turn,
 * records evidence for every attempt, finalizes the run and, for schedules, writes the execution timestamps.
 */
@Service
public class ScheduleExecutor {
    private static final Logger log = LoggerFactory.getLogger(ScheduleExecutor.class);

    /** Run id reported when the run record could not be opened; captures still run and evidence is still attempted. */
    public static final long UNRECORDED_RUN_ID = -1L;

    private final ScheduleStore scheduleStore;
    private final CredentialResolver credentialResolver;
    private final CourtConfigProvider courtConfigProvider;
    private final CaptureDispatcher dispatcher;
    private final RawCaptureLogger rawCaptureLogger;
    private final CaptureRunRepository runRepository;
    private final ExecutorService captureRunExecutor;
    private final Clock clock;
    private final Set<Long> runningSchedules = ConcurrentHashMap.newKeySet();

    public ScheduleExecutor(
        ScheduleStore scheduleStore,
        CredentialResolver credentialResolver,
        CourtConfigProvider courtConfigProvider,
        CaptureDispatcher dispatcher,
        RawCaptureLogger rawCaptureLogger,
        CaptureRunRepository runRepository,
        @Qualifier("captureRunExecutor") ExecutorService captureRunExecutor,
        Clock clock
    ) {
        this.scheduleStore = scheduleStore;
        this.credentialResolver = credentialResolver;
        this.courtConfigProvider = courtConfigProvider;
        this.dispatcher = dispatcher;
        this.rawCaptureLogger = rawCaptureLogger;
        this.runRepository = runRepository;
        this.captureRunExecutor = captureRunExecutor;
        this.clock = clock;
    }

    public ScheduleRunResult execute(long scheduleId, boolean reschedule) {
        return await(executeAsync(scheduleId, reschedule));
    }

    /**
     * Starts a run of the schedule on the run pool.
     *
     * @throws ScheduleNotFoundException if the schedule does not exist
     * @throws ActiveScheduleRunException if the schedule is already running in this process
     */
    public CompletableFuture<ScheduleRunResult> executeAsync(long scheduleId, boolean reschedule) {
        Schedule schedule = scheduleStore.read(scheduleId)
            .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        if (!runningSchedules.add(scheduleId)) {
            throw new ActiveScheduleRunException(scheduleId);
        }
        CompletableFuture<ScheduleRunResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> runSchedule(schedule, reschedule), captureRunExecutor);
        } catch (RejectedExecutionException e) {
            runningSchedules.remove(scheduleId);
            throw e;
        }
        return future.whenComplete((result, error) -> runningSchedules.remove(scheduleId));
    }

    public boolean isRunning(long scheduleId) {
        return runningSchedules.contains(scheduleId);
    }

    /**
     * One-off capture for a tenant's (court, degree) combinations, without a schedule. Combinations with no
     * active credential count as failures of the run; if none resolves, the run fails as a whole.
     */
    public ScheduleRunResult executeAdHoc(
        long tenantId,
        JobType jobType,
        Collection<CourtCombination> combinations,
        Map<String, Object> extraParams
    ) {
        CaptureJob job = new CaptureJob(null, jobType, tenantId, List.of(), extraParams);
        return await(CompletableFuture.supplyAsync(
            () -> runJob(job, () -> resolveCombinations(tenantId, combinations)),
            captureRunExecutor
        ));
    }

    private ScheduleRunResult runSchedule(Schedule schedule, boolean reschedule) {
        ScheduleRunResult result;
        try {
            result = runJob(
                schedule.toJob(),
                () -> new ResolvedCredentials(
                    credentialResolver.resolveAll(schedule.tenantId(), schedule.credentialIds()),
                    List.of()
                )
            );
        } catch (RuntimeException e) {
            updateExecutionTimes(schedule, reschedule);
            throw e;
        }
        Instant nextExecution = updateExecutionTimes(schedule, reschedule);
        return new ScheduleRunResult(
            result.jobRunId(),
            result.scheduleId(),
            result.jobType(),
            result.outcome(),
            result.startedAt(),
            result.finishedAt(),
            result.credentials(),
            result.errors(),
            nextExecution
        );
    }

    private ScheduleRunResult runJob(CaptureJob job, Supplier<ResolvedCredentials> credentialSource) {
        Instant startedAt = clock.instant();
        long runId = openRun(job, startedAt);
        log.info(
            "Capture run {} started job={} tenant={} schedule={}",
            runId,
            job.jobType().code(),
            job.tenantId(),
            job.scheduleId()
        );
        try {
            ResolvedCredentials resolved;
            try {
                resolved = credentialSource.get();
            } catch (CredentialResolutionException e) {
                log.warn("Capture run {} could not resolve credentials: {}", runId, e.getMessage());
                return finish(runId, job, startedAt, List.of(), List.of(e.getMessage()));
            }

            List<Long> credentialIds = job.credentialIds().isEmpty()
                ? resolved.credentials().stream().map(CredentialContext::credentialId).toList()
                : job.credentialIds();
            List<CredentialCaptureOutcome> outcomes = new ArrayList<>();
            for (CredentialContext credential : resolved.credentials()) {
                outcomes.add(captureForCredential(runId, job, credentialIds, credential));
            }
            return finish(runId, job, startedAt, outcomes, resolved.unresolved());
        } catch (RuntimeException e) {
            log.error("Capture run {} failed unexpectedly", runId, e);
            closeRun(runId, clock.instant(), RunOutcome.TOTAL_FAILURE.runStatus(),
                "capture_run_failed: " + describe(e), null);
            throw e;
        }
    }

    private long openRun(CaptureJob job, Instant startedAt) {
        try {
            return runRepository.insertRun(
                job.jobType(),
                job.tenantId(),
                job.credentialIds(),
                job.scheduleId(),
                startedAt
            );
        } catch (RuntimeException e) {
            log.error(
                "Failed to open capture run for job={} tenant={} schedule={}, continuing unrecorded",
                job.jobType().code(),
                job.tenantId(),
                job.scheduleId(),
                e
            );
            return UNRECORDED_RUN_ID;
        }
    }

    private void closeRun(long runId, Instant finishedAt, String status, String error, Object summary) {
        if (runId == UNRECORDED_RUN_ID) {
            return;
        }
        try {
            runRepository.completeRun(runId, finishedAt, status, error, summary);
        } catch (RuntimeException e) {
            log.error("Failed to close capture run {} as {}", runId, status, e);
        }
    }

    private CredentialCaptureOutcome captureForCredential(
        long runId,
        CaptureJob job,
        List<Long> credentialIds,
        CredentialContext credential
    ) {
        Optional<CourtConfig> courtConfig;
        String configError = null;
        try {
            courtConfig = courtConfigProvider.lookup(credential.court(), credential.degree());
        } catch (RuntimeException e) {
            log.warn("Court config lookup failed for {} {}", credential.court(), credential.degree().code(), e);
            courtConfig = Optional.empty();
            configError = new CourtConfigMissingException(credential.court(), credential.degree(), e).getMessage();
        }
        if (courtConfig.isEmpty()) {
            String message = configError != null
                ? configError
                : new CourtConfigMissingException(credential.court(), credential.degree()).getMessage();
            rawCaptureLogger.logFailure(
                runId,
                job,
                credentialIds,
                credential,
                describeRequest(job, credential, null),
                message,
                CaptureErrorType.COURT_CONFIG_MISSING
            );
            return new CredentialCaptureOutcome(
                credential.credentialId(),
                credential.court(),
                credential.degree(),
                message,
                List.of()
            );
        }

        List<SubCaptureOutcome> captures;
        try {
            captures = dispatcher.dispatch(job.jobType(), credential, courtConfig.get(), job.extraParams());
        } catch (RuntimeException e) {
            log.warn(
                "Capture {} failed for credential {} ({} {}): {}",
                job.jobType().code(),
                credential.credentialId(),
                credential.court(),
                credential.degree().code(),
                describe(e)
            );
            captures = List.of(SubCaptureOutcome.failure(null, describe(e)));
        }

        for (SubCaptureOutcome capture : captures) {
            Map<String, Object> request = describeRequest(job, credential, capture.filter());
            if (!capture.succeeded()) {
                rawCaptureLogger.logFailure(
                    runId,
                    job,
                    credentialIds,
                    credential,
                    request,
                    capture.error(),
                    CaptureErrorType.CAPTURE_EXECUTION
                );
                continue;
            }
            rawCaptureLogger.logSuccess(runId, job, credentialIds, credential, request, capture.result());
            for (PartsPayload parts : capture.result().partsPayloads()) {
                rawCaptureLogger.logParts(runId, job, credentialIds, credential, parts);
            }
        }
        return new CredentialCaptureOutcome(
            credential.credentialId(),
            credential.court(),
            credential.degree(),
            null,
            captures
        );
    }

    private ScheduleRunResult finish(
        long runId,
        CaptureJob job,
        Instant startedAt,
        List<CredentialCaptureOutcome> outcomes,
        List<String> unresolved
    ) {
        int succeeded = 0;
        int failed = unresolved.size();
        List<String> errors = new ArrayList<>(unresolved);
        for (CredentialCaptureOutcome outcome : outcomes) {
            succeeded += outcome.succeededCount();
            failed += outcome.failedCount();
            errors.addAll(outcome.errorMessages());
        }
        RunOutcome runOutcome = RunOutcome.aggregate(succeeded, failed);
        Instant finishedAt = clock.instant();
        closeRun(
            runId,
            finishedAt,
            runOutcome.runStatus(),
            errors.isEmpty() ? null : String.join("; ", errors),
            summarize(job, outcomes, succeeded, failed)
        );
        log.info(
            "Capture run {} finished outcome={} succeeded={} failed={}",
            runId,
            runOutcome,
            succeeded,
            failed
        );
        return new ScheduleRunResult(
            runId,
            job.scheduleId(),
            job.jobType(),
            runOutcome,
            startedAt,
            finishedAt,
            outcomes,
            errors,
            null
        );
    }

    private Instant updateExecutionTimes(Schedule schedule, boolean reschedule) {
        Instant now = clock.instant();
        try {
            Instant nextExecution = reschedule
                ? schedule.recurrence().nextExecutionAfter(now.atZone(clock.getZone())).toInstant()
                : null;
            scheduleStore.update(schedule.id(), now, nextExecution);
            return nextExecution;
        } catch (RuntimeException e) {
            log.error(
                "Failed to update execution times for schedule {} (reschedule={})",
                schedule.id(),
                reschedule,
                e
            );
            return null;
        }
    }

    private ResolvedCredentials resolveCombinations(long tenantId, Collection<CourtCombination> combinations) {
        Map<CourtCombination, Optional<CredentialContext>> found =
            credentialResolver.resolveForCourts(tenantId, combinations);
        List<CredentialContext> credentials = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        for (Map.Entry<CourtCombination, Optional<CredentialContext>> entry : found.entrySet()) {
            if (entry.getValue().isPresent()) {
                credentials.add(entry.getValue().get());
            } else {
                unresolved.add(entry.getKey().court() + " " + entry.getKey().degree().code()
                    + ": no active credential");
            }
        }
        if (credentials.isEmpty()) {
            throw new CredentialResolutionException(
                "No active credentials for tenant " + tenantId + ": " + found.keySet(),
                List.of()
            );
        }
        return new ResolvedCredentials(credentials, unresolved);
    }

    private static Map<String, Object> summarize(
        CaptureJob job,
        List<CredentialCaptureOutcome> outcomes,
        int succeeded,
        int failed
    ) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("credentialsProcessed", outcomes.size());
        summary.put("succeeded", succeeded);
        summary.put("failed", failed);
        if (job.jobType() == JobType.PENDING_FILINGS) {
            List<PendingFilter> filters = outcomes.stream()
                .flatMap(outcome -> outcome.captures().stream())
                .map(SubCaptureOutcome::filter)
                .filter(Objects::nonNull)
                .toList();
            if (!filters.isEmpty()) {
                summary.put("pendingFilters", PendingFilter.canonical(filters).stream().map(PendingFilter::code).toList());
            }
        }
        List<Map<String, Object>> credentials = new ArrayList<>();
        for (CredentialCaptureOutcome outcome : outcomes) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("credentialId", outcome.credentialId());
            entry.put("court", outcome.court());
            entry.put("degree", outcome.degree().code());
            entry.put("succeeded", outcome.succeededCount());
            entry.put("failed", outcome.failedCount());
            credentials.add(entry);
        }
        summary.put("credentials", credentials);
        return summary;
    }

    private static Map<String, Object> describeRequest(CaptureJob job, CredentialContext credential, PendingFilter filter) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jobType", job.jobType().code());
        request.put("credentialId", credential.credentialId());
        request.put("court", credential.court());
        request.put("degree", credential.degree().code());
        if (filter != null) {
            request.put("pendingFilter", filter.code());
        }
        if (!job.extraParams().isEmpty()) {
            request.put("params", job.extraParams());
        }
        return request;
    }

    private static ScheduleRunResult await(CompletableFuture<ScheduleRunResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private record ResolvedCredentials(List<CredentialContext> credentials, List<String> unresolved) {}
}
