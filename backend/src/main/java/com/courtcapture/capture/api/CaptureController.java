package com.courtcapture.capture.api;

import com.courtcapture.capture.court.CourtConfigProvider;
import com.courtcapture.capture.credentials.CredentialCache;
import com.courtcapture.capture.model.CacheStats;
import com.courtcapture.capture.model.CaptureRun;
import com.courtcapture.capture.model.CourtCombination;
import com.courtcapture.capture.model.Degree;
import com.courtcapture.capture.model.EvidenceEntry;
import com.courtcapture.capture.model.JobType;
import com.courtcapture.capture.model.ScheduleRunResult;
import com.courtcapture.capture.persistence.CaptureRunRepository;
import com.courtcapture.capture.persistence.EvidenceStore;
import com.courtcapture.capture.service.ScheduleExecutor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class CaptureController {
    private final ScheduleExecutor scheduleExecutor;
    private final CaptureRunRepository runRepository;
    private final EvidenceStore evidenceStore;
    private final CredentialCache credentialCache;
    private final CourtConfigProvider courtConfigProvider;

    public CaptureController(
        ScheduleExecutor scheduleExecutor,
        CaptureRunRepository runRepository,
        EvidenceStore evidenceStore,
        CredentialCache credentialCache,
        CourtConfigProvider courtConfigProvider
    ) {
        this.scheduleExecutor = scheduleExecutor;
        this.runRepository = runRepository;
        this.evidenceStore = evidenceStore;
        this.credentialCache = credentialCache;
        this.courtConfigProvider = courtConfigProvider;
    }

    @PostMapping("/schedules/{scheduleId}/execute")
    public ScheduleRunResult executeSchedule(
        @PathVariable long scheduleId,
        @RequestParam(name = "reschedule", required = false, defaultValue = "false") boolean reschedule
    ) {
        return scheduleExecutor.execute(scheduleId, reschedule);
    }

    @PostMapping("/captures")
    public ScheduleRunResult captureAdHoc(@RequestBody AdHocCaptureRequest request) {
        if (request == null || request.tenantId() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "tenantId is required");
        }
        if (request.jobType() == null || request.jobType().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "jobType is required");
        }
        if (request.courts() == null || request.courts().isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "courts must not be empty");
        }
        JobType jobType = JobType.fromCode(request.jobType());
        List<Degree> degrees = new ArrayList<>();
        if (request.degrees() == null || request.degrees().isEmpty()) {
            degrees.addAll(List.of(Degree.values()));
        } else {
            for (String degree : request.degrees()) {
                degrees.add(Degree.fromCode(degree));
            }
        }
        Set<CourtCombination> combinations = new LinkedHashSet<>();
        for (String court : request.courts()) {
            if (court == null || court.isBlank()) {
                throw new ResponseStatusException(BAD_REQUEST, "court codes must not be blank");
            }
            for (Degree degree : degrees) {
                combinations.add(new CourtCombination(court.trim(), degree));
            }
        }
        return scheduleExecutor.executeAdHoc(request.tenantId(), jobType, combinations, request.extraParams());
    }

    @GetMapping("/capture-runs")
    public List<CaptureRun> recentRuns(
        @RequestParam(name = "scheduleId", required = false) Long scheduleId,
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit
    ) {
        return runRepository.findRecentRuns(scheduleId, Math.min(200, limit));
    }

    @GetMapping("/capture-runs/{runId}")
    public CaptureRun run(@PathVariable long runId) {
        return runRepository.findRun(runId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Capture run " + runId + " not found"));
    }

    @GetMapping("/capture-runs/{runId}/evidence")
    public List<EvidenceEntry> evidence(@PathVariable long runId) {
        if (runRepository.findRun(runId).isEmpty()) {
            throw new ResponseStatusException(NOT_FOUND, "Capture run " + runId + " not found");
        }
        return evidenceStore.findByRun(runId);
    }

    @GetMapping("/credentials/cache")
    public CacheStats credentialCacheStats() {
        return credentialCache.stats();
    }

    @DeleteMapping("/credentials/cache")
    public Map<String, Object> clearCredentialCache() {
        int cleared = credentialCache.stats().total();
        credentialCache.clear();
        return Map.of("cleared", cleared);
    }

    @DeleteMapping("/court-configs/cache")
    public Map<String, Object> clearCourtConfigCache() {
        courtConfigProvider.clearCache();
        return Map.of("cleared", true);
    }
}
