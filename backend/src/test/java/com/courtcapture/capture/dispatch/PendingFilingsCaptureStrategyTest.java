package com.courtcapture.capture.dispatch;

import com.courtcapture.capture.model.CaptureRequest;
import com.courtcapture.capture.model.CaptureResult;
import com.courtcapture.capture.model.CourtConfig;
import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.Degree;
import com.courtcapture.capture.model.JobType;
import com.courtcapture.capture.model.PendingFilter;
import com.courtcapture.capture.model.SubCaptureOutcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PendingFilingsCaptureStrategyTest {
    private static final CredentialContext CREDENTIAL =
        new CredentialContext(11L, 7L, "TRT3", Degree.FIRST, "12345678901", "secret");
    private static final CourtConfig CONFIG =
        new CourtConfig("TRT3", Degree.FIRST, "TRT 3", "https://pje.trt3.jus.br", null, null, Map.of());

    @Test
    void duplicateFiltersRunOnceInCanonicalOrder() {
        List<String> seen = new ArrayList<>();
        CaptureExecutor executor = recording(seen, null);

        List<SubCaptureOutcome> outcomes = new PendingFilingsCaptureStrategy(executor).run(
            CREDENTIAL,
            CONFIG,
            Map.of("pendingFilters", List.of("within-deadline", "no-deadline", "within-deadline"))
        );

        assertThat(seen).containsExactly("no-deadline", "within-deadline");
        assertThat(outcomes).extracting(SubCaptureOutcome::filter)
            .containsExactly(PendingFilter.NO_DEADLINE, PendingFilter.WITHIN_DEADLINE);
        assertThat(outcomes).allMatch(SubCaptureOutcome::succeeded);
    }

    @Test
    void singleFilterAndDefault() {
        assertThat(PendingFilingsCaptureStrategy.resolveFilters(Map.of("pendingFilter", "within-deadline")))
            .containsExactly(PendingFilter.WITHIN_DEADLINE);
        assertThat(PendingFilingsCaptureStrategy.resolveFilters(Map.of()))
            .containsExactly(PendingFilter.NO_DEADLINE);
        assertThat(PendingFilingsCaptureStrategy.resolveFilters(Map.of("pendingFilters", List.of())))
            .containsExactly(PendingFilter.NO_DEADLINE);
    }

    @Test
    void failingFilterDoesNotStopTheNextOne() {
        List<String> seen = new ArrayList<>();
        CaptureExecutor executor = recording(seen, "no-deadline");

        List<SubCaptureOutcome> outcomes = new PendingFilingsCaptureStrategy(executor).run(
            CREDENTIAL,
            CONFIG,
            Map.of("pendingFilters", List.of("no-deadline", "within-deadline"))
        );

        assertThat(seen).containsExactly("no-deadline", "within-deadline");
        assertThat(outcomes.get(0).succeeded()).isFalse();
        assertThat(outcomes.get(0).error()).isEqualTo("portal timeout");
        assertThat(outcomes.get(1).succeeded()).isTrue();
    }

    @Test
    void unknownFilterIsACaptureError() {
        assertThrows(
            CaptureExecutionException.class,
            () -> PendingFilingsCaptureStrategy.resolveFilters(Map.of("pendingFilter", "overdue"))
        );
    }

    private static CaptureExecutor recording(List<String> seen, String failingFilter) {
        return new CaptureExecutor() {
            @Override
            public boolean supports(JobType jobType) {
                return true;
            }

            @Override
            public CaptureResult capture(CaptureRequest request) {
                String filter = String.valueOf(request.params().get("pendingFilter"));
                seen.add(filter);
                assertThat(request.params()).containsEntry("captureDocuments", true);
                if (filter.equals(failingFilter)) {
                    throw new CaptureExecutionException("portal timeout");
                }
                return new CaptureResult(null, null, null, List.of(), List.of());
            }
        };
    }
}
