package com.courtcapture.capture.credentials;

import com.courtcapture.capture.model.CourtCombination;
import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.Degree;
import com.courtcapture.capture.support.DirectExecutorService;
import com.courtcapture.capture.support.MutableClock;
import com.courtcapture.config.CaptureProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.courtcapture.capture.credentials.CredentialCacheTest.credential;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialResolverTest {

    @Mock
    private CredentialStore store;

    private CredentialCache cache;
    private CredentialResolver resolver;

    @BeforeEach
    void setUp() {
        cache = new CredentialCache(store, new MutableClock(Instant.parse("2024-01-01T12:00:00Z")), new CaptureProperties());
        resolver = new CredentialResolver(store, cache, new DirectExecutorService());
    }

    @Test
    void resolveManyKeepsInputOrderAndReportsEachFailure() {
        when(store.findById(1L)).thenReturn(Optional.of(credential(1L, 7L, "TRT1", Degree.FIRST)));
        when(store.findById(2L)).thenReturn(Optional.empty());
        when(store.findById(3L)).thenThrow(new IllegalStateException("Unable to decrypt credential secret"));

        List<CredentialResolver.CredentialResolution> resolutions = resolver.resolveMany(List.of(3L, 1L, 2L));

        assertThat(resolutions).extracting(CredentialResolver.CredentialResolution::credentialId)
            .containsExactly(3L, 1L, 2L);
        assertThat(resolutions.get(0).error()).isEqualTo("Unable to decrypt credential secret");
        assertThat(resolutions.get(1).resolved()).isTrue();
        assertThat(resolutions.get(2).error()).isEqualTo("not found or inactive");
    }

    @Test
    void resolveAllPopulatesTheCache() {
        when(store.findById(1L)).thenReturn(Optional.of(credential(1L, 7L, "TRT1", Degree.FIRST)));
        when(store.findById(2L)).thenReturn(Optional.of(credential(2L, 7L, "TRT2", Degree.SECOND)));

        List<CredentialContext> contexts = resolver.resolveAll(7L, List.of(1L, 2L));

        assertThat(contexts).extracting(CredentialContext::credentialId).containsExactly(1L, 2L);
        assertThat(cache.lookup(7L, "TRT2", Degree.SECOND)).isPresent();
    }

    @Test
    void resolveAllFailsNamingMissingAndForeignCredentials() {
        when(store.findById(1L)).thenReturn(Optional.of(credential(1L, 7L, "TRT1", Degree.FIRST)));
        when(store.findById(2L)).thenReturn(Optional.empty());
        when(store.findById(3L)).thenReturn(Optional.of(credential(3L, 8L, "TRT1", Degree.FIRST)));

        CredentialResolutionException error = assertThrows(
            CredentialResolutionException.class,
            () -> resolver.resolveAll(7L, List.of(1L, 2L, 3L))
        );

        assertThat(error.getFailedCredentialIds()).containsExactly(2L, 3L);
        assertThat(error.getMessage())
            .isEqualTo("Credentials not resolved: 2 (not found or inactive), 3 (belongs to tenant 8)");
    }

    @Test
    void resolveForCourtsServesHitsFromCacheAndBatchesMisses() {
        cache.store(credential(1L, 7L, "TRT1", Degree.FIRST));
        when(store.findActiveBatch(eq(7L), anyCollection(), anyCollection()))
            .thenReturn(List.of(credential(2L, 7L, "TRT2", Degree.FIRST)));

        Map<CourtCombination, Optional<CredentialContext>> result = resolver.resolveForCourts(7L, List.of(
            new CourtCombination("TRT1", Degree.FIRST),
            new CourtCombination("TRT2", Degree.FIRST),
            new CourtCombination("TRT3", Degree.FIRST)
        ));

        verify(store, times(1)).findActiveBatch(eq(7L), anyCollection(), anyCollection());
        assertThat(result.get(new CourtCombination("TRT1", Degree.FIRST))).map(CredentialContext::credentialId).contains(1L);
        assertThat(result.get(new CourtCombination("TRT2", Degree.FIRST))).map(CredentialContext::credentialId).contains(2L);
        assertThat(result.get(new CourtCombination("TRT3", Degree.FIRST))).isEmpty();
    }
}
