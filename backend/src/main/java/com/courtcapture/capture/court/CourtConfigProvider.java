package com.courtcapture.capture.court;

import com.courtcapture.capture.model.CourtConfig;
import com.courtcapture.capture.model.Degree;

import java.util.Optional;

public interface CourtConfigProvider {

    Optional<CourtConfig> lookup(String court, Degree degree);

    void clearCache();
}
