package com.courtcapture.capture.persistence;

import com.courtcapture.capture.model.EvidenceEntry;

import java.util.List;

/**
 * Append-only store of raw capture evidence.
 */
public interface EvidenceStore {

    void append(EvidenceEntry entry);

    List<EvidenceEntry> findByRun(long jobRunId);
}
