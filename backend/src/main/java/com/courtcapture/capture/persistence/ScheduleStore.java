package com.courtcapture.capture.persistence;

import com.courtcapture.capture.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleStore {

    Optional<Schedule> read(long scheduleId);

    /**
     * Writes the given execution timestamps; a null argument leaves that column unchanged.
     */
    void update(long scheduleId, Instant lastExecution, Instant nextExecution);

    /**
     * Active schedules whose next execution is at or before {@code now}, oldest first.
     */
    List<Schedule> findDue(Instant now, int limit);
}
