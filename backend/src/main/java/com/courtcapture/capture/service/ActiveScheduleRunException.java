package com.courtcapture.capture.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveScheduleRunException extends RuntimeException {
    public ActiveScheduleRunException(long scheduleId) {
        super("Schedule " + scheduleId + " is already running");
    }
}
