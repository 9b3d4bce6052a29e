package com.courtcapture.capture.model;

public record CacheStats(int total, int valid, int expired) {}
