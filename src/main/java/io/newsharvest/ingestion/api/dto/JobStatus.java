package io.newsharvest.ingestion.api.dto;

import java.time.LocalDateTime;

/**
 * Point-in-time view of one scheduled job.
 */
public record JobStatus(
        String jobName,
        boolean running,
        boolean scheduled,
        LocalDateTime lastRunAt,
        LocalDateTime nextRunAt,
        ImportRunResult lastResult,
        String lastError
) {
    public static JobStatus idle(String jobName) {
        return new JobStatus(jobName, false, false, null, null, null, null);
    }

    public JobStatus running(boolean value) {
        return new JobStatus(jobName, value, scheduled, lastRunAt, nextRunAt, lastResult, lastError);
    }

    public JobStatus scheduled(boolean value, LocalDateTime next) {
        return new JobStatus(jobName, running, value, lastRunAt, next, lastResult, lastError);
    }

    public JobStatus completed(LocalDateTime finishedAt, LocalDateTime next, ImportRunResult result, String error) {
        return new JobStatus(jobName, false, scheduled, finishedAt, next, result, error);
    }
}
