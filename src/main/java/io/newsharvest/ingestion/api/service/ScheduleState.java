package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.ImportRunResult;
import io.newsharvest.ingestion.api.dto.JobStatus;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-job running flag and last-run bookkeeping. Every transition is an atomic update of the
 * job's entry, so at most one caller can move a job into the running state.
 */
@Component
public class ScheduleState {

    private final ConcurrentHashMap<String, JobStatus> jobs = new ConcurrentHashMap<>();

    public void register(String jobName) {
        jobs.putIfAbsent(jobName, JobStatus.idle(jobName));
    }

    /**
     * @return true if the job was idle and is now marked running
     */
    public boolean tryMarkRunning(String jobName) {
        AtomicBoolean acquired = new AtomicBoolean(false);

        jobs.compute(jobName, (name, current) -> {
            JobStatus status = current != null ? current : JobStatus.idle(name);
            if (status.running()) {
                return status;
            }
            acquired.set(true);
            return status.running(true);
        });

        return acquired.get();
    }

    public void markFinished(String jobName, LocalDateTime finishedAt, ImportRunResult result, String error) {
        jobs.computeIfPresent(jobName, (name, status) ->
                status.completed(finishedAt, status.nextRunAt(), result, error));
    }

    public void markScheduled(String jobName, boolean scheduled, LocalDateTime nextRunAt) {
        jobs.compute(jobName, (name, current) -> {
            JobStatus status = current != null ? current : JobStatus.idle(name);
            return status.scheduled(scheduled, nextRunAt);
        });
    }

    public boolean isRunning(String jobName) {
        JobStatus status = jobs.get(jobName);
        return status != null && status.running();
    }

    public Map<String, JobStatus> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(jobs));
    }
}
