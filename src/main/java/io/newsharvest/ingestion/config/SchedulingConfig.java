package io.newsharvest.ingestion.config;

import java.util.List;

public record SchedulingConfig(
        boolean enabled,
        int itemConcurrency,
        List<ImportJob> jobs
) {
    public List<ImportJob> getEnabledJobs() {
        return jobs.stream()
                .filter(ImportJob::enabled)
                .toList();
    }
}
