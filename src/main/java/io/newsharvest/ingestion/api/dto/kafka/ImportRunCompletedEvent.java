package io.newsharvest.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record ImportRunCompletedEvent(
        @JsonProperty("runId") String runId,
        @JsonProperty("jobName") String jobName,
        @JsonProperty("categories") List<String> categories,
        @JsonProperty("imported") int imported,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("errors") int errors,
        @JsonProperty("errorDetails") List<String> errorDetails,
        @JsonProperty("durationMs") long durationMs,
        @JsonProperty("completedAt")
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime completedAt
) {
    public static ImportRunCompletedEvent create(String jobName, List<String> categories, int imported,
                                                 int skipped, int errors, List<String> errorDetails,
                                                 long durationMs) {
        return new ImportRunCompletedEvent(
                "RUN-" + System.currentTimeMillis(),
                jobName,
                categories,
                imported,
                skipped,
                errors,
                errorDetails,
                durationMs,
                LocalDateTime.now()
        );
    }
}
