package io.newsharvest.ingestion.api.exception;

public class JobAlreadyRunningException extends RuntimeException {

    private final String jobName;

    public JobAlreadyRunningException(String jobName) {
        super("Job is already running: " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
