package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.ImportRunResult;
import io.newsharvest.ingestion.api.dto.JobStatus;
import io.newsharvest.ingestion.api.exception.JobAlreadyRunningException;
import io.newsharvest.ingestion.api.exception.UnknownCategoryException;
import io.newsharvest.ingestion.config.CategoryFeed;
import io.newsharvest.ingestion.config.ImportJob;
import io.newsharvest.ingestion.config.NewsConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Fixed-rate import jobs plus the manual control surface: trigger, status, start and stop.
 * <p>
 * A job never overlaps itself: a tick or trigger that finds the job running is skipped.
 * Stopping cancels future ticks only; a run that already started is allowed to finish.
 */
@Service
public class NewsImportScheduler {

    private static final Logger logger = LoggerFactory.getLogger(NewsImportScheduler.class);

    public static final String MANUAL_JOB = "manual";
    private static final int DEFAULT_MANUAL_MAX = 5;

    private final NewsImportService importService;
    private final EventPublisherService eventPublisher;
    private final ScheduleState scheduleState;
    private final TaskScheduler taskScheduler;
    private final NewsConfig newsConfig;

    private final Map<String, ScheduledFuture<?>> scheduledJobs = new ConcurrentHashMap<>();

    public NewsImportScheduler(NewsImportService importService,
                               EventPublisherService eventPublisher,
                               ScheduleState scheduleState,
                               @Qualifier("importJobScheduler") TaskScheduler taskScheduler,
                               NewsConfig newsConfig) {
        this.importService = importService;
        this.eventPublisher = eventPublisher;
        this.scheduleState = scheduleState;
        this.taskScheduler = taskScheduler;
        this.newsConfig = newsConfig;

        newsConfig.scheduling().jobs().forEach(job -> scheduleState.register(job.name()));
        scheduleState.register(MANUAL_JOB);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!newsConfig.scheduling().enabled()) {
            logger.info("Scheduled imports are disabled");
            return;
        }
        startAllJobs();
    }

    @PreDestroy
    public void shutdown() {
        stopAllJobs();
    }

    /**
     * Run an ad-hoc import now on the calling thread.
     *
     * @param categories             category names; empty means all enabled categories
     * @param maxArticlesPerCategory import cap per category; non-positive means the default of 5
     * @throws UnknownCategoryException   if a name is unknown or disabled, before any work is done
     * @throws JobAlreadyRunningException if another manual import is in progress
     */
    public ImportRunResult triggerImport(List<String> categories, int maxArticlesPerCategory) {
        List<CategoryFeed> resolved = importService.resolveCategories(categories);
        int max = maxArticlesPerCategory > 0 ? maxArticlesPerCategory : DEFAULT_MANUAL_MAX;

        logger.info("Manual import triggered for {} categories ({} per category)", resolved.size(), max);
        return runGuarded(MANUAL_JOB, resolved, max);
    }

    /**
     * Run a configured job now, subject to the same overlap guard as its scheduled ticks.
     */
    public ImportRunResult triggerJob(String jobName) {
        ImportJob job = findJob(jobName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown import job: " + jobName));

        List<CategoryFeed> resolved = importService.resolveCategories(job.categories());
        logger.info("Manual trigger of job {}", job.name());
        return runGuarded(job.name(), resolved, job.maxArticlesPerCategory());
    }

    public Map<String, JobStatus> getStatus() {
        return scheduleState.snapshot();
    }

    public synchronized void startAllJobs() {
        for (ImportJob job : newsConfig.scheduling().getEnabledJobs()) {
            if (scheduledJobs.containsKey(job.name())) {
                logger.debug("Job {} already scheduled", job.name());
                continue;
            }

            try {
                importService.resolveCategories(job.categories());
            } catch (UnknownCategoryException e) {
                logger.error("Not scheduling job {}: {}", job.name(), e.getMessage());
                continue;
            }

            Duration initialDelay = job.initialDelay() != null ? job.initialDelay() : Duration.ZERO;
            Instant firstRun = Instant.now().plus(initialDelay);

            ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(() -> tick(job), firstRun, job.interval());
            scheduledJobs.put(job.name(), future);
            scheduleState.markScheduled(job.name(), true, toLocal(firstRun));

            logger.info("Scheduled job {} every {} for {} (first run at {})",
                    job.name(), job.interval(), describe(job.categories()), toLocal(firstRun));
        }
    }

    public synchronized void stopAllJobs() {
        scheduledJobs.forEach((name, future) -> {
            future.cancel(false);
            scheduleState.markScheduled(name, false, null);
            logger.info("Stopped job {}{}", name, scheduleState.isRunning(name) ? " (current run will finish)" : "");
        });
        scheduledJobs.clear();
    }

    void tick(ImportJob job) {
        scheduleState.markScheduled(job.name(), true, LocalDateTime.now().plus(job.interval()));

        if (scheduleState.isRunning(job.name())) {
            logger.info("Skipping tick of job {}: previous run still in progress", job.name());
            return;
        }

        try {
            List<CategoryFeed> categories = importService.resolveCategories(job.categories());
            runGuarded(job.name(), categories, job.maxArticlesPerCategory());
        } catch (JobAlreadyRunningException e) {
            logger.info("Skipping tick of job {}: {}", job.name(), e.getMessage());
        } catch (Exception e) {
            logger.error("Scheduled job {} failed: {}", job.name(), e.getMessage(), e);
        }
    }

    private ImportRunResult runGuarded(String jobName, List<CategoryFeed> categories, int max) {
        if (!scheduleState.tryMarkRunning(jobName)) {
            throw new JobAlreadyRunningException(jobName);
        }

        ImportRunResult result = null;
        String error = null;
        try {
            logger.info("Job {} started for {} categories", jobName, categories.size());
            result = importService.runImport(categories, max);
            eventPublisher.publishRunCompleted(jobName, result);
            return result;
        } catch (RuntimeException e) {
            error = e.getMessage();
            throw e;
        } finally {
            scheduleState.markFinished(jobName, LocalDateTime.now(), result, error);
        }
    }

    private Optional<ImportJob> findJob(String jobName) {
        return newsConfig.scheduling().jobs().stream()
                .filter(job -> job.name().equalsIgnoreCase(jobName))
                .findFirst();
    }

    private static String describe(List<String> categories) {
        return categories == null || categories.isEmpty() ? "all categories" : String.join(", ", categories);
    }

    private static LocalDateTime toLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
    }
}
