package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.TestFixtures;
import io.newsharvest.ingestion.api.dto.ImportRunResult;
import io.newsharvest.ingestion.api.dto.JobStatus;
import io.newsharvest.ingestion.api.exception.JobAlreadyRunningException;
import io.newsharvest.ingestion.api.exception.UnknownCategoryException;
import io.newsharvest.ingestion.config.CategoryFeed;
import io.newsharvest.ingestion.config.ImportJob;
import io.newsharvest.ingestion.config.NewsConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NewsImportSchedulerTest {

    private static final ImportJob FREQUENT = new ImportJob(
            "every-2-hours", Duration.ofHours(2), Duration.ofMinutes(1), List.of(), 8, true);
    private static final ImportJob BACKUP = new ImportJob(
            "backup-every-6-hours", Duration.ofHours(6), Duration.ofMinutes(30), List.of(), 5, true);
    private static final ImportJob DISABLED = new ImportJob(
            "nightly", Duration.ofHours(24), Duration.ZERO, List.of(), 5, false);

    @Mock
    private NewsImportService importService;

    @Mock
    private EventPublisherService eventPublisher;

    @Mock
    private TaskScheduler taskScheduler;

    private ScheduleState scheduleState;
    private NewsConfig newsConfig;
    private NewsImportScheduler scheduler;
    private List<CategoryFeed> allCategories;

    @BeforeEach
    void setUp() {
        NewsConfig base = TestFixtures.newsConfig();
        newsConfig = TestFixtures.newsConfig(base.categories(), List.of(FREQUENT, BACKUP, DISABLED), 1);
        allCategories = newsConfig.getEnabledCategories();
        scheduleState = new ScheduleState();
        scheduler = new NewsImportScheduler(importService, eventPublisher, scheduleState, taskScheduler, newsConfig);
    }

    private static ImportRunResult result(int imported) {
        return new ImportRunResult(List.of("Science", "World"), imported, 0, 0, List.of(), List.of(), List.of(), 10);
    }

    @Test
    @DisplayName("Should run a manual import with the default cap and record its result")
    void shouldRunManualImport() {
        when(importService.resolveCategories(List.of())).thenReturn(allCategories);
        when(importService.runImport(allCategories, 5)).thenReturn(result(3));

        ImportRunResult result = scheduler.triggerImport(List.of(), 0);

        assertThat(result.imported()).isEqualTo(3);
        verify(eventPublisher).publishRunCompleted(NewsImportScheduler.MANUAL_JOB, result);

        JobStatus manual = scheduler.getStatus().get(NewsImportScheduler.MANUAL_JOB);
        assertThat(manual.running()).isFalse();
        assertThat(manual.lastResult()).isEqualTo(result);
        assertThat(manual.lastRunAt()).isNotNull();
    }

    @Test
    @DisplayName("Should reject unknown categories before doing any work")
    void shouldRejectUnknownCategoriesBeforeWork() {
        when(importService.resolveCategories(List.of("Astrology")))
                .thenThrow(new UnknownCategoryException(List.of("Astrology")));

        assertThatThrownBy(() -> scheduler.triggerImport(List.of("Astrology"), 3))
                .isInstanceOf(UnknownCategoryException.class);

        verify(importService, never()).runImport(anyList(), anyInt());
        assertThat(scheduleState.isRunning(NewsImportScheduler.MANUAL_JOB)).isFalse();
    }

    @Test
    @DisplayName("Should refuse a manual import while another one is running")
    void shouldRefuseOverlappingManualImport() {
        when(importService.resolveCategories(List.of())).thenReturn(allCategories);
        scheduleState.tryMarkRunning(NewsImportScheduler.MANUAL_JOB);

        assertThatThrownBy(() -> scheduler.triggerImport(List.of(), 5))
                .isInstanceOf(JobAlreadyRunningException.class);

        verify(importService, never()).runImport(anyList(), anyInt());
    }

    @Test
    @DisplayName("Should record the error and clear the running flag when a run fails")
    void shouldRecordFailedRun() {
        when(importService.resolveCategories(List.of())).thenReturn(allCategories);
        when(importService.runImport(allCategories, 8)).thenThrow(new IllegalStateException("redis unavailable"));

        assertThatThrownBy(() -> scheduler.triggerJob("every-2-hours"))
                .isInstanceOf(IllegalStateException.class);

        JobStatus status = scheduler.getStatus().get("every-2-hours");
        assertThat(status.running()).isFalse();
        assertThat(status.lastError()).isEqualTo("redis unavailable");
        verify(eventPublisher, never()).publishRunCompleted(anyString(), any());
    }

    @Test
    @DisplayName("Should reject an unknown job name")
    void shouldRejectUnknownJob() {
        assertThatThrownBy(() -> scheduler.triggerJob("hourly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hourly");
    }

    @Test
    @DisplayName("Should skip a tick while the same job is still running")
    void shouldSkipOverlappingTick() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(importService.resolveCategories(List.of())).thenReturn(allCategories);
        when(importService.runImport(allCategories, 8)).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return result(1);
        });

        CompletableFuture<ImportRunResult> firstRun = CompletableFuture.supplyAsync(() -> scheduler.triggerJob("every-2-hours"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.tick(FREQUENT);
        release.countDown();

        assertThat(firstRun.get(5, TimeUnit.SECONDS).imported()).isEqualTo(1);
        verify(importService, times(1)).runImport(allCategories, 8);
        assertThat(scheduleState.isRunning("every-2-hours")).isFalse();
    }

    @Test
    @DisplayName("Should schedule enabled jobs once and cancel them on stop")
    void shouldStartAndStopJobs() {
        ScheduledFuture<?> frequentFuture = mock(ScheduledFuture.class);
        ScheduledFuture<?> backupFuture = mock(ScheduledFuture.class);
        when(importService.resolveCategories(List.of())).thenReturn(allCategories);
        doReturn(frequentFuture).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofHours(2)));
        doReturn(backupFuture).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofHours(6)));

        scheduler.startAllJobs();
        scheduler.startAllJobs();

        verify(taskScheduler, times(1))
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofHours(2)));
        verify(taskScheduler, times(1))
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofHours(6)));
        verify(taskScheduler, never())
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofHours(24)));
        assertThat(scheduler.getStatus().get("every-2-hours").scheduled()).isTrue();
        assertThat(scheduler.getStatus().get("every-2-hours").nextRunAt()).isNotNull();

        scheduler.stopAllJobs();

        verify(frequentFuture).cancel(false);
        verify(backupFuture).cancel(false);
        assertThat(scheduler.getStatus().get("every-2-hours").scheduled()).isFalse();
        assertThat(scheduler.getStatus().get("backup-every-6-hours").scheduled()).isFalse();
    }

    @Test
    @DisplayName("Should not schedule a job whose categories are unknown")
    void shouldNotScheduleJobWithUnknownCategories() {
        ImportJob broken = new ImportJob("broken", Duration.ofHours(1), Duration.ZERO, List.of("Astrology"), 5, true);
        NewsConfig config = TestFixtures.newsConfig(newsConfig.categories(), List.of(broken), 1);
        NewsImportScheduler brokenScheduler =
                new NewsImportScheduler(importService, eventPublisher, new ScheduleState(), taskScheduler, config);
        when(importService.resolveCategories(List.of("Astrology")))
                .thenThrow(new UnknownCategoryException(List.of("Astrology")));

        brokenScheduler.startAllJobs();

        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertThat(brokenScheduler.getStatus().get("broken").scheduled()).isFalse();
    }

    @Test
    @DisplayName("Should list every configured job and the manual job in the status")
    void shouldExposeStatusForAllJobs() {
        assertThat(scheduler.getStatus().keySet())
                .containsExactly("backup-every-6-hours", "every-2-hours", "manual", "nightly");
    }
}
