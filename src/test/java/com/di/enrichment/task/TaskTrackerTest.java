package com.di.enrichment.task;

import com.di.enrichment.model.DataTypes;
import com.di.enrichment.model.EnrichmentConfig;
import com.di.enrichment.model.EntityKind;
import com.di.enrichment.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TaskTracker Tests")
class TaskTrackerTest {

    private MutableClock clock;
    private TaskTracker tracker;
    private EnrichmentConfig config;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        tracker = new TaskTracker(new InMemoryTaskStore(), clock);
        config = EnrichmentConfig.defaults();
    }

    @Test
    @DisplayName("New task is PENDING with requested types and no completion time")
    void testCreate() {
        EnrichmentTask task = tracker.create("P-1", EntityKind.POLICY, config, "tester");

        assertNotNull(task.getId());
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(DataTypes.ALL, task.getRequestedDataTypes());
        assertEquals(EnrichmentTask.AUTO_ENRICH, task.getTaskType());
        assertNull(task.getQualityScore());
        assertNull(task.getCompletedAt());
        assertEquals(clock.instant(), task.getStartedAt());
    }

    @Test
    @DisplayName("Manual configs produce manual_enrich tasks")
    void testManualTaskType() {
        EnrichmentTask task = tracker.create("P-1", EntityKind.POLICY,
                config.toBuilder().autoEnrich(false).build(), "tester");
        assertEquals(EnrichmentTask.MANUAL_ENRICH, task.getTaskType());
    }

    @Test
    @DisplayName("Happy path PENDING -> IN_PROGRESS -> COMPLETED sets score and completion time once")
    void testCompleteLifecycle() {
        String id = tracker.create("P-1", EntityKind.POLICY, config, "tester").getId();
        tracker.start(id);
        tracker.recordProgress(id, List.of(DataTypes.DRIVING_RECORD, DataTypes.CREDIT), List.of());
        tracker.recordProgress(id, List.of(DataTypes.PRIOR_CLAIMS), List.of(DataTypes.BACKGROUND));
        clock.advance(Duration.ofSeconds(3));
        EnrichmentTask done = tracker.complete(id, 87.5, true, Map.of("qualityScore", 87.5));

        assertEquals(TaskStatus.COMPLETED, done.getStatus());
        assertEquals(87.5, done.getQualityScore());
        assertTrue(done.isPartial());
        assertEquals(List.of(DataTypes.DRIVING_RECORD, DataTypes.CREDIT, DataTypes.PRIOR_CLAIMS),
                done.getCompletedDataTypes());
        assertEquals(List.of(DataTypes.BACKGROUND), done.getFailedDataTypes());
        assertEquals(clock.instant(), done.getCompletedAt());
        assertEquals(done, tracker.find(id).orElseThrow());
    }

    @Test
    @DisplayName("Skipping IN_PROGRESS is rejected")
    void testCannotCompleteFromPending() {
        String id = tracker.create("P-1", EntityKind.POLICY, config, "tester").getId();
        assertThrows(TaskStateException.class, () -> tracker.complete(id, 50.0, false, Map.of()));
        assertThrows(TaskStateException.class, () -> tracker.recordProgress(id, List.of(DataTypes.CREDIT), List.of()));
        assertEquals(TaskStatus.PENDING, tracker.find(id).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Terminal tasks are immutable")
    void testTerminalIsImmutable() {
        String id = tracker.create("P-1", EntityKind.POLICY, config, "tester").getId();
        tracker.start(id);
        EnrichmentTask failed = tracker.fail(id, "credit: bureau down");

        assertEquals(TaskStatus.FAILED, failed.getStatus());
        assertEquals("credit: bureau down", failed.getErrorDetail());
        assertNotNull(failed.getCompletedAt());
        assertThrows(TaskStateException.class, () -> tracker.complete(id, 50.0, false, Map.of()));
        assertThrows(TaskStateException.class, () -> tracker.fail(id, "again"));
        assertThrows(TaskStateException.class, () -> tracker.start(id));
        assertEquals(failed, tracker.find(id).orElseThrow());
    }

    @Test
    @DisplayName("Progress outside the requested set or overlapping completed and failed is rejected")
    void testProgressRules() {
        EnrichmentConfig two = EnrichmentConfig.builder()
                .dataType(DataTypes.CREDIT)
                .dataType(DataTypes.BACKGROUND)
                .build();
        String id = tracker.create("P-1", EntityKind.POLICY, two, "tester").getId();
        tracker.start(id);

        assertThrows(TaskStateException.class, () -> tracker.recordProgress(id, List.of(DataTypes.DRIVING_RECORD), List.of()));
        tracker.recordProgress(id, List.of(DataTypes.CREDIT), List.of());
        assertThrows(TaskStateException.class, () -> tracker.recordProgress(id, List.of(), List.of(DataTypes.CREDIT)));
        assertEquals(List.of(DataTypes.CREDIT), tracker.find(id).orElseThrow().getCompletedDataTypes());
    }

    @Test
    @DisplayName("Quality score outside [0,100] is rejected")
    void testScoreRange() {
        String id = tracker.create("P-1", EntityKind.POLICY, config, "tester").getId();
        tracker.start(id);
        assertThrows(IllegalArgumentException.class, () -> tracker.complete(id, 100.5, false, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> tracker.complete(id, -1.0, false, Map.of()));
        assertEquals(TaskStatus.IN_PROGRESS, tracker.find(id).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Concurrent progress updates for one task are all kept")
    void testConcurrentProgress() throws Exception {
        List<String> types = new ArrayList<>();
        EnrichmentConfig.EnrichmentConfigBuilder builder = EnrichmentConfig.builder();
        for (int i = 0; i < 32; i++) {
            types.add("type-" + i);
            builder.dataType("type-" + i);
        }
        String id = tracker.create("P-1", EntityKind.POLICY, builder.build(), "tester").getId();
        tracker.start(id);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (String type : types) {
            futures.add(pool.submit(() -> {
                go.await();
                tracker.recordProgress(id, List.of(type), List.of());
                return null;
            }));
        }
        go.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(32, tracker.find(id).orElseThrow().getCompletedDataTypes().size());
    }
}
