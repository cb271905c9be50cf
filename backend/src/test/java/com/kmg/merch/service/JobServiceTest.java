package com.kmg.merch.service;

import com.kmg.merch.config.MerchProperties;
import com.kmg.merch.model.ErrorRecord;
import com.kmg.merch.model.ErrorScope;
import com.kmg.merch.model.Item;
import com.kmg.merch.model.JobOptions;
import com.kmg.merch.model.JobState;
import com.kmg.merch.model.JobStatus;
import com.kmg.merch.model.RunMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private static final JobOptions NO_DELAY = new JobOptions(Duration.ZERO, RunMode.LIVE, true);

    private ScriptedItemProcessor processor;
    private ImageMappingResolver resolver;
    private JobService jobService;

    @BeforeEach
    void setUp() {
        MerchProperties properties = new MerchProperties();
        properties.getJob().setPollInterval(Duration.ofMillis(20));
        properties.getJob().setStubDuration(Duration.ofMillis(200));

        processor = new ScriptedItemProcessor();
        resolver = new ImageMappingResolver();
        StatusStore statusStore = new StatusStore();
        jobService = new JobService(statusStore, resolver, processor, new EventService(statusStore), properties);
    }

    @AfterEach
    void tearDown() {
        jobService.shutdown();
    }

    @Test
    @DisplayName("A failure on one item is recorded and the run still completes")
    void failingItemIsIsolated() throws Exception {
        processor.failing.add("B");

        jobService.start(items("A", "B", "C"), NO_DELAY);
        JobStatus status = awaitState(JobState.COMPLETED);

        assertEquals(3, status.total());
        assertEquals(3, status.current());
        assertEquals(2, status.success());
        assertEquals(1, status.failed());
        assertEquals(1, status.errors().size());
        ErrorRecord error = status.errors().get(0);
        assertEquals(ErrorScope.ITEM, error.scope());
        assertEquals(1, error.itemIndex());
        assertEquals("B", error.title());
        assertEquals("Upload rejected for B", error.message());
        assertEquals(List.of("A", "B", "C"), processor.processedTitles());
        assertNotNull(status.finishedAt());
    }

    @Test
    @DisplayName("An exception thrown by the processor counts as a single item failure")
    void thrownExceptionIsIsolated() throws Exception {
        processor.throwing.put("item-3", new IllegalStateException("element not found"));

        jobService.start(items("item-1", "item-2", "item-3", "item-4", "item-5"), NO_DELAY);
        JobStatus status = awaitState(JobState.COMPLETED);

        assertEquals(4, status.success());
        assertEquals(1, status.failed());
        assertEquals(1, status.errors().size());
        assertEquals(2, status.errors().get(0).itemIndex());
        assertEquals("element not found", status.errors().get(0).message());
    }

    @Test
    @DisplayName("Stop after the first item leaves the rest untouched")
    void stopAfterFirstItem() throws Exception {
        processor.afterProcessing.put("A", () -> jobService.requestStop());

        jobService.start(items("A", "B", "C"), NO_DELAY);
        JobStatus status = awaitState(JobState.STOPPED);

        assertEquals(1, status.current());
        assertEquals(1, status.success());
        assertEquals(0, status.failed());
        assertEquals(List.of("A"), processor.processedTitles());
        assertEquals(1, processor.opens.get());
        assertEquals(1, processor.closes.get());
    }

    @Test
    @DisplayName("Pause takes effect at the next item and resume continues without skipping or repeating")
    void pauseAndResumeKeepsPosition() throws Exception {
        processor.afterProcessing.put("B", () -> jobService.requestPause());

        jobService.start(items("A", "B", "C", "D"), NO_DELAY);
        JobStatus paused = awaitState(JobState.PAUSED);

        assertEquals(2, paused.current());
        assertEquals(List.of("A", "B"), processor.processedTitles());

        Thread.sleep(100);
        assertEquals(List.of("A", "B"), processor.processedTitles(), "No item may run while paused");

        jobService.requestResume();
        JobStatus done = awaitState(JobState.COMPLETED);

        assertEquals(4, done.current());
        assertEquals(4, done.success());
        assertEquals(List.of("A", "B", "C", "D"), processor.processedTitles());
    }

    @Test
    @DisplayName("Stop while paused ends the run without processing further items")
    void stopWhilePaused() throws Exception {
        processor.afterProcessing.put("A", () -> jobService.requestPause());

        jobService.start(items("A", "B", "C"), NO_DELAY);
        awaitState(JobState.PAUSED);
        jobService.requestStop();
        JobStatus status = awaitState(JobState.STOPPED);

        assertEquals(1, status.current());
        assertEquals(List.of("A"), processor.processedTitles());
        assertEquals(1, processor.closes.get());
    }

    @Test
    @DisplayName("Stop interrupts the delay between items")
    void stopCutsDelayShort() throws Exception {
        processor.afterProcessing.put("A", () -> jobService.requestStop());
        JobOptions slow = new JobOptions(Duration.ofSeconds(30), RunMode.LIVE, true);

        jobService.start(items("A", "B"), slow);
        JobStatus status = awaitState(JobState.STOPPED);

        assertEquals(1, status.current());
        assertEquals(List.of("A"), processor.processedTitles());
    }

    @Test
    @DisplayName("Start is rejected while a run is in progress")
    void startWhileRunningIsRejected() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        processor.gates.put("A", gate);

        jobService.start(items("A", "B"), NO_DELAY);
        JobStateException rejected = assertThrows(JobStateException.class,
                () -> jobService.start(items("X"), NO_DELAY));
        assertEquals(JobStateException.Reason.ALREADY_RUNNING, rejected.reason());

        gate.countDown();
        JobStatus status = awaitState(JobState.COMPLETED);
        assertEquals(List.of("A", "B"), processor.processedTitles());
        assertEquals(2, status.total());
    }

    @Test
    @DisplayName("Start is rejected while a run is paused")
    void startWhilePausedIsRejected() throws Exception {
        processor.afterProcessing.put("A", () -> jobService.requestPause());

        jobService.start(items("A", "B"), NO_DELAY);
        awaitState(JobState.PAUSED);

        JobStateException rejected = assertThrows(JobStateException.class,
                () -> jobService.start(items("X"), NO_DELAY));
        assertEquals(JobStateException.Reason.ALREADY_RUNNING, rejected.reason());

        jobService.requestStop();
        awaitState(JobState.STOPPED);
    }

    @Test
    @DisplayName("Control requests are validated against the current state")
    void controlRequestsRequireMatchingState() throws Exception {
        assertEquals(JobStateException.Reason.NOT_RUNNING,
                assertThrows(JobStateException.class, () -> jobService.requestPause()).reason());
        assertEquals(JobStateException.Reason.NOT_PAUSED,
                assertThrows(JobStateException.class, () -> jobService.requestResume()).reason());
        assertEquals(JobStateException.Reason.NO_ACTIVE_JOB,
                assertThrows(JobStateException.class, () -> jobService.requestStop()).reason());

        CountDownLatch gate = new CountDownLatch(1);
        processor.gates.put("A", gate);
        jobService.start(items("A"), NO_DELAY);

        assertEquals(JobStateException.Reason.NOT_PAUSED,
                assertThrows(JobStateException.class, () -> jobService.requestResume()).reason());

        gate.countDown();
        awaitState(JobState.COMPLETED);

        assertEquals(JobStateException.Reason.NO_ACTIVE_JOB,
                assertThrows(JobStateException.class, () -> jobService.requestStop()).reason());
        assertEquals(JobStateException.Reason.NOT_RUNNING,
                assertThrows(JobStateException.class, () -> jobService.requestPause()).reason());
    }

    @Test
    @DisplayName("A new run zeroes the counters and clears the error log")
    void restartResetsStatus() throws Exception {
        processor.failing.add("A");
        jobService.start(items("A", "B"), NO_DELAY);
        JobStatus first = awaitState(JobState.COMPLETED);
        assertEquals(1, first.failed());

        processor.failing.clear();
        CountDownLatch gate = new CountDownLatch(1);
        processor.gates.put("C", gate);
        jobService.start(items("C", "D", "E"), NO_DELAY);

        JobStatus fresh = jobService.getStatus();
        assertEquals(3, fresh.total());
        assertEquals(0, fresh.success());
        assertEquals(0, fresh.failed());
        assertTrue(fresh.errors().isEmpty());
        assertNotEquals(first.runId(), fresh.runId());

        gate.countDown();
        JobStatus second = awaitState(JobState.COMPLETED);
        assertEquals(3, second.success());
        assertTrue(second.errors().isEmpty());
    }

    @Test
    @DisplayName("Failure to acquire the processor aborts the run with one global error")
    void acquireFailureIsFatal() throws Exception {
        processor.openFailure = new ResourceException("chrome not installed");

        jobService.start(items("A", "B"), NO_DELAY);
        JobStatus status = awaitState(JobState.ERROR);

        assertEquals(0, status.current());
        assertEquals(1, status.errors().size());
        assertEquals(ErrorScope.GLOBAL, status.errors().get(0).scope());
        assertEquals("chrome not installed", status.errors().get(0).message());
        assertTrue(processor.processed.isEmpty());
        assertEquals(0, processor.closes.get());
    }

    @Test
    @DisplayName("Failure to release the processor marks the run as failed")
    void releaseFailureIsFatal() throws Exception {
        processor.closeFailure = new ResourceException("driver quit failed");

        jobService.start(items("A", "B"), NO_DELAY);
        JobStatus status = awaitState(JobState.ERROR);

        assertEquals(2, status.success());
        assertEquals(1, status.errors().size());
        assertEquals(ErrorScope.GLOBAL, status.errors().get(0).scope());
        assertEquals(1, processor.closes.get());
    }

    @Test
    @DisplayName("Mapped image paths are substituted before processing")
    void imageMappingIsApplied() throws Exception {
        resolver.submit("images/a.png", "/uploads/a.png");

        List<Item> items = List.of(
                Item.of(0, "A", "images/a.png", Map.of()),
                Item.of(1, "B", "images/b.png", Map.of())
        );
        jobService.start(items, NO_DELAY);
        awaitState(JobState.COMPLETED);

        assertEquals("/uploads/a.png", processor.processed.get(0).resolvedImagePath());
        assertEquals("images/a.png", processor.processed.get(0).imagePath());
        assertEquals("images/b.png", processor.processed.get(1).resolvedImagePath());
    }

    @Test
    @DisplayName("Stub mode completes without acquiring the processor")
    void stubModeSkipsProcessing() throws Exception {
        jobService.start(items("A", "B"), new JobOptions(Duration.ZERO, RunMode.STUB, false));
        JobStatus status = awaitState(JobState.COMPLETED);

        assertEquals(2, status.total());
        assertEquals(0, status.current());
        assertEquals(0, status.failed());
        assertEquals(1, status.errors().size());
        assertEquals(ErrorScope.NOTE, status.errors().get(0).scope());
        assertEquals(JobService.STUB_NOTE_TITLE, status.errors().get(0).title());
        assertEquals(0, processor.opens.get());
    }

    @Test
    @DisplayName("Stub run can be stopped")
    void stubModeCanBeStopped() throws Exception {
        jobService.start(items("A"), new JobOptions(Duration.ZERO, RunMode.STUB, false));
        jobService.requestStop();

        JobStatus status = awaitState(JobState.STOPPED);
        assertEquals(0, status.current());
    }

    @Test
    @DisplayName("Every observed snapshot keeps success + failed <= current <= total")
    void snapshotsStayConsistent() throws Exception {
        List<String> titles = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            titles.add("item-" + i);
            if (i % 3 == 0) {
                processor.failing.add("item-" + i);
            }
        }

        AtomicBoolean done = new AtomicBoolean(false);
        List<String> violations = new CopyOnWriteArrayList<>();
        Thread observer = new Thread(() -> {
            while (!done.get()) {
                JobStatus s = jobService.getStatus();
                if (s.success() + s.failed() > s.current() || s.current() > s.total()) {
                    violations.add(s.toString());
                }
            }
        });
        observer.start();

        jobService.start(items(titles.toArray(new String[0])), NO_DELAY);
        JobStatus status = awaitState(JobState.COMPLETED);
        done.set(true);
        observer.join(TimeUnit.SECONDS.toMillis(5));

        assertTrue(violations.isEmpty(), () -> "Inconsistent snapshots: " + violations);
        assertEquals(200, status.current());
        assertEquals(67, status.failed());
        assertEquals(133, status.success());
    }

    @Test
    @DisplayName("An Error from the processor ends the run as ERROR and frees the controller")
    void processorErrorIsFatal() throws Exception {
        processor.crashing.put("B", new AssertionError("boom"));

        jobService.start(items("A", "B", "C"), NO_DELAY);
        JobStatus status = awaitState(JobState.ERROR);

        assertEquals(2, status.current());
        assertEquals(1, status.success());
        assertEquals(0, status.failed());
        assertEquals(1, status.errors().size());
        assertEquals(ErrorScope.GLOBAL, status.errors().get(0).scope());
        assertEquals("boom", status.errors().get(0).message());
        assertEquals(List.of("A", "B"), processor.processedTitles());
        assertEquals(1, processor.closes.get());
        assertFalse(jobService.isRunActive());

        processor.crashing.clear();
        jobService.start(items("D"), NO_DELAY);
        JobStatus next = awaitState(JobState.COMPLETED);
        assertEquals(1, next.success());
        assertTrue(next.errors().isEmpty());
    }

    @Test
    @DisplayName("An unexpected failure outside the processor ends the run with one global error")
    void collaboratorFailureIsFatal() throws Exception {
        ImageMappingResolver brokenResolver = new ImageMappingResolver() {
            @Override
            public String resolve(String originalPath) {
                if (originalPath.contains("B")) {
                    throw new IllegalStateException("mapping table unavailable");
                }
                return super.resolve(originalPath);
            }
        };
        MerchProperties properties = new MerchProperties();
        properties.getJob().setPollInterval(Duration.ofMillis(20));
        jobService.shutdown();
        StatusStore statusStore = new StatusStore();
        jobService = new JobService(statusStore, brokenResolver, processor, new EventService(statusStore), properties);

        jobService.start(items("A", "B", "C"), NO_DELAY);
        JobStatus status = awaitState(JobState.ERROR);

        assertEquals(1, status.current());
        assertEquals(1, status.success());
        assertEquals(1, status.errors().size());
        assertEquals(ErrorScope.GLOBAL, status.errors().get(0).scope());
        assertEquals("mapping table unavailable", status.errors().get(0).message());
        assertEquals(List.of("A"), processor.processedTitles());
        assertEquals(1, processor.closes.get());

        jobService.start(items("A"), NO_DELAY);
        awaitState(JobState.COMPLETED);
    }

    private static List<Item> items(String... titles) {
        List<Item> items = new ArrayList<>();
        for (int i = 0; i < titles.length; i++) {
            items.add(Item.of(i, titles[i], "images/" + titles[i] + ".png", Map.of("price", "19.99")));
        }
        return items;
    }

    private JobStatus awaitState(JobState expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        JobStatus status = jobService.getStatus();
        while (status.state() != expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
            status = jobService.getStatus();
        }
        assertEquals(expected, status.state(), () -> "Run did not reach " + expected + ": " + jobService.getStatus());
        return status;
    }
}
