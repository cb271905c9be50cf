package com.kmg.merch.service;

import com.kmg.merch.config.MerchProperties;
import com.kmg.merch.model.ErrorRecord;
import com.kmg.merch.model.Item;
import com.kmg.merch.model.JobOptions;
import com.kmg.merch.model.JobState;
import com.kmg.merch.model.JobStatus;
import com.kmg.merch.model.ProcessOutcome;
import com.kmg.merch.model.RunMode;
import com.kmg.merch.service.automation.ItemProcessor;
import com.kmg.merch.service.automation.ProcessorSession;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class JobService {
    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final String STUB_NOTE_TITLE = "Local Execution Required";
    static final String STUB_NOTE_MESSAGE =
            "Browser automation is not available in stub mode. Run the uploader locally in live mode to upload products.";

    private final StatusStore statusStore;
    private final ImageMappingResolver imageMappingResolver;
    private final ItemProcessor itemProcessor;
    private final EventService eventService;
    private final MerchProperties.Job settings;
    private final ControlSignals signals = new ControlSignals();

    private final ExecutorService jobExecutor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "upload-job");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicReference<String> runningRunId = new AtomicReference<>(null);

    public JobService(
            StatusStore statusStore,
            ImageMappingResolver imageMappingResolver,
            ItemProcessor itemProcessor,
            EventService eventService,
            MerchProperties properties
    ) {
        this.statusStore = statusStore;
        this.imageMappingResolver = imageMappingResolver;
        this.itemProcessor = itemProcessor;
        this.eventService = eventService;
        this.settings = properties.getJob();
    }

    public synchronized String start(List<Item> items, JobOptions options) {
        if (items == null) {
            throw new InputException("No items to process.");
        }
        if (isRunActive()) {
            throw new JobStateException(JobStateException.Reason.ALREADY_RUNNING);
        }

        List<Item> runItems = List.copyOf(items);
        String runId = UUID.randomUUID().toString();

        runningRunId.set(runId);
        signals.reset();
        statusStore.reset(runId, runItems.size());
        log.info("Run {} started: {} items, mode={}, delay={}ms",
                runId, runItems.size(), options.mode().toText(), options.delay().toMillis());
        eventService.publish("run-started", runId, "Upload started", Map.of(
                "total", runItems.size(),
                "mode", options.mode().toText()
        ));

        try {
            jobExecutor.submit(() -> runJob(runId, runItems, options, signals));
        } catch (RejectedExecutionException ex) {
            runningRunId.set(null);
            statusStore.update(status -> status.finished(JobState.ERROR, ErrorRecord.global(
                    "Execution task could not be scheduled")));
            throw ex;
        }
        return runId;
    }

    public synchronized void requestPause() {
        if (statusStore.snapshot().state() != JobState.RUNNING) {
            throw new JobStateException(JobStateException.Reason.NOT_RUNNING);
        }
        signals.requestPause();
        String runId = runningRunId.get();
        log.info("Run {} pause requested", runId);
        eventService.publish("run-pause-requested", runId, "Pause requested", null);
    }

    public synchronized void requestResume() {
        if (statusStore.snapshot().state() != JobState.PAUSED) {
            throw new JobStateException(JobStateException.Reason.NOT_PAUSED);
        }
        signals.requestResume();
        String runId = runningRunId.get();
        log.info("Run {} resume requested", runId);
        eventService.publish("run-resume-requested", runId, "Resume requested", null);
    }

    public synchronized void requestStop() {
        if (!statusStore.snapshot().state().isActive()) {
            throw new JobStateException(JobStateException.Reason.NO_ACTIVE_JOB);
        }
        signals.requestStop();
        String runId = runningRunId.get();
        log.info("Run {} stop requested", runId);
        eventService.publish("run-stop-requested", runId, "Stop requested", null);
    }

    // Same monitor as start, so a run cannot begin between the check and the reset.
    public synchronized void resetStatusIfIdle() {
        if (isRunActive()) {
            throw new JobStateException(JobStateException.Reason.ALREADY_RUNNING);
        }
        statusStore.clear();
    }

    public JobStatus getStatus() {
        return statusStore.snapshot();
    }

    public boolean isRunActive() {
        return runningRunId.get() != null || statusStore.snapshot().state().isActive();
    }

    @PreDestroy
    void shutdown() {
        signals.requestStop();
        jobExecutor.shutdownNow();
    }

    private void runJob(String runId, List<Item> items, JobOptions options, ControlSignals signals) {
        JobState terminal = JobState.ERROR;
        ErrorRecord fatal = null;
        try {
            terminal = options.mode() == RunMode.STUB
                    ? runStub(runId, signals)
                    : runLive(runId, items, options, signals);
        } catch (ResourceException e) {
            log.error("Run {} aborted: {}", runId, e.getMessage(), e);
            terminal = JobState.ERROR;
            fatal = ErrorRecord.global(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run {} interrupted; treating as stopped", runId);
            terminal = JobState.STOPPED;
        } catch (Exception | Error e) {
            log.error("Run {} failed: {}", runId, e.getMessage(), e);
            terminal = JobState.ERROR;
            fatal = ErrorRecord.global(describe(e));
        } finally {
            finish(runId, terminal, fatal);
        }
    }

    private void finish(String runId, JobState terminal, ErrorRecord fatal) {
        runningRunId.set(null);
        JobStatus finished = statusStore.update(status -> status.finished(terminal, fatal));
        log.info("Run {} finished: state={}, processed={}/{}, success={}, failed={}",
                runId, finished.state(), finished.current(), finished.total(), finished.success(), finished.failed());
        eventService.publish("run-finished", runId, "Upload " + finished.state().name().toLowerCase(), Map.of(
                "state", finished.state(),
                "success", finished.success(),
                "failed", finished.failed()
        ));
    }

    private JobState runLive(String runId, List<Item> items, JobOptions options, ControlSignals signals)
            throws ResourceException, InterruptedException {
        try (ProcessorSession session = itemProcessor.open(options)) {
            for (int i = 0; i < items.size(); i++) {
                if (signals.isStopRequested()) {
                    log.info("Run {} stopped before item {}", runId, i + 1);
                    return JobState.STOPPED;
                }
                if (signals.isPaused()) {
                    waitWhilePaused(runId, signals);
                    if (signals.isStopRequested()) {
                        log.info("Run {} stopped while paused before item {}", runId, i + 1);
                        return JobState.STOPPED;
                    }
                }

                Item item = resolveImage(items.get(i));
                int position = i + 1;
                String label = displayTitle(item, position);
                statusStore.update(status -> status.advancedTo(position, label));
                processOne(runId, session, item, label);

                if (position < items.size()) {
                    signals.sleepUnlessStopped(options.delay());
                }
            }
        }
        return JobState.COMPLETED;
    }

    private JobState runStub(String runId, ControlSignals signals) throws InterruptedException {
        statusStore.update(status -> status.withNote(ErrorRecord.note(STUB_NOTE_TITLE, STUB_NOTE_MESSAGE)));
        log.info("Run {} is in stub mode; no items will be processed", runId);
        if (signals.sleepUnlessStopped(settings.getStubDuration())) {
            return JobState.STOPPED;
        }
        return JobState.COMPLETED;
    }

    private void waitWhilePaused(String runId, ControlSignals signals) throws InterruptedException {
        Duration pollInterval = settings.getPollInterval();
        statusStore.update(status -> status.withState(JobState.PAUSED));
        log.info("Run {} paused", runId);
        eventService.publish("run-paused", runId, "Upload paused", null);

        boolean paused = true;
        while (paused) {
            paused = signals.awaitResume(pollInterval);
        }

        if (!signals.isStopRequested()) {
            statusStore.update(status -> status.withState(JobState.RUNNING));
            log.info("Run {} resumed", runId);
            eventService.publish("run-resumed", runId, "Upload resumed", null);
        }
    }

    private Item resolveImage(Item item) {
        String resolved = imageMappingResolver.resolve(item.imagePath());
        if (imageMappingResolver.isMapped(item.imagePath())) {
            log.info("Using uploaded image for {}: {}", item.title(), resolved);
        } else {
            log.info("Using original image path for {}: {}", item.title(), resolved);
        }
        return item.withResolvedImagePath(resolved);
    }

    private void processOne(String runId, ProcessorSession session, Item item, String label) {
        ProcessOutcome outcome;
        try {
            outcome = session.process(item);
            if (outcome == null) {
                outcome = ProcessOutcome.failure("Processor returned no outcome");
            }
        } catch (RuntimeException e) {
            outcome = ProcessOutcome.failure(describe(e));
        }

        if (outcome.ok()) {
            statusStore.update(JobStatus::withSuccess);
            log.info("Run {} item {} uploaded: {}", runId, item.index() + 1, label);
            eventService.publish("item-completed", runId, "Item uploaded", Map.of(
                    "index", item.index(),
                    "title", label
            ));
        } else {
            String error = outcome.error();
            statusStore.update(status -> status.withFailure(
                    ErrorRecord.item(item.index(), label, error)));
            log.warn("Run {} item {} failed ({}): {}", runId, item.index() + 1, label, error);
            eventService.publish("item-failed", runId, "Item failed", Map.of(
                    "index", item.index(),
                    "title", label,
                    "error", error
            ));
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String displayTitle(Item item, int position) {
        if (item.title() == null || item.title().isBlank()) {
            return "Product " + position;
        }
        return item.title();
    }
}
