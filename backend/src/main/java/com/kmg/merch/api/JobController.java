package com.kmg.merch.api;

import com.kmg.merch.config.MerchProperties;
import com.kmg.merch.dto.ActionResponse;
import com.kmg.merch.dto.StartJobRequest;
import com.kmg.merch.dto.StartJobResponse;
import com.kmg.merch.model.JobOptions;
import com.kmg.merch.model.JobStatus;
import com.kmg.merch.model.RunMode;
import com.kmg.merch.service.InputException;
import com.kmg.merch.service.JobService;
import com.kmg.merch.service.SpreadsheetService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

@RestController
@RequestMapping("/api/job")
public class JobController {
    private final JobService jobService;
    private final SpreadsheetService spreadsheetService;
    private final MerchProperties.Job settings;

    public JobController(JobService jobService, SpreadsheetService spreadsheetService, MerchProperties properties) {
        this.jobService = jobService;
        this.spreadsheetService = spreadsheetService;
        this.settings = properties.getJob();
    }

    @PostMapping("/start")
    public ResponseEntity<StartJobResponse> start(@Valid @RequestBody(required = false) StartJobRequest request) {
        JobOptions options = toOptions(request);
        String runId = jobService.start(spreadsheetService.currentItems(), options);
        return ResponseEntity.accepted().body(new StartJobResponse(true, "Upload started", runId));
    }

    @PostMapping("/pause")
    public ResponseEntity<ActionResponse> pause() {
        jobService.requestPause();
        return ResponseEntity.accepted().body(new ActionResponse(true, "Upload paused"));
    }

    @PostMapping("/resume")
    public ResponseEntity<ActionResponse> resume() {
        jobService.requestResume();
        return ResponseEntity.accepted().body(new ActionResponse(true, "Upload resumed"));
    }

    @PostMapping("/stop")
    public ResponseEntity<ActionResponse> stop() {
        jobService.requestStop();
        return ResponseEntity.accepted().body(new ActionResponse(true, "Upload stopped"));
    }

    @GetMapping("/status")
    public JobStatus status() {
        return jobService.getStatus();
    }

    private JobOptions toOptions(StartJobRequest request) {
        Duration delay = settings.getDefaultDelay();
        RunMode mode = settings.getDefaultMode();
        boolean headless = false;

        if (request != null) {
            if (request.delaySeconds() != null) {
                delay = Duration.ofSeconds(request.delaySeconds());
            }
            if (request.mode() != null) {
                mode = request.mode();
            }
            headless = Boolean.TRUE.equals(request.headless());
        }

        if (delay.compareTo(settings.getMaxDelay()) > 0) {
            throw new InputException("Delay must not exceed " + settings.getMaxDelay().toSeconds() + " seconds");
        }
        return new JobOptions(delay, mode, headless);
    }
}
