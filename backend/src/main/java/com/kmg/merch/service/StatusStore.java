package com.kmg.merch.service;

import com.kmg.merch.model.JobStatus;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

@Component
public class StatusStore {
    private final AtomicReference<JobStatus> current = new AtomicReference<>(JobStatus.idle());

    public JobStatus snapshot() {
        return current.get();
    }

    public JobStatus update(UnaryOperator<JobStatus> change) {
        return current.updateAndGet(change);
    }

    public JobStatus reset(String runId, int total) {
        JobStatus fresh = JobStatus.started(runId, total);
        current.set(fresh);
        return fresh;
    }

    public void clear() {
        current.set(JobStatus.idle());
    }
}
