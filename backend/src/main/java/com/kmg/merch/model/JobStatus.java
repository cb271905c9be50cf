package com.kmg.merch.model;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public record JobStatus(
        String runId,
        int total,
        int current,
        int success,
        int failed,
        JobState state,
        List<ErrorRecord> errors,
        String currentItem,
        String startedAt,
        String finishedAt
) {
    public JobStatus {
        errors = errors == null ? List.of() : List.copyOf(errors);
        currentItem = currentItem == null ? "" : currentItem;
    }

    public static JobStatus idle() {
        return new JobStatus(null, 0, 0, 0, 0, JobState.IDLE, List.of(), "", null, null);
    }

    public static JobStatus started(String runId, int total) {
        return new JobStatus(runId, total, 0, 0, 0, JobState.RUNNING, List.of(), "", now(), null);
    }

    public JobStatus withState(JobState next) {
        return new JobStatus(runId, total, current, success, failed, next, errors, currentItem, startedAt, finishedAt);
    }

    public JobStatus advancedTo(int position, String label) {
        return new JobStatus(runId, total, position, success, failed, JobState.RUNNING, errors, label, startedAt, finishedAt);
    }

    public JobStatus withSuccess() {
        return new JobStatus(runId, total, current, success + 1, failed, state, errors, currentItem, startedAt, finishedAt);
    }

    public JobStatus withFailure(ErrorRecord error) {
        return new JobStatus(runId, total, current, success, failed + 1, state, append(error), currentItem, startedAt, finishedAt);
    }

    public JobStatus withNote(ErrorRecord note) {
        return new JobStatus(runId, total, current, success, failed, state, append(note), currentItem, startedAt, finishedAt);
    }

    public JobStatus finished(JobState terminal, ErrorRecord globalError) {
        List<ErrorRecord> finalErrors = globalError == null ? errors : append(globalError);
        return new JobStatus(runId, total, current, success, failed, terminal, finalErrors, currentItem, startedAt, now());
    }

    private List<ErrorRecord> append(ErrorRecord error) {
        List<ErrorRecord> next = new ArrayList<>(errors.size() + 1);
        next.addAll(errors);
        next.add(error);
        return next;
    }

    private static String now() {
        return OffsetDateTime.now(ZoneOffset.UTC).toString();
    }
}
