package com.kmg.merch.service.automation;

import com.kmg.merch.model.JobOptions;
import com.kmg.merch.service.ResourceException;

/**
 * Performs the side-effecting action for each item. A run opens at most one session and closes it
 * exactly once, whichever way the run ends.
 */
public interface ItemProcessor {

    ProcessorSession open(JobOptions options) throws ResourceException;
}
