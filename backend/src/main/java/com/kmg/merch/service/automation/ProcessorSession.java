package com.kmg.merch.service.automation;

import com.kmg.merch.model.Item;
import com.kmg.merch.model.ProcessOutcome;
import com.kmg.merch.service.ResourceException;

public interface ProcessorSession extends AutoCloseable {

    /**
     * Processes one item. Implementations report expected failures as a failed outcome; any
     * exception thrown is treated the same way by the caller.
     */
    ProcessOutcome process(Item item);

    @Override
    void close() throws ResourceException;
}
