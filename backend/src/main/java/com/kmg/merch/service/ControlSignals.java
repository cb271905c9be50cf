package com.kmg.merch.service;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

public class ControlSignals {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean pauseRequested;
    private boolean stopRequested;

    public void reset() {
        lock.lock();
        try {
            pauseRequested = false;
            stopRequested = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void requestPause() {
        lock.lock();
        try {
            pauseRequested = true;
        } finally {
            lock.unlock();
        }
    }

    public void requestResume() {
        lock.lock();
        try {
            pauseRequested = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void requestStop() {
        lock.lock();
        try {
            stopRequested = true;
            pauseRequested = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isStopRequested() {
        lock.lock();
        try {
            return stopRequested;
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return pauseRequested && !stopRequested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits at most one poll interval while a pause is in effect.
     *
     * @return true if the task should keep waiting (still paused, not stopped)
     */
    public boolean awaitResume(Duration pollInterval) throws InterruptedException {
        lock.lock();
        try {
            if (pauseRequested && !stopRequested) {
                changed.awaitNanos(pollInterval.toNanos());
            }
            return pauseRequested && !stopRequested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleeps for the given duration unless a stop arrives first.
     *
     * @return true if a stop was requested
     */
    public boolean sleepUnlessStopped(Duration duration) throws InterruptedException {
        long remaining = duration.toNanos();
        lock.lock();
        try {
            while (!stopRequested && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            return stopRequested;
        } finally {
            lock.unlock();
        }
    }
}
