package com.cuttlefish.backend.service;

import com.cuttlefish.backend.exception.ReentrantCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every state-mutating entry point of the agent. Calls from other threads wait their
 * turn; a call from a thread that is already inside (for example a custody callback) is rejected.
 */
@Component
@Slf4j
public class SingleFlightGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile String currentOperation;

    public <T> T run(String operation, Supplier<T> action) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Re-entrant call rejected operation={} inFlight={}", operation, currentOperation);
            throw new ReentrantCallException(operation);
        }
        lock.lock();
        try {
            currentOperation = operation;
            return action.get();
        } finally {
            currentOperation = null;
            lock.unlock();
        }
    }

    public void run(String operation, Runnable action) {
        run(operation, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    void requireHeld(String operation) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException(operation + " must run inside a guarded operation");
        }
    }
}
