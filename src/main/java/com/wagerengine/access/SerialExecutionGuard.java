package com.wagerengine.access;

import com.wagerengine.common.exception.ReentrantCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Admits one state-mutating request at a time and rejects nested re-entry.
 *
 * Requests from different threads queue on a fair lock and run in arrival order.
 * A thread that already holds the guard (an external collaborator calling back into
 * the engine mid-request) is rejected instead of being allowed through.
 *
 * <pre>
 * try (SerialExecutionGuard.Permit permit = guard.enter("deposit")) {
 *     ...
 * }
 * </pre>
 */
@Component
@Slf4j
public class SerialExecutionGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    public Permit enter(String operation) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Rejected reentrant call to {}", operation);
            throw new ReentrantCallException(operation);
        }
        lock.lock();
        return new Permit();
    }

    public boolean isBusy() {
        return lock.isLocked();
    }

    /**
     * Scoped hold on the guard, released by {@link #close()}.
     */
    public final class Permit implements AutoCloseable {

        private boolean released;

        private Permit() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
