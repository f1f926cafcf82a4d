package com.cajunsystems.service.runtime;

import java.util.List;

/**
 * Reported by a worker when it terminates.
 *
 * @param worker  the terminated worker
 * @param cause   the failure that terminated it, or null for an explicit stop
 * @param pending requests that were still queued, in arrival order
 * @param <S>     The type of the service state
 */
public record WorkerTermination<S>(Worker<S> worker, Throwable cause, List<WorkerMessage<S>> pending) {

    public WorkerTermination {
        pending = List.copyOf(pending);
    }

    public boolean isAbnormal() {
        return cause != null;
    }
}
