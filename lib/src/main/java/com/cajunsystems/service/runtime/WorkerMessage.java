package com.cajunsystems.service.runtime;

import com.cajunsystems.service.declaration.FunctionKey;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A request waiting in a worker's mailbox.
 *
 * @param <S> The type of the service state
 */
public sealed interface WorkerMessage<S> permits WorkerMessage.Call, WorkerMessage.InspectState {

    /**
     * Completes the requester's future exceptionally.
     */
    void fail(Throwable cause);

    /**
     * A call to a public function. The reply future receives the unwrapped value.
     */
    record Call<S>(FunctionKey function, List<Object> args, CompletableFuture<Object> reply) implements WorkerMessage<S> {
        @Override
        public void fail(Throwable cause) {
            reply.completeExceptionally(cause);
        }
    }

    /**
     * A request for a snapshot of the worker's state.
     */
    record InspectState<S>(CompletableFuture<S> reply) implements WorkerMessage<S> {
        @Override
        public void fail(Throwable cause) {
            reply.completeExceptionally(cause);
        }
    }
}
