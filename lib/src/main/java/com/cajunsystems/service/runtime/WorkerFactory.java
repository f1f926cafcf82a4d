package com.cajunsystems.service.runtime;

import com.cajunsystems.service.config.ServiceConfig;
import com.cajunsystems.service.generator.Implementation;
import com.cajunsystems.service.mailbox.DefaultMailboxProvider;
import com.cajunsystems.service.mailbox.MailboxProvider;

import java.util.concurrent.ThreadFactory;

/**
 * Creates unstarted workers for a supervisor.
 *
 * @param <S> The type of the service state
 */
@FunctionalInterface
public interface WorkerFactory<S> {

    Worker<S> create(String workerId, S initialState, TerminationListener<S> listener);

    /**
     * A factory creating workers over the given implementation, with mailboxes and stop
     * timeout taken from the configuration.
     */
    static <S> WorkerFactory<S> standard(String serviceId, Implementation<S> implementation,
                                         ServiceConfig config, ThreadFactory threads) {
        MailboxProvider<WorkerMessage<S>> mailboxes = new DefaultMailboxProvider<>();
        return (workerId, initialState, listener) -> new Worker<>(
                serviceId,
                workerId,
                implementation,
                initialState,
                mailboxes.createMailbox(config.getMailboxType(), config.getMailboxCapacity()),
                threads,
                listener,
                config.getStopTimeout());
    }
}
