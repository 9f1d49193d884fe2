package com.bidscope.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Broadcasts task events to live subscribers.
 *
 * <p>Hot and best-effort: a subscriber sees only events emitted after it subscribed, and a slow
 * subscriber drops events rather than holding up workers. Late subscribers poll
 * {@link TaskOrchestrator#status(String)} for the current state.
 */
@Component
public class TaskEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(TaskEventPublisher.class);

    private final Sinks.Many<TaskEvent> sink = Sinks.many().multicast().directBestEffort();

    /**
     * Workers publish from several threads; the sink requires serialized emission.
     */
    public synchronized void publish(TaskEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Dropped {} ({})", event, result);
        }
    }

    public Flux<TaskEvent> events() {
        return sink.asFlux();
    }

    public Flux<TaskEvent> events(String taskId) {
        return sink.asFlux().filter(event -> event.getTaskId().equals(taskId));
    }
}
