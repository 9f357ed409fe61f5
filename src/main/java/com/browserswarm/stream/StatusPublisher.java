package com.browserswarm.stream;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event queue between state producers and the observer hub. Producers only enqueue, so they
 * never wait on slow observers; a single drain thread performs the sends.
 */
@Component
@Slf4j
public class StatusPublisher {

    private final StatusHub hub;
    private final BlockingQueue<StatusEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile Thread drainThread;

    public StatusPublisher(StatusHub hub) {
        this.hub = hub;
    }

    public StatusEvent publish(String type, Object payload) {
        StatusEvent event = newEvent(type, payload);
        queue.offer(event);
        return event;
    }

    public StatusEvent newEvent(String type, Object payload) {
        return new StatusEvent(sequence.incrementAndGet(), Instant.now(), type, payload);
    }

    @PostConstruct
    public void start() {
        if (drainThread != null) {
            return;
        }
        Thread thread = new Thread(this::drainLoop, "status-publisher");
        thread.setDaemon(true);
        drainThread = thread;
        thread.start();
    }

    @PreDestroy
    public void stop() {
        Thread thread = drainThread;
        drainThread = null;
        if (thread != null) {
            thread.interrupt();
        }
    }

    /**
     * Broadcasts everything queued so far on the calling thread.
     *
     * @return the number of events sent
     */
    public int drainPending() {
        List<StatusEvent> pending = new ArrayList<>();
        queue.drainTo(pending);
        pending.forEach(this::deliver);
        return pending.size();
    }

    private void drainLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                deliver(queue.take());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("Status publisher stopped.");
    }

    private void deliver(StatusEvent event) {
        try {
            hub.broadcast(event);
        } catch (RuntimeException ex) {
            log.warn("Failed to broadcast {} event: {}", event.type(), ex.getMessage());
        }
    }
}
