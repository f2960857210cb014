package com.iksanov.surveyshield.node.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Topic that delivers published events to its subscribers on a dispatcher.
 * <p>
 * The asynchronous variant dispatches on one dedicated thread, so subscribers observe events in publish
 * order and never run on the publisher's thread. A failing subscriber does not affect the others.
 */
public final class EventChannel<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventChannel.class);
    private final String name;
    private final Executor dispatcher;
    private final ExecutorService ownedExecutor;
    private final List<Consumer<? super T>> subscribers = new CopyOnWriteArrayList<>();

    private EventChannel(String name, Executor dispatcher, ExecutorService ownedExecutor) {
        this.name = Objects.requireNonNull(name, "name");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.ownedExecutor = ownedExecutor;
    }

    public static <T> EventChannel<T> async(String name) {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "events-" + name);
            t.setDaemon(true);
            return t;
        });
        return new EventChannel<>(name, executor, executor);
    }

    /**
     * Delivers on the publisher's thread. Used by tests and by channels whose subscribers are cheap.
     */
    public static <T> EventChannel<T> direct(String name) {
        return new EventChannel<>(name, Runnable::run, null);
    }

    public Subscription subscribe(Consumer<? super T> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public void publish(T event) {
        Objects.requireNonNull(event, "event");
        for (Consumer<? super T> subscriber : subscribers) {
            try {
                dispatcher.execute(() -> deliver(subscriber, event));
            } catch (RejectedExecutionException e) {
                log.debug("Channel '{}' is closed, dropping event", name);
                return;
            }
        }
    }

    private void deliver(Consumer<? super T> subscriber, T event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.error("Subscriber of channel '{}' failed: {}", name, e.getMessage(), e);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @Override
    public void close() {
        subscribers.clear();
        if (ownedExecutor == null) return;
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(2, TimeUnit.SECONDS)) ownedExecutor.shutdownNow();
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
