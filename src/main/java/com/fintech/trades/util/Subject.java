package com.fintech.trades.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Explicit observer list. Publishing is synchronous on the caller's thread, in
 * registration order. A failing observer is logged and does not prevent the
 * remaining observers from being notified.
 */
public class Subject<T> implements EventSource<T> {

    private static final Logger log = LoggerFactory.getLogger(Subject.class);

    private final String name;
    private final List<Consumer<? super T>> observers = new CopyOnWriteArrayList<>();

    public Subject(String name) {
        this.name = name;
    }

    @Override
    public Registration subscribe(Consumer<? super T> observer) {
        observers.add(observer);
        return () -> observers.remove(observer);
    }

    public void publish(T event) {
        for (Consumer<? super T> observer : observers) {
            try {
                observer.accept(event);
            } catch (RuntimeException e) {
                log.error("Observer of '{}' failed handling {}", name, event, e);
            }
        }
    }

    public int observerCount() {
        return observers.size();
    }
}
