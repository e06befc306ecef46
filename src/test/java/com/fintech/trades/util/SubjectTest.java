package com.fintech.trades.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Subject Tests")
class SubjectTest {

    @Test
    @DisplayName("Observers are notified in registration order")
    void notifiesInOrder() {
        Subject<String> subject = new Subject<>("test");
        List<String> seen = new ArrayList<>();
        subject.subscribe(value -> seen.add("a:" + value));
        subject.subscribe(value -> seen.add("b:" + value));

        subject.publish("x");

        assertThat(seen).containsExactly("a:x", "b:x");
    }

    @Test
    @DisplayName("A failing observer does not stop the others")
    void isolatesFailures() {
        Subject<String> subject = new Subject<>("test");
        List<String> seen = new ArrayList<>();
        subject.subscribe(value -> {
            throw new IllegalStateException("boom");
        });
        subject.subscribe(seen::add);

        subject.publish("x");

        assertThat(seen).containsExactly("x");
    }

    @Test
    @DisplayName("Removed observers receive nothing")
    void removal() {
        Subject<String> subject = new Subject<>("test");
        List<String> seen = new ArrayList<>();
        Registration registration = subject.subscribe(seen::add);

        registration.remove();
        registration.remove();
        subject.publish("x");

        assertThat(seen).isEmpty();
        assertThat(subject.observerCount()).isZero();
    }
}
