package com.postqueue.engine;

import com.postqueue.core.DeliveryException;
import com.postqueue.core.DeliveryReceipt;
import com.postqueue.dispatch.Dispatcher;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Dispatcher double: succeeds by default, fails when scripted to, and
 * remembers every delivery attempt.
 */
public class ScriptedDispatcher implements Dispatcher {

    public static final class Delivery {
        public final String target;
        public final String payload;

        Delivery(String target, String payload) {
            this.target = target;
            this.payload = payload;
        }
    }

    private final List<Delivery> deliveries = new ArrayList<>();
    private final Deque<RuntimeException> runtimeFailures = new ArrayDeque<>();
    private final Deque<String> failures = new ArrayDeque<>();
    private boolean alwaysFail;

    public synchronized void failNext(String reason) {
        failures.add(reason);
    }

    public synchronized void crashNext(RuntimeException error) {
        runtimeFailures.add(error);
    }

    public synchronized void alwaysFail() {
        alwaysFail = true;
    }

    @Override
    public synchronized DeliveryReceipt deliver(String target, String payload) throws DeliveryException {
        deliveries.add(new Delivery(target, payload));
        if (!runtimeFailures.isEmpty()) {
            throw runtimeFailures.poll();
        }
        if (!failures.isEmpty()) {
            throw new DeliveryException(target, failures.poll());
        }
        if (alwaysFail) {
            throw new DeliveryException(target, "target unreachable");
        }
        return new DeliveryReceipt("msg-" + deliveries.size(), Instant.now());
    }

    public synchronized List<Delivery> getDeliveries() {
        return new ArrayList<>(deliveries);
    }

    public synchronized int deliveryCount() {
        return deliveries.size();
    }
}
