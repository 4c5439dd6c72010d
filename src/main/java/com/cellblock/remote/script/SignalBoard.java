package com.cellblock.remote.script;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;

/**
 * Named one-shot gates backing the {@code await} and {@code signal} builtins. One board is shared
 * by every container of a runtime server, so code in one container can release code in another.
 */
public class SignalBoard {

    private final ConcurrentHashMap<String, CountDownLatch> gates = new ConcurrentHashMap<>();

    public void await(String name) throws InterruptedException {
        gate(name).await();
    }

    public void signal(String name) {
        gate(name).countDown();
    }

    public boolean isSignaled(String name) {
        CountDownLatch gate = gates.get(name);
        return gate != null && gate.getCount() == 0;
    }

    private CountDownLatch gate(String name) {
        return gates.computeIfAbsent(name, k -> new CountDownLatch(1));
    }
}
