package com.declfactory.generator.expansion.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * The loop threads of one templated declaration, in source order.
 * The last thread varies fastest when enumerating combinations.
 */
@Value
public class LoopDescriptor {

    @NonNull
    List<LoopThread> threads;

    public LoopDescriptor(@NonNull List<LoopThread> threads) {
        if (threads.isEmpty()) {
            throw new IllegalArgumentException("A loop descriptor needs at least one thread");
        }
        this.threads = List.copyOf(threads);
    }

    /**
     * Number of declarations the expansion produces: the product of all thread sizes.
     */
    public long combinationCount() {
        long count = 1;
        for (LoopThread thread : threads) {
            count *= thread.size();
        }
        return count;
    }

    public List<String> bindings() {
        return threads.stream().map(LoopThread::binding).toList();
    }
}
