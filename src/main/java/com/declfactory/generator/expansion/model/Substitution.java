package com.declfactory.generator.expansion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.github.javaparser.ast.expr.Expression;

import lombok.EqualsAndHashCode;

/**
 * One combination drawn from a loop descriptor: every loop variable mapped to a single fragment.
 */
@EqualsAndHashCode
public final class Substitution {

    private final Map<String, Expression> bindings;

    private Substitution(Map<String, Expression> bindings) {
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    public static Substitution of(Map<String, ? extends Expression> bindings) {
        return new Substitution(new LinkedHashMap<>(bindings));
    }

    /**
     * Picks {@code picks[i]} from the i-th thread.
     */
    public static Substitution pick(List<LoopThread> threads, int[] picks) {
        Map<String, Expression> bindings = new LinkedHashMap<>();
        for (int i = 0; i < threads.size(); i++) {
            LoopThread thread = threads.get(i);
            bindings.put(thread.binding(), thread.matrix().get(picks[i]));
        }
        return new Substitution(bindings);
    }

    public Optional<Expression> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    @Override
    public String toString() {
        return bindings.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
