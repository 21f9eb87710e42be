package com.declfactory.generator.expansion.scope;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.declfactory.generator.expansion.exception.ExpansionException;
import com.declfactory.generator.expansion.model.ExpressionMatrix;
import com.github.javaparser.ast.Node;

/**
 * Lexically scoped table of expression matrices.
 *
 * Frames nest with block structure: a block opened with {@link #open()} releases every frame
 * pushed while it was open when it is closed, whether the block finished normally or not.
 * Lookup scans frames innermost first, so an inner binding hides an outer one of the same name.
 */
public class ScopeStack {

    private final Deque<Map<String, ExpressionMatrix>> frames = new ArrayDeque<>();

    /**
     * Pushes a frame. An empty frame is not pushed.
     *
     * @return whether a frame was pushed
     */
    public boolean push(Map<String, ExpressionMatrix> bindings) {
        if (bindings.isEmpty()) {
            return false;
        }
        frames.push(Collections.unmodifiableMap(new LinkedHashMap<>(bindings)));
        return true;
    }

    public void pop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Scope stack underflow");
        }
        frames.pop();
    }

    public int depth() {
        return frames.size();
    }

    public Optional<ExpressionMatrix> lookup(String name) {
        for (Map<String, ExpressionMatrix> frame : frames) {
            ExpressionMatrix matrix = frame.get(name);
            if (matrix != null) {
                return Optional.of(matrix);
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #lookup(String)}, but an undefined name is fatal.
     */
    public ExpressionMatrix resolve(String name, Node site) {
        return lookup(name).orElseThrow(() -> new ExpansionException(
                "Matrix '" + name + "' is not defined in this lexical scope", site));
    }

    public Block open() {
        return new Block(frames.size());
    }

    /**
     * Frames pushed through one block's traversal.
     */
    public final class Block implements AutoCloseable {

        private final int base;

        private Block(int base) {
            this.base = base;
        }

        public boolean push(Map<String, ExpressionMatrix> bindings) {
            return ScopeStack.this.push(bindings);
        }

        @Override
        public void close() {
            while (frames.size() > base) {
                frames.pop();
            }
        }
    }
}
