package com.declfactory.generator.expansion.model;

/**
 * One named axis of a Cartesian expansion: the loop variable and the values it takes.
 */
public record LoopThread(String binding, ExpressionMatrix matrix) {

    public int size() {
        return matrix.size();
    }
}
