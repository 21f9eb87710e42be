package com.declfactory.generator.expansion.loop;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.declfactory.generator.expansion.EmptyMatrixPolicy;
import com.declfactory.generator.expansion.declaration.Declaration;
import com.declfactory.generator.expansion.exception.ExpansionException;
import com.declfactory.generator.expansion.instantiate.Instantiator;
import com.declfactory.generator.expansion.model.LoopDescriptor;
import com.declfactory.generator.expansion.model.LoopThread;
import com.declfactory.generator.expansion.model.Substitution;

import lombok.RequiredArgsConstructor;

/**
 * Instantiates a template once per combination of its loop threads.
 *
 * Combinations are enumerated row-major: the last thread varies fastest, as if each later
 * thread were a loop nested inside the earlier ones. Output order follows that enumeration.
 */
@RequiredArgsConstructor
public class CartesianExpander {
    private static final Logger log = LoggerFactory.getLogger(CartesianExpander.class);

    private final Instantiator instantiator;
    private final EmptyMatrixPolicy emptyMatrixPolicy;

    public List<Declaration> expand(Declaration template, LoopDescriptor loops) {
        List<Substitution> combinations = combinations(loops, template);
        List<Declaration> instances = new ArrayList<>(combinations.size());
        for (Substitution substitution : combinations) {
            instances.add(instantiator.instantiate(template, substitution));
        }
        return instances;
    }

    /**
     * Every combination of the threads' values, in output order.
     */
    public List<Substitution> combinations(LoopDescriptor loops, Declaration template) {
        List<LoopThread> threads = loops.getThreads();
        for (LoopThread thread : threads) {
            if (thread.size() == 0) {
                if (emptyMatrixPolicy == EmptyMatrixPolicy.FAIL) {
                    throw new ExpansionException("Loop variable '" + thread.binding()
                            + "' ranges over an empty matrix", template.node());
                }
                log.warn("Loop variable '{}' ranges over an empty matrix, {} expands to nothing",
                        thread.binding(), template.describe());
                return List.of();
            }
        }

        List<Substitution> combinations = new ArrayList<>();
        int[] picks = new int[threads.size()];
        while (true) {
            combinations.add(Substitution.pick(threads, picks));

            int axis = threads.size() - 1;
            while (axis >= 0 && ++picks[axis] == threads.get(axis).size()) {
                picks[axis] = 0;
                axis--;
            }
            if (axis < 0) {
                return combinations;
            }
        }
    }
}
