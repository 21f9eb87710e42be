package com.declfactory.generator.expansion;

import lombok.Getter;
import lombok.ToString;

/**
 * Counters collected during one expansion run.
 */
@Getter
@ToString
public class ExpansionStats {
    private int bindingsDeclared;
    private int templatesExpanded;
    private int instancesEmitted;
    private int emptyExpansions;

    public void recordBindings(int count) {
        bindingsDeclared += count;
    }

    public void recordExpansion(int instances) {
        templatesExpanded++;
        instancesEmitted += instances;
        if (instances == 0) {
            emptyExpansions++;
        }
    }

    public void add(ExpansionStats other) {
        bindingsDeclared += other.bindingsDeclared;
        templatesExpanded += other.templatesExpanded;
        instancesEmitted += other.instancesEmitted;
        emptyExpansions += other.emptyExpansions;
    }
}
