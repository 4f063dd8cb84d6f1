package com.waypoint.dispatch.cli;

import com.waypoint.core.model.HookCondition;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;

/**
 * Condition flags shared by the hook add commands.
 */
public class HookConditionOptions {

    @Option(names = "--tag", description = "Only run for work units carrying one of these tags")
    List<String> tags = new ArrayList<>();

    @Option(names = "--prefix", description = "Only run for work units with one of these id prefixes")
    List<String> prefixes = new ArrayList<>();

    @Option(names = "--epic", description = "Only run for work units in this epic")
    String epic;

    @Option(names = "--estimate-min", description = "Minimum estimate (inclusive)")
    Integer estimateMin;

    @Option(names = "--estimate-max", description = "Maximum estimate (inclusive)")
    Integer estimateMax;

    /**
     * @return the condition, or {@code null} when no flag was given
     */
    HookCondition toCondition() {
        var condition = new HookCondition(tags, prefixes, epic, estimateMin, estimateMax);
        return condition.isEmpty() ? null : condition;
    }
}
