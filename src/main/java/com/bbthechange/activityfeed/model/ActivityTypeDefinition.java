package com.bbthechange.activityfeed.model;

import java.util.List;

/**
 * Everything the engine knows about a verb: its grouping rules, in claim order, and its stream routes.
 */
public record ActivityTypeDefinition(String verb, List<GroupingRule> groupingRules, List<StreamRoute> routes) {

    public ActivityTypeDefinition {
        groupingRules = List.copyOf(groupingRules);
        routes = List.copyOf(routes);
    }
}
