package com.bbthechange.activityfeed.config;

import com.bbthechange.activityfeed.exception.EventValidationException;
import com.bbthechange.activityfeed.model.ActivityTypeDefinition;
import com.bbthechange.activityfeed.model.GroupingRule;
import com.bbthechange.activityfeed.model.StreamRoute;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable catalogue of activity types, built once from configuration and injected wherever
 * grouping rules or stream routes are needed.
 */
public final class ActivityRegistry {

    private final Map<String, ActivityTypeDefinition> definitions;
    private final Duration defaultMergeWindow;

    private ActivityRegistry(Map<String, ActivityTypeDefinition> definitions, Duration defaultMergeWindow) {
        this.definitions = Collections.unmodifiableMap(definitions);
        this.defaultMergeWindow = defaultMergeWindow;
    }

    public static ActivityRegistry of(List<ActivityTypeDefinition> definitions, Duration defaultMergeWindow) {
        Map<String, ActivityTypeDefinition> byVerb = new LinkedHashMap<>();
        Set<String> ruleIds = new HashSet<>();
        for (ActivityTypeDefinition definition : definitions) {
            if (byVerb.putIfAbsent(definition.verb(), definition) != null) {
                throw new IllegalStateException("Activity type registered twice: " + definition.verb());
            }
            for (GroupingRule rule : definition.groupingRules()) {
                if (!rule.verb().equals(definition.verb())) {
                    throw new IllegalStateException("Grouping rule " + rule.ruleId() + " is declared under "
                            + definition.verb() + " but targets " + rule.verb());
                }
                if (!ruleIds.add(rule.ruleId())) {
                    throw new IllegalStateException("Grouping rule id used twice: " + rule.ruleId());
                }
            }
        }
        return new ActivityRegistry(byVerb, defaultMergeWindow);
    }

    public static ActivityRegistry fromProperties(ActivityProperties properties) {
        Duration defaultWindow = properties.getAggregation().getDefaultMergeWindow();
        List<ActivityTypeDefinition> definitions = new ArrayList<>();
        for (ActivityProperties.TypeConfig type : properties.getTypes()) {
            List<GroupingRule> rules = type.getGrouping().stream()
                    .map(rule -> new GroupingRule(rule.getRuleId(), type.getVerb(), rule.getPivots(),
                            rule.getMergeWindow() != null ? rule.getMergeWindow() : defaultWindow))
                    .toList();
            List<StreamRoute> routes = type.getRoutes().stream()
                    .map(route -> new StreamRoute(route.getStream(), route.getEntity(), route.getAssociation(),
                            route.isExcludeActors()))
                    .toList();
            definitions.add(new ActivityTypeDefinition(type.getVerb(), rules, routes));
        }
        return of(definitions, defaultWindow);
    }

    public Optional<ActivityTypeDefinition> find(String verb) {
        return Optional.ofNullable(definitions.get(verb));
    }

    public ActivityTypeDefinition require(String verb) {
        return find(verb).orElseThrow(() -> EventValidationException.unknownVerb(verb));
    }

    /**
     * Grouping rules for the verb in claim order. A registered verb without rules gets the
     * implicit exact-match rule.
     */
    public List<GroupingRule> rulesFor(String verb) {
        List<GroupingRule> rules = require(verb).groupingRules();
        if (rules.isEmpty()) {
            return List.of(GroupingRule.implicitFor(verb, defaultMergeWindow));
        }
        return rules;
    }

    public Set<String> verbs() {
        return definitions.keySet();
    }
}
