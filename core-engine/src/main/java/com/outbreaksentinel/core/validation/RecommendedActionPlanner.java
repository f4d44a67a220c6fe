package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.config.ActionRule;
import com.outbreaksentinel.core.model.RecommendedAction;
import com.outbreaksentinel.core.model.Severity;
import com.outbreaksentinel.core.model.SourceCategory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Selects recommended actions from the configured rule table, in table order.
 */
public class RecommendedActionPlanner {

    private final List<ActionRule> rules;

    public RecommendedActionPlanner(List<ActionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * @param severity           final severity tier
     * @param environmentalLevel environmental risk level key
     * @param corroborating      corroborating source categories
     * @return matching actions; duplicates removed
     */
    public List<RecommendedAction> plan(Severity severity, String environmentalLevel,
            Set<SourceCategory> corroborating) {
        Set<RecommendedAction> actions = new LinkedHashSet<>();
        for (ActionRule rule : rules) {
            if (rule.matches(severity, environmentalLevel, corroborating)) {
                actions.add(rule.toAction());
            }
        }
        return new ArrayList<>(actions);
    }
}
