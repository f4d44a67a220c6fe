package com.outbreaksentinel.core.config;

import com.outbreaksentinel.core.model.RecommendedAction;
import com.outbreaksentinel.core.model.Severity;
import com.outbreaksentinel.core.model.SourceCategory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One row of the recommended-action rule table.
 *
 * <p>
 * A rule contributes its action to an escalated case when every configured
 * condition matches. Empty condition lists match anything:
 * </p>
 * <ul>
 * <li>{@code severities} — final severity tiers the rule applies to</li>
 * <li>{@code environmentalRisk} — environmental risk levels
 * (low, medium, high, critical, unknown)</li>
 * <li>{@code requiredSources} — source categories that must have
 * corroborated the anomaly</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ActionRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private String category;
    private String action;
    private String priority = "medium";
    private String target;
    private String details;

    private List<String> severities = new ArrayList<>();
    private List<String> environmentalRisk = new ArrayList<>();
    private List<String> requiredSources = new ArrayList<>();

    /**
     * @param severity           final severity of the case
     * @param environmentalLevel environmental risk level key
     * @param corroborating      categories that corroborated the anomaly
     * @return {@code true} if every condition of this rule holds
     */
    public boolean matches(Severity severity, String environmentalLevel, Set<SourceCategory> corroborating) {
        if (!severities.isEmpty() && severities.stream().noneMatch(s -> s.equalsIgnoreCase(severity.key()))) {
            return false;
        }
        if (!environmentalRisk.isEmpty()
                && environmentalRisk.stream().noneMatch(l -> l.equalsIgnoreCase(environmentalLevel))) {
            return false;
        }
        for (String source : requiredSources) {
            if (!corroborating.contains(SourceCategory.fromKey(source))) {
                return false;
            }
        }
        return true;
    }

    public RecommendedAction toAction() {
        return new RecommendedAction(category, action, priority, target, details);
    }

    /**
     * @return list of problems with this rule; empty when valid
     */
    List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (category == null || category.isBlank()) {
            errors.add("Action rule requires 'category'");
        }
        if (action == null || action.isBlank()) {
            errors.add("Action rule '" + category + "' requires 'action'");
        }
        if (target == null || target.isBlank()) {
            errors.add("Action rule '" + action + "' requires 'target'");
        }
        for (String s : severities) {
            try {
                Severity.fromKey(s);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        for (String source : requiredSources) {
            try {
                SourceCategory.fromKey(source);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        return errors;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority != null ? priority.toLowerCase(Locale.ROOT) : null;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public List<String> getSeverities() {
        return severities;
    }

    public void setSeverities(List<String> severities) {
        this.severities = severities != null ? new ArrayList<>(severities) : new ArrayList<>();
    }

    public List<String> getEnvironmentalRisk() {
        return environmentalRisk;
    }

    public void setEnvironmentalRisk(List<String> environmentalRisk) {
        this.environmentalRisk = environmentalRisk != null ? new ArrayList<>(environmentalRisk) : new ArrayList<>();
    }

    public List<String> getRequiredSources() {
        return requiredSources;
    }

    public void setRequiredSources(List<String> requiredSources) {
        this.requiredSources = requiredSources != null ? new ArrayList<>(requiredSources) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ActionRule{" +
                "category='" + category + '\'' +
                ", action='" + action + '\'' +
                ", severities=" + severities +
                ", environmentalRisk=" + environmentalRisk +
                ", requiredSources=" + requiredSources +
                '}';
    }
}
