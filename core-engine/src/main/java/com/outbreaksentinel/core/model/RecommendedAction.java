package com.outbreaksentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One recommended response attached to an alert, e.g. "stock antipyretics"
 * targeted at pharmacies.
 *
 * @since 1.0.0
 */
public class RecommendedAction implements Serializable {

    private static final long serialVersionUID = 1L;

    private String category;
    private String action;
    private String priority;
    private String target;
    private String details;

    /** No-arg constructor required by Jackson. */
    public RecommendedAction() {
    }

    public RecommendedAction(String category, String action, String priority, String target, String details) {
        this.category = category;
        this.action = action;
        this.priority = priority;
        this.target = target;
        this.details = details;
    }

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
        this.priority = priority;
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

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecommendedAction that))
            return false;
        return Objects.equals(category, that.category)
                && Objects.equals(action, that.action)
                && Objects.equals(priority, that.priority)
                && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, action, priority, target);
    }

    @Override
    public String toString() {
        return "[" + priority + "] " + category + ": " + action + " (" + target + ")";
    }
}
