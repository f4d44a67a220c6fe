package com.outbreaksentinel.core.notify;

import com.outbreaksentinel.core.config.RecipientRule;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves the recipients of a location from the configured rules.
 * Rules naming the location win; the {@code "*"} rules apply only when no
 * rule names it.
 *
 * @since 1.0.0
 */
public class RecipientDirectory {

    private final List<RecipientRule> rules;

    public RecipientDirectory(List<RecipientRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    public List<Recipient> resolve(String location) {
        Set<Recipient> specific = new LinkedHashSet<>();
        Set<Recipient> fallback = new LinkedHashSet<>();
        for (RecipientRule rule : rules) {
            if (!rule.appliesTo(location)) {
                continue;
            }
            Recipient recipient = new Recipient(rule.getChannel(), rule.getAddress());
            if (RecipientRule.ANY_LOCATION.equals(rule.getLocation())) {
                fallback.add(recipient);
            } else {
                specific.add(recipient);
            }
        }
        return List.copyOf(specific.isEmpty() ? fallback : specific);
    }
}
