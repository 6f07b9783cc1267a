package com.socmind.core.escalation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "socmind.escalation")
public class EscalationProperties {

    /** Entity categories whose containment always needs a human sign-off. */
    private Set<String> criticalCategories = new LinkedHashSet<>(
            Set.of("domain-controller", "identity-provider", "database-server"));

    public boolean isCritical(String category) {
        if (category == null) {
            return false;
        }
        var normalized = category.trim().toLowerCase(Locale.ROOT);
        return criticalCategories.stream().anyMatch(c -> c.trim().toLowerCase(Locale.ROOT).equals(normalized));
    }

    public Set<String> getCriticalCategories() { return criticalCategories; }
    public void setCriticalCategories(Set<String> criticalCategories) { this.criticalCategories = criticalCategories; }
}
