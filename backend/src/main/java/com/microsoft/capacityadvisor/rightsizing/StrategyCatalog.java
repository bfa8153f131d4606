package com.microsoft.capacityadvisor.rightsizing;

import com.microsoft.capacityadvisor.config.RightsizingProperties;
import com.microsoft.capacityadvisor.domain.model.StrategyProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Named strategy profiles: the three built-ins plus any defined under
 * {@code rightsizing.strategies}.
 *
 * Names resolve case-insensitively. A blank name resolves to the configured
 * default; an unrecognised name falls back to balanced with a warning rather
 * than failing the run.
 */
@Component
@Slf4j
public class StrategyCatalog {

    private final Map<String, StrategyProfile> profiles;
    private final StrategyProfile defaultProfile;

    public StrategyCatalog(RightsizingProperties properties) {
        Map<String, StrategyProfile> byName = new LinkedHashMap<>();
        register(byName, StrategyProfile.AGGRESSIVE);
        register(byName, StrategyProfile.BALANCED);
        register(byName, StrategyProfile.CONSERVATIVE);

        properties.getStrategies().forEach((name, definition) -> {
            String description = definition.getDescription() != null
                    ? definition.getDescription()
                    : "Custom strategy (risk up to " + definition.getRiskCeiling() + ")";
            StrategyProfile profile = new StrategyProfile(
                    name.toLowerCase(Locale.ROOT),
                    definition.getRiskCeiling(),
                    definition.getMaxProjectedCpu(),
                    definition.getMaxProjectedMemory(),
                    description);
            if (byName.containsKey(profile.name())) {
                log.info("Strategy '{}' overridden from configuration", profile.name());
            }
            register(byName, profile);
        });

        this.profiles = Collections.unmodifiableMap(byName);
        this.defaultProfile = lookup(properties.getStrategy());
        log.info("Strategies available: {} (default: {})", profiles.keySet(), defaultProfile.name());
    }

    public StrategyProfile resolve(String name) {
        if (name == null || name.isBlank()) {
            return defaultProfile;
        }
        return lookup(name);
    }

    public StrategyProfile defaultProfile() {
        return defaultProfile;
    }

    public Collection<StrategyProfile> profiles() {
        return profiles.values();
    }

    private StrategyProfile lookup(String name) {
        StrategyProfile profile = name == null ? null : profiles.get(name.trim().toLowerCase(Locale.ROOT));
        if (profile == null) {
            log.warn("Unknown strategy '{}', falling back to '{}'", name, StrategyProfile.BALANCED.name());
            return profiles.get(StrategyProfile.BALANCED.name());
        }
        return profile;
    }

    private static void register(Map<String, StrategyProfile> byName, StrategyProfile profile) {
        byName.put(profile.name(), profile);
    }
}
