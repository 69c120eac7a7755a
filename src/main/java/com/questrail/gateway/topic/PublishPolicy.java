package com.questrail.gateway.topic;

import com.questrail.gateway.api.PublishDecision;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * PublishPolicy
 * -----------------------------------------------------------------------------
 * Decides QoS and retention of a translated controller event from its
 * parameter name.
 *
 * <p>Transient signals (button presses, install tests) are published
 * {@link PublishDecision#TRANSIENT exactly once and not retained}, so a client
 * connecting later does not see a stale press. Everything else is a steady
 * state value and is published {@link PublishDecision#STEADY_STATE at least
 * once and retained}.</p>
 *
 * <p>The built-in transient rule ({@code INSTALL_TEST}, {@code PRESS_*}) is
 * always active. Additional names and prefixes may be configured.</p>
 */
public final class PublishPolicy
{
    public static final String INSTALL_TEST = "INSTALL_TEST";
    public static final String PRESS_PREFIX = "PRESS_";

    private static final PublishPolicy DEFAULT = new PublishPolicy(Set.of(), Set.of());

    private final Set<String> transientNames;
    private final Set<String> transientPrefixes;

    private PublishPolicy(Set<String> extraNames, Set<String> extraPrefixes) {
        Set<String> names = new LinkedHashSet<>();
        names.add(INSTALL_TEST);
        names.addAll(extraNames);
        Set<String> prefixes = new LinkedHashSet<>();
        prefixes.add(PRESS_PREFIX);
        prefixes.addAll(extraPrefixes);

        this.transientNames = Set.copyOf(names);
        this.transientPrefixes = Set.copyOf(prefixes);
    }

    public static PublishPolicy defaults() {
        return DEFAULT;
    }

    /**
     * Policy with additional transient parameter names and name prefixes.
     */
    public static PublishPolicy withTransient(Set<String> names, Set<String> prefixes) {
        return new PublishPolicy(
                Objects.requireNonNull(names, "names"),
                Objects.requireNonNull(prefixes, "prefixes"));
    }

    public PublishDecision resolve(String parameter) {
        Objects.requireNonNull(parameter, "parameter");
        return isTransient(parameter) ? PublishDecision.TRANSIENT : PublishDecision.STEADY_STATE;
    }

    private boolean isTransient(String parameter) {
        if (transientNames.contains(parameter)) {
            return true;
        }
        for (String prefix : transientPrefixes) {
            if (parameter.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
