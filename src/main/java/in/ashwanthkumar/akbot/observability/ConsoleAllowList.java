package in.ashwanthkumar.akbot.observability;

import com.google.common.collect.ImmutableSet;

import java.util.Collection;

/**
 * Process-wide set of instance names whose events are mirrored to the console.
 * Written once at startup, read concurrently by every instance afterwards.
 */
public final class ConsoleAllowList {
    private static volatile ImmutableSet<String> allowed = ImmutableSet.of();

    private ConsoleAllowList() {
    }

    public static void configure(Collection<String> instances) {
        allowed = ImmutableSet.copyOf(instances);
    }

    public static boolean allows(String instance) {
        return allowed.contains(instance);
    }

    public static ImmutableSet<String> current() {
        return allowed;
    }
}
