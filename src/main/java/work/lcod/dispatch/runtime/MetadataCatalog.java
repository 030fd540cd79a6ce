package work.lcod.dispatch.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import work.lcod.dispatch.alias.AliasMatcher;

/**
 * Append-only list of registered commands. Writers swap in a new immutable list under a lock;
 * readers always work on the snapshot current when they started.
 */
final class MetadataCatalog {
    private final Object lock = new Object();
    private volatile List<CommandMetadata> entries = List.of();

    void register(CommandMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        synchronized (lock) {
            var next = new ArrayList<CommandMetadata>(entries.size() + 1);
            next.addAll(entries);
            next.add(metadata);
            entries = List.copyOf(next);
        }
    }

    List<CommandMetadata> snapshot() {
        return entries;
    }

    /**
     * All commands whose aliases match {@code input}, in registration order.
     */
    List<Resolution> resolve(String input) {
        if (input == null) {
            return List.of();
        }
        String lowered = input.toLowerCase(Locale.ROOT);
        var matches = new ArrayList<Resolution>();
        for (CommandMetadata metadata : snapshot()) {
            metadata.matchingAlias(lowered).ifPresent(alias -> matches.add(new Resolution(metadata, alias)));
        }
        return matches;
    }

    /**
     * First-registered match wins.
     */
    Optional<Resolution> resolveFirst(String input) {
        var matches = resolve(input);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    record Resolution(CommandMetadata metadata, AliasMatcher alias) {
        String arguments(String input) {
            return alias.removeMatched(input);
        }
    }
}
