package work.lcod.dispatch.runtime;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.dispatch.alias.AliasMatcher;

/**
 * A registered command: the aliases that select it and the executor that runs it.
 */
public record CommandMetadata(List<AliasMatcher> aliases, ExecutorData executor) {
    public CommandMetadata {
        Objects.requireNonNull(executor, "executor");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        if (aliases.isEmpty()) {
            throw new IllegalArgumentException("Command '" + executor.name() + "' declares no alias");
        }
    }

    public Optional<AliasMatcher> matchingAlias(String input) {
        for (AliasMatcher alias : aliases) {
            if (alias.matches(input)) {
                return Optional.of(alias);
            }
        }
        return Optional.empty();
    }

    public String name() {
        return executor.name();
    }
}
