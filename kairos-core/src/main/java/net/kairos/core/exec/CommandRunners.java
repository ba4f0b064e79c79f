package net.kairos.core.exec;

import net.kairos.core.model.ExecutionKind;

import java.net.http.HttpClient;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class CommandRunners {
    private final Map<ExecutionKind, CommandRunner> byKind = new EnumMap<>(ExecutionKind.class);

    public CommandRunners(List<? extends CommandRunner> runners) {
        for (CommandRunner r : runners) {
            if (byKind.putIfAbsent(r.kind(), r) != null) {
                throw new IllegalArgumentException("duplicate runner for " + r.kind());
            }
        }
    }

    public static CommandRunners defaults() {
        return new CommandRunners(List.of(new ShellCommandRunner(), new HttpCommandRunner(HttpClient.newHttpClient())));
    }

    public Optional<CommandRunner> forKind(ExecutionKind kind) {
        return Optional.ofNullable(kind == null ? null : byKind.get(kind));
    }
}
