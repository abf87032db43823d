package com.sandkev.scrobbler.cli;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Positional command line: {@code <command> <store.sqlite3> [extra]}.
 * Arguments starting with "--" are Spring properties and are skipped here.
 */
public record CliArgs(Command command, Path store, List<String> extra) {

    public static final String USAGE = """
            Usage: scrobbler <command> <musium.sqlite3> [args]

            Commands:
              authenticate                 Authorize with Last.fm and print a session key.
              scrobble                     Scrobble pending listens to Last.fm.
              submit-listens               Submit pending listens to ListenBrainz.
              import-history               Import the full Last.fm history.
              import-history-incremental   Import the recent Last.fm history.
              sync                         scrobble, then import-history-incremental.
              import-events <events.jsonl> Load listens from an old playback event log.

            Environment:
              LAST_FM_API_KEY, LAST_FM_SECRET   Last.fm API account, https://www.last.fm/api/account/create
              LAST_FM_SESSION_KEY               Printed by authenticate, needed for scrobble.
              LAST_FM_USER                      User whose history is imported.
              LISTENBRAINZ_USER_TOKEN           From https://listenbrainz.org/profile/
            """;

    public static CliArgs parse(String... args) {
        List<String> positional = Arrays.stream(args).filter(a -> !a.startsWith("--")).toList();
        if (positional.size() < 2) {
            throw new IllegalArgumentException("Expected a command and a store path");
        }
        Command command = Command.byName(positional.get(0))
                .orElseThrow(() -> new IllegalArgumentException("Unknown command: " + positional.get(0)));
        List<String> extra = positional.subList(2, positional.size());
        if (extra.size() != command.extraArgs()) {
            throw new IllegalArgumentException(command.cliName() + " takes " + command.extraArgs()
                    + " argument(s) after the store path, got " + extra.size());
        }
        return new CliArgs(command, Path.of(positional.get(1)), List.copyOf(extra));
    }

    public String jdbcUrl() {
        return "jdbc:sqlite:" + store;
    }
}
