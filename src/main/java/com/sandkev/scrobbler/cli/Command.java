package com.sandkev.scrobbler.cli;

import java.util.Arrays;
import java.util.Optional;

public enum Command {
    AUTHENTICATE("authenticate", 0),
    SCROBBLE("scrobble", 0),
    SUBMIT_LISTENS("submit-listens", 0),
    IMPORT_HISTORY("import-history", 0),
    IMPORT_HISTORY_INCREMENTAL("import-history-incremental", 0),
    SYNC("sync", 0),
    IMPORT_EVENTS("import-events", 1);

    private final String cliName;
    private final int extraArgs;

    Command(String cliName, int extraArgs) {
        this.cliName = cliName;
        this.extraArgs = extraArgs;
    }

    public String cliName() {
        return cliName;
    }

    /** Positional arguments after the store path. */
    public int extraArgs() {
        return extraArgs;
    }

    public static Optional<Command> byName(String name) {
        return Arrays.stream(values()).filter(c -> c.cliName.equals(name)).findFirst();
    }
}
