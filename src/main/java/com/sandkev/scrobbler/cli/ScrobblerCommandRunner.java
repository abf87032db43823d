package com.sandkev.scrobbler.cli;

import com.sandkev.scrobbler.lastfm.LastFmAuthService;
import com.sandkev.scrobbler.lastfm.LastFmScrobbleService;
import com.sandkev.scrobbler.lastfm.LastFmSession;
import com.sandkev.scrobbler.lastfm.history.ImportResult;
import com.sandkev.scrobbler.lastfm.history.LastFmHistoryImporter;
import com.sandkev.scrobbler.legacy.LegacyListenImporter;
import com.sandkev.scrobbler.listenbrainz.ListenBrainzSubmitService;
import com.sandkev.scrobbler.shared.error.ProtocolInvariantException;
import com.sandkev.scrobbler.shared.error.RemoteServiceException;
import com.sandkev.scrobbler.shared.error.ScrobblerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/** Runs the command given on the command line; only active when started through ScrobblerApplication.main. */
@Slf4j
@Component
@ConditionalOnProperty("scrobbler.command")
@RequiredArgsConstructor
public class ScrobblerCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final LastFmAuthService auth;
    private final LastFmScrobbleService lastFm;
    private final ListenBrainzSubmitService listenBrainz;
    private final LastFmHistoryImporter history;
    private final LegacyListenImporter legacy;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        CliArgs cli = CliArgs.parse(args.getSourceArgs());
        try {
            execute(cli);
        } catch (ProtocolInvariantException e) {
            log.error("{}\nResponse body:\n{}", e.getMessage(), e.getResponseBody());
            exitCode = 1;
        } catch (RemoteServiceException e) {
            if (cli.command() == Command.SUBMIT_LISTENS) {
                // the submit service already logged the body
                log.error("{} failed with status {}", e.getService(), e.getStatus());
            } else {
                log.error("{} failed with status {}:\n{}", e.getService(), e.getStatus(), e.getResponseBody());
            }
            exitCode = 1;
        } catch (ScrobblerException e) {
            log.error("{} aborted: {}", cli.command().cliName(), e.getMessage(), e);
            exitCode = 1;
        }
    }

    private void execute(CliArgs cli) throws IOException {
        switch (cli.command()) {
            case AUTHENTICATE -> authenticate();
            case SCROBBLE -> lastFm.scrobblePending();
            case SUBMIT_LISTENS -> listenBrainz.submitPending();
            case IMPORT_HISTORY -> report(history.importFull());
            case IMPORT_HISTORY_INCREMENTAL -> report(history.importIncremental());
            case SYNC -> {
                lastFm.scrobblePending();
                report(history.importIncremental());
            }
            case IMPORT_EVENTS -> legacy.importLog(Path.of(cli.extra().get(0)));
        }
    }

    private void authenticate() throws IOException {
        String token = auth.requestToken();
        System.out.println("Please authorize the application at the following page:\n");
        System.out.println(auth.authorizeUrl(token) + "\n");
        System.out.println("Press Enter to continue.");
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).readLine();

        LastFmSession session = auth.fetchSession(token);
        System.out.println("\nScrobbling authorized by user " + session.name() + ".");
        System.out.println("Please set the following environment variable when scrobbling:\n");
        System.out.println("LAST_FM_SESSION_KEY=" + session.key());
    }

    private static void report(ImportResult r) {
        log.info("Import done after {} pages: {} new listens, {} staged vs {} on Last.fm{}",
                r.pagesFetched(), r.rowsInserted(), r.localCount(), r.remoteTotal(),
                r.reconciled() ? "" : " (counts differ)");
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
