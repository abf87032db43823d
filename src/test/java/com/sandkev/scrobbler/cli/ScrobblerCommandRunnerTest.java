package com.sandkev.scrobbler.cli;

import com.sandkev.scrobbler.lastfm.LastFmAuthService;
import com.sandkev.scrobbler.lastfm.LastFmScrobbleService;
import com.sandkev.scrobbler.lastfm.history.LastFmHistoryImporter;
import com.sandkev.scrobbler.legacy.LegacyListenImporter;
import com.sandkev.scrobbler.listenbrainz.ListenBrainzSubmitService;
import com.sandkev.scrobbler.shared.error.RemoteServiceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(OutputCaptureExtension.class)
class ScrobblerCommandRunnerTest {

    private final LastFmScrobbleService lastFm = mock(LastFmScrobbleService.class);
    private final ListenBrainzSubmitService listenBrainz = mock(ListenBrainzSubmitService.class);
    private final ScrobblerCommandRunner runner = new ScrobblerCommandRunner(
            mock(LastFmAuthService.class), lastFm, listenBrainz,
            mock(LastFmHistoryImporter.class), mock(LegacyListenImporter.class));

    @Test
    void listenBrainzRejectionLogsTheStatusWithoutRepeatingTheBody(CapturedOutput output) throws Exception {
        when(listenBrainz.submitPending())
                .thenThrow(new RemoteServiceException("ListenBrainz", 400, "{\"error\": \"JSON document is too large.\"}"));

        runner.run(new DefaultApplicationArguments("submit-listens", "db.sqlite3"));

        assertThat(runner.getExitCode()).isEqualTo(1);
        assertThat(output).contains("ListenBrainz failed with status 400");
        assertThat(output).doesNotContain("JSON document is too large.");
    }

    @Test
    void lastFmRejectionLogsTheBody(CapturedOutput output) throws Exception {
        when(lastFm.scrobblePending())
                .thenThrow(new RemoteServiceException("Last.fm", 403, "{\"error\": 9, \"message\": \"Invalid session key\"}"));

        runner.run(new DefaultApplicationArguments("scrobble", "db.sqlite3"));

        assertThat(runner.getExitCode()).isEqualTo(1);
        assertThat(output).contains("Last.fm failed with status 403", "Invalid session key");
    }

    @Test
    void successExitsWithZero() throws Exception {
        when(lastFm.scrobblePending()).thenReturn(3);

        runner.run(new DefaultApplicationArguments("scrobble", "db.sqlite3"));

        assertThat(runner.getExitCode()).isZero();
    }
}
