package com.sandkev.scrobbler.lastfm;

import java.util.Map;

/** Raw Last.fm calls; each returns the response body as received so failures can be reported verbatim. */
public interface LastFmSignedClient {
    String post(Map<String, String> params);      // signed, form body
    String get(Map<String, String> params);       // signed, query string
    String getPublic(Map<String, String> params); // UNSIGNED, api_key + format only
}
