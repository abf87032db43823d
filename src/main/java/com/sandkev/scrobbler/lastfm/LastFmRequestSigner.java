package com.sandkev.scrobbler.lastfm;

import lombok.RequiredArgsConstructor;
import org.springframework.util.DigestUtils;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Last.fm request signing, see https://www.last.fm/api/authspec#_8-signing-calls.
 * <pre>
 *   api_sig = md5( k1 v1 k2 v2 ... secret )   pairs sorted by key, api_key included
 * </pre>
 * The {@code format} parameter is not part of the signature input, it is added afterwards.
 */
@RequiredArgsConstructor
public class LastFmRequestSigner {

    private final String apiKey;
    private final String secret;

    public String apiKey() {
        return apiKey;
    }

    /** Returns the parameters to send: the input plus api_key, api_sig and format, sorted by key. */
    public LinkedHashMap<String, String> sign(Map<String, String> params) {
        var sorted = new TreeMap<String, String>(params);
        sorted.put("api_key", apiKey);

        var signInput = new StringBuilder();
        sorted.forEach((k, v) -> signInput.append(k).append(v));
        signInput.append(secret);

        var out = new LinkedHashMap<String, String>(sorted);
        out.put("api_sig", DigestUtils.md5DigestAsHex(signInput.toString().getBytes(StandardCharsets.UTF_8)));
        out.put("format", "json");
        return out;
    }

    /**
     * key=value pairs joined by '&amp;'. Everything except RFC 3986 unreserved characters is
     * percent-encoded, including '/', and a space becomes %20 rather than '+'.
     */
    public static String encode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> UriUtils.encode(e.getKey(), StandardCharsets.UTF_8)
                        + "=" + UriUtils.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
