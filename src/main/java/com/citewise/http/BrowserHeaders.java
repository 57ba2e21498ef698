package com.citewise.http;

import org.springframework.http.HttpHeaders;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Browser-like request headers applied to every search and page request.
 * Plain-looking requests are less likely to be served a CAPTCHA or a stripped page.
 */
public final class BrowserHeaders {

    public static final String USER_AGENT =
            "Mozilla/5.0 (X11; Linux x86_64; rv:122.0) Gecko/20100101 Firefox/122.0";

    public static final Map<String, String> DEFAULTS;

    static {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.USER_AGENT, USER_AGENT);
        headers.put(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        headers.put(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5");
        headers.put(HttpHeaders.ACCEPT_ENCODING, "gzip, deflate");
        headers.put("DNT", "1");
        DEFAULTS = Collections.unmodifiableMap(headers);
    }

    private BrowserHeaders() {
    }

    public static void apply(HttpHeaders headers) {
        DEFAULTS.forEach(headers::set);
    }
}
