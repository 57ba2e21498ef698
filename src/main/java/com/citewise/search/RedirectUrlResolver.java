package com.citewise.search;

import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Resolves result hrefs from the search engine's HTML page to their real destination.
 *
 * Result links are usually wrapped in an internal redirect of the form
 * {@code //duckduckgo.com/l/?uddg=<encoded-url>&rut=...}; the destination is the
 * decoded {@code uddg} parameter.
 */
public final class RedirectUrlResolver {

    private static final String REDIRECT_MARKER = "/l/?";
    private static final String DESTINATION_PARAM = "uddg";
    private static final String ENGINE_ORIGIN = "https://duckduckgo.com";

    private RedirectUrlResolver() {
    }

    /**
     * @return the destination URL, or an empty string when none can be recovered
     */
    public static String resolve(String href) {
        if (href == null || href.isBlank()) {
            return "";
        }
        String link = href.trim();
        if (!link.contains(REDIRECT_MARKER)) {
            return link;
        }

        if (link.startsWith("//")) {
            link = "https:" + link;
        } else if (!link.startsWith("http")) {
            link = ENGINE_ORIGIN + (link.startsWith("/") ? "" : "/") + link;
        }

        try {
            MultiValueMap<String, String> params = UriComponentsBuilder.fromUriString(link)
                    .build()
                    .getQueryParams();
            String destination = params.getFirst(DESTINATION_PARAM);
            return destination == null ? "" : URLDecoder.decode(destination, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /**
     * True for absolute http/https URLs with a host.
     */
    public static boolean isAbsoluteHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            return scheme != null
                    && ("http".equals(scheme.toLowerCase(Locale.ROOT)) || "https".equals(scheme.toLowerCase(Locale.ROOT)))
                    && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
