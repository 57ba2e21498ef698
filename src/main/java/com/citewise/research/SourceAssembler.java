package com.citewise.research;

import com.citewise.model.PageText;
import com.citewise.model.SearchResult;
import com.citewise.model.Source;

import java.net.URI;

/**
 * Builds prompt sources from search results and fetched pages, falling back to
 * the search snippet so no source slot is ever empty.
 */
public final class SourceAssembler {

    public static final String FETCH_FAILED_PLACEHOLDER = "(text unavailable)";
    public static final String NO_TEXT_PLACEHOLDER = "(no text retrieved)";

    private SourceAssembler() {
    }

    /**
     * Source for a successful fetch: page text and title win, the search result fills gaps.
     */
    public static Source fromPage(int index, SearchResult result, PageText page) {
        if (page == null || page.isEmpty()) {
            return build(index, result, result.getTitle(), nullToEmpty(result.getSnippet()));
        }
        String pageText = page.getText() == null ? "" : page.getText().strip();
        String pageTitle = page.getTitle() == null ? "" : page.getTitle().strip();

        String text = !pageText.isEmpty() ? pageText : nullToEmpty(result.getSnippet());
        String title = !pageTitle.isEmpty() ? pageTitle : result.getTitle();
        return build(index, result, title, text);
    }

    /**
     * Source for a fetch that raised: the search snippet or a placeholder.
     */
    public static Source fromFailure(int index, SearchResult result) {
        String snippet = nullToEmpty(result.getSnippet());
        String text = !snippet.isEmpty() ? snippet : FETCH_FAILED_PLACEHOLDER;
        return build(index, result, result.getTitle(), text);
    }

    private static Source build(int index, SearchResult result, String title, String text) {
        return Source.builder()
                .index(index)
                .title(title == null || title.isBlank() ? domain(result.getUrl()) : title)
                .url(result.getUrl())
                .text(text.isBlank() ? NO_TEXT_PLACEHOLDER : text)
                .build();
    }

    /**
     * Bare host of a URL, e.g. {@code en.wikipedia.org}; the URL itself if it has none.
     */
    public static String domain(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : url;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.strip();
    }
}
