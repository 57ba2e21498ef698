package com.citewise.model;

import lombok.Builder;
import lombok.Value;

/**
 * Readable text extracted from a fetched web page, clipped at extraction time.
 */
@Value
@Builder
public class PageText {

    String url;

    String title;

    String text;

    /**
     * Failure value: the page could not be fetched or had no usable content.
     */
    public static PageText empty(String url) {
        return new PageText(url, "", "");
    }

    public boolean isEmpty() {
        return (title == null || title.isBlank()) && (text == null || text.isBlank());
    }
}
