package com.citewise.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single organic result scraped from the search engine's HTML results page.
 * The url is always an absolute http(s) URL.
 */
@Value
@Builder
public class SearchResult {

    String url;

    String title;

    String snippet;
}
