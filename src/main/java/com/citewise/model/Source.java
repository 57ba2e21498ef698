package com.citewise.model;

import lombok.Builder;
import lombok.Value;

/**
 * One numbered source handed to the summarisation prompt.
 * The index is 1-based and matches the citation number in the answer.
 */
@Value
@Builder
public class Source {

    int index;

    String title;

    String url;

    String text;
}
