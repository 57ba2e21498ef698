package com.citewise.model;

import lombok.Value;

/**
 * Breadth/depth preset for one research invocation.
 *
 * - quick: few sources, short extracts
 * - default: balanced, overridable from configuration
 * - deep: more sources, longer extracts, longer answers
 */
@Value
public class ResearchMode {

    public static final String QUICK = "quick";
    public static final String DEFAULT = "default";
    public static final String DEEP = "deep";

    String name;

    /**
     * Number of unique URLs to gather and fetch.
     */
    int sourceCount;

    /**
     * Maximum characters extracted per page.
     */
    int snippetChars;

    public boolean isDeep() {
        return DEEP.equals(name);
    }
}
