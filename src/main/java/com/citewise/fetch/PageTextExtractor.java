package com.citewise.fetch;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects the visible text of a page, discarding scripts, styles and navigation chrome.
 *
 * States:
 * <pre>
 *   IDLE           text is collected
 *   SUPPRESSED(n)  inside n nested noise elements; text is dropped
 *   IN_PAGE_TITLE  inside &lt;title&gt;; text goes to the title
 * </pre>
 * Script and style bodies are data nodes in jsoup and never reach {@link #head}
 * as text; they are still counted as noise so nothing nested in them leaks.
 */
public class PageTextExtractor implements NodeVisitor {

    static final Set<String> NOISE_ELEMENTS = Set.of(
            "script", "style", "nav", "footer", "header", "aside", "noscript", "form");

    enum State {
        IDLE,
        SUPPRESSED,
        IN_PAGE_TITLE
    }

    private final List<String> chunks = new ArrayList<>();
    private final StringBuilder title = new StringBuilder();

    private int suppressedDepth;
    private boolean inTitle;

    /**
     * Extract from a complete document.
     */
    public static PageTextExtractor extract(String html) {
        PageTextExtractor extractor = new PageTextExtractor();
        NodeTraversor.traverse(extractor, Jsoup.parse(html == null ? "" : html));
        return extractor;
    }

    State getState() {
        if (suppressedDepth > 0) {
            return State.SUPPRESSED;
        }
        return inTitle ? State.IN_PAGE_TITLE : State.IDLE;
    }

    @Override
    public void head(Node node, int depth) {
        if (node instanceof Element element) {
            String name = element.normalName();
            if (NOISE_ELEMENTS.contains(name)) {
                suppressedDepth++;
            } else if ("title".equals(name) && suppressedDepth == 0) {
                inTitle = true;
            }
        } else if (node instanceof TextNode textNode) {
            text(textNode.getWholeText());
        }
    }

    @Override
    public void tail(Node node, int depth) {
        if (!(node instanceof Element element)) {
            return;
        }
        String name = element.normalName();
        if (NOISE_ELEMENTS.contains(name) && suppressedDepth > 0) {
            suppressedDepth--;
        }
        if ("title".equals(name)) {
            inTitle = false;
        }
    }

    private void text(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return;
        }
        switch (getState()) {
            case IN_PAGE_TITLE -> title.append(trimmed);
            case IDLE -> chunks.add(trimmed);
            case SUPPRESSED -> {
                // dropped
            }
        }
    }

    public String getTitle() {
        return title.toString().strip();
    }

    /**
     * Visible text joined with single spaces, clipped to {@code maxChars}.
     */
    public String getText(int maxChars) {
        String joined = String.join(" ", chunks);
        return joined.length() > maxChars ? joined.substring(0, Math.max(0, maxChars)) : joined;
    }
}
