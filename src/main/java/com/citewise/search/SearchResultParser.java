package com.citewise.search;

import com.citewise.model.SearchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Extracts (url, title, snippet) triples from the search engine's HTML results page.
 *
 * State machine driven by jsoup's element enter/exit callbacks:
 * <pre>
 *   IDLE       --a.result__a-->        IN_TITLE   (pending result: url + title)
 *   IDLE       --*.result__snippet-->  IN_SNIPPET (pending result: snippet)
 *   IN_TITLE   --matching exit-->      IDLE
 *   IN_SNIPPET --matching exit-->      IDLE, pending result emitted
 * </pre>
 * Depth is counted inside the active element so nested markup does not close
 * it early. A title anchor that arrives while a previous result is still
 * pending flushes that result without a snippet.
 */
public class SearchResultParser implements NodeVisitor {

    static final String TITLE_CLASS = "result__a";
    static final String SNIPPET_CLASS = "result__snippet";

    enum State {
        IDLE,
        IN_TITLE,
        IN_SNIPPET
    }

    private final List<SearchResult> results = new ArrayList<>();

    private State state = State.IDLE;
    private int depth;

    private String pendingUrl = "";
    private final StringBuilder pendingTitle = new StringBuilder();
    private final StringBuilder pendingSnippet = new StringBuilder();

    /**
     * Parse a complete results page.
     */
    public static List<SearchResult> parse(String html) {
        SearchResultParser parser = new SearchResultParser();
        NodeTraversor.traverse(parser, Jsoup.parse(html == null ? "" : html));
        return parser.finish();
    }

    /**
     * Flush a trailing pending result and return everything parsed so far.
     */
    public List<SearchResult> finish() {
        flushPending();
        state = State.IDLE;
        depth = 0;
        return Collections.unmodifiableList(results);
    }

    State getState() {
        return state;
    }

    @Override
    public void head(Node node, int nodeDepth) {
        if (node instanceof Element element) {
            enter(element);
        } else if (node instanceof TextNode textNode) {
            text(textNode.getWholeText());
        }
    }

    @Override
    public void tail(Node node, int nodeDepth) {
        if (node instanceof Element && state != State.IDLE) {
            depth--;
            if (depth <= 0) {
                closeActiveElement();
            }
        }
    }

    private void enter(Element element) {
        if (state != State.IDLE) {
            depth++;
            return;
        }

        Set<String> classes = element.classNames();
        if (classes.contains(TITLE_CLASS)) {
            flushPending();
            pendingUrl = RedirectUrlResolver.resolve(element.attr("href"));
            state = State.IN_TITLE;
            depth = 1;
        } else if (classes.contains(SNIPPET_CLASS)) {
            pendingSnippet.setLength(0);
            state = State.IN_SNIPPET;
            depth = 1;
        }
    }

    private void text(String text) {
        if (state == State.IN_TITLE) {
            pendingTitle.append(text);
        } else if (state == State.IN_SNIPPET) {
            pendingSnippet.append(text);
        }
    }

    private void closeActiveElement() {
        if (state == State.IN_SNIPPET) {
            flushPending();
        }
        state = State.IDLE;
        depth = 0;
    }

    private void flushPending() {
        String title = collapse(pendingTitle);
        if (!pendingUrl.isEmpty() && !title.isEmpty() && RedirectUrlResolver.isAbsoluteHttpUrl(pendingUrl)) {
            results.add(SearchResult.builder()
                    .url(pendingUrl)
                    .title(title)
                    .snippet(collapse(pendingSnippet))
                    .build());
        }
        pendingUrl = "";
        pendingTitle.setLength(0);
        pendingSnippet.setLength(0);
    }

    private static String collapse(CharSequence text) {
        return text.toString().replaceAll("\\s+", " ").trim();
    }
}
