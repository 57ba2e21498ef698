package com.citewise.query;

import com.citewise.config.CitewiseProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a conversational question into terse search strings. Rule based, no I/O.
 */
@Component
public class QueryTransformer {

    // Conversational lead-ins that add nothing to a keyword search
    private static final Pattern CONVERSATIONAL_PREFIX = Pattern.compile(
            "^(?:give\\s+me|tell\\s+me|show\\s+me|find\\s+me|can\\s+you|please\\s+"
                    + "|i\\s+want\\s+to\\s+know|what(?:'s|\\s+is|\\s+are)|\\w+\\s+me\\s+)\\s*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_ARTICLE = Pattern.compile("^(?:about|the)\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern FILLER_PHRASE = Pattern.compile(
            "\\b(?:a\\s+summary\\s+of|an?\\s+overview\\s+of"
                    + "|some\\s+info(?:rmation)?\\s+(?:about|on)"
                    + "|info(?:rmation)?\\s+(?:about|on))\\b",
            Pattern.CASE_INSENSITIVE);

    // Vague temporal references; replaced with the current year so results skew recent
    private static final List<Pattern> TEMPORAL = List.of(
            Pattern.compile("\\bthis\\s+week\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bthis\\s+month\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bthis\\s+year\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\btoday\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bright\\s+now\\b", Pattern.CASE_INSENSITIVE));

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<Pattern> VERSUS_SEPARATORS = List.of(
            Pattern.compile(" vs ", Pattern.CASE_INSENSITIVE | Pattern.LITERAL),
            Pattern.compile(" versus ", Pattern.CASE_INSENSITIVE | Pattern.LITERAL));

    private static final Pattern AND_SEPARATOR = Pattern.compile(" and ", Pattern.CASE_INSENSITIVE | Pattern.LITERAL);

    private static final int PREFIX_PASSES = 3;

    private final Clock clock;
    private final int maxLength;
    private final int andSplitMinLength;
    private final int andSplitMinPartLength;

    @Autowired
    public QueryTransformer(Clock clock, CitewiseProperties properties) {
        this(clock,
                properties.getQuery().getMaxLength(),
                properties.getQuery().getAndSplitMinLength(),
                properties.getQuery().getAndSplitMinPartLength());
    }

    public QueryTransformer(Clock clock, int maxLength, int andSplitMinLength, int andSplitMinPartLength) {
        this.clock = clock;
        this.maxLength = maxLength;
        this.andSplitMinLength = andSplitMinLength;
        this.andSplitMinPartLength = andSplitMinPartLength;
    }

    /**
     * Convert a natural-language question into a keyword-style search query.
     *
     * <pre>
     * "give me a summary of the top AI news for this week" -> "the top AI news for 2026"
     * "tell me about Python asyncio"                        -> "Python asyncio"
     * </pre>
     */
    public String toSearchQuery(String text) {
        String query = text == null ? "" : text.strip();

        // Nested lead-ins such as "please tell me" need more than one pass
        for (int i = 0; i < PREFIX_PASSES; i++) {
            String cleaned = CONVERSATIONAL_PREFIX.matcher(query).replaceFirst("").strip();
            if (cleaned.equals(query)) {
                break;
            }
            query = cleaned;
        }

        query = LEADING_ARTICLE.matcher(query).replaceFirst("").strip();
        query = FILLER_PHRASE.matcher(query).replaceAll("").strip();
        query = WHITESPACE.matcher(query).replaceAll(" ").strip();

        String year = String.valueOf(LocalDate.now(clock).getYear());
        for (Pattern temporal : TEMPORAL) {
            query = temporal.matcher(query).replaceAll(year);
        }

        return query.length() > maxLength ? query.substring(0, maxLength) : query;
    }

    /**
     * Split a query into 1-3 sub-queries.
     *
     * - "X vs Y" / "X versus Y": search each side separately
     * - long query joined by " and ": the whole query plus each half
     * - anything else: the query itself
     *
     * @return distinct sub-queries, never empty
     */
    public List<String> decompose(String query) {
        String q = query == null ? "" : query.strip();

        for (Pattern separator : VERSUS_SEPARATORS) {
            Matcher matcher = separator.matcher(q);
            if (matcher.find()) {
                String left = q.substring(0, matcher.start()).strip();
                String right = q.substring(matcher.end()).strip();
                if (!left.isEmpty() && !right.isEmpty()) {
                    return distinct(List.of(left, right));
                }
            }
        }

        Matcher and = AND_SEPARATOR.matcher(q);
        if (q.length() > andSplitMinLength && and.find()) {
            String left = q.substring(0, and.start()).strip();
            String right = q.substring(and.end()).strip();
            if (left.length() > andSplitMinPartLength && right.length() > andSplitMinPartLength) {
                return distinct(List.of(q, left, right));
            }
        }

        return List.of(q);
    }

    private static List<String> distinct(List<String> queries) {
        return new ArrayList<>(new LinkedHashSet<>(queries));
    }
}
