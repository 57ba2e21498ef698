package com.citewise.research;

import com.citewise.config.CitewiseProperties;
import com.citewise.fetch.PageFetchClient;
import com.citewise.http.ErrorCategory;
import com.citewise.http.RetryPolicy;
import com.citewise.model.Message;
import com.citewise.model.ResearchMode;
import com.citewise.model.SearchResult;
import com.citewise.model.Source;
import com.citewise.provider.ChatProvider;
import com.citewise.provider.LlmCapability;
import com.citewise.provider.ProviderService;
import com.citewise.query.QueryTransformer;
import com.citewise.search.SearchClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Research pipeline: decompose, search, deduplicate, fetch, summarise.
 *
 * Retrieval failures never escape: searches and fetches degrade to empty data
 * and snippet fallbacks. The language model is called at most once per
 * invocation, and only after at least one search result survived.
 */
@Slf4j
@Service
public class ResearchService {

    public static final String NO_RESULTS_MESSAGE = "I couldn't find any search results for that query. "
            + "Please try rephrasing or try again later.";

    public static final String PERMISSION_DENIED_MESSAGE = "I don't have access to that resource (403). "
            + "Please check permissions / sharing settings.";

    public static final String PROVIDER_FAILURE_MESSAGE = "The AI provider failed to summarise the results. "
            + "Please try again in a moment.";

    public static final String TRUNCATION_MARKER = "\n\n(response truncated)";

    private final QueryTransformer queryTransformer;
    private final SearchClient searchClient;
    private final PageFetchClient pageFetchClient;
    private final ProviderService providerService;
    private final CitewiseProperties properties;

    public ResearchService(
            QueryTransformer queryTransformer,
            SearchClient searchClient,
            PageFetchClient pageFetchClient,
            ProviderService providerService,
            CitewiseProperties properties) {
        this.queryTransformer = queryTransformer;
        this.searchClient = searchClient;
        this.pageFetchClient = pageFetchClient;
        this.providerService = providerService;
        this.properties = properties;
    }

    /**
     * Research with the configured provider and model, cache TTL and default-mode overrides.
     */
    public Mono<String> research(String query, String modeName) {
        CitewiseProperties.ResearchConfig research = properties.getResearch();
        return Mono.fromCallable(providerService::getResearchProvider)
                .flatMap(provider -> research(
                        query,
                        withModel(provider, research.getModel()),
                        modeName,
                        properties.getSearch().getCacheTtl(),
                        research.getDefaultSources(),
                        research.getDefaultSnippetChars()));
    }

    /**
     * The provider bound to the research model; the provider itself when no model is configured.
     */
    static LlmCapability withModel(ChatProvider provider, String model) {
        if (model == null || model.isBlank()) {
            return provider;
        }
        return (messages, system) -> provider.complete(messages, system, model);
    }

    /**
     * Run the full pipeline and return a cited plain-text answer or a fixed user-facing message.
     *
     * @param query                the user's question
     * @param llm                  summarisation capability, called at most once
     * @param modeName             quick, default or deep; anything else means default
     * @param ttl                  search cache TTL
     * @param sourceCountOverride  replaces the default mode's source count when non-null
     * @param snippetCharsOverride replaces the default mode's snippet length when non-null
     */
    public Mono<String> research(
            String query,
            LlmCapability llm,
            String modeName,
            Duration ttl,
            Integer sourceCountOverride,
            Integer snippetCharsOverride) {

        return Mono.defer(() -> {
            ResearchMode mode = resolveMode(modeName, sourceCountOverride, snippetCharsOverride);

            String searchQuery = queryTransformer.toSearchQuery(query);
            List<String> subQueries = queryTransformer.decompose(searchQuery);
            log.info("Research query='{}' searchQuery='{}' mode={} subQueries={}",
                    query, searchQuery, mode.getName(), subQueries);

            return searchAll(subQueries, ttl, mode.getSourceCount())
                    .map(perQuery -> mergeResults(perQuery, mode.getSourceCount()))
                    .flatMap(results -> {
                        if (results.isEmpty()) {
                            log.warn("No search results returned for query '{}'", query);
                            return Mono.just(NO_RESULTS_MESSAGE);
                        }
                        return fetchSources(results, mode)
                                .flatMap(sources -> summarise(query, sources, mode, llm));
                    });
        });
    }

    /**
     * Resolve a preset by name; unknown names fall back to default.
     */
    public ResearchMode resolveMode(String modeName, Integer sourceCountOverride, Integer snippetCharsOverride) {
        String name = modeName == null ? ResearchMode.DEFAULT : modeName.trim().toLowerCase(Locale.ROOT);
        CitewiseProperties.ModeConfig preset = properties.getResearch().getModes().get(name);
        if (preset == null) {
            name = ResearchMode.DEFAULT;
            preset = properties.getResearch().getModes().get(ResearchMode.DEFAULT);
        }

        int sources = preset != null ? preset.getSources() : properties.getResearch().getDefaultSources();
        int snippetChars = preset != null ? preset.getSnippetChars() : properties.getResearch().getDefaultSnippetChars();

        if (ResearchMode.DEFAULT.equals(name)) {
            if (sourceCountOverride != null) {
                sources = sourceCountOverride;
            }
            if (snippetCharsOverride != null) {
                snippetChars = snippetCharsOverride;
            }
        }
        return new ResearchMode(name, sources, snippetChars);
    }

    /**
     * One search per sub-query, concurrently; result lists keep sub-query order.
     */
    private Mono<List<List<SearchResult>>> searchAll(List<String> subQueries, Duration ttl, int maxResults) {
        return Flux.fromIterable(subQueries)
                .flatMapSequential(subQuery -> searchClient.search(subQuery, ttl, maxResults)
                        .defaultIfEmpty(List.of())
                        .onErrorResume(error -> {
                            log.warn("Search for '{}' failed: {}", subQuery, RetryPolicy.describe(error));
                            return Mono.just(List.of());
                        }))
                .collectList();
    }

    /**
     * Flatten in order, keep the first occurrence of each URL, stop at {@code limit}.
     */
    static List<SearchResult> mergeResults(List<List<SearchResult>> perQuery, int limit) {
        Set<String> seenUrls = new HashSet<>();
        List<SearchResult> merged = new ArrayList<>();

        for (List<SearchResult> results : perQuery) {
            for (SearchResult result : results) {
                if (merged.size() >= limit) {
                    return merged;
                }
                if (result.getUrl() != null && !result.getUrl().isEmpty() && seenUrls.add(result.getUrl())) {
                    merged.add(result);
                }
            }
        }
        return merged;
    }

    /**
     * Fetch every page concurrently; each failure only affects its own source.
     */
    private Mono<List<Source>> fetchSources(List<SearchResult> results, ResearchMode mode) {
        return Flux.fromIterable(results)
                .index()
                .flatMapSequential(indexed -> fetchSource(indexed.getT1().intValue() + 1, indexed.getT2(), mode))
                .collectList()
                .doOnNext(sources -> log.info("Assembled {} sources for summarisation", sources.size()));
    }

    private Mono<Source> fetchSource(int index, SearchResult result, ResearchMode mode) {
        return Mono.defer(() -> pageFetchClient.fetchPage(result.getUrl(), mode.getSnippetChars()))
                .map(page -> SourceAssembler.fromPage(index, result, page))
                .switchIfEmpty(Mono.fromSupplier(() -> SourceAssembler.fromFailure(index, result)))
                .onErrorResume(error -> {
                    log.warn("Fetch exception for {}: {}", result.getUrl(), RetryPolicy.describe(error));
                    return Mono.just(SourceAssembler.fromFailure(index, result));
                });
    }

    /**
     * The single language-model call. Failures map to fixed messages and are never retried here.
     */
    private Mono<String> summarise(String query, List<Source> sources, ResearchMode mode, LlmCapability llm) {
        String prompt = PromptBuilder.buildPrompt(query, sources, mode);
        List<Message> messages = List.of(Message.user(prompt));

        return Mono.defer(() -> llm.complete(messages, PromptBuilder.SYSTEM_PROMPT))
                .defaultIfEmpty("")
                .map(this::capLength)
                .onErrorResume(error -> {
                    if (ErrorCategory.of(error) == ErrorCategory.PERMISSION_DENIED) {
                        log.warn("Summarisation refused by provider: {}", RetryPolicy.describe(error));
                        return Mono.just(PERMISSION_DENIED_MESSAGE);
                    }
                    log.error("Summarisation LLM call failed", error);
                    return Mono.just(PROVIDER_FAILURE_MESSAGE);
                });
    }

    private String capLength(String answer) {
        int max = properties.getResearch().getMaxAnswerChars();
        if (answer.length() > max) {
            return answer.substring(0, max) + TRUNCATION_MARKER;
        }
        return answer;
    }
}
