package com.citewise.research;

import com.citewise.model.ResearchMode;
import com.citewise.model.Source;

import java.util.List;

/**
 * Renders the single summarisation request.
 */
public final class PromptBuilder {

    public static final String SYSTEM_PROMPT = "You are a research assistant. Synthesise a clear, cited answer from the "
            + "web sources provided by the user.\n\n"
            + "Rules:\n"
            + "- Use ONLY the information in the provided sources. "
            + "Do not add knowledge from your training data.\n"
            + "- If sources are insufficient or contradictory, say so explicitly.\n"
            + "- Cite claims with numbered references like [1], [2].\n"
            + "- End with a 'References' section listing each source as:\n"
            + "  [N] Title — domain — URL\n"
            + "- Keep the answer concise (3–6 short paragraphs) unless the mode is 'deep'.\n"
            + "- Use plain text. Do not use Markdown symbols like **, __, or #.";

    static final String CLOSING_INSTRUCTION = "Write a concise, cited answer using only the sources above. "
            + "Follow the rules in the system prompt.";

    static final String DEEP_CLOSING_INSTRUCTION = "Write a thorough, cited answer using only the sources above. "
            + "Cover every relevant source and follow the rules in the system prompt.";

    private PromptBuilder() {
    }

    /**
     * User message listing every source, then the question and the closing instruction.
     *
     * @param query   the user's original, uncleaned question
     * @param sources sources in citation order
     * @param mode    named in the prompt so the model can apply the length rule
     */
    public static String buildPrompt(String query, List<Source> sources, ResearchMode mode) {
        StringBuilder prompt = new StringBuilder("Sources:\n\n");

        for (Source source : sources) {
            prompt.append('[').append(source.getIndex()).append("] ").append(source.getTitle()).append('\n')
                    .append("URL: ").append(source.getUrl()).append('\n')
                    .append(source.getText()).append("\n\n");
        }

        prompt.append("Query: ").append(query).append('\n')
                .append("Mode: ").append(mode.getName()).append("\n\n")
                .append(mode.isDeep() ? DEEP_CLOSING_INSTRUCTION : CLOSING_INSTRUCTION);
        return prompt.toString();
    }
}
