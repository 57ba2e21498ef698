package com.citewise.research;

import com.citewise.model.ResearchMode;

import java.util.ArrayList;
import java.util.List;

/**
 * A research command in chat form: {@code [--quick|--deep] <question>}.
 * Flags may appear anywhere; the last one wins.
 */
public record ResearchCommand(String mode, String query) {

    public static final String USAGE = "Usage: [--quick|--deep] <your question>\n\n"
            + "Examples:\n"
            + "  Python asyncio explained\n"
            + "  --quick latest AI news\n"
            + "  --deep climate change causes";

    public static ResearchCommand parse(String text) {
        String mode = ResearchMode.DEFAULT;
        List<String> words = new ArrayList<>();

        if (text != null) {
            for (String word : text.trim().split("\\s+")) {
                switch (word) {
                    case "--quick" -> mode = ResearchMode.QUICK;
                    case "--deep" -> mode = ResearchMode.DEEP;
                    default -> {
                        if (!word.isEmpty()) {
                            words.add(word);
                        }
                    }
                }
            }
        }

        return new ResearchCommand(mode, String.join(" ", words));
    }

    public boolean isEmpty() {
        return query.isBlank();
    }
}
