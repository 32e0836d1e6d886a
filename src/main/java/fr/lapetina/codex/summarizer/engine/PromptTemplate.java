package fr.lapetina.codex.summarizer.engine;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompt templates sent to providers.
 *
 * A template renders as a system block followed by a human block. Placeholders
 * are written {@code {name}} and substituted in a single pass, so braces inside
 * substituted content are left untouched.
 */
public enum PromptTemplate {

    FILE_SUMMARY(
            "You are a senior software engineer analyzing code. "
                    + "Provide a concise, technical summary of the given code file. "
                    + "Focus on:\n"
                    + "• Primary purpose and functionality\n"
                    + "• Key data structures and their roles\n"
                    + "• Public API/interface (functions, methods, exports)\n"
                    + "• Important algorithms or business logic\n"
                    + "• Dependencies and integrations\n"
                    + "• Notable patterns or architectural decisions\n\n"
                    + "Be precise and use technical terminology. "
                    + "Limit response to 300 tokens maximum.",
            "File: {file_path}\n"
                    + "Language: {language}\n"
                    + "Content:\n{content}"
    ),

    CHUNK_SUMMARY(
            "You are analyzing a code chunk. Provide a brief summary focusing on:\n"
                    + "• What this code does\n"
                    + "• Key functions/methods and their purpose\n"
                    + "• Important data structures\n"
                    + "• Any notable patterns or algorithms\n\n"
                    + "Keep it concise (under 150 tokens).",
            "Chunk type: {chunk_type}\n"
                    + "Language: {language}\n"
                    + "Content:\n{content}"
    ),

    AGGREGATE_SUMMARY(
            "Combine and synthesize the following file summaries into a cohesive "
                    + "project overview. Organize by:\n"
                    + "• Project structure and architecture\n"
                    + "• Key modules and their responsibilities\n"
                    + "• Main functionality and features\n"
                    + "• Technology stack and dependencies\n"
                    + "• Notable patterns and design decisions\n\n"
                    + "Create a professional summary suitable for technical documentation.",
            "File summaries:\n{summaries}"
    );

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private final String system;
    private final String human;

    PromptTemplate(String system, String human) {
        this.system = system;
        this.human = human;
    }

    public String getSystem() {
        return system;
    }

    public String getHuman() {
        return human;
    }

    /**
     * Renders the template. Unknown placeholders are kept verbatim.
     */
    public String format(Map<String, String> values) {
        return "System: " + system + "\nHuman: " + substitute(human, values);
    }

    private static String substitute(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group(0);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
