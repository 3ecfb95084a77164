package com.purchasingpower.fullcycle.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extraction of structured payloads from free-form LLM text.
 *
 * <p>Pure functions only. LLMs wrap answers in markdown fences, add "Here is the file:" lines or
 * trail off with explanations; everything that deals with that lives here.
 */
public final class LlmResponseParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```[\\w.+#-]*[ \\t]*\\r?\\n([\\s\\S]*?)```");

    private static final Pattern PREAMBLE_LINE = Pattern.compile(
            "^(here('s| is| are)|below is|sure[,!.]|certainly[,!.]|of course[,!.]|okay[,!.]|ok[,!.]"
                    + "|the (updated|complete|full|fixed|corrected|modified|new) (file|code|content|version))\\b.*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern STRAY_HEADING = Pattern.compile(
            "^#{1,6}\\s+(updated|modified|fixed|corrected|complete|full|new|final)\\b.*",
            Pattern.CASE_INSENSITIVE);

    private LlmResponseParser() {
    }

    /**
     * Find the first balanced JSON object in the text. Braces inside string literals are ignored.
     *
     * @return the object text, or empty if the text holds no complete object
     */
    public static Optional<String> extractJsonObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findMatchingBrace(text, start);
            if (end > 0) {
                return Optional.of(text.substring(start, end + 1));
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private static int findMatchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * All fenced code blocks, in order of appearance.
     */
    public static List<String> extractFencedBlocks(String text) {
        List<String> blocks = new ArrayList<>();
        if (text == null) {
            return blocks;
        }
        Matcher matcher = FENCED_BLOCK.matcher(text);
        while (matcher.find()) {
            blocks.add(matcher.group(1));
        }
        return blocks;
    }

    /**
     * Turn an LLM answer into file content.
     *
     * <ol>
     *   <li>If the answer contains a complete fenced block, use the largest one.</li>
     *   <li>Otherwise drop a dangling opening or closing fence line.</li>
     *   <li>Drop leading preamble lines ("Here is the updated file:") and stray headings
     *       ("## Updated file").</li>
     * </ol>
     * The result ends with exactly one newline, or is empty.
     */
    public static String cleanCode(String response) {
        if (response == null || response.isBlank()) {
            return "";
        }

        String content = response;
        List<String> blocks = extractFencedBlocks(response);
        if (!blocks.isEmpty()) {
            content = blocks.stream().max((a, b) -> Integer.compare(a.length(), b.length())).orElse(content);
        } else {
            content = stripDanglingFences(content);
        }

        List<String> lines = new ArrayList<>(content.lines().toList());
        while (!lines.isEmpty()) {
            String first = lines.get(0).trim();
            if (first.isEmpty() || PREAMBLE_LINE.matcher(first).matches() || STRAY_HEADING.matcher(first).matches()) {
                lines.remove(0);
            } else {
                break;
            }
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
    }

    private static String stripDanglingFences(String content) {
        String trimmed = content.strip();
        if (trimmed.startsWith("```")) {
            int newline = trimmed.indexOf('\n');
            trimmed = newline < 0 ? "" : trimmed.substring(newline + 1);
        }
        if (trimmed.endsWith("```")) {
            trimmed = trimmed.substring(0, trimmed.length() - 3);
        }
        return trimmed;
    }

    /**
     * Number of lines as an editor would show them; empty text has zero lines.
     */
    public static int countLines(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) text.lines().count();
    }
}
