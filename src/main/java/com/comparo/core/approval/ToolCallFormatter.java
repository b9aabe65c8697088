package com.comparo.core.approval;

import com.comparo.core.model.ToolCallRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders tool calls as short human-readable lines for approval prompts and summaries.
 */
@Component
public class ToolCallFormatter {

    private static final Logger log = LoggerFactory.getLogger(ToolCallFormatter.class);
    private static final int PREVIEW_LENGTH = 30;

    private final ObjectMapper objectMapper;

    public ToolCallFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses raw tool input. JSON objects become maps; anything else is kept under {@code raw}.
     */
    public Map<String, Object> parseArguments(String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(rawArguments, new TypeReference<LinkedHashMap<String, Object>>() {});
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            log.debug("Tool arguments are not a JSON object, keeping raw text: {}", e.getOriginalMessage());
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("raw", rawArguments);
            return raw;
        }
    }

    public String displayMessage(String toolName, Map<String, Object> args) {
        Map<String, Object> a = args == null ? Map.of() : args;
        return switch (toolName) {
            case "read_file" -> formatReadFile(a);
            case "grep_search" -> formatGrepSearch(a);
            case "file_search" -> formatFileSearch(a);
            case "semantic_search" -> "Semantic search: \"" + first(a, "unknown query", "query") + "\"";
            case "list_dir" -> "List directory: " + first(a, "unknown directory", "path", "directory");
            case "get_errors" -> sizeOf(a, "filePaths", "file_paths") > 0
                    ? "Get errors in " + sizeOf(a, "filePaths", "file_paths") + " file(s)"
                    : "Get all errors";
            case "replace_string_in_file" -> formatReplaceString(a);
            case "create_file" -> formatCreateFile(a);
            case "run_in_terminal" -> formatRunInTerminal(a);
            case "run_tests" -> formatRunTests(a);
            default -> formatGeneric(toolName, a);
        };
    }

    /**
     * One line describing several tool calls, e.g. {@code 3 tools: read_file(2), list_dir}.
     */
    public String summary(Collection<ToolCallRecord> toolCalls) {
        if (toolCalls.isEmpty()) {
            return "No tools called";
        }
        if (toolCalls.size() == 1) {
            return toolCalls.iterator().next().displayMessage();
        }
        Map<String, Long> counts = toolCalls.stream()
                .collect(Collectors.groupingBy(ToolCallRecord::name, LinkedHashMap::new, Collectors.counting()));
        String tools = counts.entrySet().stream()
                .map(e -> e.getValue() > 1 ? e.getKey() + "(" + e.getValue() + ")" : e.getKey())
                .collect(Collectors.joining(", "));
        return toolCalls.size() + " tools: " + tools;
    }

    private String formatReadFile(Map<String, Object> a) {
        Object file = first(a, "unknown file", "filePath", "file_path");
        Object start = first(a, null, "offset", "start_line");
        Object end = first(a, null, "limit", "end_line");
        if (start != null && end != null) {
            return "Read " + file + " (lines " + start + "-" + end + ")";
        }
        if (start != null) {
            return "Read " + file + " (from line " + start + ")";
        }
        return "Read " + file;
    }

    private String formatGrepSearch(Map<String, Object> a) {
        StringBuilder msg = new StringBuilder("Search for \"")
                .append(first(a, "unknown query", "query", "pattern")).append('"');
        if (Boolean.TRUE.equals(first(a, null, "isRegexp", "is_regexp"))) {
            msg.append(" (regex)");
        }
        Object include = first(a, null, "includePattern", "include_pattern");
        if (include != null) {
            msg.append(" in ").append(include);
        }
        return msg.toString();
    }

    private String formatFileSearch(Map<String, Object> a) {
        String msg = "Find files matching \"" + first(a, "*", "query", "pattern") + "\"";
        Object max = first(a, null, "maxResults", "max_results");
        return max == null ? msg : msg + " (max " + max + ")";
    }

    private String formatReplaceString(Map<String, Object> a) {
        Object file = first(a, "unknown file", "filePath", "file_path");
        Object oldString = first(a, null, "oldString", "old_string");
        if (oldString instanceof String text && first(a, null, "newString", "new_string") != null) {
            return "Replace in " + file + ": \"" + preview(text) + "\"";
        }
        return "Replace in " + file;
    }

    private String formatCreateFile(Map<String, Object> a) {
        Object file = first(a, "unknown file", "filePath", "file_path");
        if (a.get("content") instanceof String content) {
            return "Create " + file + " (" + content.split("\n", -1).length + " lines)";
        }
        return "Create " + file;
    }

    private String formatRunInTerminal(Map<String, Object> a) {
        Object command = first(a, "unknown command", "command");
        if (Boolean.TRUE.equals(first(a, null, "isBackground", "is_background"))) {
            return "Run in terminal (background): " + command;
        }
        return "Run in terminal: " + command;
    }

    private String formatRunTests(Map<String, Object> a) {
        int files = sizeOf(a, "files");
        if (files > 0) {
            return "Run tests in " + files + " file(s)";
        }
        int tests = sizeOf(a, "testNames", "test_names");
        return tests > 0 ? "Run " + tests + " test(s)" : "Run all tests";
    }

    private String formatGeneric(String toolName, Map<String, Object> a) {
        if (a.isEmpty()) {
            return toolName;
        }
        for (Map.Entry<String, Object> entry : a.entrySet()) {
            if (entry.getKey().startsWith("_") || entry.getValue() == null) {
                continue;
            }
            Object value = entry.getValue();
            String text = value instanceof String s ? s : toJson(value);
            return toolName + ": " + entry.getKey() + "=\"" + preview(text) + "\"";
        }
        return toolName + " (" + a.size() + (a.size() == 1 ? " param)" : " params)");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String preview(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }

    private static Object first(Map<String, Object> a, Object fallback, String... keys) {
        for (String key : keys) {
            Object value = a.get(key);
            if (value != null && !"".equals(value)) {
                return value;
            }
        }
        return fallback;
    }

    private static int sizeOf(Map<String, Object> a, String... keys) {
        return first(a, null, keys) instanceof List<?> list ? list.size() : 0;
    }
}
