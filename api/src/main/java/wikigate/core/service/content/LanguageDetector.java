package wikigate.core.service.content;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Script-based language guess. Checks scripts in a fixed order and falls back to {@code en}.
 */
final class LanguageDetector {

    static final String FALLBACK = "en";

    private static final Map<String, Pattern> SCRIPTS = new LinkedHashMap<>();

    static {
        SCRIPTS.put("zh", Pattern.compile("[\\u4e00-\\u9fff]"));
        SCRIPTS.put("ja", Pattern.compile("[\\u3040-\\u309f\\u30a0-\\u30ff]"));
        SCRIPTS.put("ko", Pattern.compile("[\\uac00-\\ud7af]"));
        SCRIPTS.put("ar", Pattern.compile("[\\u0600-\\u06ff]"));
        SCRIPTS.put("ru", Pattern.compile("[\\u0400-\\u04ff]"));
        SCRIPTS.put("th", Pattern.compile("[\\u0e00-\\u0e7f]"));
        SCRIPTS.put("hi", Pattern.compile("[\\u0900-\\u097f]"));
    }

    private LanguageDetector() {}

    static String detect(String text) {
        if (text == null || text.isEmpty()) {
            return FALLBACK;
        }
        return SCRIPTS.entrySet().stream()
                .filter(entry -> entry.getValue().matcher(text).find())
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(FALLBACK);
    }
}
