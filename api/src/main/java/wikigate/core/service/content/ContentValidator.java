package wikigate.core.service.content;

import java.util.List;
import java.util.regex.Pattern;

import wikigate.core.model.common.ValidationException;

/**
 * Input checks for content operations. Each check throws {@link ValidationException}.
 */
final class ContentValidator {

    static final int MAX_LIMIT = 50;
    static final int MAX_BATCH_LIMIT = 20;
    static final int MAX_BATCH_SIZE = 10;
    static final int MAX_CONCURRENCY = 5;
    static final int MAX_RADIUS = 100_000;

    private static final Pattern LANGUAGE = Pattern.compile("^[a-z]{2,3}(-[a-z]+)?$");
    private static final Pattern TRENDING_DATE = Pattern.compile("^\\d{4}/\\d{2}/\\d{2}$");

    private ContentValidator() {}

    static String text(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "must not be blank");
        }
        return value.trim();
    }

    static String language(String lang) {
        if (lang == null || !LANGUAGE.matcher(lang).matches()) {
            throw new ValidationException("lang", "must be a language code like 'en' or 'zh-yue', got: " + lang);
        }
        return lang;
    }

    static int range(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new ValidationException(field, "must be between " + min + " and " + max + ", got: " + value);
        }
        return value;
    }

    static double range(String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ValidationException(field, "must be between " + min + " and " + max + ", got: " + value);
        }
        return value;
    }

    static int nonNegative(String field, int value) {
        if (value < 0) {
            throw new ValidationException(field, "must not be negative, got: " + value);
        }
        return value;
    }

    static long positive(String field, long value) {
        if (value <= 0) {
            throw new ValidationException(field, "must be positive, got: " + value);
        }
        return value;
    }

    static List<String> batch(String field, List<String> values) {
        if (values == null || values.isEmpty() || values.size() > MAX_BATCH_SIZE) {
            throw new ValidationException(
                    field, "must hold between 1 and " + MAX_BATCH_SIZE + " entries, got: "
                            + (values == null ? 0 : values.size()));
        }
        values.forEach(value -> text(field, value));
        return values;
    }

    static String trendingDate(String date) {
        if (!TRENDING_DATE.matcher(date).matches()) {
            throw new ValidationException("date", "must have the form yyyy/MM/dd, got: " + date);
        }
        return date;
    }
}
