package io.calcport.engine.mapping;

import io.calcport.engine.model.DataType;
import io.calcport.engine.model.Field;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic identifier generation from raw field names.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>strip delimiting brackets and quotes</li>
 *   <li>collapse cryptic copy names ({@code 2022_(copy)_(copy)_780248699807363141})
 *       to their year plus a {@code _copy} marker</li>
 *   <li>lower-case, fold accents, turn every run of other characters into one underscore</li>
 *   <li>prefix names that are empty or start with a digit</li>
 *   <li>suffix reserved words with {@value #RESERVED_SUFFIX}</li>
 *   <li>append {@code _2}, {@code _3}, ... until the name is free</li>
 * </ol>
 */
public final class NameGenerator {

    static final String RESERVED_SUFFIX = "_field";
    static final int CRYPTIC_MIN_LENGTH = 20;
    static final double CRYPTIC_DIGIT_RATIO = 0.6;

    // year, anything, then a separated 9+ digit trailing ID
    private static final Pattern CRYPTIC = Pattern.compile(
            "^((?:19|20)\\d{2})(.*?)[_\\s-]+(\\d{9,})$");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ReservedWords reservedWords;

    public NameGenerator(ReservedWords reservedWords) {
        this.reservedWords = reservedWords;
    }

    /**
     * Generates a unique identifier.
     *
     * @param rawName  The raw field name, delimiters allowed
     * @param dataType Decides the prefix for names starting with a digit
     * @param taken    Whether an identifier is already held by another field
     */
    public String generate(String rawName, DataType dataType, Predicate<String> taken) {
        String base = baseName(rawName, dataType);
        if (!taken.test(base)) {
            return base;
        }
        int counter = 2;
        while (taken.test(base + "_" + counter)) {
            counter++;
        }
        return base + "_" + counter;
    }

    /**
     * The identifier before collision handling.
     */
    public String baseName(String rawName, DataType dataType) {
        String cleaned = Field.stripDelimiters(rawName == null ? "" : rawName);
        String stem = crypticYear(cleaned).map(year -> year + "_copy").orElse(cleaned);

        String name = normalize(stem);
        if (name.isEmpty()) {
            name = prefix(dataType) + "unnamed";
        } else if (Character.isDigit(name.charAt(0))) {
            name = prefix(dataType) + name;
        }
        if (reservedWords.isReserved(name)) {
            name = name + RESERVED_SUFFIX;
        }
        return name;
    }

    /**
     * Human-facing label for a raw name: delimiters stripped, cryptic IDs dropped,
     * underscores shown as spaces.
     */
    public static String displayName(String rawName) {
        String cleaned = Field.stripDelimiters(rawName == null ? "" : rawName);
        if (crypticYear(cleaned).isPresent()) {
            Matcher m = CRYPTIC.matcher(cleaned);
            if (m.matches()) {
                cleaned = m.group(1) + m.group(2);
            }
        }
        return WHITESPACE.matcher(cleaned.replace('_', ' ')).replaceAll(" ").trim();
    }

    static Optional<String> crypticYear(String cleaned) {
        if (cleaned.length() <= CRYPTIC_MIN_LENGTH) {
            return Optional.empty();
        }
        Matcher m = CRYPTIC.matcher(cleaned);
        if (!m.matches()) {
            return Optional.empty();
        }
        long noise = cleaned.chars().filter(c -> !Character.isLetter(c)).count();
        if ((double) noise / cleaned.length() < CRYPTIC_DIGIT_RATIO) {
            return Optional.empty();
        }
        return Optional.of(m.group(1));
    }

    static String normalize(String text) {
        String folded = DIACRITICS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
        String snake = NON_WORD.matcher(folded.toLowerCase(Locale.ROOT)).replaceAll("_");
        int start = 0;
        int end = snake.length();
        while (start < end && snake.charAt(start) == '_') {
            start++;
        }
        while (end > start && snake.charAt(end - 1) == '_') {
            end--;
        }
        return snake.substring(start, end);
    }

    static String prefix(DataType dataType) {
        if (dataType == null) {
            return "field_";
        }
        return switch (dataType) {
            case INTEGER, REAL -> "value_";
            case DATE, DATETIME -> "date_";
            case BOOLEAN -> "flag_";
            case STRING -> "field_";
        };
    }
}
