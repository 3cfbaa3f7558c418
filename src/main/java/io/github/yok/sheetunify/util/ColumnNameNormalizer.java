package io.github.yok.sheetunify.util;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Generated;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Normalizes spreadsheet headers into column names and file names.
 *
 * <p>
 * A normalized name is lowercase, accent-free and made only of word characters joined by single
 * underscores, e.g. {@code "Número Cliente"} becomes {@code "numero_cliente"}. Names that
 * normalize to nothing become {@value #FALLBACK_NAME}.
 * </p>
 */
public final class ColumnNameNormalizer {

    /** Name used when a header normalizes to an empty string. */
    public static final String FALLBACK_NAME = "columna";

    /** Default upper bound for {@link #safeFilename(String)}. */
    public static final int DEFAULT_MAX_FILENAME_LENGTH = 100;

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{Mn}+");
    private static final Pattern NON_WORD =
            Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SEPARATOR_RUN =
            Pattern.compile("[\\s-]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_+");
    private static final Pattern RESERVED_FILE_CHARS = Pattern.compile("[\\\\/:*?\"<>|]+");

    // hash suffix: "_" + 8 hex chars
    private static final int HASH_SUFFIX_LENGTH = 9;

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ColumnNameNormalizer() {
        throw new AssertionError("No ColumnNameNormalizer instances for you!");
    }

    /**
     * Normalizes a single header.
     *
     * @param raw raw header; {@code null} is treated as empty
     * @return normalized, non-empty name
     */
    public static String normalize(String raw) {
        String s = stripAccents(StringUtils.defaultString(raw).toLowerCase(Locale.ROOT))
                .toLowerCase(Locale.ROOT);
        s = NON_WORD.matcher(s).replaceAll(" ");
        s = SEPARATOR_RUN.matcher(s.trim()).replaceAll("_");
        s = UNDERSCORE_RUN.matcher(s).replaceAll("_");
        s = StringUtils.strip(s, "_");
        return s.isEmpty() ? FALLBACK_NAME : s;
    }

    /**
     * Normalizes a list of headers belonging to one sheet and resolves collisions.
     *
     * <p>
     * The first occurrence of a name is kept as is; later occurrences get {@code _1}, {@code _2},
     * ... from a per-name counter. A suffixed candidate that is already taken (for instance by a
     * literal {@code total_1} header) is skipped, so the result never contains duplicates.
     * </p>
     *
     * @param headers raw headers in sheet order
     * @return normalized, unique names in the same order
     */
    public static List<String> normalizeHeaders(List<String> headers) {
        List<String> result = new ArrayList<>(headers.size());
        Set<String> used = new HashSet<>();
        Map<String, Integer> counters = new HashMap<>();
        for (String header : headers) {
            String name = normalize(header);
            if (used.add(name)) {
                counters.putIfAbsent(name, 0);
                result.add(name);
                continue;
            }
            int n = counters.getOrDefault(name, 0);
            String candidate;
            do {
                n++;
                candidate = name + "_" + n;
            } while (used.contains(candidate));
            counters.put(name, n);
            used.add(candidate);
            result.add(candidate);
        }
        return result;
    }

    /**
     * Builds a file-system safe base name with the default length limit.
     *
     * @param raw column name
     * @return safe base name without extension
     * @see #safeFilename(String, int)
     */
    public static String safeFilename(String raw) {
        return safeFilename(raw, DEFAULT_MAX_FILENAME_LENGTH);
    }

    /**
     * Builds a file-system safe base name (without extension) for a column.
     *
     * <p>
     * The name is normalized, reserved characters ({@code \ / : * ? " < > |}) become underscores
     * and trailing dots and spaces are dropped. Names longer than {@code maxLen} are cut to
     * {@code maxLen - 9} characters followed by {@code _} and the first eight hex digits of the
     * MD5 of the full name, so the result is deterministic and never longer than {@code maxLen}.
     * </p>
     *
     * @param raw column name
     * @param maxLen maximum length of the result; at least 10
     * @return safe base name
     * @throws IllegalArgumentException if {@code maxLen} is less than 10
     */
    public static String safeFilename(String raw, int maxLen) {
        Validate.isTrue(maxLen > HASH_SUFFIX_LENGTH, "maxLen must be at least %d: %d",
                HASH_SUFFIX_LENGTH + 1, maxLen);
        String base = RESERVED_FILE_CHARS.matcher(normalize(raw)).replaceAll("_");
        base = StringUtils.stripEnd(base, " .");
        if (base.isEmpty()) {
            base = FALLBACK_NAME;
        }
        if (base.length() > maxLen) {
            String hash = DigestUtils.md5Hex(base.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
            base = base.substring(0, maxLen - HASH_SUFFIX_LENGTH) + "_" + hash;
        }
        return base;
    }

    private static String stripAccents(String s) {
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFKD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }
}
