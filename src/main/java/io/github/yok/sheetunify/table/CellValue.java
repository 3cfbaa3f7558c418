package io.github.yok.sheetunify.table;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single spreadsheet cell, held untyped as one of {@link Kind#NULL}, {@link Kind#NUMBER} or
 * {@link Kind#TEXT}.
 *
 * <p>
 * The reader produces cells without deciding a column type. Numeric interpretation of text cells
 * is deferred to {@link #toNumber()}, which the type inferencer and applier call explicitly.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class CellValue {

    /**
     * Cell kind.
     */
    public enum Kind {
        NULL, NUMBER, TEXT
    }

    // Locale-independent decimal: optional sign, digits with optional fraction, optional exponent
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final BigDecimal DOUBLE_MAX = new BigDecimal(Double.MAX_VALUE);

    private static final CellValue NULL = new CellValue(Kind.NULL, null, null);

    private final Kind kind;
    private final BigDecimal number;
    private final String text;

    private CellValue(Kind kind, BigDecimal number, String text) {
        this.kind = kind;
        this.number = number;
        this.text = text;
    }

    /**
     * Returns the shared null cell.
     *
     * @return null cell
     */
    public static CellValue nullValue() {
        return NULL;
    }

    /**
     * Creates a numeric cell; {@code null} yields the null cell.
     *
     * @param value numeric value
     * @return numeric cell
     */
    public static CellValue number(BigDecimal value) {
        return value == null ? NULL : new CellValue(Kind.NUMBER, value, null);
    }

    /**
     * Creates a text cell; {@code null} yields the null cell.
     *
     * @param value text value
     * @return text cell
     */
    public static CellValue text(String value) {
        return value == null ? NULL : new CellValue(Kind.TEXT, null, value);
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    /**
     * Interprets this cell as a number.
     *
     * <p>
     * Numeric cells return their value. Text cells are trimmed and parsed as a plain decimal
     * ({@code 12}, {@code -3.5}, {@code .5}, {@code 1e3}); anything else, including
     * {@code NaN}, {@code inf}, grouped digits such as {@code 1,000} and magnitudes beyond the
     * double range, is not a number.
     * </p>
     *
     * @return parsed value, or empty for null and non-numeric cells
     */
    public Optional<BigDecimal> toNumber() {
        if (kind == Kind.NUMBER) {
            return Optional.of(number);
        }
        if (kind == Kind.TEXT) {
            return parseDecimal(text);
        }
        return Optional.empty();
    }

    /**
     * Returns the text form of this cell: the text itself, a number in plain notation without
     * trailing zeros, or {@code null} for the null cell.
     *
     * @return text form, or {@code null}
     */
    public String asText() {
        switch (kind) {
            case NUMBER:
                return plain(number);
            case TEXT:
                return text;
            default:
                return null;
        }
    }

    /**
     * Parses a locale-independent decimal string.
     *
     * @param raw string to parse; may be {@code null}
     * @return parsed value, or empty if {@code raw} is not a decimal number or its magnitude
     *         exceeds {@link Double#MAX_VALUE}
     */
    public static Optional<BigDecimal> parseDecimal(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String s = raw.trim();
        if (!DECIMAL.matcher(s).matches()) {
            return Optional.empty();
        }
        BigDecimal value;
        try {
            value = new BigDecimal(s);
        } catch (NumberFormatException e) {
            // exponent out of range
            return Optional.empty();
        }
        if (value.abs().compareTo(DOUBLE_MAX) > 0) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    /**
     * Renders a number in plain notation without trailing fractional zeros.
     *
     * @param value value to render
     * @return plain string
     */
    public static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
