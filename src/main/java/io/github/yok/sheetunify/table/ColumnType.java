package io.github.yok.sheetunify.table;

import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Column types assigned by the type inferencer.
 *
 * <p>
 * The {@link #getTag() tag} is the literal written to {@code inferred_dtypes.json}.
 * </p>
 */
@Getter
@RequiredArgsConstructor
public enum ColumnType {

    /** Nullable 64-bit integer. */
    INT("int"),

    /** Nullable double. */
    FLOAT("float"),

    /** Text. */
    STRING("string");

    private final String tag;

    /**
     * Looks up a type by its tag.
     *
     * @param tag tag such as {@code "int"}; may be {@code null}
     * @return matching type, or empty for an unexpected tag
     */
    public static Optional<ColumnType> fromTag(String tag) {
        for (ColumnType type : values()) {
            if (type.tag.equals(tag)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
