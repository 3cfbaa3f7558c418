package io.github.yok.sheetunify.core;

import com.google.common.base.Preconditions;
import io.github.yok.sheetunify.table.Column;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of coercing one column to a type: either the coerced column or the reason the coercion
 * is impossible.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class CoercionResult {

    private final Column column;
    private final String failureReason;

    /**
     * Creates a successful result.
     *
     * @param column coerced column
     * @return success
     */
    public static CoercionResult success(Column column) {
        return new CoercionResult(Preconditions.checkNotNull(column, "column"), null);
    }

    /**
     * Creates a failed result.
     *
     * @param reason why the column cannot be coerced
     * @return failure
     */
    public static CoercionResult failure(String reason) {
        return new CoercionResult(null, Preconditions.checkNotNull(reason, "reason"));
    }

    public boolean isSuccess() {
        return column != null;
    }

    public Optional<Column> getColumn() {
        return Optional.ofNullable(column);
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }
}
