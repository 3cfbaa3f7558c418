package io.github.yok.sheetunify.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.sheetunify.config.UnifyConfig;
import io.github.yok.sheetunify.exception.InvalidConfigException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Which sheets of a workbook to read: every sheet in workbook order, or an explicit ordered list of
 * sheet names.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SheetSelection {

    private static final SheetSelection ALL = new SheetSelection(true, ImmutableList.of());

    private final boolean all;
    private final List<String> sheetNames;

    /**
     * Selects every sheet, in workbook order.
     *
     * @return selection of all sheets
     */
    public static SheetSelection all() {
        return ALL;
    }

    /**
     * Selects exactly the given sheets, in the given order.
     *
     * @param sheetNames sheet names
     * @return explicit selection
     * @throws InvalidConfigException if the list is {@code null} or empty, or contains a blank or
     *         repeated name
     */
    public static SheetSelection of(List<String> sheetNames) {
        if (sheetNames == null || sheetNames.isEmpty()) {
            throw new InvalidConfigException(
                    "Sheet selection must be 'all' or a non-empty list of sheet names.");
        }
        Set<String> seen = new HashSet<>();
        for (String name : sheetNames) {
            if (StringUtils.isBlank(name)) {
                throw new InvalidConfigException("Sheet selection contains a blank sheet name.");
            }
            if (!seen.add(name)) {
                throw new InvalidConfigException("Sheet selection repeats sheet [" + name + "].");
            }
        }
        return new SheetSelection(false, ImmutableList.copyOf(sheetNames));
    }

    /**
     * Maps the {@code unify.sheets} setting to a selection: the single value
     * {@value UnifyConfig#ALL_SHEETS} selects every sheet, any other list is an explicit
     * selection.
     *
     * @param configured configured values
     * @return selection
     * @throws InvalidConfigException if the setting is neither form
     */
    public static SheetSelection fromConfig(List<String> configured) {
        if (configured != null && configured.size() == 1
                && UnifyConfig.ALL_SHEETS.equals(StringUtils.trim(configured.get(0)))) {
            return ALL;
        }
        return of(configured);
    }
}
