package io.github.yok.sheetunify.config;

import com.google.common.collect.ImmutableList;
import io.github.yok.sheetunify.util.ColumnNameNormalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code unify} section in {@code application.yml}.
 *
 * <p>
 * Typical usage is to bind YAML like:
 * </p>
 *
 * <pre>
 * unify:
 *   input-path: data/2025A.xlsx
 *   output-dir: outputs
 *   sheets: [all]
 *   max-filename-length: 100
 *   type-overrides:
 *     codigo_postal: string
 * </pre>
 *
 * <p>
 * The two positional command-line arguments take precedence over {@code input-path} and
 * {@code output-dir}.
 * </p>
 */
@ConfigurationProperties(prefix = "unify")
@Data
public class UnifyConfig {

    /** Value of {@link #sheets} that selects every sheet of the workbook. */
    public static final String ALL_SHEETS = "all";

    /**
     * Text cell contents that are read as missing values.
     */
    public static final List<String> DEFAULT_NA_VALUES = ImmutableList.of("", "#N/A", "#N/A N/A",
            "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN", "<NA>", "N/A", "NA",
            "NULL", "NaN", "None", "n/a", "nan", "null");

    /**
     * Spreadsheet read when no input path is given on the command line.
     */
    private String inputPath = "data/2025A.xlsx";

    /**
     * Directory written when no output directory is given on the command line.
     */
    private String outputDir = "outputs";

    /**
     * Either the single value {@code all} or the names of the sheets to read, in order.
     */
    private List<String> sheets = ImmutableList.of(ALL_SHEETS);

    private List<String> naValues = DEFAULT_NA_VALUES;

    /**
     * Upper bound for the base name of each per-column CSV file.
     */
    private int maxFilenameLength = ColumnNameNormalizer.DEFAULT_MAX_FILENAME_LENGTH;

    /**
     * Map of “normalized column name → type tag” replacing the inferred type of that column. Tags
     * other than {@code int}, {@code float} and {@code string} make the column fall back to
     * {@code string}.
     */
    private Map<String, String> typeOverrides = new LinkedHashMap<>();
}
