package io.github.yok.sheetunify.core;

import io.github.yok.sheetunify.config.UnifyConfig;
import io.github.yok.sheetunify.exception.InvalidConfigException;
import io.github.yok.sheetunify.table.ColumnType;
import io.github.yok.sheetunify.table.ColumnTypeMap;
import io.github.yok.sheetunify.table.MasterTable;
import io.github.yok.sheetunify.table.Sheet;
import io.github.yok.sheetunify.util.ColumnNameNormalizer;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the whole batch: read, unify, infer, apply, export.
 *
 * <p>
 * <strong>Main responsibilities:</strong>
 * </p>
 * <ul>
 * <li>Read the configured sheets of the input workbook ({@link WorkbookSheetReader}).</li>
 * <li>Unify them into one master table ({@link SheetUnifier}).</li>
 * <li>Infer column types ({@link TypeInferencer}) and apply the configured overrides.</li>
 * <li>Coerce the table ({@link TypeApplier}) and write all outputs ({@link TableExporter}).</li>
 * </ul>
 *
 * <p>
 * Every stage runs once, in order, on the calling thread. A failure in any stage ends the run
 * before the export starts, except column coercion failures, which the applier recovers.
 * </p>
 *
 * @see UnifyConfig
 */
@Slf4j
public class SheetPipeline {

    private final UnifyConfig config;
    private final WorkbookSheetReader reader;
    private final SheetUnifier unifier;
    private final TypeInferencer inferencer;
    private final TypeApplier applier;
    private final TableExporter exporter;

    /**
     * Creates a pipeline from configuration.
     *
     * @param config unify settings
     * @throws InvalidConfigException if {@code max-filename-length} is less than 10
     */
    public SheetPipeline(UnifyConfig config) {
        this(config, new WorkbookSheetReader(config.getNaValues()), new SheetUnifier(),
                new TypeInferencer(), new TypeApplier(),
                new TableExporter(config.getMaxFilenameLength()));
        if (config.getMaxFilenameLength() < 10) {
            throw new InvalidConfigException("unify.max-filename-length must be at least 10: "
                    + config.getMaxFilenameLength());
        }
    }

    SheetPipeline(UnifyConfig config, WorkbookSheetReader reader, SheetUnifier unifier,
            TypeInferencer inferencer, TypeApplier applier, TableExporter exporter) {
        this.config = config;
        this.reader = reader;
        this.unifier = unifier;
        this.inferencer = inferencer;
        this.applier = applier;
        this.exporter = exporter;
    }

    /**
     * Runs the pipeline.
     *
     * @param input input workbook
     * @param outDir output directory
     * @return run summary
     * @throws IOException on file I/O error while exporting
     */
    public PipelineSummary execute(Path input, Path outDir) throws IOException {
        SheetSelection selection = SheetSelection.fromConfig(config.getSheets());

        log.info("== Reading workbook: {} (sheets: {})", input,
                selection.isAll() ? UnifyConfig.ALL_SHEETS : selection.getSheetNames());
        Map<String, Sheet> sheets = reader.readAllSheets(input, selection);
        log.info("Sheets read: {}", sheets.keySet());

        log.info("== Unifying sheets and normalizing headers");
        MasterTable master = unifier.unify(sheets);
        log.info("Master table: {} rows, {} columns", master.getRowCount(),
                master.getColumnCount());

        log.info("== Inferring column types");
        ColumnTypeMap types = inferencer.infer(master);
        applyOverrides(master, types, config.getTypeOverrides());
        MasterTable typed = applier.apply(master, types);

        log.info("== Exporting to {}", outDir);
        File dir = outDir.toAbsolutePath().normalize().toFile();
        ExportResult exported = exporter.export(typed, types, dir);

        return new PipelineSummary(typed.getRowCount(), typed.getColumnCount(), dir, exported);
    }

    /**
     * Replaces inferred types with configured overrides.
     *
     * <p>
     * Overrides for columns the table does not have, and for
     * {@value MasterTable#SHEET_COLUMN}, are ignored. An unexpected tag makes the column
     * {@code string}.
     * </p>
     *
     * @param master master table
     * @param types inferred types; updated in place
     * @param overrides column to tag map; may be {@code null}
     */
    static void applyOverrides(MasterTable master, ColumnTypeMap types,
            Map<String, String> overrides) {
        if (overrides == null) {
            return;
        }
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            if (MasterTable.SHEET_COLUMN.equals(entry.getKey())) {
                log.warn("Type override for [{}] ignored: the column is always string",
                        entry.getKey());
                continue;
            }
            String column = ColumnNameNormalizer.normalize(entry.getKey());
            if (!master.hasColumn(column)) {
                log.warn("Type override for [{}] ignored: no such column", entry.getKey());
                continue;
            }
            ColumnType type = ColumnType.fromTag(entry.getValue()).orElse(null);
            if (type == null) {
                log.warn("Unexpected type tag [{}] for column [{}]; using string",
                        entry.getValue(), column);
                type = ColumnType.STRING;
            }
            log.info("Column[{}] type overridden: {} -> {}", column,
                    types.get(column).map(ColumnType::getTag).orElse("-"), type.getTag());
            types.put(column, type);
        }
    }
}
