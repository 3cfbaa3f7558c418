package io.github.yok.sheetunify.core;

import java.io.File;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a successful {@link SheetPipeline} run.
 */
@Data
@AllArgsConstructor
public class PipelineSummary {

    private int rowCount;
    private int columnCount;
    private File outputDir;
    private ExportResult exportResult;
}
