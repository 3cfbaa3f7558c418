package io.github.yok.sheetunify.core;

import java.io.File;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Files written by one {@link TableExporter#export} call.
 */
@Data
@AllArgsConstructor
public class ExportResult {

    private File masterFile;
    private List<File> columnFiles;
    private File typeMapFile;
}
