package io.github.yok.sheetunify;

import io.github.yok.sheetunify.config.UnifyConfig;
import io.github.yok.sheetunify.core.PipelineSummary;
import io.github.yok.sheetunify.core.SheetPipeline;
import io.github.yok.sheetunify.core.TableExporter;
import io.github.yok.sheetunify.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Usage: {@code sheetunify [input-spreadsheet] [output-dir]}. Both positional arguments are
 * optional; when omitted, {@code unify.input-path} and {@code unify.output-dir} from
 * {@code application.yml} are used ({@code data/2025A.xlsx} and {@code outputs} by default).
 * </p>
 *
 * <p>
 * The process exits with status {@code 0} after printing a summary, and with status {@code 1} when
 * the configuration is invalid, the input file is missing or the run fails. Configuration is
 * checked before the input file is looked up.
 * </p>
 *
 * @see UnifyConfig
 * @see SheetPipeline
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(UnifyConfig.class)
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final UnifyConfig unifyConfig;

    private int exitCode = 0;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        int status = SpringApplication.exit(context);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        Path input = Paths.get(args.length > 0 ? args[0] : unifyConfig.getInputPath());
        Path outDir = Paths.get(args.length > 1 ? args[1] : unifyConfig.getOutputDir());
        for (int i = 2; i < args.length; i++) {
            log.warn("Unknown argument: {}", args[i]);
        }

        try {
            PipelineSummary summary = new SheetPipeline(unifyConfig).execute(input, outDir);
            printSummary(summary);
        } catch (Exception e) {
            exitCode = ErrorHandler.report(e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static void printSummary(PipelineSummary summary) {
        log.info("Run completed: rows={}, columns={}, output={}", summary.getRowCount(),
                summary.getColumnCount(), summary.getOutputDir());
        System.out.println("=== DONE ===");
        System.out.println("Rows: " + summary.getRowCount() + " | Columns: "
                + summary.getColumnCount());
        System.out.println("Output: " + summary.getOutputDir().getAbsolutePath());
        System.out.println("Generated:");
        System.out.println(" - " + TableExporter.MASTER_FILE);
        System.out.println(" - " + TableExporter.COLUMNS_DIR + "/*.csv ("
                + summary.getExportResult().getColumnFiles().size() + " files, one per column)");
        System.out.println(" - " + TableExporter.TYPE_MAP_FILE + " (applied column types)");
    }
}
