package im.arun.lcms.cli;

import im.arun.lcms.config.ConfigLoader;
import im.arun.lcms.config.LcmsConfig;
import im.arun.lcms.io.CatalogIoException;
import im.arun.lcms.model.ImportReport;
import im.arun.lcms.service.LibraryCatalogService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry point for the library catalog manager.
 */
@Command(
    name = "lcms",
    description = "Manage a library catalog organized as a category tree",
    mixinStandardHelpOptions = true,
    version = "LCMS 1.0"
)
public class LcmsCLI implements Callable<Integer> {

    @Option(names = {"--config"}, description = "Path to a YAML configuration file")
    private String configPath;

    @Option(names = {"--root-name"}, description = "Name of the root category (default from config: Library)")
    private String rootName;

    @Option(names = {"--import"}, description = "CSV file to import before starting")
    private String importPath;

    @Option(names = {"--batch"}, description = "Read commands from this file instead of the terminal")
    private String batchPath;

    @Option(names = {"--no-confirm"}, description = "Do not ask before removing books or categories")
    private boolean noConfirm;

    @Override
    public Integer call() throws Exception {
        // Build config from file defaults plus command-line overrides
        Map<String, Object> overrides = new HashMap<>();
        if (rootName != null) overrides.put("root_name", rootName);
        if (noConfirm) overrides.put("confirm_removals", false);
        LcmsConfig config = new ConfigLoader(configPath).load(overrides);

        LibraryCatalogService service = new LibraryCatalogService(config);

        if (importPath != null) {
            try {
                ImportReport report = service.importCsv(Paths.get(importPath));
                System.out.println(report.getImported() + " books imported");
            } catch (CatalogIoException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
        }

        if (batchPath != null) {
            Path batchFile = Paths.get(batchPath);
            if (!Files.exists(batchFile)) {
                System.err.println("Error: batch file not found: " + batchPath);
                return 1;
            }
            try (Reader reader = Files.newBufferedReader(batchFile, StandardCharsets.UTF_8)) {
                new CatalogShell(service, config, new ReaderPrompter(reader), System.out).run();
            }
            return 0;
        }

        System.out.println("Library Catalog (type 'help' for commands, 'exit' to quit)");
        try (JLinePrompter prompter = new JLinePrompter(config.getHistoryFile())) {
            new CatalogShell(service, config, prompter, System.out).run();
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LcmsCLI()).execute(args);
        System.exit(exitCode);
    }
}
