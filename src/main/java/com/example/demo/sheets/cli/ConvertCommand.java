package com.example.demo.sheets.cli;

import com.example.demo.sheets.config.ConverterProperties;
import com.example.demo.sheets.exception.NotAnArchiveException;
import com.example.demo.sheets.model.ConversionRequest;
import com.example.demo.sheets.model.ConversionResult;
import com.example.demo.sheets.model.OutputFormat;
import com.example.demo.sheets.service.ConversionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Command-line front end:
 * {@code sheet-happens <file> [--csv] [--json] [--yaml] [--output=DIR] [--no-sanitize] [--help]}.
 * <p>
 * Exit codes: 0 success, 1 conversion failure, 2 usage error, 3 input is not an Excel 2007+ file.
 * Options containing a dot are Spring property overrides and are left to Spring.
 */
@Slf4j
@Component
public class ConvertCommand implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_NOT_AN_ARCHIVE = 3;

    static final String OPT_HELP = "help";
    static final String OPT_OUTPUT = "output";
    static final String OPT_NO_SANITIZE = "no-sanitize";

    static final String DESCRIPTION = "Simple Excel 2007+ to CSV, JSON, and YAML converter";

    private final ConversionService conversionService;
    private final ConverterProperties properties;
    private PrintStream out = System.out;
    private PrintStream err = System.err;
    private int exitCode = EXIT_OK;

    public ConvertCommand(ConversionService conversionService, ConverterProperties properties) {
        this.conversionService = conversionService;
        this.properties = properties;
    }

    void setStreams(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        if (args.containsOption(OPT_HELP)) {
            printHelp(out);
            return EXIT_OK;
        }
        for (String option : args.getOptionNames()) {
            if (!option.contains(".") && !isKnownOption(option)) {
                return usageError("ERROR. Unknown option --" + option + " (formats: " + OutputFormat.tags() + ").");
            }
        }
        List<String> files = args.getNonOptionArgs();
        if (files.isEmpty()) {
            return usageError("ERROR. Missing the Excel file to convert.");
        }
        if (files.size() > 1) {
            return usageError("ERROR. Expected one Excel file, got " + files.size() + ".");
        }

        Set<OutputFormat> formats = selectedFormats(args);
        if (formats.isEmpty()) {
            return usageError("ERROR. Choose at least one output format.");
        }

        Path source = Paths.get(files.get(0));
        ConversionRequest request = ConversionRequest.builder()
                .source(source)
                .outputDirectory(outputDirectory(args))
                .formats(formats)
                .sanitize(properties.isSanitize() && !args.containsOption(OPT_NO_SANITIZE))
                .build();
        try {
            ConversionResult result = conversionService.convert(request);
            log.info("Wrote {} file(s) for {} sheet(s)", result.getWrittenFiles().size(), result.getSheetCount());
            return EXIT_OK;
        } catch (NotAnArchiveException e) {
            log.debug("Rejected input {}", source, e);
            err.println("ERROR. \"" + source + "\" is not an Excel 2007+ file");
            return EXIT_NOT_AN_ARCHIVE;
        } catch (RuntimeException e) {
            log.debug("Conversion of {} failed", source, e);
            err.println("ERROR. " + e.getMessage() + " (" + e.getClass().getSimpleName() + ")");
            return EXIT_FAILURE;
        }
    }

    private Set<OutputFormat> selectedFormats(ApplicationArguments args) {
        Set<OutputFormat> formats = EnumSet.noneOf(OutputFormat.class);
        for (String option : args.getOptionNames()) {
            OutputFormat.fromTag(option).ifPresent(formats::add);
        }
        if (formats.isEmpty() && properties.getFormats() != null) {
            formats.addAll(properties.getFormats());
        }
        return formats;
    }

    private Path outputDirectory(ApplicationArguments args) {
        List<String> values = args.getOptionValues(OPT_OUTPUT);
        if (values != null && !values.isEmpty() && !values.get(values.size() - 1).isBlank()) {
            return Paths.get(values.get(values.size() - 1));
        }
        String configured = properties.getOutputDirectory();
        return configured == null || configured.isBlank() ? null : Paths.get(configured);
    }

    private boolean isKnownOption(String option) {
        return OPT_HELP.equals(option) || OPT_OUTPUT.equals(option) || OPT_NO_SANITIZE.equals(option)
                || OutputFormat.fromTag(option).isPresent();
    }

    private int usageError(String message) {
        out.println();
        out.println(message);
        out.println();
        printHelp(out);
        return EXIT_USAGE;
    }

    static void printHelp(PrintStream stream) {
        stream.println("usage: sheet-happens [--help] [--csv] [--json] [--yaml] [--output=DIR] [--no-sanitize] filepath");
        stream.println();
        stream.println(DESCRIPTION);
        stream.println();
        stream.println("positional arguments:");
        stream.println("  filepath         Excel 2007+ (.xlsx) file to convert");
        stream.println();
        stream.println("options:");
        stream.println("  --help           show this help message and exit");
        stream.println("  --csv            write every sheet as CSV");
        stream.println("  --json           write every sheet as a JSON array of records");
        stream.println("  --yaml           write every sheet as a YAML sequence of records");
        stream.println("  --output=DIR     directory for the output files (default: next to filepath)");
        stream.println("  --no-sanitize    keep cell values as stored (no trimming or line folding)");
    }
}
