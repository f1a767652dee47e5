package com.raditha.armmerge.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.javaparser.Position;
import com.raditha.armmerge.config.MergeConfig;
import com.raditha.armmerge.config.MergeSettings;
import com.raditha.armmerge.model.ArmTree;
import com.raditha.armmerge.model.SourceEdit;
import com.raditha.armmerge.refactoring.Assist;
import com.raditha.armmerge.refactoring.DiffGenerator;
import com.raditha.armmerge.refactoring.MergeMatchArms;
import com.raditha.armmerge.tree.JavaSwitchParser;
import com.raditha.armmerge.tree.LineIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line interface for merging switch rules in a Java file.
 * <p>
 * Usage:
 * java -jar arm-merger.jar [options] --line &lt;n&gt; --column &lt;n&gt; &lt;file&gt;
 * <p>
 * Configuration priority: CLI arguments &gt; arm-merger.yml &gt; defaults
 */
@Command(name = "arm-merger", mixinStandardHelpOptions = true, version = "arm-merger v1.0.0",
        description = "Merge consecutive switch rules that share the same body")
public class ArmMergeCLI implements Callable<Integer> {

    static final int EXIT_MERGED = 0;
    static final int EXIT_NOT_APPLICABLE = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_IO_ERROR = 3;

    private static final Logger logger = LoggerFactory.getLogger(ArmMergeCLI.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Java source file", paramLabel = "<file>")
    private Path file;

    @Option(names = "--offset", description = "Cursor as a 0-based character offset", paramLabel = "<n>")
    private Integer offset;

    @Option(names = "--line", description = "Cursor line (1-based)", paramLabel = "<n>")
    private Integer line;

    @Option(names = "--column", description = "Cursor column (1-based)", paramLabel = "<n>")
    private Integer column;

    @Option(names = "--mode", description = "Merge mode: dry-run or apply (default: dry-run)",
            paramLabel = "<mode>", converter = MergeModeConverter.class)
    private MergeMode mode;

    @Option(names = "--context", description = "Context lines in the preview diff (default: 3)", paramLabel = "<n>")
    private Integer contextLines;

    @Option(names = "--json", description = "Print the edit as JSON instead of a diff")
    private boolean jsonOutput = false;

    @Option(names = "--no-backup", description = "Do not keep a .bak copy when applying")
    private boolean noBackup = false;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    /**
     * DTO for JSON output.
     */
    public record AssistDTO(
            String id,
            String name,
            String label,
            int targetStart,
            int targetEnd,
            int replaceStart,
            int replaceEnd,
            String replacement,
            int cursorOffset,
            int cursorLine,
            int cursorColumn) {
    }

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 when the arms were merged, 1 when the merge does not apply)
     */
    @Override
    public Integer call() throws IOException {
        validateConfiguration();

        Map<String, Object> yaml = MergeSettings.loadConfigMap(configFile);
        MergeConfig config = MergeSettings.loadConfig(yaml, mode, contextLines, noBackup);

        String source = Files.readString(file, StandardCharsets.UTF_8);
        LineIndex lineIndex = new LineIndex(source);
        int cursor = resolveCursor(lineIndex, source.length());

        ArmTree tree = new JavaSwitchParser(config.languageLevel()).parse(source);
        Optional<Assist> assist = new MergeMatchArms().apply(tree, cursor);

        PrintWriter out = spec.commandLine().getOut();
        if (assist.isEmpty()) {
            Position position = lineIndex.positionOf(cursor);
            spec.commandLine().getErr().printf("%s is not applicable at %s:%d:%d%n",
                    MergeMatchArms.LABEL, file.getFileName(), position.line, position.column);
            return EXIT_NOT_APPLICABLE;
        }

        SourceEdit edit = assist.get().edit();
        String merged = edit.applyTo(source);
        Position newCursor = new LineIndex(merged).positionOf(edit.cursorOffset());

        if (jsonOutput) {
            out.println(toJson(assist.get(), newCursor));
        } else {
            out.println(new DiffGenerator().generateUnifiedDiff(
                    file.getFileName().toString(), source, merged, config.contextLines()));
            out.printf("Cursor: %d:%d%n", newCursor.line, newCursor.column);
        }

        if (config.mode() == MergeMode.APPLY) {
            write(merged, config.backup());
            out.println("Merged arms written to " + file);
        }
        out.flush();
        return EXIT_MERGED;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Build the command line with the exit code mapping used by {@link #main(String[])}.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new ArmMergeCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG_ERROR;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO_ERROR;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_NOT_APPLICABLE;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIG_ERROR;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Source file not found: " + file);
        }
        boolean hasOffset = offset != null;
        boolean hasPosition = line != null || column != null;
        if (hasOffset == hasPosition) {
            throw new IllegalArgumentException("Give the cursor either as --offset or as --line and --column");
        }
        if (hasPosition && (line == null || column == null)) {
            throw new IllegalArgumentException("--line and --column must be used together");
        }
        if (contextLines != null && contextLines < 0) {
            throw new IllegalArgumentException("Context lines must not be negative, got: " + contextLines);
        }
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
    }

    private int resolveCursor(LineIndex lineIndex, int length) {
        if (offset != null) {
            if (offset < 0 || offset > length) {
                throw new IllegalArgumentException("Offset " + offset + " is outside the file (0.." + length + ")");
            }
            return offset;
        }
        return lineIndex.offsetOf(line, column);
    }

    private void write(String merged, boolean backup) throws IOException {
        if (backup) {
            Path backupFile = file.resolveSibling(file.getFileName() + ".bak");
            Files.copy(file, backupFile, StandardCopyOption.REPLACE_EXISTING);
            logger.info("Backed up {} to {}", file, backupFile);
        }
        Files.writeString(file, merged, StandardCharsets.UTF_8);
    }

    private static String toJson(Assist assist, Position cursor) throws JsonProcessingException {
        SourceEdit edit = assist.edit();
        AssistDTO dto = new AssistDTO(
                assist.id().id(),
                assist.id().name(),
                assist.label(),
                edit.target().start(),
                edit.target().end(),
                edit.edit().range().start(),
                edit.edit().range().end(),
                edit.edit().replacement(),
                edit.cursorOffset(),
                cursor.line,
                cursor.column);
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(dto);
    }

    /**
     * Custom converter for MergeMode enum to handle CLI string values.
     */
    public static class MergeModeConverter implements ITypeConverter<MergeMode> {
        @Override
        public MergeMode convert(String value) throws Exception {
            return MergeMode.fromString(value);
        }
    }
}
