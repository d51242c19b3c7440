package com.tinyc;

import com.tinyc.output.AstFormatter;
import com.tinyc.output.ReportPrinter;
import com.tinyc.pipeline.Pipeline;
import com.tinyc.pipeline.PipelineResult;
import com.tinyc.pipeline.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "tinyc", mixinStandardHelpOptions = true, version = "1.0",
         description = "Evaluate prefix arithmetic (sum, sub, div, mul) and compile it to infix")
public class TinyC implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(TinyC.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "<expression>",
                description = "Program words, e.g. sub 2 sum 1 3 4 (default: read programs from --file or stdin)")
    private List<String> words = new ArrayList<>();

    @Option(names = {"-f", "--file"}, description = "Read programs from a file, one per line")
    private File inputFile;

    @Option(names = {"-s", "--stage"}, paramLabel = "<stage>",
            description = "Stage to print: ${COMPLETION-CANDIDATES} (repeatable, default: all)")
    private List<Stage> stages = new ArrayList<>();

    @Option(names = {"-c", "--compact-output"}, description = "Print the syntax tree on one line")
    private boolean compactOutput = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TinyC())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<String> programs;
        try {
            programs = readPrograms();
        } catch (IOException e) {
            return readFailure(e);
        } catch (UncheckedIOException e) {
            return readFailure(e.getCause());
        }

        Pipeline pipeline = new Pipeline();
        ReportPrinter printer = new ReportPrinter(new AstFormatter(!compactOutput), Set.copyOf(stages));

        boolean allSucceeded = true;
        for (String program : programs) {
            PipelineResult result = pipeline.run(program);
            printer.print(result, out);
            allSucceeded &= result.succeeded();
        }
        return allSucceeded ? 0 : 1;
    }

    private int readFailure(IOException e) {
        logger.debug("Could not read programs", e);
        spec.commandLine().getErr().println("Error: " + e.getMessage());
        return 1;
    }

    private List<String> readPrograms() throws IOException {
        if (!words.isEmpty()) {
            return List.of(String.join(" ", words));
        }
        if (inputFile != null) {
            return nonBlank(Files.readAllLines(inputFile.toPath(), StandardCharsets.UTF_8));
        }
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return nonBlank(reader.lines().collect(Collectors.toList()));
    }

    private static List<String> nonBlank(List<String> lines) {
        return lines.stream().filter(line -> !line.isBlank()).collect(Collectors.toList());
    }
}
