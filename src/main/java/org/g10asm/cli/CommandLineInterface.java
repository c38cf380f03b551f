package org.g10asm.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.g10asm.cli.config.AssemblerConfigLoader;
import org.g10asm.cli.config.LoggingConfigurator;
import org.g10asm.compiler.Assembler;
import org.g10asm.compiler.api.AssemblyException;
import org.g10asm.compiler.api.AssemblyResult;
import org.g10asm.compiler.diagnostics.Diagnostic;
import org.g10asm.compiler.diagnostics.DiagnosticsEngine;
import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.parser.AstPrinter;
import org.g10asm.compiler.frontend.preprocessor.PreProcessorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "g10asm",
    mixinStandardHelpOptions = true,
    version = "g10asm 1.0.0",
    description = "Assembler front end for the G10 CPU: lexer, preprocessor and parser.",
    exitCodeOnInvalidInput = 1
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(names = {"-s", "--source"}, required = true, description = "The main assembly source file.")
    private File source;

    @Option(names = {"-o", "--output"}, description = "The output file. Required unless an '--*-only' option is given.")
    private File output;

    @Option(names = "--lex-only", description = "Print the tokens of the source file and stop.")
    private boolean lexOnly;

    @Option(names = "--preprocess-only", description = "Print the preprocessed source and stop.")
    private boolean preprocessOnly;

    @Option(names = "--parse-only", description = "Print the syntax tree and stop.")
    private boolean parseOnly;

    @Option(names = {"-I", "--include"}, description = "An additional include directory. May be repeated.")
    private List<File> includeDirs = new ArrayList<>();

    @Option(names = {"-c", "--config"}, description = "Path to a configuration file (default: g10asm.conf).")
    private File configFile;

    @Option(names = "--verbose", description = "Enable debug logging.")
    private boolean verbose;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("g10asm");
        System.exit(commandLine.execute(args));
    }

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        if (output == null && !lexOnly && !preprocessOnly && !parseOnly) {
            err.println("Missing required option: '--output=<output>'");
            return 1;
        }

        final Config config;
        try {
            config = AssemblerConfigLoader.load(configFile);
        } catch (IOException | ConfigException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            return 1;
        }
        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.setLevel("org.g10asm", "DEBUG");
        }

        final PreProcessorConfig ppConfig;
        try {
            ppConfig = PreProcessorConfig.fromConfig(config)
                    .withAdditionalIncludeDirs(includeDirs.stream().map(File::toPath).toList());
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Invalid preprocessor configuration: " + e.getMessage());
            return 1;
        }

        final Path sourcePath = source.toPath().toAbsolutePath().normalize();
        final String fileName = sourcePath.toString().replace('\\', '/');
        final Assembler assembler = new Assembler(ppConfig);
        try {
            final String text = Files.readString(sourcePath, StandardCharsets.UTF_8);
            if (lexOnly) {
                printTokens(assembler.tokenize(text, fileName), out);
            } else if (preprocessOnly) {
                out.print(assembler.preprocess(text, fileName).text());
            } else {
                final AssemblyResult result = assembler.assemble(text, fileName);
                if (parseOnly) {
                    out.print(AstPrinter.print(result.module()));
                } else {
                    writeOutput(result);
                }
            }
        } catch (AssemblyException e) {
            err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } finally {
            out.flush();
        }

        printDiagnostics(assembler.getDiagnostics(), err);
        return 0;
    }

    private void writeOutput(final AssemblyResult result) throws IOException {
        final String content = result.preprocessed().text() + System.lineSeparator() + AstPrinter.print(result.module());
        Files.writeString(output.toPath(), content, StandardCharsets.UTF_8);
        LOG.info("Wrote {}", output.getAbsolutePath());
    }

    private static void printTokens(final List<Token> tokens, final PrintWriter out) {
        for (int i = 0; i < tokens.size(); i++) {
            out.println(String.format("%04d | %s", i, tokens.get(i)));
        }
    }

    private static void printDiagnostics(final DiagnosticsEngine diagnostics, final PrintWriter err) {
        for (final Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            err.println(diagnostic);
        }
        err.flush();
    }
}
