package org.brahmic;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class App {
    private static final Logger log = LogManager.getLogger("app");

    static final String USAGE = "usage: app [--tokens] [--tree] [-o out.py] (<file.teng> | -c <code>)";

    // ==========================================================
    // MAIN PIPELINE
    // ==========================================================

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    // Returns the exit status, 0 when the whole source was translated.
    static int run(String[] args, PrintStream out, PrintStream err) {
        // 1. Command line
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 1;
        }

        try {
            // 2. Input
            var code = readSource(options);

            // 3. Token table, on request
            if (options.tokens()) {
                var lexer = new Lexer(code);
                lexer.lex();
                out.println(lexer.toJson());
            }

            // 4. Translation
            var result = Transpiler.transpile(code);
            for (var error : result.lexicalErrors()) {
                err.println(error.getMessage());
            }

            // 5. Structure outline, on request
            if (options.tree()) {
                out.print(new PrinterST().print(result.tree()));
            }

            // 6. Output
            if (options.outputFile() != null) {
                Files.writeString(Paths.get(options.outputFile()), result.python() + "\n", StandardCharsets.UTF_8);
                log.info("wrote {}", options.outputFile());
            } else {
                out.println(result.python());
            }

            return result.hasLexicalErrors() ? 1 : 0;
        } catch (SyntaxError e) {
            err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }

    // ==========================================================
    // INPUT HANDLING
    // ==========================================================

    record Options(String inputFile, String inlineCode, String outputFile, boolean tokens, boolean tree) {
        static Options parse(String[] args) {
            String inputFile = null;
            String inlineCode = null;
            String outputFile = null;
            boolean tokens = false;
            boolean tree = false;

            for (int i = 0; i < args.length; i++) {
                var arg = args[i];
                switch (arg) {
                    case "--tokens" -> tokens = true;
                    case "--tree" -> tree = true;
                    case "-c" -> {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("-c needs the code to translate");
                        }
                        inlineCode = args[++i];
                    }
                    case "-o" -> {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("-o needs an output file");
                        }
                        outputFile = args[++i];
                    }
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("unknown option: " + arg);
                        }
                        if (inputFile != null) {
                            throw new IllegalArgumentException("only one input file is allowed");
                        }
                        inputFile = arg;
                    }
                }
            }

            if ((inputFile == null) == (inlineCode == null)) {
                throw new IllegalArgumentException("give either an input file or -c <code>");
            }
            return new Options(inputFile, inlineCode, outputFile, tokens, tree);
        }
    }

    private static String readSource(Options options) throws IOException {
        if (options.inlineCode() != null) {
            return options.inlineCode();
        }

        Path path = Paths.get(options.inputFile());
        if (!Files.exists(path)) {
            throw new IOException("cannot find file: " + options.inputFile()
                + " (current dir: " + System.getProperty("user.dir") + ")");
        }
        log.debug("reading {}", path);
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
