package org.tessera.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typesafe.config.ConfigException;
import org.tessera.cli.CommandLineInterface;
import org.tessera.cli.config.LoggingConfigurator;
import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.api.SourceInfo;
import org.tessera.compiler.diagnostics.CompilerLogger;
import org.tessera.compiler.frontend.lexer.Lexer;
import org.tessera.compiler.frontend.lexer.LexerOptions;
import org.tessera.compiler.frontend.lexer.SourceBuffer;
import org.tessera.compiler.frontend.lexer.Token;
import org.tessera.compiler.frontend.lexer.TokenRenderer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokenize", description = "Prints the token stream of a source file.")
public class TokenizeCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", arity = "0..1", description = "The source file. Reads stdin if omitted or '-'.")
    private Path file;

    @Option(names = "--json", description = "Print the tokens as a JSON array.")
    private boolean json;

    @Option(names = {"-v", "--verbose"}, description = "Compiler log verbosity (0=ERROR .. 4=TRACE).")
    private Integer verbosity;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        LexerOptions options;
        try {
            options = LexerOptions.fromConfig(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e);
        }
        if (verbosity != null) {
            CompilerLogger.setLevel(verbosity);
            LoggingConfigurator.applyCompilerVerbosity(verbosity);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            SourceBuffer source = readSource(options);
            List<Token> tokens = new Lexer(source, null, options).scanTokens();
            if (json) {
                Gson gson = new GsonBuilder().setPrettyPrinting().create();
                out.println(gson.toJson(toJson(tokens)));
            } else {
                for (Token token : tokens) {
                    out.printf("%d:%d %s %s%n", token.line(), token.column(), token.type(), TokenRenderer.render(token));
                }
            }
            out.flush();
            return 0;
        } catch (LexicalException e) {
            SourceInfo info = e.getSourceInfo();
            err.println("error[" + e.getErrorCode() + "]: " + e.getMessage());
            if (info != null && !info.lineContent().isEmpty()) {
                err.println("  " + info.lineContent());
                err.println("  " + " ".repeat(Math.max(0, info.columnNumber() - 1)) + "^");
            }
            err.flush();
            return 1;
        }
    }

    private SourceBuffer readSource(LexerOptions options) throws LexicalException {
        if (file == null || "-".equals(file.toString())) {
            return SourceBuffer.read(System.in, options.defaultFileName(), options);
        }
        return SourceBuffer.read(file, options);
    }

    private static JsonArray toJson(List<Token> tokens) {
        JsonArray array = new JsonArray();
        for (Token token : tokens) {
            JsonObject object = new JsonObject();
            object.addProperty("type", token.type().name());
            object.addProperty("text", token.text());
            if (token.value() instanceof Number number) {
                object.addProperty("value", number);
            } else if (token.value() != null) {
                object.addProperty("value", token.value().toString());
            }
            object.addProperty("start", token.start());
            object.addProperty("end", token.end());
            object.addProperty("line", token.line());
            object.addProperty("column", token.column());
            array.add(object);
        }
        return array;
    }
}
