package org.tova.compiler;

import org.tova.compiler.api.CompilationException;
import org.tova.compiler.api.CompilationResult;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.api.ICompiler;
import org.tova.compiler.backend.CodeGenerator;
import org.tova.compiler.diagnostics.AnalysisError;
import org.tova.compiler.diagnostics.CompilerError;
import org.tova.compiler.diagnostics.CompilerLogger;
import org.tova.compiler.diagnostics.Diagnostic;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.parser.Parser;
import org.tova.compiler.frontend.parser.ast.ProgramNode;
import org.tova.compiler.frontend.semantics.AnalysisResult;
import org.tova.compiler.frontend.semantics.SemanticAnalyzer;
import org.tova.compiler.stdlib.StdlibRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The main compiler implementation. This class orchestrates the pipeline from Tova source text
 * to the generated JavaScript of every target. It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final CompilerLogger log = CompilerLogger.of(Compiler.class);

    private final CompilerOptions options;
    private final StdlibRegistry stdlib;
    private int verbosity = -1;

    public Compiler() {
        this(CompilerOptions.defaults());
    }

    public Compiler(CompilerOptions options) {
        this(options, StdlibRegistry.defaultRegistry());
    }

    public Compiler(CompilerOptions options, StdlibRegistry stdlib) {
        this.options = options;
        this.stdlib = stdlib;
    }

    /**
     * {@inheritDoc}
     * <p>
     * In tolerant mode analysis errors do not stop the pipeline; code is generated for whatever
     * parsed, and the errors are dropped from the result. Lex and parse errors always fail.
     */
    @Override
    public CompilationResult compile(String source, String fileName) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setVerbosity(verbosity);
        }
        long start = System.nanoTime();
        try {
            // Phase 1: Lexical Analysis
            List<Token> tokens = new Lexer(source, fileName).scanTokens();
            log.trace("Lexer produced {} tokens for {}", tokens.size(), fileName);

            // Phase 2: Parsing (builds AST)
            ProgramNode program = new Parser(tokens).parse();

            // Phase 3: Semantic Analysis (scopes, gradual types, lints)
            AnalysisResult analysis = new SemanticAnalyzer(new DiagnosticsEngine(), options).analyze(program);
            if (analysis.hasErrors()) {
                log.warn("Continuing with {} analysis error(s) in tolerant mode", analysis.errors().size());
            }

            // Phase 4: Code Generation
            CompilationResult result = new CompilationResult(fileName,
                    new CodeGenerator(program, fileName, options, stdlib).generate(), analysis.warnings());
            log.info("Compiled {} in {} ms ({} warning(s))", fileName, (System.nanoTime() - start) / 1_000_000,
                    analysis.warnings().size());
            return result;
        } catch (AnalysisError e) {
            throw new CompilationException(summary(e.getErrors()), e.getDiagnostics(), e);
        } catch (CompilerError e) {
            throw new CompilationException(summary(e.getDiagnostics()), e.getDiagnostics(), e);
        }
    }

    @Override
    public List<Diagnostic> check(String source, String fileName) {
        List<Diagnostic> found = new ArrayList<>();
        try {
            ProgramNode program = new Parser(new Lexer(source, fileName).scanTokens()).parse();
            AnalysisResult analysis = new SemanticAnalyzer(new DiagnosticsEngine(), options.withTolerant(true)).analyze(program);
            found.addAll(analysis.errors());
            found.addAll(analysis.warnings());
        } catch (CompilerError e) {
            found.addAll(e.getDiagnostics());
        }
        return found;
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The options this compiler runs with.
     */
    public CompilerOptions getOptions() {
        return options;
    }

    private static String summary(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
