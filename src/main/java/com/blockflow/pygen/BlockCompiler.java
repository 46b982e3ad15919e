package com.blockflow.pygen;

import com.blockflow.pygen.api.CompileListener;
import com.blockflow.pygen.api.CompileResult;
import com.blockflow.pygen.api.Diagnostic;
import com.blockflow.pygen.engine.CodeGenEngine;
import com.blockflow.pygen.engine.CompileContext;
import com.blockflow.pygen.graph.BlockGraph;
import com.blockflow.pygen.graph.BlockNode;
import com.blockflow.pygen.util.CompositeCompileListener;
import com.blockflow.pygen.util.CompileStatsListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Compiler entry point: turns a {@link BlockGraph} into one Python program.
 *
 * <p>
 * A pass:
 * <ul>
 * <li>reserves the workspace's variable names and rebuilds the variable type
 * repository;</li>
 * <li>emits every program root in order through the {@link CodeGenEngine};</li>
 * <li>assembles {@code imports \n\n declarations \n\n body};</li>
 * <li>discards the pass state.</li>
 * </ul>
 * Each pass runs on its own {@link CompileContext}; compiling an unchanged
 * graph twice yields identical text.
 */
public class BlockCompiler {
    private static final Logger log = LogManager.getLogger(BlockCompiler.class);

    private static final Pattern LEADING_BLANK_LINES = Pattern.compile("^\\s+\\n");
    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("\\n\\s+$");
    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+\\n");

    private final CompilerOptions options;
    private final CodeGenEngine engine = new CodeGenEngine();
    private final CompositeCompileListener compositeListener = new CompositeCompileListener();
    private final AtomicLong passes = new AtomicLong();

    public BlockCompiler() {
        this(CompilerOptions.defaults());
    }

    public BlockCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * Registers a listener for compile events. Listeners accumulate; each one
     * sees every later pass.
     */
    public void addListener(CompileListener listener) {
        compositeListener.addForComposite(listener);
    }

    /** Registers and returns a {@link CompileStatsListener}. */
    public CompileStatsListener enableStats() {
        var stats = new CompileStatsListener();
        compositeListener.addForComposite(stats);
        return stats;
    }

    /** The generated program. */
    public String compile(BlockGraph graph) {
        return compileWithDiagnostics(graph).code();
    }

    /** The generated program with the non-fatal diagnostics of the pass. */
    public CompileResult compileWithDiagnostics(BlockGraph graph) {
        long pass = passes.incrementAndGet();
        CompileContext ctx = new CompileContext(graph, options, engine, compositeListener, pass);
        try {
            compositeListener.onCompileStart(pass);

            ctx.names().reserveVariables(graph.variableNames());
            ctx.repository().rebuild(ctx);

            List<String> fragments = new ArrayList<>();
            for (BlockNode root : graph.program()) {
                String text = engine.emitTopLevel(root, ctx);
                if (!text.isEmpty())
                    fragments.add(text);
            }
            String body = cleanBody(String.join("\n", fragments));

            List<Diagnostic> diagnostics = new ArrayList<>(ctx.diagnostics());
            if (options.isCommentDiagnostics() && !diagnostics.isEmpty()) {
                StringBuilder sb = new StringBuilder(body);
                for (Diagnostic d : diagnostics) {
                    sb.append("# warning: ").append(d).append('\n');
                }
                body = sb.toString();
            }

            String code = String.join("\n", ctx.preamble().imports()) + "\n\n"
                    + String.join("\n", ctx.preamble().declarations()) + "\n\n"
                    + body;

            int emitted = ctx.blocksEmitted();
            compositeListener.onCompileEnd(pass, emitted);
            log.debug("Pass {}: {} roots, {} blocks emitted, {} diagnostics, {} repository entries",
                    pass, graph.program().size(), emitted, diagnostics.size(), ctx.repository().size());
            return new CompileResult(code, diagnostics);
        } finally {
            ctx.reset();
        }
    }

    /**
     * Strips leading blank lines, collapses trailing whitespace to one newline
     * and drops spaces before line breaks.
     */
    static String cleanBody(String body) {
        String s = LEADING_BLANK_LINES.matcher(body).replaceFirst("");
        s = TRAILING_WHITESPACE.matcher(s).replaceFirst("\n");
        return TRAILING_SPACES.matcher(s).replaceAll("\n");
    }
}
