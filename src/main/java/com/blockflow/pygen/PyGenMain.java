package com.blockflow.pygen;

import com.blockflow.pygen.api.CompileResult;
import com.blockflow.pygen.api.Diagnostic;
import com.blockflow.pygen.graph.BlockGraph;
import com.blockflow.pygen.io.GraphDefinitionException;
import com.blockflow.pygen.io.GraphLoader;
import com.blockflow.pygen.web.CompileServer;

import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command line entry point.
 *
 * <pre>
 * PyGenMain &lt;graph.json&gt; [options.properties]   print the generated program
 * PyGenMain --serve [options.properties]          run the compile server
 * </pre>
 *
 * Diagnostics go to the log. The exit code is non-zero only when the graph
 * definition or the options cannot be read.
 */
@Log4j2
public final class PyGenMain {

    private PyGenMain() {
    }

    public static void main(String[] args) {
        int code = run(args);
        // the server keeps the JVM alive on its own threads
        if (code != 0 || !"--serve".equals(args[0]))
            System.exit(code);
    }

    static int run(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: PyGenMain <graph.json>|--serve [options.properties]");
            return 2;
        }

        CompilerOptions options;
        try {
            options = args.length == 2 ? CompilerOptions.load(Path.of(args[1])) : CompilerOptions.defaults();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot read options {}: {}", args[1], e.getMessage());
            return 1;
        }
        BlockCompiler compiler = new BlockCompiler(options);

        if ("--serve".equals(args[0])) {
            CompileServer server = new CompileServer(compiler);
            server.start(options.getServerPort());
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
            return 0;
        }

        BlockGraph graph;
        try {
            graph = new GraphLoader().load(Path.of(args[0]));
        } catch (IOException | GraphDefinitionException e) {
            log.error("Cannot read graph definition {}: {}", args[0], e.getMessage());
            return 1;
        }

        CompileResult result = compiler.compileWithDiagnostics(graph);
        for (Diagnostic d : result.diagnostics()) {
            log.warn("{}", d);
        }
        System.out.print(result.code());
        return 0;
    }
}
