package com.blockflow.pygen.web;

import com.blockflow.pygen.BlockCompiler;
import com.blockflow.pygen.api.CompileResult;
import com.blockflow.pygen.api.Diagnostic;
import com.blockflow.pygen.graph.BlockGraph;
import com.blockflow.pygen.io.GraphDefinitionException;
import com.blockflow.pygen.io.GraphLoader;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.javalin.Javalin;
import lombok.extern.log4j.Log4j2;

/**
 * HTTP front end of the compiler.
 *
 * <pre>
 * POST /api/compile   body: graph definition JSON
 *   200 {"code": "...", "diagnostics": [{"code", "blockId", "kind", "message"}]}
 *   400 {"error": "..."}   when the body is not a graph definition
 * </pre>
 *
 * Each request loads its own graph and runs its own pass, so requests never
 * share mutable state.
 */
@Log4j2
public class CompileServer {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final BlockCompiler compiler;
    private final GraphLoader loader;
    private Javalin app;

    /** Status and JSON body of one compile request. */
    public record Response(int status, String body) {
    }

    public CompileServer(BlockCompiler compiler) {
        this(compiler, new GraphLoader());
    }

    public CompileServer(BlockCompiler compiler, GraphLoader loader) {
        this.compiler = compiler;
        this.loader = loader;
    }

    /**
     * Starts the server on the given port; 0 picks a free one.
     */
    public void start(int port) {
        log.info("Starting compile server on port {}", port);
        app = Javalin.create(config -> config.showJavalinBanner = false).start(port);

        app.post("/api/compile", ctx -> {
            Response r = handleCompile(ctx.body());
            ctx.status(r.status()).contentType("application/json").result(r.body());
        });
    }

    /** The bound port, once started. */
    public int port() {
        if (app == null)
            throw new IllegalStateException("Server not started");
        return app.port();
    }

    /**
     * Compiles one graph definition. Graph content never fails a request;
     * only an unreadable definition answers 400.
     */
    public Response handleCompile(String body) {
        BlockGraph graph;
        try {
            graph = loader.load(body == null ? "" : body);
        } catch (GraphDefinitionException e) {
            log.warn("Rejected compile request: {}", e.getMessage());
            ObjectNode error = MAPPER.createObjectNode().put("error", e.getMessage());
            return new Response(400, write(error));
        }

        CompileResult result = compiler.compileWithDiagnostics(graph);
        ObjectNode out = MAPPER.createObjectNode().put("code", result.code());
        ArrayNode diags = out.putArray("diagnostics");
        for (Diagnostic d : result.diagnostics()) {
            diags.addObject()
                    .put("code", d.code().name())
                    .put("blockId", d.blockId())
                    .put("kind", d.kind())
                    .put("message", d.message());
        }
        return new Response(200, write(out));
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            log.info("Compile server stopped");
        }
    }

    private static String write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize response", e);
        }
    }
}
