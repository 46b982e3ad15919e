package com.blockflow.pygen.engine;

import com.blockflow.pygen.api.DiagnosticCode;
import com.blockflow.pygen.api.Fragment;
import com.blockflow.pygen.catalog.BlockCatalog;
import com.blockflow.pygen.catalog.BlockSchema;
import com.blockflow.pygen.catalog.RowSpec;
import com.blockflow.pygen.catalog.SocketSpec;
import com.blockflow.pygen.catalog.UnknownKindException;
import com.blockflow.pygen.graph.BlockNode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Recursive resolver turning blocks into Python fragments.
 *
 * For every block it is asked to emit, the engine:
 *
 * 1. Resolves the catalog entry. A kind without entry emits nothing and
 * records nothing.
 *
 * 2. Emits every bound socket first, innermost first. Statement sockets are
 * emitted as whole chains. An unbound required socket records a
 * MISSING_REQUIRED_SOCKET diagnostic; the generator then sees the socket's
 * default literal.
 *
 * 3. Runs the kind's generator over the resolved fragments. The generator may
 * add preamble entries and consult the variable type repository.
 *
 * 4. Reports the emission to the listener.
 *
 * Fault containment:
 * A generator that throws degrades its own block to empty text and records a
 * GENERATOR_FAULT diagnostic; the pass carries on with the siblings. A block
 * met again while it is still being emitted records CYCLE_DETECTED and emits
 * nothing. Nothing propagates out of {@link #emit}.
 *
 * The engine only reads the graph. It is stateless; all pass state lives in
 * the {@link CompileContext}.
 */
public final class CodeGenEngine {
    private static final Logger log = LogManager.getLogger(CodeGenEngine.class);

    /**
     * Emits one block and, recursively, everything plugged into it.
     *
     * @return The block's fragment; {@link Fragment#EMPTY} for null, unknown
     *         kinds, cycles and faulted generators.
     */
    public Fragment emit(BlockNode node, CompileContext ctx) {
        if (node == null)
            return Fragment.EMPTY;

        BlockCatalog.Entry entry;
        try {
            entry = ctx.catalog().resolve(node.kind());
        } catch (UnknownKindException e) {
            log.debug("Skipping {}: {}", node, e.getMessage());
            return Fragment.EMPTY;
        }

        if (!ctx.enter(node)) {
            ctx.diagnose(DiagnosticCode.CYCLE_DETECTED, node, "Block reached again while being emitted");
            return Fragment.EMPTY;
        }

        long start = System.nanoTime();
        Fragment result;
        try {
            BlockSchema schema = entry.schema();
            Map<String, Fragment> resolved = resolveSockets(node, schema, ctx);
            Inputs inputs = new Inputs(node, schema, resolved, ctx.indent());
            try {
                result = entry.generator().generate(node, inputs, ctx);
                if (result == null)
                    result = Fragment.EMPTY;
            } catch (RuntimeException e) {
                log.error("Generator for {} failed, emitting nothing", node, e);
                ctx.diagnose(DiagnosticCode.GENERATOR_FAULT, node,
                        e.getClass().getSimpleName() + ": " + e.getMessage());
                result = Fragment.EMPTY;
            }
        } finally {
            ctx.exit(node);
        }

        ctx.countEmission();
        ctx.listener().onBlockEmitted(ctx.pass(), node.id(), node.kind().id(), System.nanoTime() - start);
        return result;
    }

    /** Emits a statement chain, concatenating the statements in order. */
    public String emitChain(BlockNode first, CompileContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (BlockNode n = first; n != null; n = n.next()) {
            sb.append(emit(n, ctx).text());
        }
        return sb.toString();
    }

    /**
     * Emits a program root. Statement roots yield their whole chain; an
     * expression root becomes a line of its own.
     */
    public String emitTopLevel(BlockNode root, CompileContext ctx) {
        if (root.schema() == null || root.isStatement())
            return emitChain(root, ctx);
        String text = emit(root, ctx).text();
        return text.isEmpty() ? text : text + "\n";
    }

    private Map<String, Fragment> resolveSockets(BlockNode node, BlockSchema schema, CompileContext ctx) {
        Map<String, Fragment> resolved = new HashMap<>();
        for (SocketSpec socket : schema.sockets()) {
            BlockNode child = node.input(socket.name());
            if (child == null) {
                if (socket.required()) {
                    ctx.diagnose(DiagnosticCode.MISSING_REQUIRED_SOCKET, node,
                            "Socket '" + socket.name() + "' is empty, using " + describe(socket.defaultLiteral()));
                }
                continue;
            }
            Fragment f = socket.statement()
                    ? Fragment.statement(emitChain(child, ctx))
                    : emit(child, ctx);
            resolved.put(socket.name(), f);
        }
        if (schema.isDynamic()) {
            for (int i = 0; i < node.arity(); i++) {
                String name = RowSpec.socketName(i);
                BlockNode child = node.input(name);
                if (child != null)
                    resolved.put(name, emit(child, ctx));
            }
        }
        return resolved;
    }

    private static String describe(String literal) {
        return literal.isEmpty() ? "empty text" : "'" + literal + "'";
    }
}
