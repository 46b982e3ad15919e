package com.blockflow.pygen.engine;

import com.blockflow.pygen.CompilerOptions;
import com.blockflow.pygen.api.CompileListener;
import com.blockflow.pygen.api.Diagnostic;
import com.blockflow.pygen.api.DiagnosticCode;
import com.blockflow.pygen.api.Fragment;
import com.blockflow.pygen.api.KindTag;
import com.blockflow.pygen.catalog.BlockCatalog;
import com.blockflow.pygen.graph.BlockGraph;
import com.blockflow.pygen.graph.BlockNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * State of one compile pass, owned by exactly one call to the compiler.
 *
 * Bundles the graph being read with everything a pass mutates: the variable
 * type repository, the preamble, the generated-name counters and the
 * diagnostics. Nothing here is shared between passes, so passes over distinct
 * contexts never interfere.
 */
public final class CompileContext {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final BlockGraph graph;
    private final CompilerOptions options;
    private final CodeGenEngine engine;
    private final CompileListener listener;
    private final long pass;

    private final VariableTypeRepository repository;
    private final Preamble preamble;
    private final NameGenerator names = new NameGenerator();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<BlockNode> emitting = Collections.newSetFromMap(new IdentityHashMap<>());
    private int blocksEmitted;

    public CompileContext(BlockGraph graph, CompilerOptions options, CodeGenEngine engine,
            CompileListener listener, long pass) {
        this(graph, options, engine, listener, pass, new VariableTypeRepository(), new Preamble());
    }

    private CompileContext(BlockGraph graph, CompilerOptions options, CodeGenEngine engine,
            CompileListener listener, long pass, VariableTypeRepository repository, Preamble preamble) {
        this.graph = graph;
        this.options = options;
        this.engine = engine;
        this.listener = listener == null ? CompileListener.NOOP : listener;
        this.pass = pass;
        this.repository = repository;
        this.preamble = preamble;
    }

    /** Shared Jackson mapper for literal rendering and parsing. */
    public static ObjectMapper json() {
        return JSON;
    }

    /**
     * A throwaway context over the same graph and repository. Its preamble,
     * names and diagnostics are discarded with it and nothing is reported to
     * the listener.
     */
    public CompileContext scratch() {
        return new CompileContext(graph, options, engine, CompileListener.NOOP, pass, repository, new Preamble());
    }

    /**
     * Emits a block whose subtree the pass already emitted elsewhere, such as
     * the producer behind a name reference. Imports and declarations still
     * reach this pass's preamble; diagnostics and emission events are not
     * recorded a second time.
     */
    public Fragment reemit(BlockNode node) {
        return new CompileContext(graph, options, engine, CompileListener.NOOP, pass, repository, preamble)
                .emit(node);
    }

    // ── Emission ─────────────────────────────────────────────────────

    /** Emits a block; null yields {@link Fragment#EMPTY}. */
    public Fragment emit(BlockNode node) {
        return engine.emit(node, this);
    }

    /** Emits a statement chain starting at {@code first}. */
    public String emitChain(BlockNode first) {
        return engine.emitChain(first, this);
    }

    // ── Provenance ───────────────────────────────────────────────────

    /**
     * The block a socket child stands for in structural decisions. A name
     * reference resolves to the value of the last assignment to that name;
     * anything else, or a name never assigned, stands for itself.
     */
    public BlockNode provenance(BlockNode child) {
        if (child == null || !child.kind().is(KindTag.NAME_REFERENCE))
            return child;
        BlockNode producer = graph.producerOf(child.field(BlockGraph.VAR_FIELD));
        return producer == null ? child : producer;
    }

    /** Repository signature of a name-reference child; empty for any other child. */
    public Optional<Signature> signatureOf(BlockNode child) {
        return repository.lookup(child);
    }

    // ── Diagnostics ──────────────────────────────────────────────────

    public void diagnose(DiagnosticCode code, BlockNode node, String message) {
        Diagnostic d = new Diagnostic(code, node.id(), node.kind().id(), message);
        diagnostics.add(d);
        listener.onDiagnostic(pass, d);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    // ── Accessors ────────────────────────────────────────────────────

    public BlockGraph graph() {
        return graph;
    }

    public BlockCatalog catalog() {
        return graph.catalog();
    }

    public CompilerOptions options() {
        return options;
    }

    /** One level of indentation. */
    public String indent() {
        return options.getIndent();
    }

    public VariableTypeRepository repository() {
        return repository;
    }

    public Preamble preamble() {
        return preamble;
    }

    public NameGenerator names() {
        return names;
    }

    public CompileListener listener() {
        return listener;
    }

    public long pass() {
        return pass;
    }

    public int blocksEmitted() {
        return blocksEmitted;
    }

    /** Clears every per-pass structure. */
    public void reset() {
        repository.clear();
        preamble.reset();
        names.reset();
        diagnostics.clear();
        emitting.clear();
        blocksEmitted = 0;
    }

    // Cycle guard and counters, driven by CodeGenEngine.

    boolean enter(BlockNode node) {
        return emitting.add(node);
    }

    void exit(BlockNode node) {
        emitting.remove(node);
    }

    void countEmission() {
        blocksEmitted++;
    }
}
