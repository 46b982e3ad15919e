package com.blockflow.pygen.engine;

import com.blockflow.pygen.api.KindTag;
import com.blockflow.pygen.api.Precedence;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.graph.BlockGraph;
import com.blockflow.pygen.graph.BlockNode;
import com.fasterxml.jackson.core.JsonProcessingException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-pass table from variable name to the {@link Signature} of the value last
 * assigned to it.
 *
 * {@link #rebuild} makes one flat pass over the assignment blocks in
 * declaration order:
 * <ul>
 * <li>model-like value: (label text, features text, kind), "[]" for an
 * unbound operand;</li>
 * <li>literal collection: ("", JSON list of element texts, kind), "None" for
 * an unbound element;</li>
 * <li>aggregate-like value: ("", "", kind);</li>
 * <li>anything else, or no value: the name has no signature.</li>
 * </ul>
 * A later assignment replaces the signature of an earlier one, so at most one
 * signature is live per name.
 */
public final class VariableTypeRepository {
    private static final Logger log = LogManager.getLogger(VariableTypeRepository.class);

    static final String UNBOUND_OPERAND = "[]";
    static final String UNBOUND_ELEMENT = "None";

    private final Map<String, Signature> signatures = new LinkedHashMap<>();

    /**
     * Discards every entry and records the signatures of the given pass.
     * Operand texts are produced in a scratch context so the pass's preamble,
     * names and diagnostics are not touched.
     */
    public void rebuild(CompileContext ctx) {
        signatures.clear();
        CompileContext scratch = ctx.scratch();
        BlockGraph graph = ctx.graph();

        for (BlockNode assignment : graph.assignments()) {
            String name = NameGenerator.variableName(assignment.field(BlockGraph.VAR_FIELD));
            BlockNode value = assignment.input(BlockGraph.VALUE_SOCKET);
            Signature sig = value == null ? null : signatureOf(value, scratch);
            if (sig == null) {
                signatures.remove(name);
            } else {
                signatures.put(name, sig);
            }
        }
        log.debug("Variable type repository rebuilt with {} signatures", signatures.size());
    }

    public Optional<Signature> lookup(String name) {
        return Optional.ofNullable(signatures.get(name));
    }

    /** Signature of the variable read by a name-reference block, if any. */
    public Optional<Signature> lookup(BlockNode reference) {
        if (reference == null || !reference.kind().is(KindTag.NAME_REFERENCE))
            return Optional.empty();
        return lookup(NameGenerator.variableName(reference.field(BlockGraph.VAR_FIELD)));
    }

    public Map<String, Signature> entries() {
        return Collections.unmodifiableMap(signatures);
    }

    public int size() {
        return signatures.size();
    }

    public void clear() {
        signatures.clear();
    }

    private static Signature signatureOf(BlockNode value, CompileContext scratch) {
        BlockKind kind = value.kind();
        if (kind.is(KindTag.MODEL_LIKE)) {
            String label = operand(value.input("label"), scratch);
            String features = operand(value.input("features"), scratch);
            return new Signature(label, features, kind);
        }
        if (kind.is(KindTag.DYNAMIC_COLLECTION)) {
            List<String> elements = new ArrayList<>(value.arity());
            for (int i = 0; i < value.arity(); i++) {
                String text = scratch.emit(value.row(i)).text();
                elements.add(text.isEmpty() ? UNBOUND_ELEMENT : text);
            }
            try {
                return new Signature("", CompileContext.json().writeValueAsString(elements), kind);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot serialize list elements of " + value, e);
            }
        }
        if (kind.is(KindTag.AGGREGATE_LIKE)) {
            return new Signature("", "", kind);
        }
        return null;
    }

    private static String operand(BlockNode child, CompileContext scratch) {
        String text = scratch.emit(child).textIn(Precedence.MEMBER);
        return text.isEmpty() ? UNBOUND_OPERAND : text;
    }
}
