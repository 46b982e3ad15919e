package com.blockflow.pygen.io;

import com.blockflow.pygen.catalog.BlockCatalog;
import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.catalog.RowSpec;
import com.blockflow.pygen.catalog.UnknownKindException;
import com.blockflow.pygen.graph.ArityDesyncException;
import com.blockflow.pygen.graph.BlockGraph;
import com.blockflow.pygen.graph.BlockNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds a live {@link BlockGraph} from a {@link GraphDefinition}.
 *
 * <p>
 * Loading is lenient in the way the editor is: a block whose type is not known,
 * a field the block does not have, or a binding to a missing block is logged
 * and skipped, so one bad entry never costs the rest of the workspace. Only
 * input that is not a workspace at all raises {@link GraphDefinitionException}.
 *
 * <p>
 * Dynamic blocks are resized to their persisted {@code arity} before their
 * bindings are restored; a binding to a row at or beyond that arity is
 * dropped. Without a persisted arity the block grows to cover its highest
 * bound row. Either way the row count is clamped to {@link #MAX_ARITY}.
 */
public final class GraphLoader {
    private static final Logger log = LogManager.getLogger(GraphLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Most rows a loaded dynamic block may have. */
    public static final int MAX_ARITY = 1024;

    private final BlockCatalog catalog;

    public GraphLoader() {
        this(BlockCatalog.standard());
    }

    public GraphLoader(BlockCatalog catalog) {
        this.catalog = catalog;
    }

    public BlockGraph load(String json) {
        try {
            return load(MAPPER.readValue(json, GraphDefinition.class));
        } catch (JsonProcessingException e) {
            throw new GraphDefinitionException("Malformed workspace JSON: " + e.getOriginalMessage(), e);
        }
    }

    public BlockGraph load(Path file) throws IOException {
        return load(Files.readString(file, StandardCharsets.UTF_8));
    }

    public BlockGraph load(GraphDefinition def) {
        if (def == null || def.getGraph() == null)
            throw new GraphDefinitionException("Workspace has no 'graph' object");
        GraphDefinition.GraphInfo info = def.getGraph();
        List<GraphDefinition.BlockDef> defs = info.getBlocks() != null ? info.getBlocks() : Collections.emptyList();

        BlockGraph graph = new BlockGraph(catalog);

        // 1. Blocks, rows and fields
        List<GraphDefinition.BlockDef> created = new ArrayList<>(defs.size());
        for (GraphDefinition.BlockDef bd : defs) {
            BlockNode node = createBlock(graph, bd);
            if (node == null)
                continue;
            created.add(bd);
            if (node.isDynamic())
                graph.mutator(node).resize(rowCount(node, bd));
            else if (bd.getArity() != null)
                log.warn("Ignoring arity of block {}: {} has no rows", bd.getId(), bd.getType());
            restoreFields(node, bd);
        }

        // 2. Bindings and statement chains, now that every block exists
        for (GraphDefinition.BlockDef bd : created) {
            BlockNode node = graph.node(bd.getId());
            if (bd.getInputs() != null) {
                for (Map.Entry<String, String> e : bd.getInputs().entrySet()) {
                    restoreBinding(graph, node, e.getKey(), e.getValue());
                }
            }
            if (bd.getNext() != null) {
                BlockNode successor = graph.node(bd.getNext());
                if (successor == null) {
                    log.warn("Block {} is followed by unknown block {}", bd.getId(), bd.getNext());
                } else {
                    try {
                        graph.chain(node, successor);
                    } catch (IllegalArgumentException e) {
                        log.warn("Dropping link {} -> {}: {}", bd.getId(), bd.getNext(), e.getMessage());
                    }
                }
            }
        }

        // 3. Program roots
        if (info.getProgram() != null) {
            for (String id : info.getProgram()) {
                BlockNode root = graph.node(id);
                if (root == null) {
                    log.warn("Program references unknown block {}", id);
                    continue;
                }
                try {
                    graph.addToProgram(root);
                } catch (IllegalArgumentException e) {
                    log.warn("Block {} cannot be a program root: {}", id, e.getMessage());
                }
            }
        } else {
            for (BlockNode node : graph.nodes()) {
                if (node.parent() == null && node.previous() == null)
                    graph.addToProgram(node);
            }
        }

        log.info("Loaded workspace '{}' with {} blocks and {} program roots",
                info.getName(), graph.size(), graph.program().size());
        return graph;
    }

    private static BlockNode createBlock(BlockGraph graph, GraphDefinition.BlockDef bd) {
        if (bd.getId() == null || bd.getId().isBlank()) {
            log.warn("Skipping block of type {} without id", bd.getType());
            return null;
        }
        BlockKind kind;
        try {
            kind = BlockKind.fromId(bd.getType());
        } catch (UnknownKindException e) {
            log.warn("Skipping block {}: {}", bd.getId(), e.getMessage());
            return null;
        }
        try {
            return graph.newNode(bd.getId(), kind);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping block {}: {}", bd.getId(), e.getMessage());
            return null;
        }
    }

    /** Persisted arity, or enough rows for the highest bound row, at most {@link #MAX_ARITY}. */
    private static int rowCount(BlockNode node, GraphDefinition.BlockDef bd) {
        int rows;
        if (bd.getArity() != null) {
            rows = Math.max(0, bd.getArity());
        } else {
            rows = node.arity();
            if (bd.getInputs() != null) {
                for (String socket : bd.getInputs().keySet()) {
                    rows = Math.max(rows, RowSpec.rowIndex(socket) + 1);
                }
            }
        }
        if (rows > MAX_ARITY) {
            log.warn("Clamping arity of block {} from {} to {}", bd.getId(), rows, MAX_ARITY);
            rows = MAX_ARITY;
        }
        return rows;
    }

    private static void restoreFields(BlockNode node, GraphDefinition.BlockDef bd) {
        if (bd.getFields() == null)
            return;
        for (Map.Entry<String, String> e : bd.getFields().entrySet()) {
            String name = e.getKey();
            String value = e.getValue() != null ? e.getValue() : "";
            try {
                if (node.schema() == null || node.schema().field(name).isPresent() || !node.isDynamic()) {
                    node.setField(name, value);
                } else {
                    int split = rowSuffixStart(name);
                    if (split <= 0 || split == name.length())
                        throw new IllegalArgumentException("Block " + node.id() + " has no field " + name);
                    node.setRowField(Integer.parseInt(name.substring(split)), name.substring(0, split), value);
                }
            } catch (ArityDesyncException e2) {
                log.warn("Dropping field {} of block {}: row {} is beyond arity {}",
                        name, node.id(), e2.index(), e2.arity());
            } catch (IllegalArgumentException e2) {
                log.warn("Dropping field {} of block {}: {}", name, node.id(), e2.getMessage());
            }
        }
    }

    private static int rowSuffixStart(String name) {
        int i = name.length();
        while (i > 0 && Character.isDigit(name.charAt(i - 1)))
            i--;
        return i;
    }

    private static void restoreBinding(BlockGraph graph, BlockNode parent, String socket, String childId) {
        BlockNode child = childId != null ? graph.node(childId) : null;
        if (child == null) {
            log.warn("Dropping binding {}.{}: unknown block {}", parent.id(), socket, childId);
            return;
        }
        try {
            graph.connect(parent, socket, child);
        } catch (ArityDesyncException e) {
            log.warn("Dropping binding {}.{} -> {}: row {} is beyond arity {}",
                    parent.id(), socket, childId, e.index(), e.arity());
        } catch (IllegalArgumentException e) {
            log.warn("Dropping binding {}.{} -> {}: {}", parent.id(), socket, childId, e.getMessage());
        }
    }
}
