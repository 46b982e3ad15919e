package com.blockflow.pygen.catalog;

import com.blockflow.pygen.api.BlockGenerator;
import com.blockflow.pygen.gen.ChartBlocks;
import com.blockflow.pygen.gen.CoreBlocks;
import com.blockflow.pygen.gen.FrameBlocks;
import com.blockflow.pygen.gen.MetricBlocks;
import com.blockflow.pygen.gen.ModelBlocks;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry mapping {@link BlockKind}s to their schema and code-generation rule.
 */
public final class BlockCatalog {

    /** Schema and generator registered for one kind. */
    public record Entry(BlockKind kind, BlockSchema schema, BlockGenerator generator) {
    }

    private final Map<BlockKind, Entry> registry = new EnumMap<>(BlockKind.class);

    /** Creates an empty catalog. */
    public BlockCatalog() {
    }

    /** Creates a catalog holding every built-in kind. */
    public static BlockCatalog standard() {
        BlockCatalog catalog = new BlockCatalog();
        catalog.registerBuiltIns();
        return catalog;
    }

    public BlockCatalog register(BlockKind kind, BlockSchema schema, BlockGenerator generator) {
        registry.put(kind, new Entry(kind, schema, generator));
        return this;
    }

    /**
     * @throws UnknownKindException if nothing is registered for the kind.
     */
    public Entry resolve(BlockKind kind) {
        Entry e = registry.get(kind);
        if (e == null)
            throw new UnknownKindException("No catalog entry for block type " + kind.id());
        return e;
    }

    /** Schema of the kind, empty if the kind is not registered. */
    public Optional<BlockSchema> schema(BlockKind kind) {
        Entry e = registry.get(kind);
        return e == null ? Optional.empty() : Optional.of(e.schema());
    }

    public boolean contains(BlockKind kind) {
        return registry.containsKey(kind);
    }

    public Set<BlockKind> kinds() {
        return Set.copyOf(registry.keySet());
    }

    // ── Built-in Kinds ──────────────────────────────────────────────

    private void registerBuiltIns() {
        CoreBlocks.register(this);
        FrameBlocks.register(this);
        ModelBlocks.register(this);
        MetricBlocks.register(this);
        ChartBlocks.register(this);
    }
}
