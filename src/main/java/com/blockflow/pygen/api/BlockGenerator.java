package com.blockflow.pygen.api;

import com.blockflow.pygen.engine.CompileContext;
import com.blockflow.pygen.engine.Inputs;
import com.blockflow.pygen.graph.BlockNode;

/**
 * Code-generation rule of one block kind.
 *
 * The engine has already emitted every bound socket when this is called;
 * {@code in} exposes those fragments together with the schema defaults.
 * Implementations may register preamble entries through {@code ctx} and may
 * consult the variable type repository for name-only operands.
 */
@FunctionalInterface
public interface BlockGenerator {
    Fragment generate(BlockNode node, Inputs in, CompileContext ctx);
}
