package com.blockflow.pygen.gen;

import com.blockflow.pygen.catalog.BlockKind;
import com.blockflow.pygen.engine.CompileContext;
import com.blockflow.pygen.engine.Inputs;
import com.blockflow.pygen.engine.Signature;
import com.blockflow.pygen.graph.BlockNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Operand rewriting shared by the data-science generators.
 *
 * A name whose recorded origin is a literal list is not tabular yet; these
 * helpers wrap it before it is handed to pandas or scikit-learn.
 */
final class Operands {

    private Operands() {
    }

    /** True if the child is a name whose last assignment was a literal list. */
    static boolean isListVariable(BlockNode child, CompileContext ctx) {
        return ctx.signatureOf(child)
                .map(Signature::origin)
                .filter(o -> o == BlockKind.LISTS_CREATE_WITH)
                .isPresent();
    }

    /** Features operand: {@code pd.DataFrame(v).T} for a list variable. */
    static String features(Inputs in, String socket, CompileContext ctx) {
        String code = in.code(socket);
        if (isListVariable(in.child(socket), ctx)) {
            ctx.preamble().addImport(PyImports.PANDAS);
            return "pd.DataFrame(" + code + ").T";
        }
        return code;
    }

    /** Expected-label operand: {@code pd.DataFrame(v)} for a list variable. */
    static String labels(Inputs in, String socket, CompileContext ctx) {
        String code = in.code(socket);
        if (isListVariable(in.child(socket), ctx)) {
            ctx.preamble().addImport(PyImports.PANDAS);
            return "pd.DataFrame(" + code + ")";
        }
        return code;
    }

    /**
     * Column name carried by a row of a select block: the raw text of a text
     * block, or the emitted operand with its quotes stripped.
     */
    static String columnName(BlockNode child, CompileContext ctx) {
        if (child == null)
            return "";
        if (child.kind() == BlockKind.TEXT) {
            String v = child.field("TEXT");
            return v == null ? "" : v;
        }
        return Literals.unquote(ctx.reemit(child).text());
    }

    /** Column names of every row of a select block. */
    static List<String> columnNames(BlockNode select, CompileContext ctx) {
        List<String> names = new ArrayList<>(select.arity());
        for (int i = 0; i < select.arity(); i++) {
            names.add(columnName(select.row(i), ctx));
        }
        return names;
    }

    static boolean isKind(BlockNode node, BlockKind kind) {
        return node != null && node.kind() == kind;
    }
}
