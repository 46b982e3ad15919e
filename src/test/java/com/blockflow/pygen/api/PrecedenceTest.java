package com.blockflow.pygen.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class PrecedenceTest {

    @Test
    public void testTighterInnerNeedsNoParens() {
        assertFalse(Precedence.needsParens(Precedence.MEMBER, Precedence.ATOMIC));
        assertFalse(Precedence.needsParens(Precedence.RELATIONAL, Precedence.ADDITIVE));
        assertFalse(Precedence.needsParens(Precedence.NONE, Precedence.LOGICAL_OR));
    }

    @Test
    public void testLooserInnerNeedsParens() {
        assertTrue(Precedence.needsParens(Precedence.MEMBER, Precedence.RELATIONAL));
        assertTrue(Precedence.needsParens(Precedence.MULTIPLICATIVE, Precedence.ADDITIVE));
    }

    @Test
    public void testSameClassIsParenthesised() {
        assertTrue(Precedence.needsParens(Precedence.ADDITIVE, Precedence.ADDITIVE));
        assertTrue(Precedence.needsParens(Precedence.RELATIONAL, Precedence.RELATIONAL));
    }

    @Test
    public void testAtomicAndNoneNeverParenthesiseThemselves() {
        assertFalse(Precedence.needsParens(Precedence.ATOMIC, Precedence.ATOMIC));
        assertFalse(Precedence.needsParens(Precedence.NONE, Precedence.NONE));
    }

    @Test
    public void testCallAndMemberChain() {
        assertFalse(Precedence.needsParens(Precedence.MEMBER, Precedence.FUNCTION_CALL));
        assertFalse(Precedence.needsParens(Precedence.FUNCTION_CALL, Precedence.MEMBER));
        assertFalse(Precedence.needsParens(Precedence.MEMBER, Precedence.MEMBER));
    }

    @Test
    public void testSameLogicalOperatorChains() {
        assertFalse(Precedence.needsParens(Precedence.LOGICAL_AND, Precedence.LOGICAL_AND));
        assertFalse(Precedence.needsParens(Precedence.LOGICAL_OR, Precedence.LOGICAL_OR));
    }

    @Test
    public void testFragmentTextIn() {
        Fragment cmp = Fragment.of("a > b", Precedence.RELATIONAL);
        assertEquals("(a > b)", cmp.textIn(Precedence.MEMBER));
        assertEquals("a > b", cmp.textIn(Precedence.NONE));
        assertEquals("", Fragment.EMPTY.textIn(Precedence.ATOMIC));
    }

    @Test
    public void testNullTextBecomesEmpty() {
        Fragment f = Fragment.of(null, null);
        assertTrue(f.isEmpty());
        assertEquals(Precedence.NONE, f.precedence());
    }
}
