package com.blockflow.pygen.gen;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class LiteralsTest {

    @Test
    public void testQuote() {
        assertEquals("'abc'", Literals.quote("abc"));
        assertEquals("\"it's\"", Literals.quote("it's"));
        assertEquals("'say \"hi\"'", Literals.quote("say \"hi\""));
        assertEquals("'a\\'b\"c'", Literals.quote("a'b\"c"));
        assertEquals("'line\\nbreak'", Literals.quote("line\nbreak"));
    }

    @Test
    public void testNumberNormalisation() {
        assertEquals("18", Literals.number("18"));
        assertEquals("2.5", Literals.number("2.50"));
        assertEquals("0", Literals.number("0.000"));
        assertEquals("-3", Literals.number(" -3 "));
        assertEquals("float('inf')", Literals.number("Infinity"));
        assertNull(Literals.number("abc"));
        assertNull(Literals.number(null));
    }

    @Test
    public void testNumberMagnitudes() {
        assertEquals("1000", Literals.number("1e3"));
        assertEquals("float('inf')", Literals.number("1e50000000"));
        assertEquals("-float('inf')", Literals.number("-2e400"));
        assertEquals("0", Literals.number("1e-400"));
        assertEquals("1E+21", Literals.number("1e21"));
        assertEquals("1.5E+300", Literals.number("15e299"));
        assertEquals("1E-8", Literals.number("0.00000001"));
        assertEquals("0.0001", Literals.number("1e-4"));
    }

    @Test
    public void testIsNumber() {
        assertTrue(Literals.isNumber("10"));
        assertTrue(Literals.isNumber("1e3"));
        assertFalse(Literals.isNumber("x"));
    }

    @Test
    public void testColumnKey() {
        assertEquals("\"age\"", Literals.columnKey(List.of("age")));
        assertEquals("[\"age\",\"city\"]", Literals.columnKey(List.of("age", "city")));
        assertEquals("[]", Literals.columnKey(List.of()));
    }

    @Test
    public void testUnquote() {
        assertEquals("age", Literals.unquote("'age'"));
        assertEquals("age", Literals.unquote("\"age\""));
        assertEquals("'age\"", Literals.unquote("'age\""));
        assertEquals("x", Literals.unquote("x"));
    }
}
