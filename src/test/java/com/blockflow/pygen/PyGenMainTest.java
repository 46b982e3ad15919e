package com.blockflow.pygen;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import static org.junit.Assert.*;

public class PyGenMainTest {

    private PrintStream originalOut;
    private ByteArrayOutputStream captured;

    @Before
    public void setUp() {
        originalOut = System.out;
        captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @After
    public void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    public void testUsage() {
        assertEquals(2, PyGenMain.run(new String[0]));
        assertEquals(2, PyGenMain.run(new String[] { "a", "b", "c" }));
    }

    @Test
    public void testCompilesGraphFile() throws Exception {
        String path = Paths.get(getClass().getResource("/graphs/filter.json").toURI()).toString();

        assertEquals(0, PyGenMain.run(new String[] { path }));
        String out = captured.toString(StandardCharsets.UTF_8);
        assertTrue(out.startsWith("import pandas as pd\n"));
        assertTrue(out.endsWith("adults = df[(df[\"age\"]>18) & (df[\"city\"]=='NY')]\n"));
    }

    @Test
    public void testMissingGraphFile() {
        assertEquals(1, PyGenMain.run(new String[] { "does/not/exist.json" }));
        assertEquals("", captured.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testMissingOptionsFile() throws Exception {
        String path = Paths.get(getClass().getResource("/graphs/filter.json").toURI()).toString();
        assertEquals(1, PyGenMain.run(new String[] { path, "does/not/exist.properties" }));
    }
}
