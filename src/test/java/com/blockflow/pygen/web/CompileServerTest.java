package com.blockflow.pygen.web;

import com.blockflow.pygen.BlockCompiler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class CompileServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private CompileServer server;

    @Before
    public void setUp() {
        server = new CompileServer(new BlockCompiler());
    }

    @Test
    public void testCompileReturnsCode() throws Exception {
        CompileServer.Response r = server.handleCompile("{\"graph\":{\"blocks\":["
                + "{\"id\":\"p\",\"type\":\"text_print\",\"inputs\":{\"TEXT\":\"t\"}},"
                + "{\"id\":\"t\",\"type\":\"text\",\"fields\":{\"TEXT\":\"hello\"}}]}}");

        assertEquals(200, r.status());
        JsonNode body = mapper.readTree(r.body());
        assertEquals("\n\n\n\nprint('hello')\n", body.get("code").asText());
        assertEquals(0, body.get("diagnostics").size());
    }

    @Test
    public void testDiagnosticsAreReported() throws Exception {
        CompileServer.Response r = server.handleCompile("{\"graph\":{\"blocks\":["
                + "{\"id\":\"h\",\"type\":\"headTail\"}]}}");

        assertEquals(200, r.status());
        JsonNode diag = mapper.readTree(r.body()).get("diagnostics").get(0);
        assertEquals("MISSING_REQUIRED_SOCKET", diag.get("code").asText());
        assertEquals("h", diag.get("blockId").asText());
        assertEquals("headTail", diag.get("kind").asText());
        assertTrue(diag.get("message").asText().contains("dataframe"));
    }

    @Test
    public void testMalformedBodyIsRejected() throws Exception {
        CompileServer.Response r = server.handleCompile("not json");

        assertEquals(400, r.status());
        assertTrue(mapper.readTree(r.body()).get("error").asText().startsWith("Malformed workspace JSON"));
    }

    @Test
    public void testMissingBodyIsRejected() {
        assertEquals(400, server.handleCompile(null).status());
        assertEquals(400, server.handleCompile("{}").status());
    }

    @Test(expected = IllegalStateException.class)
    public void testPortBeforeStart() {
        server.port();
    }
}
