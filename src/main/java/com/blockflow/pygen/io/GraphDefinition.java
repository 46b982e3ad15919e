package com.blockflow.pygen.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a persisted block workspace.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** The workspace: its blocks and the roots of its program. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name;
        private List<BlockDef> blocks;
        private List<String> program;
    }

    /**
     * One block. {@code inputs} maps socket names (including row sockets
     * {@code ADD0}, {@code ADD1}, ...) to block ids; {@code fields} holds
     * fixed fields and row fields, the latter suffixed with their row index.
     * {@code arity} is the row count of a dynamic block, absent otherwise.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class BlockDef {
        private String id, type, next;
        private Integer arity;
        private Map<String, String> fields;
        private Map<String, String> inputs;
    }
}
