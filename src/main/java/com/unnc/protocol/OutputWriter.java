package com.unnc.protocol;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.unnc.protocol.util.SpacedPrinter;
import com.unnc.protocol.util.TreeRenderer;

/**
 * Writes batch results.
 *
 * <ul>
 *   <li>one result that is not an array: that JSON value</li>
 *   <li>several results: one JSON document per line</li>
 *   <li>otherwise: the array of all results</li>
 * </ul>
 *
 * Tree results get an ASCII rendering in a trailing {@code --- Tree Visualization ---} section.
 */
public class OutputWriter {

    public static final String TREE_SECTION = "--- Tree Visualization ---";

    private final ObjectMapper om;
    private final ObjectWriter compact;

    public OutputWriter(ObjectMapper om) {
        this.om = om;
        this.compact = om.writer(new SpacedPrinter());
    }

    public String render(List<CaseResult> results) {
        StringBuilder sb = new StringBuilder();
        if (results.size() == 1 && !results.get(0).output().isArray()) {
            sb.append(json(results.get(0).output()));
        } else if (results.size() > 1) {
            for (int i = 0; i < results.size(); i++) {
                if (i > 0) sb.append('\n');
                sb.append(json(results.get(i).output()));
            }
        } else {
            ArrayNode all = om.createArrayNode();
            for (CaseResult r : results) all.add(r.output());
            sb.append(json(all));
        }

        boolean anyTree = false;
        for (CaseResult r : results) anyTree |= r.isTree();
        if (anyTree) {
            sb.append("\n\n").append(TREE_SECTION).append("\n\n");
            for (int i = 0; i < results.size(); i++) {
                if (!results.get(i).isTree()) continue;
                sb.append("Case ").append(i + 1).append(":\n");
                sb.append(TreeRenderer.render(results.get(i).output())).append("\n\n");
            }
        }
        return sb.toString();
    }

    public void write(List<CaseResult> results, Path out) throws IOException {
        Files.writeString(out, render(results), StandardCharsets.UTF_8);
    }

    private String json(JsonNode n) {
        try {
            return compact.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result", e);
        }
    }
}
