package com.lox.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.lox.script.parser.Diagnostics;
import com.lox.script.parser.Diagnostics.Diagnostic;

/**
 * JSON report of a run for editor and CI tooling:
 * {"ok":false,"diagnostics":[{"phase":"SYNTAX","line":3,"where":" at ';'","message":"..."}],"output":[...]}
 */
public final class DiagnosticsJson {

    private static final ObjectMapper om = new ObjectMapper();

    public static ObjectNode toNode(RunResult result) {
        ObjectNode root = toNode(result.diagnostics());
        ArrayNode out = root.putArray("output");
        for (String line : result.output()) out.add(line);
        return root;
    }

    public static ObjectNode toNode(Diagnostics diagnostics) {
        ObjectNode root = om.createObjectNode();
        root.put("ok", !diagnostics.hasErrors());
        ArrayNode arr = root.putArray("diagnostics");
        for (Diagnostic d : diagnostics.all()) {
            ObjectNode n = arr.addObject();
            n.put("phase", d.phase.name());
            n.put("line", d.line);
            n.put("where", d.where);
            n.put("message", d.message);
        }
        return root;
    }

    public static String toJson(RunResult result) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toNode(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode diagnostics", e);
        }
    }

    private DiagnosticsJson() {}
}
