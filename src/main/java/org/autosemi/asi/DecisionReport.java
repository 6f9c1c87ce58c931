package org.autosemi.asi;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.autosemi.lexer.LexerToken;

/**
 * Renders the decisions of a pass for people ({@code --explain}) and for tools ({@code --json}).
 */
public class DecisionReport {

    public static String toText(String fileName, AsiResult result) {
        StringBuilder sb = new StringBuilder();
        if (!result.enabled) {
            return sb.append(fileName).append(": automatic semicolon insertion is disabled\n").toString();
        }
        for (BoundaryDecision decision : result.decisions) {
            LineBoundary boundary = decision.boundary;
            sb.append(fileName).append(':').append(boundary.line)
                    .append(": ").append(decision.decision == InsertionDecision.INSERT ? "insert  " : "suppress")
                    .append(" after '").append(result.sourceTokens.get(boundary.lastTokenIndex).text).append('\'')
                    .append(" before '").append(result.sourceTokens.get(boundary.nextTokenIndex).text).append('\'')
                    .append(" (line ").append(boundary.nextLine)
                    .append(", indent ").append(boundary.precedingIndent).append("->").append(boundary.followingIndent)
                    .append("): ").append(decision.reason.description);
            if (decision.validity != null) {
                sb.append(" [").append(decision.validity).append(']');
            }
            sb.append('\n');
        }
        for (AsiDiagnostic diagnostic : result.diagnostics) {
            sb.append(diagnostic.format(fileName)).append('\n');
        }
        sb.append(fileName).append(": ").append(result.insertionCount()).append(" of ")
                .append(result.decisions.size()).append(" line boundaries terminated\n");
        return sb.toString();
    }

    public static JSONObject toJsonObject(String fileName, AsiResult result) {
        JSONObject report = new JSONObject();
        report.put("file", fileName);
        report.put("enabled", result.enabled);
        report.put("insertions", result.insertionCount());

        JSONArray boundaries = new JSONArray();
        for (BoundaryDecision decision : result.decisions) {
            LineBoundary boundary = decision.boundary;
            LexerToken last = result.sourceTokens.get(boundary.lastTokenIndex);
            LexerToken next = result.sourceTokens.get(boundary.nextTokenIndex);

            JSONObject entry = new JSONObject();
            entry.put("line", boundary.line);
            entry.put("nextLine", boundary.nextLine);
            entry.put("after", last.text);
            entry.put("before", next.text);
            entry.put("precedingIndent", boundary.precedingIndent);
            entry.put("followingIndent", boundary.followingIndent);
            entry.put("continuation", boundary.hasContinuationMarker);
            entry.put("blockClose", boundary.isBlockClose);
            entry.put("implicitReturn", boundary.isImplicitReturnPosition);
            if (boundary.enclosingDelimiter != 0) {
                entry.put("enclosing", String.valueOf(boundary.enclosingDelimiter));
            }
            entry.put("decision", decision.decision.name());
            entry.put("reason", decision.reason.name());
            if (decision.validity != null) {
                JSONObject validity = new JSONObject();
                validity.put("determined", decision.validity.determined);
                validity.put("insert", decision.validity.insertValid);
                validity.put("suppress", decision.validity.suppressValid);
                validity.put("terminatorOptional", decision.validity.terminatorOptional);
                entry.put("validity", validity);
            }
            boundaries.add(entry);
        }
        report.put("boundaries", boundaries);

        JSONArray diagnostics = new JSONArray();
        for (AsiDiagnostic diagnostic : result.diagnostics) {
            JSONObject entry = new JSONObject();
            entry.put("severity", diagnostic.severity.name().toLowerCase());
            entry.put("code", diagnostic.code);
            entry.put("line", diagnostic.line);
            entry.put("column", diagnostic.column);
            entry.put("message", diagnostic.message);
            diagnostics.add(entry);
        }
        report.put("diagnostics", diagnostics);
        return report;
    }

    public static String toJson(String fileName, AsiResult result) {
        return JSON.toJSONString(toJsonObject(fileName, result), JSONWriter.Feature.PrettyFormat);
    }
}
