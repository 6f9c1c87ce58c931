package org.autosemi.asi;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.autosemi.ArgumentParser;
import org.autosemi.CompilerContext;
import org.autosemi.lexer.Lexer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DecisionReportTest {

    private static final CompilerContext CTX = new CompilerContext("t.src", new ArgumentParser.CompilerOptions());

    private static AsiResult run(String code, AsiConfig config) {
        return new AutoSemicolonPass(config, CTX).run(new Lexer(code, "t.src").tokenize());
    }

    @Test
    public void testTextReport() {
        String text = DecisionReport.toText("t.src", run("let a = 1\nlet b = a\n    + 2\n", AsiConfig.DEFAULT));
        String[] lines = text.split("\n");

        assertEquals(3, lines.length);
        assertEquals("t.src:1: insert   after '1' before 'let' (line 2, indent 0->0): "
                + "same or shallower indentation starts a new statement [insert=valid suppress=invalid]", lines[0]);
        assertTrue(lines[1].startsWith("t.src:2: suppress after 'a' before '+' (line 3, indent 0->4): "
                + "deeper indentation continues the statement"), lines[1]);
        assertEquals("t.src: 1 of 2 line boundaries terminated", lines[2]);
    }

    @Test
    public void testTextReportListsDiagnostics() {
        String text = DecisionReport.toText("t.src", run("x = 1\nelse\n", AsiConfig.DEFAULT));
        assertTrue(text.contains("t.src:1:6: error: ambiguous line boundary"), text);
        assertTrue(text.endsWith("t.src: 0 of 1 line boundaries terminated\n"));
    }

    @Test
    public void testDisabled() {
        AsiResult result = run("let a = 1\nlet b = 2\n", AsiConfig.DEFAULT.withEnabled(false));
        assertEquals("t.src: automatic semicolon insertion is disabled\n", DecisionReport.toText("t.src", result));
    }

    @Test
    public void testJsonReport() {
        String json = DecisionReport.toJson("t.src", run("f(a,\n  b)\nreturn\nx\n", AsiConfig.DEFAULT));
        JSONObject report = JSON.parseObject(json);

        assertEquals("t.src", report.getString("file"));
        assertTrue(report.getBooleanValue("enabled"));
        assertEquals(2, report.getIntValue("insertions"));

        JSONArray boundaries = report.getJSONArray("boundaries");
        assertEquals(3, boundaries.size());

        JSONObject group = boundaries.getJSONObject(0);
        assertEquals("(", group.getString("enclosing"));
        assertEquals("SUPPRESS", group.getString("decision"));
        assertEquals(2, group.getIntValue("followingIndent"));
        assertTrue(group.getJSONObject("validity").getBooleanValue("suppress"));

        JSONObject close = boundaries.getJSONObject(1);
        assertTrue(close.getBooleanValue("blockClose"));
        assertFalse(close.containsKey("enclosing"));
        assertEquals("BLOCK_CLOSE", close.getString("reason"));
        assertEquals("INSERT", close.getString("decision"));

        JSONObject jump = boundaries.getJSONObject(2);
        assertEquals("return", jump.getString("after"));
        assertEquals("x", jump.getString("before"));
        assertEquals("INSERT", jump.getString("decision"));

        assertTrue(report.getJSONArray("diagnostics").isEmpty());
    }
}
