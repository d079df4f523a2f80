package com.lexdfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import static org.junit.Assert.*;

public class DfaTableTest {
    private static final String START = "{DIGIT1.a,IDENT.s,PLUS.q0,S}";

    private static Dfa toyUnion() {
        return HopcroftMinimizer.minimize(SubsetConstruction.determinize(
                AutomatonUnion.union(AutomatonUnionTest.toyTokens())));
    }

    @Test
    public void exportsTokenUnion() {
        JsonObject table = DfaTable.export(toyUnion());

        JsonArray states = table.getAsJsonArray("states");
        assertEquals(4, states.size());
        assertEquals(START, states.get(0).getAsString());
        assertEquals("{DIGIT1.b}", states.get(1).getAsString());
        assertEquals("{IDENT.t}", states.get(2).getAsString());
        assertEquals("{PLUS.q1}", states.get(3).getAsString());

        assertEquals("[\"+\",\"1\",\"g\"]", table.getAsJsonArray("alphabet").toString());
        assertEquals(START, table.get("start").getAsString());

        JsonObject finals = table.getAsJsonObject("finals");
        assertEquals(3, finals.size());
        JsonObject plus = finals.getAsJsonObject("{PLUS.q1}");
        assertEquals("PLUS", plus.get("winner").getAsString());
        assertEquals(10, plus.getAsJsonObject("contenders").get("PLUS").getAsInt());
        assertEquals("IDENT", finals.getAsJsonObject("{IDENT.t}").get("winner").getAsString());

        JsonObject delta = table.getAsJsonObject("delta");
        assertEquals(4, delta.size());
        assertEquals("{PLUS.q1}", delta.get(START + "|+").getAsString());
        assertEquals("{DIGIT1.b}", delta.get(START + "|1").getAsString());
        assertEquals("{IDENT.t}", delta.get(START + "|g").getAsString());
        assertEquals("{IDENT.t}", delta.get("{IDENT.t}|g").getAsString());
    }

    @Test
    public void escapesControlSymbols() {
        JsonObject table = DfaTable.export(new RegexCompiler().compile("\\t"));
        JsonObject delta = table.getAsJsonObject("delta");
        assertEquals(1, delta.size());
        assertEquals("{1}", delta.get("{0}|\\t").getAsString());
        assertTrue(table.getAsJsonArray("alphabet").contains(JsonParser.parseString("\"\\\\t\"")));
    }

    @Test
    public void sortsAlphabetByDisplayString() {
        Dfa dfa = new RegexCompiler().compile("\\t|!|\\[|\\\\");
        JsonArray alphabet = DfaTable.export(dfa).getAsJsonArray("alphabet");
        List<String> symbols = new ArrayList<>();
        for (JsonElement e : alphabet) {
            symbols.add(e.getAsString());
        }
        assertEquals(98, symbols.size());
        List<String> sorted = new ArrayList<>(symbols);
        Collections.sort(sorted);
        assertEquals(sorted, symbols);
        assertTrue(symbols.indexOf("!") < symbols.indexOf("\\t"));
        assertTrue(symbols.indexOf("[") < symbols.indexOf("\\t"));
        assertTrue(symbols.indexOf("\\\\") < symbols.indexOf("\\t"));
    }

    @Test
    public void writesNullWinnerForAnonymousPatterns() {
        Dfa dfa = new RegexCompiler().compile("a");
        JsonObject table = DfaTable.export(dfa);
        JsonObject accept = table.getAsJsonObject("finals").getAsJsonObject("{1}");
        assertTrue(accept.get("winner").isJsonNull());
        assertEquals(0, accept.getAsJsonObject("contenders").size());
        assertTrue(DfaTable.toJson(dfa).contains("\"winner\": null"));
    }

    @Test
    public void jsonRoundTripsToSameTable() {
        Dfa dfa = toyUnion();
        assertEquals(DfaTable.export(dfa), JsonParser.parseString(DfaTable.toJson(dfa)));
    }
}
