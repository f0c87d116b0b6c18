package com.twbconvert.formula;

import com.twbconvert.formula.grammar.TableauFormulaLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

public final class DebugFlags {
    private static final String TOKENS_PROPERTY = "twbconvert.debugTokens";
    private static final String PARSER_PROPERTY = "twbconvert.debugParser";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "TWBCONVERT_DEBUG_TOKENS";
    private static final String PARSER_ENV = "TWBCONVERT_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS = ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS = ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return flag(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isParserTraceEnabled() {
        return flag(PARSER_PROPERTY, PARSER_ENV);
    }

    private static boolean flag(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }

    /** Captures one line per token; {@link FormulaParser} logs and drains them after the parse. */
    public static void captureTokens(CommonTokenStream tokens, TableauFormulaLexer lexer) {
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            CAPTURED_TOKENS.get().add(
                    String.format(
                            Locale.ROOT,
                            "%-15s @ %4d..%-4d -> %s",
                            symbolic,
                            token.getStartIndex(),
                            token.getStopIndex(),
                            token.getText()));
        }
    }

    public static DebugDiagnosticErrorListener diagnosticListener() {
        return new DebugDiagnosticErrorListener();
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }

    static void captureDiagnostic(String message) {
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    public static List<String> drainCapturedDiagnostics() {
        List<String> captured = new ArrayList<>(CAPTURED_DIAGNOSTICS.get());
        CAPTURED_DIAGNOSTICS.get().clear();
        return captured;
    }
}
