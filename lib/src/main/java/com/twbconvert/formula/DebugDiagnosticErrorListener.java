package com.twbconvert.formula;

import java.util.BitSet;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Records ambiguity reports while tracing the formula grammar. The stock listener reports through
 * {@link Parser#notifyErrorListeners(String)}, which would reach {@link ThrowingErrorListener} and abort the parse.
 */
final class DebugDiagnosticErrorListener extends DiagnosticErrorListener {

    DebugDiagnosticErrorListener() {
        super(true);
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (exactOnly && !exact) {
            return;
        }
        DebugFlags.captureDiagnostic(
                String.format(
                        "reportAmbiguity d=%s: ambigAlts=%s, input='%s'",
                        getDecisionDescription(recognizer, dfa),
                        getConflictingAlts(ambigAlts, configs),
                        text(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        DebugFlags.captureDiagnostic(
                String.format(
                        "reportAttemptingFullContext d=%s, input='%s'",
                        getDecisionDescription(recognizer, dfa),
                        text(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer, DFA dfa, int startIndex, int stopIndex, int prediction, ATNConfigSet configs) {
        DebugFlags.captureDiagnostic(
                String.format(
                        "reportContextSensitivity d=%s, input='%s'",
                        getDecisionDescription(recognizer, dfa),
                        text(recognizer, startIndex, stopIndex)));
    }

    private static String text(Parser recognizer, int startIndex, int stopIndex) {
        return recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
    }
}
