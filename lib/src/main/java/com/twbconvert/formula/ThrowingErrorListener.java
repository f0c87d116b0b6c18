package com.twbconvert.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        throw new PositionedCancellation(line, charPositionInLine, msg, e);
    }

    /** Carries the error position out of the recognizer so it can be turned into a character offset. */
    static final class PositionedCancellation extends ParseCancellationException {
        private static final long serialVersionUID = 1L;

        private final int line;
        private final int charPositionInLine;

        PositionedCancellation(int line, int charPositionInLine, String msg, Throwable cause) {
            super("line " + line + ":" + (charPositionInLine + 1) + " " + msg, cause);
            this.line = line;
            this.charPositionInLine = charPositionInLine;
        }

        int getLine() {
            return line;
        }

        int getCharPositionInLine() {
            return charPositionInLine;
        }
    }
}
