package com.twbconvert.translate;

import com.twbconvert.workbook.FieldKey;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class TranslationResult {
    private final List<TranslatedExpression> fields;
    private final List<TranslatedExpression> parameters;
    private final SymbolTable symbols;

    public TranslationResult(
            List<TranslatedExpression> fields, List<TranslatedExpression> parameters, SymbolTable symbols) {
        this.fields = List.copyOf(fields);
        this.parameters = List.copyOf(parameters);
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    /** Translated calculated fields in dependency order. */
    public List<TranslatedExpression> getFields() {
        return fields;
    }

    /** One measure per workbook parameter, in declaration order. */
    public List<TranslatedExpression> getParameters() {
        return parameters;
    }

    /** Symbols of every column, parameter and translated field; later stages resolve shelf references with it. */
    public SymbolTable getSymbols() {
        return symbols;
    }

    public Optional<TranslatedExpression> find(FieldKey key) {
        return fields.stream().filter(t -> t.getKey().equals(key)).findFirst();
    }
}
