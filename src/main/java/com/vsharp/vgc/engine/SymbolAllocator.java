package com.vsharp.vgc.engine;

import com.vsharp.vgc.api.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Issues unique names for intermediate values.
 *
 * Indices start at 0 and only grow. There is no way to free a symbol; the
 * allocator lives exactly as long as one build session.
 */
public final class SymbolAllocator {
    private int counter;
    private final List<Symbol> symbols = new ArrayList<>();

    public Symbol allocate(Class<?> dataKind) {
        return allocate(dataKind, null);
    }

    public Symbol allocate(Class<?> dataKind, String nameHint) {
        var symbol = new Symbol(counter++, nameHint, dataKind);
        symbols.add(symbol);
        return symbol;
    }

    /** Every symbol allocated so far, in allocation order. */
    public List<Symbol> allSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    public int size() {
        return symbols.size();
    }
}
