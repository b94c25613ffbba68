package com.vsharp.vgc.api;

import javax.lang.model.SourceVersion;

/**
 * A generated name standing for one computed or literal value in emitted
 * source. Rendered as {@code displayHint + index}, or {@code t<index>} when no
 * hint was given.
 *
 * @param index       Allocation index, unique and increasing per allocator.
 * @param displayHint Optional readable prefix. Must be a Java identifier that
 *                    is not a keyword and does not end in a digit, so that
 *                    {@code hint + index} stays unique.
 * @param dataKind    Host type of the value.
 */
public record Symbol(int index, String displayHint, Class<?> dataKind) {

    public Symbol {
        if (displayHint != null && !isValidHint(displayHint))
            throw new IllegalArgumentException("Invalid symbol hint: '" + displayHint + "'");
    }

    /** Whether a hint can prefix an index and still yield a unique Java name. */
    public static boolean isValidHint(String hint) {
        return SourceVersion.isIdentifier(hint)
                && !SourceVersion.isKeyword(hint)
                && !Character.isDigit(hint.charAt(hint.length() - 1));
    }

    @Override
    public String toString() {
        return displayHint != null ? displayHint + index : "t" + index;
    }
}
