package com.latexword.converter.text;

import java.util.Map;
import java.util.Optional;

/**
 * Maps LaTeX symbol macros (without the leading backslash) to Unicode text.
 */
public final class SymbolTable {

    private static final Map<String, String> SYMBOLS = Map.ofEntries(
        Map.entry("geq", "≥"),
        Map.entry("leq", "≤"),
        Map.entry("neq", "≠"),
        Map.entry("approx", "≈"),
        Map.entry("times", "×"),
        Map.entry("div", "÷"),
        Map.entry("pm", "±"),
        Map.entry("cdot", "·"),
        Map.entry("ldots", "…"),
        Map.entry("dots", "…"),
        Map.entry("rightarrow", "→"),
        Map.entry("leftarrow", "←"),
        Map.entry("Rightarrow", "⇒"),
        Map.entry("Leftarrow", "⇐"),
        Map.entry("leftrightarrow", "↔"),
        Map.entry("uparrow", "↑"),
        Map.entry("downarrow", "↓"),
        Map.entry("infty", "∞"),
        Map.entry("partial", "∂"),
        Map.entry("nabla", "∇"),
        Map.entry("forall", "∀"),
        Map.entry("exists", "∃"),
        Map.entry("in", "∈"),
        Map.entry("notin", "∉"),
        Map.entry("subset", "⊂"),
        Map.entry("supset", "⊃"),
        Map.entry("cup", "∪"),
        Map.entry("cap", "∩"),
        Map.entry("alpha", "α"),
        Map.entry("beta", "β"),
        Map.entry("gamma", "γ"),
        Map.entry("delta", "δ"),
        Map.entry("lambda", "λ"),
        Map.entry("mu", "μ"),
        Map.entry("sigma", "σ"),
        Map.entry("omega", "ω"),
        Map.entry("pi", "π"),
        Map.entry("theta", "θ"),
        Map.entry("phi", "φ"),
        Map.entry("sum", "∑"),
        Map.entry("prod", "∏"),
        Map.entry("int", "∫"),
        Map.entry("sqrt", "√"),
        Map.entry("degree", "°"),
        Map.entry("copyright", "©"),
        Map.entry("registered", "®"),
        Map.entry("trademark", "™"),
        Map.entry("dag", "†"),
        Map.entry("ddag", "‡"),
        Map.entry("S", "§"),
        Map.entry("pounds", "£"),
        Map.entry("yen", "¥"),
        Map.entry("euro", "€"),
        Map.entry("textregistered", "®"),
        Map.entry("texttrademark", "™"),
        Map.entry("textcopyright", "©"),
        Map.entry("textdegree", "°"),
        Map.entry("LaTeX", "LaTeX"),
        Map.entry("TeX", "TeX"),
        // Escaped specials
        Map.entry("%", "%"),
        Map.entry("&", "&"),
        Map.entry("$", "$"),
        Map.entry("#", "#"),
        Map.entry("_", "_"),
        Map.entry("{", "{"),
        Map.entry("}", "}")
    );

    private SymbolTable() {
        // Utility class
    }

    public static Optional<String> lookup(String name) {
        return Optional.ofNullable(SYMBOLS.get(name));
    }

    public static boolean isSymbol(String name) {
        return SYMBOLS.containsKey(name);
    }

    public static Map<String, String> symbols() {
        return SYMBOLS;
    }
}
