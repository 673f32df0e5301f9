package com.latexword.converter.math;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Symbol macros available inside math mode, split into identifiers
 * (rendered as {@code mi}) and operators (rendered as {@code mo}).
 */
final class MathSymbols {

    static final Map<String, String> IDENTIFIERS = new HashMap<>();
    static final Map<String, String> OPERATORS = new HashMap<>();

    /** Multi-letter function names set upright. */
    static final Set<String> FUNCTIONS = Set.of(
        "sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos", "arctan",
        "sinh", "cosh", "tanh", "coth", "log", "ln", "lg", "exp", "det", "dim",
        "ker", "gcd", "deg", "arg", "hom", "Pr", "max", "min", "sup", "inf", "lim",
        "liminf", "limsup", "argmax", "argmin");

    /** Operators whose limits go above and below rather than to the side. */
    static final Set<String> LIMIT_OPERATORS = Set.of(
        "sum", "prod", "coprod", "bigcup", "bigcap", "bigoplus", "bigotimes", "bigvee", "bigwedge",
        "lim", "max", "min", "sup", "inf", "liminf", "limsup", "argmax", "argmin");

    /** Accent macros mapped to the combining mark placed over the base. */
    static final Map<String, String> ACCENTS = Map.of(
        "hat", "^",
        "widehat", "^",
        "bar", "¯",
        "overline", "¯",
        "vec", "→",
        "overrightarrow", "→",
        "dot", "˙",
        "ddot", "¨",
        "tilde", "~",
        "widetilde", "~");

    static {
        String[][] greek = {
            {"alpha", "α"}, {"beta", "β"}, {"gamma", "γ"}, {"delta", "δ"}, {"epsilon", "ϵ"},
            {"varepsilon", "ε"}, {"zeta", "ζ"}, {"eta", "η"}, {"theta", "θ"}, {"vartheta", "ϑ"},
            {"iota", "ι"}, {"kappa", "κ"}, {"lambda", "λ"}, {"mu", "μ"}, {"nu", "ν"},
            {"xi", "ξ"}, {"pi", "π"}, {"varpi", "ϖ"}, {"rho", "ρ"}, {"varrho", "ϱ"},
            {"sigma", "σ"}, {"varsigma", "ς"}, {"tau", "τ"}, {"upsilon", "υ"}, {"phi", "ϕ"},
            {"varphi", "φ"}, {"chi", "χ"}, {"psi", "ψ"}, {"omega", "ω"},
            {"Gamma", "Γ"}, {"Delta", "Δ"}, {"Theta", "Θ"}, {"Lambda", "Λ"}, {"Xi", "Ξ"},
            {"Pi", "Π"}, {"Sigma", "Σ"}, {"Upsilon", "Υ"}, {"Phi", "Φ"}, {"Psi", "Ψ"},
            {"Omega", "Ω"},
            {"infty", "∞"}, {"partial", "∂"}, {"nabla", "∇"}, {"hbar", "ℏ"}, {"ell", "ℓ"},
            {"emptyset", "∅"}, {"varnothing", "∅"}, {"aleph", "ℵ"}, {"Re", "ℜ"}, {"Im", "ℑ"},
            {"prime", "′"}, {"angle", "∠"}, {"triangle", "△"}
        };
        for (String[] entry : greek) {
            IDENTIFIERS.put(entry[0], entry[1]);
        }

        String[][] operators = {
            {"pm", "±"}, {"mp", "∓"}, {"times", "×"}, {"div", "÷"}, {"cdot", "⋅"}, {"ast", "∗"},
            {"star", "⋆"}, {"circ", "∘"}, {"bullet", "∙"}, {"oplus", "⊕"}, {"otimes", "⊗"},
            {"leq", "≤"}, {"le", "≤"}, {"geq", "≥"}, {"ge", "≥"}, {"neq", "≠"}, {"ne", "≠"},
            {"approx", "≈"}, {"equiv", "≡"}, {"sim", "∼"}, {"simeq", "≃"}, {"cong", "≅"},
            {"propto", "∝"}, {"ll", "≪"}, {"gg", "≫"}, {"leqslant", "⩽"}, {"geqslant", "⩾"},
            {"in", "∈"}, {"notin", "∉"}, {"ni", "∋"}, {"subset", "⊂"}, {"supset", "⊃"},
            {"subseteq", "⊆"}, {"supseteq", "⊇"}, {"cup", "∪"}, {"cap", "∩"}, {"setminus", "∖"},
            {"wedge", "∧"}, {"land", "∧"}, {"vee", "∨"}, {"lor", "∨"}, {"neg", "¬"}, {"lnot", "¬"},
            {"forall", "∀"}, {"exists", "∃"}, {"nexists", "∄"},
            {"to", "→"}, {"rightarrow", "→"}, {"leftarrow", "←"}, {"gets", "←"},
            {"Rightarrow", "⇒"}, {"Leftarrow", "⇐"}, {"leftrightarrow", "↔"},
            {"Leftrightarrow", "⇔"}, {"iff", "⇔"}, {"implies", "⇒"}, {"mapsto", "↦"},
            {"uparrow", "↑"}, {"downarrow", "↓"}, {"longrightarrow", "⟶"},
            {"ldots", "…"}, {"dots", "…"}, {"cdots", "⋯"}, {"vdots", "⋮"}, {"ddots", "⋱"},
            {"perp", "⊥"}, {"parallel", "∥"}, {"mid", "∣"}, {"vert", "|"}, {"Vert", "‖"},
            {"langle", "⟨"}, {"rangle", "⟩"}, {"lfloor", "⌊"}, {"rfloor", "⌋"},
            {"lceil", "⌈"}, {"rceil", "⌉"}, {"lbrace", "{"}, {"rbrace", "}"},
            {"sum", "∑"}, {"prod", "∏"}, {"coprod", "∐"}, {"int", "∫"}, {"iint", "∬"},
            {"iiint", "∭"}, {"oint", "∮"}, {"bigcup", "⋃"}, {"bigcap", "⋂"},
            {"bigoplus", "⨁"}, {"bigotimes", "⨂"}, {"bigvee", "⋁"}, {"bigwedge", "⋀"},
            {"therefore", "∴"}, {"because", "∵"}, {"degree", "°"}
        };
        for (String[] entry : operators) {
            OPERATORS.put(entry[0], entry[1]);
        }
    }

    private MathSymbols() {
        // Utility class
    }
}
