package domain.model;

/** Literal syntaxes recognized as CASE results, in match priority order. */
public enum LiteralKind {
    SINGLE_QUOTED,
    DOUBLE_QUOTED,
    INTEGER,
    BARE_WORD
}
