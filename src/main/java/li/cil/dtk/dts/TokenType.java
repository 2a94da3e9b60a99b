package li.cil.dtk.dts;

public enum TokenType {
    STRING,
    DTS_V1,
    PLUGIN,
    MEMRESERVE,
    BITS,
    DELETE_PROPERTY,
    DELETE_NODE,
    OMIT_IF_NO_REF,
    LABEL,
    CHAR_LITERAL,
    REFERENCE,
    INCBIN,
    NUMBER,
    NAME,
    BYTE,
    /**
     * Punctuation and operators, the token text is the operator itself.
     */
    MISC,
    /**
     * Anything the lexer could not make sense of in its current mode.
     */
    BAD,
    EOF,
}
