package li.cil.dtk.dts;

import javax.annotation.Nullable;
import java.math.BigInteger;

/**
 * A single lexical token.
 * <p>
 * For labels, references, strings and character literals {@link #text} holds the payload
 * without its delimiters ({@code foo} for {@code foo:}, {@code {/a/b}} for {@code &{/a/b}}).
 * Numbers and bytes additionally carry their {@link #number value}.
 */
public final class Token {
    public final TokenType type;
    public final String text;
    @Nullable public final BigInteger number;

    public Token(final TokenType type, final String text) {
        this(type, text, null);
    }

    public Token(final TokenType type, final String text, @Nullable final BigInteger number) {
        this.type = type;
        this.text = text;
        this.number = number;
    }

    public boolean is(final String misc) {
        return type == TokenType.MISC && text.equals(misc);
    }

    @Override
    public String toString() {
        return String.format("%s '%s'", type, text);
    }
}
