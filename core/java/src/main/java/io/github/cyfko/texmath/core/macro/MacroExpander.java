package io.github.cyfko.texmath.core.macro;

import io.github.cyfko.texmath.core.config.ParserPolicy;
import io.github.cyfko.texmath.core.exception.ExpansionLoopException;
import io.github.cyfko.texmath.core.exception.TexSyntaxException;
import io.github.cyfko.texmath.core.parsing.Lexer;
import io.github.cyfko.texmath.core.parsing.Token;
import io.github.cyfko.texmath.core.parsing.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Turns the raw token stream of a {@link Lexer} into the expanded stream seen by the parser.
 * <p>
 * Pending tokens are kept on a stack whose top is the next token to read; the lexer is only
 * consulted once the stack is empty. Expanding a macro pops its name (and arguments) and pushes
 * the replacement back, so the replacement is re-examined and nested macros expand in turn.
 * </p>
 *
 * <h2>Expansion Budget</h2>
 * <p>
 * Every expansion counts against {@link ParserPolicy#maxExpand()}. A self-referencing
 * definition therefore fails with {@link ExpansionLoopException} instead of looping.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MacroExpander {

    private static final String RELAX = "\\relax";

    private final Lexer lexer;
    private final MacroTable macros;
    private final int maxExpand;
    private final Deque<Token> stack = new ArrayDeque<>();
    private int expansionCount;

    public MacroExpander(String input, MacroTable macros, ParserPolicy policy) {
        this.lexer = new Lexer(input);
        this.macros = Objects.requireNonNull(macros, "macros");
        this.maxExpand = Objects.requireNonNull(policy, "policy").maxExpand();
    }

    public MacroTable macros() {
        return macros;
    }

    public void beginGroup() {
        macros.beginGroup();
    }

    public void endGroup() {
        macros.endGroup();
    }

    /**
     * Returns the next unexpanded token without consuming it.
     */
    public Token future() {
        if (stack.isEmpty()) {
            stack.push(lexer.lex());
        }
        return stack.peek();
    }

    /**
     * Removes and returns the next unexpanded token.
     */
    public Token popToken() {
        future();
        return stack.pop();
    }

    public void pushToken(Token token) {
        stack.push(token);
    }

    /**
     * Pushes {@code tokens} so that {@code tokens.get(0)} is read next.
     */
    public void pushTokens(List<Token> tokens) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            stack.push(tokens.get(i));
        }
    }

    /**
     * Skips unexpanded whitespace tokens.
     */
    public void consumeSpaces() {
        while (future().kind() == TokenKind.WHITESPACE) {
            stack.pop();
        }
    }

    /**
     * Reads one undelimited macro argument: a single token, or the contents of a balanced
     * brace group with the outer braces removed.
     *
     * @return the argument tokens
     * @throws TexSyntaxException if the input ends inside the argument
     */
    public List<Token> consumeArg() {
        consumeSpaces();
        Token start = popToken();
        if (start.isEof()) {
            throw new TexSyntaxException("End of input in macro argument", start);
        }
        if (start.kind() != TokenKind.BEGIN_GROUP) {
            return List.of(start);
        }

        List<Token> arg = new ArrayList<>();
        int depth = 1;
        while (true) {
            Token token = popToken();
            switch (token.kind()) {
                case EOF -> throw new TexSyntaxException("Unexpected end of input in a macro argument, expected '}'", start);
                case BEGIN_GROUP -> depth++;
                case END_GROUP -> depth--;
                default -> { }
            }
            if (depth == 0) {
                return arg;
            }
            arg.add(token);
        }
    }

    /**
     * Returns the next token of the expanded stream. {@code \relax} is dropped.
     *
     * @return the next non-macro token
     * @throws ExpansionLoopException if the expansion budget is exhausted
     */
    public Token expandNextToken() {
        while (true) {
            if (!expandOnce()) {
                Token token = stack.pop();
                if (!RELAX.equals(token.text())) {
                    return token;
                }
            }
        }
    }

    /**
     * Fully expands the macro {@code name} and returns the resulting text.
     * <p>
     * Used for macros that hold a literal parameter such as {@code \arraystretch}.
     * </p>
     *
     * @param name control sequence to expand
     * @return the expansion as text, or {@code null} if {@code name} is undefined
     */
    public String expandMacroAsText(String name) {
        if (!macros.isDefined(name)) {
            return null;
        }
        int floor = stack.size();
        pushToken(new Token(TokenKind.CONTROL_SEQUENCE, name, -1));

        StringBuilder text = new StringBuilder();
        while (stack.size() > floor) {
            if (!expandOnce()) {
                text.append(stack.pop().text());
            }
        }
        return text.toString();
    }

    /**
     * Expands the next token once if it is a macro.
     *
     * @return {@code true} if an expansion happened, {@code false} if the next token is not a macro
     */
    private boolean expandOnce() {
        Token head = future();
        if (!isExpandable(head)) {
            return false;
        }
        MacroDefinition definition = macros.lookup(head.text());
        stack.pop();

        expansionCount++;
        if (expansionCount > maxExpand) {
            throw new ExpansionLoopException(String.format(
                "Too many expansions (max: %d) while expanding '%s': infinite loop or need to increase maxExpand",
                maxExpand, head.text()
            ));
        }

        List<List<Token>> args = new ArrayList<>(definition.numArgs());
        for (int i = 0; i < definition.numArgs(); i++) {
            args.add(consumeArg());
        }
        pushTokens(substitute(definition.tokens(), args, head));
        return true;
    }

    private boolean isExpandable(Token token) {
        return switch (token.kind()) {
            case CONTROL_SEQUENCE, CHARACTER -> macros.isDefined(token.text());
            default -> false;
        };
    }

    private static List<Token> substitute(List<Token> body, List<List<Token>> args, Token origin) {
        if (args.isEmpty()) {
            return body;
        }
        List<Token> result = new ArrayList<>(body.size());
        for (int i = 0; i < body.size(); i++) {
            Token token = body.get(i);
            if (!"#".equals(token.text()) || i + 1 >= body.size()) {
                result.add(token);
                continue;
            }
            Token next = body.get(++i);
            if ("#".equals(next.text())) {
                result.add(next);
                continue;
            }
            int index = parameterIndex(next);
            if (index < 1 || index > args.size()) {
                throw new TexSyntaxException("Not a valid argument number '#" + next.text() + "'", origin);
            }
            result.addAll(args.get(index - 1));
        }
        return result;
    }

    private static int parameterIndex(Token token) {
        String text = token.text();
        if (text.length() != 1 || !Character.isDigit(text.charAt(0))) {
            return -1;
        }
        return text.charAt(0) - '0';
    }
}
