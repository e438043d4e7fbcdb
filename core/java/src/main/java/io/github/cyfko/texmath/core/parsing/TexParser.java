package io.github.cyfko.texmath.core.parsing;

import io.github.cyfko.texmath.core.ast.CrNode;
import io.github.cyfko.texmath.core.ast.EquationRowNode;
import io.github.cyfko.texmath.core.ast.LeftRightNode;
import io.github.cyfko.texmath.core.ast.MathStyle;
import io.github.cyfko.texmath.core.ast.Measurement;
import io.github.cyfko.texmath.core.ast.Node;
import io.github.cyfko.texmath.core.ast.StyleNode;
import io.github.cyfko.texmath.core.ast.SymbolNode;
import io.github.cyfko.texmath.core.config.ParserPolicy;
import io.github.cyfko.texmath.core.environment.EnvContext;
import io.github.cyfko.texmath.core.environment.EnvSpec;
import io.github.cyfko.texmath.core.environment.EnvironmentRegistry;
import io.github.cyfko.texmath.core.exception.TexSyntaxException;
import io.github.cyfko.texmath.core.macro.MacroDefinition;
import io.github.cyfko.texmath.core.macro.MacroExpander;
import io.github.cyfko.texmath.core.macro.MacroTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive-descent parser turning the expanded token stream into syntax-tree nodes.
 * <p>
 * The parser keeps a single token of lookahead: {@link #fetch()} expands and caches the next
 * token, {@link #consume()} drops it. Sub-parses are bounded through the {@code breakOnTokenText}
 * argument of {@link #parseExpression(boolean, String)}: the expression stops, without consuming,
 * in front of that token. Environment handlers rely on this to read one cell or one row at a time.
 * </p>
 *
 * <h2>Built-in Primitives</h2>
 * <ul>
 *   <li>{@code {...}}: group, opens a macro scope</li>
 *   <li>{@code \begin{name} ... \end{name}}: dispatch through {@link EnvironmentRegistry}</li>
 *   <li>{@code \\}, {@code \cr}: row break with optional gap {@code [size]}</li>
 *   <li>{@code \def}, {@code \gdef}: local and global macro definitions</li>
 *   <li>{@code \displaystyle} and friends: style the rest of the expression</li>
 *   <li>{@code \left ... \right}: delimited group</li>
 * </ul>
 * <p>Every other control sequence or character becomes a {@link SymbolNode}.</p>
 *
 * <p>A parser instance handles one source text and is not thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TexParser {

    /**
     * Tokens that always end an expression.
     */
    public static final Set<String> END_OF_EXPRESSION = Set.of("}", "\\end", "\\right", "&");

    /**
     * Infix commands in front of which {@code parseExpression(true, ...)} stops.
     */
    public static final Set<String> INFIX_COMMANDS = Set.of("\\over", "\\atop", "\\choose", "\\brace", "\\brack", "\\above");

    private static final Set<String> DEFINITIONS = Set.of("\\def", "\\gdef");

    private final MacroExpander macroExpander;
    private Mode mode = Mode.MATH;
    private Token nextToken;

    public TexParser(String input) {
        this(input, new MacroTable(), ParserPolicy.defaults());
    }

    public TexParser(String input, MacroTable macros, ParserPolicy policy) {
        this.macroExpander = new MacroExpander(Objects.requireNonNull(input, "input"), macros, policy);
    }

    public MacroExpander macroExpander() {
        return macroExpander;
    }

    public Mode mode() {
        return mode;
    }

    /**
     * Returns the next expanded token without consuming it.
     */
    public Token fetch() {
        if (nextToken == null) {
            nextToken = macroExpander.expandNextToken();
        }
        return nextToken;
    }

    /**
     * Discards the token returned by the last {@link #fetch()}.
     */
    public void consume() {
        nextToken = null;
    }

    public void consumeSpaces() {
        while (fetch().kind() == TokenKind.WHITESPACE) {
            consume();
        }
    }

    /**
     * Checks that the next token has the given text.
     *
     * @param text    expected token text
     * @param consume whether to consume the token once matched
     * @throws TexSyntaxException if the next token differs
     */
    public void expect(String text, boolean consume) {
        Token token = fetch();
        if (!text.equals(token.text())) {
            throw new TexSyntaxException("Expected '" + text + "'", token);
        }
        if (consume) {
            consume();
        }
    }

    /**
     * Parses the whole input as one row.
     *
     * @return the row holding every top-level node
     * @throws TexSyntaxException if the input is malformed or not fully consumed
     */
    public EquationRowNode parse() {
        macroExpander.beginGroup();
        try {
            List<Node> body = parseExpression(false, null);
            Token last = fetch();
            if (!last.isEof()) {
                throw new TexSyntaxException("Expected 'EOF'", last);
            }
            return EquationRowNode.wrap(body);
        } finally {
            macroExpander.endGroup();
        }
    }

    /**
     * Parses a maximal run of atoms.
     * <p>
     * Stops without consuming at end of input, at any of {@link #END_OF_EXPRESSION}, at a token
     * whose text equals {@code breakOnTokenText}, and, if {@code breakOnInfix} is set, in front of
     * any of {@link #INFIX_COMMANDS}.
     * </p>
     *
     * @param breakOnInfix     stop in front of infix commands
     * @param breakOnTokenText additional stop token, may be {@code null}
     * @return the parsed nodes
     */
    public List<Node> parseExpression(boolean breakOnInfix, String breakOnTokenText) {
        List<Node> body = new ArrayList<>();
        while (true) {
            if (mode == Mode.MATH) {
                consumeSpaces();
            }
            Token lex = fetch();
            String text = lex.text();
            if (lex.isEof() || END_OF_EXPRESSION.contains(text)) {
                break;
            }
            if (text.equals(breakOnTokenText)) {
                break;
            }
            if (breakOnInfix && INFIX_COMMANDS.contains(text)) {
                break;
            }
            if (lex.kind() == TokenKind.CONTROL_SEQUENCE && DEFINITIONS.contains(text)) {
                parseDefinition();
                continue;
            }
            Node atom = parseAtom(breakOnTokenText);
            if (atom == null) {
                break;
            }
            body.add(atom);
        }
        return body;
    }

    /**
     * Parses exactly one argument.
     * <p>
     * A single token yields a bare node (usually a {@link SymbolNode}); a brace group yields an
     * {@link EquationRowNode}. An optional argument is a bracket-delimited row, or {@code null}
     * when the next token is not {@code [}.
     * </p>
     *
     * @param argMode  mode to parse the argument in, {@code null} for the current mode
     * @param optional whether the argument is optional and bracket-delimited
     * @return the argument node, {@code null} only for an absent optional argument
     * @throws TexSyntaxException if a required argument is missing
     */
    public Node parseArgNode(Mode argMode, boolean optional) {
        Mode outer = mode;
        if (argMode != null) {
            mode = argMode;
        }
        try {
            consumeSpaces();
            Token next = fetch();
            if (optional) {
                if (!"[".equals(next.text())) {
                    return null;
                }
                consume();
                List<Node> body;
                macroExpander.beginGroup();
                try {
                    body = parseExpression(false, "]");
                    expect("]", true);
                } finally {
                    macroExpander.endGroup();
                }
                return EquationRowNode.wrap(body);
            }
            if (next.kind() == TokenKind.BEGIN_GROUP) {
                return parseGroup();
            }
            if (next.isEof() || END_OF_EXPRESSION.contains(next.text())) {
                throw new TexSyntaxException("Expected group as argument", next);
            }
            return parseAtom(null);
        } finally {
            mode = outer;
        }
    }

    /**
     * Parses the next atom, typically a command such as {@code \cr} whose node the caller needs.
     *
     * @return the parsed node
     * @throws TexSyntaxException if there is no atom to parse
     */
    public Node parseFunction() {
        Token token = fetch();
        if (token.isEof() || token.kind() == TokenKind.END_GROUP) {
            throw new TexSyntaxException("Expected a function", token);
        }
        return parseAtom(null);
    }

    private Node parseAtom(String breakOnTokenText) {
        Token token = fetch();
        return switch (token.kind()) {
            case BEGIN_GROUP -> parseGroup();
            case END_GROUP, EOF -> null;
            case CHARACTER, WHITESPACE -> {
                consume();
                yield new SymbolNode(token.text());
            }
            case CONTROL_SEQUENCE -> parseControlSequence(token, breakOnTokenText);
        };
    }

    private Node parseControlSequence(Token token, String breakOnTokenText) {
        String name = token.text();
        return switch (name) {
            case "\\begin" -> parseEnvironment();
            case "\\\\", "\\cr" -> parseRowBreak();
            case "\\left" -> parseLeftRight();
            case "\\hline", "\\hdashline" -> throw new TexSyntaxException(name + " valid only within array environment", token);
            case "\\displaystyle", "\\textstyle", "\\scriptstyle", "\\scriptscriptstyle" -> parseStyle(breakOnTokenText);
            default -> {
                consume();
                yield new SymbolNode(name);
            }
        };
    }

    private EquationRowNode parseGroup() {
        consume();
        List<Node> body;
        macroExpander.beginGroup();
        try {
            body = parseExpression(false, null);
            expect("}", true);
        } finally {
            macroExpander.endGroup();
        }
        return EquationRowNode.wrap(body);
    }

    private Node parseEnvironment() {
        Token begin = fetch();
        consume();
        String name = parseEnvironmentName(begin);
        EnvSpec spec = EnvironmentRegistry.lookup(name)
            .orElseThrow(() -> new TexSyntaxException("No such environment: " + name, begin));

        List<Node> args = new ArrayList<>(spec.numArgs());
        for (int i = 0; i < spec.numArgs(); i++) {
            args.add(parseArgNode(null, false));
        }
        Node result = spec.handler().handle(this, new EnvContext(name, mode, args));

        Token end = fetch();
        if (!"\\end".equals(end.text())) {
            throw new TexSyntaxException("Expected '\\end' to close environment '" + name + "'", end);
        }
        consume();
        String endName = parseEnvironmentName(end);
        if (!name.equals(endName)) {
            throw new TexSyntaxException("Mismatch: \\begin{" + name + "} matched by \\end{" + endName + "}", end);
        }
        return result;
    }

    private String parseEnvironmentName(Token command) {
        consumeSpaces();
        if (fetch().kind() != TokenKind.BEGIN_GROUP) {
            throw new TexSyntaxException("Expected '{' after '" + command.text() + "'", fetch());
        }
        consume();
        StringBuilder name = new StringBuilder();
        while (true) {
            Token token = fetch();
            if (token.kind() == TokenKind.END_GROUP) {
                consume();
                return name.toString();
            }
            if (token.isEof()) {
                throw new TexSyntaxException("Unexpected end of input in environment name", token);
            }
            if (token.kind() != TokenKind.WHITESPACE) {
                name.append(token.text());
            }
            consume();
        }
    }

    private CrNode parseRowBreak() {
        Token command = fetch();
        consume();
        consumeSpaces();
        if (!"[".equals(fetch().text())) {
            return new CrNode(null);
        }
        consume();
        StringBuilder size = new StringBuilder();
        while (true) {
            Token token = fetch();
            if ("]".equals(token.text())) {
                consume();
                break;
            }
            if (token.isEof()) {
                throw new TexSyntaxException("Unexpected end of input in size, expected ']'", token);
            }
            size.append(token.text());
            consume();
        }
        return new CrNode(Measurement.parse(size.toString(), command));
    }

    private LeftRightNode parseLeftRight() {
        Token left = fetch();
        consume();
        String leftDelim = parseDelimiter(left);

        List<Node> body;
        Token right;
        macroExpander.beginGroup();
        try {
            body = parseExpression(false, null);
            right = fetch();
            if (!"\\right".equals(right.text())) {
                throw new TexSyntaxException("Expected '\\right' to match '\\left" + leftDelim + "'", right);
            }
            consume();
        } finally {
            macroExpander.endGroup();
        }
        String rightDelim = parseDelimiter(right);
        return new LeftRightNode(leftDelim, rightDelim, List.of(EquationRowNode.wrap(body)));
    }

    private String parseDelimiter(Token command) {
        consumeSpaces();
        Token delimiter = fetch();
        if (delimiter.kind() != TokenKind.CHARACTER && delimiter.kind() != TokenKind.CONTROL_SEQUENCE) {
            throw new TexSyntaxException("Missing or unrecognized delimiter after '" + command.text() + "'", delimiter);
        }
        consume();
        return delimiter.text();
    }

    private StyleNode parseStyle(String breakOnTokenText) {
        Token command = fetch();
        consume();
        MathStyle style = MathStyle.fromCommand(command.text())
            .orElseThrow(() -> new TexSyntaxException("Unknown style command", command));
        return new StyleNode(style, parseExpression(true, breakOnTokenText));
    }

    private void parseDefinition() {
        Token command = fetch();
        consume();

        macroExpander.consumeSpaces();
        Token name = macroExpander.popToken();
        if (name.kind() != TokenKind.CONTROL_SEQUENCE) {
            throw new TexSyntaxException("Expected a control sequence after '" + command.text() + "'", name);
        }

        int numArgs = 0;
        while ("#".equals(macroExpander.future().text())) {
            macroExpander.popToken();
            Token number = macroExpander.popToken();
            if (!String.valueOf(numArgs + 1).equals(number.text())) {
                throw new TexSyntaxException("Argument number in '" + command.text() + "' must be " + (numArgs + 1), number);
            }
            numArgs++;
        }
        if (macroExpander.future().kind() != TokenKind.BEGIN_GROUP) {
            throw new TexSyntaxException("Expected '{' to start the body of '" + name.text() + "'", macroExpander.future());
        }

        MacroDefinition definition = new MacroDefinition(macroExpander.consumeArg(), numArgs);
        if ("\\gdef".equals(command.text())) {
            macroExpander.macros().defineGlobal(name.text(), definition);
        } else {
            macroExpander.macros().define(name.text(), definition);
        }
    }
}
