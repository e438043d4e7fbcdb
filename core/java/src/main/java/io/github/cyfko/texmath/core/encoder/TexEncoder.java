package io.github.cyfko.texmath.core.encoder;

import io.github.cyfko.texmath.core.api.MathEncoder;
import io.github.cyfko.texmath.core.ast.CdArrowNode;
import io.github.cyfko.texmath.core.ast.CrNode;
import io.github.cyfko.texmath.core.ast.EquationRowNode;
import io.github.cyfko.texmath.core.ast.LeftRightNode;
import io.github.cyfko.texmath.core.ast.MatrixNode;
import io.github.cyfko.texmath.core.ast.Node;
import io.github.cyfko.texmath.core.ast.StyleNode;
import io.github.cyfko.texmath.core.ast.SymbolNode;
import io.github.cyfko.texmath.core.config.EncodePolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Encodes syntax trees into canonical TeX source.
 * <p>
 * Rows concatenate their children, nested rows are wrapped in braces, and a space is inserted
 * wherever a control word would otherwise run into a following letter. Matrices are delegated
 * to {@link MatrixEncoder}, which only supports commutative diagrams.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MathEncoder encoder = new TexEncoder();
 * EquationRowNode tree = new BasicMathParser().parse("\\begin{CD} A @>f>> B \\end{CD}");
 * String tex = encoder.encodeToString(tree);
 * // "\begin{CD} A @>f>> B \\ \end{CD}"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TexEncoder implements MathEncoder {

    private static final Pattern TRAILING_CONTROL_WORD = Pattern.compile("\\\\[a-zA-Z]+$");

    private final EncodePolicy policy;

    public TexEncoder() {
        this(EncodePolicy.defaults());
    }

    public TexEncoder(EncodePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public EncodePolicy policy() {
        return policy;
    }

    @Override
    public EncodeResult encode(Node node) {
        Objects.requireNonNull(node, "node");

        if (node instanceof EquationRowNode row) {
            return new StaticEncodeResult(encodeNodes(row.children()));
        }
        if (node instanceof SymbolNode symbol) {
            return new StaticEncodeResult(symbol.symbol());
        }
        if (node instanceof StyleNode style) {
            return new StaticEncodeResult(join(List.of(style.style().command(), encodeNodes(style.children()))));
        }
        if (node instanceof CrNode cr) {
            return new StaticEncodeResult(cr.size() == null ? "\\\\" : "\\\\[" + cr.size() + "]");
        }
        if (node instanceof LeftRightNode leftRight) {
            List<String> pieces = new ArrayList<>();
            pieces.add("\\left" + leftRight.leftDelim());
            for (EquationRowNode row : leftRight.body()) {
                pieces.add(encodeToString(row));
            }
            pieces.add("\\right" + leftRight.rightDelim());
            return new StaticEncodeResult(String.join(" ", pieces));
        }
        if (node instanceof MatrixNode matrix) {
            return MatrixEncoder.encode(matrix, this);
        }
        if (node instanceof CdArrowNode arrow) {
            return new StaticEncodeResult(encodeArrow(arrow));
        }
        return new NonStrictEncodeResult(
            "unknown node",
            "no TeX encoding for " + node.getClass().getSimpleName(),
            ""
        );
    }

    @Override
    public String encodeToString(Node node) {
        return encode(node).stringify(policy);
    }

    private String encodeNodes(List<Node> nodes) {
        List<String> pieces = new ArrayList<>(nodes.size());
        for (Node child : nodes) {
            String text = encodeToString(child);
            pieces.add(child instanceof EquationRowNode ? "{" + text + "}" : text);
        }
        return join(pieces);
    }

    private String encodeArrow(CdArrowNode arrow) {
        char c = arrow.kind().symbol();
        if (!arrow.kind().takesLabels()) {
            return "@" + c;
        }
        String kind = String.valueOf(c);
        return join(List.of("@" + kind, label(arrow.firstLabel()), kind, label(arrow.secondLabel()), kind));
    }

    private String label(EquationRowNode label) {
        return label == null ? "" : encodeToString(label);
    }

    /**
     * Concatenates TeX fragments, separating a trailing control word from a following letter.
     */
    static String join(List<String> pieces) {
        StringBuilder tex = new StringBuilder();
        for (String piece : pieces) {
            if (piece.isEmpty()) {
                continue;
            }
            if (Character.isLetter(piece.charAt(0)) && TRAILING_CONTROL_WORD.matcher(tex).find()) {
                tex.append(' ');
            }
            tex.append(piece);
        }
        return tex.toString();
    }
}
