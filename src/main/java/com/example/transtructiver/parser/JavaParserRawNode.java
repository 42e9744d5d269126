package com.example.transtructiver.parser;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.UnparsableStmt;
import com.google.common.base.CaseFormat;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Concrete-syntax view of a JavaParser AST node.
 * <p>
 * The children are the node's tokens in source order, where every run of tokens owned by a
 * child AST node is replaced by that child. Whitespace, comments and EOF are dropped.
 */
public final class JavaParserRawNode implements RawNode {

    private final Node astNode;
    private List<RawNode> children;

    public JavaParserRawNode(Node astNode) {
        this.astNode = astNode;
    }

    /**
     * {@code BlockStmt} becomes {@code block_statement}, {@code BinaryExpr} becomes
     * {@code binary_expression}.
     */
    static String typeName(Class<?> nodeClass) {
        String snake = CaseFormat.UPPER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, nodeClass.getSimpleName());
        return snake.replaceAll("_stmt$", "_statement").replaceAll("_expr$", "_expression");
    }

    @Override
    public String type() {
        return astNode instanceof UnparsableStmt ? AntlrRawNode.ERROR_TYPE : typeName(astNode.getClass());
    }

    @Override
    public boolean isError() {
        return astNode instanceof UnparsableStmt;
    }

    @Override
    public boolean isNamed() {
        return true;
    }

    @Override
    public synchronized List<RawNode> children() {
        if (children == null) {
            children = collectChildren();
        }
        return children;
    }

    private List<RawNode> collectChildren() {
        Optional<TokenRange> range = astNode.getTokenRange();
        Optional<Range> span = astNode.getRange();
        if (range.isEmpty() || span.isEmpty()) {
            return List.of();
        }

        Map<JavaToken, Node> childByFirstToken = new IdentityHashMap<>();
        for (Node child : astNode.getChildNodes()) {
            if (child.getTokenRange().isPresent()
                    && child.getRange().isPresent()
                    && span.get().contains(child.getRange().get())) {
                childByFirstToken.putIfAbsent(child.getTokenRange().get().getBegin(), child);
            }
        }

        List<RawNode> result = new ArrayList<>();
        JavaToken end = range.get().getEnd();
        JavaToken token = range.get().getBegin();
        while (token != null) {
            Node child = childByFirstToken.get(token);
            JavaToken last;
            if (child != null) {
                result.add(new JavaParserRawNode(child));
                last = child.getTokenRange().get().getEnd();
            } else {
                if (isSignificant(token)) {
                    result.add(new TokenNode(token));
                }
                last = token;
            }
            if (last == end) {
                break;
            }
            token = last.getNextToken().orElse(null);
        }
        return List.copyOf(result);
    }

    private static boolean isSignificant(JavaToken token) {
        return token.getKind() != JavaToken.Kind.EOF.getKind()
                && !token.getCategory().isWhitespaceOrComment();
    }

    /**
     * A single token leaf. Identifiers and literals are named, everything else is typed by
     * its own text.
     */
    static final class TokenNode implements RawNode {
        private final JavaToken token;

        TokenNode(JavaToken token) {
            this.token = token;
        }

        @Override
        public String type() {
            if (token.getCategory().isIdentifier()) {
                return "identifier";
            }
            if (token.getCategory().isLiteral()) {
                return JavaToken.Kind.valueOf(token.getKind()).name().toLowerCase(Locale.ROOT);
            }
            return token.getText();
        }

        @Override
        public boolean isError() {
            return false;
        }

        @Override
        public boolean isNamed() {
            return token.getCategory().isIdentifier() || token.getCategory().isLiteral();
        }

        @Override
        public List<RawNode> children() {
            return List.of();
        }

        @Override
        public Optional<String> text() {
            return Optional.of(token.getText());
        }
    }
}
