package com.example.transtructiver.parser;

import com.google.common.base.CaseFormat;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Raw view of an ANTLR parse tree.
 * <p>
 * Rule contexts become named nodes typed by their rule name. A non-root rule context with
 * a single child that is itself a rule or a named token is replaced by that child, so
 * precedence-climbing chains do not show up as nodes; rules listed in
 * {@link Shape#keptRules()} are never replaced. Named tokens (identifiers, literals)
 * are typed by their symbolic name in snake case; literal tokens are anonymous and typed by
 * their text. {@code EOF}, layout tokens and tokens conjured by error recovery are dropped.
 */
public final class AntlrRawNode implements RawNode {
    static final String ERROR_TYPE = "ERROR";

    /**
     * Grammar-specific adjustments: token types that only carry layout (newlines, indentation)
     * and rules that stay in the tree even when they wrap a single child.
     */
    public record Shape(Set<Integer> layoutTokenTypes, Set<String> keptRules) {
        public static final Shape PLAIN = new Shape(Set.of(), Set.of());

        public Shape {
            layoutTokenTypes = Set.copyOf(layoutTokenTypes);
            keptRules = Set.copyOf(keptRules);
        }
    }

    private final String type;
    private final boolean error;
    private final boolean named;
    private final List<AntlrRawNode> children;
    private final String text;

    private AntlrRawNode(String type, boolean error, boolean named, List<AntlrRawNode> children, String text) {
        this.type = type;
        this.error = error;
        this.named = named;
        this.children = children;
        this.text = text;
    }

    public static AntlrRawNode root(RuleContext tree, Parser parser, Shape shape) {
        return build(tree, parser, shape, true);
    }

    private static AntlrRawNode build(ParseTree tree, Parser parser, Shape shape, boolean root) {
        if (tree instanceof ErrorNode errorNode) {
            return new AntlrRawNode(ERROR_TYPE, true, true, List.of(), errorNode.getText());
        }
        if (tree instanceof TerminalNode terminal) {
            Token token = terminal.getSymbol();
            Vocabulary vocabulary = parser.getVocabulary();
            boolean named = isNamedToken(token, vocabulary);
            String type = named ? tokenType(vocabulary.getSymbolicName(token.getType())) : token.getText();
            return new AntlrRawNode(type, false, named, List.of(), token.getText());
        }

        RuleContext context = (RuleContext) tree;
        String type = parser.getRuleNames()[context.getRuleIndex()];
        List<ParseTree> kept = new ArrayList<>(context.getChildCount());
        for (int i = 0; i < context.getChildCount(); i++) {
            ParseTree child = context.getChild(i);
            if (!isDropped(child, shape)) {
                kept.add(child);
            }
        }

        if (!root && kept.size() == 1 && !shape.keptRules().contains(type) && isCollapsible(kept.get(0), parser)) {
            return build(kept.get(0), parser, shape, false);
        }

        if (kept.isEmpty()) {
            return new AntlrRawNode(type, false, true, List.of(), "");
        }
        List<AntlrRawNode> children = new ArrayList<>(kept.size());
        for (ParseTree child : kept) {
            children.add(build(child, parser, shape, false));
        }
        return new AntlrRawNode(type, false, true, List.copyOf(children), null);
    }

    private static boolean isCollapsible(ParseTree only, Parser parser) {
        if (only instanceof ErrorNode) {
            return true;
        }
        if (only instanceof TerminalNode terminal) {
            return isNamedToken(terminal.getSymbol(), parser.getVocabulary());
        }
        return only instanceof RuleContext;
    }

    /**
     * {@code Identifier} and {@code IDENTIFIER} both become {@code identifier}.
     */
    private static String tokenType(String symbolicName) {
        CaseFormat format = symbolicName.equals(symbolicName.toUpperCase(Locale.ROOT))
                ? CaseFormat.UPPER_UNDERSCORE
                : CaseFormat.UPPER_CAMEL;
        return format.to(CaseFormat.LOWER_UNDERSCORE, symbolicName);
    }

    private static boolean isNamedToken(Token token, Vocabulary vocabulary) {
        return vocabulary.getLiteralName(token.getType()) == null
                && vocabulary.getSymbolicName(token.getType()) != null;
    }

    private static boolean isDropped(ParseTree tree, Shape shape) {
        if (!(tree instanceof TerminalNode terminal)) {
            return false;
        }
        Token token = terminal.getSymbol();
        if (tree instanceof ErrorNode) {
            // missing tokens made up by recovery have no place in the input
            return token.getTokenIndex() < 0 || isLayout(token, shape);
        }
        return isLayout(token, shape);
    }

    private static boolean isLayout(Token token, Shape shape) {
        return token.getType() == Token.EOF || shape.layoutTokenTypes().contains(token.getType());
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public boolean isError() {
        return error;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public List<AntlrRawNode> children() {
        return children;
    }

    @Override
    public Optional<String> text() {
        return Optional.ofNullable(text);
    }
}
