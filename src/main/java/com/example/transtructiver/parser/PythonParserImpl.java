package com.example.transtructiver.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.TokenStream;

import java.util.Set;

/**
 * Python backend built on the {@code PySnippet} ANTLR grammar.
 * <p>
 * Newline and indentation tokens are dropped from the tree. Blocks and expression statements
 * stay as nodes even around a single child, as they do in tree-sitter-python.
 */
public class PythonParserImpl extends AntlrLanguageParser<PySnippetParser> {

    private static final AntlrRawNode.Shape SHAPE = new AntlrRawNode.Shape(
            Set.of(PySnippetLexer.NEWLINE, PySnippetParser.INDENT, PySnippetParser.DEDENT),
            Set.of("block", "expression_statement"));

    @Override
    protected Lexer createLexer(CharStream input) {
        return new PySnippetLexer(input);
    }

    @Override
    protected PySnippetParser createParser(TokenStream tokens) {
        return new PySnippetParser(tokens);
    }

    @Override
    protected ParserRuleContext startRule(PySnippetParser parser) {
        return parser.module();
    }

    @Override
    protected AntlrRawNode.Shape shape() {
        return SHAPE;
    }
}
