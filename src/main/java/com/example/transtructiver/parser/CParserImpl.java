package com.example.transtructiver.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.TokenStream;

/**
 * C-family backend built on the {@code CSnippet} ANTLR grammar.
 */
public class CParserImpl extends AntlrLanguageParser<CSnippetParser> {

    @Override
    protected Lexer createLexer(CharStream input) {
        return new CSnippetLexer(input);
    }

    @Override
    protected CSnippetParser createParser(TokenStream tokens) {
        return new CSnippetParser(tokens);
    }

    @Override
    protected ParserRuleContext startRule(CSnippetParser parser) {
        return parser.translation_unit();
    }
}
