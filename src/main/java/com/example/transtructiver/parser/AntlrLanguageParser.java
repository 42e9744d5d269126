package com.example.transtructiver.parser;

import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-stage driver shared by the ANTLR backends: a fast SLL pass that bails on the first
 * problem, then a full LL pass whose default error strategy recovers and leaves error nodes
 * in the tree.
 *
 * @param <P> generated parser type
 */
public abstract class AntlrLanguageParser<P extends Parser> implements LanguageParser {
    private static final Logger log = LoggerFactory.getLogger(AntlrLanguageParser.class);

    protected abstract Lexer createLexer(CharStream input);

    protected abstract P createParser(TokenStream tokens);

    /**
     * Invokes the start rule.
     */
    protected abstract ParserRuleContext startRule(P parser);

    protected AntlrRawNode.Shape shape() {
        return AntlrRawNode.Shape.PLAIN;
    }

    @Override
    public RawNode parse(String code) {
        Lexer lexer = createLexer(CharStreams.fromString(code));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        P parser = createParser(tokens);

        routeErrorListeners(lexer, parser);

        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        parser.setErrorHandler(new BailErrorStrategy());

        ParserRuleContext tree;
        try {
            tree = startRule(parser);
        } catch (ParseCancellationException ex) {
            // SLL gave up; redo with full LL and let the default strategy recover
            parser.reset();
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.setErrorHandler(new DefaultErrorStrategy());
            tree = startRule(parser);
        }
        return AntlrRawNode.root(tree, parser, shape());
    }

    private void routeErrorListeners(Lexer lexer, P parser) {
        ANTLRErrorListener toDebugLog = new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer,
                                    Object offendingSymbol,
                                    int line, int charPositionInLine,
                                    String msg, RecognitionException e) {
                log.debug("{}: syntax error at {}:{}: {}", AntlrLanguageParser.this.getClass().getSimpleName(), line, charPositionInLine, msg);
            }
        };

        lexer.removeErrorListeners();
        lexer.addErrorListener(toDebugLog);
        parser.removeErrorListeners();
        parser.addErrorListener(toDebugLog);
    }
}
