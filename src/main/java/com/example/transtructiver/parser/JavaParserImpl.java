package com.example.transtructiver.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParseStart;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Providers;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Java backend built on JavaParser.
 * <p>
 * Snippets are usually single methods rather than whole files, so a failed compilation unit
 * parse is retried with the snippet wrapped in a class body, then as a list of block statements.
 * Members or statements found that way are exposed under a synthetic {@code program} root.
 */
public class JavaParserImpl implements LanguageParser {
    private static final Logger log = LoggerFactory.getLogger(JavaParserImpl.class);

    static final String SNIPPET_ROOT = "program";
    private static final String WRAPPER_OPEN = "class __Snippet__ {\n";
    private static final String WRAPPER_CLOSE = "\n}";
    private static final String BLOCK_OPEN = "{\n";
    private static final String BLOCK_CLOSE = "\n}";

    private final JavaParser javaParser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
            .setAttributeComments(false)
            .setStoreTokens(true));

    @Override
    public RawNode parse(String code) {
        ParseResult<CompilationUnit> unit = javaParser.parse(ParseStart.COMPILATION_UNIT, Providers.provider(code));
        if (unit.isSuccessful()) {
            return new JavaParserRawNode(unit.getResult().get());
        }

        ParseResult<CompilationUnit> wrapped = javaParser.parse(ParseStart.COMPILATION_UNIT,
                Providers.provider(WRAPPER_OPEN + code + WRAPPER_CLOSE));
        if (wrapped.isSuccessful()) {
            return snippetRoot(wrapped.getResult().get());
        }

        ParseResult<BlockStmt> block = javaParser.parseBlock(BLOCK_OPEN + code + BLOCK_CLOSE);
        if (block.isSuccessful()) {
            return statementsRoot(block.getResult().get());
        }

        log.debug("Java snippet did not parse cleanly: {}", unit.getProblems());
        // Failed parses still return a unit; it is only worth keeping when declarations survived.
        Optional<CompilationUnit> partialUnit = unit.getResult();
        if (partialUnit.isPresent() && !partialUnit.get().getTypes().isEmpty()) {
            return new JavaParserRawNode(partialUnit.get());
        }
        Optional<CompilationUnit> partialSnippet = wrapped.getResult();
        if (partialSnippet.isPresent() && hasMembers(partialSnippet.get())) {
            return snippetRoot(partialSnippet.get());
        }
        Optional<BlockStmt> partialBlock = block.getResult();
        if (partialBlock.isPresent() && hasParsedStatements(partialBlock.get())) {
            return statementsRoot(partialBlock.get());
        }
        return SyntheticRawNode.root(SNIPPET_ROOT, List.of(SyntheticRawNode.errorLeaf(code)));
    }

    private static boolean hasMembers(CompilationUnit wrapper) {
        return !wrapper.getTypes().isEmpty() && !wrapper.getType(0).getMembers().isEmpty();
    }

    private static boolean hasParsedStatements(BlockStmt block) {
        return block.getStatements().stream().anyMatch(statement -> !statement.isUnparsableStmt());
    }

    private static RawNode statementsRoot(BlockStmt block) {
        List<JavaParserRawNode> statements = block.getStatements().stream()
                .map(JavaParserRawNode::new)
                .collect(Collectors.toList());
        return SyntheticRawNode.root(SNIPPET_ROOT, statements);
    }

    private static RawNode snippetRoot(CompilationUnit wrapper) {
        TypeDeclaration<?> snippetClass = wrapper.getType(0);
        List<JavaParserRawNode> members = snippetClass.getMembers().stream()
                .map(JavaParserImpl::asRaw)
                .collect(Collectors.toList());
        return SyntheticRawNode.root(SNIPPET_ROOT, members);
    }

    private static JavaParserRawNode asRaw(BodyDeclaration<?> member) {
        return new JavaParserRawNode(member);
    }
}
