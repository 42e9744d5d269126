package com.example.transtructiver.parser;

/**
 * A parsing backend for one or more languages. Implementations keep per-parse state and are
 * therefore created fresh for every parse by {@link ParserFactory}.
 */
public interface LanguageParser {

    RawNode parse(String code);
}
