package com.example.transtructiver.parser;

import lombok.Getter;

@Getter
public class UnsupportedLanguageException extends IllegalArgumentException {
    private final String language;

    public UnsupportedLanguageException(String language) {
        super("Unsupported language: " + language);
        this.language = language;
    }
}
