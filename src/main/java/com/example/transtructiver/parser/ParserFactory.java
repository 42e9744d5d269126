package com.example.transtructiver.parser;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Component
public class ParserFactory {

    private static final Map<String, Class<? extends LanguageParser>> parserRegistry = new TreeMap<>();

    static {
        parserRegistry.put("c", CParserImpl.class);
        parserRegistry.put("cpp", CParserImpl.class);
        parserRegistry.put("h", CParserImpl.class);
        parserRegistry.put("java", JavaParserImpl.class);
        parserRegistry.put("python", PythonParserImpl.class);
        parserRegistry.put("py", PythonParserImpl.class);
    }

    public LanguageParser getParser(String language) {
        Class<? extends LanguageParser> parserClass = lookup(language);
        try {
            return parserClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot create parser for language " + language, e);
        }
    }

    /**
     * Fails with {@link UnsupportedLanguageException} when no backend handles the language.
     */
    public void requireSupported(String language) {
        lookup(language);
    }

    public Set<String> supportedLanguages() {
        return parserRegistry.keySet();
    }

    private static Class<? extends LanguageParser> lookup(String language) {
        Class<? extends LanguageParser> parserClass =
                language == null ? null : parserRegistry.get(language.toLowerCase(Locale.ROOT));
        if (parserClass == null) {
            throw new UnsupportedLanguageException(language);
        }
        return parserClass;
    }
}
