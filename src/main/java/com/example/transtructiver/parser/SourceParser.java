package com.example.transtructiver.parser;

import com.example.transtructiver.filter.DiscardReason;
import com.example.transtructiver.filter.QualityFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Turns a source snippet into a tree, or tells why it is unusable.
 */
@Service
public class SourceParser {
    private static final Logger log = LoggerFactory.getLogger(SourceParser.class);

    private final ParserFactory parserFactory;
    private final QualityFilter qualityFilter;

    public SourceParser(ParserFactory parserFactory, QualityFilter qualityFilter) {
        this.parserFactory = parserFactory;
        this.qualityFilter = qualityFilter;
    }

    /**
     * @throws UnsupportedLanguageException when no backend handles {@code language}
     */
    public ParseOutcome parse(String code, String language) {
        LanguageParser parser = parserFactory.getParser(language);

        // Unpaired surrogates have no UTF-8 form. Encoders are stateful, so one per call.
        if (!StandardCharsets.UTF_8.newEncoder().canEncode(code)) {
            return ParseOutcome.discarded(DiscardReason.INVALID_UTF8);
        }

        RawNode raw = parser.parse(code);
        Optional<DiscardReason> reason = qualityFilter.classify(raw, code);
        if (reason.isPresent()) {
            log.debug("Discarding {} snippet: {}", language, reason.get().code());
            return ParseOutcome.discarded(reason.get());
        }

        return ParseOutcome.accepted(TreeAdapter.convert(raw, code.getBytes(StandardCharsets.UTF_8)));
    }
}
