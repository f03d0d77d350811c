package com.eyelevel.documentindexer.service.convert;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the {@link TextExtractor} for a MIME type from all extractors registered in the context.
 */
@Service
@Slf4j
public class TextExtractorFactory {

    private final List<TextExtractor> extractors;

    public TextExtractorFactory(List<TextExtractor> extractors) {
        this.extractors = extractors;
        log.info("TextExtractorFactory initialized with {} available extractors.", extractors.size());
    }

    /**
     * Finds the extractor for {@code mimeType}. Parameters such as {@code ;charset=utf-8} are ignored.
     */
    public Optional<TextExtractor> getExtractor(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(mimeType);
        Optional<TextExtractor> extractor = extractors.stream().filter(e -> e.supports(normalized)).findFirst();
        log.debug("Searching for extractor for '{}'. Found: {}", normalized,
                  extractor.map(e -> e.getClass().getSimpleName()).orElse("None"));
        return extractor;
    }

    static String normalize(String mimeType) {
        int separator = mimeType.indexOf(';');
        String base = separator >= 0 ? mimeType.substring(0, separator) : mimeType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
