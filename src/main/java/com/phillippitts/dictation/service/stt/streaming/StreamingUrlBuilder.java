package com.phillippitts.dictation.service.stt.streaming;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the listen URL for a streaming session.
 *
 * <p>The newest model tier is used when the language (or its base code) is supported by it, or
 * when the language is detected automatically; other languages fall back to the previous tier,
 * which takes bias terms as {@code keywords} instead of {@code keyterm}.
 */
final class StreamingUrlBuilder {

    private static final Logger LOG = LogManager.getLogger(StreamingUrlBuilder.class);

    static final String MODEL_NOVA_3 = "nova-3";
    static final String MODEL_NOVA_2 = "nova-2";

    private static final Set<String> NOVA3_LANGUAGES = Set.of(
            "ar", "be", "bn", "bs", "bg", "ca", "hr", "cs", "da", "nl", "en", "et", "fi", "fr", "de",
            "el", "he", "hi", "hu", "id", "it", "ja", "kn", "ko", "lv", "lt", "mk", "ms", "mr", "no",
            "fa", "pl", "pt", "ro", "ru", "sr", "sk", "sl", "es", "sv", "tl", "ta", "te", "tr", "uk",
            "ur", "vi", "multi");

    private StreamingUrlBuilder() {}

    static String modelFor(String explicitLanguage) {
        if (explicitLanguage == null) {
            return MODEL_NOVA_3;
        }
        String base = explicitLanguage.split("-")[0].toLowerCase(Locale.ROOT);
        if (NOVA3_LANGUAGES.contains(explicitLanguage) || NOVA3_LANGUAGES.contains(base)) {
            return MODEL_NOVA_3;
        }
        return MODEL_NOVA_2;
    }

    static URI build(String endpoint, StreamingOptions options) {
        String language = options.explicitLanguage();
        String model = modelFor(language);
        if (MODEL_NOVA_2.equals(model)) {
            LOG.debug("Falling back to {} for language={}", model, language);
        }

        StringBuilder query = new StringBuilder()
                .append("encoding=linear16")
                .append("&sample_rate=").append(options.sampleRate())
                .append("&channels=1")
                .append("&model=").append(model)
                .append("&punctuate=true")
                .append("&interim_results=true");
        if (language != null) {
            query.append("&language=").append(encode(language));
        }
        String termParam = MODEL_NOVA_3.equals(model) ? "keyterm" : "keywords";
        for (String term : options.keyterms()) {
            if (term != null && !term.isBlank()) {
                query.append('&').append(termParam).append('=').append(encode(term));
            }
        }
        return URI.create(endpoint + (endpoint.contains("?") ? "&" : "?") + query);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
