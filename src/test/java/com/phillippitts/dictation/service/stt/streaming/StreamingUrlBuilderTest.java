package com.phillippitts.dictation.service.stt.streaming;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingUrlBuilderTest {

    private static final String ENDPOINT = "wss://api.example.com/v1/listen";

    @Test
    void autoLanguageUsesNewestModelWithoutLanguageParam() {
        URI uri = StreamingUrlBuilder.build(ENDPOINT, StreamingOptions.forLanguage("auto"));

        assertThat(uri.toString())
                .startsWith(ENDPOINT + "?")
                .contains("encoding=linear16")
                .contains("sample_rate=16000")
                .contains("channels=1")
                .contains("model=nova-3")
                .contains("interim_results=true")
                .doesNotContain("language=");
    }

    @Test
    void regionalVariantOfSupportedLanguageKeepsNewestModel() {
        assertThat(StreamingUrlBuilder.modelFor("en-GB")).isEqualTo(StreamingUrlBuilder.MODEL_NOVA_3);
        assertThat(StreamingUrlBuilder.modelFor("pt-BR")).isEqualTo(StreamingUrlBuilder.MODEL_NOVA_3);
    }

    @Test
    void unsupportedLanguageFallsBackToPreviousTierWithKeywords() {
        StreamingOptions options = new StreamingOptions(16_000, "zh-CN", List.of("Kubernetes"));

        String url = StreamingUrlBuilder.build(ENDPOINT, options).toString();

        assertThat(url).contains("model=nova-2")
                .contains("language=zh-CN")
                .contains("keywords=Kubernetes")
                .doesNotContain("keyterm=");
    }

    @Test
    void keytermsAreEncodedAndBlankOnesSkipped() {
        StreamingOptions options = new StreamingOptions(16_000, "en", List.of("Spring Boot", " ", "C++"));

        String url = StreamingUrlBuilder.build(ENDPOINT, options).toString();

        assertThat(url).contains("keyterm=Spring+Boot")
                .contains("keyterm=C%2B%2B")
                .contains("language=en");
        assertThat(url.split("keyterm=", -1)).hasSize(3);
    }

    @Test
    void existingQueryIsExtended() {
        String url = StreamingUrlBuilder.build(ENDPOINT + "?tier=x", StreamingOptions.defaults()).toString();
        assertThat(url).startsWith(ENDPOINT + "?tier=x&encoding=linear16");
    }
}
