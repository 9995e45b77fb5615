package com.delta.propertytracker.crawl.extract;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackProbeTest {

    @Test
    void returnsFirstPlausibleValueWithItsLabel() {
        FallbackProbe<Map<String, String>, String> probe = FallbackProbe.<Map<String, String>, String>forField("title")
            .plausibleWhen(text -> text.length() > 3)
            .candidate("throws", source -> {
                throw new IllegalStateException("detached element");
            })
            .candidate("blank", source -> "   ")
            .candidate("short", source -> "abc")
            .candidates(List.of("h2", "h3"), selector -> source -> source.get(selector))
            .build();

        Optional<FallbackProbe.Match<String>> match = probe.probe(Map.of("h3", "Departamento en venta"));

        assertThat(match).isPresent();
        assertThat(match.get().value()).isEqualTo("Departamento en venta");
        assertThat(match.get().label()).isEqualTo("h3");
        assertThat(probe.size()).isEqualTo(5);
    }

    @Test
    void candidateSpecificCheckCanRejectAValue() {
        FallbackProbe<String, String> probe = FallbackProbe.<String, String>forField("detailUrl")
            .candidate("own href", source -> source, href -> href.contains("MLC"))
            .candidate("fallback", source -> "https://www.portalinmobiliario.com/MLC-1")
            .build();

        assertThat(probe.probeValue("https://example.com/other")).contains("https://www.portalinmobiliario.com/MLC-1");
        assertThat(probe.probe("https://www.portalinmobiliario.com/MLC-9").get().label()).isEqualTo("own href");
    }

    @Test
    void emptyWhenNoCandidateMatches() {
        FallbackProbe<String, Integer> probe = FallbackProbe.<String, Integer>forField("bedrooms")
            .candidate("none", source -> null)
            .build();

        assertThat(probe.probe("anything")).isEmpty();
        assertThat(probe.field()).isEqualTo("bedrooms");
    }
}
