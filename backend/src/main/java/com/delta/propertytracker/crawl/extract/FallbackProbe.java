package com.delta.propertytracker.crawl.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An ordered list of extraction strategies for one field. {@link #probe(Object)} runs them in
 * order and returns the first value that passes the plausibility check. A strategy that
 * throws or returns {@code null} counts as a miss.
 *
 * @param <T> what the strategies read from (a page, a card element)
 * @param <R> the extracted value
 */
public final class FallbackProbe<T, R> {
    private static final Logger log = LoggerFactory.getLogger(FallbackProbe.class);

    private final String field;
    private final List<Candidate<T, R>> candidates;
    private final Predicate<? super R> plausible;

    private FallbackProbe(String field, List<Candidate<T, R>> candidates, Predicate<? super R> plausible) {
        this.field = field;
        this.candidates = List.copyOf(candidates);
        this.plausible = plausible;
    }

    public static <T, R> Builder<T, R> forField(String field) {
        return new Builder<>(field);
    }

    public String field() {
        return field;
    }

    public int size() {
        return candidates.size();
    }

    public Optional<Match<R>> probe(T source) {
        for (Candidate<T, R> candidate : candidates) {
            R value;
            try {
                value = candidate.extractor().apply(source);
            } catch (RuntimeException e) {
                log.debug("{} candidate {} failed: {}", field, candidate.label(), e.getMessage());
                continue;
            }
            if (value == null || isBlankText(value)) {
                continue;
            }
            if (!plausible.test(value)) {
                continue;
            }
            if (candidate.accept() != null && !candidate.accept().test(value)) {
                continue;
            }
            return Optional.of(new Match<>(value, candidate.label()));
        }
        log.debug("No candidate matched {}", field);
        return Optional.empty();
    }

    public Optional<R> probeValue(T source) {
        return probe(source).map(Match::value);
    }

    private static boolean isBlankText(Object value) {
        return value instanceof String text && text.isBlank();
    }

    public record Match<R>(R value, String label) {
    }

    private record Candidate<T, R>(String label, Function<? super T, ? extends R> extractor, Predicate<? super R> accept) {
    }

    public static final class Builder<T, R> {
        private final String field;
        private final List<Candidate<T, R>> candidates = new ArrayList<>();
        private Predicate<? super R> plausible = value -> true;

        private Builder(String field) {
            this.field = field;
        }

        /** Check every candidate value must pass, on top of being non-null and non-blank. */
        public Builder<T, R> plausibleWhen(Predicate<? super R> predicate) {
            this.plausible = predicate;
            return this;
        }

        public Builder<T, R> candidate(String label, Function<? super T, ? extends R> extractor) {
            return candidate(label, extractor, null);
        }

        public Builder<T, R> candidate(
            String label,
            Function<? super T, ? extends R> extractor,
            Predicate<? super R> accept
        ) {
            candidates.add(new Candidate<>(label, extractor, accept));
            return this;
        }

        /** One candidate per selector, in list order. */
        public Builder<T, R> candidates(List<String> selectors, Function<String, Function<? super T, ? extends R>> factory) {
            for (String selector : selectors) {
                candidates.add(new Candidate<>(selector, factory.apply(selector), null));
            }
            return this;
        }

        public FallbackProbe<T, R> build() {
            return new FallbackProbe<>(field, candidates, plausible);
        }
    }
}
