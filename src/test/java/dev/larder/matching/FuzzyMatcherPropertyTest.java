package dev.larder.matching;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Invariants of {@link FuzzyMatcher#search} over generated names.
 */
class FuzzyMatcherPropertyTest {

    @Provide
    Arbitrary<String> names() {
        return Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(12);
    }

    @Provide
    Arbitrary<List<String>> nameLists() {
        return names().list().ofMinSize(1).ofMaxSize(15);
    }

    @Provide
    Arbitrary<MatchLevel> levels() {
        return Arbitraries.of(MatchLevel.class);
    }

    @Property
    void caseInsensitiveExactMatchIsAlwaysReturnedAsExact(@ForAll("nameLists") List<String> names,
                                                          @ForAll("levels") MatchLevel level) {
        String target = names.get(names.size() / 2);
        String query = "  " + target.toUpperCase(Locale.ROOT) + " ";

        FuzzySearchResult<String> result = FuzzyMatcher.search(names, query, Function.identity(), level);

        assertThat(result.exact()).isNotNull();
        assertThat(NameNormalizer.sameName(result.exact(), target)).isTrue();
        assertThat(result.similar()).isEmpty();
    }

    @Property
    void similarItemsComeFromInputAndRespectThreshold(@ForAll("nameLists") List<String> names,
                                                      @ForAll("names") String query,
                                                      @ForAll("levels") MatchLevel level) {
        FuzzySearchResult<String> result = FuzzyMatcher.search(names, query, Function.identity(), level);

        assertThat(names).containsAll(result.similar());
        List<Double> scores = new ArrayList<>();
        for (String item : result.similar()) {
            double score = FuzzyMatcher.score(NameNormalizer.normalizeKey(query), NameNormalizer.normalizeKey(item));
            assertThat(score).isLessThanOrEqualTo(level.threshold());
            scores.add(score);
        }
        assertThat(scores).isSorted();
    }

    @Property
    void searchNeverMutatesItems(@ForAll("nameLists") List<String> names, @ForAll("names") String query) {
        List<String> copy = List.copyOf(names);

        FuzzyMatcher.search(names, query, Function.identity(), MatchLevel.PERMISSIVE);

        assertThat(names).isEqualTo(copy);
    }
}
