package dev.larder.matching;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NameNormalizerTest {

    @Test
    void normalizeKeyTrimsCollapsesWhitespaceAndLowercases() {
        assertThat(NameNormalizer.normalizeKey("  Crème   FRAÎCHE \t")).isEqualTo("crème fraîche");
    }

    @Test
    void normalizeKeyOfNullIsEmpty() {
        assertThat(NameNormalizer.normalizeKey(null)).isEmpty();
    }

    @Test
    void cleanNameStripsParentheticalAnnotations() {
        assertThat(NameNormalizer.cleanName("Tomato (diced)")).isEqualTo("Tomato");
        assertThat(NameNormalizer.cleanName("Cheddar (smoked) (grated)")).isEqualTo("Cheddar");
        assertThat(NameNormalizer.cleanName("Tomato (diced)")).isEqualTo(NameNormalizer.cleanName("Tomato"));
    }

    @Test
    void cleanNameKeepsNamesWithoutParentheses() {
        assertThat(NameNormalizer.cleanName(" Pomme de terre ")).isEqualTo("Pomme de terre");
    }

    @Test
    void sameNameIgnoresCaseAndSpacing() {
        assertThat(NameNormalizer.sameName("FLOUR ", "flour")).isTrue();
        assertThat(NameNormalizer.sameName("flour", "flours")).isFalse();
    }
}
