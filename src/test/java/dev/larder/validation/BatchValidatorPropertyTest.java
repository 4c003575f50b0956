package dev.larder.validation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import dev.larder.fixture.ConvertedRecipeBuilder;
import dev.larder.matching.NameNormalizer;
import dev.larder.recipe.ConvertedRecipe;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Batch-level invariants of {@link BatchValidator} over generated recipe batches.
 */
class BatchValidatorPropertyTest {

    private final BatchValidator validator = new BatchValidator();

    @Provide
    Arbitrary<String> ingredientNames() {
        Arbitrary<String> base = Arbitraries.of("Flour", "Sugar", "Butter", "Tomato", "Cumin", "Red onion");
        Arbitrary<String> spelled = Arbitraries.oneOf(
                base,
                base.map(String::toUpperCase),
                base.map(String::toLowerCase),
                base.map(name -> "  " + name + " "),
                base.map(name -> name + " (diced)"));
        return spelled;
    }

    @Provide
    Arbitrary<List<List<String>>> batches() {
        return ingredientNames().list().ofMinSize(0).ofMaxSize(6).list().ofMinSize(1).ofMaxSize(5);
    }

    @Property
    void uniqueIngredientCountEqualsDistinctCleanedNames(@ForAll("batches") List<List<String>> batch,
                                                         @ForAll long seed) {
        Set<String> expected = batch.stream()
                .flatMap(List::stream)
                .map(name -> NameNormalizer.normalizeKey(NameNormalizer.cleanName(name)))
                .collect(Collectors.toSet());

        List<ConvertedRecipe> recipes = toRecipes(batch);
        List<ConvertedRecipe> shuffled = new ArrayList<>(recipes);
        Collections.shuffle(shuffled, new Random(seed));

        assertThat(validator.initialize(recipes, List.of(), List.of()).uniqueIngredients())
                .hasSize(expected.size());
        assertThat(validator.initialize(shuffled, List.of(), List.of()).uniqueIngredients().keySet())
                .containsExactlyInAnyOrderElementsOf(expected);
    }

    @Property
    void mappingsPlusPendingCoverEveryUniqueIngredient(@ForAll("batches") List<List<String>> batch) {
        BatchValidationState state = validator.initialize(toRecipes(batch),
                BatchValidatorTest.INGREDIENTS, BatchValidatorTest.TAGS);

        assertThat(state.ingredientMappings().size() + state.ingredientsToValidate().size())
                .isEqualTo(state.uniqueIngredients().size());
    }

    @Property
    void applyingMappingsIsIdempotent(@ForAll("batches") List<List<String>> batch) {
        List<ConvertedRecipe> recipes = toRecipes(batch);
        BatchValidationState state = validator.initialize(recipes,
                BatchValidatorTest.INGREDIENTS, BatchValidatorTest.TAGS);

        assertThat(validator.applyMappingsToRecipes(recipes, state))
                .isEqualTo(validator.applyMappingsToRecipes(recipes, state));
    }

    private static List<ConvertedRecipe> toRecipes(List<List<String>> batch) {
        List<ConvertedRecipe> recipes = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            recipes.add(new ConvertedRecipeBuilder()
                    .title("Recipe " + i)
                    .ingredients(batch.get(i).toArray(new String[0]))
                    .build());
        }
        return recipes;
    }
}
