package dev.larder.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import dev.larder.matching.NameNormalizer;
import dev.larder.recipe.ConvertedRecipe;
import dev.larder.recipe.ImportedIngredient;
import dev.larder.recipe.Nutrition;
import dev.larder.recipe.PreparationStep;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/**
 * Converts raw {@link ScrapedRecipe} fields into a {@link ConvertedRecipe}: ingredient line
 * parsing, servings and time defaults, tag merging, method steps, per-100 g nutrition.
 */
@Component
public class ScrapedRecipeConverter {

    private static final double PER_GRAMS = 100.0;
    private static final double SODIUM_MG_THRESHOLD = 10.0;
    private static final double MG_PER_GRAM = 1000.0;
    private static final double KCAL_TO_KJ = 4.184;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern FIRST_INTEGER = Pattern.compile("\\d+");
    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+(?:[.,]\\d+)?");
    private static final Pattern LINE_BREAK_TAG = Pattern.compile("(?i)<br\\s*/?>");
    private static final Pattern AFCDN_RESIZE_SUFFIX = Pattern.compile("_w\\d+h\\d+[^.]*\\.");

    private final ScraperProperties properties;

    public ScrapedRecipeConverter(ScraperProperties properties) {
        this.properties = properties;
    }

    /**
     * Convert scraped fields into the canonical recipe shape.
     *
     * @param scraped    fields read from the page
     * @param sourceUrl  page URL
     * @param providerId id of the provider that fetched the page
     * @return the converted recipe
     */
    public ConvertedRecipe convert(ScrapedRecipe scraped, String sourceUrl, String providerId) {
        List<ImportedIngredient> ingredients = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (String raw : scraped.ingredients()) {
            if (isIgnored(raw)) {
                skipped.add(raw.trim());
            } else {
                ingredients.add(parseIngredient(raw));
            }
        }

        int time = scraped.totalTime() != null ? scraped.totalTime()
                : scraped.prepTime() != null ? scraped.prepTime() : 0;

        return new ConvertedRecipe(
                scraped.title(),
                scraped.description(),
                cleanImageUrl(scraped.image()),
                parseServings(scraped.yields()),
                time,
                ingredients,
                mergeTags(scraped.keywords(), scraped.dietaryRestrictions()),
                convertNutrition(scraped.nutrients()),
                convertPreparation(scraped.instructions(), scraped.instructionsList()),
                skipped,
                sourceUrl,
                providerId);
    }

    /**
     * Whether a line matches one of the configured ignore patterns (case-insensitive exact
     * match or prefix).
     */
    boolean isIgnored(String ingredient) {
        String lower = ingredient.trim().toLowerCase(Locale.ROOT);
        for (String exact : properties.ignoredIngredientExactMatches()) {
            if (lower.equals(exact.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        for (String prefix : properties.ignoredIngredientPrefixes()) {
            if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Split an ingredient line into quantity, unit and name: {@code "<qty> <unit> <name...>"},
     * where the quantity may span two words when the second is a fraction ("1 1/2 cups milk").
     * Parenthetical annotations are dropped first. Lines without a leading quantity become a
     * bare name.
     */
    static ImportedIngredient parseIngredient(String line) {
        String trimmed = NameNormalizer.cleanName(line);
        String[] words = WHITESPACE.split(trimmed);
        if (words.length < 2) {
            return ImportedIngredient.named(trimmed);
        }

        boolean fraction = words[1].contains("/");
        String candidate = fraction ? words[0] + " " + words[1] : words[0];
        OptionalDouble parsed = QuantityParser.parse(candidate);
        if (parsed.isEmpty()) {
            return ImportedIngredient.named(trimmed);
        }

        String quantity = QuantityParser.format(parsed.getAsDouble());
        List<String> remaining = Arrays.asList(words).subList(fraction ? 2 : 1, words.length);
        if (remaining.isEmpty()) {
            return new ImportedIngredient("", quantity, "");
        }
        if (remaining.size() == 1) {
            return new ImportedIngredient(remaining.get(0), quantity, "");
        }
        String name = String.join(" ", remaining.subList(1, remaining.size()));
        return new ImportedIngredient(name, quantity, remaining.get(0));
    }

    int parseServings(String yields) {
        if (yields == null) {
            return properties.defaultPersons();
        }
        Matcher matcher = FIRST_INTEGER.matcher(yields);
        if (matcher.find()) {
            try {
                return Integer.parseInt(matcher.group());
            } catch (NumberFormatException e) {
                return properties.defaultPersons();
            }
        }
        return properties.defaultPersons();
    }

    /**
     * Keywords first, then dietary restrictions; blanks dropped, first spelling of a
     * case-insensitive duplicate kept.
     */
    static List<String> mergeTags(List<String> keywords, List<String> dietaryRestrictions) {
        Map<String, String> tags = new LinkedHashMap<>();
        List<String> all = new ArrayList<>(keywords);
        all.addAll(dietaryRestrictions);
        for (String tag : all) {
            if (tag == null || tag.isBlank()) {
                continue;
            }
            tags.putIfAbsent(NameNormalizer.normalizeKey(tag), tag.trim());
        }
        return List.copyOf(tags.values());
    }

    static List<PreparationStep> convertPreparation(String instructions, List<String> instructionsList) {
        if (!instructionsList.isEmpty()) {
            return instructionsList.stream()
                    .map(step -> new PreparationStep("", stripHtml(step.trim())))
                    .toList();
        }
        if (instructions == null) {
            return List.of();
        }
        return Arrays.stream(instructions.split("\n"))
                .map(line -> stripHtml(removeNumberedPrefix(line)))
                .filter(step -> !step.isEmpty())
                .map(step -> new PreparationStep("", step))
                .toList();
    }

    /**
     * Drop a leading step number such as {@code "12."}.
     */
    static String removeNumberedPrefix(String text) {
        String trimmed = text.trim();
        int dot = trimmed.indexOf('.');
        if (dot > 0 && dot <= 3 && trimmed.substring(0, dot).chars().allMatch(Character::isDigit)) {
            return trimmed.substring(dot + 1).trim();
        }
        return trimmed;
    }

    static String stripHtml(String text) {
        String withBreaks = LINE_BREAK_TAG.matcher(text).replaceAll("\n");
        return Jsoup.parseBodyFragment(withBreaks).text().trim();
    }

    /**
     * Per-100 g nutrition, only when the page states both calories and a serving size;
     * without a serving size the values cannot be told apart from per-100 g ones.
     */
    static Nutrition convertNutrition(Map<String, String> nutrients) {
        double kcal = numericValue(nutrients.get("calories"));
        if (kcal == 0) {
            return null;
        }
        double servingSize = numericValue(nutrients.get("servingSize"));
        if (servingSize <= 0) {
            return null;
        }

        double rawSodium = numericValue(nutrients.get("sodiumContent"));
        double sodiumGrams = rawSodium > SODIUM_MG_THRESHOLD ? rawSodium / MG_PER_GRAM : rawSodium;

        double energyKcal = per100g(kcal, servingSize);
        return new Nutrition(
                energyKcal,
                roundOneDecimal(energyKcal * KCAL_TO_KJ),
                per100g(numericValue(nutrients.get("fatContent")), servingSize),
                per100g(numericValue(nutrients.get("saturatedFatContent")), servingSize),
                per100g(numericValue(nutrients.get("carbohydrateContent")), servingSize),
                per100g(numericValue(nutrients.get("sugarContent")), servingSize),
                per100g(numericValue(nutrients.get("fiberContent")), servingSize),
                per100g(numericValue(nutrients.get("proteinContent")), servingSize),
                per100g(sodiumGrams, servingSize),
                servingSize);
    }

    private static double per100g(double perServing, double servingSize) {
        return roundOneDecimal(perServing / servingSize * PER_GRAMS);
    }

    private static double roundOneDecimal(double value) {
        return Math.round(value * 10) / 10.0;
    }

    /**
     * First number in a nutrition text such as {@code "250 kcal"} or {@code "2,5 g"}; 0 when none or
     * out of range.
     */
    static double numericValue(String text) {
        if (text == null) {
            return 0;
        }
        Matcher matcher = FIRST_NUMBER.matcher(text);
        if (!matcher.find()) {
            return 0;
        }
        double value = Double.parseDouble(matcher.group().replace(',', '.'));
        return Double.isFinite(value) ? value : 0;
    }

    /**
     * Remove CDN resize suffixes so the full-size image is stored.
     */
    public static String cleanImageUrl(String url) {
        if (url == null || url.isEmpty()) {
            return "";
        }
        if (url.contains("assets.afcdn.com")) {
            return AFCDN_RESIZE_SUFFIX.matcher(url).replaceFirst(".");
        }
        return url;
    }
}
