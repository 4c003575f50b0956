package dev.larder.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts schema.org {@code Recipe} data from the JSON-LD blocks of an HTML page.
 *
 * <p>The recipe object may be the top-level value, an element of a top-level array, a node of
 * an {@code @graph}, or nested anywhere below. When the recipe carries no keywords, tags are
 * read from the page state embedded in a {@code __NEXT_DATA__} script; only tags flagged for
 * display are kept there.
 */
@Component
public class SchemaRecipeParser {

    private static final Logger log = LoggerFactory.getLogger(SchemaRecipeParser.class);

    private static final Pattern ISO_DURATION =
            Pattern.compile("P(?:(\\d{1,6})D)?T?(?:(\\d{1,6})H)?(?:(\\d{1,6})M)?(?:(\\d{1,6})S)?",
                    Pattern.CASE_INSENSITIVE);

    private static final int MAX_PAGE_STATE_DEPTH = 10;

    private static final List<String> NUTRIENT_KEYS = List.of(
            "calories",
            "carbohydrateContent",
            "proteinContent",
            "fatContent",
            "fiberContent",
            "sodiumContent",
            "sugarContent",
            "saturatedFatContent",
            "cholesterolContent",
            "servingSize"
    );

    private final ObjectMapper objectMapper;

    public SchemaRecipeParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse the first schema.org Recipe found in the page.
     *
     * @param html    page HTML
     * @param pageUrl URL the page was fetched from
     * @return the raw recipe fields
     * @throws ParseFailureException if no JSON-LD block contains a Recipe
     */
    public ScrapedRecipe parse(String html, String pageUrl) {
        Document document = Jsoup.parse(html == null ? "" : html, pageUrl);
        JsonNode recipe = findRecipeNode(document, pageUrl);
        if (recipe == null) {
            throw new ParseFailureException("No schema.org Recipe found in " + pageUrl);
        }
        return toScrapedRecipe(recipe, document);
    }

    /**
     * Read only the main image of the page's recipe, if any.
     *
     * @param html    page HTML
     * @param pageUrl URL the page was fetched from
     * @return the image URL, empty when the page has no recipe or no image
     */
    public Optional<String> extractImage(String html, String pageUrl) {
        Document document = Jsoup.parse(html == null ? "" : html, pageUrl);
        JsonNode recipe = findRecipeNode(document, pageUrl);
        if (recipe == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(image(recipe.get("image")));
    }

    private JsonNode findRecipeNode(Document document, String pageUrl) {
        for (Element script : document.select("script[type=application/ld+json]")) {
            JsonNode root;
            try {
                root = objectMapper.readTree(script.data());
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block on {}: {}", pageUrl, e.getOriginalMessage());
                continue;
            }
            JsonNode recipe = findRecipe(root);
            if (recipe != null) {
                return recipe;
            }
        }
        return null;
    }

    private JsonNode findRecipe(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                JsonNode found = findRecipe(item);
                if (found != null) {
                    return found;
                }
            }
            return null;
        }
        if (!node.isObject()) {
            return null;
        }

        if (isRecipeType(node.get("@type"))) {
            return node;
        }

        JsonNode graph = node.get("@graph");
        if (graph != null && graph.isArray()) {
            for (JsonNode item : graph) {
                if (item.isObject() && isRecipeType(item.get("@type"))) {
                    return item;
                }
            }
        }

        Iterator<JsonNode> values = node.elements();
        while (values.hasNext()) {
            JsonNode found = findRecipe(values.next());
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static boolean isRecipeType(JsonNode type) {
        if (type == null) {
            return false;
        }
        if (type.isTextual()) {
            return isRecipeTypeName(type.asText());
        }
        if (type.isArray()) {
            for (JsonNode item : type) {
                if (item.isTextual() && isRecipeTypeName(item.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isRecipeTypeName(String name) {
        return name.equals("Recipe") || name.endsWith("/Recipe");
    }

    private ScrapedRecipe toScrapedRecipe(JsonNode recipe, Document document) {
        List<String> instructionsList = instructionsList(recipe.get("recipeInstructions"));
        return new ScrapedRecipe(
                text(recipe.get("name")),
                text(recipe.get("description")),
                ingredients(recipe.get("recipeIngredient")),
                instructionsText(recipe.get("recipeInstructions"), instructionsList),
                instructionsList,
                durationMinutes(recipe.get("totalTime")),
                durationMinutes(recipe.get("prepTime")),
                yields(recipe.get("recipeYield")),
                image(recipe.get("image")),
                keywords(recipe.get("keywords"), document),
                dietaryRestrictions(recipe.get("suitableForDiet")),
                nutrients(recipe.get("nutrition"))
        );
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static List<String> ingredients(JsonNode node) {
        if (node == null) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        List<String> result = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    result.add(item.asText());
                }
            }
        }
        return result;
    }

    private static List<String> instructionsList(JsonNode node) {
        if (node == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    result.add(item.asText());
                } else if (item.isObject()) {
                    // HowToStep carries text, HowToSection a name plus itemListElement steps
                    String stepText = text(item.get("text"));
                    String stepName = text(item.get("name"));
                    if (stepText != null) {
                        result.add(stepText);
                    } else if (stepName != null) {
                        result.add(stepName);
                    }
                    JsonNode elements = item.get("itemListElement");
                    if (elements != null && elements.isArray()) {
                        for (JsonNode element : elements) {
                            String elementText = element.isObject() ? text(element.get("text")) : null;
                            if (elementText != null) {
                                result.add(elementText);
                            }
                        }
                    }
                }
            }
        }
        return result;
    }

    private static String instructionsText(JsonNode node, List<String> instructionsList) {
        if (node != null && node.isTextual()) {
            return node.asText();
        }
        if (!instructionsList.isEmpty()) {
            return String.join("\n", instructionsList);
        }
        return null;
    }

    /**
     * ISO-8601 duration to whole minutes (days, hours and minutes; seconds ignored).
     * Returns null for anything unparsable or zero.
     */
    static Integer durationMinutes(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        Matcher matcher = ISO_DURATION.matcher(node.asText());
        if (!matcher.find()) {
            return null;
        }
        int days = group(matcher, 1);
        int hours = group(matcher, 2);
        int minutes = group(matcher, 3);
        int total = days * 24 * 60 + hours * 60 + minutes;
        return total > 0 ? total : null;
    }

    private static int group(Matcher matcher, int index) {
        String value = matcher.group(index);
        return value == null ? 0 : Integer.parseInt(value);
    }

    private static String yields(JsonNode node) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.isArray() && !node.isEmpty() ? node.get(0) : node;
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isNumber()) {
            return value.asText() + " servings";
        }
        return null;
    }

    private static String image(JsonNode node) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.isArray() && !node.isEmpty() ? node.get(0) : node;
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isObject()) {
            return text(value.get("url"));
        }
        return null;
    }


    private List<String> keywords(JsonNode node, Document document) {
        if (node != null && node.isTextual()) {
            return Arrays.stream(node.asText().split(","))
                    .map(String::trim)
                    .toList();
        }
        if (node != null && node.isArray()) {
            List<String> result = new ArrayList<>();
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    result.add(item.asText());
                }
            }
            if (!result.isEmpty()) {
                return result;
            }
        }
        return pageStateTags(document);
    }

    private List<String> pageStateTags(Document document) {
        Element nextData = document.selectFirst("script#__NEXT_DATA__");
        if (nextData == null) {
            return List.of();
        }
        try {
            List<String> tags = findTags(objectMapper.readTree(nextData.data()), 0);
            return tags == null ? List.of() : tags;
        } catch (JsonProcessingException e) {
            log.debug("Malformed __NEXT_DATA__ page state: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private static List<String> findTags(JsonNode node, int depth) {
        if (depth > MAX_PAGE_STATE_DEPTH || node == null) {
            return null;
        }
        if (node.isObject()) {
            for (String key : List.of("tags", "labels")) {
                JsonNode candidates = node.get(key);
                if (candidates == null || !candidates.isArray()) {
                    continue;
                }
                List<String> result = new ArrayList<>();
                for (JsonNode tag : candidates) {
                    if (!isUserFacingTag(tag)) {
                        continue;
                    }
                    if (tag.isTextual() && !tag.asText().isEmpty()) {
                        result.add(tag.asText());
                    } else if (tag.isObject()) {
                        String name = text(tag.get("name"));
                        if (name != null && !name.isEmpty()) {
                            result.add(name);
                        }
                    }
                }
                if (!result.isEmpty()) {
                    return result;
                }
            }
        }
        if (node.isContainerNode()) {
            for (JsonNode child : node) {
                List<String> found = findTags(child, depth + 1);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    /**
     * Plain values always pass; objects must be flagged for display.
     */
    private static boolean isUserFacingTag(JsonNode tag) {
        if (!tag.isObject()) {
            return true;
        }
        return isTrue(tag.get("displayLabel")) || isTrue(tag.get("display_label"));
    }

    private static boolean isTrue(JsonNode node) {
        return node != null && node.isBoolean() && node.booleanValue();
    }

    private static List<String> dietaryRestrictions(JsonNode node) {
        if (node == null) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(cleanDietName(node.asText()));
        }
        List<String> result = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    result.add(cleanDietName(item.asText()));
                }
            }
        }
        return result;
    }

    private static String cleanDietName(String diet) {
        return diet.replace("https://schema.org/", "").replace("http://schema.org/", "");
    }



    private static Map<String, String> nutrients(JsonNode node) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return result;
        }
        for (String key : NUTRIENT_KEYS) {
            JsonNode value = node.get(key);
            if (value != null && (value.isTextual() || value.isNumber())) {
                result.put(key, value.asText());
            }
        }
        return result;
    }
}
