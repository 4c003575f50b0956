package dev.larder.validation;

/**
 * Thrown when no recipe of an import batch keeps a single ingredient after mappings are applied.
 */
public class NoValidRecipesException extends RuntimeException {

    public NoValidRecipesException(int recipeCount) {
        super("None of the " + recipeCount + " recipes has a validated ingredient; nothing to import");
    }
}
