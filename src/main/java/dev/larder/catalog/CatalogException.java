package dev.larder.catalog;

/**
 * Raised when the catalog cannot load its reference data or store recipes.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
