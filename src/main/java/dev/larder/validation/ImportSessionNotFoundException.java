package dev.larder.validation;

import java.util.UUID;

public class ImportSessionNotFoundException extends RuntimeException {

    public ImportSessionNotFoundException(UUID id) {
        super("Import session not found: " + id);
    }
}
