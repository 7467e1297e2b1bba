package com.disassembly.composition.exception;

import jakarta.persistence.EntityNotFoundException;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A referenced owner, product type, material or product does not exist.
 */
public class ModelNotFoundException extends EntityNotFoundException {

    private final String modelName;
    private final List<Object> missingIds;

    public ModelNotFoundException(String modelName, Object id) {
        this(modelName, List.of(id));
    }

    public ModelNotFoundException(String modelName, Collection<?> missingIds) {
        super(buildMessage(modelName, missingIds));
        this.modelName = modelName;
        this.missingIds = List.copyOf(missingIds);
    }

    public String getModelName() {
        return modelName;
    }

    public List<Object> getMissingIds() {
        return missingIds;
    }

    private static String buildMessage(String modelName, Collection<?> ids) {
        if (ids.size() == 1) {
            return modelName + " with id " + ids.iterator().next() + " not found";
        }
        String joined = ids.stream().map(String::valueOf).sorted().collect(Collectors.joining(", "));
        return modelName + "s with ids {" + joined + "} not found";
    }
}
