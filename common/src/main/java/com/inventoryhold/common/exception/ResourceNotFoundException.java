package com.inventoryhold.common.exception;

import lombok.Getter;

/**
 * The addressed inventory unit or reservation does not exist. Mapped to HTTP 404.
 */
@Getter
public class ResourceNotFoundException extends BusinessException {

    public static final String ERROR_CODE = "RESOURCE_NOT_FOUND";

    private final String resourceType;
    private final String identifier;

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), ERROR_CODE);
        this.resourceType = resourceType;
        this.identifier = String.valueOf(identifier);
    }
}
