package com.shopsense.catalog.exception;

import org.springframework.http.HttpStatus;

public class CatalogException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public CatalogException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static CatalogException productNotFound(String identifier) {
        return new CatalogException("Product not found: " + identifier, HttpStatus.NOT_FOUND, "PRODUCT_NOT_FOUND");
    }
}
