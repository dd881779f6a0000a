package com.di.poolguard.exception;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body returned by {@link GlobalExceptionHandler} for every failed request.
 */
@Data
public class ErrorResponse {
    private String timestamp;
    private int status;
    private String error;
    private String message;
    private String errorCategory;
    private String errorCategoryName;
    private String errorCategoryDescription;
    private String path;
    private Map<String, Object> details = new LinkedHashMap<>();

    public void addDetail(String key, Object value) {
        details.put(key, value);
    }
}
