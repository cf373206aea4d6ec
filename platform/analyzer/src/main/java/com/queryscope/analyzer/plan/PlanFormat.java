package com.queryscope.analyzer.plan;

/**
 * Serialization format of a captured plan.
 */
public enum PlanFormat {
    JSON("application/json", "json", "JSON"),
    XML("application/xml", "xml", "XML"),
    TEXT("text/plain", "txt", "Plain Text"),
    UNKNOWN("text/plain", "txt", "Plain Text");

    private final String contentType;
    private final String fileExtension;
    private final String description;

    PlanFormat(String contentType, String fileExtension, String description) {
        this.contentType = contentType;
        this.fileExtension = fileExtension;
        this.description = description;
    }

    public String contentType() {
        return contentType;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public String description() {
        return description;
    }
}
