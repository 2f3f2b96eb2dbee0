package com.example.docsync.model;

/**
 * One decoded source file handed to the engine.
 *
 * @param origin file name (may be null for ad-hoc text)
 * @param text   decoded file content
 */
public record SourceUnit(String origin, String text) {

    public SourceUnit {
        if (text == null) text = "";
    }

    public static SourceUnit of(String text) {
        return new SourceUnit(null, text);
    }

    public boolean hasExtension(String extension) {
        return origin != null && origin.toLowerCase().endsWith(extension);
    }
}
