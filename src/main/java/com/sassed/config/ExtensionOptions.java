package com.sassed.config;

/**
 * File extensions, without the dot, that folder compilation picks up.
 */
public record ExtensionOptions(String sass, String scss) {
    public static final ExtensionOptions DEFAULT = new ExtensionOptions("sass", "scss");

    public boolean isSass(String fileName) {
        return fileName.endsWith("." + sass);
    }

    public boolean matches(String fileName) {
        return isSass(fileName) || fileName.endsWith("." + scss);
    }
}
