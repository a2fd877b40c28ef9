package com.bookdrop.catalogagent.domain.model;

public record BookFileName(
        String fileName,
        String baseName,
        String extension
) {
    public boolean hasExtension() {
        return extension != null && !extension.isEmpty();
    }
}
