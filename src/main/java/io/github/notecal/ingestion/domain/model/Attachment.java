package io.github.notecal.ingestion.domain.model;

public record Attachment(String filename, byte[] content) {

    public String extension() {
        if (filename == null) return "unknown";
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) return "unknown";
        return filename.substring(dot + 1).toLowerCase();
    }
}
