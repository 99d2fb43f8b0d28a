package com.flagship.media_ledger.creation;

public enum CreationKind {
    IMAGE("png"),
    VIDEO("mp4");

    private final String extension;

    CreationKind(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
