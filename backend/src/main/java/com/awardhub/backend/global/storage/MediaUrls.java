package com.awardhub.backend.global.storage;

public final class MediaUrls {

    private static final String PREFIX = "/media/";

    private MediaUrls() {
    }

    public static String of(String mediaPath) {
        return mediaPath == null ? null : PREFIX + mediaPath;
    }
}
