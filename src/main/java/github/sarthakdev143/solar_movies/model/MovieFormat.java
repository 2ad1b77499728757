package github.sarthakdev143.solar_movies.model;

import java.util.List;

public enum MovieFormat {
    MP4("mp4", null),
    MOV("mov", "mov"),
    FLV("flv", "flv");

    private final String extension;
    private final String muxer;

    MovieFormat(String extension, String muxer) {
        this.extension = extension;
        this.muxer = muxer;
    }

    public String extension() {
        return extension;
    }

    public String muxer() {
        return muxer;
    }

    public boolean primary() {
        return this == MP4;
    }

    public static List<MovieFormat> derived() {
        return List.of(MOV, FLV);
    }
}
