package edu.harvard.hms.dbmi.avillach.tsformat.etl.timeseries;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

import java.net.URI;
import java.nio.file.Path;

public final class SeriesPaths {

    private static final String SEPARATOR = "/";
    private static final String FILE_SCHEME = "file:";

    private static final Escaper SEGMENT_ESCAPER = UrlEscapers.urlPathSegmentEscaper();

    private SeriesPaths() {
    }

    /**
     * Joins a base location and a file name. A separator is inserted unless the base already ends with one, and an absolute file
     * name replaces the base entirely. Under a {@code file:} base the file name is percent-encoded segment by segment, so
     * characters such as {@code #}, {@code %} or spaces stay part of the name.
     */
    public static String join(String basePath, String fileName) {
        if (fileName.startsWith(SEPARATOR) || basePath.isEmpty()) {
            return fileName;
        }
        String name = basePath.startsWith(FILE_SCHEME) ? encodePath(fileName) : fileName;
        if (basePath.endsWith(SEPARATOR)) {
            return basePath + name;
        }
        return basePath + SEPARATOR + name;
    }

    private static String encodePath(String relativePath) {
        return Joiner.on(SEPARATOR).join(
            Splitter.on(SEPARATOR).splitToStream(relativePath).map(SEGMENT_ESCAPER::escape).iterator()
        );
    }

    /**
     * Converts a joined location, either a plain path or a {@code file:} uri, to a local path.
     *
     * @throws IllegalArgumentException if the location is a malformed or non-file uri
     */
    public static Path toPath(String location) {
        if (location.startsWith(FILE_SCHEME)) {
            return Path.of(URI.create(location));
        }
        return Path.of(location);
    }
}
