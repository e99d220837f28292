package com.github.wikiexport.crawl;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

/**
 * Media file to be fetched for a page in the File: namespace.
 */
public record DownloadJob(String title, Path destination) {
    public static final String FILE_PREFIX = "File:";

    public DownloadJob {
        Objects.requireNonNull(title);
        Objects.requireNonNull(destination);
    }

    public String localName() {
        return StringUtils.removeStart(title, FILE_PREFIX);
    }

    public static boolean isFilePage(String title) {
        return title.startsWith(FILE_PREFIX);
    }

    /**
     * A name is safe when it stays within the save directory once resolved.
     */
    public static boolean isSafeName(String name) {
        return !name.isEmpty() && !StringUtils.containsAny(name, '/', '\\') && !name.equals(".") && !name.equals("..");
    }

    /**
     * @return the job for a File: title, empty for other titles and for names
     * that would escape the save directory
     */
    public static Optional<DownloadJob> forTitle(String title, Path saveDir) {
        if (!isFilePage(title)) {
            return Optional.empty();
        }

        var name = StringUtils.removeStart(title, FILE_PREFIX);

        if (!isSafeName(name)) {
            return Optional.empty();
        }

        return Optional.of(new DownloadJob(title, saveDir.resolve(name)));
    }
}
