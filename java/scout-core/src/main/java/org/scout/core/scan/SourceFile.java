package org.scout.core.scan;

import java.nio.file.Path;

/**
 * One candidate source file found under a project root.
 *
 * @param relativePath path relative to the scanned root
 * @param content      raw source text
 */
public record SourceFile(Path relativePath, String content) {

    /**
     * Unit identifier: the relative path with {@code /} separators and the extension stripped.
     */
    public String unitId() {
        String path = relativePath.toString().replace('\\', '/');
        int dot = path.lastIndexOf('.');
        int slash = path.lastIndexOf('/');
        return dot > slash ? path.substring(0, dot) : path;
    }
}
