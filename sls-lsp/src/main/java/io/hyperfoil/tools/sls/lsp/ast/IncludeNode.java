package io.hyperfoil.tools.sls.lsp.ast;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One entry of the {@code include:} list, a dotted reference to another state file.
 */
public class IncludeNode extends AstNode {

    public static final String DEFAULT_EXTENSION = "sls";
    public static final String INIT = "init";

    private String value;

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public Path getFile(Path topPath) {
        return getFile(topPath, DEFAULT_EXTENSION);
    }

    /**
     * Resolves the include against the top of the state tree. {@code a.b} maps to {@code a/b/init.<ext>}
     * first and to {@code a/b.<ext>} second. When {@code topPath} is not a directory its parent is used.
     * Names leading outside of the root resolve to nothing.
     *
     * @return the existing file or null
     */
    public Path getFile(Path topPath, String extension) {
        if (value == null || value.isEmpty() || topPath == null) {
            return null;
        }
        Path root = Files.isDirectory(topPath) ? topPath : topPath.getParent();
        if (root == null) {
            return null;
        }
        Path destination = root;
        for (String segment : value.split("\\.")) {
            if (!segment.isEmpty()) {
                destination = destination.resolve(segment);
            }
        }
        if (destination.equals(root) || !destination.normalize().startsWith(root.normalize())) {
            return null;
        }
        Path init = destination.resolve(INIT + "." + extension);
        if (Files.isRegularFile(init)) {
            return init;
        }
        Path file = destination.resolveSibling(destination.getFileName() + "." + extension);
        if (Files.isRegularFile(file)) {
            return file;
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IncludeNode other = (IncludeNode) o;
        return sameSpan(other) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanHash(), value);
    }

    @Override
    public String toString() {
        return "IncludeNode[" + span() + " " + value + "]";
    }
}
