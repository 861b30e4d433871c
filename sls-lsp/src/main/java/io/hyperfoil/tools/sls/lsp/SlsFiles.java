package io.hyperfoil.tools.sls.lsp;

import io.hyperfoil.tools.sls.lsp.ast.IncludeNode;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates the top of a state tree and the state files below it.
 */
public class SlsFiles {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private final String extension;
    private final String topFile;

    public SlsFiles(SlsConfig config) {
        this(config.getExtension(), config.getTopFile());
    }

    public SlsFiles(String extension, String topFile) {
        this.extension = extension;
        this.topFile = topFile;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Walks up from {@code path} to the first directory holding the top file, or null.
     */
    public Path findTop(Path path) {
        if (path == null) {
            return null;
        }
        Path current = path.toAbsolutePath();
        if (!Files.isDirectory(current)) {
            current = current.getParent();
        }
        while (current != null) {
            if (Files.isRegularFile(current.resolve(topFile))) {
                return current;
            }
            current = current.getParent();
        }
        return null;
    }

    /**
     * Every state file under {@code top} as an include name: {@code a/b.sls} is {@code a.b}, {@code a/init.sls} is {@code a}.
     */
    public List<String> listIncludes(Path top) {
        if (top == null || !Files.isDirectory(top)) {
            return Collections.emptyList();
        }
        String suffix = "." + extension;
        try (Stream<Path> files = Files.walk(top)) {
            List<String> names = new ArrayList<>();
            for (Path file : files.filter(Files::isRegularFile).collect(Collectors.toList())) {
                String name = includeName(top.relativize(file), suffix);
                if (name != null && !names.contains(name)) {
                    names.add(name);
                }
            }
            Collections.sort(names);
            return names;
        } catch (IOException | RuntimeException e) {
            logger.warnf(e, "failed to list state files under %s", top);
            return Collections.emptyList();
        }
    }

    private String includeName(Path relative, String suffix) {
        String fileName = relative.getFileName().toString();
        if (!fileName.endsWith(suffix) || relative.toString().equals(topFile)) {
            return null;
        }
        List<String> segments = new ArrayList<>();
        for (Path segment : relative) {
            segments.add(segment.toString());
        }
        String last = fileName.substring(0, fileName.length() - suffix.length());
        segments.remove(segments.size() - 1);
        if (!IncludeNode.INIT.equals(last)) {
            segments.add(last);
        }
        return segments.isEmpty() ? null : String.join(".", segments);
    }
}
