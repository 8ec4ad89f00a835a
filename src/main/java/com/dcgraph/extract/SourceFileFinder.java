package com.dcgraph.extract;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SourceFileFinder {
    private static final Logger log = LoggerFactory.getLogger(SourceFileFinder.class);

    private final String extension;
    private final SkipDecision skipDecision;

    public SourceFileFinder(String extension, SkipDecision skipDecision) {
        this.extension = normalizeExtension(extension);
        this.skipDecision = skipDecision;
    }

    public Discovery find(List<Path> inputs) throws IOException {
        Set<Path> files = new LinkedHashSet<>();
        int skipped = 0;
        for (Path input : inputs) {
            String problem = problemWith(input);
            if (problem != null) {
                skip(input, problem);
                skipped++;
                continue;
            }
            if (Files.isDirectory(input)) {
                Walk walk = walk(input);
                files.addAll(walk.files);
                skipped += walk.skipped;
            } else if (hasExtension(input)) {
                files.add(input.toAbsolutePath().normalize());
            } else {
                log.debug("Ignoring {}: not a .{} file", input, extension);
            }
        }
        return new Discovery(List.copyOf(files), skipped);
    }

    public boolean hasExtension(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith("." + extension);
    }

    private String problemWith(Path input) {
        if (!Files.exists(input)) {
            return "no such file or directory";
        }
        if (!Files.isRegularFile(input) && !Files.isDirectory(input)) {
            return "not a regular file or a directory";
        }
        if (!Files.isReadable(input)) {
            return "permission denied";
        }
        return null;
    }

    private void skip(Path path, String reason) throws IOException {
        if (!skipDecision.skip(path, reason)) {
            throw new IOException("Build aborted at " + path + ": " + reason);
        }
        log.warn("Skipping {}: {}", path, reason);
    }

    private Walk walk(Path root) throws IOException {
        Walk walk = new Walk();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isHidden(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (isHidden(file) || !hasExtension(file)) {
                    return FileVisitResult.CONTINUE;
                }
                if (attrs.isRegularFile()) {
                    walk.files.add(file.toAbsolutePath().normalize());
                } else if (attrs.isSymbolicLink()) {
                    if (Files.isRegularFile(file)) {
                        walk.files.add(file.toAbsolutePath().normalize());
                    } else if (!Files.exists(file)) {
                        skip(file, "broken symbolic link");
                        walk.skipped++;
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                skip(file, String.valueOf(exc.getMessage()));
                walk.skipped++;
                return FileVisitResult.CONTINUE;
            }
        });
        walk.files.sort(null);
        return walk;
    }

    private static boolean isHidden(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().startsWith(".");
    }

    private static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return "tcl";
        }
        String trimmed = extension.strip();
        return (trimmed.startsWith(".") ? trimmed.substring(1) : trimmed).toLowerCase(Locale.ROOT);
    }

    public record Discovery(List<Path> files, int skippedInputs) {
    }

    private static final class Walk {
        final List<Path> files = new ArrayList<>();
        int skipped;
    }
}
