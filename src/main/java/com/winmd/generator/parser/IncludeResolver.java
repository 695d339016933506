package com.winmd.generator.parser;

import com.winmd.generator.parser.exception.SemanticException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Locates and reads metatext files, tracking the chain of files currently being
 * expanded so that include cycles are reported instead of recursing forever.
 */
class IncludeResolver {
    private static final Logger log = LoggerFactory.getLogger(IncludeResolver.class);

    /** Files currently being expanded, innermost first. */
    private final Deque<Path> currentlyExpanding = new ArrayDeque<>();

    /**
     * Resolves an include path against the directory of the including file.
     */
    Path resolve(Path baseDir, String includePath) {
        Path raw = Path.of(includePath);
        Path resolved = raw.isAbsolute() || baseDir == null ? raw : baseDir.resolve(raw);
        return resolved.toAbsolutePath().normalize();
    }

    /**
     * Marks a file as being expanded; fails if it is already on the expansion chain.
     *
     * @param includedFrom location of the include line, or {@code null} for the primary file
     */
    void enter(Path file, SourceLocation includedFrom) {
        Path key = file.toAbsolutePath().normalize();
        if (currentlyExpanding.contains(key)) {
            SourceLocation location = includedFrom != null ? includedFrom : new SourceLocation(key.toString(), 0);
            throw new SemanticException(location, "include cycle detected: " + describeCycle(key));
        }
        currentlyExpanding.push(key);
    }

    void exit(Path file) {
        Path key = file.toAbsolutePath().normalize();
        if (!key.equals(currentlyExpanding.peek())) {
            throw new IllegalStateException("include stack out of order: expected " + currentlyExpanding.peek() + ", got " + key);
        }
        currentlyExpanding.pop();
    }

    List<String> readLines(Path file) throws IOException {
        log.debug("Reading metatext file: {}", file);
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    private String describeCycle(Path repeated) {
        StringBuilder chain = new StringBuilder();
        Iterator<Path> outermostFirst = currentlyExpanding.descendingIterator();
        while (outermostFirst.hasNext()) {
            chain.append(outermostFirst.next().getFileName()).append(" -> ");
        }
        return chain.append(repeated.getFileName()).toString();
    }
}
