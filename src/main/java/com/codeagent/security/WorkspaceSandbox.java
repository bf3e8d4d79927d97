package com.codeagent.security;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Confines path arguments to one task workspace. Resolution runs in layers:
 * raw-path policy, lexical containment, canonical containment (symlinks).
 */
public class WorkspaceSandbox {

    private final Path root;
    private final long maxFileSizeBytes;

    public WorkspaceSandbox(Path root, long maxFileSizeBytes) {
        this.root = root.toAbsolutePath().normalize();
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public Path root() { return root; }

    public Path resolve(String rawPath) throws SandboxViolationException {
        if (rawPath == null || rawPath.contains("\0")) {
            throw new SandboxViolationException("Invalid path: null bytes");
        }
        Path p;
        try {
            p = Path.of(rawPath.isBlank() ? "." : rawPath);
        } catch (InvalidPathException e) {
            throw new SandboxViolationException("Invalid path: " + e.getReason());
        }
        // Layer 1: traversal components are rejected before any resolution
        for (var component : p) {
            if ("..".equals(component.toString())) {
                throw new SandboxViolationException("Path traversal not allowed: " + rawPath);
            }
        }

        // Layer 2: lexical containment
        var resolved = root.resolve(p).normalize();
        if (!resolved.startsWith(root)) {
            throw new SandboxViolationException("Path escapes workspace: " + rawPath);
        }

        // Layer 3: canonical containment of the nearest existing ancestor
        var realRoot = realRoot();
        var existing = resolved;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            throw new SandboxViolationException("Path escapes workspace: " + rawPath);
        }
        try {
            if (!existing.toRealPath().startsWith(realRoot)) {
                throw new SandboxViolationException("Resolved path escapes workspace: " + rawPath);
            }
        } catch (IOException e) {
            // dangling symlink
            throw new SandboxViolationException("Cannot resolve path: " + rawPath);
        }
        return resolved;
    }

    /** Resolves a path that must name an existing regular file within the size limit. */
    public Path resolveReadableFile(String rawPath) throws SandboxViolationException, IOException {
        var path = resolve(rawPath);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(rawPath, null, "file not found");
        }
        if (Files.size(path) > maxFileSizeBytes) {
            throw new IOException("File too large: max " + maxFileSizeBytes + " bytes");
        }
        return path;
    }

    public String relativize(Path path) {
        var rel = root.relativize(path.toAbsolutePath().normalize()).toString();
        return rel.isEmpty() ? "." : rel.replace('\\', '/');
    }

    private Path realRoot() {
        try {
            return root.toRealPath();
        } catch (IOException e) {
            throw new SandboxViolationException("Workspace root does not exist: " + root);
        }
    }
}
