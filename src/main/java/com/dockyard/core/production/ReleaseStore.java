package com.dockyard.core.production;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Stream;

/**
 * On-disk release layout for production deployments:
 * <pre>
 * &lt;root&gt;/&lt;projectId&gt;/&lt;hash&gt;/       one directory per staged build: dist/ plus a Dockerfile
 * &lt;root&gt;/&lt;projectId&gt;/current       symlink to the active hash directory
 * &lt;root&gt;/&lt;projectId&gt;/previous      symlink to what current pointed at before the last promotion
 * </pre>
 * Release directories are written under a temporary name and moved into place,
 * and symlinks are replaced by renaming a freshly created temporary link over
 * them, so {@code current} always resolves to a complete directory.
 */
public class ReleaseStore {

    private static final Logger log = LoggerFactory.getLogger(ReleaseStore.class);

    static final String CURRENT = "current";
    static final String PREVIOUS = "previous";
    static final String DIST = "dist";
    static final String DOCKERFILE = "Dockerfile";

    private static final int HASH_LENGTH = 8;

    private final Path root;
    private final String defaultDockerfile;

    public ReleaseStore(Path root, String defaultDockerfile) {
        this.root = root;
        this.defaultDockerfile = defaultDockerfile;
    }

    public Path projectDir(String projectId) {
        return root.resolve(projectId);
    }

    public Path releaseDir(String projectId, String hash) {
        return projectDir(projectId).resolve(hash);
    }

    public boolean exists(String projectId, String hash) {
        return isReleaseName(hash) && Files.isDirectory(releaseDir(projectId, hash), LinkOption.NOFOLLOW_LINKS);
    }

    // ── Staging ─────────────────────────────────────────────────────────

    /**
     * Copies a build output into a new release directory named after its content hash.
     * Staging the same content twice reuses the existing directory and refreshes its mtime.
     *
     * @param distDir    build output to stage
     * @param dockerfile project Dockerfile to ship with the release, or null to use the default
     * @return the release hash
     */
    public String stage(String projectId, Path distDir, Path dockerfile) throws IOException {
        if (!Files.isDirectory(distDir)) {
            throw new NoSuchFileException(distDir.toString(), null, "build output directory is missing");
        }
        String hash = hashDirectory(distDir);
        Path target = releaseDir(projectId, hash);
        Files.createDirectories(projectDir(projectId));

        if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
            Files.setLastModifiedTime(target, FileTime.from(Instant.now()));
            log.info("Release {} already staged for project {}", hash, projectId);
            return hash;
        }

        Path staging = projectDir(projectId).resolve(".staging-" + hash + "-" + randomSuffix());
        try {
            copyTree(distDir, staging.resolve(DIST));
            if (dockerfile != null && Files.isRegularFile(dockerfile)) {
                Files.copy(dockerfile, staging.resolve(DOCKERFILE));
            } else {
                Files.writeString(staging.resolve(DOCKERFILE), defaultDockerfile, StandardCharsets.UTF_8);
            }
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (FileAlreadyExistsException e) {
            // Staged concurrently with identical content
            deleteTree(staging);
        } catch (IOException e) {
            deleteTree(staging);
            throw e;
        }
        log.info("Staged release {} for project {}", hash, projectId);
        return hash;
    }

    /**
     * SHA-256 over every regular file's relative path and content, in sorted path order.
     *
     * @return the first {@value #HASH_LENGTH} hex characters
     */
    public static String hashDirectory(Path dir) throws IOException {
        MessageDigest digest = sha256();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(dir)) {
            files = walk.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> relativeName(dir, p)))
                    .toList();
        }
        byte[] buffer = new byte[8192];
        for (Path file : files) {
            digest.update(relativeName(dir, file).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            try (InputStream in = Files.newInputStream(file)) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    digest.update(buffer, 0, read);
                }
            }
        }
        return HexFormat.of().formatHex(digest.digest()).substring(0, HASH_LENGTH);
    }

    // ── Promotion ───────────────────────────────────────────────────────

    /**
     * Points {@code current} at {@code hash}, recording the old target as {@code previous}.
     */
    public void promote(String projectId, String hash) throws IOException {
        if (!exists(projectId, hash)) {
            throw new NoSuchFileException(releaseDir(projectId, hash).toString(), null, "release is not staged");
        }
        Optional<String> current = currentHash(projectId);
        if (current.isPresent() && !current.get().equals(hash)) {
            swapLink(projectId, PREVIOUS, current.get());
        }
        swapLink(projectId, CURRENT, hash);
        log.info("Promoted release {} for project {} (was {})", hash, projectId, current.orElse("none"));
    }

    private void swapLink(String projectId, String linkName, String hash) throws IOException {
        Path link = projectDir(projectId).resolve(linkName);
        Path tmp = projectDir(projectId).resolve(linkName + ".tmp-" + System.currentTimeMillis() + "-" + randomSuffix());
        // Relative target so the tree can be relocated
        Files.createSymbolicLink(tmp, Path.of(hash));
        try {
            replaceSymlink(tmp, link);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    /**
     * Renames {@code tmp} over {@code link}. A single rename(2), so readers see
     * either the old or the new target.
     */
    protected void replaceSymlink(Path tmp, Path link) throws IOException {
        Files.move(tmp, link, StandardCopyOption.ATOMIC_MOVE);
    }

    public Optional<String> currentHash(String projectId) {
        return readLink(projectDir(projectId).resolve(CURRENT));
    }

    public Optional<String> previousHash(String projectId) {
        return readLink(projectDir(projectId).resolve(PREVIOUS));
    }

    private static Optional<String> readLink(Path link) {
        if (!Files.isSymbolicLink(link)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readSymbolicLink(link).getFileName().toString());
        } catch (IOException e) {
            log.warn("Unreadable symlink {}: {}", link, e.getMessage());
            return Optional.empty();
        }
    }

    // ── Listing and cleanup ─────────────────────────────────────────────

    /**
     * All staged releases, newest first by modification time.
     */
    public List<ReleaseVersion> listVersions(String projectId) throws IOException {
        Path dir = projectDir(projectId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        String current = currentHash(projectId).orElse(null);
        List<ReleaseVersion> versions = new ArrayList<>();
        try (Stream<Path> entries = Files.list(dir)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                String name = entry.getFileName().toString();
                if (!isReleaseName(name) || !Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                Instant mtime = Files.getLastModifiedTime(entry, LinkOption.NOFOLLOW_LINKS).toInstant();
                versions.add(new ReleaseVersion(name, name.equals(current), mtime));
            }
        }
        versions.sort(Comparator.comparing(ReleaseVersion::modifiedAt).reversed()
                .thenComparing(ReleaseVersion::hash));
        return versions;
    }

    /**
     * Deletes all but the {@code keep} newest releases. The release {@code current}
     * points at is never deleted. A directory that cannot be removed is logged and skipped.
     *
     * @return hashes that were deleted
     */
    public List<String> cleanup(String projectId, int keep) throws IOException {
        List<ReleaseVersion> versions = listVersions(projectId);
        if (versions.size() <= keep) {
            return List.of();
        }
        String current = currentHash(projectId).orElse(null);
        List<String> deleted = new ArrayList<>();
        for (ReleaseVersion version : versions.subList(keep, versions.size())) {
            if (version.hash().equals(current)) {
                log.debug("Keeping active release {} for project {}", version.hash(), projectId);
                continue;
            }
            try {
                deleteTree(releaseDir(projectId, version.hash()));
                deleted.add(version.hash());
                log.info("Deleted old release {} for project {}", version.hash(), projectId);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to delete release {} for project {}: {}", version.hash(), projectId, e.getMessage());
            }
        }
        return deleted;
    }

    /**
     * Removes every release and link of a project.
     *
     * @return hashes of the releases that existed
     */
    public List<String> deleteAll(String projectId) throws IOException {
        List<String> hashes = listVersions(projectId).stream().map(ReleaseVersion::hash).toList();
        Path dir = projectDir(projectId);
        if (Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            deleteTree(dir);
            log.info("Deleted {} release(s) for project {}", hashes.size(), projectId);
        }
        return hashes;
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private static boolean isReleaseName(String name) {
        return name != null && !name.isEmpty() && !name.startsWith(".")
                && !name.equals(CURRENT) && !name.equals(PREVIOUS) && !name.contains(".tmp-")
                && !name.contains("/") && !name.contains("..");
    }

    private static String relativeName(Path base, Path file) {
        return base.relativize(file).toString().replace('\\', '/');
    }

    private static void copyTree(Path source, Path target) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(source)) {
            paths = walk.toList();
        }
        for (Path path : paths) {
            Path dest = target.resolve(relativeName(source, path));
            if (Files.isDirectory(path)) {
                Files.createDirectories(dest);
            } else {
                Files.copy(path, dest, StandardCopyOption.COPY_ATTRIBUTES);
            }
        }
    }

    static void deleteTree(Path dir) throws IOException {
        if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    private static String randomSuffix() {
        return Integer.toString(ThreadLocalRandom.current().nextInt(0x100000, 0x1000000), 36);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
