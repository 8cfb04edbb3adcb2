package com.incoresoft.presenceTracker.repository;

import com.incoresoft.presenceTracker.config.PresenceProps;
import com.incoresoft.presenceTracker.domain.shared.exception.StorageFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-identity folders under the users directory: {@code <users>/<name>/<name>.jpg} plus reports.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class IdentityFileRepository {

    private final PresenceProps props;

    public Path usersDir() {
        return Paths.get(props.getStorage().getUsersDir());
    }

    public Path identityDir(String name) {
        Path root = usersDir().toAbsolutePath().normalize();
        Path resolved = root.resolve(name).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Invalid identity name: " + name);
        }
        return resolved;
    }

    public Path referenceImage(String name) {
        return identityDir(name).resolve(name + ".jpg");
    }

    public Path saveReferenceImage(String name, byte[] jpeg) {
        Path image = referenceImage(name);
        try {
            Files.createDirectories(image.getParent());
            Files.write(image, jpeg);
            log.debug("Reference image stored: {} ({} bytes)", image, jpeg.length);
            return image;
        } catch (IOException e) {
            throw new StorageFailureException("Failed to store reference image for " + name, e);
        }
    }

    public byte[] readReferenceImage(String name) {
        try {
            return Files.readAllBytes(referenceImage(name));
        } catch (IOException e) {
            throw new StorageFailureException("Failed to read reference image of " + name, e);
        }
    }

    /**
     * Folders that hold a reference image, by name in folder order (sorted for a stable load order).
     */
    public List<String> listStoredIdentities() {
        Path root = usersDir();
        if (!Files.isDirectory(root)) return List.of();
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                String name = dir.getFileName().toString();
                if (Files.isRegularFile(dir.resolve(name + ".jpg"))) names.add(name);
            }
        } catch (IOException e) {
            throw new StorageFailureException("Failed to list " + root, e);
        }
        names.sort(String::compareTo);
        return names;
    }

    /**
     * Verified report text per identity folder; folders without a report are left out.
     */
    public Map<String, String> readVerifiedReports(String reportFileName) {
        Map<String, String> reports = new TreeMap<>();
        Path root = usersDir();
        if (!Files.isDirectory(root)) return reports;
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                Path report = dir.resolve(reportFileName);
                if (!Files.isRegularFile(report)) continue;
                try {
                    reports.put(dir.getFileName().toString(), Files.readString(report));
                } catch (IOException e) {
                    log.warn("Error reading verified report {}: {}", report, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StorageFailureException("Failed to list " + root, e);
        }
        return reports;
    }

    public void deleteIdentityDir(String name) {
        Path dir = identityDir(name);
        try {
            boolean deleted = FileSystemUtils.deleteRecursively(dir);
            log.debug("Deleted {} (existed={})", dir, deleted);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to delete storage of " + name, e);
        }
    }
}
