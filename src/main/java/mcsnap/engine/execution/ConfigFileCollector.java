package mcsnap.engine.execution;

import mcsnap.engine.model.TargetName;
import mcsnap.engine.util.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Collects server configuration files from {@code <serversDir>/<target>}:
 * a fixed list of well-known files plus any top-level file with a config
 * extension. Files over the size limit are skipped.
 */
public class ConfigFileCollector implements FileCollector {

    private static final Logger log = LoggerFactory.getLogger(ConfigFileCollector.class);

    static final List<String> KNOWN_CONFIG_FILES = List.of(
            "server.properties",
            "config.env",
            "docker-compose.yml",
            "bukkit.yml",
            "spigot.yml",
            "paper.yml",
            "paper-global.yml",
            "paper-world-defaults.yml",
            "ops.json",
            "whitelist.json",
            "banned-players.json",
            "banned-ips.json");

    static final Set<String> CONFIG_EXTENSIONS = Set.of(".yml", ".yaml", ".json", ".properties");

    private final Path serversDir;
    private final long maxFileSize;

    public ConfigFileCollector(Path serversDir, long maxFileSize) {
        this.serversDir = serversDir;
        this.maxFileSize = maxFileSize;
    }

    @Override
    public List<CollectedFile> collect(TargetName target) {
        Path serverDir = serversDir.resolve(target.value());
        if (!Files.isDirectory(serverDir)) {
            return List.of();
        }

        Set<String> candidates = new LinkedHashSet<>();
        for (String known : KNOWN_CONFIG_FILES) {
            if (Files.isRegularFile(serverDir.resolve(known))) {
                candidates.add(known);
            }
        }
        try (Stream<Path> list = Files.list(serverDir)) {
            list.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> CONFIG_EXTENSIONS.contains(extension(name)))
                    .forEach(candidates::add);
        } catch (IOException e) {
            log.warn("Failed to list {}: {}", serverDir, e.getMessage());
        }

        List<CollectedFile> files = new ArrayList<>();
        for (String name : candidates) {
            CollectedFile file = read(serverDir, name);
            if (file != null) {
                files.add(file);
            }
        }
        files.sort(Comparator.comparing(CollectedFile::path));

        log.debug("Collected {} config file(s) for {}", files.size(), target);
        return files;
    }

    private CollectedFile read(Path serverDir, String name) {
        Path file = PathGuard.resolveWithin(serverDir, name);
        try {
            long size = Files.size(file);
            if (size > maxFileSize) {
                log.info("Skipping {} for snapshot: {} bytes exceeds limit of {}", name, size, maxFileSize);
                return null;
            }
            return new CollectedFile(name, Files.readAllBytes(file));
        } catch (IOException e) {
            log.warn("Skipping unreadable config file {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
