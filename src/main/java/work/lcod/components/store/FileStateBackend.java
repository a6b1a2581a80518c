package work.lcod.components.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores one JSON document per instance and namespace under {@code <root>/<instanceId>/<namespace>.json}.
 * Writes go to a temporary file first and are moved into place, so a save is all-or-nothing.
 */
public final class FileStateBackend implements StateBackend {
    private static final Logger log = LoggerFactory.getLogger(FileStateBackend.class);
    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path root;
    private final ObjectMapper json = JsonValues.mapper();

    public FileStateBackend(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public synchronized Map<String, String> load(String instanceId, String namespace) {
        Path file = documentPath(instanceId, namespace);
        var entries = new LinkedHashMap<String, String>();
        if (!Files.isRegularFile(file)) {
            return entries;
        }
        try {
            JsonNode document = json.readTree(file.toFile());
            if (document != null && document.isObject()) {
                var fields = document.fields();
                while (fields.hasNext()) {
                    var field = fields.next();
                    entries.put(field.getKey(), json.writeValueAsString(field.getValue()));
                }
            }
            return entries;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read state document " + file, ex);
        }
    }

    @Override
    public synchronized void save(String instanceId, String namespace, Map<String, String> entries) {
        Path file = documentPath(instanceId, namespace);
        try {
            Files.createDirectories(file.getParent());
            ObjectNode document = json.createObjectNode();
            for (var entry : entries.entrySet()) {
                document.set(entry.getKey(), json.readTree(entry.getValue()));
            }
            Path temp = Files.createTempFile(file.getParent(), namespace, ".tmp");
            json.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                log.debug("Atomic move unsupported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write state document " + file, ex);
        }
    }

    @Override
    public synchronized void drop(String instanceId) {
        Path dir = root.resolve(checkSegment(instanceId));
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to drop state of instance " + instanceId, ex);
        }
    }

    private Path documentPath(String instanceId, String namespace) {
        return root.resolve(checkSegment(instanceId)).resolve(checkSegment(namespace) + ".json");
    }

    private static String checkSegment(String segment) {
        if (segment == null || !SAFE_SEGMENT.matcher(segment).matches() || segment.startsWith(".")) {
            throw new IllegalArgumentException("Unsafe state path segment: " + segment);
        }
        return segment;
    }
}
