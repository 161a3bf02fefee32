package com.hubrelay.webhooks.subscription;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * {@link SubscriptionStore} persisted as a JSON array in a local file.
 *
 * <h2>Usage</h2>
 * <pre>
 *   SubscriptionStore store = JsonFileSubscriptionStore.open(Path.of("/var/lib/hubrelay/subscriptions.json"));
 * </pre>
 *
 * <p>The whole file is rewritten after every mutation: the new content goes
 * to a sibling temporary file which then replaces the original, so a crash
 * mid-write leaves the previous snapshot intact.
 */
public class JsonFileSubscriptionStore extends InMemorySubscriptionStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSubscriptionStore.class);
    private static final TypeReference<List<Subscription>> ROWS = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;

    private JsonFileSubscriptionStore(Path file) {
        this.file = file.toAbsolutePath().normalize();
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Opens the store backed by {@code file}, loading existing rows if the file exists.
     * Parent directories are created on the first write.
     */
    public static JsonFileSubscriptionStore open(Path file) throws SubscriptionStoreException {
        JsonFileSubscriptionStore store = new JsonFileSubscriptionStore(file);
        store.load();
        return store;
    }

    public Path getFile() { return file; }

    private void load() throws SubscriptionStoreException {
        if (!Files.exists(file)) {
            log.info("Subscription file {} does not exist yet, starting empty", file);
            return;
        }
        try {
            List<Subscription> rows = mapper.readValue(file.toFile(), ROWS);
            replaceAll(rows);
            log.info("Loaded {} subscription(s) from {}", rows.size(), file);
        } catch (IOException e) {
            throw new SubscriptionStoreException("Cannot read subscription file " + file, e);
        }
    }

    @Override
    protected void written() throws SubscriptionStoreException {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot());
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote subscription snapshot to {}", file);
        } catch (IOException e) {
            throw new SubscriptionStoreException("Cannot write subscription file " + file, e);
        }
    }
}
