package com.stashguard.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Document store backed by JSON files.
 *
 * <p>Each top-level document is one file, {@code <dir>/<collection>/<id>.json}, holding the
 * document's fields and, embedded, every document of its subcollections. A commit rewrites
 * that one file through a temporary file and an atomic rename, which is what makes a batch
 * all-or-nothing. A batch must therefore stay under a single top-level document.
 */
public class FileDocumentStore implements DocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileDocumentStore.class);
    private static final int CURRENT_SCHEMA_VERSION = 1;
    private static final String FILE_SUFFIX = ".json";

    private final Gson gson;
    private final Path storageDirectory;
    private final Clock clock;
    private final Map<DocumentPath, ReentrantLock> rootLocks = new ConcurrentHashMap<>();

    /**
     * Creates a store rooted at the given directory, creating it if needed.
     *
     * @param storageDirectory base directory for document files
     * @param clock source of commit timestamps
     */
    public FileDocumentStore(Path storageDirectory, Clock clock) {
        this.gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();
        this.storageDirectory = storageDirectory;
        this.clock = clock;

        try {
            Files.createDirectories(storageDirectory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create storage directory: " + storageDirectory, e);
        }
    }

    @Override
    public Optional<JsonObject> read(DocumentPath path) throws StoreException {
        JsonObject root = loadRoot(path.root());
        if (root == null) {
            return Optional.empty();
        }
        JsonObject node;
        try {
            node = findNode(root, path);
        } catch (ClassCastException e) {
            throw new StoreException("Corrupt document tree under " + path.root() + ": " + e.getMessage(), e);
        }
        JsonObject data = dataOf(node, path.toString());
        return data == null ? Optional.empty() : Optional.of(data.deepCopy());
    }

    @Override
    public Map<String, JsonObject> list(String collection) throws StoreException {
        Map<String, JsonObject> result = new TreeMap<>();
        Path collectionDir = storageDirectory.resolve(encode(collection));
        if (!Files.isDirectory(collectionDir)) {
            return result;
        }

        try (DirectoryStream<Path> files = Files.newDirectoryStream(collectionDir, "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                String id = decode(fileName.substring(0, fileName.length() - FILE_SUFFIX.length()));
                JsonObject data = dataOf(readFile(file), collection + "/" + id);
                if (data != null) {
                    result.put(id, data.deepCopy());
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list collection '" + collection + "' in " + collectionDir, e);
        }
        return result;
    }

    @Override
    public void commit(List<DocumentWrite> writes) throws StoreException {
        if (writes.isEmpty()) {
            return;
        }

        Set<DocumentPath> roots = new LinkedHashSet<>();
        for (DocumentWrite write : writes) {
            roots.add(write.path().root());
        }
        if (roots.size() != 1) {
            throw new StoreException("A batch must stay under one top-level document, got: " + roots);
        }
        DocumentPath rootPath = roots.iterator().next();

        ReentrantLock lock = rootLocks.computeIfAbsent(rootPath, p -> new ReentrantLock());
        lock.lock();
        try {
            Instant commitTime = clock.instant();
            JsonObject root = loadRoot(rootPath);
            if (root == null) {
                root = newNode();
            }
            for (DocumentWrite write : writes) {
                JsonObject node;
                try {
                    node = findOrCreateNode(root, write.path());
                } catch (ClassCastException e) {
                    throw new StoreException("Corrupt document tree under " + rootPath + ": " + e.getMessage(), e);
                }
                JsonObject existing = dataOf(node, write.path().toString());
                node.add("data", DocumentMutator.apply(existing, write, commitTime));
            }
            writeRoot(rootPath, root);
            LOGGER.debug("Committed {} writes under {}", writes.size(), rootPath);
        } finally {
            lock.unlock();
        }
    }

    private JsonObject loadRoot(DocumentPath rootPath) throws StoreException {
        Path file = fileFor(rootPath);
        if (!Files.exists(file)) {
            return null;
        }
        return readFile(file);
    }

    private JsonObject readFile(Path file) throws StoreException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonObject wrapper = gson.fromJson(reader, JsonObject.class);
            if (wrapper == null) {
                throw new StoreException("Empty document file: " + file);
            }
            JsonElement version = wrapper.get("schemaVersion");
            if (version == null || !version.isJsonPrimitive() || !version.getAsJsonPrimitive().isNumber()
                    || version.getAsInt() != CURRENT_SCHEMA_VERSION) {
                throw new StoreException(String.format("Unsupported schema version in %s (expected %d)",
                    file, CURRENT_SCHEMA_VERSION));
            }
            JsonElement root = wrapper.get("root");
            if (root == null || !root.isJsonObject()) {
                throw new StoreException("Document file missing root node: " + file);
            }
            return root.getAsJsonObject();
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                 | NumberFormatException | ClassCastException e) {
            throw new StoreException("Corrupt document file " + file + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StoreException("Failed to read document file " + file + ": " + e.getMessage(), e);
        }
    }

    private void writeRoot(DocumentPath rootPath, JsonObject root) throws StoreException {
        Path file = fileFor(rootPath);
        JsonObject wrapper = new JsonObject();
        wrapper.addProperty("schemaVersion", CURRENT_SCHEMA_VERSION);
        wrapper.add("root", root);

        Path temp = null;
        try {
            Files.createDirectories(file.getParent());
            temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(wrapper, writer);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOGGER.warn("Atomic rename not supported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StoreException("Failed to write document file " + file + ": " + e.getMessage(), e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOGGER.warn("Failed to remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    /**
     * @return the node's fields, or null if the node or its data is absent
     * @throws StoreException if the data member is not an object
     */
    private static JsonObject dataOf(JsonObject node, String path) throws StoreException {
        if (node == null || !node.has("data")) {
            return null;
        }
        JsonElement data = node.get("data");
        if (!data.isJsonObject()) {
            throw new StoreException("Corrupt document " + path + ": data is not an object");
        }
        return data.getAsJsonObject();
    }

    private static JsonObject newNode() {
        JsonObject node = new JsonObject();
        node.add("collections", new JsonObject());
        return node;
    }

    private static JsonObject findNode(JsonObject root, DocumentPath path) {
        JsonObject node = root;
        List<String> segments = path.segments();
        for (int i = 2; i < segments.size() && node != null; i += 2) {
            JsonObject collections = node.getAsJsonObject("collections");
            JsonObject collection = collections != null ? collections.getAsJsonObject(segments.get(i)) : null;
            node = collection != null ? collection.getAsJsonObject(segments.get(i + 1)) : null;
        }
        return node;
    }

    private static JsonObject findOrCreateNode(JsonObject root, DocumentPath path) {
        JsonObject node = root;
        List<String> segments = path.segments();
        for (int i = 2; i < segments.size(); i += 2) {
            JsonObject collections = node.getAsJsonObject("collections");
            if (collections == null) {
                collections = new JsonObject();
                node.add("collections", collections);
            }
            JsonObject collection = collections.getAsJsonObject(segments.get(i));
            if (collection == null) {
                collection = new JsonObject();
                collections.add(segments.get(i), collection);
            }
            JsonObject child = collection.getAsJsonObject(segments.get(i + 1));
            if (child == null) {
                child = newNode();
                collection.add(segments.get(i + 1), child);
            }
            node = child;
        }
        return node;
    }

    private Path fileFor(DocumentPath rootPath) {
        return storageDirectory
            .resolve(encode(rootPath.collection()))
            .resolve(encode(rootPath.id()) + FILE_SUFFIX);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }

    private static String decode(String fileName) {
        return URLDecoder.decode(fileName, StandardCharsets.UTF_8);
    }
}
