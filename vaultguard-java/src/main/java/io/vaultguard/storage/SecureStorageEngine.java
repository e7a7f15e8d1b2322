package io.vaultguard.storage;

import io.vaultguard.crypto.CryptoException;
import io.vaultguard.crypto.CryptoProvider;
import io.vaultguard.storage.KeyAliasDeriver.DerivedKeys;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Encrypted file storage under a single root directory.
 *
 * Each logical name maps to {@code <root>[/<dir>]/<name><extension>} holding ciphertext only, plus
 * one {@link FileMetadata} record. The key alias and metadata key are re-derived from the name on
 * every call; no key material is written next to the ciphertext.
 *
 * Operations never throw. Every outcome is a {@link StorageResult}; {@link #list} degrades to an
 * empty list. Calls for the same logical name are serialized through striped locks.
 */
public class SecureStorageEngine {

    private static final Logger logger = Logger.getLogger(SecureStorageEngine.class.getName());

    private static final String TMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final CryptoProvider crypto;
    private final MetadataStore metadataStore;
    private final AccessGate accessGate;
    private final KeyAliasDeriver deriver;
    private final StorageOptions options;
    private final Path root;
    private final String extension;
    private final ReentrantLock[] locks;
    private final ExecutorService executor;

    private final AtomicLong filesSaved = new AtomicLong();
    private final AtomicLong filesRead = new AtomicLong();
    private final AtomicLong filesDeleted = new AtomicLong();
    private final AtomicLong bytesWritten = new AtomicLong();
    private final AtomicLong bytesRead = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    private Consumer<FileSavedEvent> onFileSaved;
    private Consumer<FileReadEvent> onFileRead;
    private Consumer<FileDeletedEvent> onFileDeleted;
    private Consumer<StorageError> onFailure;

    public SecureStorageEngine(CryptoProvider crypto, MetadataStore metadataStore, StorageOptions options) {
        this(crypto, metadataStore, new AccessGate(), options);
    }

    public SecureStorageEngine(CryptoProvider crypto, MetadataStore metadataStore,
                               AccessGate accessGate, StorageOptions options) {
        this.crypto = crypto;
        this.metadataStore = metadataStore;
        this.accessGate = accessGate;
        this.options = options;
        this.deriver = new KeyAliasDeriver(options.salt);
        this.root = options.root;
        this.extension = options.extension;

        this.locks = new ReentrantLock[options.lockStripes];
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(options.ioThreads, r -> {
            Thread t = new Thread(r, "vault-io-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== Save ====================

    public StorageResult<StoredFileHandle> save(byte[] data, String name) {
        return save(data, name, null, List.of());
    }

    public StorageResult<StoredFileHandle> save(byte[] data, String name, String directory) {
        return save(data, name, directory, List.of());
    }

    /**
     * Encrypt and store data, then commit its metadata record.
     *
     * The ciphertext is written before the metadata. If the metadata commit fails, the new
     * ciphertext is removed and any previous version of the file is put back.
     *
     * @param data Plaintext, may be empty
     * @param name Logical name
     * @param directory Optional single-level subdirectory, null for the root
     * @param tags Labels recorded in the metadata
     * @return Handle of the written file, or the reason for failure
     */
    public StorageResult<StoredFileHandle> save(byte[] data, String name, String directory, List<String> tags) {
        StorageError rejected = checkRequest(name, directory);
        if (rejected == null && data == null) {
            rejected = StorageError.validation("Data must not be null");
        }
        if (rejected != null) {
            return fail(rejected);
        }

        DerivedKeys keys = deriver.derive(name, directory);
        ReentrantLock lock = lockFor(keys);
        lock.lock();
        try {
            Path dir = resolveDirectory(directory);
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                return fail(StorageError.Kind.IO_FAILURE, "Failed to create directory " + dir, e);
            }

            boolean keyExisted = crypto.hasKey(keys.keyAlias());
            byte[] encrypted;
            try {
                encrypted = crypto.encrypt(data, keys.keyAlias());
            } catch (CryptoException e) {
                return fail(StorageError.Kind.CRYPTO_FAILURE, "Failed to encrypt " + name, e);
            }

            Path target = dir.resolve(name + extension);
            Path tmp = dir.resolve(name + extension + TMP_SUFFIX);
            Path backup = dir.resolve(name + extension + BACKUP_SUFFIX);
            boolean replacing = Files.exists(target);

            try {
                Files.write(tmp, encrypted);
                if (replacing) {
                    Files.move(target, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                }
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                deleteQuietly(tmp);
                if (replacing && Files.exists(backup) && !Files.exists(target)) {
                    restoreQuietly(backup, target);
                }
                if (!keyExisted) {
                    discardKey(keys.keyAlias());
                }
                return fail(StorageError.Kind.IO_FAILURE, "Failed to write " + target, e);
            }

            FileMetadata metadata = new FileMetadata(
                name,
                MimeTypes.guess(name),
                data.length,
                System.currentTimeMillis(),
                tags
            );
            try {
                metadataStore.put(keys.metadataKey(), metadata);
            } catch (IOException | RuntimeException e) {
                rollback(target, replacing ? backup : null);
                if (!keyExisted) {
                    discardKey(keys.keyAlias());
                }
                return fail(StorageError.Kind.IO_FAILURE,
                    "Failed to commit metadata for " + name + ", file rolled back", e);
            }

            if (replacing) {
                deleteQuietly(backup);
            }

            filesSaved.incrementAndGet();
            bytesWritten.addAndGet(encrypted.length);
            logger.fine("Saved " + KeyAliasDeriver.qualifiedName(name, directory) + " (" + data.length + " bytes)");

            emit(onFileSaved, new FileSavedEvent(name, directory, data.length, replacing));
            return StorageResult.success(new StoredFileHandle(name, directory, target));
        } catch (RuntimeException e) {
            return fail(StorageError.Kind.INTERNAL_FAILURE, "Unexpected failure saving " + name, e);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Read ====================

    public StorageResult<FileData> read(String name) {
        return read(name, null);
    }

    /**
     * Read and decrypt a stored file.
     * @return The plaintext, {@code NOT_FOUND} if no ciphertext exists, {@code CRYPTO_FAILURE} if it
     *         does not decrypt under the name's key
     */
    public StorageResult<FileData> read(String name, String directory) {
        StorageError rejected = checkRequest(name, directory);
        if (rejected != null) {
            return fail(rejected);
        }

        DerivedKeys keys = deriver.derive(name, directory);
        ReentrantLock lock = lockFor(keys);
        lock.lock();
        try {
            Path file = resolveDirectory(directory).resolve(name + extension);
            if (!Files.exists(file)) {
                return fail(StorageError.notFound("File not found: " + KeyAliasDeriver.qualifiedName(name, directory)));
            }

            byte[] encrypted;
            try {
                encrypted = Files.readAllBytes(file);
            } catch (IOException e) {
                return fail(StorageError.Kind.IO_FAILURE, "Failed to read " + file, e);
            }

            byte[] plaintext;
            try {
                plaintext = crypto.decrypt(encrypted, keys.keyAlias());
            } catch (CryptoException e) {
                return fail(StorageError.Kind.CRYPTO_FAILURE, "Failed to decrypt " + name, e);
            }

            filesRead.incrementAndGet();
            bytesRead.addAndGet(encrypted.length);

            emit(onFileRead, new FileReadEvent(name, directory, plaintext.length));
            return StorageResult.success(new FileData(name, plaintext));
        } catch (RuntimeException e) {
            return fail(StorageError.Kind.INTERNAL_FAILURE, "Unexpected failure reading " + name, e);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Delete ====================

    public StorageResult<StoredFileHandle> delete(String name) {
        return delete(name, null);
    }

    /**
     * Delete a stored file, then its metadata record and key.
     * If the file cannot be deleted, metadata and key are left untouched.
     */
    public StorageResult<StoredFileHandle> delete(String name, String directory) {
        StorageError rejected = checkRequest(name, directory);
        if (rejected != null) {
            return fail(rejected);
        }

        DerivedKeys keys = deriver.derive(name, directory);
        ReentrantLock lock = lockFor(keys);
        lock.lock();
        try {
            Path file = resolveDirectory(directory).resolve(name + extension);
            if (!Files.exists(file)) {
                return fail(StorageError.notFound("File not found: " + KeyAliasDeriver.qualifiedName(name, directory)));
            }

            try {
                Files.delete(file);
            } catch (IOException e) {
                return fail(StorageError.Kind.IO_FAILURE, "Failed to delete " + file, e);
            }

            try {
                metadataStore.remove(keys.metadataKey());
            } catch (IOException e) {
                logger.log(Level.WARNING, "Deleted " + file + " but could not remove its metadata", e);
            }
            try {
                crypto.removeKey(keys.keyAlias());
            } catch (CryptoException e) {
                logger.log(Level.WARNING, "Deleted " + file + " but could not remove its key", e);
            }

            filesDeleted.incrementAndGet();
            logger.fine("Deleted " + KeyAliasDeriver.qualifiedName(name, directory));

            emit(onFileDeleted, new FileDeletedEvent(name, directory));
            return StorageResult.success(new StoredFileHandle(name, directory, file));
        } catch (RuntimeException e) {
            return fail(StorageError.Kind.INTERNAL_FAILURE, "Unexpected failure deleting " + name, e);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Listing & Metadata ====================

    public List<String> list() {
        return list(null);
    }

    /**
     * Base names of all ciphertext files in a directory, sorted.
     * Missing, unreadable or invalid directories yield an empty list, as does a locked gate.
     */
    public List<String> list(String directory) {
        if (directory != null && !FileNames.isValid(directory)) {
            logger.fine("Not listing invalid directory name " + directory);
            return List.of();
        }
        if (accessGate.isLocked()) {
            logger.fine("Listing refused while storage is locked");
            return List.of();
        }
        Path dir = resolveDirectory(directory);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .filter(n -> n.endsWith(extension) && n.length() > extension.length())
                .map(n -> FileNames.baseName(n, extension))
                .sorted()
                .toList();
        } catch (IOException | UncheckedIOException | SecurityException e) {
            logger.log(Level.WARNING, "Failed to list " + dir, e);
            return List.of();
        }
    }

    public Optional<FileMetadata> metadata(String name) {
        return metadata(name, null);
    }

    public Optional<FileMetadata> metadata(String name, String directory) {
        if (checkRequest(name, directory) != null) {
            return Optional.empty();
        }
        return metadataStore.get(deriver.derive(name, directory).metadataKey());
    }

    public boolean exists(String name, String directory) {
        if (checkRequest(name, directory) != null) {
            return false;
        }
        return Files.exists(resolveDirectory(directory).resolve(name + extension));
    }

    // ==================== Asynchronous Operations ====================

    public CompletableFuture<StorageResult<StoredFileHandle>> saveAsync(byte[] data, String name, String directory) {
        return CompletableFuture.supplyAsync(() -> save(data, name, directory), executor);
    }

    public CompletableFuture<StorageResult<FileData>> readAsync(String name, String directory) {
        return CompletableFuture.supplyAsync(() -> read(name, directory), executor);
    }

    public CompletableFuture<StorageResult<StoredFileHandle>> deleteAsync(String name, String directory) {
        return CompletableFuture.supplyAsync(() -> delete(name, directory), executor);
    }

    public CompletableFuture<List<String>> listAsync(String directory) {
        return CompletableFuture.supplyAsync(() -> list(directory), executor);
    }

    // ==================== Lifecycle & Stats ====================

    public StorageStats stats() {
        return new StorageStats(
            filesSaved.get(),
            filesRead.get(),
            filesDeleted.get(),
            bytesWritten.get(),
            bytesRead.get(),
            failures.get()
        );
    }

    public Path getRoot() {
        return root;
    }

    public StorageOptions getOptions() {
        return options;
    }

    public AccessGate getAccessGate() {
        return accessGate;
    }

    public KeyAliasDeriver getDeriver() {
        return deriver;
    }

    public CompletableFuture<Void> shutdown() {
        return CompletableFuture.runAsync(() -> {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        });
    }

    public void setOnFileSaved(Consumer<FileSavedEvent> listener) { this.onFileSaved = listener; }
    public void setOnFileRead(Consumer<FileReadEvent> listener) { this.onFileRead = listener; }
    public void setOnFileDeleted(Consumer<FileDeletedEvent> listener) { this.onFileDeleted = listener; }
    public void setOnFailure(Consumer<StorageError> listener) { this.onFailure = listener; }

    // ==================== Internals ====================

    private StorageError checkRequest(String name, String directory) {
        Optional<String> problem = FileNames.validate(name);
        if (problem.isPresent()) {
            return StorageError.validation(problem.get());
        }
        if (directory != null) {
            problem = FileNames.validate(directory);
            if (problem.isPresent()) {
                return StorageError.validation("Invalid directory: " + problem.get());
            }
        }
        Optional<AccessGate.Lockdown> lockdown = accessGate.current();
        if (lockdown.isPresent()) {
            return StorageError.validation("Storage locked: " + lockdown.get().reason());
        }
        return null;
    }

    private Path resolveDirectory(String directory) {
        return directory == null ? root : root.resolve(directory);
    }

    private ReentrantLock lockFor(DerivedKeys keys) {
        int stripe = Integer.parseUnsignedInt(keys.derivedId().substring(0, 7), 16) % locks.length;
        return locks[stripe];
    }

    private void rollback(Path target, Path backup) {
        deleteQuietly(target);
        if (backup != null) {
            restoreQuietly(backup, target);
        }
    }

    private void discardKey(String alias) {
        try {
            crypto.removeKey(alias);
        } catch (CryptoException e) {
            logger.log(Level.WARNING, "Could not remove unused key " + alias, e);
        }
    }

    private static <T> void emit(Consumer<T> listener, T event) {
        if (listener == null) {
            return;
        }
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Storage listener failed for " + event, e);
        }
    }

    private static void restoreQuietly(Path backup, Path target) {
        try {
            Files.move(backup, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Could not restore previous version of " + target + " from " + backup, e);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not delete " + path, e);
        }
    }

    private <T> StorageResult<T> fail(StorageError.Kind kind, String message, Throwable cause) {
        return fail(new StorageError(kind, message, cause));
    }

    private <T> StorageResult<T> fail(StorageError error) {
        failures.incrementAndGet();
        if (error.kind() == StorageError.Kind.NOT_FOUND || error.kind() == StorageError.Kind.VALIDATION_FAILURE) {
            logger.fine(error.toString());
        } else {
            logger.log(Level.WARNING, error.message(), error.cause());
        }
        emit(onFailure, error);
        return StorageResult.failure(error);
    }

    public static class StorageOptions {
        public final Path root;
        public final String extension;
        public final String salt;
        public final int lockStripes;
        public final int ioThreads;

        private StorageOptions(Builder builder) {
            this.root = builder.root;
            this.extension = builder.extension;
            this.salt = builder.salt;
            this.lockStripes = builder.lockStripes;
            this.ioThreads = builder.ioThreads;
        }

        public static StorageOptions defaults() {
            return builder().build();
        }

        public static StorageOptions withRoot(Path root) {
            return builder().root(root).build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public static class Builder {
            private Path root = Path.of(System.getProperty("user.home"), ".vaultguard", "files");
            private String extension = ".sec";
            private String salt = "";
            private int lockStripes = 64;
            private int ioThreads = 2;

            public Builder root(Path root) { this.root = root; return this; }
            public Builder extension(String extension) { this.extension = extension; return this; }
            public Builder salt(String salt) { this.salt = salt; return this; }
            public Builder lockStripes(int stripes) { this.lockStripes = stripes; return this; }
            public Builder ioThreads(int threads) { this.ioThreads = threads; return this; }

            public StorageOptions build() {
                if (!extension.startsWith(".") || extension.length() < 2) {
                    throw new IllegalArgumentException("Extension must start with '.': " + extension);
                }
                if (lockStripes < 1 || ioThreads < 1) {
                    throw new IllegalArgumentException("lockStripes and ioThreads must be positive");
                }
                return new StorageOptions(this);
            }
        }
    }

    public record StorageStats(
        long filesSaved,
        long filesRead,
        long filesDeleted,
        long bytesWritten,
        long bytesRead,
        long failures
    ) {}

    public record FileSavedEvent(String name, String directory, long size, boolean replaced) {}
    public record FileReadEvent(String name, String directory, long size) {}
    public record FileDeletedEvent(String name, String directory) {}
}
