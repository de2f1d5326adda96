package credman.adapter.out.storage.file;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Base64;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import credman.core.port.out.CredentialStorage;

/**
 * Credential storage keeping one file per key in a local directory.
 *
 * <p>File names are the URL-safe Base64 encoding of the key. Writes go to a
 * temporary file that is then moved over the target, so a reader sees either
 * the old or the new value. On POSIX file systems the directory and files are
 * readable by the owner only.
 *
 * <p>File I/O runs on the Mutiny worker pool.
 */
public class FileCredentialStorage implements CredentialStorage {

    private static final Logger LOG = Logger.getLogger(FileCredentialStorage.class);

    private static final String SUFFIX = ".bin";
    private static final Set<PosixFilePermission> OWNER_ONLY_FILE =
            EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE);
    private static final Set<PosixFilePermission> OWNER_ONLY_DIRECTORY = EnumSet.of(
            PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_EXECUTE);

    private final Path directory;
    private final boolean posix;

    public FileCredentialStorage(Path directory) {
        this.directory = directory;
        this.posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
        try {
            Files.createDirectories(directory);
            if (posix) {
                Files.setPosixFilePermissions(directory, OWNER_ONLY_DIRECTORY);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create credential directory " + directory, e);
        }
        LOG.infof("Initialized file credential storage in %s", directory);
    }

    @Override
    public Uni<Void> put(String key, byte[] value) {
        return blocking(() -> {
            final var target = pathFor(key);
            final var temp = Files.createTempFile(directory, ".tmp-", SUFFIX);
            try {
                if (posix) {
                    Files.setPosixFilePermissions(temp, OWNER_ONLY_FILE);
                }
                Files.write(temp, value);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<byte[]>> get(String key) {
        return blocking(() -> {
            try {
                return Optional.of(Files.readAllBytes(pathFor(key)));
            } catch (NoSuchFileException e) {
                return Optional.empty();
            }
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return blocking(() -> {
            Files.deleteIfExists(pathFor(key));
            return null;
        });
    }

    @Override
    public Uni<Set<String>> keys(String prefix) {
        return blocking(() -> {
            final var result = new HashSet<String>();
            try (Stream<Path> files = Files.list(directory)) {
                files.map(p -> p.getFileName().toString())
                        .filter(name -> name.endsWith(SUFFIX) && !name.startsWith(".tmp-"))
                        .map(FileCredentialStorage::decodeKey)
                        .flatMap(Optional::stream)
                        .filter(k -> k.startsWith(prefix))
                        .forEach(result::add);
            }
            return Set.copyOf(result);
        });
    }

    Path pathFor(String key) {
        final var encoded =
                Base64.getUrlEncoder().withoutPadding().encodeToString(key.getBytes(StandardCharsets.UTF_8));
        return directory.resolve(encoded + SUFFIX);
    }

    private static Optional<String> decodeKey(String fileName) {
        final var encoded = fileName.substring(0, fileName.length() - SUFFIX.length());
        try {
            return Optional.of(new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            LOG.debugf("Ignoring unrecognized file in credential directory: %s", fileName);
            return Optional.empty();
        }
    }

    private static <T> Uni<T> blocking(IoCall<T> call) {
        return Uni.createFrom()
                .item(() -> {
                    try {
                        return call.run();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T run() throws IOException;
    }
}
