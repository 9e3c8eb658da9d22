package dev.evalset.log;

import dev.evalset.ConfigurationException;
import dev.evalset.config.EvalSetConfig;
import dev.evalset.json.EvalSetJsonMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Storage for log files under one location. Implementations must be safe for concurrent writers of
 * distinct names, and a reader must never observe a write that is only partly applied where the
 * backend allows it.
 */
@ThreadSafe
public interface LogStore {
    /** the location this store was opened on */
    String location();

    /** locations of every log under this store, recursively, in lexicographic order */
    List<String> list() throws LogStoreException;

    InputStream open(String logLocation) throws LogStoreException;

    /**
     * Write (or overwrite) the log with the given file name.
     *
     * @return the location of the written log
     */
    String write(String name, byte[] content) throws LogStoreException;

    /** Delete a log. Deleting a log which no longer exists is not an error. */
    void delete(String logLocation) throws LogStoreException;

    /**
     * Open the store for a location string: a directory path or {@code file:} uri, or an {@code
     * http(s)://} object store base url.
     *
     * @throws ConfigurationException if the location cannot be resolved
     */
    static LogStore of(String location, EvalSetConfig config) {
        if (location == null || location.isBlank()) {
            throw new ConfigurationException("log location must not be blank");
        }
        if (location.startsWith("http://") || location.startsWith("https://")) {
            try {
                return new HttpImpl(URI.create(location), config);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("invalid log location: " + location, e);
            }
        }
        try {
            Path dir;
            if (location.startsWith("file:")) {
                dir = Path.of(URI.create(location));
            } else if (FileImpl.URI_SCHEME.matcher(location).find()) {
                throw new ConfigurationException("unsupported log location: " + location);
            } else {
                dir = Path.of(location);
            }
            if (Files.exists(dir) && !Files.isDirectory(dir)) {
                throw new ConfigurationException("log location is not a directory: " + location);
            }
            return new FileImpl(dir);
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            throw new ConfigurationException("invalid log location: " + location, e);
        }
    }

    /** Logs stored as files under a local directory. */
    @Slf4j
    class FileImpl implements LogStore {
        static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");

        private final Path dir;

        public FileImpl(Path dir) {
            this.dir = dir.toAbsolutePath().normalize();
        }

        @Override
        public String location() {
            return dir.toString();
        }

        @Override
        public List<String> list() {
            if (!Files.isDirectory(dir)) {
                return List.of();
            }
            try (Stream<Path> files = Files.walk(dir)) {
                return files.filter(Files::isRegularFile)
                        .filter(FileImpl::isLogFile)
                        .map(Path::toString)
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new LogStoreException("failed to list logs under " + dir, e);
            }
        }

        private static boolean isLogFile(Path path) {
            var name = path.getFileName().toString();
            return name.endsWith(EvalLogCodec.EXTENSION) && !name.startsWith(".");
        }

        @Override
        public InputStream open(String logLocation) {
            try {
                return Files.newInputStream(Path.of(logLocation));
            } catch (IOException | InvalidPathException e) {
                throw new LogStoreException("failed to open log " + logLocation, e);
            }
        }

        @Override
        public String write(String name, byte[] content) {
            var target = dir.resolve(name);
            try {
                Files.createDirectories(target.getParent());
                // readers never see a half written file
                var tmp = Files.createTempFile(target.getParent(), ".", ".tmp");
                try {
                    Files.write(tmp, content);
                    try {
                        Files.move(
                                tmp,
                                target,
                                StandardCopyOption.ATOMIC_MOVE,
                                StandardCopyOption.REPLACE_EXISTING);
                    } catch (AtomicMoveNotSupportedException e) {
                        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                    }
                } finally {
                    Files.deleteIfExists(tmp);
                }
                return target.toString();
            } catch (IOException e) {
                throw new LogStoreException("failed to write log " + target, e);
            }
        }

        @Override
        public void delete(String logLocation) {
            try {
                if (Files.deleteIfExists(Path.of(logLocation))) {
                    log.debug("deleted log {}", logLocation);
                }
            } catch (IOException e) {
                throw new LogStoreException("failed to delete log " + logLocation, e);
            }
        }
    }

    /**
     * Logs stored in an http object store.
     *
     * <p>Protocol: {@code GET <base>/} returns {@code {"objects": [{"name": "..."}]}} listing every
     * object recursively; {@code GET}, {@code PUT} and {@code DELETE} on {@code <base>/<name>}
     * read, write and delete one object. When configured, a bearer token is sent with every
     * request.
     */
    @Slf4j
    class HttpImpl implements LogStore {
        private final String baseUrl;
        private final Optional<String> token;
        private final Duration requestTimeout;
        private final HttpClient httpClient;

        HttpImpl(URI base, EvalSetConfig config) {
            this(base, config, createDefaultHttpClient());
        }

        HttpImpl(URI base, EvalSetConfig config, HttpClient httpClient) {
            if (base.getHost() == null) {
                throw new IllegalArgumentException("log store url has no host: " + base);
            }
            var url = base.toString();
            this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
            this.token = config.logStoreToken();
            this.requestTimeout = config.requestTimeout();
            this.httpClient = httpClient;
        }

        record ObjectInfo(String name) {}

        record ObjectListing(List<ObjectInfo> objects) {}

        @Override
        public String location() {
            return baseUrl;
        }

        @Override
        public List<String> list() {
            var response = send(request(baseUrl + "/").GET(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 404) {
                return List.of();
            }
            requireSuccess(response.statusCode(), "list " + baseUrl, response.body());
            ObjectListing listing;
            try {
                listing = EvalSetJsonMapper.get().readValue(response.body(), ObjectListing.class);
            } catch (IOException e) {
                throw new LogStoreException("failed to parse object listing of " + baseUrl, e);
            }
            if (listing.objects() == null) {
                return List.of();
            }
            return listing.objects().stream()
                    .map(ObjectInfo::name)
                    .filter(name -> name != null && name.endsWith(EvalLogCodec.EXTENSION))
                    .map(this::locationOf)
                    .sorted()
                    .toList();
        }

        @Override
        public InputStream open(String logLocation) {
            // streamed, so a header-only read stops after the first few kilobytes
            var response =
                    send(request(logLocation).GET(), HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                try (var body = response.body()) {
                    requireSuccess(response.statusCode(), "read " + logLocation, null);
                } catch (IOException e) {
                    throw new LogStoreException("failed to read " + logLocation, e);
                }
            }
            return response.body();
        }

        @Override
        public String write(String name, byte[] content) {
            var logLocation = locationOf(name);
            var response =
                    send(
                            request(logLocation)
                                    .header("Content-Type", "application/json")
                                    .PUT(HttpRequest.BodyPublishers.ofByteArray(content)),
                            HttpResponse.BodyHandlers.ofString());
            requireSuccess(response.statusCode(), "write " + logLocation, response.body());
            return logLocation;
        }

        @Override
        public void delete(String logLocation) {
            var response =
                    send(request(logLocation).DELETE(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 404) {
                requireSuccess(response.statusCode(), "delete " + logLocation, response.body());
            }
        }

        private String locationOf(String name) {
            return baseUrl + "/" + (name.startsWith("/") ? name.substring(1) : name);
        }

        private HttpRequest.Builder request(String url) {
            var builder =
                    HttpRequest.newBuilder().uri(URI.create(url)).timeout(requestTimeout);
            token.ifPresent(t -> builder.header("Authorization", "Bearer " + t));
            return builder;
        }

        private <T> HttpResponse<T> send(
                HttpRequest.Builder request, HttpResponse.BodyHandler<T> bodyHandler) {
            var built = request.build();
            try {
                var response = httpClient.send(built, bodyHandler);
                log.debug("{} {} -> {}", built.method(), built.uri(), response.statusCode());
                return response;
            } catch (IOException e) {
                throw new LogStoreException(
                        "request failed: %s %s".formatted(built.method(), built.uri()), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LogStoreException(
                        "interrupted: %s %s".formatted(built.method(), built.uri()), e);
            }
        }

        private static void requireSuccess(int status, String action, @Nullable String body) {
            if (status < 200 || status >= 300) {
                log.warn("log store request failed with status {}: {}", status, action);
                throw new LogStoreException(
                        "failed to %s: status %d%s"
                                .formatted(action, status, body == null ? "" : " " + body));
            }
        }

        private static HttpClient createDefaultHttpClient() {
            return HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        }
    }

    /** Implementation for test doubling */
    class InMemoryImpl implements LogStore {
        private static final String SCHEME = "memory:";

        private final Map<String, byte[]> logs = new ConcurrentSkipListMap<>();

        @Override
        public String location() {
            return SCHEME;
        }

        @Override
        public List<String> list() {
            return logs.keySet().stream()
                    .filter(name -> name.endsWith(EvalLogCodec.EXTENSION))
                    .map(name -> SCHEME + name)
                    .toList();
        }

        @Override
        public InputStream open(String logLocation) {
            var content = logs.get(nameOf(logLocation));
            if (content == null) {
                throw new LogStoreException("no such log: " + logLocation);
            }
            return new ByteArrayInputStream(content);
        }

        @Override
        public String write(String name, byte[] content) {
            logs.put(name, content.clone());
            return SCHEME + name;
        }

        @Override
        public void delete(String logLocation) {
            logs.remove(nameOf(logLocation));
        }

        public int size() {
            return logs.size();
        }

        private static String nameOf(String logLocation) {
            return logLocation.startsWith(SCHEME)
                    ? logLocation.substring(SCHEME.length())
                    : logLocation;
        }
    }
}
