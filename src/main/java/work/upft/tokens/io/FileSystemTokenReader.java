package work.upft.tokens.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads JSON or YAML documents from disk relative to a base directory, or over HTTP.
 */
public final class FileSystemTokenReader implements TokenFileReader {
    private static final Logger log = LoggerFactory.getLogger(FileSystemTokenReader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Path basePath;
    private final HttpClient httpClient;

    public FileSystemTokenReader(Path basePath) {
        this.basePath = basePath.toAbsolutePath().normalize();
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    public Path basePath() {
        return basePath;
    }

    @Override
    public Map<String, Object> read(String path) throws IOException {
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return readHttp(URI.create(path));
        }
        var file = path.startsWith("file://") ? Path.of(URI.create(path)) : basePath.resolve(path).normalize();
        log.debug("Reading {}", file);
        try (var in = Files.newInputStream(file)) {
            return parse(in, file.getFileName().toString(), path);
        }
    }

    private Map<String, Object> readHttp(URI uri) throws IOException {
        log.debug("Downloading {}", uri);
        var request = HttpRequest.newBuilder(uri).GET().build();
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() >= 400) {
                throw new IOException("HTTP " + response.statusCode() + " while downloading " + uri);
            }
            try (var body = response.body()) {
                return parse(body, uri.getPath(), uri.toString());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            var interrupted = new InterruptedIOException("Interrupted while downloading " + uri);
            interrupted.initCause(ex);
            throw interrupted;
        }
    }

    private static Map<String, Object> parse(InputStream in, String fileName, String source) throws IOException {
        var name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        var mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        return JsonValues.toMap(mapper.readTree(in), source);
    }
}
