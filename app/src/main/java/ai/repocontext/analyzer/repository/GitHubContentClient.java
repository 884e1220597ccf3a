package ai.repocontext.analyzer.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RepositoryContentService} backed by the GitHub contents REST API.
 */
public class GitHubContentClient implements RepositoryContentService {

    private static final Logger LOGGER = LoggerFactory.getLogger(GitHubContentClient.class);

    public static final URI DEFAULT_API_BASE = URI.create("https://api.github.com");
    public static final String TOKEN_MISSING_MESSAGE =
            "GITHUB_TOKEN is not set. Please set it to a valid GitHub personal access token with repo scope";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final HttpClient httpClient;
    private final URI apiBase;
    private final Optional<String> token;
    private final Duration requestTimeout;

    public GitHubContentClient(URI apiBase, Optional<String> token, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), apiBase, token, timeout);
    }

    public GitHubContentClient(HttpClient httpClient, URI apiBase, Optional<String> token, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.apiBase = Objects.requireNonNull(apiBase, "apiBase");
        this.token = token == null ? Optional.empty() : token.filter(value -> !value.isBlank());
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public String getFile(RepositoryRef repository, String path, Optional<String> branch) {
        JsonNode body = fetchContents(repository, path, branch);
        if (!body.isObject()) {
            throw new HostingException(HostingException.Kind.DECODE_ERROR,
                    "Expected a file but '%s' is not a file".formatted(path));
        }
        String encoding = body.path("encoding").asText("");
        if (!"base64".equals(encoding)) {
            throw new HostingException(HostingException.Kind.DECODE_ERROR, "Unexpected file encoding: " + encoding);
        }
        try {
            byte[] decoded = Base64.getMimeDecoder().decode(body.path("content").asText(""));
            return new String(decoded, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new HostingException(HostingException.Kind.DECODE_ERROR, "Failed to decode base64 content", ex);
        }
    }

    @Override
    public String getFolder(RepositoryRef repository, String path, Optional<String> branch) {
        JsonNode body = fetchContents(repository, path, branch);
        if (!body.isArray()) {
            throw new HostingException(HostingException.Kind.DECODE_ERROR,
                    "Expected a folder but '%s' is not a folder".formatted(path));
        }
        StringBuilder structure = new StringBuilder();
        for (JsonNode item : body) {
            structure.append(item.path("path").asText())
                    .append(" (")
                    .append(item.path("type").asText())
                    .append(")\n");
        }
        return structure.toString();
    }

    private JsonNode fetchContents(RepositoryRef repository, String path, Optional<String> branch) {
        Objects.requireNonNull(repository, "repository");
        String bearer = token.orElseThrow(() ->
                new HostingException(HostingException.Kind.CREDENTIAL_MISSING, TOKEN_MISSING_MESSAGE));

        URI uri = contentsUri(repository, path, branch);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .header("Accept", "application/vnd.github+json")
                .header("Authorization", "Bearer " + bearer)
                .timeout(requestTimeout)
                .GET()
                .build();

        LOGGER.debug("GET {}", uri);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new HostingException(HostingException.Kind.TRANSPORT_ERROR, "Interrupted while calling GitHub API", ex);
        } catch (IOException ex) {
            throw new HostingException(HostingException.Kind.TRANSPORT_ERROR, "Failed to send request: " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        if (status == 404) {
            throw new HostingException(HostingException.Kind.NOT_FOUND,
                    "Path '%s' not found in %s".formatted(displayPath(path), repository.fullName()));
        }
        if (status != 200) {
            throw new HostingException(HostingException.Kind.TRANSPORT_ERROR,
                    "GitHub API request failed with status code: " + status);
        }
        try {
            return OBJECT_MAPPER.readTree(response.body());
        } catch (JsonProcessingException ex) {
            throw new HostingException(HostingException.Kind.DECODE_ERROR, "Failed to parse JSON response", ex);
        }
    }

    URI contentsUri(RepositoryRef repository, String path, Optional<String> branch) {
        String base = apiBase.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        StringBuilder url = new StringBuilder(base)
                .append("/repos/")
                .append(encodeSegment(repository.owner()))
                .append('/')
                .append(encodeSegment(repository.name()))
                .append("/contents/")
                .append(encodePath(path));
        branch.filter(value -> !value.isBlank())
                .ifPresent(ref -> url.append("?ref=").append(URLEncoder.encode(ref, StandardCharsets.UTF_8)));
        return URI.create(url.toString());
    }

    private static String encodePath(String path) {
        if (path == null || path.isBlank()) {
            return "";
        }
        String normalized = path.trim();
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        StringBuilder encoded = new StringBuilder();
        for (String segment : normalized.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (encoded.length() > 0) {
                encoded.append('/');
            }
            encoded.append(encodeSegment(segment));
        }
        return encoded.toString();
    }

    private static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String displayPath(String path) {
        return path == null || path.isBlank() ? "/" : path;
    }
}
