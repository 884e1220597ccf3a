package ai.repocontext.analyzer.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.Test;

class GitHubContentClientTest {

    private static final RepositoryRef REPOSITORY = new RepositoryRef("octo", "demo");
    private static final URI API_BASE = URI.create("https://api.github.com");

    private final RecordingHttpClient httpClient = new RecordingHttpClient();

    @Test
    void decodesBase64FileContent() {
        String encoded = Base64.getMimeEncoder().encodeToString(
                "public class Main {\n    // entry point\n}\n".repeat(4).getBytes(StandardCharsets.UTF_8));
        httpClient.respondWith(200, "{\"type\":\"file\",\"encoding\":\"base64\",\"content\":\""
                + encoded.replace("\r\n", "\\n") + "\"}");

        String content = client(Optional.of("token-123")).getFile(REPOSITORY, "src/Main.java", Optional.of("dev"));

        assertThat(content).startsWith("public class Main {").contains("// entry point").endsWith("}\n");
        HttpRequest request = httpClient.requests().get(0);
        assertThat(request.uri()).isEqualTo(URI.create("https://api.github.com/repos/octo/demo/contents/src/Main.java?ref=dev"));
        assertThat(request.headers().firstValue("Authorization")).contains("Bearer token-123");
        assertThat(request.headers().firstValue("Accept")).contains("application/vnd.github+json");
    }

    @Test
    void rendersFolderListing() {
        httpClient.respondWith(200, "[{\"path\":\"README.md\",\"type\":\"file\"},{\"path\":\"src\",\"type\":\"dir\"}]");

        String listing = client(Optional.of("token")).getFolder(REPOSITORY, "", Optional.empty());

        assertThat(listing).isEqualTo("README.md (file)\nsrc (dir)\n");
        assertThat(httpClient.requests().get(0).uri())
                .isEqualTo(URI.create("https://api.github.com/repos/octo/demo/contents/"));
    }

    @Test
    void missingTokenFailsWithoutRequest() {
        HostingException failure = failureOf(() -> client(Optional.empty()).getFolder(REPOSITORY, "", Optional.empty()));

        assertThat(failure.kind()).isEqualTo(HostingException.Kind.CREDENTIAL_MISSING);
        assertThat(failure.isCredentialMissing()).isTrue();
        assertThat(failure).hasMessage(GitHubContentClient.TOKEN_MISSING_MESSAGE);
        assertThat(httpClient.requests()).isEmpty();
    }

    @Test
    void notFoundIsReportedAsSuch() {
        httpClient.respondWith(404, "{\"message\":\"Not Found\"}");

        HostingException failure = failureOf(() -> client(Optional.of("token")).getFile(REPOSITORY, "missing.md", Optional.empty()));

        assertThat(failure.kind()).isEqualTo(HostingException.Kind.NOT_FOUND);
        assertThat(failure).hasMessageContaining("missing.md");
    }

    @Test
    void otherStatusCodesAreTransportErrors() {
        httpClient.respondWith(500, "oops");

        HostingException failure = failureOf(() -> client(Optional.of("token")).getFolder(REPOSITORY, "src", Optional.empty()));

        assertThat(failure.kind()).isEqualTo(HostingException.Kind.TRANSPORT_ERROR);
        assertThat(failure).hasMessage("GitHub API request failed with status code: 500");
    }

    @Test
    void unexpectedEncodingIsADecodeError() {
        httpClient.respondWith(200, "{\"type\":\"file\",\"encoding\":\"none\",\"content\":\"\"}");

        HostingException failure = failureOf(() -> client(Optional.of("token")).getFile(REPOSITORY, "big.bin", Optional.empty()));

        assertThat(failure.kind()).isEqualTo(HostingException.Kind.DECODE_ERROR);
    }

    @Test
    void folderRequestedAsFileIsADecodeError() {
        httpClient.respondWith(200, "[{\"path\":\"src/Main.java\",\"type\":\"file\"}]");

        HostingException failure = failureOf(() -> client(Optional.of("token")).getFile(REPOSITORY, "src", Optional.empty()));

        assertThat(failure.kind()).isEqualTo(HostingException.Kind.DECODE_ERROR);
    }

    @Test
    void ioFailureIsATransportError() {
        httpClient.failWith(new IOException("connection refused"));

        HostingException failure = failureOf(() -> client(Optional.of("token")).getFolder(REPOSITORY, "", Optional.empty()));

        assertThat(failure.kind()).isEqualTo(HostingException.Kind.TRANSPORT_ERROR);
        assertThat(failure).hasMessageContaining("connection refused");
    }

    @Test
    void encodesPathSegmentsAndCustomApiBase() {
        GitHubContentClient client = new GitHubContentClient(httpClient,
                URI.create("https://ghe.example.com/api/v3/"), Optional.of("token"), Duration.ofSeconds(5));

        URI uri = client.contentsUri(REPOSITORY, "/docs/my guide.md", Optional.of("release/1.0"));

        assertThat(uri.toString())
                .isEqualTo("https://ghe.example.com/api/v3/repos/octo/demo/contents/docs/my%20guide.md?ref=release%2F1.0");
    }

    private static HostingException failureOf(ThrowableAssert.ThrowingCallable call) {
        Throwable thrown = catchThrowable(call);
        assertThat(thrown).isInstanceOf(HostingException.class);
        return (HostingException) thrown;
    }

    private GitHubContentClient client(Optional<String> token) {
        return new GitHubContentClient(httpClient, API_BASE, token, Duration.ofSeconds(5));
    }
}
