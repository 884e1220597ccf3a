package ai.repocontext.analyzer.repository;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Normalizes a free-form repository identifier into a {@link RepositoryRef}.
 *
 * <p>Two shapes are accepted:
 * <ul>
 *     <li>{@code owner/name}: exactly two non-empty segments.</li>
 *     <li>an absolute {@code http(s)} URL: the first two path segments are read as owner and name,
 *     anything after them is ignored and a trailing {@code .git} is removed from the name.</li>
 * </ul>
 *
 * <p>The URL host is not checked. Any host with the {@code /owner/name} path shape is accepted so that
 * mirrors and enterprise installations resolve the same way; the hosting client decides which API
 * base URL is queried.
 *
 * <p>Every other input yields {@link RepositoryRef#empty()}.
 */
public class RepositoryRefParser {

    private static final String GIT_SUFFIX = ".git";

    public RepositoryRef parse(String identifier) {
        if (identifier == null) {
            return RepositoryRef.empty();
        }
        String trimmed = identifier.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return parseUrl(trimmed);
        }
        return parseSlug(trimmed);
    }

    private RepositoryRef parseUrl(String raw) {
        String path;
        try {
            path = new URI(raw).getPath();
        } catch (URISyntaxException ex) {
            return RepositoryRef.empty();
        }
        if (path == null) {
            return RepositoryRef.empty();
        }
        String[] segments = path.split("/", -1);
        if (segments.length < 3) {
            return RepositoryRef.empty();
        }
        return of(segments[1], stripGitSuffix(segments[2]));
    }

    private RepositoryRef parseSlug(String raw) {
        String[] segments = raw.split("/", -1);
        if (segments.length != 2) {
            return RepositoryRef.empty();
        }
        return of(segments[0], segments[1]);
    }

    private static RepositoryRef of(String owner, String name) {
        if (owner.isBlank() || name.isBlank()) {
            return RepositoryRef.empty();
        }
        return new RepositoryRef(owner, name);
    }

    private static String stripGitSuffix(String name) {
        if (name.endsWith(GIT_SUFFIX)) {
            return name.substring(0, name.length() - GIT_SUFFIX.length());
        }
        return name;
    }
}
