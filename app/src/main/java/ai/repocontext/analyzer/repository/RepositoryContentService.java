package ai.repocontext.analyzer.repository;

import java.util.Optional;

/**
 * Read-only access to the files and folders of a hosted repository.
 *
 * <p>Implementations signal failures with {@link HostingException}.
 */
public interface RepositoryContentService {

    /**
     * Returns the decoded text of a single file.
     */
    String getFile(RepositoryRef repository, String path, Optional<String> branch);

    /**
     * Returns the folder entries as newline-terminated {@code "<path> (<type>)"} lines.
     */
    String getFolder(RepositoryRef repository, String path, Optional<String> branch);
}
