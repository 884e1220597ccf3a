package ai.repocontext.analyzer.repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Content service serving fixed files and folders, recording every lookup.
 */
public final class InMemoryContentService implements RepositoryContentService {

    private final Map<String, String> files = new HashMap<>();
    private final Map<String, String> folders = new HashMap<>();
    private final Map<String, RuntimeException> failures = new HashMap<>();
    private final List<String> lookups = new ArrayList<>();
    private Optional<String> lastBranch = Optional.empty();
    private Runnable onFileRead = () -> { };

    public InMemoryContentService withFile(String path, String content) {
        files.put(path, content);
        return this;
    }

    public InMemoryContentService withFolder(String path, String listing) {
        folders.put(path, listing);
        return this;
    }

    public InMemoryContentService failingOn(String path, RuntimeException failure) {
        failures.put(path, failure);
        return this;
    }

    public InMemoryContentService onFileRead(Runnable action) {
        this.onFileRead = action;
        return this;
    }

    @Override
    public String getFile(RepositoryRef repository, String path, Optional<String> branch) {
        record("file:" + path, branch);
        onFileRead.run();
        throwIfFailing(path);
        String content = files.get(path);
        if (content == null) {
            throw new HostingException(HostingException.Kind.NOT_FOUND, "Path '%s' not found in %s".formatted(path, repository));
        }
        return content;
    }

    @Override
    public String getFolder(RepositoryRef repository, String path, Optional<String> branch) {
        record("folder:" + path, branch);
        throwIfFailing(path);
        String listing = folders.get(path);
        if (listing == null) {
            throw new HostingException(HostingException.Kind.NOT_FOUND, "Path '%s' not found in %s".formatted(path, repository));
        }
        return listing;
    }

    public List<String> lookups() {
        return lookups;
    }

    public Optional<String> lastBranch() {
        return lastBranch;
    }

    private void record(String lookup, Optional<String> branch) {
        lookups.add(lookup);
        lastBranch = branch;
    }

    private void throwIfFailing(String path) {
        RuntimeException failure = failures.get(path);
        if (failure != null) {
            throw failure;
        }
    }
}
