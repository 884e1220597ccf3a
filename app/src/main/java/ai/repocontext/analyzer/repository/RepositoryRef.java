package ai.repocontext.analyzer.repository;

import java.util.Objects;

/**
 * Owner and name of a hosted repository. Both parts are blank only for the {@link #empty()} reference.
 */
public record RepositoryRef(String owner, String name) {

    private static final RepositoryRef EMPTY = new RepositoryRef("", "");

    public RepositoryRef {
        owner = Objects.requireNonNullElse(owner, "");
        name = Objects.requireNonNullElse(name, "");
    }

    public static RepositoryRef empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return owner.isEmpty() || name.isEmpty();
    }

    public String fullName() {
        return owner + "/" + name;
    }

    @Override
    public String toString() {
        return fullName();
    }
}
