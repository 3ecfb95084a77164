package com.purchasingpower.fullcycle.model;

import com.google.common.base.Preconditions;

/**
 * Owner and name of the hosted repository, e.g. {@code octocat/hello-world}.
 */
public record RepositoryCoordinates(String owner, String repo) {

    public RepositoryCoordinates {
        Preconditions.checkArgument(owner != null && !owner.isBlank(), "owner must not be blank");
        Preconditions.checkArgument(repo != null && !repo.isBlank(), "repo must not be blank");
    }

    @Override
    public String toString() {
        return owner + "/" + repo;
    }
}
