package org.rostilos.labgate.core.resolver;

import org.rostilos.labgate.vcsclient.gitlab.GitLabClient;
import org.rostilos.labgate.vcsclient.gitlab.model.EMembershipScope;

import java.io.IOException;

public class ProjectTargetResolver implements TargetResolver {

    private final GitLabClient gitLabClient;

    public ProjectTargetResolver(GitLabClient gitLabClient) {
        this.gitLabClient = gitLabClient;
    }

    @Override
    public EMembershipScope scope() {
        return EMembershipScope.PROJECT;
    }

    @Override
    public TargetResolution resolve(String path) throws IOException {
        return gitLabClient.findProject(path)
                .map(TargetResolution::resolved)
                .orElseGet(() -> TargetResolution.unresolved(path));
    }
}
