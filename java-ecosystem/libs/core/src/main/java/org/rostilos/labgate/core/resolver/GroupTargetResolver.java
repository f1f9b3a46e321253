package org.rostilos.labgate.core.resolver;

import org.rostilos.labgate.vcsclient.gitlab.GitLabClient;
import org.rostilos.labgate.vcsclient.gitlab.model.EMembershipScope;

import java.io.IOException;

public class GroupTargetResolver implements TargetResolver {

    private final GitLabClient gitLabClient;

    public GroupTargetResolver(GitLabClient gitLabClient) {
        this.gitLabClient = gitLabClient;
    }

    @Override
    public EMembershipScope scope() {
        return EMembershipScope.GROUP;
    }

    @Override
    public TargetResolution resolve(String path) throws IOException {
        return gitLabClient.findGroup(path)
                .map(TargetResolution::resolved)
                .orElseGet(() -> TargetResolution.unresolved(path));
    }
}
