package org.rostilos.labgate.core.resolver;

import org.rostilos.labgate.vcsclient.gitlab.GitLabClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Tries each resolver in order; the first {@link TargetResolution.Resolved} wins.
 * With {@link #groupsFirst} a path that names both a group and a project resolves to the group.
 */
public class TargetResolverChain {

    private static final Logger log = LoggerFactory.getLogger(TargetResolverChain.class);

    private final List<TargetResolver> resolvers;

    public TargetResolverChain(List<TargetResolver> resolvers) {
        if (resolvers.isEmpty()) {
            throw new IllegalArgumentException("At least one target resolver is required");
        }
        this.resolvers = List.copyOf(resolvers);
    }

    public static TargetResolverChain groupsFirst(GitLabClient gitLabClient) {
        return new TargetResolverChain(List.of(
                new GroupTargetResolver(gitLabClient),
                new ProjectTargetResolver(gitLabClient)
        ));
    }

    public TargetResolution resolve(String path) throws IOException {
        for (TargetResolver resolver : resolvers) {
            TargetResolution resolution = resolver.resolve(path);
            if (resolution instanceof TargetResolution.Resolved resolved) {
                log.info("Target '{}' identified as a {} (id {})", path, resolver.scope().getId(), resolved.target().id());
                return resolution;
            }
            log.debug("Target '{}' is not a {}", path, resolver.scope().getId());
        }
        return TargetResolution.unresolved(path);
    }

    public List<TargetResolver> getResolvers() {
        return resolvers;
    }
}
