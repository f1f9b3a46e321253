package org.rostilos.labgate.core.resolver;

import org.rostilos.labgate.vcsclient.gitlab.model.GitLabTarget;

/**
 * Result of looking a path up as one kind of target.
 */
public sealed interface TargetResolution permits TargetResolution.Resolved, TargetResolution.Unresolved {

    record Resolved(GitLabTarget target) implements TargetResolution {
    }

    record Unresolved(String path) implements TargetResolution {
    }

    static TargetResolution resolved(GitLabTarget target) {
        return new Resolved(target);
    }

    static TargetResolution unresolved(String path) {
        return new Unresolved(path);
    }
}
