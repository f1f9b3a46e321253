package org.rostilos.labgate.core.resolver;

import org.rostilos.labgate.vcsclient.gitlab.model.EMembershipScope;

import java.io.IOException;

/**
 * Strategy that tries to resolve a path as one specific kind of target.
 * A miss is {@link TargetResolution.Unresolved}, not an exception.
 */
public interface TargetResolver {

    EMembershipScope scope();

    TargetResolution resolve(String path) throws IOException;
}
