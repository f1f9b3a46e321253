package org.rostilos.labgate.core.service;

import org.rostilos.labgate.core.exception.TargetNotFoundException;
import org.rostilos.labgate.core.exception.UpstreamException;
import org.rostilos.labgate.core.exception.UserNotFoundException;
import org.rostilos.labgate.core.exception.ValidationException;
import org.rostilos.labgate.core.model.permission.EMembershipAction;
import org.rostilos.labgate.core.model.permission.ERole;
import org.rostilos.labgate.core.model.permission.MembershipResult;
import org.rostilos.labgate.core.model.permission.PermissionRequest;
import org.rostilos.labgate.core.resolver.TargetResolution;
import org.rostilos.labgate.core.resolver.TargetResolverChain;
import org.rostilos.labgate.core.validation.RequestValidator;
import org.rostilos.labgate.vcsclient.gitlab.GitLabClient;
import org.rostilos.labgate.vcsclient.gitlab.GitLabException;
import org.rostilos.labgate.vcsclient.gitlab.model.EMembershipScope;
import org.rostilos.labgate.vcsclient.gitlab.model.GitLabMember;
import org.rostilos.labgate.vcsclient.gitlab.model.GitLabTarget;
import org.rostilos.labgate.vcsclient.gitlab.model.GitLabUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Grants or changes a user's role on a GitLab group or project.
 * <p>
 * Writes go straight to GitLab and cannot be rolled back from here: if a later step
 * fails, whatever GitLab already accepted stays in place and the failure is reported.
 */
public class PermissionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionService.class);

    private final GitLabClient gitLabClient;
    private final TargetResolverChain targetResolverChain;

    public PermissionService(GitLabClient gitLabClient) {
        this(gitLabClient, TargetResolverChain.groupsFirst(gitLabClient));
    }

    public PermissionService(GitLabClient gitLabClient, TargetResolverChain targetResolverChain) {
        this.gitLabClient = gitLabClient;
        this.targetResolverChain = targetResolverChain;
    }

    /**
     * Create the membership with the requested role, or move an existing one to it.
     * Asking for the role a user already holds changes nothing and reports {@code updated}.
     *
     * @throws ValidationException      if a field is empty, the role is unknown, or {@code owner} is requested on a project
     * @throws TargetNotFoundException  if the target is neither a group nor a project
     * @throws UserNotFoundException    if no user has exactly this username
     * @throws UpstreamException        if GitLab or the network fails
     */
    public MembershipResult setPermission(PermissionRequest request) {
        ERole role = RequestValidator.validatePermission(request);
        String username = request.username().trim();
        String targetPath = request.target().trim();

        log.info("Modifying permission for user {} on {} to {}", username, targetPath, role.getId());
        try {
            GitLabTarget target = resolveTarget(targetPath);
            if (target.scope() == EMembershipScope.PROJECT && role == ERole.OWNER) {
                throw new ValidationException("Owner role is not supported for projects");
            }
            GitLabUser user = resolveUser(username);

            MembershipResult result = applyRole(target, user, role);
            log.info("Set {}'s role to {} on {} {} ({})", user.username(), role.getId(),
                    target.scope().getId(), target.fullPath(), result.action().getId());
            return result;
        } catch (GitLabException e) {
            log.warn("GitLab rejected permission change for {} on {}: {}", username, targetPath, e.getMessage());
            throw UpstreamException.fromGitLab(e);
        } catch (IOException e) {
            log.warn("Network error during permission change for {} on {}: {}", username, targetPath, e.getMessage());
            throw UpstreamException.fromNetwork("permission change", e);
        }
    }

    private GitLabTarget resolveTarget(String targetPath) throws IOException {
        TargetResolution resolution = targetResolverChain.resolve(targetPath);
        if (resolution instanceof TargetResolution.Resolved resolved) {
            return resolved.target();
        }
        log.info("Target '{}' not found", targetPath);
        throw new TargetNotFoundException(targetPath);
    }

    private GitLabUser resolveUser(String username) throws IOException {
        log.debug("Looking up user ID for username: {}", username);
        return gitLabClient.findUsersByUsername(username).stream()
                .filter(user -> username.equalsIgnoreCase(user.username()))
                .findFirst()
                .orElseThrow(() -> {
                    log.info("User '{}' not found", username);
                    return new UserNotFoundException(username);
                });
    }

    private MembershipResult applyRole(GitLabTarget target, GitLabUser user, ERole role) throws IOException {
        Optional<GitLabMember> existing = gitLabClient.getMember(target.scope(), target.id(), user.id());

        EMembershipAction action;
        if (existing.isEmpty()) {
            action = addOrUpdate(target, user, role);
        } else if (existing.get().accessLevel() == role.getAccessLevel()) {
            log.info("User {} already has role {} on {}, nothing to change", user.username(), role.getId(), target.fullPath());
            action = EMembershipAction.UPDATED;
        } else {
            log.info("User {} already exists in {}, updating role", user.username(), target.fullPath());
            gitLabClient.updateMember(target.scope(), target.id(), user.id(), role.getAccessLevel());
            action = EMembershipAction.UPDATED;
        }

        return new MembershipResult(
                target.fullPath(),
                target.scope(),
                target.id(),
                user.username(),
                user.id(),
                role,
                role.getAccessLevel(),
                action
        );
    }

    private EMembershipAction addOrUpdate(GitLabTarget target, GitLabUser user, ERole role) throws IOException {
        try {
            gitLabClient.addMember(target.scope(), target.id(), user.id(), role.getAccessLevel());
            return EMembershipAction.CREATED;
        } catch (GitLabException e) {
            if (!e.isConflict()) {
                throw e;
            }
            // became a member since we looked
            log.info("User {} was added to {} concurrently, updating role", user.username(), target.fullPath());
            gitLabClient.updateMember(target.scope(), target.id(), user.id(), role.getAccessLevel());
            return EMembershipAction.UPDATED;
        }
    }
}
