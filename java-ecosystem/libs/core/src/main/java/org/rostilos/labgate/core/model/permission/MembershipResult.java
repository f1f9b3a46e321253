package org.rostilos.labgate.core.model.permission;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.rostilos.labgate.vcsclient.gitlab.model.EMembershipScope;

/**
 * Outcome of a role change, as applied on GitLab.
 */
public record MembershipResult(
    @JsonProperty("target")
    String target,

    @JsonProperty("target_kind")
    EMembershipScope targetKind,

    @JsonProperty("resolved_target_id")
    long resolvedTargetId,

    @JsonProperty("username")
    String username,

    @JsonProperty("resolved_user_id")
    long resolvedUserId,

    @JsonProperty("applied_role")
    ERole appliedRole,

    @JsonProperty("access_level")
    int accessLevel,

    @JsonProperty("action")
    EMembershipAction action
) {
}
