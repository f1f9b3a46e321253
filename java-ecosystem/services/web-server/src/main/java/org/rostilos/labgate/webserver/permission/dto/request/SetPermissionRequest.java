package org.rostilos.labgate.webserver.permission.dto.request;

import jakarta.validation.constraints.NotBlank;
import org.rostilos.labgate.core.model.permission.PermissionRequest;

public class SetPermissionRequest {
    @NotBlank(message = "Username cannot be empty")
    private String username;

    // group or project full path
    @NotBlank(message = "Target (group/project) cannot be empty")
    private String target;

    @NotBlank(message = "Role cannot be empty")
    private String role;

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public PermissionRequest toPermissionRequest() {
        return new PermissionRequest(username, target, role);
    }
}
