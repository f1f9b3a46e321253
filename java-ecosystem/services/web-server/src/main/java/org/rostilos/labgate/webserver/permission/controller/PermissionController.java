package org.rostilos.labgate.webserver.permission.controller;

import jakarta.validation.Valid;
import org.rostilos.labgate.core.model.permission.MembershipResult;
import org.rostilos.labgate.core.service.PermissionService;
import org.rostilos.labgate.webserver.permission.dto.request.SetPermissionRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@CrossOrigin(origins = "*", maxAge = 3600)
@RestController
public class PermissionController {
    private final PermissionService permissionService;

    public PermissionController(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    @PostMapping("/permission")
    public ResponseEntity<MembershipResult> setPermission(@Valid @RequestBody SetPermissionRequest request) {
        MembershipResult result = permissionService.setPermission(request.toPermissionRequest());
        return ResponseEntity.ok(result);
    }
}
