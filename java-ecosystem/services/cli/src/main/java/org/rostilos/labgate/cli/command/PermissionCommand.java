package org.rostilos.labgate.cli.command;

import org.rostilos.labgate.cli.LabGateCli;
import org.rostilos.labgate.core.model.permission.MembershipResult;
import org.rostilos.labgate.core.model.permission.PermissionRequest;
import org.rostilos.labgate.core.service.PermissionService;
import org.rostilos.labgate.core.validation.RequestValidator;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "permission",
        mixinStandardHelpOptions = true,
        description = "Grant or change a user's role on a group or project.")
public class PermissionCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    LabGateCli parent;

    @CommandLine.Option(names = {"-u", "--username"}, description = "GitLab username.")
    String username;

    @CommandLine.Option(names = {"-t", "--target"}, description = "Full path of the group or project, e.g. team/app.")
    String target;

    @CommandLine.Option(names = {"-r", "--role"}, description = "One of guest, reporter, developer, maintainer, owner.")
    String role;

    @Override
    public Integer call() {
        PermissionRequest request = new PermissionRequest(username, target, role);
        // input errors are reported even when GITLAB_TOKEN is missing
        RequestValidator.validatePermission(request);

        MembershipResult result = new PermissionService(parent.gitLabClient()).setPermission(request);
        parent.printJson(result);
        return LabGateCli.EXIT_OK;
    }
}
