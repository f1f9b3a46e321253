package org.rostilos.labgate.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.rostilos.labgate.cli.command.ItemsCommand;
import org.rostilos.labgate.cli.command.PermissionCommand;
import org.rostilos.labgate.core.exception.TargetNotFoundException;
import org.rostilos.labgate.core.exception.UpstreamException;
import org.rostilos.labgate.core.exception.UserNotFoundException;
import org.rostilos.labgate.core.exception.ValidationException;
import org.rostilos.labgate.vcsclient.HttpAuthorizedClientFactory;
import org.rostilos.labgate.vcsclient.gitlab.GitLabClient;
import org.rostilos.labgate.vcsclient.gitlab.GitLabConnectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.Map;

/**
 * Command line entry point. GitLab is configured through {@code GITLAB_URL} and {@code GITLAB_TOKEN}.
 * Results are printed to stdout as JSON; errors and logs go to stderr.
 */
@CommandLine.Command(
        name = "labgate",
        mixinStandardHelpOptions = true,
        version = "LabGate 1.0.0",
        description = "Manage GitLab memberships and list issues or merge requests by year.",
        subcommands = {PermissionCommand.class, ItemsCommand.class})
public class LabGateCli implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LabGateCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_VALIDATION = 2;
    public static final int EXIT_NOT_FOUND = 3;
    public static final int EXIT_UPSTREAM = 4;

    private final Map<String, String> environment;
    private final ObjectMapper objectMapper;
    private GitLabClient gitLabClient;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public LabGateCli(Map<String, String> environment) {
        this.environment = environment;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine(System.getenv(), new PrintWriter(System.out, true), new PrintWriter(System.err, true))
                .execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine(Map<String, String> environment, PrintWriter out, PrintWriter err) {
        CommandLine commandLine = new CommandLine(new LabGateCli(environment));
        commandLine.setOut(out);
        commandLine.setErr(err);
        commandLine.setExitCodeExceptionMapper(LabGateCli::exitCodeFor);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            cmd.getErr().println("Error: " + ex.getMessage());
            if (ex instanceof ValidationException validation && validation.getErrors().size() > 1) {
                validation.getErrors().forEach(error -> cmd.getErr().println("  - " + error));
            }
            cmd.getErr().flush();
            return exitCodeFor(ex);
        });
        return commandLine;
    }

    static int exitCodeFor(Throwable ex) {
        if (ex instanceof ValidationException) {
            return EXIT_VALIDATION;
        }
        if (ex instanceof TargetNotFoundException || ex instanceof UserNotFoundException) {
            return EXIT_NOT_FOUND;
        }
        if (ex instanceof UpstreamException) {
            return EXIT_UPSTREAM;
        }
        if (ex instanceof CommandLine.ParameterException) {
            return EXIT_VALIDATION;
        }
        log.error("Unexpected failure: {}", ex.getMessage(), ex);
        return EXIT_FAILURE;
    }

    @Override
    public void run() {
        PrintWriter out = spec.commandLine().getOut();
        spec.commandLine().usage(out);
        out.flush();
    }

    /**
     * Built on first use so that {@code --help} works without a token.
     *
     * @throws ValidationException if {@code GITLAB_TOKEN} is missing or {@code GITLAB_URL} is malformed
     */
    public GitLabClient gitLabClient() {
        if (gitLabClient == null) {
            GitLabConnectionSettings settings;
            try {
                settings = GitLabConnectionSettings.fromEnvironment(environment);
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage());
            }
            log.debug("Connecting to {}", settings.apiBaseUrl());
            OkHttpClient httpClient = new HttpAuthorizedClientFactory().createClient(settings);
            gitLabClient = new GitLabClient(httpClient, settings);
        }
        return gitLabClient;
    }

    public void printJson(Object value) {
        try {
            PrintWriter out = spec.commandLine().getOut();
            out.println(objectMapper.writeValueAsString(value));
            out.flush();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result", e);
        }
    }
}
