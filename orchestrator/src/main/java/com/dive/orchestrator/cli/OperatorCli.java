package com.dive.orchestrator.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * Operator command line for a running orchestrator.
 *
 * <p>Every command is a thin call to the REST API; the exit code is 0 when
 * the server answered 2xx and 1 otherwise.
 *
 * <pre>
 * dive-orch --connect localhost:8090 state fra
 * dive-orch deploy fra --mode up
 * dive-orch checkpoint list fra
 * dive-orch checkpoint clear fra --phase SEEDING --confirm
 * dive-orch reset fra --confirm
 * dive-orch breakers status
 * dive-orch breakers reset keycloak-token
 * dive-orch levels
 * dive-orch federation drift
 * </pre>
 */
@Command(name = "dive-orch",
         mixinStandardHelpOptions = true,
         version = "dive-orch 0.1.0",
         description = "Command-line interface for the DIVE deployment orchestrator",
         subcommands = {
                 OperatorCli.StateCommand.class,
                 OperatorCli.HistoryCommand.class,
                 OperatorCli.ErrorsCommand.class,
                 OperatorCli.DeployCommand.class,
                 OperatorCli.CheckpointCommand.class,
                 OperatorCli.RollbackCommand.class,
                 OperatorCli.ResetCommand.class,
                 OperatorCli.UnlockCommand.class,
                 OperatorCli.BreakersCommand.class,
                 OperatorCli.LevelsCommand.class,
                 OperatorCli.FederationCommand.class
         })
public class OperatorCli implements Runnable {

    static final String CONFIRM_TOKEN = "confirm";

    @Option(names = {"-c", "--connect"},
            description = "Orchestrator address (host:port)",
            defaultValue = "localhost:8090")
    String serverAddress;

    private final HttpClient httpClient = HttpClient.newHttpClient();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OperatorCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /** Response of one REST call; status 0 when the server could not be reached. */
    record Reply(int status, String body) {
        boolean ok() {
            return status >= 200 && status < 300;
        }
    }

    Reply get(String path) {
        return send(HttpRequest.newBuilder().uri(uri(path)).GET());
    }

    Reply post(String path) {
        return send(HttpRequest.newBuilder().uri(uri(path)).POST(HttpRequest.BodyPublishers.noBody()));
    }

    Reply delete(String path) {
        return send(HttpRequest.newBuilder().uri(uri(path)).DELETE());
    }

    private URI uri(String path) {
        return URI.create("http://" + serverAddress + path);
    }

    private Reply send(HttpRequest.Builder builder) {
        try {
            HttpResponse<String> response = httpClient.send(
                    builder.header("Accept", "application/json").build(),
                    HttpResponse.BodyHandlers.ofString());
            return new Reply(response.statusCode(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Reply(0, "{\"error\":\"interrupted\"}");
        } catch (Exception e) {
            return new Reply(0, "{\"error\":\"" + e.getMessage() + "\"}");
        }
    }

    /** Print the reply body (errors to stderr) and map it to an exit code. */
    int print(Reply reply) {
        if (reply.ok()) {
            System.out.println(reply.body());
            return 0;
        }
        System.err.println((reply.status() == 0 ? "Request failed" : "HTTP " + reply.status())
                + ": " + reply.body());
        return 1;
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    // ===== Subcommands =====

    @Command(name = "state", description = "Show the deployment state of an instance")
    static class StateCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Parameters(index = "0", description = "Instance code (e.g. usa, fra)")
        private String instance;

        @Override
        public Integer call() {
            return parent.print(parent.get("/instances/" + encode(instance) + "/state"));
        }
    }

    @Command(name = "history", description = "Show the state transition log of an instance")
    static class HistoryCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Parameters(index = "0", description = "Instance code")
        private String instance;

        @Option(names = {"-n", "--limit"}, description = "Number of transitions", defaultValue = "20")
        private int limit;

        @Override
        public Integer call() {
            return parent.print(parent.get("/instances/" + encode(instance) + "/history?limit=" + limit));
        }
    }

    @Command(name = "errors", description = "Show recent recorded errors of an instance")
    static class ErrorsCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Parameters(index = "0", description = "Instance code")
        private String instance;

        @Option(names = {"-n", "--limit"}, description = "Number of errors", defaultValue = "20")
        private int limit;

        @Override
        public Integer call() {
            return parent.print(parent.get("/instances/" + encode(instance) + "/errors?limit=" + limit));
        }
    }

    @Command(name = "deploy", description = "Run or resume the deployment pipeline")
    static class DeployCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Parameters(index = "0", description = "Instance code")
        private String instance;

        @Option(names = {"-m", "--mode"}, description = "deploy, up or redeploy", defaultValue = "deploy")
        private String mode;

        @Override
        public Integer call() {
            return parent.print(parent.post("/instances/" + encode(instance) + "/pipeline?mode=" + encode(mode)));
        }
    }

    @Command(name = "rollback", description = "Stop services and restore the newest checkpoint")
    static class RollbackCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Parameters(index = "0", description = "Instance code")
        private String instance;

        @Override
        public Integer call() {
            return parent.print(parent.post("/instances/" + encode(instance) + "/rollback"));
        }
    }

    @Command(name = "reset", description = "Clear all checkpoints and return the instance to UNKNOWN")
    static class ResetCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Parameters(index = "0", description = "Instance code")
        private String instance;

        @Option(names = "--confirm", description = "Required: confirms the destructive reset")
        private boolean confirm;

        @Override
        public Integer call() {
            if (!confirm) {
                System.err.println("Refusing to reset " + instance + " without --confirm");
                return 1;
            }
            return parent.print(parent.post(
                    "/instances/" + encode(instance) + "/reset?confirm=" + CONFIRM_TOKEN));
        }
    }

    @Command(name = "unlock", description = "Force-release a stale instance lock")
    static class UnlockCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Parameters(index = "0", description = "Instance code")
        private String instance;

        @Override
        public Integer call() {
            return parent.print(parent.delete("/instances/" + encode(instance) + "/lock"));
        }
    }

    @Command(name = "levels", description = "Show service startup levels")
    static class LevelsCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Override
        public Integer call() {
            return parent.print(parent.get("/dependencies"));
        }
    }

    @Command(name = "checkpoint",
             description = "Checkpoint management",
             subcommands = {
                     CheckpointCommand.ListCommand.class,
                     CheckpointCommand.ValidateCommand.class,
                     CheckpointCommand.ReportCommand.class,
                     CheckpointCommand.ClearCommand.class
             })
    static class CheckpointCommand implements Runnable {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Override
        public void run() {
            CommandLine.usage(this, System.out);
        }

        @Command(name = "list", description = "List completed phases")
        static class ListCommand implements Callable<Integer> {
            @CommandLine.ParentCommand
            private CheckpointCommand checkpointParent;

            @Parameters(index = "0", description = "Instance code")
            private String instance;

            @Override
            public Integer call() {
                OperatorCli cli = checkpointParent.parent;
                return cli.print(cli.get("/instances/" + encode(instance) + "/checkpoints"));
            }
        }

        @Command(name = "validate", description = "Check that completed phases form a prefix of the phase order")
        static class ValidateCommand implements Callable<Integer> {
            @CommandLine.ParentCommand
            private CheckpointCommand checkpointParent;

            @Parameters(index = "0", description = "Instance code")
            private String instance;

            @Override
            public Integer call() {
                OperatorCli cli = checkpointParent.parent;
                return cli.print(cli.get("/instances/" + encode(instance) + "/checkpoints/validate"));
            }
        }

        @Command(name = "report", description = "Print the JSON checkpoint report")
        static class ReportCommand implements Callable<Integer> {
            @CommandLine.ParentCommand
            private CheckpointCommand checkpointParent;

            @Parameters(index = "0", description = "Instance code")
            private String instance;

            @Override
            public Integer call() {
                OperatorCli cli = checkpointParent.parent;
                return cli.print(cli.get("/instances/" + encode(instance) + "/checkpoints/report"));
            }
        }

        @Command(name = "clear", description = "Clear one phase's checkpoint, or all of them")
        static class ClearCommand implements Callable<Integer> {
            @CommandLine.ParentCommand
            private CheckpointCommand checkpointParent;

            @Parameters(index = "0", description = "Instance code")
            private String instance;

            @Option(names = {"-p", "--phase"}, description = "Phase to clear; all phases when omitted")
            private String phase;

            @Option(names = "--confirm", description = "Required: confirms the deletion")
            private boolean confirm;

            @Override
            public Integer call() {
                if (!confirm) {
                    System.err.println("Refusing to clear checkpoints of " + instance + " without --confirm");
                    return 1;
                }
                OperatorCli cli = checkpointParent.parent;
                String path = "/instances/" + encode(instance) + "/checkpoints"
                        + (phase != null ? "/" + encode(phase) : "")
                        + "?confirm=" + CONFIRM_TOKEN;
                return cli.print(cli.delete(path));
            }
        }
    }

    @Command(name = "breakers",
             description = "Circuit breaker management",
             subcommands = {
                     BreakersCommand.StatusCommand.class,
                     BreakersCommand.ResetBreakerCommand.class
             })
    static class BreakersCommand implements Runnable {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Override
        public void run() {
            CommandLine.usage(this, System.out);
        }

        @Command(name = "status", description = "List every circuit breaker")
        static class StatusCommand implements Callable<Integer> {
            @CommandLine.ParentCommand
            private BreakersCommand breakersParent;

            @Override
            public Integer call() {
                OperatorCli cli = breakersParent.parent;
                return cli.print(cli.get("/circuit-breakers"));
            }
        }

        @Command(name = "reset", description = "Force one breaker, or every open one, back to CLOSED")
        static class ResetBreakerCommand implements Callable<Integer> {
            @CommandLine.ParentCommand
            private BreakersCommand breakersParent;

            @Parameters(index = "0", arity = "0..1", description = "Operation name; all open breakers when omitted")
            private String operation;

            @Override
            public Integer call() {
                OperatorCli cli = breakersParent.parent;
                return cli.print(operation == null
                        ? cli.post("/circuit-breakers/reset-open")
                        : cli.post("/circuit-breakers/" + encode(operation) + "/reset"));
            }
        }
    }

    @Command(name = "federation", description = "Query the federation drift service")
    static class FederationCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private OperatorCli parent;

        @Parameters(index = "0", arity = "0..1", defaultValue = "health",
                    description = "health, drift or states (default: ${DEFAULT-VALUE})")
        private String view;

        @Override
        public Integer call() {
            if (!view.equals("health") && !view.equals("drift") && !view.equals("states")) {
                System.err.println("Unknown federation view '" + view + "': expected health, drift or states");
                return 1;
            }
            return parent.print(parent.get("/federation/" + view));
        }
    }
}
