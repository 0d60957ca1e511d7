package com.keystone.dispatch.cli;

import com.keystone.core.error.GovernanceException;
import com.keystone.core.model.AuditEntry;
import com.keystone.core.model.TaskRecord;
import com.keystone.core.service.GovernanceService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * CLI command: keystone status &lt;task-id&gt;
 * <p>
 * Shows the latest snapshot of a task and its most recent audit entries.
 * With {@code --watch} it follows the task's event stream on a running server.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check task status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port for watch mode (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final GovernanceService governance;

    public StatusCommand(GovernanceService governance) {
        this.governance = governance;
    }

    @Override
    public Integer call() {
        if (watch) {
            return runWatchMode();
        }

        ConsoleOutput.printBanner();
        TaskRecord task;
        List<AuditEntry> latest;
        try {
            task = governance.task(taskId);
            latest = governance.status(taskId).latestAuditEntries();
        } catch (GovernanceException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.task(task);

        if (!task.provenanceIds().isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Provenance: " + String.join(", ", task.provenanceIds()));
        }
        if (!latest.isEmpty()) {
            System.out.println();
            System.out.println("Recent decisions:");
            latest.forEach(ConsoleOutput::auditEntry);
        }
        return 0;
    }

    private int runWatchMode() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching task " + taskId + " (connecting to localhost:" + port + ")...");
        System.out.println();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/tasks/" + taskId + "/events");

        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "text/event-stream")
                    .GET()
                    .build();

            HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Task not found: " + taskId);
                return 1;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return 1;
            }

            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, data);
                    currentEventType[0] = "";
                }
            });

            System.out.println();
            ConsoleOutput.info("Stream ended.");
            return 0;

        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Keystone server at localhost:" + port);
            ConsoleOutput.info("Start the server first: keystone serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
            return 130;
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
            return 1;
        }
    }
}
