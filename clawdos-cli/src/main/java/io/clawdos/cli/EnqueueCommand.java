package io.clawdos.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clawdos.core.config.ConfigException;
import io.clawdos.core.executor.JobPatch;
import io.clawdos.core.queue.CommandQueue;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Inserts a request the way the dashboard does, for operators and smoke tests.
 */
@Command(name = "enqueue", description = "Queue a run, delete or patch request for a cron job")
public final class EnqueueCommand implements Callable<Integer> {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final CliContext context;
    private final ObjectMapper mapper = new ObjectMapper();

    @Option(names = "--config", description = "Config file path")
    Path config;

    @Parameters(index = "0", description = "Queue: ${COMPLETION-CANDIDATES}")
    CommandQueue queue;

    @Parameters(index = "1", description = "Executor job id")
    String jobId;

    @Option(names = "--patch", description = "Patch JSON for the patch queue, e.g. {\"enabled\":false}")
    String patch;

    public EnqueueCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Map<String, Object> patchBody = null;
            if (queue == CommandQueue.PATCH) {
                if (patch == null || patch.isBlank()) {
                    System.err.println("--patch is required for the patch queue");
                    return 2;
                }
                JsonNode node = mapper.readTree(patch);
                JobPatch.fromJson(node);
                patchBody = mapper.convertValue(node, MAP_TYPE);
            }
            String id = context.runtimeFactory()
                .open(context.loadValidated(config))
                .store()
                .enqueue(queue, jobId, patchBody);
            System.out.println("Queued " + queue.table() + " request " + id + " for job " + jobId);
            return 0;
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid patch: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Enqueue failed: " + e.getMessage());
            return 1;
        }
    }
}
