package com.questrail.helixd.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.helixd.internal.time.MonotonicClock;
import com.questrail.helixd.protocol.codec.impl.ProtocolJson;
import com.questrail.helixd.protocol.model.SyncStats;
import com.questrail.helixd.queue.QueueKey;
import com.questrail.helixd.queue.SyncExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * ProcessSyncExecutor
 * =============================================================================
 * {@link SyncExecutor} that runs an external command per job.
 *
 * <p>Each template token may contain the placeholders {@code {tool}},
 * {@code {repo_root}} and {@code {directory}}. The command runs with the
 * repository root as working directory and stderr merged into stdout.</p>
 *
 * <ul>
 *   <li>Non-zero exit status fails the job</li>
 *   <li>A JSON object on the last output line is read as {@link SyncStats}</li>
 *   <li>Otherwise only {@code duration_ms} is reported</li>
 * </ul>
 */
public final class ProcessSyncExecutor implements SyncExecutor
{
    private static final Logger log = LoggerFactory.getLogger(ProcessSyncExecutor.class);

    private final List<String> commandTemplate;
    private final MonotonicClock clock;
    private final ObjectMapper mapper;

    public ProcessSyncExecutor(List<String> commandTemplate, MonotonicClock clock)
    {
        Objects.requireNonNull(commandTemplate, "commandTemplate");
        if (commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("commandTemplate must not be empty");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = ProtocolJson.mapper();
    }

    @Override
    public SyncStats execute(QueueKey key) throws IOException, InterruptedException
    {
        List<String> command = render(key);
        long startedNanos = clock.nowNanos();

        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workingDirectory(key).toFile())
                .redirectErrorStream(true);

        Process process = builder.start();
        String lastLine;
        try {
            lastLine = readLastLine(process);
        }
        catch (IOException e) {
            process.destroyForcibly();
            throw e;
        }

        int status;
        try {
            status = process.waitFor();
        }
        catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(Math.max(0, clock.nowNanos() - startedNanos));
        if (status != 0) {
            throw new IOException(lastLine == null
                    ? "Sync command exited with status " + status
                    : "Sync command exited with status " + status + ": " + lastLine);
        }
        return parseStats(lastLine, durationMs);
    }

    List<String> render(QueueKey key)
    {
        List<String> rendered = new ArrayList<>(commandTemplate.size());
        for (String token : commandTemplate) {
            rendered.add(token
                    .replace("{tool}", key.tool())
                    .replace("{repo_root}", key.repoRoot())
                    .replace("{directory}", key.directory()));
        }
        return rendered;
    }

    private static Path workingDirectory(QueueKey key)
    {
        return Paths.get(key.repoRoot());
    }

    private static String readLastLine(Process process) throws IOException
    {
        String last = null;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    last = line.trim();
                }
            }
        }
        return last;
    }

    SyncStats parseStats(String lastLine, long durationMs)
    {
        if (lastLine == null || !lastLine.startsWith("{")) {
            return SyncStats.ofDuration(durationMs);
        }
        try {
            SyncStats stats = mapper.readValue(lastLine, SyncStats.class);
            return stats.durationMs() > 0 ? stats : stats.withDurationMs(durationMs);
        }
        catch (JsonProcessingException e) {
            log.debug("Sync output is not a stats object: {}", e.getOriginalMessage());
            return SyncStats.ofDuration(durationMs);
        }
    }
}
