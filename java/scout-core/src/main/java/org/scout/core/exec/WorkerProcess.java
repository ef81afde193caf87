package org.scout.core.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.load.CompilingUnitLoader;
import org.scout.core.worker.WorkerMain;
import org.scout.core.worker.WorkerRequest;
import org.scout.core.worker.WorkerResponse;
import org.scout.core.worker.WorkerSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * A child JVM running {@link WorkerMain}, talked to over its stdin and stdout.
 */
final class WorkerProcess implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WorkerProcess.class);

    private static final long EXIT_WAIT_SECONDS = 10;

    private final Process process;
    private final BufferedReader reader;
    private final BufferedWriter writer;
    private final ObjectMapper objectMapper;

    private WorkerProcess(Process process, ObjectMapper objectMapper) {
        this.process = process;
        this.objectMapper = objectMapper;
        this.reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    static WorkerProcess start(WorkerSetup setup, List<String> jvmArgs, ObjectMapper objectMapper) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.addAll(jvmArgs);
        command.add("-cp");
        command.add(workerClasspath(setup));
        command.add(WorkerMain.class.getName());

        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(Path.of(setup.getProjectRoot()).toFile())
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        WorkerProcess worker = new WorkerProcess(builder.start(), objectMapper);
        logger.debug("Started worker pid {}", worker.pid());

        WorkerResponse ack;
        try {
            worker.writeLine(objectMapper.writeValueAsString(setup));
            ack = worker.readResponse();
        } catch (IOException e) {
            worker.close();
            throw e;
        }
        if (ack.getError() != null) {
            worker.close();
            throw new IOException("Worker setup failed: " + ack.getError());
        }
        return worker;
    }

    WorkerResponse send(WorkerRequest request) throws IOException {
        writeLine(objectMapper.writeValueAsString(request));
        WorkerResponse response = readResponse();
        if (response.getError() != null) {
            throw new IOException(response.getError());
        }
        if (response.getBatchId() != request.getBatchId()) {
            throw new IOException("Worker answered batch " + response.getBatchId() + " to batch " + request.getBatchId());
        }
        return response;
    }

    long pid() {
        return process.pid();
    }

    boolean isAlive() {
        return process.isAlive();
    }

    private void writeLine(String line) throws IOException {
        writer.write(line);
        writer.newLine();
        writer.flush();
    }

    private WorkerResponse readResponse() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            throw new IOException("Worker " + pid() + " exited" + exitDetail());
        }
        try {
            return objectMapper.readValue(line, WorkerResponse.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Worker " + pid() + " sent an unreadable response: " + e.getOriginalMessage(), e);
        }
    }

    private String exitDetail() {
        try {
            if (process.waitFor(1, TimeUnit.SECONDS)) {
                return " with code " + process.exitValue();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "";
    }

    @Override
    public void close() {
        try {
            writer.close();
        } catch (IOException e) {
            logger.debug("Closing input of worker {}: {}", pid(), e.getMessage());
        }
        try {
            if (!process.waitFor(EXIT_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Worker {} did not exit, killing it", pid());
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static String workerClasspath(WorkerSetup setup) {
        Set<String> entries = new LinkedHashSet<>();
        CompilingUnitLoader.codeSourceOf(WorkerMain.class).ifPresent(entries::add);
        for (String entry : System.getProperty("java.class.path", "").split(File.pathSeparator)) {
            if (!entry.isBlank()) {
                entries.add(entry);
            }
        }
        entries.addAll(setup.getClasspath());
        return String.join(File.pathSeparator, entries);
    }
}
