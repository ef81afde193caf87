package org.scout.core.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.annotation.AnnotationIndex;
import org.scout.core.exec.BatchRunner;
import org.scout.core.load.CompilerSettings;
import org.scout.core.load.CompilingUnitLoader;
import org.scout.core.model.InvocationOutcome;
import org.scout.core.prep.PrepContext;
import org.scout.core.prep.PrepRegistry;
import org.scout.core.prep.PrepUnitRegistrar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point of a forked worker JVM.
 *
 * Reads one {@link WorkerSetup} line from stdin and acknowledges it, then answers every
 * {@link WorkerRequest} line with one {@link WorkerResponse} line until stdin closes.
 * Test output written to {@code System.out} is diverted to stderr so stdout carries
 * nothing but the protocol.
 */
public final class WorkerMain {
    private static final Logger logger = LoggerFactory.getLogger(WorkerMain.class);

    private WorkerMain() {
    }

    public static void main(String[] args) throws IOException {
        PrintStream protocol = System.out;
        System.setOut(System.err);

        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(protocol, StandardCharsets.UTF_8), true);
        serve(reader, writer, new ObjectMapper());
    }

    /**
     * Runs the worker protocol over the given streams; returns when input ends or setup fails.
     */
    static void serve(BufferedReader reader, PrintWriter writer, ObjectMapper objectMapper) throws IOException {
        String setupLine = reader.readLine();
        if (setupLine == null) {
            return;
        }

        BatchRunner runner;
        try {
            WorkerSetup setup = objectMapper.readValue(setupLine, WorkerSetup.class);
            runner = createRunner(setup, new PrepRegistry(), objectMapper);
        } catch (JsonProcessingException | RuntimeException e) {
            logger.error("Worker setup failed", e);
            reply(writer, objectMapper, new WorkerResponse(WorkerResponse.SETUP_ACK, List.of(), e.getMessage()));
            return;
        }
        reply(writer, objectMapper, new WorkerResponse(WorkerResponse.SETUP_ACK, List.of(), null));
        logger.debug("Worker {} ready", ProcessHandle.current().pid());

        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            reply(writer, objectMapper, handle(line, runner, objectMapper));
        }
        logger.debug("Worker {} input closed", ProcessHandle.current().pid());
    }

    private static WorkerResponse handle(String line, BatchRunner runner, ObjectMapper objectMapper) {
        WorkerRequest request;
        try {
            request = objectMapper.readValue(line, WorkerRequest.class);
        } catch (JsonProcessingException e) {
            logger.error("Unreadable request: {}", e.getOriginalMessage());
            return new WorkerResponse(WorkerResponse.SETUP_ACK, List.of(), "Unreadable request: " + e.getOriginalMessage());
        }
        try {
            List<InvocationOutcome> outcomes = runner.run(request.getUnits(), request.getFilter(), request.getSuite());
            return new WorkerResponse(request.getBatchId(), outcomes, null);
        } catch (RuntimeException e) {
            logger.error("Batch {} failed", request.getBatchId(), e);
            return new WorkerResponse(request.getBatchId(), List.of(), e.toString());
        }
    }

    private static void reply(PrintWriter writer, ObjectMapper objectMapper, WorkerResponse response)
            throws JsonProcessingException {
        writer.println(objectMapper.writeValueAsString(response));
    }

    /**
     * Builds a runner the way every worker does: fresh loader, prep units registered into
     * {@code registry}, and a session cache private to the returned runner.
     */
    public static BatchRunner createRunner(WorkerSetup setup, PrepRegistry registry, ObjectMapper objectMapper) {
        CompilerSettings settings = new CompilerSettings();
        settings.setClasspath(setup.getClasspath());
        settings.setSourcePath(setup.getSourcePath().stream().map(Path::of).collect(Collectors.toList()));
        CompilingUnitLoader loader = new CompilingUnitLoader(settings);

        int preps = new PrepUnitRegistrar(loader, registry).registerAll(Path.of(setup.getProjectRoot()), setup.getPrepUnits());
        logger.debug("Registered {} preps from {} prep units", preps, setup.getPrepUnits().size());

        return new BatchRunner(loader, new PrepContext(registry), AnnotationIndex.of(setup.getAnnotations()), objectMapper);
    }
}
