package com.whereq.evtfilter.executor;

import com.whereq.evtfilter.config.EvtFilterProperties;
import com.whereq.evtfilter.exception.DecoderException;
import com.whereq.evtfilter.model.DecoderRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs Log Parser on a staged event log, converting it to XML.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecoderInvoker {

    static final String STDOUT_FILE = "decoder.out";
    static final String STDERR_FILE = "decoder.err";

    private final EvtFilterProperties properties;

    /**
     * Run the decoder and wait for it to exit.
     *
     * @param tool Log Parser executable
     * @param source staged event log
     * @param destination XML file to produce
     * @return exit code and captured output streams
     * @throws DecoderException if the process exceeds the configured timeout
     */
    public DecoderRun invoke(String tool, Path source, Path destination) throws IOException, InterruptedException {
        List<String> command = buildCommand(tool, source, destination);
        Path workDir = destination.toAbsolutePath().getParent();
        Path stdout = workDir.resolve(STDOUT_FILE);
        Path stderr = workDir.resolve(STDERR_FILE);

        log.debug("Executing command: {}", String.join(" ", command));

        ProcessBuilder processBuilder = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile());

        Process process = processBuilder.start();
        try {
            Duration timeout = properties.getDecoder().getTimeout();
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                process.waitFor();
            } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DecoderException("Log Parser timed out after " + timeout.toSeconds() + "s on " + source);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        return new DecoderRun(process.exitValue(), readCaptured(stdout), readCaptured(stderr), destination);
    }

    /**
     * Build the Log Parser command line.
     * {@code <tool> "SELECT * INTO <dest> FROM '<src>'" -i:EVT -o:XML -structure:1 -q:ON}
     */
    public List<String> buildCommand(String tool, Path source, Path destination) {
        List<String> command = new ArrayList<>();
        command.add(tool);
        command.add("SELECT * INTO " + destination + " FROM '" + source + "'");
        command.add("-i:" + properties.getDecoder().getInputFormat());
        command.add("-o:XML");
        // one <ROW> element per record
        command.add("-structure:1");
        command.add("-q:ON");
        return command;
    }

    /**
     * Resolve the decoder executable against the search path.
     * Paths containing a directory are returned unchanged.
     */
    public String resolveExecutable(String tool) {
        if (tool.contains("/") || tool.contains(File.separator)) {
            return tool;
        }

        String path = System.getenv("PATH");
        if (path != null) {
            for (String dir : path.split(File.pathSeparator)) {
                File candidate = new File(dir, tool);
                if (candidate.isFile() && candidate.canExecute()) {
                    return candidate.getAbsolutePath();
                }
            }
        }

        log.warn("Could not find {} on PATH, using '{}'", tool, tool);
        return tool;
    }

    private String readCaptured(Path file) throws IOException {
        if (!Files.exists(file)) {
            return "";
        }
        return new String(Files.readAllBytes(file), Charset.defaultCharset()).strip();
    }
}
