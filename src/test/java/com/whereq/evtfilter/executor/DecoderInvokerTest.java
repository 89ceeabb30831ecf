package com.whereq.evtfilter.executor;

import com.whereq.evtfilter.EventXml;
import com.whereq.evtfilter.FakeDecoder;
import com.whereq.evtfilter.config.EvtFilterProperties;
import com.whereq.evtfilter.exception.DecoderException;
import com.whereq.evtfilter.model.DecoderRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecoderInvokerTest {

    @TempDir
    Path dir;

    private EvtFilterProperties properties;

    private DecoderInvoker invoker;

    @BeforeEach
    void setUp() {
        properties = new EvtFilterProperties();
        invoker = new DecoderInvoker(properties);
    }

    @Test
    void buildsLogParserQuery() {
        Path source = dir.resolve("evtfilter_1").resolve("abc_Security.evtx");
        Path xml = dir.resolve("evtfilter_1").resolve("lp.xml");

        List<String> command = invoker.buildCommand("LogParser.exe", source, xml);

        assertEquals(List.of(
                "LogParser.exe",
                "SELECT * INTO " + xml + " FROM '" + source + "'",
                "-i:EVT",
                "-o:XML",
                "-structure:1",
                "-q:ON"), command);
    }

    @Test
    void inputFormatIsConfigurable() {
        properties.getDecoder().setInputFormat("EVTX");

        List<String> command = invoker.buildCommand("lp", Path.of("a.evtx"), Path.of("lp.xml"));

        assertEquals("-i:EVTX", command.get(2));
    }

    @Test
    void explicitPathIsNotResolved() {
        assertEquals("/opt/logparser/LogParser.exe", invoker.resolveExecutable("/opt/logparser/LogParser.exe"));
        assertEquals("no-such-decoder-on-path.exe", invoker.resolveExecutable("no-such-decoder-on-path.exe"));
    }

    @Test
    void successfulRunProducesOutput() throws Exception {
        Path tool = FakeDecoder.install(dir);
        Path work = Files.createDirectory(dir.resolve("work"));
        Path source = Files.write(work.resolve("Security.evtx"),
                EventXml.document().row("2024-05-01 09:00:00", 4624, "logon").toUtf8());
        Path xml = work.resolve("lp.xml");

        DecoderRun run = invoker.invoke(tool.toString(), source, xml);

        assertTrue(run.succeeded());
        assertEquals(0, run.getExitCode());
        assertTrue(Files.size(xml) > 0);
        assertEquals(xml, run.getOutputFile());
        assertEquals(List.of(source.toString()), FakeDecoder.calls(tool));
    }

    @Test
    void failedRunCapturesBothStreams() throws Exception {
        Path tool = FakeDecoder.install(dir);
        Path work = Files.createDirectory(dir.resolve("work"));
        Path source = Files.writeString(work.resolve("Broken.evtx"), "FAIL: not an event log");

        DecoderRun run = invoker.invoke(tool.toString(), source, work.resolve("lp.xml"));

        assertFalse(run.succeeded());
        assertEquals(3, run.getExitCode());
        assertEquals("Error: corrupt event log", run.getStderr());
        assertEquals("Task aborted.", run.getStdout());
        assertFalse(Files.exists(work.resolve("lp.xml")));
    }

    @Test
    @DisabledOnOs(value = OS.WINDOWS, disabledReason = "killing the cmd.exe wrapper leaves its JVM running")
    void hungDecoderIsKilledAfterTimeout() throws IOException {
        properties.getDecoder().setTimeout(Duration.ofMillis(500));
        Path tool = FakeDecoder.installHanging(dir);
        Path work = Files.createDirectory(dir.resolve("work"));
        Path source = Files.writeString(work.resolve("Security.evtx"), "x");

        long started = System.nanoTime();
        DecoderException e = assertThrows(DecoderException.class,
                () -> invoker.invoke(tool.toString(), source, work.resolve("lp.xml")));

        assertTrue(e.getMessage().contains("timed out"));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).getSeconds() < 20);
    }

    @Test
    void missingExecutableFailsToStart() throws IOException {
        Path source = Files.writeString(dir.resolve("Security.evtx"), "x");

        assertThrows(IOException.class,
                () -> invoker.invoke(dir.resolve("missing/LogParser.exe").toString(), source, dir.resolve("lp.xml")));
    }
}
