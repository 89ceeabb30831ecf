package com.whereq.evtfilter.cli;

import com.whereq.evtfilter.exception.FilterSpecException;
import com.whereq.evtfilter.exception.RunCancelledException;
import com.whereq.evtfilter.model.ExtractionRequest;
import com.whereq.evtfilter.model.ExtractionSummary;
import com.whereq.evtfilter.service.ExtractionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EvtFilterCommandTest {

    @Mock
    private ExtractionService extractionService;

    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        commandLine = new CommandLine(new EvtFilterCommand(extractionService));
        commandLine.setErr(new PrintWriter(new StringWriter()));
        commandLine.setOut(new PrintWriter(new StringWriter()));
    }

    @Test
    void mapsOptionsToRequest() throws Exception {
        when(extractionService.run(any())).thenReturn(new ExtractionSummary(3, 1, 10, Path.of("out.csv")));

        int exitCode = commandLine.execute(
                "--dir", "logs",
                "--output", "out.csv",
                "--start-date", "2024-05-01 00:00:00",
                "--end-date", "2024-05-01 23:59:59",
                "--event-ids", "4624,4625",
                "--exclude-event-ids-file", "noise.txt",
                "--workers", "4",
                "--placeholder-char", "|",
                "--logparser", "C:\\Tools\\LogParser.exe",
                "--sort-by-source");

        assertEquals(EvtFilterCommand.EXIT_OK, exitCode);
        ArgumentCaptor<ExtractionRequest> captor = ArgumentCaptor.forClass(ExtractionRequest.class);
        verify(extractionService).run(captor.capture());
        ExtractionRequest request = captor.getValue();
        assertEquals(Path.of("logs"), request.getDirectory());
        assertEquals(Path.of("out.csv"), request.getOutput());
        assertEquals(LocalDateTime.of(2024, 5, 1, 0, 0), request.getStart());
        assertEquals(LocalDateTime.of(2024, 5, 1, 23, 59, 59), request.getEnd());
        assertEquals("4624,4625", request.getIncludeIds());
        assertNull(request.getIncludeIdsFile());
        assertEquals(Path.of("noise.txt"), request.getExcludeIdsFile());
        assertEquals(4, request.getWorkers());
        assertEquals('|', request.getPlaceholder());
        assertEquals("C:\\Tools\\LogParser.exe", request.getDecoderPath());
        assertEquals(Boolean.TRUE, request.getSortBySource());
        assertEquals(Path.of("out.csv.log"), request.resolveLogFile());
    }

    @Test
    void unsetOptionsStayNull() throws Exception {
        when(extractionService.run(any())).thenReturn(new ExtractionSummary(1, 0, 0, null));

        commandLine.execute(required());

        ArgumentCaptor<ExtractionRequest> captor = ArgumentCaptor.forClass(ExtractionRequest.class);
        verify(extractionService).run(captor.capture());
        assertNull(captor.getValue().getIncludeIds());
        assertNull(captor.getValue().getWorkers());
        assertNull(captor.getValue().getPlaceholder());
        assertNull(captor.getValue().getSortBySource());
    }

    @Test
    void malformedDateIsAStartupError() {
        int exitCode = commandLine.execute(
                "--dir", "logs", "--output", "out.csv",
                "--start-date", "2024-05-01T00:00", "--end-date", "2024-05-01 23:59:59");

        assertEquals(EvtFilterCommand.EXIT_STARTUP, exitCode);
        verifyNoInteractions(extractionService);
    }

    @Test
    void missingRequiredOptionIsAUsageError() {
        int exitCode = commandLine.execute("--dir", "logs", "--output", "out.csv");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        verifyNoInteractions(extractionService);
    }

    @Test
    void badIdListIsAStartupError() throws Exception {
        when(extractionService.run(any())).thenThrow(new FilterSpecException("Invalid EventID 'abc'"));

        assertEquals(EvtFilterCommand.EXIT_STARTUP, commandLine.execute(required()));
    }

    @Test
    void cancellationExitsWith130() throws Exception {
        when(extractionService.run(any())).thenThrow(new RunCancelledException("Run cancelled"));

        assertEquals(EvtFilterCommand.EXIT_CANCELLED, commandLine.execute(required()));
    }

    @Test
    void parsesDateFormat() {
        assertEquals(LocalDateTime.of(2024, 1, 2, 3, 4, 5), EvtFilterCommand.parseDate("--start-date", " 2024-01-02 03:04:05 "));
        assertThrows(com.whereq.evtfilter.exception.StartupException.class,
                () -> EvtFilterCommand.parseDate("--end-date", "2024-13-01 00:00:00"));
    }

    private static String[] required() {
        return new String[]{
                "--dir", "logs", "--output", "out.csv",
                "--start-date", "2024-05-01 00:00:00", "--end-date", "2024-05-01 23:59:59"};
    }
}
