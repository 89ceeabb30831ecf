package com.whereq.evtfilter.executor;

import com.whereq.evtfilter.config.EvtFilterProperties;
import com.whereq.evtfilter.model.StagedFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class StagingAreaTest {

    @TempDir
    Path dir;

    private Path stagingRoot;

    private StagingArea stagingArea;

    @BeforeEach
    void setUp() {
        stagingRoot = dir.resolve("staging");
        EvtFilterProperties properties = new EvtFilterProperties();
        properties.getStaging().setDirectory(stagingRoot);
        stagingArea = new StagingArea(properties);
    }

    @Test
    void stagedNameDropsPercentSignsAndQuotes() {
        assertEquals("Micro_4Windows_Sec.evtx", StagingArea.sanitize("Micro%4Windows%%Sec.evtx"));
        assertEquals("O_Brien.evtx", StagingArea.sanitize("O'Brien.evtx"));
        assertEquals("Security.evtx", StagingArea.sanitize("Security.evtx"));
        assertTrue(StagingArea.stagedName(Path.of("x/Micro%4Sec.evtx")).matches("[0-9a-f]{32}_Micro_4Sec\\.evtx"));
    }

    @Test
    void stagesContentUnderPrivateDirectory() throws IOException {
        Path source = Files.writeString(dir.resolve("Application%4Log.evtx"), "event bytes");

        try (StagedFile staged = stagingArea.stage(source)) {
            assertEquals(stagingRoot, staged.getDirectory().getParent());
            assertTrue(staged.getDirectory().getFileName().toString().startsWith(StagingArea.DIRECTORY_PREFIX));
            assertFalse(staged.getPath().getFileName().toString().contains("%"));
            assertEquals("event bytes", Files.readString(staged.getPath()));
        }
        assertTrue(Files.exists(source));
    }

    @Test
    void sameBaseNameStagesToDistinctPaths() throws IOException {
        Path source = Files.writeString(dir.resolve("Security.evtx"), "x");

        try (StagedFile first = stagingArea.stage(source); StagedFile second = stagingArea.stage(source)) {
            assertNotEquals(first.getDirectory(), second.getDirectory());
            assertNotEquals(first.getPath().getFileName(), second.getPath().getFileName());
        }
    }

    @Test
    void closeRemovesDirectoryExactlyOnce() throws IOException {
        Path source = Files.writeString(dir.resolve("Security.evtx"), "x");
        StagedFile staged = stagingArea.stage(source);
        Files.writeString(staged.resolve("lp.xml"), "<ROOT/>");

        staged.close();
        staged.close();

        assertTrue(staged.isClosed());
        assertFalse(Files.exists(staged.getDirectory()));
        assertTrue(Files.exists(source));
    }

    @Test
    void failedStagingLeavesNoDirectoryBehind() throws IOException {
        assertThrows(NoSuchFileException.class, () -> stagingArea.stage(dir.resolve("missing.evtx")));

        try (Stream<Path> leftovers = Files.list(stagingRoot)) {
            assertEquals(0, leftovers.count());
        }
    }
}
