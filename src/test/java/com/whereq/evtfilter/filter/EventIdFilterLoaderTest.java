package com.whereq.evtfilter.filter;

import com.whereq.evtfilter.exception.FilterSpecException;
import com.whereq.evtfilter.exception.StartupException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EventIdFilterLoaderTest {

    private final EventIdFilterLoader loader = new EventIdFilterLoader();

    @TempDir
    Path dir;

    @Test
    void absentSourcesMeanNoFiltering() {
        assertEquals(Optional.empty(), loader.load(null, null));
    }

    @Test
    void parsesInlineListWithBlanksAndSpaces() {
        assertEquals(Optional.of(Set.of(4624, 4625, 1102)), loader.load(" 4624, 4625,,1102 ", null));
    }

    @Test
    void mergesInlineListAndFile() throws IOException {
        Path file = dir.resolve("ids.txt");
        Files.writeString(file, "4688\n\n  4624  \n7045\n");

        assertEquals(Optional.of(Set.of(4624, 4688, 7045, 1)), loader.load("1,4624", file));
    }

    @Test
    void presentButEmptySourceFiltersEverything() throws IOException {
        Path file = dir.resolve("empty.txt");
        Files.writeString(file, "\n\n");

        Optional<Set<Integer>> ids = loader.load(null, file);

        assertTrue(ids.isPresent());
        assertTrue(ids.get().isEmpty());
    }

    @Test
    void nonIntegerTokenIsAParseError() {
        FilterSpecException error = assertThrows(FilterSpecException.class, () -> loader.load("4624,abc", null));
        assertTrue(error.getMessage().contains("abc"));
    }

    @Test
    void nonIntegerLineInFileIsAParseError() throws IOException {
        Path file = dir.resolve("ids.txt");
        Files.writeString(file, "4624\n46.5\n");

        assertThrows(FilterSpecException.class, () -> loader.load(null, file));
    }

    @Test
    void unreadableFileIsAStartupError() {
        assertThrows(StartupException.class, () -> loader.load(null, dir.resolve("missing.txt")));
    }
}
