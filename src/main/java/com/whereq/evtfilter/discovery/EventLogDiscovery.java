package com.whereq.evtfilter.discovery;

import com.whereq.evtfilter.exception.StartupException;
import com.whereq.evtfilter.service.ErrorReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds .evt/.evtx files under a root directory.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventLogDiscovery {

    private static final Pattern EVENT_LOG = Pattern.compile(".*\\.evtx?$", Pattern.CASE_INSENSITIVE);

    private final ErrorReporter errorReporter;

    /**
     * Recursively list event-log files. Unreadable directories are skipped.
     *
     * @param root directory to search
     * @param errorLog where skipped directories are reported, may be null
     * @return matching files sorted by path, possibly empty
     */
    public List<Path> discover(Path root, Path errorLog) {
        if (!Files.isDirectory(root)) {
            throw new StartupException("Not a directory: " + root);
        }

        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && isEventLog(file)) {
                            found.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        errorReporter.report(errorLog, "Skipping unreadable path " + file + ": " + exc);
                        return FileVisitResult.CONTINUE;
                    }
                });
        } catch (IOException e) {
            throw new StartupException("Failed to scan " + root + ": " + e.getMessage(), e);
        }

        found.sort(null);
        log.debug("Discovered {} event logs under {}", found.size(), root);
        return found;
    }

    static boolean isEventLog(Path file) {
        Path name = file.getFileName();
        return name != null && EVENT_LOG.matcher(name.toString()).matches();
    }
}
