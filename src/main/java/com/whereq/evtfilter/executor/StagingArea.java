package com.whereq.evtfilter.executor;

import com.whereq.evtfilter.config.EvtFilterProperties;
import com.whereq.evtfilter.model.StagedFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Stages event logs under a private temporary directory with a name Log Parser accepts.
 *
 * <p>Log Parser treats '%' as an environment-variable marker and a quote ends the
 * FROM literal, so both are replaced. A hard link is used when the staging root and the
 * source share a volume; otherwise the file is copied.</p>
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StagingArea {

    static final String DIRECTORY_PREFIX = "evtfilter_";

    private static final Pattern UNSAFE = Pattern.compile("%+|'");

    private final EvtFilterProperties properties;

    /**
     * Stage a source file. The caller owns the returned file and must close it.
     *
     * @param source original event-log file
     * @return staged file inside a fresh temporary directory
     */
    public StagedFile stage(Path source) throws IOException {
        Path directory = createDirectory();
        StagedFile staged = new StagedFile(directory.resolve(stagedName(source)), directory);
        try {
            link(source, staged.getPath());
            return staged;
        } catch (IOException | RuntimeException e) {
            staged.close();
            throw e;
        }
    }

    static String sanitize(String fileName) {
        return UNSAFE.matcher(fileName).replaceAll("_");
    }

    static String stagedName(Path source) {
        String unique = UUID.randomUUID().toString().replace("-", "");
        return unique + "_" + sanitize(source.getFileName().toString());
    }

    private Path createDirectory() throws IOException {
        Path root = properties.getStaging().getDirectory();
        if (root == null) {
            return Files.createTempDirectory(DIRECTORY_PREFIX);
        }
        Files.createDirectories(root);
        return Files.createTempDirectory(root, DIRECTORY_PREFIX);
    }

    private void link(Path source, Path target) throws IOException {
        try {
            Files.createLink(target, source);
            log.debug("Hard-linked {} -> {}", source, target);
        } catch (UnsupportedOperationException | FileSystemException e) {
            log.debug("Hard link unavailable for {} ({}), copying", source, e.getMessage());
            Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
        }
    }
}
