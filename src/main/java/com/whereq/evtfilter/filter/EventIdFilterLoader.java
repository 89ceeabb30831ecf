package com.whereq.evtfilter.filter;

import com.whereq.evtfilter.exception.FilterSpecException;
import com.whereq.evtfilter.exception.StartupException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Builds EventID sets from an inline comma-separated list and/or a one-per-line file.
 *
 * <p>An empty {@link Optional} means no filtering; a present but empty set filters
 * every record out.</p>
 */
@Component
public class EventIdFilterLoader {

    public Optional<Set<Integer>> load(String inline, Path file) {
        if (inline == null && file == null) {
            return Optional.empty();
        }

        Set<Integer> ids = new LinkedHashSet<>();
        if (inline != null) {
            for (String token : inline.split(",")) {
                addToken(ids, token, "--event-ids list");
            }
        }
        if (file != null) {
            try {
                for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                    addToken(ids, line, file.toString());
                }
            } catch (IOException e) {
                throw new StartupException("Cannot read EventID file " + file + ": " + e.getMessage(), e);
            }
        }
        return Optional.of(Set.copyOf(ids));
    }

    private void addToken(Set<Integer> ids, String token, String origin) {
        String trimmed = token.replace("\uFEFF", "").strip();
        if (trimmed.isEmpty()) {
            return;
        }
        try {
            ids.add(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            throw new FilterSpecException("Invalid EventID '" + trimmed + "' in " + origin, e);
        }
    }
}
