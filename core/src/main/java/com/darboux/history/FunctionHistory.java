package com.darboux.history;

import com.darboux.integration.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Text file of previously integrated functions.
 *
 * <p>Format: a function line followed by its interval line, repeated.
 * <pre>
 *   x 2 ^
 *   [0 ; 1]
 *   x sin
 *   [0 ; 3.14159]
 * </pre>
 *
 * <p>The file is appended to and read back in UTF-8. A missing file is
 * treated as an empty history.
 */
public class FunctionHistory {

    private static final Logger logger = LoggerFactory.getLogger(FunctionHistory.class);

    private final Path file;

    public FunctionHistory(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
    }

    public Path file() {
        return file;
    }

    /**
     * Appends an integrand and its interval bounds.
     *
     * @param integrand the postfix integrand
     * @param start the start bound as entered
     * @param end the end bound as entered
     * @return the stored entry
     * @throws HistoryException if the file cannot be written
     */
    public HistoryEntry append(String integrand, String start, String end) {
        HistoryEntry entry = new HistoryEntry(integrand.strip(), IntervalParser.format(start, end));
        String text = entry.integrand() + System.lineSeparator() + entry.interval() + System.lineSeparator();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new HistoryException("Failed to save function", file, e);
        }
        logger.debug("Saved '{}' over {} to {}", entry.integrand(), entry.interval(), file);
        return entry;
    }

    /**
     * Returns the most recently saved entry: the second-to-last line is the
     * integrand and the last line its interval.
     *
     * @return the entry, or empty if fewer than two lines are stored
     * @throws HistoryException if the file exists but cannot be read
     */
    public Optional<HistoryEntry> lastEntry() {
        List<String> lines = nonBlankLines();
        if (lines.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new HistoryEntry(lines.get(lines.size() - 2), lines.get(lines.size() - 1)));
    }

    /**
     * Returns every complete entry in file order. A trailing unpaired line is ignored.
     *
     * @return the entries, unmodifiable
     * @throws HistoryException if the file exists but cannot be read
     */
    public List<HistoryEntry> entries() {
        List<String> lines = nonBlankLines();
        List<HistoryEntry> entries = new ArrayList<>();
        for (int i = 0; i + 1 < lines.size(); i += 2) {
            entries.add(new HistoryEntry(lines.get(i), lines.get(i + 1)));
        }
        return Collections.unmodifiableList(entries);
    }

    /**
     * Returns the raw file content.
     *
     * @return the text, or an empty string if the file does not exist
     * @throws HistoryException if the file exists but cannot be read
     */
    public String readAll() {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return "";
        } catch (IOException e) {
            throw new HistoryException("Failed to read saved functions", file, e);
        }
    }

    private List<String> nonBlankLines() {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Collections.emptyList();
        } catch (IOException e) {
            throw new HistoryException("Failed to read saved functions", file, e);
        }
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (!line.isBlank()) {
                result.add(line.strip());
            }
        }
        return result;
    }
}
