package com.xbleey.marketreport.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Pattern;

public class FileDailyRunMarkerStore implements DailyRunMarkerStore {

    private static final Logger log = LoggerFactory.getLogger(FileDailyRunMarkerStore.class);
    private static final Pattern SAFE_MARKER_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;

    public FileDailyRunMarkerStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<LocalDate> readLastRunDate(String markerId) {
        Path file = markerFile(markerId);
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8).trim();
            if (content.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(LocalDate.parse(content));
        } catch (NoSuchFileException ex) {
            return Optional.empty();
        } catch (Exception ex) {
            log.warn("Failed to read run marker {} from {}, treating as not run", markerId, file, ex);
            return Optional.empty();
        }
    }

    @Override
    public boolean writeLastRunDate(String markerId, LocalDate date) {
        Path file = markerFile(markerId);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, markerId + ".", ".tmp");
            Files.writeString(temp, date.toString(), StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (Exception ex) {
            log.warn("Failed to write run marker {} to {}", markerId, file, ex);
            deleteQuietly(temp);
            return false;
        }
    }

    public Path markerFile(String markerId) {
        if (markerId == null || !SAFE_MARKER_ID.matcher(markerId).matches()) {
            throw new IllegalArgumentException("Invalid marker id: " + markerId);
        }
        return directory.resolve(markerId + ".txt");
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            log.debug("Failed to delete temp marker file {}", temp, ex);
        }
    }
}
