package com.star.logexplorer.service;

import com.star.logexplorer.config.LogExplorerProperties;
import com.star.logexplorer.dto.LogFileInfo;
import com.star.logexplorer.dto.UploadResponse;
import com.star.logexplorer.exception.DirectoryNotFoundException;
import com.star.logexplorer.exception.FileSizeLimitExceededException;
import com.star.logexplorer.exception.InvalidFileNameException;
import com.star.logexplorer.exception.InvalidUploadException;
import com.star.logexplorer.exception.LogFileException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Manages the files of the log directory: listing, upload and deletion.
 */
@Service
@Slf4j
public class LogFileService {

    private static final DateTimeFormatter UPLOAD_PREFIX_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);

    private final LogExplorerProperties properties;
    private final Clock clock;

    @Autowired
    public LogFileService(LogExplorerProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public LogFileService(LogExplorerProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Regular files of the log directory, newest first. The directory is
     * created when missing.
     */
    public List<LogFileInfo> listFiles() {
        Path directory = ensureDirectory();

        try (Stream<Path> entries = Files.list(directory)) {
            List<LogFileInfo> files = entries
                    .filter(Files::isRegularFile)
                    .map(file -> describe(file, false))
                    .sorted(Comparator.comparing(LogFileInfo::getLastModified).reversed())
                    .collect(Collectors.toList());

            log.debug("Listed {} files in {}", files.size(), directory);
            return files;

        } catch (IOException | UncheckedIOException e) {
            throw new LogFileException("Failed to read log files", e);
        }
    }

    /**
     * Every entry (files and sub-directories) of an arbitrary directory,
     * defaulting to the log directory.
     */
    public List<LogFileInfo> inspectDirectory(String customPath) {
        Path directory = customPath != null && !customPath.isBlank()
                ? Path.of(customPath)
                : properties.getDirectoryPath();

        if (!Files.isDirectory(directory)) {
            throw new DirectoryNotFoundException(directory.toString());
        }

        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .map(file -> describe(file, true))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new LogFileException("Failed to inspect directory: " + directory, e);
        }
    }

    public UploadResponse upload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidUploadException("No file provided");
        }

        long maxSize = properties.getMaxUploadSize().toBytes();
        if (file.getSize() > maxSize) {
            throw new FileSizeLimitExceededException(maxSize, file.getSize());
        }

        String originalName = sanitizeFileName(stripDirectories(file.getOriginalFilename()));
        String storedName = UPLOAD_PREFIX_FORMAT.format(clock.instant()) + "-" + originalName;
        Path target = resolveInDirectory(storedName);

        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new LogFileException("Failed to upload file", e);
        }

        log.info("Stored uploaded log file {} ({} bytes)", target, file.getSize());
        return new UploadResponse(storedName, "/logs/" + storedName, originalName, file.getSize());
    }

    public void delete(List<String> fileNames) {
        if (fileNames == null || fileNames.isEmpty()) {
            throw new LogFileException("No files specified for deletion");
        }

        List<Path> targets = fileNames.stream()
                .map(this::resolveInDirectory)
                .collect(Collectors.toList());

        List<String> failed = new ArrayList<>();
        for (Path target : targets) {
            if (!Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
                log.warn("Refusing to delete {}: not a regular file", target);
                failed.add(target.getFileName() + ": " + (Files.exists(target, LinkOption.NOFOLLOW_LINKS)
                        ? "not a regular file" : "NoSuchFileException"));
                continue;
            }
            try {
                Files.delete(target);
                log.info("Deleted log file {}", target);
            } catch (IOException e) {
                log.warn("Could not delete log file {}: {}", target, e.toString());
                failed.add(target.getFileName() + ": " + e.getClass().getSimpleName());
            }
        }

        if (!failed.isEmpty()) {
            throw new LogFileException("Some files could not be deleted", failed);
        }
    }

    private Path ensureDirectory() {
        Path directory = properties.getDirectoryPath();
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new LogFileException("Failed to create log directory: " + directory, e);
        }
    }

    private Path resolveInDirectory(String fileName) {
        Path directory = ensureDirectory().toAbsolutePath().normalize();
        String name = sanitizeFileName(fileName);
        Path resolved = directory.resolve(name).normalize();
        if (!directory.equals(resolved.getParent())) {
            throw new InvalidFileNameException(fileName);
        }
        return resolved;
    }

    private static String sanitizeFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new InvalidFileNameException(String.valueOf(fileName));
        }
        String trimmed = fileName.trim();
        if (trimmed.contains("/") || trimmed.contains("\\") || trimmed.equals(".") || trimmed.equals("..")) {
            throw new InvalidFileNameException(fileName);
        }
        return trimmed;
    }

    private static String stripDirectories(String fileName) {
        if (fileName == null) {
            return null;
        }
        int separator = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        return separator >= 0 ? fileName.substring(separator + 1) : fileName;
    }

    private static LogFileInfo describe(Path file, boolean withDetails) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            LogFileInfo.LogFileInfoBuilder builder = LogFileInfo.builder()
                    .name(file.getFileName().toString())
                    .size(attributes.size())
                    .lastModified(attributes.lastModifiedTime().toInstant());
            if (withDetails) {
                builder.path(file.toString())
                        .created(attributes.creationTime().toInstant())
                        .directory(attributes.isDirectory());
            }
            return builder.build();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
