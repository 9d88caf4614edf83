package com.phillippitts.serverwarden.service.backup;

import com.phillippitts.serverwarden.config.properties.BackupProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * {@link BackupService} writing timestamped zip archives (or plain directory copies) and pruning
 * the oldest backups beyond the configured limit.
 *
 * <p>Backups are named {@code backup-yyyyMMdd-HHmmss[.zip]}, so lexical order is chronological.
 * A partially written backup is deleted before the failure is reported.
 */
@Component
public class ArchiveBackupService implements BackupService {

    private static final Logger LOG = LogManager.getLogger(ArchiveBackupService.class);

    static final String PREFIX = "backup-";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path backupDirectory;
    private final int maxBackups;
    private final boolean compress;
    private final Clock clock;

    public ArchiveBackupService(BackupProperties props, Clock clock) {
        Objects.requireNonNull(props, "props");
        this.backupDirectory = Paths.get(props.directory());
        this.maxBackups = props.maxBackups();
        this.compress = props.compress();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public BackupResult create(Path sourcePath) {
        if (sourcePath == null || !Files.isDirectory(sourcePath)) {
            LOG.warn("Backup source is not a directory: {}", sourcePath);
            return BackupResult.failed("Backup source is not a directory: " + sourcePath);
        }
        Path target = uniqueTarget();
        long start = System.nanoTime();
        try {
            Files.createDirectories(backupDirectory);
            if (compress) {
                zip(sourcePath, target);
            } else {
                copyTree(sourcePath, target);
            }
        } catch (IOException | UncheckedIOException e) {
            LOG.error("Backup of {} failed: {}", sourcePath, e.toString());
            deleteQuietly(target);
            return BackupResult.failed("Backup failed: " + e.getMessage());
        }
        LOG.info("Backup written to {} in {}ms", target, (System.nanoTime() - start) / 1_000_000);
        prune();
        return BackupResult.ok(target);
    }

    private Path uniqueTarget() {
        String base = PREFIX + STAMP.format(LocalDateTime.now(clock));
        String suffix = compress ? ".zip" : "";
        Path target = backupDirectory.resolve(base + suffix);
        int n = 1;
        while (Files.exists(target)) {
            target = backupDirectory.resolve(base + "-" + n++ + suffix);
        }
        return target;
    }

    private static void zip(Path source, Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target);
             ZipOutputStream zip = new ZipOutputStream(out);
             Stream<Path> files = Files.walk(source)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                String name = source.relativize(file).toString().replace('\\', '/');
                zip.putNextEntry(new ZipEntry(name));
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
    }

    private static void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir)));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file)), StandardCopyOption.COPY_ATTRIBUTES);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Deletes the oldest backups so at most {@code maxBackups} remain.
     */
    void prune() {
        List<Path> backups = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(backupDirectory, PREFIX + "*")) {
            ds.forEach(backups::add);
        } catch (IOException e) {
            LOG.warn("Cannot list backups in {}: {}", backupDirectory, e.toString());
            return;
        }
        if (backups.size() <= maxBackups) {
            return;
        }
        backups.sort(Comparator.comparing(p -> p.getFileName().toString()));
        for (Path old : backups.subList(0, backups.size() - maxBackups)) {
            LOG.info("Removing old backup {}", old.getFileName());
            deleteQuietly(old);
        }
    }

    private static void deleteQuietly(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    LOG.warn("Could not delete {}: {}", p, e.toString());
                }
            });
        } catch (IOException e) {
            LOG.warn("Could not delete {}: {}", path, e.toString());
        }
    }
}
