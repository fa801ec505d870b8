// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.watch;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.ConcurrentHashMap;
import kiln.config.SiteSettings;
import kiln.util.SneakyThrow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches the source tree and the project settings for changes, on a thread of its own.
 * <p>
 * Directories created after the watcher started are watched as they appear. Changes inside the target directory
 * are ignored, since every build pass makes some.
 */
public final class SourceWatcher implements AutoCloseable {
    /**
     * Starts watching. The listener is called from the watcher thread for every relevant batch of changes.
     *
     * @throws IOException If the watch service cannot be set up.
     */
    public SourceWatcher(final SiteSettings settings, final Runnable listener) throws IOException {
        projectDirectory = settings.projectDirectory().toAbsolutePath().normalize();
        sourceRoot = settings.sourceDirectory().toAbsolutePath().normalize();
        excludedDirectory = settings.targetDirectory().toAbsolutePath().normalize();
        this.listener = listener;
        watchService = FileSystems.getDefault().newWatchService();
        register(projectDirectory);
        registerTree(sourceRoot);
        thread = new Thread(this::run, "source-watcher");
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void close() throws IOException {
        watchService.close();
        try {
            thread.join();
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    private void run() {
        while (true) {
            final WatchKey key;
            try {
                key = watchService.take();
            } catch (final InterruptedException | ClosedWatchServiceException e) {
                return;
            }
            final var directory = directories.get(key);
            boolean relevant = false;
            if (directory != null) {
                for (final var event : key.pollEvents()) {
                    relevant |= handleEvent(directory, event);
                }
            }
            if (!key.reset()) {
                directories.remove(key);
            }
            if (relevant) {
                listener.run();
            }
        }
    }

    private boolean handleEvent(final Path directory, final WatchEvent<?> event) {
        if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
            return true;
        }
        if (!(event.context() instanceof final Path name)) {
            return false;
        }
        final var changed = directory.resolve(name);
        if (changed.startsWith(excludedDirectory)) {
            return false;
        }
        if (directory.equals(projectDirectory) && !changed.startsWith(sourceRoot)
            && !name.toString().equals(SiteSettings.settingsFileName)) {
            return false;
        }
        if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(changed)
            && changed.startsWith(sourceRoot)) {
            try {
                registerTree(changed);
            } catch (final IOException e) {
                logger.warn("Cannot watch new directory {}", changed, e);
            }
        }
        logger.debug("{} {}", event.kind().name(), changed);
        return true;
    }

    private void registerTree(final Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path directory, final BasicFileAttributes attributes)
                throws IOException {
                if (directory.startsWith(excludedDirectory)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                register(directory);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void register(final Path directory) throws IOException {
        final var key = directory.register(
            watchService,
            StandardWatchEventKinds.ENTRY_CREATE,
            StandardWatchEventKinds.ENTRY_DELETE,
            StandardWatchEventKinds.ENTRY_MODIFY
        );
        directories.put(key, directory);
    }

    private final Path projectDirectory;
    private final Path sourceRoot;
    private final Path excludedDirectory;
    private final Runnable listener;
    private final WatchService watchService;
    private final ConcurrentHashMap<WatchKey, Path> directories = new ConcurrentHashMap<>();
    private final Thread thread;

    private static final Logger logger = LoggerFactory.getLogger(SourceWatcher.class);
}
