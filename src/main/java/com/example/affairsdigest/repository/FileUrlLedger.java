/**
 * FileUrlLedger is the file-based implementation of UrlLedger.
 * - Each line of the ledger file is "url\tyyyy-MM-dd HH:mm:ss".
 * - checkAndInsert() holds the instance monitor and an exclusive file lock while it reads and appends,
 *   so neither two workers nor two concurrent runs can both claim the same URL.
 * - If the file cannot be read or written, a warning is logged and the URL is treated as new.
 */

package com.example.affairsdigest.repository;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

public class FileUrlLedger implements UrlLedger {
    private static final DateTimeFormatter OUTPUT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;
    private final Logger logger;

    public FileUrlLedger(Path file, Logger logger) {
        this.file = file;
        this.logger = logger;
    }

    @Override
    public synchronized boolean exists(String url) {
        if (!Files.exists(file)) {
            return false;
        }
        try {
            return readUrls(Files.readString(file, StandardCharsets.UTF_8)).contains(url);
        } catch (IOException e) {
            logger.warning("Failed to read " + file + ", treating URL as new: " + e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized void insert(String url, LocalDateTime processedAt) {
        try (FileChannel channel = openForAppend();
             FileLock ignored = channel.lock()) {
            append(channel, url, processedAt);
        } catch (IOException e) {
            logger.warning("Failed to write to " + file + ": " + e.getMessage());
        }
    }

    @Override
    public synchronized boolean checkAndInsert(String url, LocalDateTime processedAt) {
        try (FileChannel channel = openForAppend();
             FileLock ignored = channel.lock()) {
            channel.position(0);
            String content = new String(Channels.newInputStream(channel).readAllBytes(), StandardCharsets.UTF_8);
            if (readUrls(content).contains(url)) {
                return false;
            }
            append(channel, url, processedAt);
            return true;
        } catch (IOException e) {
            logger.warning("Ledger unavailable (" + e.getMessage() + "), treating " + url + " as new");
            return true;
        }
    }

    private FileChannel openForAppend() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
    }

    private void append(FileChannel channel, String url, LocalDateTime processedAt) throws IOException {
        String line = url + "\t" + OUTPUT_FORMAT.format(processedAt) + "\n";
        channel.position(channel.size());
        ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private static Set<String> readUrls(String content) {
        Set<String> urls = new HashSet<>();
        for (String line : content.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int tab = trimmed.indexOf('\t');
            urls.add(tab >= 0 ? trimmed.substring(0, tab) : trimmed);
        }
        return urls;
    }
}
