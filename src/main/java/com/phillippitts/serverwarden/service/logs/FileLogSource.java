package com.phillippitts.serverwarden.service.logs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Follows a growing log file by byte offset.
 *
 * <p>Behavior:
 * <ul>
 *   <li>Only complete lines are returned; a trailing line without newline (still being written)
 *       stays in the file and is returned once its newline arrives</li>
 *   <li>A file shorter than the current offset was truncated or rotated; reading restarts at 0</li>
 *   <li>Bytes that are not valid UTF-8 are replaced, never rejected</li>
 *   <li>At most {@link #MAX_READ_BYTES} are consumed per poll so a huge backlog cannot stall a tick</li>
 * </ul>
 */
public final class FileLogSource implements LogSource {

    private static final Logger LOG = LogManager.getLogger(FileLogSource.class);

    static final int MAX_READ_BYTES = 1_048_576;
    private static final int TAIL_READ_BYTES = 262_144;

    private final Path file;
    private long offset;
    private boolean missingLogged;

    public FileLogSource(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public List<String> pollNewLines() {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            missingLogged = false;
            long size = channel.size();
            if (size < offset) {
                LOG.info("Log file {} shrank from {} to {} bytes; assuming rotation", file, offset, size);
                offset = 0;
            }
            if (size == offset) {
                return Collections.emptyList();
            }
            int toRead = (int) Math.min(MAX_READ_BYTES, size - offset);
            byte[] bytes = read(channel, offset, toRead);
            int lastNewline = lastIndexOf(bytes, (byte) '\n');
            if (lastNewline < 0) {
                if (toRead == MAX_READ_BYTES) {
                    // a single line longer than the read window; drop it rather than stall
                    offset += toRead;
                }
                return Collections.emptyList();
            }
            offset += lastNewline + 1;
            return splitLines(bytes, lastNewline + 1);
        } catch (NoSuchFileException e) {
            if (!missingLogged) {
                LOG.warn("Log file {} does not exist (yet)", file);
                missingLogged = true;
            }
            offset = 0;
            return Collections.emptyList();
        } catch (IOException e) {
            LOG.warn("Failed to read log file {}: {}", file, e.toString());
            return Collections.emptyList();
        }
    }

    @Override
    public List<String> recentTail(int maxLines) {
        if (maxLines <= 0 || !Files.isRegularFile(file)) {
            return Collections.emptyList();
        }
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            long start = Math.max(0, size - TAIL_READ_BYTES);
            byte[] bytes = read(channel, start, (int) (size - start));
            int lastNewline = lastIndexOf(bytes, (byte) '\n');
            if (lastNewline < 0) {
                return Collections.emptyList();
            }
            List<String> lines = splitLines(bytes, lastNewline + 1);
            if (start > 0 && !lines.isEmpty()) {
                // first line was cut by the read window
                lines = lines.subList(1, lines.size());
            }
            int from = Math.max(0, lines.size() - maxLines);
            return new ArrayList<>(lines.subList(from, lines.size()));
        } catch (IOException e) {
            LOG.warn("Failed to read tail of log file {}: {}", file, e.toString());
            return Collections.emptyList();
        }
    }

    @Override
    public void seekToEnd() {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            long start = Math.max(0, size - TAIL_READ_BYTES);
            byte[] bytes = read(channel, start, (int) (size - start));
            int lastNewline = lastIndexOf(bytes, (byte) '\n');
            offset = lastNewline < 0 ? start : start + lastNewline + 1;
        } catch (IOException e) {
            LOG.debug("Cannot seek to end of {}: {}", file, e.toString());
            offset = 0;
        }
    }

    /** Visible for tests */
    long offset() {
        return offset;
    }

    private static byte[] read(FileChannel channel, long position, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        long pos = position;
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, pos);
            if (n < 0) {
                break;
            }
            pos += n;
        }
        byte[] out = new byte[buffer.position()];
        buffer.flip();
        buffer.get(out);
        return out;
    }

    private static int lastIndexOf(byte[] bytes, byte value) {
        for (int i = bytes.length - 1; i >= 0; i--) {
            if (bytes[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> splitLines(byte[] bytes, int length) {
        String text = decode(bytes, length);
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            String trimmed = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
            lines.add(trimmed);
        }
        // split leaves an empty element after the final newline
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static String decode(byte[] bytes, int length) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes, 0, length)).toString();
        } catch (CharacterCodingException e) {
            // cannot happen with REPLACE
            return new String(bytes, 0, length, StandardCharsets.UTF_8);
        }
    }
}
