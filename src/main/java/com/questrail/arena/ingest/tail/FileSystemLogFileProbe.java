package com.questrail.arena.ingest.tail;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Arrays;
import java.util.Optional;

/**
 * NIO implementation of {@link LogFileProbe}.
 */
public final class FileSystemLogFileProbe implements LogFileProbe {

    public static final FileSystemLogFileProbe INSTANCE = new FileSystemLogFileProbe();

    private FileSystemLogFileProbe() {}

    @Override
    public Optional<LogFileStat> stat(Path path) throws IOException {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }

        Object fileKey = attrs.fileKey();
        FileIdentity identity = fileKey != null
                ? FileIdentity.of(fileKey)
                : new FileIdentity(path.toAbsolutePath() + "@" + attrs.creationTime().toMillis());
        return Optional.of(new LogFileStat(attrs.size(), identity));
    }

    @Override
    public byte[] read(Path path, long offset, int length) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(length);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long pos = offset;
            while (buf.hasRemaining()) {
                int n = channel.read(buf, pos);
                if (n < 0) {
                    break;
                }
                pos += n;
            }
        }
        return buf.position() == length ? buf.array() : Arrays.copyOf(buf.array(), buf.position());
    }
}
