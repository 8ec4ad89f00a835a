package com.dcgraph.index;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binary snapshot of a {@link GraphIndex}.
 *
 * <pre>
 * int magic ("DCGX"), int version,
 * call section, dependency section
 * section := int entries, entries * (string key, int values, values * string)
 * string  := int byteLength, UTF-8 bytes
 * </pre>
 *
 * All integers are big-endian.
 */
public class IndexStore {
    private static final Logger log = LoggerFactory.getLogger(IndexStore.class);

    public static final int MAGIC = 0x44434758;
    public static final int FORMAT_VERSION = 1;

    public void save(GraphIndex index, Path path) throws IOException {
        byte[] image = encode(index);
        Path absolute = path.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }

        Path temp = absolute.resolveSibling(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(temp, image, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Wrote {} bytes to {}", image.length, absolute);
    }

    public GraphIndex load(Path path) throws IOException {
        byte[] image = Files.readAllBytes(path);
        DataInputStream in = new DataInputStream(new ByteArrayInputStream(image));
        GraphIndexBuilder builder = new GraphIndexBuilder();
        try {
            int magic = in.readInt();
            if (magic != MAGIC) {
                throw new CorruptIndexException(path, "bad magic 0x%08X".formatted(magic));
            }
            int version = in.readInt();
            if (version != FORMAT_VERSION) {
                throw new CorruptIndexException(path, "unsupported format version " + version);
            }
            readSection(in, path, builder::appendCallEntry);
            readSection(in, path, builder::appendDependencyEntry);
            if (in.available() > 0) {
                throw new CorruptIndexException(path, in.available() + " trailing bytes after last section");
            }
        } catch (EOFException e) {
            throw new CorruptIndexException(path, "unexpected end of file", e);
        }
        if (!builder.isTransposeConsistent()) {
            throw new CorruptIndexException(path, "dependency section is not the transpose of the call section");
        }
        GraphIndex index = builder.build();
        log.debug("Loaded {} from {}", index, path);
        return index;
    }

    public boolean delete(Path path) throws IOException {
        return Files.deleteIfExists(path);
    }

    static byte[] encode(GraphIndex index) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(MAGIC);
            out.writeInt(FORMAT_VERSION);
            writeSection(out, index.callMap());
            writeSection(out, index.dependencyMap());
        }
        return bytes.toByteArray();
    }

    private static void writeSection(DataOutputStream out, Map<String, List<String>> section) throws IOException {
        out.writeInt(section.size());
        for (Map.Entry<String, List<String>> entry : section.entrySet()) {
            writeString(out, entry.getKey());
            out.writeInt(entry.getValue().size());
            for (String value : entry.getValue()) {
                writeString(out, value);
            }
        }
    }

    private static void writeString(DataOutputStream out, String value) throws IOException {
        byte[] encoded = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(encoded.length);
        out.write(encoded);
    }

    private static void readSection(DataInputStream in, Path path, SectionSink sink) throws IOException {
        int entries = readCount(in, path, "entry count");
        for (int i = 0; i < entries; i++) {
            String key = readString(in, path);
            int values = readCount(in, path, "value count");
            List<String> list = new ArrayList<>(Math.min(values, 1024));
            for (int j = 0; j < values; j++) {
                list.add(readString(in, path));
            }
            sink.accept(key, list);
        }
    }

    private static int readCount(DataInputStream in, Path path, String what) throws IOException {
        int count = in.readInt();
        if (count < 0) {
            throw new CorruptIndexException(path, "negative " + what + " " + count);
        }
        return count;
    }

    private static String readString(DataInputStream in, Path path) throws IOException {
        int length = readCount(in, path, "string length");
        if (length > in.available()) {
            throw new CorruptIndexException(path, "string length " + length + " exceeds remaining " + in.available() + " bytes");
        }
        byte[] encoded = new byte[length];
        in.readFully(encoded);
        return new String(encoded, StandardCharsets.UTF_8);
    }

    @FunctionalInterface
    private interface SectionSink {
        void accept(String key, List<String> values);
    }
}
