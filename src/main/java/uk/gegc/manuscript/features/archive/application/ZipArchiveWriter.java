package uk.gegc.manuscript.features.archive.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.manuscript.features.archive.domain.ZipEncodingException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.zip.CRC32;
import java.util.zip.Deflater;

/**
 * Builds a ZIP archive in memory.
 * <p>
 * Entries are written in the order they are added. Each call appends the local file header and
 * data to the local-entry buffer and, at the same time, the matching central directory record
 * (whose offset is the local buffer size before the append). {@link #finish()} concatenates the
 * two buffers and the end-of-central-directory record.
 * <p>
 * No Zip64, extra fields, comments or encryption. A writer is single-use and not thread-safe.
 */
@Slf4j
public class ZipArchiveWriter {

    static final int LOCAL_FILE_HEADER_SIGNATURE = 0x04034b50;
    static final int CENTRAL_DIRECTORY_SIGNATURE = 0x02014b50;
    static final int END_OF_CENTRAL_DIRECTORY_SIGNATURE = 0x06054b50;

    private static final int METHOD_STORED = 0;
    private static final int METHOD_DEFLATED = 8;
    private static final int VERSION_STORED = 10;
    private static final int VERSION_DEFLATED = 20;
    private static final int VERSION_MADE_BY = 20;
    private static final int FLAG_UTF8_NAME = 1 << 11;

    private final ByteArrayOutputStream localEntries = new ByteArrayOutputStream();
    private final ByteArrayOutputStream centralDirectory = new ByteArrayOutputStream();
    private final int dosTime;
    private final int dosDate;
    private final int compressionLevel;
    private int entryCount;
    private boolean finished;

    public ZipArchiveWriter(Clock clock) {
        this(clock, Deflater.DEFAULT_COMPRESSION);
    }

    public ZipArchiveWriter(Clock clock, int compressionLevel) {
        LocalDateTime now = LocalDateTime.now(clock);
        this.dosTime = dosTime(now);
        this.dosDate = dosDate(now);
        this.compressionLevel = compressionLevel;
    }

    /**
     * Adds a UTF-8 text entry, compressed when that makes it smaller.
     */
    public ZipArchiveWriter addEntry(String path, String content) {
        return addEntry(path, content, true);
    }

    public ZipArchiveWriter addEntry(String path, String content, boolean compress) {
        return addEntry(path, encode(content, "content of " + path), compress);
    }

    /**
     * Appends an entry. With {@code compress} set, the data is deflated and kept compressed only
     * if the result is strictly smaller than the input; otherwise it is stored.
     */
    public ZipArchiveWriter addEntry(String path, byte[] data, boolean compress) {
        if (finished) {
            throw new IllegalStateException("Archive already finished");
        }
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Entry path cannot be null or empty");
        }
        byte[] name = encode(path, "entry name " + path);
        byte[] payload = data != null ? data : new byte[0];
        int crc = (int) crc32(payload);

        byte[] compressed = compress ? deflate(payload) : null;
        boolean deflated = compressed != null;
        byte[] stored = deflated ? compressed : payload;
        int method = deflated ? METHOD_DEFLATED : METHOD_STORED;
        int versionNeeded = deflated ? VERSION_DEFLATED : VERSION_STORED;
        int flags = isAscii(path) ? 0 : FLAG_UTF8_NAME;
        int localHeaderOffset = localEntries.size();

        writeInt(localEntries, LOCAL_FILE_HEADER_SIGNATURE);
        writeShort(localEntries, versionNeeded);
        writeShort(localEntries, flags);
        writeShort(localEntries, method);
        writeShort(localEntries, dosTime);
        writeShort(localEntries, dosDate);
        writeInt(localEntries, crc);
        writeInt(localEntries, stored.length);
        writeInt(localEntries, payload.length);
        writeShort(localEntries, name.length);
        writeShort(localEntries, 0);
        localEntries.writeBytes(name);
        localEntries.writeBytes(stored);

        writeInt(centralDirectory, CENTRAL_DIRECTORY_SIGNATURE);
        writeShort(centralDirectory, VERSION_MADE_BY);
        writeShort(centralDirectory, versionNeeded);
        writeShort(centralDirectory, flags);
        writeShort(centralDirectory, method);
        writeShort(centralDirectory, dosTime);
        writeShort(centralDirectory, dosDate);
        writeInt(centralDirectory, crc);
        writeInt(centralDirectory, stored.length);
        writeInt(centralDirectory, payload.length);
        writeShort(centralDirectory, name.length);
        writeShort(centralDirectory, 0); // extra field length
        writeShort(centralDirectory, 0); // comment length
        writeShort(centralDirectory, 0); // disk number start
        writeShort(centralDirectory, 0); // internal attributes
        writeInt(centralDirectory, 0);   // external attributes
        writeInt(centralDirectory, localHeaderOffset);
        centralDirectory.writeBytes(name);

        entryCount++;
        log.debug("Added ZIP entry {} ({} -> {} bytes, method {})", path, payload.length, stored.length, method);
        return this;
    }

    /**
     * Completes the archive and returns its bytes. The writer cannot be used afterwards.
     */
    public byte[] finish() {
        if (finished) {
            throw new IllegalStateException("Archive already finished");
        }
        finished = true;

        int centralDirectoryOffset = localEntries.size();
        int centralDirectorySize = centralDirectory.size();

        ByteArrayOutputStream archive = new ByteArrayOutputStream(
                centralDirectoryOffset + centralDirectorySize + 22);
        archive.writeBytes(localEntries.toByteArray());
        archive.writeBytes(centralDirectory.toByteArray());

        writeInt(archive, END_OF_CENTRAL_DIRECTORY_SIGNATURE);
        writeShort(archive, 0); // this disk
        writeShort(archive, 0); // disk with central directory
        writeShort(archive, entryCount);
        writeShort(archive, entryCount);
        writeInt(archive, centralDirectorySize);
        writeInt(archive, centralDirectoryOffset);
        writeShort(archive, 0); // comment length

        log.debug("Finished ZIP archive with {} entries ({} bytes)", entryCount, archive.size());
        return archive.toByteArray();
    }

    public int entryCount() {
        return entryCount;
    }

    /**
     * CRC-32 (polynomial 0xEDB88320) of the given bytes.
     */
    public static long crc32(byte[] data) {
        CRC32 crc = new CRC32();
        crc.update(data, 0, data.length);
        return crc.getValue();
    }

    static int dosTime(LocalDateTime time) {
        return (time.getHour() << 11) | (time.getMinute() << 5) | (time.getSecond() / 2);
    }

    static int dosDate(LocalDateTime time) {
        int year = Math.max(time.getYear(), 1980);
        return ((year - 1980) << 9) | (time.getMonthValue() << 5) | time.getDayOfMonth();
    }

    /**
     * Raw DEFLATE (no zlib header). Returns {@code null} when the output would not be smaller.
     */
    private byte[] deflate(byte[] data) {
        if (data.length == 0) {
            return null;
        }
        Deflater deflater = new Deflater(compressionLevel, true);
        try {
            deflater.setInput(data);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length);
            byte[] buffer = new byte[8192];
            while (!deflater.finished()) {
                int written = deflater.deflate(buffer);
                out.write(buffer, 0, written);
                if (out.size() >= data.length) {
                    return null;
                }
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static byte[] encode(String text, String what) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer buffer = encoder.encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new ZipEncodingException("Cannot encode " + what + " as UTF-8", e);
        }
    }

    private static boolean isAscii(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) > 0x7f) {
                return false;
            }
        }
        return true;
    }

    private static void writeShort(ByteArrayOutputStream out, int value) {
        out.write(value & 0xff);
        out.write((value >>> 8) & 0xff);
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        out.write(value & 0xff);
        out.write((value >>> 8) & 0xff);
        out.write((value >>> 16) & 0xff);
        out.write((value >>> 24) & 0xff);
    }
}
