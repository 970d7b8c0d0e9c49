package com.phillippitts.trackembed.service.audio;

import com.phillippitts.trackembed.exception.InvalidAudioException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads the header of a normalized WAV file and checks it against the model format.
 *
 * <p>Walks the RIFF chunk list to locate the fmt and data chunks, so files carrying extra
 * chunks (the transcoder writes a LIST/INFO chunk) or an extended fmt chunk are handled.
 * Only chunk headers are read; the PCM payload is skipped.
 */
@Component
public class WavInspector {

    /**
     * Parses the WAV header.
     *
     * @param wav path to a WAV file
     * @return format and payload size
     * @throws InvalidAudioException when the file is not a PCM WAV file or cannot be read
     */
    public WavInfo inspect(Path wav) {
        try (FileChannel channel = FileChannel.open(wav, StandardOpenOption.READ)) {
            long fileSize = channel.size();
            if (fileSize < WavFormat.RIFF_HEADER_SIZE) {
                throw new InvalidAudioException(wav, "File too small for RIFF header ("
                        + WavFormat.RIFF_HEADER_SIZE + " bytes)");
            }

            ByteBuffer riff = read(channel, 0, WavFormat.RIFF_HEADER_SIZE);
            if (!"RIFF".equals(chunkId(riff, 0)) || !"WAVE".equals(chunkId(riff, 8))) {
                throw new InvalidAudioException(wav, "Missing RIFF/WAVE markers");
            }
            return parseChunks(wav, channel, fileSize);
        } catch (IOException e) {
            throw new InvalidAudioException(wav, "Unreadable WAV file: " + e.getMessage(), e);
        }
    }

    /**
     * Parses the header and requires the model format (24 kHz, 16-bit, mono, at most 15 s).
     *
     * @param wav path to a normalized WAV file
     * @return format and payload size
     * @throws InvalidAudioException when the header does not match
     */
    public WavInfo requireModelFormat(Path wav) {
        WavInfo info = inspect(wav);
        if (info.channels() != AudioFormat.MODEL_CHANNELS) {
            throw new InvalidAudioException(wav, "Invalid channel count: " + info.channels()
                    + ". Expected: " + AudioFormat.MODEL_CHANNELS);
        }
        if (info.sampleRate() != AudioFormat.MODEL_SAMPLE_RATE) {
            throw new InvalidAudioException(wav, "Invalid sample rate: " + info.sampleRate()
                    + " Hz. Expected: " + AudioFormat.MODEL_SAMPLE_RATE + " Hz");
        }
        if (info.bitsPerSample() != AudioFormat.MODEL_BITS_PER_SAMPLE) {
            throw new InvalidAudioException(wav, "Invalid bit depth: " + info.bitsPerSample()
                    + "-bit. Expected: " + AudioFormat.MODEL_BITS_PER_SAMPLE + "-bit");
        }
        if (info.frames() == 0) {
            throw new InvalidAudioException(wav, "No audio frames decoded");
        }
        if (!info.matchesModelFormat()) {
            throw new InvalidAudioException(wav, "Audio too long: ~" + info.durationMillis()
                    + " ms. Max: " + AudioFormat.MAX_DURATION_SECONDS * 1000L + " ms");
        }
        return info;
    }

    private WavInfo parseChunks(Path wav, FileChannel channel, long fileSize) throws IOException {
        long offset = WavFormat.RIFF_HEADER_SIZE;
        ByteBuffer fmt = null;

        while (offset + WavFormat.CHUNK_HEADER_SIZE <= fileSize) {
            ByteBuffer header = read(channel, offset, WavFormat.CHUNK_HEADER_SIZE);
            String id = chunkId(header, 0);
            long size = Integer.toUnsignedLong(header.getInt(4));
            long dataStart = offset + WavFormat.CHUNK_HEADER_SIZE;

            if ("fmt ".equals(id)) {
                if (size < WavFormat.FMT_CHUNK_MIN_SIZE || dataStart + size > fileSize) {
                    throw new InvalidAudioException(wav, "Invalid fmt chunk size: " + size);
                }
                fmt = read(channel, dataStart, WavFormat.FMT_CHUNK_MIN_SIZE);
            } else if ("data".equals(id)) {
                if (fmt == null) {
                    throw new InvalidAudioException(wav, "data chunk precedes fmt chunk");
                }
                // Streams written without seeking may leave the size unset; trust the file length
                long available = fileSize - dataStart;
                return toInfo(wav, fmt, Math.min(size, available));
            }

            offset = dataStart + size;
            if (size % 2 == 1) {
                offset++; // chunks are padded to even byte boundaries
            }
        }

        throw new InvalidAudioException(wav, fmt == null ? "Missing fmt chunk in WAV file"
                : "Missing data chunk in WAV file");
    }

    private WavInfo toInfo(Path wav, ByteBuffer fmt, long dataBytes) {
        int audioFormat = Short.toUnsignedInt(fmt.getShort(0));
        int channels = Short.toUnsignedInt(fmt.getShort(2));
        int sampleRate = fmt.getInt(4);
        int bitsPerSample = Short.toUnsignedInt(fmt.getShort(14));

        if (audioFormat != WavFormat.AUDIO_FORMAT_PCM && audioFormat != WavFormat.AUDIO_FORMAT_EXTENSIBLE) {
            throw new InvalidAudioException(wav, "Unsupported audio format: " + audioFormat
                    + " (expected " + WavFormat.AUDIO_FORMAT_PCM + " for PCM)");
        }
        return new WavInfo(sampleRate, channels, bitsPerSample, dataBytes);
    }

    private static ByteBuffer read(FileChannel channel, long position, int length) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        while (buf.hasRemaining()) {
            int n = channel.read(buf, position + buf.position());
            if (n < 0) {
                throw new IOException("Unexpected end of file at offset " + (position + buf.position()));
            }
        }
        buf.flip();
        return buf;
    }

    private static String chunkId(ByteBuffer buf, int offset) {
        byte[] id = new byte[4];
        for (int i = 0; i < 4; i++) {
            id[i] = buf.get(offset + i);
        }
        return new String(id, StandardCharsets.US_ASCII);
    }
}
