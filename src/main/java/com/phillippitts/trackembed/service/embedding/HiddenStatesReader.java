package com.phillippitts.trackembed.service.embedding;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads the tensor file written by the external inference runner.
 *
 * <p>Layout (little-endian): three {@code int32} dimensions {@code layers, time, features}
 * followed by {@code layers * time * features} {@code float32} values in row-major order.
 */
final class HiddenStatesReader {

    static final int HEADER_BYTES = 3 * Integer.BYTES;

    private HiddenStatesReader() {}

    /**
     * @throws IOException if the file cannot be read or its size does not match the header
     */
    static HiddenStates read(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = ch.size();
            if (size < HEADER_BYTES) {
                throw new IOException("Tensor file too small: " + size + " bytes");
            }
            ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
            readFully(ch, header);
            header.flip();
            int layers = header.getInt();
            int time = header.getInt();
            int features = header.getInt();
            if (layers <= 0 || time < 0 || features <= 0) {
                throw new IOException("Invalid tensor shape [" + layers + ", " + time + ", " + features + "]");
            }
            long expected = HEADER_BYTES + (long) layers * time * features * Float.BYTES;
            if (size != expected) {
                throw new IOException("Tensor file size " + size + " does not match shape ["
                        + layers + ", " + time + ", " + features + "] (expected " + expected + ")");
            }

            float[][][] values = new float[layers][time][features];
            ByteBuffer frame = ByteBuffer.allocate(features * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
            for (int l = 0; l < layers; l++) {
                for (int t = 0; t < time; t++) {
                    frame.clear();
                    readFully(ch, frame);
                    frame.flip();
                    frame.asFloatBuffer().get(values[l][t]);
                }
            }
            return new HiddenStates(values);
        }
    }

    private static void readFully(FileChannel ch, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) {
            if (ch.read(buf) < 0) {
                throw new IOException("Unexpected end of tensor file");
            }
        }
    }
}
