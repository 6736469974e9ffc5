/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.volz.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import io.github.flanglet.volz.Error;


/**
 * Reads and writes the fixed layout header of a compressed volume container.
 * <p>
 * Layout (little endian):
 * <pre>
 * signature        5 bytes  "CTS3D"
 * version          int32    1
 * width            int32
 * height           int32
 * depth            int32
 * chunkDim         int32
 * pixelSize        float64
 * hasLabels        1 byte
 * compressionLevel int32
 * predictive       1 byte
 * runLength        1 byte
 * </pre>
 * The header is followed by the volume chunk count and the chunk records.
 */
public final class HeaderCodec {
    public static final byte[] SIGNATURE = "CTS3D".getBytes(StandardCharsets.US_ASCII);
    public static final int VERSION = 1;
    public static final int HEADER_SIZE = 40;


    private HeaderCodec() {
    }


    public static void write(OutputStream os, ContainerHeader header) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(SIGNATURE);
        buf.putInt(VERSION);
        buf.putInt(header.getWidth());
        buf.putInt(header.getHeight());
        buf.putInt(header.getDepth());
        buf.putInt(header.getChunkDim());
        buf.putDouble(header.getPixelSize());
        buf.put((byte) (header.hasLabels() ? 1 : 0));
        buf.putInt(header.getCompressionLevel());
        buf.put((byte) (header.usePredictiveCoding() ? 1 : 0));
        buf.put((byte) (header.useRunLengthEncoding() ? 1 : 0));
        os.write(buf.array(), 0, HEADER_SIZE);
    }


    /**
     * Reads and validates a container header. The signature is checked first,
     * then the version, then the geometry.
     *
     * @param is the input stream positioned at the start of the container
     * @return the decoded header
     * @throws VolumeIOException with ERR_INVALID_SIGNATURE, ERR_STREAM_VERSION,
     *         ERR_INVALID_FILE or ERR_READ_FILE (truncated header)
     * @throws IOException if the stream cannot be read
     */
    public static ContainerHeader read(InputStream is) throws IOException {
        byte[] bytes = new byte[HEADER_SIZE];
        readFully(is, bytes, 0, HEADER_SIZE, "container header");

        if (Arrays.equals(bytes, 0, SIGNATURE.length, SIGNATURE, 0, SIGNATURE.length) == false)
            throw new VolumeIOException("Invalid container signature (not a compressed volume)",
                Error.ERR_INVALID_SIGNATURE);

        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        buf.position(SIGNATURE.length);
        final int version = buf.getInt();

        if (version != VERSION)
            throw new VolumeIOException("Unsupported container version: " + version + " (expected " + VERSION + ")",
                Error.ERR_STREAM_VERSION);

        final int width = buf.getInt();
        final int height = buf.getInt();
        final int depth = buf.getInt();
        final int chunkDim = buf.getInt();
        final double pixelSize = buf.getDouble();
        final boolean hasLabels = buf.get() != 0;
        final int level = buf.getInt();
        final boolean predictive = buf.get() != 0;
        final boolean rle = buf.get() != 0;

        try {
            return new ContainerHeader(width, height, depth, chunkDim, pixelSize, hasLabels, level, predictive, rle);
        }
        catch (IllegalArgumentException e) {
            throw new VolumeIOException("Invalid container header: " + e.getMessage(), e, Error.ERR_INVALID_FILE);
        }
    }


    public static void writeInt32(OutputStream os, int value) throws IOException {
        os.write(value);
        os.write(value >>> 8);
        os.write(value >>> 16);
        os.write(value >>> 24);
    }


    public static int readInt32(InputStream is) throws IOException {
        byte[] buf = new byte[4];
        readFully(is, buf, 0, 4, "integer");
        return (buf[0] & 0xFF) | ((buf[1] & 0xFF) << 8) | ((buf[2] & 0xFF) << 16) | ((buf[3] & 0xFF) << 24);
    }


    /**
     * Reads exactly len bytes.
     *
     * @throws VolumeIOException with ERR_READ_FILE on a premature end of stream
     */
    static void readFully(InputStream is, byte[] buf, int off, int len, String what) throws IOException {
        final int n = is.readNBytes(buf, off, len);

        if (n != len)
            throw new VolumeIOException("Unexpected end of stream while reading " + what + ": got " + n
                + " bytes, expected " + len, Error.ERR_READ_FILE);
    }
}
