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
import io.github.flanglet.volz.Error;


/**
 * Header of a raw (uncompressed) volume container. The header is followed by
 * {@code chunkCount} chunks of {@code chunkDim^3} bytes, chunk {@code i} being
 * located at {@code HEADER_SIZE + i * chunkDim^3}.
 * <p>
 * Layout (little endian): width, height, depth, chunkDim, bitsPerPixel
 * (int32), pixelSize (float64), chunkCountX, chunkCountY, chunkCountZ (int32).
 * Legacy containers with a 28-byte header (seven int32 fields, without
 * bitsPerPixel and pixelSize) are not supported and cannot be read.
 */
public final class VolumeHeader {
    public static final int HEADER_SIZE = 40;
    public static final int DEFAULT_BITS_PER_PIXEL = 8;

    private final int width;
    private final int height;
    private final int depth;
    private final int chunkDim;
    private final int bitsPerPixel;
    private final double pixelSize;
    private final int chunkCountX;
    private final int chunkCountY;
    private final int chunkCountZ;


    /**
     * Creates a header whose chunk counts cover the extents.
     */
    public VolumeHeader(int width, int height, int depth, int chunkDim, int bitsPerPixel, double pixelSize) {
        this(width, height, depth, chunkDim, bitsPerPixel, pixelSize,
            ContainerHeader.getChunkCount(width, chunkDim),
            ContainerHeader.getChunkCount(height, chunkDim),
            ContainerHeader.getChunkCount(depth, chunkDim));
    }


    public VolumeHeader(int width, int height, int depth, int chunkDim, int bitsPerPixel, double pixelSize,
        int chunkCountX, int chunkCountY, int chunkCountZ) {
        if ((width <= 0) || (height <= 0) || (depth <= 0))
            throw new IllegalArgumentException("Invalid volume extents: " + width + "x" + height + "x" + depth);

        if ((chunkDim <= 0) || (chunkDim > ContainerHeader.MAX_CHUNK_DIM))
            throw new IllegalArgumentException("Invalid chunk dimension: " + chunkDim);

        if ((chunkCountX <= 0) || (chunkCountY <= 0) || (chunkCountZ <= 0))
            throw new IllegalArgumentException("Invalid chunk counts: " + chunkCountX + "x" + chunkCountY + "x" + chunkCountZ);

        this.width = width;
        this.height = height;
        this.depth = depth;
        this.chunkDim = chunkDim;
        this.bitsPerPixel = bitsPerPixel;
        this.pixelSize = pixelSize;
        this.chunkCountX = chunkCountX;
        this.chunkCountY = chunkCountY;
        this.chunkCountZ = chunkCountZ;
    }


    public static VolumeHeader read(InputStream is) throws IOException {
        byte[] bytes = new byte[HEADER_SIZE];
        HeaderCodec.readFully(is, bytes, 0, HEADER_SIZE, "volume header");
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        final int w = buf.getInt();
        final int h = buf.getInt();
        final int d = buf.getInt();
        final int dim = buf.getInt();
        final int bpp = buf.getInt();
        final double ps = buf.getDouble();
        final int cx = buf.getInt();
        final int cy = buf.getInt();
        final int cz = buf.getInt();

        try {
            return new VolumeHeader(w, h, d, dim, bpp, ps, cx, cy, cz);
        }
        catch (IllegalArgumentException e) {
            throw new VolumeIOException("Invalid volume header: " + e.getMessage(), e, Error.ERR_INVALID_FILE);
        }
    }


    public void write(OutputStream os) throws IOException {
        os.write(this.toBytes());
    }


    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(this.width);
        buf.putInt(this.height);
        buf.putInt(this.depth);
        buf.putInt(this.chunkDim);
        buf.putInt(this.bitsPerPixel);
        buf.putDouble(this.pixelSize);
        buf.putInt(this.chunkCountX);
        buf.putInt(this.chunkCountY);
        buf.putInt(this.chunkCountZ);
        return buf.array();
    }


    public int getWidth() {
        return this.width;
    }


    public int getHeight() {
        return this.height;
    }


    public int getDepth() {
        return this.depth;
    }


    public int getChunkDim() {
        return this.chunkDim;
    }


    public int getBitsPerPixel() {
        return this.bitsPerPixel;
    }


    public double getPixelSize() {
        return this.pixelSize;
    }


    public int getChunkCountX() {
        return this.chunkCountX;
    }


    public int getChunkCountY() {
        return this.chunkCountY;
    }


    public int getChunkCountZ() {
        return this.chunkCountZ;
    }


    public int getChunkCount() {
        return this.chunkCountX * this.chunkCountY * this.chunkCountZ;
    }


    public int getChunkSize() {
        return this.chunkDim * this.chunkDim * this.chunkDim;
    }


    /**
     * @return the size of the raw container (header included)
     */
    public long getFileSize() {
        return HEADER_SIZE + (long) this.getChunkCount() * this.getChunkSize();
    }
}
