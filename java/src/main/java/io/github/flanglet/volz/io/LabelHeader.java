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
 * Label geometry: chunk dimension and chunk counts (4 x int32, little endian).
 * It is the header of a raw label container and the sub-header preceding the
 * label records of a compressed container.
 */
public final class LabelHeader {
    public static final int HEADER_SIZE = 16;

    private final int chunkDim;
    private final int chunkCountX;
    private final int chunkCountY;
    private final int chunkCountZ;


    public LabelHeader(int chunkDim, int chunkCountX, int chunkCountY, int chunkCountZ) {
        if ((chunkDim <= 0) || (chunkDim > ContainerHeader.MAX_CHUNK_DIM))
            throw new IllegalArgumentException("Invalid label chunk dimension: " + chunkDim);

        if ((chunkCountX <= 0) || (chunkCountY <= 0) || (chunkCountZ <= 0))
            throw new IllegalArgumentException("Invalid label chunk counts: " + chunkCountX + "x" + chunkCountY + "x" + chunkCountZ);

        this.chunkDim = chunkDim;
        this.chunkCountX = chunkCountX;
        this.chunkCountY = chunkCountY;
        this.chunkCountZ = chunkCountZ;
    }


    public static LabelHeader read(InputStream is) throws IOException {
        byte[] bytes = new byte[HEADER_SIZE];
        HeaderCodec.readFully(is, bytes, 0, HEADER_SIZE, "label header");
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);

        try {
            return new LabelHeader(buf.getInt(), buf.getInt(), buf.getInt(), buf.getInt());
        }
        catch (IllegalArgumentException e) {
            throw new VolumeIOException("Invalid label header: " + e.getMessage(), e, Error.ERR_INVALID_FILE);
        }
    }


    public void write(OutputStream os) throws IOException {
        os.write(this.toBytes());
    }


    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(this.chunkDim);
        buf.putInt(this.chunkCountX);
        buf.putInt(this.chunkCountY);
        buf.putInt(this.chunkCountZ);
        return buf.array();
    }


    public int getChunkDim() {
        return this.chunkDim;
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


    public long getFileSize() {
        return HEADER_SIZE + (long) this.getChunkCount() * this.getChunkSize();
    }
}
