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

import io.github.flanglet.volz.ChunkSink;
import io.github.flanglet.volz.ChunkSource;


/**
 * In memory chunked volume. It serves as the source when compressing a volume
 * already loaded in memory and as the sink when decompressing into memory.
 */
public class ArrayChunkSource implements ChunkSource, ChunkSink {
    private final byte[][] chunks;
    private final int chunkDim;
    private final int chunkCountX;
    private final int chunkCountY;
    private final int chunkCountZ;


    /**
     * Creates a zero filled volume.
     */
    public ArrayChunkSource(int chunkDim, int chunkCountX, int chunkCountY, int chunkCountZ) {
        if ((chunkDim <= 0) || (chunkDim > ContainerHeader.MAX_CHUNK_DIM))
            throw new IllegalArgumentException("Invalid chunk dimension: " + chunkDim);

        if ((chunkCountX <= 0) || (chunkCountY <= 0) || (chunkCountZ <= 0))
            throw new IllegalArgumentException("Invalid chunk counts: " + chunkCountX + "x" + chunkCountY + "x" + chunkCountZ);

        this.chunkDim = chunkDim;
        this.chunkCountX = chunkCountX;
        this.chunkCountY = chunkCountY;
        this.chunkCountZ = chunkCountZ;
        this.chunks = new byte[this.getChunkCount()][this.getChunkSize()];
    }


    /**
     * Splits a dense volume (voxel (x,y,z) at {@code x + width*(y + height*z)})
     * into chunks. Voxels of boundary chunks outside the extents are set to 0.
     *
     * @param voxels the dense voxels
     * @param width the extent along x
     * @param height the extent along y
     * @param depth the extent along z
     * @param chunkDim the chunk edge length
     * @return the chunked volume
     */
    public static ArrayChunkSource fromVoxels(byte[] voxels, int width, int height, int depth, int chunkDim) {
        if (voxels.length < (long) width * height * depth)
            throw new IllegalArgumentException("Not enough voxels: " + voxels.length);

        ArrayChunkSource res = new ArrayChunkSource(chunkDim,
            ContainerHeader.getChunkCount(width, chunkDim),
            ContainerHeader.getChunkCount(height, chunkDim),
            ContainerHeader.getChunkCount(depth, chunkDim));

        for (int i = 0; i < res.chunks.length; i++) {
            final byte[] chunk = res.chunks[i];
            final int x0 = (i % res.chunkCountX) * chunkDim;
            final int y0 = ((i / res.chunkCountX) % res.chunkCountY) * chunkDim;
            final int z0 = (i / (res.chunkCountX * res.chunkCountY)) * chunkDim;
            final int w = Math.min(chunkDim, width - x0);
            int idx = 0;

            for (int z = z0; z < z0 + chunkDim; z++) {
                for (int y = y0; y < y0 + chunkDim; y++, idx += chunkDim) {
                    if ((z >= depth) || (y >= height))
                        continue;

                    System.arraycopy(voxels, x0 + width * (y + height * z), chunk, idx, w);
                }
            }
        }

        return res;
    }


    @Override
    public int getChunkDim() {
        return this.chunkDim;
    }


    @Override
    public int getChunkCountX() {
        return this.chunkCountX;
    }


    @Override
    public int getChunkCountY() {
        return this.chunkCountY;
    }


    @Override
    public int getChunkCountZ() {
        return this.chunkCountZ;
    }


    @Override
    public byte[] getChunkBytes(int index) {
        return this.chunks[index].clone();
    }


    @Override
    public void putChunk(int index, byte[] data, int off, int len) {
        if (len != this.chunks[index].length)
            throw new IllegalArgumentException("Invalid chunk length: " + len + " (expected " + this.chunks[index].length + ")");

        System.arraycopy(data, off, this.chunks[index], 0, len);
    }
}
