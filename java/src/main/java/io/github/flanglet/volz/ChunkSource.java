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

package io.github.flanglet.volz;

import java.io.IOException;


/**
 * Random access to the cubic chunks of a volume. Chunk {@code i} covers the
 * chunk coordinates {@code (i % cx, (i / cx) % cy, i / (cx * cy))} and is
 * always {@code chunkDim^3} bytes long, boundary chunks included.
 * <p>
 * Implementations must support concurrent calls to {@link #getChunkBytes(int)}
 * with distinct indexes.
 */
public interface ChunkSource {

    public int getChunkDim();

    public int getChunkCountX();

    public int getChunkCountY();

    public int getChunkCountZ();

    /**
     * @return the total number of chunks
     */
    public default int getChunkCount() {
        return this.getChunkCountX() * this.getChunkCountY() * this.getChunkCountZ();
    }

    /**
     * @return the size in bytes of one chunk
     */
    public default int getChunkSize() {
        final int dim = this.getChunkDim();
        return dim * dim * dim;
    }

    /**
     * Returns a copy of the bytes of one chunk, in z, y, x scan order.
     *
     * @param index the chunk index in [0..getChunkCount())
     * @return a new array of {@code getChunkSize()} bytes
     * @throws IOException if the chunk cannot be read
     */
    public byte[] getChunkBytes(int index) throws IOException;
}
