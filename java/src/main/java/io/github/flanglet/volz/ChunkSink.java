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
 * Destination of decoded chunks. Each chunk lands at a fixed position derived
 * from its index, so chunks may be stored in any order.
 */
public interface ChunkSink {

    /**
     * Stores one decoded chunk.
     *
     * @param index the chunk index
     * @param data the chunk bytes
     * @param off the offset of the first byte in data
     * @param len the number of bytes (the chunk size)
     * @throws IOException if the chunk cannot be written
     */
    public void putChunk(int index, byte[] data, int off, int len) throws IOException;
}
