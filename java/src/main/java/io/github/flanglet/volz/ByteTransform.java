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

/**
 * A reversible byte transform applied to one chunk of voxels.
 * Implementations are stateless between calls (apart from reusable scratch
 * buffers) and must never depend on the order in which chunks are processed.
 */
public interface ByteTransform {

    /**
     * Reads src.length bytes from src.array[src.index], transforms them and
     * writes the result to dst.array[dst.index]. The index of each slice is
     * advanced by the number of bytes respectively read and written.
     *
     * @param src the slice holding the data to transform
     * @param dst the slice receiving the transformed data
     * @return {@code true} if the transform succeeded, {@code false} if the
     *         destination is too small or the input cannot be processed
     */
    public boolean forward(SliceByteArray src, SliceByteArray dst);

    /**
     * Reverts {@link #forward(SliceByteArray, SliceByteArray)}.
     * Read src.length bytes from src.array[src.index] and write the restored
     * bytes to dst.array[dst.index]. The index of each slice is updated
     * with the number of bytes respectively read from and written to.
     *
     * @param src the slice holding the transformed data
     * @param dst the slice receiving the restored data
     * @return {@code true} if the transform succeeded, {@code false} otherwise
     * @throws TransformException if the input is malformed
     */
    public boolean inverse(SliceByteArray src, SliceByteArray dst);

    /**
     * Returns the maximum size required for the output buffer of the forward
     * transform given the length of the source data.
     *
     * @param srcLength the length of the source data
     * @return the worst case encoded length
     */
    public int getMaxEncodedLength(int srcLength);
}
