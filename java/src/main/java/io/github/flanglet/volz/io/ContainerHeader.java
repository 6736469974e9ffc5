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

import java.util.Objects;


/**
 * Header of a compressed volume container. Chunk counts are not stored, they
 * are derived from the extents and the chunk dimension.
 */
public final class ContainerHeader {
    // Run-length coding may double a chunk: 2 * MAX_CHUNK_DIM^3 must fit in an int
    public static final int MAX_CHUNK_DIM = 1023;

    private final int width;
    private final int height;
    private final int depth;
    private final int chunkDim;
    private final double pixelSize;
    private final boolean hasLabels;
    private final int compressionLevel;
    private final boolean predictiveCoding;
    private final boolean runLengthEncoding;


    public ContainerHeader(int width, int height, int depth, int chunkDim, double pixelSize,
        boolean hasLabels, int compressionLevel, boolean predictiveCoding, boolean runLengthEncoding) {
        if ((width <= 0) || (height <= 0) || (depth <= 0))
            throw new IllegalArgumentException("Invalid volume extents: " + width + "x" + height + "x" + depth);

        if ((chunkDim <= 0) || (chunkDim > MAX_CHUNK_DIM))
            throw new IllegalArgumentException("Invalid chunk dimension (must be in [1.." + MAX_CHUNK_DIM + "]): " + chunkDim);

        if ((compressionLevel < 1) || (compressionLevel > 9))
            throw new IllegalArgumentException("Invalid compression level (must be in [1..9]): " + compressionLevel);

        this.width = width;
        this.height = height;
        this.depth = depth;
        this.chunkDim = chunkDim;
        this.pixelSize = pixelSize;
        this.hasLabels = hasLabels;
        this.compressionLevel = compressionLevel;
        this.predictiveCoding = predictiveCoding;
        this.runLengthEncoding = runLengthEncoding;
    }


    /**
     * Number of chunks needed to cover an extent.
     *
     * @param extent the extent in voxels
     * @param chunkDim the chunk edge length
     * @return ceil(extent / chunkDim)
     */
    public static int getChunkCount(int extent, int chunkDim) {
        return (extent + chunkDim - 1) / chunkDim;
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


    public double getPixelSize() {
        return this.pixelSize;
    }


    public boolean hasLabels() {
        return this.hasLabels;
    }


    public int getCompressionLevel() {
        return this.compressionLevel;
    }


    public boolean usePredictiveCoding() {
        return this.predictiveCoding;
    }


    public boolean useRunLengthEncoding() {
        return this.runLengthEncoding;
    }


    public int getChunkCountX() {
        return getChunkCount(this.width, this.chunkDim);
    }


    public int getChunkCountY() {
        return getChunkCount(this.height, this.chunkDim);
    }


    public int getChunkCountZ() {
        return getChunkCount(this.depth, this.chunkDim);
    }


    public int getChunkCount() {
        return this.getChunkCountX() * this.getChunkCountY() * this.getChunkCountZ();
    }


    public int getChunkSize() {
        return this.chunkDim * this.chunkDim * this.chunkDim;
    }


    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;

        if ((o instanceof ContainerHeader) == false)
            return false;

        ContainerHeader h = (ContainerHeader) o;
        return (this.width == h.width) && (this.height == h.height) && (this.depth == h.depth)
            && (this.chunkDim == h.chunkDim)
            && (Double.compare(this.pixelSize, h.pixelSize) == 0)
            && (this.hasLabels == h.hasLabels)
            && (this.compressionLevel == h.compressionLevel)
            && (this.predictiveCoding == h.predictiveCoding)
            && (this.runLengthEncoding == h.runLengthEncoding);
    }


    @Override
    public int hashCode() {
        return Objects.hash(this.width, this.height, this.depth, this.chunkDim, this.pixelSize,
            this.hasLabels, this.compressionLevel, this.predictiveCoding, this.runLengthEncoding);
    }


    @Override
    public String toString() {
        return String.format("{ \"width\":%d, \"height\":%d, \"depth\":%d, \"chunkDim\":%d, \"pixelSize\":%s, "
            + "\"labels\":%b, \"level\":%d, \"predictive\":%b, \"rle\":%b }",
            this.width, this.height, this.depth, this.chunkDim, this.pixelSize, this.hasLabels,
            this.compressionLevel, this.predictiveCoding, this.runLengthEncoding);
    }
}
