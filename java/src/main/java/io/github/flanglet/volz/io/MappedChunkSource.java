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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.MappedByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import io.github.flanglet.volz.ChunkSource;
import io.github.flanglet.volz.Error;


/**
 * Read only chunk source over a memory mapped raw container (volume or
 * labels). The file is mapped in segments holding a whole number of chunks,
 * so containers larger than 2 GB are supported.
 */
public class MappedChunkSource implements ChunkSource, Closeable {
    private static final long MAX_SEGMENT_SIZE = 1L << 30;

    private final FileChannel channel;
    private final MappedByteBuffer[] segments;
    private final int chunksPerSegment;
    private final int chunkDim;
    private final int chunkCountX;
    private final int chunkCountY;
    private final int chunkCountZ;
    private final VolumeHeader volumeHeader;
    private final LabelHeader labelHeader;


    private MappedChunkSource(FileChannel channel, long dataOffset, int chunkDim,
        int cx, int cy, int cz, VolumeHeader vh, LabelHeader lh) throws IOException {
        this.channel = channel;
        this.chunkDim = chunkDim;
        this.chunkCountX = cx;
        this.chunkCountY = cy;
        this.chunkCountZ = cz;
        this.volumeHeader = vh;
        this.labelHeader = lh;
        final int chunkSize = this.getChunkSize();
        final int chunkCount = this.getChunkCount();
        final long required = dataOffset + (long) chunkCount * chunkSize;

        if (channel.size() < required)
            throw new VolumeIOException("Truncated raw container: " + channel.size() + " bytes, expected at least "
                + required, Error.ERR_INVALID_FILE);

        this.chunksPerSegment = (int) Math.max(1, MAX_SEGMENT_SIZE / chunkSize);
        final int nbSegments = (chunkCount + this.chunksPerSegment - 1) / this.chunksPerSegment;
        this.segments = new MappedByteBuffer[nbSegments];

        for (int i = 0; i < nbSegments; i++) {
            final int first = i * this.chunksPerSegment;
            final int n = Math.min(this.chunksPerSegment, chunkCount - first);
            this.segments[i] = channel.map(FileChannel.MapMode.READ_ONLY,
                dataOffset + (long) first * chunkSize, (long) n * chunkSize);
        }
    }


    /**
     * Maps a raw volume container ({@link VolumeHeader} followed by the chunks).
     *
     * @param path the raw volume file
     * @return a new chunk source, to be closed by the caller
     * @throws IOException if the file cannot be opened or is invalid
     */
    public static MappedChunkSource openVolume(Path path) throws IOException {
        FileChannel fc = FileChannel.open(path, StandardOpenOption.READ);

        try {
            InputStream is = Channels.newInputStream(fc);
            VolumeHeader vh = VolumeHeader.read(is);
            return new MappedChunkSource(fc, VolumeHeader.HEADER_SIZE, vh.getChunkDim(),
                vh.getChunkCountX(), vh.getChunkCountY(), vh.getChunkCountZ(), vh, null);
        }
        catch (IOException | RuntimeException e) {
            fc.close();
            throw e;
        }
    }


    /**
     * Maps a raw label container ({@link LabelHeader} followed by the chunks).
     *
     * @param path the raw label file
     * @return a new chunk source, to be closed by the caller
     * @throws IOException if the file cannot be opened or is invalid
     */
    public static MappedChunkSource openLabels(Path path) throws IOException {
        FileChannel fc = FileChannel.open(path, StandardOpenOption.READ);

        try {
            InputStream is = Channels.newInputStream(fc);
            LabelHeader lh = LabelHeader.read(is);
            return new MappedChunkSource(fc, LabelHeader.HEADER_SIZE, lh.getChunkDim(),
                lh.getChunkCountX(), lh.getChunkCountY(), lh.getChunkCountZ(), null, lh);
        }
        catch (IOException | RuntimeException e) {
            fc.close();
            throw e;
        }
    }


    /**
     * @return the volume header, or null if this source maps a label container
     */
    public VolumeHeader getVolumeHeader() {
        return this.volumeHeader;
    }


    /**
     * @return the label header, or null if this source maps a volume container
     */
    public LabelHeader getLabelHeader() {
        return this.labelHeader;
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
    public byte[] getChunkBytes(int index) throws IOException {
        if ((index < 0) || (index >= this.getChunkCount()))
            throw new IndexOutOfBoundsException("Invalid chunk index: " + index);

        final int chunkSize = this.getChunkSize();
        final MappedByteBuffer segment = this.segments[index / this.chunksPerSegment];
        final int offset = (index % this.chunksPerSegment) * chunkSize;
        byte[] res = new byte[chunkSize];

        // Absolute bulk get, the buffer position is never touched
        segment.get(offset, res, 0, chunkSize);
        return res;
    }


    @Override
    public void close() throws IOException {
        this.channel.close();
    }
}
