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
import java.io.RandomAccessFile;
import java.nio.file.Path;
import io.github.flanglet.volz.ChunkSink;
import io.github.flanglet.volz.Error;


/**
 * Writable raw container (volume or labels). The file is sized to its final
 * length at creation so that chunks can be written at their fixed offset in
 * any order.
 */
public class RawContainerFile implements ChunkSink, Closeable {
    private final RandomAccessFile file;
    private final long dataOffset;
    private final int chunkSize;
    private final int chunkCount;


    private RawContainerFile(Path path, byte[] header, int chunkSize, int chunkCount) throws IOException {
        this.dataOffset = header.length;
        this.chunkSize = chunkSize;
        this.chunkCount = chunkCount;

        try {
            this.file = new RandomAccessFile(path.toFile(), "rw");
        }
        catch (IOException e) {
            throw new VolumeIOException("Cannot create output file '" + path + "': " + e.getMessage(), e,
                Error.ERR_CREATE_FILE);
        }

        try {
            this.file.setLength(header.length + (long) chunkSize * chunkCount);
            this.file.seek(0);
            this.file.write(header);
        }
        catch (IOException e) {
            this.file.close();
            throw new VolumeIOException("Cannot write output file '" + path + "': " + e.getMessage(), e,
                Error.ERR_WRITE_FILE);
        }
    }


    public static RawContainerFile createVolume(Path path, VolumeHeader header) throws IOException {
        return new RawContainerFile(path, header.toBytes(), header.getChunkSize(), header.getChunkCount());
    }


    public static RawContainerFile createLabels(Path path, LabelHeader header) throws IOException {
        return new RawContainerFile(path, header.toBytes(), header.getChunkSize(), header.getChunkCount());
    }


    @Override
    public synchronized void putChunk(int index, byte[] data, int off, int len) throws IOException {
        if ((index < 0) || (index >= this.chunkCount))
            throw new IndexOutOfBoundsException("Invalid chunk index: " + index);

        if (len != this.chunkSize)
            throw new VolumeIOException("Invalid chunk length: " + len + " (expected " + this.chunkSize + ")",
                Error.ERR_DATA_INTEGRITY);

        try {
            this.file.seek(this.dataOffset + (long) index * this.chunkSize);
            this.file.write(data, off, len);
        }
        catch (IOException e) {
            throw new VolumeIOException("Failed to write chunk " + index + ": " + e.getMessage(), e,
                Error.ERR_WRITE_FILE);
        }
    }


    @Override
    public void close() throws IOException {
        this.file.close();
    }
}
