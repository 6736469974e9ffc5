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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import io.github.flanglet.volz.ChunkSink;
import io.github.flanglet.volz.Error;
import io.github.flanglet.volz.Event;
import io.github.flanglet.volz.Listener;
import io.github.flanglet.volz.SliceByteArray;
import io.github.flanglet.volz.TransformException;
import io.github.flanglet.volz.transform.Sequence;
import io.github.flanglet.volz.transform.TransformFactory;


/**
 * Reads a compressed volume container, one record at a time.
 * <p>
 * The container is decoded in stages, in stream order:
 * {@link #readHeader()}, {@link #readVolume(ChunkSink)}, then, when the
 * header announces labels, {@link #readLabelHeader()} and
 * {@link #readLabels(ChunkSink)}. The label geometry is only known once the
 * volume records have been consumed, which lets callers size the label
 * destination before decoding the label records.
 */
public class CompressedVolumeReader {
    private static final int STATE_INIT = 0;
    private static final int STATE_HEADER = 1;
    private static final int STATE_VOLUME = 2;
    private static final int STATE_LABEL_HEADER = 3;
    private static final int STATE_DONE = 4;

    private final InputStream is;
    private final List<Listener> listeners;
    private final AtomicBoolean canceled;
    private final TransformFactory factory;
    private ContainerHeader header;
    private LabelHeader labelHeader;
    private int state;
    private long read;
    private int lastPercent;


    public CompressedVolumeReader(InputStream is) {
        if (is == null)
            throw new NullPointerException("Invalid null input stream parameter");

        this.is = is;
        this.listeners = new ArrayList<>(10);
        this.canceled = new AtomicBoolean(false);
        this.factory = new TransformFactory();
        this.state = STATE_INIT;
        this.lastPercent = -1;
    }


    public boolean addListener(Listener bl) {
        return (bl != null) ? this.listeners.add(bl) : false;
    }


    public boolean removeListener(Listener bl) {
        return (bl != null) ? this.listeners.remove(bl) : false;
    }


    /**
     * Requests the cancellation of the decoding. It is checked before each
     * record and the pending read call fails with ERR_CANCELED.
     */
    public void cancel() {
        this.canceled.set(true);
    }


    /**
     * @return the number of bytes read from the input stream so far
     */
    public long getRead() {
        return this.read;
    }


    /**
     * Reads and validates the container header. Subsequent calls return the
     * header already read.
     *
     * @return the container header
     * @throws IOException if the header is missing or invalid
     */
    public ContainerHeader readHeader() throws IOException {
        if (this.header != null)
            return this.header;

        Listener[] blockListeners = this.listeners.toArray(new Listener[this.listeners.size()]);
        CompressedVolumeWriter.notifyListeners(blockListeners, new Event(Event.Type.DECOMPRESSION_START, -1, 0L));
        this.header = HeaderCodec.read(this.is);
        this.read += HeaderCodec.HEADER_SIZE;
        this.state = STATE_HEADER;

        if (blockListeners.length > 0) {
            String msg = String.format("{ \"type\":\"%s\", \"header\":%s }", Event.Type.AFTER_HEADER_DECODING,
                this.header);
            CompressedVolumeWriter.notifyListeners(blockListeners,
                new Event(Event.Type.AFTER_HEADER_DECODING, -1, msg));
        }

        return this.header;
    }


    /**
     * Decodes the volume records into the sink.
     *
     * @param sink the destination of the volume chunks
     * @throws IOException if a record is invalid or cannot be decoded
     */
    public void readVolume(ChunkSink sink) throws IOException {
        this.readHeader();

        if (this.state != STATE_HEADER)
            throw new IllegalStateException("The volume records have already been read");

        final int count = HeaderCodec.readInt32(this.is);
        this.read += 4;

        if (count != this.header.getChunkCount())
            throw new VolumeIOException("Invalid volume chunk count: " + count + " (expected "
                + this.header.getChunkCount() + ")", Error.ERR_INVALID_FILE);

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("level", this.header.getCompressionLevel());
        ctx.put("chunkDim", this.header.getChunkDim());
        final String pipeline = TransformFactory.getVolumePipeline(this.header.usePredictiveCoding(),
            this.header.useRunLengthEncoding());
        Sequence transform = this.factory.newFunction(ctx, this.factory.getType(pipeline));

        // Labels are assumed to share the volume geometry until their header is read
        final int end = (this.header.hasLabels() == true) ? 50 : 100;
        this.readRecords(sink, transform, count, this.header.getChunkSize(), 0, end);
        this.state = (this.header.hasLabels() == true) ? STATE_VOLUME : STATE_DONE;
    }


    /**
     * Reads the label geometry following the volume records.
     *
     * @return the label header or null if the container has no labels
     * @throws IOException if the label header is invalid
     */
    public LabelHeader readLabelHeader() throws IOException {
        if (this.header == null)
            throw new IllegalStateException("The volume records must be read first");

        if (this.header.hasLabels() == false)
            return null;

        if (this.labelHeader != null)
            return this.labelHeader;

        if (this.state != STATE_VOLUME)
            throw new IllegalStateException("The volume records must be read first");

        this.labelHeader = LabelHeader.read(this.is);
        this.read += LabelHeader.HEADER_SIZE;
        this.state = STATE_LABEL_HEADER;
        return this.labelHeader;
    }


    /**
     * Decodes the label records into the sink.
     *
     * @param sink the destination of the label chunks
     * @throws IOException if a record is invalid or cannot be decoded
     */
    public void readLabels(ChunkSink sink) throws IOException {
        if (this.readLabelHeader() == null)
            throw new IllegalStateException("The container has no labels");

        if (this.state != STATE_LABEL_HEADER)
            throw new IllegalStateException("The label records have already been read");

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("level", this.header.getCompressionLevel());
        ctx.put("chunkDim", this.labelHeader.getChunkDim());
        Sequence transform = this.factory.newFunction(ctx, this.factory.getType(TransformFactory.LABEL_PIPELINE));
        this.readRecords(sink, transform, this.labelHeader.getChunkCount(), this.labelHeader.getChunkSize(),
            Math.max(this.lastPercent, 0), 100);
        this.state = STATE_DONE;
    }


    private void readRecords(ChunkSink sink, Sequence transform, int count, int chunkSize,
        int startPercent, int endPercent) throws IOException {
        Listener[] blockListeners = this.listeners.toArray(new Listener[this.listeners.size()]);
        final int maxLength = transform.getMaxEncodedLength(chunkSize);
        byte[] buffer = new byte[0];
        SliceByteArray dst = new SliceByteArray(new byte[chunkSize], 0);

        for (int i = 0; i < count; i++) {
            if (this.canceled.get() == true)
                throw new VolumeIOException("Decompression canceled", Error.ERR_CANCELED);

            final int length = HeaderCodec.readInt32(this.is);
            this.read += 4;

            if ((length < 0) || (length > maxLength))
                throw new VolumeIOException("Chunk " + i + ": invalid record length " + length,
                    Error.ERR_INVALID_FILE);

            if (buffer.length < length)
                buffer = new byte[length];

            HeaderCodec.readFully(this.is, buffer, 0, length, "chunk " + i);
            this.read += length;
            SliceByteArray src = new SliceByteArray(buffer, length, 0);
            dst.index = 0;

            try {
                if (transform.inverse(src, dst) == false)
                    throw new VolumeIOException("Chunk " + i + ": inverse transform failed", Error.ERR_PROCESS_CHUNK);
            }
            catch (TransformException e) {
                throw new VolumeIOException("Chunk " + i + ": " + e.getMessage(), e, e.getErrorCode());
            }

            if (dst.index != chunkSize)
                throw new VolumeIOException("Chunk " + i + ": decoded " + dst.index + " bytes, expected " + chunkSize,
                    Error.ERR_DATA_INTEGRITY);

            sink.putChunk(i, dst.array, 0, chunkSize);

            if (blockListeners.length > 0) {
                CompressedVolumeWriter.notifyListeners(blockListeners,
                    new Event(Event.Type.CHUNK_DECODED, i, length, chunkSize));
                this.reportProgress(blockListeners, startPercent
                    + (int) (((i + 1) * (long) (endPercent - startPercent)) / count));
            }
        }

        if ((endPercent == 100) && (blockListeners.length > 0)) {
            this.reportProgress(blockListeners, 100);
            CompressedVolumeWriter.notifyListeners(blockListeners,
                new Event(Event.Type.DECOMPRESSION_END, -1, this.read));
        }
    }


    private void reportProgress(Listener[] blockListeners, int percent) {
        if (percent <= this.lastPercent)
            return;

        this.lastPercent = percent;
        CompressedVolumeWriter.notifyListeners(blockListeners, Event.progress(percent));
    }
}
