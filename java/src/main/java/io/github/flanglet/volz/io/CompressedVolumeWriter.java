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
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import io.github.flanglet.volz.ChunkSource;
import io.github.flanglet.volz.Error;
import io.github.flanglet.volz.Event;
import io.github.flanglet.volz.Listener;
import io.github.flanglet.volz.SliceByteArray;
import io.github.flanglet.volz.TransformException;
import io.github.flanglet.volz.transform.DeflateCodec;
import io.github.flanglet.volz.transform.Sequence;
import io.github.flanglet.volz.transform.TransformFactory;


/**
 * Writes a compressed volume container.
 * <p>
 * Every chunk (volume chunks first, then label chunks) is encoded by its own
 * task. Tasks run on the thread pool provided in the context and store their
 * output in a fixed slot indexed by chunk number. Once all tasks are done,
 * the header and the records are written in ascending chunk order, so the
 * output does not depend on the number of jobs.
 * <p>
 * Context entries: "level" (1 to 9, default 5), "predictive" and "rle"
 * (default true), "jobs" (default 1) and "pool" (an ExecutorService, required
 * when jobs is greater than 1).
 */
public class CompressedVolumeWriter {
    private static final int MAX_CONCURRENCY = 64;

    private final OutputStream os;
    private final int level;
    private final boolean predictive;
    private final boolean rle;
    private final int jobs;
    private final ExecutorService pool;
    private final List<Listener> listeners;
    private final AtomicBoolean canceled;
    private final AtomicBoolean used;
    private final Object progressLock;
    private int lastPercent;
    private long written;


    public CompressedVolumeWriter(OutputStream os, Map<String, Object> ctx) {
        if (os == null)
            throw new NullPointerException("Invalid null output stream parameter");

        if (ctx == null)
            throw new NullPointerException("Invalid null context parameter");

        final int lvl = (Integer) ctx.getOrDefault("level", DeflateCodec.DEFAULT_LEVEL);

        if ((lvl < 1) || (lvl > 9))
            throw new IllegalArgumentException("Invalid compression level (must be in [1..9]): " + lvl);

        final int tasks = (Integer) ctx.getOrDefault("jobs", 1);

        if ((tasks <= 0) || (tasks > MAX_CONCURRENCY))
            throw new IllegalArgumentException("The number of jobs must be in [1.." + MAX_CONCURRENCY + "]");

        ExecutorService threadPool = (ExecutorService) ctx.get("pool");

        if ((tasks > 1) && (threadPool == null))
            throw new IllegalArgumentException("The thread pool cannot be null when the number of jobs is " + tasks);

        this.os = os;
        this.level = lvl;
        this.predictive = (Boolean) ctx.getOrDefault("predictive", Boolean.TRUE);
        this.rle = (Boolean) ctx.getOrDefault("rle", Boolean.TRUE);
        this.jobs = tasks;
        this.pool = threadPool;
        this.listeners = new ArrayList<>(10);
        this.canceled = new AtomicBoolean(false);
        this.used = new AtomicBoolean(false);
        this.progressLock = new Object();
        this.lastPercent = -1;
    }


    public boolean addListener(Listener bl) {
        return (bl != null) ? this.listeners.add(bl) : false;
    }


    public boolean removeListener(Listener bl) {
        return (bl != null) ? this.listeners.remove(bl) : false;
    }


    /**
     * Requests the cancellation of the current (or next) call to write. Chunk
     * tasks not yet started are skipped and the call fails with ERR_CANCELED.
     */
    public void cancel() {
        this.canceled.set(true);
    }


    /**
     * @return the number of bytes written to the output stream so far
     */
    public long getWritten() {
        return this.written;
    }


    /**
     * Compresses a volume and its optional labels into the output stream.
     * The output stream is flushed, not closed.
     *
     * @param header the raw volume header (extents, chunk dimension, pixel size)
     * @param volume the volume chunks, matching the header geometry
     * @param labels the label chunks or null
     * @return the container header written
     * @throws IOException if a chunk cannot be read or encoded, if the output
     *         cannot be written or if the call is canceled
     */
    public ContainerHeader write(VolumeHeader header, ChunkSource volume, ChunkSource labels) throws IOException {
        if (this.used.getAndSet(true) == true)
            throw new IllegalStateException("A container has already been written by this writer");

        if ((header == null) || (volume == null))
            throw new NullPointerException("Invalid null volume parameter");

        if ((volume.getChunkDim() != header.getChunkDim())
            || (volume.getChunkCountX() != ContainerHeader.getChunkCount(header.getWidth(), header.getChunkDim()))
            || (volume.getChunkCountY() != ContainerHeader.getChunkCount(header.getHeight(), header.getChunkDim()))
            || (volume.getChunkCountZ() != ContainerHeader.getChunkCount(header.getDepth(), header.getChunkDim())))
            throw new VolumeIOException("The chunk geometry of the volume does not match its extents",
                Error.ERR_INVALID_PARAM);

        final ContainerHeader ch = new ContainerHeader(header.getWidth(), header.getHeight(), header.getDepth(),
            header.getChunkDim(), header.getPixelSize(), labels != null, this.level, this.predictive, this.rle);
        final int volumeChunks = volume.getChunkCount();
        final int labelChunks = (labels == null) ? 0 : labels.getChunkCount();
        final int total = volumeChunks + labelChunks;

        // Protect against future concurrent modification of the list of listeners
        Listener[] blockListeners = this.listeners.toArray(new Listener[this.listeners.size()]);

        if (blockListeners.length > 0) {
            Event evt = new Event(Event.Type.COMPRESSION_START, -1, header.getFileSize());
            notifyListeners(blockListeners, evt);
            this.reportProgress(blockListeners, 0);
        }

        final byte[][] volumeRecords = new byte[volumeChunks][];
        final byte[][] labelRecords = new byte[labelChunks][];
        final AtomicInteger completed = new AtomicInteger(0);
        final AtomicReference<Status> failure = new AtomicReference<>();
        final TransformFactory factory = new TransformFactory();
        final String volumePipeline = TransformFactory.getVolumePipeline(this.predictive, this.rle);
        final long volumeType = factory.getType(volumePipeline);
        final long labelType = factory.getType(TransformFactory.LABEL_PIPELINE);
        List<Callable<Status>> tasks = new ArrayList<>(total);
        Map<String, Object> volumeCtx = new HashMap<>();
        volumeCtx.put("level", this.level);
        volumeCtx.put("chunkDim", volume.getChunkDim());

        for (int i = 0; i < volumeChunks; i++) {
            tasks.add(new ChunkEncodingTask(volume, i, volumeRecords, factory, volumeType, volumeCtx,
                completed, total, failure, blockListeners));
        }

        if (labels != null) {
            Map<String, Object> labelCtx = new HashMap<>();
            labelCtx.put("level", this.level);
            labelCtx.put("chunkDim", labels.getChunkDim());

            for (int i = 0; i < labelChunks; i++) {
                tasks.add(new ChunkEncodingTask(labels, i, labelRecords, factory, labelType, labelCtx,
                    completed, total, failure, blockListeners));
            }
        }

        this.runTasks(tasks);

        // Barrier passed: surface the first failure, if any
        Status status = failure.get();

        if (status != null)
            throw new VolumeIOException(status.msg, status.cause, status.error);

        if (this.canceled.get() == true)
            throw new VolumeIOException("Compression canceled", Error.ERR_CANCELED);

        // Ordered flush
        try {
            HeaderCodec.write(this.os, ch);
            this.written += HeaderCodec.HEADER_SIZE;
            HeaderCodec.writeInt32(this.os, volumeChunks);
            this.written += 4;
            this.writeRecords(volumeRecords);

            if (labels != null) {
                LabelHeader lh = new LabelHeader(labels.getChunkDim(), labels.getChunkCountX(),
                    labels.getChunkCountY(), labels.getChunkCountZ());
                lh.write(this.os);
                this.written += LabelHeader.HEADER_SIZE;
                this.writeRecords(labelRecords);
            }

            this.os.flush();
        }
        catch (VolumeIOException e) {
            throw e;
        }
        catch (IOException e) {
            throw new VolumeIOException("Failed to write compressed container: " + e.getMessage(), e,
                Error.ERR_WRITE_FILE);
        }

        if (blockListeners.length > 0) {
            this.reportProgress(blockListeners, 100);
            Event evt = new Event(Event.Type.COMPRESSION_END, -1, this.written);
            notifyListeners(blockListeners, evt);
        }

        return ch;
    }


    private void runTasks(List<Callable<Status>> tasks) throws IOException {
        try {
            if ((this.jobs == 1) || (tasks.size() == 1)) {
                // Synchronous calls on the caller thread
                for (Callable<Status> task : tasks) {
                    Status status = task.call();

                    if ((status.error != 0) || (this.canceled.get() == true))
                        break;
                }
            }
            else {
                // Invoke the tasks concurrently and wait for all of them
                for (Future<Status> result : this.pool.invokeAll(tasks))
                    result.get();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            this.canceled.set(true);
            throw new VolumeIOException("Compression interrupted", e, Error.ERR_CANCELED);
        }
        catch (Exception e) {
            throw new VolumeIOException(e.getMessage(), e, Error.ERR_UNKNOWN);
        }
    }


    private void writeRecords(byte[][] records) throws IOException {
        for (int i = 0; i < records.length; i++) {
            if (this.canceled.get() == true)
                throw new VolumeIOException("Compression canceled", Error.ERR_CANCELED);

            HeaderCodec.writeInt32(this.os, records[i].length);
            this.os.write(records[i]);
            this.written += 4 + records[i].length;
        }
    }


    // Reports only increasing values to keep the progress monotonic
    private void reportProgress(Listener[] blockListeners, int percent) {
        synchronized (this.progressLock) {
            if (percent <= this.lastPercent)
                return;

            this.lastPercent = percent;
            notifyListeners(blockListeners, Event.progress(percent));
        }
    }


    static void notifyListeners(Listener[] listeners, Event evt) {
        for (Listener bl : listeners) {
            try {
                bl.processEvent(evt);
            }
            catch (Exception e) {
                // A faulty listener must not break the pipeline
                System.err.println("Listener error on " + evt.getType() + ": " + e);
            }
        }
    }


    /**
     * Encodes one chunk and stores the result in its slot.
     */
    class ChunkEncodingTask implements Callable<Status> {
        private final ChunkSource source;
        private final int index;
        private final byte[][] results;
        private final TransformFactory factory;
        private final long transformType;
        private final Map<String, Object> ctx;
        private final AtomicInteger completed;
        private final int total;
        private final AtomicReference<Status> failure;
        private final Listener[] listeners;


        ChunkEncodingTask(ChunkSource source, int index, byte[][] results, TransformFactory factory,
            long transformType, Map<String, Object> ctx, AtomicInteger completed, int total,
            AtomicReference<Status> failure, Listener[] listeners) {
            this.source = source;
            this.index = index;
            this.results = results;
            this.factory = factory;
            this.transformType = transformType;
            this.ctx = ctx;
            this.completed = completed;
            this.total = total;
            this.failure = failure;
            this.listeners = listeners;
        }


        @Override
        public Status call() {
            // Skip the chunk if a previous task failed or the call was canceled
            if ((this.failure.get() != null) || (CompressedVolumeWriter.this.canceled.get() == true))
                return new Status(this.index, Error.ERR_CANCELED, "Skipped", null);

            try {
                final byte[] data = this.source.getChunkBytes(this.index);
                final int chunkSize = this.source.getChunkSize();

                if ((data == null) || (data.length != chunkSize))
                    return this.fail(Error.ERR_DATA_INTEGRITY, "Chunk " + this.index + ": got "
                        + ((data == null) ? 0 : data.length) + " bytes, expected " + chunkSize, null);

                Sequence transform = this.factory.newFunction(this.ctx, this.transformType);
                SliceByteArray src = new SliceByteArray(data, chunkSize, 0);
                final int required = transform.getMaxEncodedLength(chunkSize);
                SliceByteArray dst = new SliceByteArray(new byte[required], required, 0);

                if (transform.forward(src, dst) == false)
                    return this.fail(Error.ERR_PROCESS_CHUNK, "Chunk " + this.index + ": forward transform failed", null);

                this.results[this.index] = Arrays.copyOf(dst.array, dst.index);

                if (this.listeners.length > 0) {
                    Event evt = new Event(Event.Type.CHUNK_ENCODED, this.index, dst.index, chunkSize);
                    notifyListeners(this.listeners, evt);
                    final int done = this.completed.incrementAndGet();
                    CompressedVolumeWriter.this.reportProgress(this.listeners, (int) ((done * 100L) / this.total));
                }

                return new Status(this.index, 0, "Success", null);
            }
            catch (TransformException e) {
                return this.fail(e.getErrorCode(), "Chunk " + this.index + ": " + e.getMessage(), e);
            }
            catch (VolumeIOException e) {
                return this.fail(e.getErrorCode(), e.getMessage(), e);
            }
            catch (IOException e) {
                return this.fail(Error.ERR_READ_FILE, "Chunk " + this.index + ": " + e.getMessage(), e);
            }
            catch (Exception e) {
                return this.fail(Error.ERR_PROCESS_CHUNK, "Chunk " + this.index + ": " + e.getMessage(), e);
            }
        }


        private Status fail(int error, String msg, Throwable cause) {
            Status status = new Status(this.index, error, msg, cause);
            this.failure.compareAndSet(null, status);
            return status;
        }
    }


    static class Status {
        final int chunkId;
        final int error; // 0 = OK
        final String msg;
        final Throwable cause;


        Status(int chunkId, int error, String msg, Throwable cause) {
            this.chunkId = chunkId;
            this.error = error;
            this.msg = msg;
            this.cause = cause;
        }
    }
}
