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
 * This class represents events emitted while a volume is compressed or
 * decompressed. Chunk events carry the chunk index, the raw size and the
 * encoded size of the chunk. Progress events carry a percentage.
 */
public class Event {

    /**
     * Enum representing the types of events that can occur.
     */
    public enum Type {
        /**
         * Beginning of compression
         */
        COMPRESSION_START,

        /**
         * Beginning of decompression
         */
        DECOMPRESSION_START,

        /**
         * End of container header decoding
         */
        AFTER_HEADER_DECODING,

        /**
         * A chunk went through the forward pipeline
         */
        CHUNK_ENCODED,

        /**
         * A chunk went through the inverse pipeline
         */
        CHUNK_DECODED,

        /**
         * Percentage of chunks processed so far
         */
        PROGRESS,

        /**
         * End of compression
         */
        COMPRESSION_END,

        /**
         * End of decompression
         */
        DECOMPRESSION_END
    }

    private final int id;
    private final long size;
    private final long rawSize;
    private final int percent;
    private final Type type;
    private final long time;
    private final String msg;


    /**
     * Constructs an Event with the specified type, id and size.
     *
     * @param type the type of event
     * @param id the chunk index, or -1 when the event is not tied to a chunk
     * @param size the size attached to the event
     */
    public Event(Type type, int id, long size) {
        this(type, id, size, size);
    }

    /**
     * Constructs a chunk Event.
     *
     * @param type the type of event
     * @param id the chunk index
     * @param size the encoded size of the chunk
     * @param rawSize the decoded size of the chunk
     */
    public Event(Type type, int id, long size, long rawSize) {
        this.type = type;
        this.id = id;
        this.size = size;
        this.rawSize = rawSize;
        this.percent = -1;
        this.time = System.nanoTime();
        this.msg = null;
    }

    /**
     * Constructs an Event with the specified type, id, and message.
     *
     * @param type the type of event
     * @param id the event id
     * @param msg the event message
     */
    public Event(Type type, int id, String msg) {
        this.type = type;
        this.id = id;
        this.size = 0L;
        this.rawSize = 0L;
        this.percent = -1;
        this.time = System.nanoTime();
        this.msg = msg;
    }

    private Event(int percent) {
        this.type = Type.PROGRESS;
        this.id = -1;
        this.size = 0L;
        this.rawSize = 0L;
        this.percent = percent;
        this.time = System.nanoTime();
        this.msg = null;
    }

    /**
     * Creates a progress event.
     *
     * @param percent the percentage of processed chunks, in [0..100]
     * @return a new PROGRESS event
     */
    public static Event progress(int percent) {
        if ((percent < 0) || (percent > 100))
            throw new IllegalArgumentException("Invalid progress value: " + percent);

        return new Event(percent);
    }

    public int getId() {
        return this.id;
    }

    public long getSize() {
        return this.size;
    }

    public long getRawSize() {
        return this.rawSize;
    }

    /**
     * Returns the progress percentage.
     *
     * @return a value in [0..100] for PROGRESS events, -1 otherwise
     */
    public int getPercent() {
        return this.percent;
    }

    public long getTime() {
        return this.time;
    }

    public Type getType() {
        return this.type;
    }

    @Override
    public String toString() {
        if (this.msg != null) {
            return this.msg;
        }

        StringBuilder sb = new StringBuilder(200);
        sb.append("{ \"type\":\"").append(this.getType()).append("\"");

        if (this.type == Type.PROGRESS) {
            sb.append(", \"percent\":").append(this.percent);
        }
        else {
            if (this.id >= 0) {
                sb.append(", \"id\":").append(this.getId());
            }

            sb.append(", \"size\":").append(this.getSize());

            if (this.rawSize != this.size) {
                sb.append(", \"rawSize\":").append(this.rawSize);
            }
        }

        sb.append(", \"time\":").append(this.getTime());
        sb.append(" }");
        return sb.toString();
    }
}
