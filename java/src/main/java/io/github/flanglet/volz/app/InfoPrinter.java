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

package io.github.flanglet.volz.app;

import java.io.PrintStream;
import io.github.flanglet.volz.Event;
import io.github.flanglet.volz.Listener;

/**
 * Listener printing compression or decompression events according to a
 * verbosity level: 3 shows the container header and the progress by steps of
 * 10%, 4 adds one line per chunk, 5 dumps every event.
 */
public class InfoPrinter implements Listener {
    public enum Type {
        ENCODING,
        DECODING
    }

    private final PrintStream ps;
    private final Type type;
    private final int level;
    private final Event.Type chunkEvent;
    private long time0;
    private int lastStep;

    /**
     * Constructs an {@code InfoPrinter}.
     *
     * @param infoLevel the verbosity level
     * @param type encoding or decoding
     * @param ps the stream receiving the messages
     */
    public InfoPrinter(int infoLevel, Type type, PrintStream ps) {
        if (ps == null)
            throw new NullPointerException("Invalid null print stream parameter");

        this.ps = ps;
        this.level = infoLevel;
        this.type = type;
        this.chunkEvent = (type == Type.ENCODING) ? Event.Type.CHUNK_ENCODED : Event.Type.CHUNK_DECODED;
        this.lastStep = -1;
    }

    @Override
    public synchronized void processEvent(Event evt) {
        final Event.Type t = evt.getType();

        if ((t == Event.Type.COMPRESSION_START) || (t == Event.Type.DECOMPRESSION_START)) {
            this.time0 = evt.getTime();
            this.lastStep = -1;

            if (this.level >= 5)
                this.ps.println(evt);
        } else if (t == this.chunkEvent) {
            if (this.level >= 5) {
                this.ps.println(evt);
            } else if (this.level >= 4) {
                final boolean enc = this.type == Type.ENCODING;
                final long from = enc ? evt.getRawSize() : evt.getSize();
                final long to = enc ? evt.getSize() : evt.getRawSize();
                StringBuilder msg = new StringBuilder();
                msg.append(String.format("Chunk %d: %d => %d", evt.getId(), from, to));

                if ((enc == true) && (from != 0))
                    msg.append(String.format(" (%d%%)", (to * 100L / from)));

                this.ps.println(msg.toString());
            }
        } else if (t == Event.Type.PROGRESS) {
            if (this.level >= 5) {
                this.ps.println(evt);
            } else if (this.level >= 3) {
                // One line per 10% step
                final int step = evt.getPercent() / 10;

                if (step > this.lastStep) {
                    this.lastStep = step;
                    long elapsed = (evt.getTime() - this.time0) / 1000000L;
                    this.ps.println(String.format("Progress: %3d%% [%d ms]", evt.getPercent(), elapsed));
                }
            }
        } else if ((t == Event.Type.AFTER_HEADER_DECODING) && (this.level >= 3)) {
            this.ps.println(evt);
        } else if (this.level >= 5) {
            this.ps.println(evt);
        }
    }
}
