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

package io.github.flanglet.volz.test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import io.github.flanglet.volz.ChunkSource;
import io.github.flanglet.volz.Error;
import io.github.flanglet.volz.Event;
import io.github.flanglet.volz.Listener;
import io.github.flanglet.volz.io.ArrayChunkSource;
import io.github.flanglet.volz.io.CompressedVolumeReader;
import io.github.flanglet.volz.io.CompressedVolumeWriter;
import io.github.flanglet.volz.io.ContainerHeader;
import io.github.flanglet.volz.io.LabelHeader;
import io.github.flanglet.volz.io.VolumeHeader;
import io.github.flanglet.volz.io.VolumeIOException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;


public class TestCompressedVolume {
  private static final ExecutorService pool = Executors.newFixedThreadPool(4);
  private static final Random RANDOM = new Random(Long.MAX_VALUE);

  // 20x12x9 voxels in chunks of 8: 3x2x2 chunks
  private static final int WIDTH = 20;
  private static final int HEIGHT = 12;
  private static final int DEPTH = 9;
  private static final int DIM = 8;

  @AfterAll
  static void shutDown() {
    pool.shutdown();
  }

  @Test
  void testDeterminism() throws IOException {
    ArrayChunkSource volume = newVolume();

    for (int level : new int[] { 1, 5, 9 }) {
      byte[] output1 = compress(volume, null, ctx(level, 1));
      byte[] output2 = compress(volume, null, ctx(level, 4));
      Assertions.assertArrayEquals(output1, output2, "level=" + level);
    }
  }

  @Test
  void testRoundTrip() throws IOException {
    ArrayChunkSource volume = newVolume();
    final boolean[] flags = new boolean[] { false, true };

    for (boolean predictive : flags) {
      for (boolean rle : flags) {
        Map<String, Object> ctx = ctx(7, 4);
        ctx.put("predictive", predictive);
        ctx.put("rle", rle);
        byte[] output = compress(volume, null, ctx);

        CompressedVolumeReader reader = new CompressedVolumeReader(new ByteArrayInputStream(output));
        ContainerHeader header = reader.readHeader();
        Assertions.assertEquals(WIDTH, header.getWidth());
        Assertions.assertEquals(predictive, header.usePredictiveCoding());
        Assertions.assertEquals(rle, header.useRunLengthEncoding());
        Assertions.assertFalse(header.hasLabels());
        ArrayChunkSource restored = new ArrayChunkSource(DIM, header.getChunkCountX(),
            header.getChunkCountY(), header.getChunkCountZ());
        reader.readVolume(restored);
        Assertions.assertNull(reader.readLabelHeader());
        Assertions.assertEquals(output.length, reader.getRead());
        assertSameChunks(volume, restored);
      }
    }
  }

  @Test
  void testRoundTripWithLabels() throws IOException {
    ArrayChunkSource volume = newVolume();
    ArrayChunkSource labels = new ArrayChunkSource(4, 5, 3, 3);

    for (int i = 0; i < labels.getChunkCount(); i++) {
      byte[] chunk = new byte[labels.getChunkSize()];

      for (int j = chunk.length / 2; j < chunk.length; j++)
        chunk[j] = (byte) (1 + (i % 3));

      labels.putChunk(i, chunk, 0, chunk.length);
    }

    byte[] output = compress(volume, labels, ctx(3, 2));
    CompressedVolumeReader reader = new CompressedVolumeReader(new ByteArrayInputStream(output));
    Assertions.assertTrue(reader.readHeader().hasLabels());
    ArrayChunkSource restored = new ArrayChunkSource(DIM, 3, 2, 2);
    reader.readVolume(restored);
    LabelHeader lh = reader.readLabelHeader();
    Assertions.assertEquals(4, lh.getChunkDim());
    Assertions.assertEquals(5, lh.getChunkCountX());
    Assertions.assertEquals(45, lh.getChunkCount());
    ArrayChunkSource restoredLabels = new ArrayChunkSource(lh.getChunkDim(), lh.getChunkCountX(),
        lh.getChunkCountY(), lh.getChunkCountZ());
    reader.readLabels(restoredLabels);
    assertSameChunks(volume, restored);
    assertSameChunks(labels, restoredLabels);
  }

  @Test
  void testProgress() throws IOException {
    ArrayChunkSource volume = newVolume();
    final List<Integer> percents = new ArrayList<>();
    final List<Event.Type> types = new ArrayList<>();
    Listener listener = new Listener() {
      @Override
      public void processEvent(Event evt) {
        synchronized (percents) {
          types.add(evt.getType());

          if (evt.getType() == Event.Type.PROGRESS)
            percents.add(evt.getPercent());
        }
      }
    };

    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    CompressedVolumeWriter writer = new CompressedVolumeWriter(baos, ctx(5, 4));
    writer.addListener(listener);
    writer.write(header(), volume, null);
    Assertions.assertEquals(baos.size(), writer.getWritten());
    assertMonotonic(percents);
    Assertions.assertEquals(Event.Type.COMPRESSION_START, types.get(0));
    Assertions.assertEquals(Event.Type.COMPRESSION_END, types.get(types.size() - 1));

    percents.clear();
    types.clear();
    CompressedVolumeReader reader = new CompressedVolumeReader(new ByteArrayInputStream(baos.toByteArray()));
    reader.addListener(listener);
    reader.readVolume(new ArrayChunkSource(DIM, 3, 2, 2));
    assertMonotonic(percents);
    Assertions.assertTrue(types.contains(Event.Type.AFTER_HEADER_DECODING));
    Assertions.assertEquals(Event.Type.DECOMPRESSION_END, types.get(types.size() - 1));
  }

  @Test
  void testCancel() throws IOException {
    final ArrayChunkSource volume = newVolume();
    final CompressedVolumeWriter writer1 = new CompressedVolumeWriter(new ByteArrayOutputStream(), ctx(5, 4));
    writer1.cancel();
    assertError(Error.ERR_CANCELED, new Executable() {
      @Override
      public void execute() throws Throwable {
        writer1.write(header(), volume, null);
      }
    });

    // Cancel from a listener after the first chunk
    final CompressedVolumeWriter writer2 = new CompressedVolumeWriter(new ByteArrayOutputStream(), ctx(5, 1));
    writer2.addListener(new Listener() {
      @Override
      public void processEvent(Event evt) {
        if (evt.getType() == Event.Type.CHUNK_ENCODED)
          writer2.cancel();
      }
    });
    assertError(Error.ERR_CANCELED, new Executable() {
      @Override
      public void execute() throws Throwable {
        writer2.write(header(), volume, null);
      }
    });

    final byte[] output = compress(volume, null, ctx(5, 1));
    final CompressedVolumeReader reader = new CompressedVolumeReader(new ByteArrayInputStream(output));
    reader.cancel();
    assertError(Error.ERR_CANCELED, new Executable() {
      @Override
      public void execute() throws Throwable {
        reader.readVolume(new ArrayChunkSource(DIM, 3, 2, 2));
      }
    });
  }

  @Test
  void testChunkFailure() {
    final ArrayChunkSource volume = newVolume();
    final IOException cause = new IOException("disk error");

    // Chunk 5 cannot be read
    final ChunkSource failing = new ChunkSource() {
      @Override
      public int getChunkDim() {
        return volume.getChunkDim();
      }

      @Override
      public int getChunkCountX() {
        return volume.getChunkCountX();
      }

      @Override
      public int getChunkCountY() {
        return volume.getChunkCountY();
      }

      @Override
      public int getChunkCountZ() {
        return volume.getChunkCountZ();
      }

      @Override
      public byte[] getChunkBytes(int index) throws IOException {
        if (index == 5)
          throw cause;

        return volume.getChunkBytes(index);
      }
    };

    for (final int jobs : new int[] { 1, 4 }) {
      VolumeIOException e = assertError(Error.ERR_READ_FILE, new Executable() {
        @Override
        public void execute() throws Throwable {
          compress(failing, null, ctx(5, jobs));
        }
      });

      Assertions.assertSame(cause, e.getCause());
    }
  }

  @Test
  void testGeometryMismatch() {
    final ArrayChunkSource volume = new ArrayChunkSource(DIM, 2, 2, 2);

    assertError(Error.ERR_INVALID_PARAM, new Executable() {
      @Override
      public void execute() throws Throwable {
        compress(volume, null, ctx(5, 1));
      }
    });
  }

  @Test
  void testCorruptedRecords() throws IOException {
    ArrayChunkSource volume = newVolume();
    byte[] output = compress(volume, null, ctx(9, 1));

    // Negative length of the first record (right after header and chunk count)
    final byte[] badLength = output.clone();
    badLength[47] = (byte) 0x80;
    assertError(Error.ERR_INVALID_FILE, new Executable() {
      @Override
      public void execute() throws Throwable {
        new CompressedVolumeReader(new ByteArrayInputStream(badLength)).readVolume(new ArrayChunkSource(DIM, 3, 2, 2));
      }
    });

    // Wrong chunk count
    final byte[] badCount = output.clone();
    badCount[40] = 11;
    assertError(Error.ERR_INVALID_FILE, new Executable() {
      @Override
      public void execute() throws Throwable {
        new CompressedVolumeReader(new ByteArrayInputStream(badCount)).readVolume(new ArrayChunkSource(DIM, 3, 2, 2));
      }
    });

    // Truncated stream
    final byte[] truncated = java.util.Arrays.copyOf(output, output.length - 3);
    assertError(Error.ERR_READ_FILE, new Executable() {
      @Override
      public void execute() throws Throwable {
        new CompressedVolumeReader(new ByteArrayInputStream(truncated)).readVolume(new ArrayChunkSource(DIM, 3, 2, 2));
      }
    });
  }

  @Test
  void testFromVoxels() {
    byte[] voxels = new byte[WIDTH * HEIGHT * DEPTH];

    for (int i = 0; i < voxels.length; i++)
      voxels[i] = (byte) (1 + (i % 251));

    ArrayChunkSource volume = ArrayChunkSource.fromVoxels(voxels, WIDTH, HEIGHT, DEPTH, DIM);
    Assertions.assertEquals(12, volume.getChunkCount());

    // Voxel (17, 9, 8) lives in chunk (2, 1, 1) at local (1, 1, 0)
    byte[] chunk = volume.getChunkBytes(2 + 3 * (1 + 2 * 1));
    Assertions.assertEquals(voxels[17 + WIDTH * (9 + HEIGHT * 8)], chunk[1 + DIM * 1]);

    // Padding outside of the extents
    Assertions.assertEquals(0, chunk[4 + DIM * (1 + DIM * 1)]);
  }

  private static VolumeIOException assertError(int code, Executable executable) {
    VolumeIOException e = Assertions.assertThrows(VolumeIOException.class, executable);
    Assertions.assertEquals(code, e.getErrorCode(), e.getMessage());
    return e;
  }

  private static void assertMonotonic(List<Integer> percents) {
    Assertions.assertFalse(percents.isEmpty());

    for (int i = 1; i < percents.size(); i++)
      Assertions.assertTrue(percents.get(i - 1) <= percents.get(i), "Progress is not monotonic: " + percents);

    Assertions.assertEquals(100, (int) percents.get(percents.size() - 1));
  }

  private static void assertSameChunks(ChunkSource expected, ChunkSource actual) throws IOException {
    Assertions.assertEquals(expected.getChunkCount(), actual.getChunkCount());

    for (int i = 0; i < expected.getChunkCount(); i++)
      Assertions.assertArrayEquals(expected.getChunkBytes(i), actual.getChunkBytes(i), "chunk " + i);
  }

  private static Map<String, Object> ctx(int level, int jobs) {
    Map<String, Object> ctx = new HashMap<>();
    ctx.put("level", level);
    ctx.put("jobs", jobs);
    ctx.put("pool", pool);
    return ctx;
  }

  private static VolumeHeader header() {
    return new VolumeHeader(WIDTH, HEIGHT, DEPTH, DIM, 8, 0.125);
  }

  private static byte[] compress(ChunkSource volume, ChunkSource labels, Map<String, Object> ctx)
      throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    CompressedVolumeWriter writer = new CompressedVolumeWriter(baos, ctx);
    writer.write(header(), volume, labels);
    return baos.toByteArray();
  }

  // Smooth noisy volume
  private static ArrayChunkSource newVolume() {
    byte[] voxels = new byte[WIDTH * HEIGHT * DEPTH];

    for (int z = 0, i = 0; z < DEPTH; z++) {
      for (int y = 0; y < HEIGHT; y++) {
        for (int x = 0; x < WIDTH; x++, i++)
          voxels[i] = (byte) (40 + 2 * x + 3 * y + 5 * z + RANDOM.nextInt(4));
      }
    }

    return ArrayChunkSource.fromVoxels(voxels, WIDTH, HEIGHT, DEPTH, DIM);
  }
}
