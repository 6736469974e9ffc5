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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import io.github.flanglet.volz.ByteTransform;
import io.github.flanglet.volz.Error;
import io.github.flanglet.volz.SliceByteArray;
import io.github.flanglet.volz.TransformException;
import io.github.flanglet.volz.transform.DeflateCodec;
import io.github.flanglet.volz.transform.PredictiveCoder;
import io.github.flanglet.volz.transform.RLT;
import io.github.flanglet.volz.transform.Sequence;
import io.github.flanglet.volz.transform.TransformFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;


public class TestTransforms {
  private static final Random RANDOM = new Random(Long.MAX_VALUE);
  private static final int[] DIMS = new int[] { 2, 4, 8, 16 };

  @Test
  void testPipelineRoundTrip() {
    final boolean[] flags = new boolean[] { false, true };

    for (int dim : DIMS) {
      for (boolean predictive : flags) {
        for (boolean rle : flags) {
          for (int level : new int[] { 1, 5, 9 }) {
            final String name = TransformFactory.getVolumePipeline(predictive, rle);

            for (int test = 0; test < 4; test++) {
              byte[] input = generate(dim, test);
              byte[] output = roundTrip(newPipeline(name, dim, level), input);
              Assertions.assertArrayEquals(input, output,
                  "Round trip failed for " + name + ", dim=" + dim + ", level=" + level + ", test=" + test);
            }
          }
        }
      }
    }
  }

  @Test
  void testLabelPipelineRoundTrip() {
    for (int dim : DIMS) {
      byte[] labels = new byte[dim * dim * dim];

      // Few large segments
      for (int i = 0; i < labels.length; i++)
        labels[i] = (byte) ((i * 3) / labels.length);

      byte[] output = roundTrip(newPipeline(TransformFactory.LABEL_PIPELINE, dim, 5), labels);
      Assertions.assertArrayEquals(labels, output);
    }
  }

  @Test
  void testPredictiveEdgeValues() {
    final int dim = 8;
    final int size = dim * dim * dim;
    byte[] zeros = new byte[size];
    byte[] full = new byte[size];
    Arrays.fill(full, (byte) 255);
    byte[] first = new byte[size];
    first[0] = (byte) 200;

    for (byte[] input : new byte[][] { zeros, full, first }) {
      PredictiveCoder pc = new PredictiveCoder(dim);
      SliceByteArray src = new SliceByteArray(input, size, 0);
      SliceByteArray dst = new SliceByteArray(new byte[size], 0);
      Assertions.assertTrue(pc.forward(src, dst));
      Assertions.assertEquals(size, dst.index);
      byte[] encoded = dst.array;

      // First voxel stored verbatim
      Assertions.assertEquals(input[0], encoded[0]);
      Assertions.assertArrayEquals(input, roundTrip(pc, input));
    }
  }

  @Test
  void testPredictiveResiduals() {
    final int dim = 4;
    final int size = dim * dim * dim;
    byte[] input = new byte[size];
    Arrays.fill(input, (byte) 77);
    SliceByteArray src = new SliceByteArray(input, size, 0);
    SliceByteArray dst = new SliceByteArray(new byte[size], 0);
    Assertions.assertTrue(new PredictiveCoder(dim).forward(src, dst));
    Assertions.assertEquals(77, dst.array[0] & 0xFF);

    // A constant chunk is predicted exactly: every residual is the bias
    for (int i = 1; i < size; i++)
      Assertions.assertEquals(128, dst.array[i] & 0xFF, "index " + i);

    // Voxel 1 (x=1) only has its x neighbor, voxel 5 (x=1,y=1) averages two neighbors
    input[0] = 10;
    input[1] = (byte) 250;
    input[4] = 20;
    input[5] = 0;
    src = new SliceByteArray(input, size, 0);
    dst = new SliceByteArray(new byte[size], 0);
    Assertions.assertTrue(new PredictiveCoder(dim).forward(src, dst));
    Assertions.assertEquals((byte) (250 - 10 + 128), dst.array[1]);
    Assertions.assertEquals((byte) (0 - ((250 + 20) / 2) + 128), dst.array[5]);
    Assertions.assertArrayEquals(input, roundTrip(new PredictiveCoder(dim), input));
  }

  @Test
  void testPredictiveRejectsWrongLength() {
    final PredictiveCoder pc = new PredictiveCoder(4);
    Assertions.assertFalse(pc.forward(new SliceByteArray(new byte[63], 63, 0), new SliceByteArray(new byte[64], 0)));

    TransformException e = Assertions.assertThrows(TransformException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        pc.inverse(new SliceByteArray(new byte[63], 63, 0), new SliceByteArray(new byte[64], 0));
      }
    });

    Assertions.assertEquals(Error.ERR_DATA_INTEGRITY, e.getErrorCode());
  }

  @Test
  void testRunLengthTokens() {
    byte[] input = new byte[300 + 2];
    Arrays.fill(input, 0, 300, (byte) 7);
    input[300] = 1;
    input[301] = 2;
    RLT rlt = new RLT();
    SliceByteArray src = new SliceByteArray(input, input.length, 0);
    SliceByteArray dst = new SliceByteArray(new byte[rlt.getMaxEncodedLength(input.length)], 0);
    Assertions.assertTrue(rlt.forward(src, dst));

    // 300 = 255 + 45, then two single byte runs
    byte[] expected = new byte[] { (byte) 255, 7, 45, 7, 1, 1, 1, 2 };
    Assertions.assertArrayEquals(expected, Arrays.copyOf(dst.array, dst.index));
    Assertions.assertArrayEquals(input, roundTrip(new RLT(), input));
  }

  @Test
  void testRunLengthLongRuns() {
    for (int length : new int[] { 1, 255, 256, 510, 511, 4096, 100000 }) {
      byte[] input = new byte[length];
      int i = 0;

      while (i < length) {
        final int run = Math.min(length - i, 1 + RANDOM.nextInt(700));
        Arrays.fill(input, i, i + run, (byte) RANDOM.nextInt(3));
        i += run;
      }

      Assertions.assertArrayEquals(input, roundTrip(new RLT(), input), "length=" + length);
    }
  }

  @Test
  void testRunLengthEmptyInput() {
    RLT rlt = new RLT();
    SliceByteArray src = new SliceByteArray(new byte[0], 0, 0);
    SliceByteArray dst = new SliceByteArray(new byte[16], 0);
    Assertions.assertTrue(rlt.forward(src, dst));
    Assertions.assertEquals(0, dst.index);
    src = new SliceByteArray(new byte[0], 0, 0);
    dst = new SliceByteArray(new byte[16], 0);
    Assertions.assertTrue(rlt.inverse(src, dst));
    Assertions.assertEquals(0, dst.index);
  }

  @Test
  void testRunLengthOddStream() {
    final RLT rlt = new RLT();
    TransformException e = Assertions.assertThrows(TransformException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        rlt.inverse(new SliceByteArray(new byte[] { 3, 9, 2 }, 3, 0), new SliceByteArray(new byte[16], 0));
      }
    });

    Assertions.assertEquals(Error.ERR_DATA_INTEGRITY, e.getErrorCode());
  }

  @Test
  void testDeflateTiers() {
    Assertions.assertEquals(DeflateCodec.Tier.FASTEST, DeflateCodec.getTier(1));
    Assertions.assertEquals(DeflateCodec.Tier.FASTEST, DeflateCodec.getTier(3));
    Assertions.assertEquals(DeflateCodec.Tier.NONE, DeflateCodec.getTier(4));
    Assertions.assertEquals(DeflateCodec.Tier.NONE, DeflateCodec.getTier(6));
    Assertions.assertEquals(DeflateCodec.Tier.STRONGEST, DeflateCodec.getTier(7));
    Assertions.assertEquals(DeflateCodec.Tier.STRONGEST, DeflateCodec.getTier(9));

    Assertions.assertThrows(IllegalArgumentException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        DeflateCodec.getTier(0);
      }
    });

    // Stored blocks do not shrink the data, the other tiers do
    byte[] input = new byte[4096];
    Assertions.assertTrue(encode(new DeflateCodec(5), input).length > input.length);
    Assertions.assertTrue(encode(new DeflateCodec(1), input).length < input.length / 10);
    Assertions.assertTrue(encode(new DeflateCodec(9), input).length < input.length / 10);
  }

  @Test
  void testDeflateCorruptedInput() {
    byte[] input = generate(16, 1);
    final byte[] encoded = encode(new DeflateCodec(9), input);
    final DeflateCodec codec = new DeflateCodec(9);

    TransformException e = Assertions.assertThrows(TransformException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        // Truncated stream
        codec.inverse(new SliceByteArray(encoded, encoded.length / 2, 0), new SliceByteArray(new byte[16], 0));
      }
    });

    Assertions.assertEquals(Error.ERR_DATA_INTEGRITY, e.getErrorCode());
  }

  @Test
  void testFactoryNames() {
    TransformFactory tf = new TransformFactory();
    Assertions.assertEquals("PRED+RLE+DEFLATE", TransformFactory.getVolumePipeline(true, true));
    Assertions.assertEquals("PRED+DEFLATE", TransformFactory.getVolumePipeline(true, false));
    Assertions.assertEquals("DEFLATE", TransformFactory.getVolumePipeline(false, false));
    Assertions.assertEquals("RLE+DEFLATE", tf.getName(tf.getType("NONE+rle+deflate")));
    Map<String, Object> ctx = new HashMap<>();
    ctx.put("chunkDim", 4);
    Assertions.assertEquals(3, tf.newFunction(ctx, tf.getType("PRED+RLE+DEFLATE")).getNbTransforms());

    Assertions.assertThrows(IllegalArgumentException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        tf.getType("PRED+BWT");
      }
    });
  }

  @Test
  void testSequenceRejectsInvalidSlices() {
    Sequence seq = newPipeline("PRED+RLE+DEFLATE", 4, 5);
    byte[] input = generate(4, 1);
    SliceByteArray src = new SliceByteArray(input, input.length, 0);
    SliceByteArray dst = new SliceByteArray(new byte[seq.getMaxEncodedLength(input.length)], 0);

    dst.index = dst.array.length + 1;
    Assertions.assertFalse(seq.forward(src, dst));
    dst.index = -1;
    Assertions.assertFalse(seq.inverse(src, dst));
    Assertions.assertFalse(SliceByteArray.isValid(null));

    // Source window past the end of its array
    dst.index = 0;
    src.index = 1;
    Assertions.assertFalse(seq.forward(src, dst));
    Assertions.assertEquals(1, src.index);
    Assertions.assertEquals(0, dst.index);
  }

  @Test
  void testLargestChunkBounds() {
    final int dim = 1023;
    final int size = dim * dim * dim;
    final int rle = new RLT().getMaxEncodedLength(size);
    Assertions.assertEquals(2L * size, rle);

    final int bound = newPipeline("PRED+RLE+DEFLATE", dim, 9).getMaxEncodedLength(size);
    Assertions.assertTrue(bound >= rle, "bound=" + bound);

    Assertions.assertThrows(IllegalArgumentException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        new PredictiveCoder(dim + 1);
      }
    });
  }

  private static Sequence newPipeline(String name, int dim, int level) {
    TransformFactory tf = new TransformFactory();
    Map<String, Object> ctx = new HashMap<>();
    ctx.put("chunkDim", dim);
    ctx.put("level", level);
    return tf.newFunction(ctx, tf.getType(name));
  }

  private static byte[] encode(ByteTransform transform, byte[] input) {
    SliceByteArray src = new SliceByteArray(input, input.length, 0);
    final int required = transform.getMaxEncodedLength(input.length);
    SliceByteArray dst = new SliceByteArray(new byte[required], 0);
    Assertions.assertTrue(transform.forward(src, dst), "Forward transform failed");
    Assertions.assertEquals(input.length, src.index);
    return Arrays.copyOf(dst.array, dst.index);
  }

  private static byte[] roundTrip(ByteTransform transform, byte[] input) {
    byte[] encoded = encode(transform, input);
    SliceByteArray src = new SliceByteArray(encoded, encoded.length, 0);
    SliceByteArray dst = new SliceByteArray(new byte[input.length], 0);
    Assertions.assertTrue(transform.inverse(src, dst), "Inverse transform failed");
    return Arrays.copyOf(dst.array, dst.index);
  }

  // 0: random, 1: smooth gradient, 2: sparse, 3: extreme values
  private static byte[] generate(int dim, int kind) {
    byte[] res = new byte[dim * dim * dim];

    for (int z = 0, i = 0; z < dim; z++) {
      for (int y = 0; y < dim; y++) {
        for (int x = 0; x < dim; x++, i++) {
          switch (kind) {
          case 0:
            res[i] = (byte) RANDOM.nextInt(256);
            break;

          case 1:
            res[i] = (byte) (x * 3 + y * 5 + z * 7 + RANDOM.nextInt(3));
            break;

          case 2:
            res[i] = (RANDOM.nextInt(10) == 0) ? (byte) RANDOM.nextInt(256) : 0;
            break;

          default:
            res[i] = ((x + y + z) % 2 == 0) ? (byte) 0 : (byte) 255;
            break;
          }
        }
      }
    }

    return res;
  }
}
