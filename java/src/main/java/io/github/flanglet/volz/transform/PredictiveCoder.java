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

package io.github.flanglet.volz.transform;

import java.util.Map;
import io.github.flanglet.volz.ByteTransform;
import io.github.flanglet.volz.Error;
import io.github.flanglet.volz.SliceByteArray;
import io.github.flanglet.volz.TransformException;

/**
 * 3D predictive coding of a cubic chunk.
 * <p>
 * Voxels are visited in z, y, x order (flat index {@code z*n*n + y*n + x}).
 * Each voxel is predicted as the truncated mean of the neighbors at
 * {@code (x-1,y,z)}, {@code (x,y-1,z)} and {@code (x,y,z-1)} that exist, and
 * the residual {@code original - prediction + 128} is stored modulo 256. The
 * first voxel has no neighbor and is stored verbatim. Decoding walks the same
 * order and predicts from the voxels already restored, so both directions
 * see identical predictions.
 */
public class PredictiveCoder implements ByteTransform {
  private static final int BIAS = 128;

  private final int dim;
  private final int plane;
  private final int size;

  /**
   * Constructor with the chunk edge length.
   *
   * @param dim the edge length of the cubic chunk
   */
  public PredictiveCoder(int dim) {
    if ((dim < 1) || (dim > 1023))
      throw new IllegalArgumentException("Invalid chunk dimension: " + dim);

    this.dim = dim;
    this.plane = dim * dim;
    this.size = this.plane * dim;
  }

  /**
   * Constructor with a context map holding the "chunkDim" entry.
   *
   * @param ctx the context map
   */
  public PredictiveCoder(Map<String, Object> ctx) {
    this(chunkDim(ctx));
  }

  private static int chunkDim(Map<String, Object> ctx) {
    Integer dim = (Integer) ctx.get("chunkDim");

    if (dim == null)
      throw new NullPointerException("Invalid null chunk dimension parameter");

    return dim;
  }

  @Override
  public boolean forward(SliceByteArray input, SliceByteArray output) {
    if (input.length == 0)
      return true;

    if (input.length != this.size)
      return false;

    if (input.array == output.array)
      return false;

    if (output.length - output.index < this.size)
      return false;

    final byte[] src = input.array;
    final byte[] dst = output.array;
    final int srcIdx = input.index;
    final int dstIdx = output.index;
    dst[dstIdx] = src[srcIdx];

    for (int idx = 1; idx < this.size; idx++) {
      final int pred = this.predict(src, srcIdx, idx);
      dst[dstIdx + idx] = (byte) ((src[srcIdx + idx] & 0xFF) - pred + BIAS);
    }

    input.index += this.size;
    output.index += this.size;
    return true;
  }

  @Override
  public boolean inverse(SliceByteArray input, SliceByteArray output) {
    if (input.length == 0)
      return true;

    if (input.length != this.size)
      throw new TransformException("Invalid predictive block length: got " + input.length
          + " bytes, expected " + this.size, Error.ERR_DATA_INTEGRITY);

    if (input.array == output.array)
      return false;

    output.ensureCapacity(output.index + this.size);
    final byte[] src = input.array;
    final byte[] dst = output.array;
    final int srcIdx = input.index;
    final int dstIdx = output.index;
    dst[dstIdx] = src[srcIdx];

    for (int idx = 1; idx < this.size; idx++) {
      // Predict from restored voxels only
      final int pred = this.predict(dst, dstIdx, idx);
      dst[dstIdx + idx] = (byte) (pred + (src[srcIdx + idx] & 0xFF) - BIAS);
    }

    input.index += this.size;
    output.index += this.size;
    return true;
  }

  // Truncated mean of the causal neighbors of voxel idx (idx > 0)
  private int predict(byte[] buf, int base, int idx) {
    final int x = idx % this.dim;
    final int y = (idx / this.dim) % this.dim;
    final int z = idx / this.plane;
    int sum = 0;
    int count = 0;

    if (x > 0) {
      sum += buf[base + idx - 1] & 0xFF;
      count++;
    }

    if (y > 0) {
      sum += buf[base + idx - this.dim] & 0xFF;
      count++;
    }

    if (z > 0) {
      sum += buf[base + idx - this.plane] & 0xFF;
      count++;
    }

    return sum / count;
  }

  @Override
  public int getMaxEncodedLength(int srcLength) {
    return srcLength;
  }
}
