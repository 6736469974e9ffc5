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

import io.github.flanglet.volz.ByteTransform;
import io.github.flanglet.volz.Error;
import io.github.flanglet.volz.SliceByteArray;
import io.github.flanglet.volz.TransformException;

/**
 * Run length transform emitting one (runLength, value) pair per run.
 * Runs longer than 255 are split into several pairs, so the output is at most
 * twice as long as the input.
 */
public class RLT implements ByteTransform {
  private static final int MAX_RUN = 255;

  /**
   * Default constructor.
   */
  public RLT() {
  }

  @Override
  public boolean forward(SliceByteArray input, SliceByteArray output) {
    if (input.length == 0)
      return true;

    if (input.array == output.array)
      return false;

    final int count = input.length;

    if (output.length - output.index < this.getMaxEncodedLength(count))
      return false;

    final byte[] src = input.array;
    final byte[] dst = output.array;
    final int srcEnd = input.index + count;
    int srcIdx = input.index;
    int dstIdx = output.index;

    while (srcIdx < srcEnd) {
      final byte val = src[srcIdx];
      int run = 1;

      while ((srcIdx + run < srcEnd) && (run < MAX_RUN) && (src[srcIdx + run] == val))
        run++;

      dst[dstIdx++] = (byte) run;
      dst[dstIdx++] = val;
      srcIdx += run;
    }

    input.index = srcIdx;
    output.index = dstIdx;
    return true;
  }

  @Override
  public boolean inverse(SliceByteArray input, SliceByteArray output) {
    if (input.length == 0)
      return true;

    final int count = input.length;

    if ((count & 1) != 0)
      throw new TransformException("Invalid run length stream: odd length " + count,
          Error.ERR_DATA_INTEGRITY);

    final byte[] src = input.array;
    final int srcEnd = input.index + count;
    int total = 0;

    // First pass: validate the tokens and size the output
    for (int i = input.index; i < srcEnd; i += 2) {
      final int run = src[i] & 0xFF;

      if (run == 0)
        throw new TransformException("Invalid run length stream: null run at offset " + (i - input.index),
            Error.ERR_DATA_INTEGRITY);

      total += run;
    }

    output.ensureCapacity(output.index + total);
    final byte[] dst = output.array;
    int dstIdx = output.index;

    for (int i = input.index; i < srcEnd; i += 2) {
      final int run = src[i] & 0xFF;
      final byte val = src[i + 1];

      for (int j = 0; j < run; j++)
        dst[dstIdx++] = val;
    }

    input.index = srcEnd;
    output.index = dstIdx;
    return true;
  }

  @Override
  public int getMaxEncodedLength(int srcLength) {
    return 2 * srcLength;
  }
}
