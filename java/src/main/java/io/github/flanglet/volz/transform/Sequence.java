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
import io.github.flanglet.volz.SliceByteArray;

/**
 * Chains transforms. The forward direction applies them in declaration order,
 * the inverse direction in reverse order. Unlike a best effort chain, every
 * stage is mandatory: a stage that declines its input fails the whole
 * sequence.
 */
public class Sequence implements ByteTransform {
  private static final int MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;

  private final ByteTransform[] transforms;

  /**
   * Constructor with an array of transforms.
   *
   * @param transforms the array of transforms
   */
  public Sequence(ByteTransform[] transforms) {
    if (transforms == null)
      throw new NullPointerException("Invalid null transforms parameter");

    if ((transforms.length < 1) || (transforms.length > 8))
      throw new IllegalArgumentException("Only 1 to 8 transforms allowed");

    this.transforms = transforms;
  }

  @Override
  public boolean forward(SliceByteArray src, SliceByteArray dst) {
    if (src.length == 0)
      return true;

    if ((SliceByteArray.isValid(src) == false) || (SliceByteArray.isValid(dst) == false))
      return false;

    if ((long) src.index + src.length > src.array.length)
      return false;

    if (dst.length - dst.index < this.getMaxEncodedLength(src.length))
      return false;

    int count = src.length;
    SliceByteArray sa1 = new SliceByteArray(src.array, count, src.index);

    for (int i = 0; i < this.transforms.length; i++) {
      final ByteTransform t = this.transforms[i];
      final boolean last = i == this.transforms.length - 1;
      SliceByteArray sa2;

      if (last == true) {
        sa2 = new SliceByteArray(dst.array, dst.length, dst.index);
      } else {
        final int required = t.getMaxEncodedLength(count);
        sa2 = new SliceByteArray(new byte[required], required, 0);
      }

      final int savedOIdx = sa2.index;
      sa1.length = count;

      if (t.forward(sa1, sa2) == false)
        return false;

      count = sa2.index - savedOIdx;
      sa1 = new SliceByteArray(sa2.array, count, savedOIdx);
    }

    src.index += src.length;
    dst.index += count;
    return true;
  }

  @Override
  public boolean inverse(SliceByteArray src, SliceByteArray dst) {
    if (src.length == 0)
      return true;

    if ((SliceByteArray.isValid(src) == false) || (SliceByteArray.isValid(dst) == false))
      return false;

    if ((long) src.index + src.length > src.array.length)
      return false;

    int count = src.length;
    SliceByteArray sa1 = new SliceByteArray(src.array, count, src.index);

    // Process transforms in reverse order, all of them must succeed
    for (int i = this.transforms.length - 1; i >= 0; i--) {
      final SliceByteArray sa2 = (i == 0) ? dst
          : new SliceByteArray(new byte[(int) Math.min(2L * count, MAX_BUFFER_SIZE)], 0);
      final int savedOIdx = sa2.index;
      sa1.length = count;

      if (this.transforms[i].inverse(sa1, sa2) == false)
        return false;

      count = sa2.index - savedOIdx;

      if (i == 0)
        sa2.index = savedOIdx;

      sa1 = new SliceByteArray(sa2.array, count, savedOIdx);
    }

    src.index += src.length;
    dst.index += count;
    return true;
  }

  @Override
  public int getMaxEncodedLength(int srcLength) {
    int requiredSize = srcLength;

    for (ByteTransform t : this.transforms) {
      requiredSize = Math.max(requiredSize, t.getMaxEncodedLength(requiredSize));
    }

    return requiredSize;
  }

  public int getNbTransforms() {
    return this.transforms.length;
  }
}
