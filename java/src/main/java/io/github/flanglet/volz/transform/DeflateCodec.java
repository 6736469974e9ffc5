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
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;
import io.github.flanglet.volz.ByteTransform;
import io.github.flanglet.volz.Error;
import io.github.flanglet.volz.SliceByteArray;
import io.github.flanglet.volz.TransformException;

/**
 * Raw DEFLATE (no zlib wrapper, no checksum) over java.util.zip.
 * <p>
 * The container compression level (1 to 9) selects one of three tiers:
 * levels 1 to 3 use the fastest setting, levels 7 to 9 the strongest one and
 * levels 4 to 6 emit stored (uncompressed) DEFLATE blocks. The middle tier is
 * kept as is for compatibility with existing containers, so level 5 does not
 * compress at this stage.
 */
public class DeflateCodec implements ByteTransform {
  public static final int DEFAULT_LEVEL = 5;

  public enum Tier {
    FASTEST(Deflater.BEST_SPEED),
    NONE(Deflater.NO_COMPRESSION),
    STRONGEST(Deflater.BEST_COMPRESSION);

    private final int deflaterLevel;

    Tier(int deflaterLevel) {
      this.deflaterLevel = deflaterLevel;
    }

    public int getDeflaterLevel() {
      return this.deflaterLevel;
    }
  }

  private final Tier tier;

  /**
   * Constructor with a container compression level.
   *
   * @param level the compression level in [1..9]
   */
  public DeflateCodec(int level) {
    this.tier = getTier(level);
  }

  /**
   * Constructor with a context map. The "level" entry defaults to 5.
   *
   * @param ctx the context map
   */
  public DeflateCodec(Map<String, Object> ctx) {
    this((Integer) ctx.getOrDefault("level", DEFAULT_LEVEL));
  }

  /**
   * Maps a container compression level to a DEFLATE tier.
   *
   * @param level the compression level in [1..9]
   * @return the tier
   */
  public static Tier getTier(int level) {
    if ((level < 1) || (level > 9))
      throw new IllegalArgumentException("Invalid compression level (must be in [1..9]): " + level);

    if (level <= 3)
      return Tier.FASTEST;

    if (level >= 7)
      return Tier.STRONGEST;

    return Tier.NONE;
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

    final Deflater deflater = new Deflater(this.tier.getDeflaterLevel(), true);
    int dstIdx = output.index;

    try {
      deflater.setInput(input.array, input.index, count);
      deflater.finish();

      while (deflater.finished() == false) {
        final int room = output.array.length - dstIdx;

        if (room == 0)
          return false;

        dstIdx += deflater.deflate(output.array, dstIdx, room);
      }
    } finally {
      deflater.end();
    }

    input.index += count;
    output.index = dstIdx;
    return true;
  }

  @Override
  public boolean inverse(SliceByteArray input, SliceByteArray output) {
    if (input.length == 0)
      return true;

    if (input.array == output.array)
      return false;

    final int count = input.length;
    final Inflater inflater = new Inflater(true);
    output.ensureCapacity(output.index + 2 * count);
    int dstIdx = output.index;

    try {
      inflater.setInput(input.array, input.index, count);

      while (inflater.finished() == false) {
        if (dstIdx == output.array.length)
          output.ensureCapacity(dstIdx + count + 64);

        final int n = inflater.inflate(output.array, dstIdx, output.array.length - dstIdx);
        dstIdx += n;

        if ((n == 0) && (inflater.finished() == false)) {
          if (inflater.needsInput() == true)
            throw new TransformException("Truncated DEFLATE stream", Error.ERR_DATA_INTEGRITY);

          if (inflater.needsDictionary() == true)
            throw new TransformException("Unexpected DEFLATE dictionary request", Error.ERR_DATA_INTEGRITY);
        }
      }

      if (inflater.getRemaining() != 0)
        throw new TransformException("Trailing bytes after DEFLATE stream: " + inflater.getRemaining(),
            Error.ERR_DATA_INTEGRITY);
    } catch (DataFormatException e) {
      throw new TransformException("Invalid DEFLATE stream: " + e.getMessage(), e, Error.ERR_DATA_INTEGRITY);
    } finally {
      inflater.end();
    }

    input.index += count;
    output.index = dstIdx;
    return true;
  }

  @Override
  public int getMaxEncodedLength(int srcLength) {
    // Above the zlib bound for both stored and compressed blocks
    return srcLength + (srcLength >> 10) + 128;
  }
}
