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
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import io.github.flanglet.volz.Error;


public class IOUtil
{
    public static final String VOLUME_FILE = "volume.bin";
    public static final String LABELS_FILE = "labels.bin";
    public static final String DESCRIPTOR_FILE = "volume.chk";
    public static final int DESCRIPTOR_SIZE = 24;


    private IOUtil()
    {
    }


    /**
     * Locates the raw containers to compress. The input is either a folder
     * holding volume.bin (and optionally labels.bin) or the volume file
     * itself, in which case a sibling labels.bin is picked up.
     *
     * @param input the input folder or volume file
     * @return the volume path and the label path (null when absent)
     * @throws IOException if no volume file can be found
     */
    public static Path[] locateInputs(Path input) throws IOException
    {
       if (Files.exists(input) == false)
          throw new VolumeIOException("Cannot access input file '"+input+"'", Error.ERR_OPEN_FILE);

       Path volume;

       if (Files.isDirectory(input) == true)
          volume = input.resolve(VOLUME_FILE);
       else if (Files.isRegularFile(input) == true)
          volume = input;
       else
          throw new VolumeIOException("Invalid file type '"+input+"'", Error.ERR_OPEN_FILE);

       if (Files.isRegularFile(volume) == false)
          throw new VolumeIOException("Cannot find volume file '"+volume+"'", Error.ERR_OPEN_FILE);

       Path parent = volume.toAbsolutePath().getParent();
       Path labels = (parent == null) ? null : parent.resolve(LABELS_FILE);

       if ((labels != null) && (Files.isRegularFile(labels) == false))
          labels = null;

       return new Path[] { volume, labels };
    }


    /**
     * Writes the legacy volume descriptor: width, height, depth, chunkDim
     * (int32) and pixelSize (float64), little endian.
     */
    public static void writeDescriptor(Path path, ContainerHeader header) throws IOException
    {
       ByteBuffer buf = ByteBuffer.allocate(DESCRIPTOR_SIZE).order(ByteOrder.LITTLE_ENDIAN);
       buf.putInt(header.getWidth());
       buf.putInt(header.getHeight());
       buf.putInt(header.getDepth());
       buf.putInt(header.getChunkDim());
       buf.putDouble(header.getPixelSize());

       try (OutputStream os = Files.newOutputStream(path))
       {
          os.write(buf.array());
       }
    }


    /**
     * Reads a legacy volume descriptor back into a volume header (8 bits per
     * voxel, chunk counts covering the extents).
     */
    public static VolumeHeader readDescriptor(Path path) throws IOException
    {
       byte[] bytes = new byte[DESCRIPTOR_SIZE];

       try (InputStream is = Files.newInputStream(path))
       {
          HeaderCodec.readFully(is, bytes, 0, DESCRIPTOR_SIZE, "volume descriptor");
       }

       ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);

       try
       {
          return new VolumeHeader(buf.getInt(), buf.getInt(), buf.getInt(), buf.getInt(),
             VolumeHeader.DEFAULT_BITS_PER_PIXEL, buf.getDouble());
       }
       catch (IllegalArgumentException e)
       {
          throw new VolumeIOException("Invalid volume descriptor: "+e.getMessage(), e, Error.ERR_INVALID_FILE);
       }
    }


    /**
     * Deletes the given files, ignoring null entries. Failures are reported
     * on the error stream.
     */
    public static void deleteQuietly(Path... paths)
    {
       for (Path p : paths)
       {
          if (p == null)
             continue;

          try
          {
             Files.deleteIfExists(p);
          }
          catch (IOException e)
          {
             System.err.println("Failed to delete '"+p+"': "+e.getMessage());
          }
       }
    }
}
