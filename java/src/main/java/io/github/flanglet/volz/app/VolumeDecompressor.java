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

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import io.github.flanglet.volz.Error;
import io.github.flanglet.volz.Listener;
import io.github.flanglet.volz.io.CompressedVolumeReader;
import io.github.flanglet.volz.io.ContainerHeader;
import io.github.flanglet.volz.io.IOUtil;
import io.github.flanglet.volz.io.LabelHeader;
import io.github.flanglet.volz.io.RawContainerFile;
import io.github.flanglet.volz.io.VolumeHeader;
import io.github.flanglet.volz.io.VolumeIOException;


/**
 * Decompresses a compressed volume file into a folder holding the raw
 * containers: volume.bin, labels.bin (if the container has labels) and the
 * volume.chk descriptor. Records are decoded sequentially.
 */
public class VolumeDecompressor implements Runnable, Callable<Integer>
{
   private static final int DEFAULT_BUFFER_SIZE = 65536;

   private final int verbosity;
   private final boolean overwrite;
   private final String inputName;
   private final String outputName;
   private final List<Listener> listeners;


   /**
    * Constructs a {@code VolumeDecompressor}.
    *
    * @param map the options: "inputName" (required), "outputName" (the
    *        destination folder), "verbose", "overwrite"
    */
   public VolumeDecompressor(Map<String, Object> map)
   {
      this.overwrite = Boolean.TRUE.equals(map.remove("overwrite"));
      String iName = (String) map.remove("inputName");

      if ((iName == null) || (iName.isEmpty() == true))
         throw new IllegalArgumentException("Missing input name");

      this.inputName = iName;
      String oName = (String) map.remove("outputName");
      this.outputName = ((oName == null) || (oName.isEmpty() == true)) ? defaultOutputName(iName) : oName;
      Integer verbose = (Integer) map.remove("verbose");
      this.verbosity = (verbose == null) ? 1 : verbose;
      this.listeners = new ArrayList<>(10);

      // Decoding is sequential
      map.remove("jobs");

      if (this.verbosity > 2)
         this.addListener(new InfoPrinter(this.verbosity, InfoPrinter.Type.DECODING, System.out));

      if ((this.verbosity > 0) && (map.size() > 0))
      {
         for (String k : map.keySet())
            printOut("Warning: Ignoring invalid option [" + k + "]", true);
      }
   }


   static String defaultOutputName(String inputName)
   {
      if ((inputName.length() > VolumeCompressor.EXTENSION.length())
         && (inputName.toLowerCase().endsWith(VolumeCompressor.EXTENSION) == true))
         return inputName.substring(0, inputName.length()-VolumeCompressor.EXTENSION.length());

      return inputName + ".out";
   }


   public void dispose()
   {
      this.listeners.clear();
   }


   @Override
   public void run()
   {
      this.call();
   }


   /**
    * Runs the decompression.
    *
    * @return 0 on success, an error code otherwise
    */
   @Override
   public Integer call()
   {
      if (this.verbosity > 2)
      {
         printOut("Verbosity: "+this.verbosity, true);
         printOut("Overwrite: "+this.overwrite, true);
         printOut("Input file name: '"+this.inputName+"'", true);
         printOut("Output folder: '"+this.outputName+"'", true);
      }

      Path input = Paths.get(this.inputName);
      Path folder = Paths.get(this.outputName);

      if (Files.isRegularFile(input) == false)
      {
         System.err.println("Cannot access input file '"+this.inputName+"'");
         return Error.ERR_OPEN_FILE;
      }

      if ((Files.exists(folder) == true) && (Files.isDirectory(folder) == false))
      {
         System.err.println("The output '"+this.outputName+"' is not a folder");
         return Error.ERR_CREATE_FILE;
      }

      Path volumePath = folder.resolve(IOUtil.VOLUME_FILE);
      Path labelPath = folder.resolve(IOUtil.LABELS_FILE);
      Path descriptorPath = folder.resolve(IOUtil.DESCRIPTOR_FILE);

      if ((this.overwrite == false) && ((Files.exists(volumePath) == true) || (Files.exists(labelPath) == true)
         || (Files.exists(descriptorPath) == true)))
      {
         System.err.println("Folder '" + this.outputName + "' already holds a volume and " +
            "the 'force' command line option has not been provided");
         return Error.ERR_OVERWRITE_FILE;
      }

      try
      {
         Files.createDirectories(folder);
      }
      catch (IOException e)
      {
         System.err.println("Cannot create output folder '"+this.outputName+"': "+e.getMessage());
         return Error.ERR_CREATE_FILE;
      }

      printOut("\nDecompressing "+this.inputName+" ...", this.verbosity>1);
      long read = 0;
      long written = 0;
      int code = 0;
      long before = System.nanoTime();

      // Files created or truncated by this call, removed on failure
      List<Path> outputs = new ArrayList<>(3);

      try (InputStream is = new BufferedInputStream(Files.newInputStream(input), DEFAULT_BUFFER_SIZE))
      {
         CompressedVolumeReader reader = new CompressedVolumeReader(is);

         for (Listener bl : this.listeners)
            reader.addListener(bl);

         ContainerHeader ch = reader.readHeader();

         // The bit depth is not stored in the container
         VolumeHeader vh = new VolumeHeader(ch.getWidth(), ch.getHeight(), ch.getDepth(), ch.getChunkDim(),
            VolumeHeader.DEFAULT_BITS_PER_PIXEL, ch.getPixelSize());

         try (RawContainerFile volume = RawContainerFile.createVolume(volumePath, vh))
         {
            outputs.add(volumePath);
            reader.readVolume(volume);
         }

         written += vh.getFileSize();
         LabelHeader lh = reader.readLabelHeader();

         if (lh != null)
         {
            try (RawContainerFile labels = RawContainerFile.createLabels(labelPath, lh))
            {
               outputs.add(labelPath);
               reader.readLabels(labels);
            }

            written += lh.getFileSize();
         }

         IOUtil.writeDescriptor(descriptorPath, ch);
         outputs.add(descriptorPath);
         written += IOUtil.DESCRIPTOR_SIZE;
         read = reader.getRead();

         // A label file left by a previous run does not belong to this volume
         if (lh == null)
            Files.deleteIfExists(labelPath);
      }
      catch (VolumeIOException e)
      {
         System.err.println("Decompression failure for '"+this.inputName+"': "+e.getMessage());
         code = e.getErrorCode();
      }
      catch (IOException e)
      {
         System.err.println("Decompression failure for '"+this.inputName+"': "+e.getMessage());
         code = Error.ERR_WRITE_FILE;
      }
      catch (Exception e)
      {
         System.err.println("An unexpected condition happened. Exiting ...");
         System.err.println(e.getMessage());
         code = Error.ERR_UNKNOWN;
      }
      finally
      {
         // Partially regenerated containers are useless
         if (code != 0)
            IOUtil.deleteQuietly(outputs.toArray(new Path[outputs.size()]));
      }

      if (code != 0)
         return code;

      long delta = (System.nanoTime() - before) / 1000000L; // convert to ms

      if (this.verbosity >= 1)
      {
         String str = (delta >= 100000) ? String.format("%1$.1f", (float) delta/1000) + " s" : delta + " ms";

         if (this.verbosity > 1)
         {
            printOut("", true);
            printOut("Decompression time: "+str, true);
            printOut("Input size:         "+read, true);
            printOut("Output size:        "+written, true);

            if ((delta != 0) && (written != 0))
               printOut("Throughput (KiB/s): "+(((written * 1000L) >> 10) / delta), true);

            printOut("", true);
         }
         else
         {
            printOut(String.format("Decompressed %s: %d => %d in %s", this.inputName, read, written, str), true);
         }
      }

      return 0;
   }


   private static void printOut(String msg, boolean print)
   {
      if ((print == true) && (msg != null))
         System.out.println(msg);
   }


   public final boolean addListener(Listener bl)
   {
      return (bl != null) ? this.listeners.add(bl) : false;
   }


   public final boolean removeListener(Listener bl)
   {
      return (bl != null) ? this.listeners.remove(bl) : false;
   }
}
