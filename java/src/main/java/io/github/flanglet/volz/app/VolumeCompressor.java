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

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import io.github.flanglet.volz.Error;
import io.github.flanglet.volz.Listener;
import io.github.flanglet.volz.io.CompressedVolumeWriter;
import io.github.flanglet.volz.io.IOUtil;
import io.github.flanglet.volz.io.MappedChunkSource;
import io.github.flanglet.volz.io.VolumeHeader;
import io.github.flanglet.volz.io.VolumeIOException;
import io.github.flanglet.volz.transform.DeflateCodec;
import io.github.flanglet.volz.transform.TransformFactory;


/**
 * Compresses a raw volume container (and its label container, if any) into
 * a compressed volume file. Chunks are encoded concurrently.
 */
public class VolumeCompressor implements Runnable, Callable<Integer>
{
   public static final String EXTENSION = ".vlz";
   private static final int DEFAULT_BUFFER_SIZE = 65536;
   private static final int MAX_CONCURRENCY = 64;

   private final int verbosity;
   private final boolean overwrite;
   private final boolean predictive;
   private final boolean rle;
   private final int level;
   private final String inputName;
   private final String outputName;
   private final int jobs;
   private final List<Listener> listeners;
   private final ExecutorService pool;


   /**
    * Constructs a {@code VolumeCompressor}.
    *
    * @param map the options: "inputName" (required), "outputName", "level",
    *        "predictive", "rle", "jobs", "verbose", "overwrite"
    */
   public VolumeCompressor(Map<String, Object> map)
   {
      this.level = map.containsKey("level") ? (Integer) map.remove("level") : DeflateCodec.DEFAULT_LEVEL;

      if ((this.level < 1) || (this.level > 9))
         throw new IllegalArgumentException("Invalid compression level (must be in [1..9]), got " + this.level);

      this.predictive = !Boolean.FALSE.equals(map.remove("predictive"));
      this.rle = !Boolean.FALSE.equals(map.remove("rle"));
      this.overwrite = Boolean.TRUE.equals(map.remove("overwrite"));
      String iName = (String) map.remove("inputName");

      if ((iName == null) || (iName.isEmpty() == true))
         throw new IllegalArgumentException("Missing input name");

      this.inputName = iName;
      String oName = (String) map.remove("outputName");
      this.outputName = ((oName == null) || (oName.isEmpty() == true)) ? defaultOutputName(iName) : oName;
      Integer verbose = (Integer) map.remove("verbose");
      this.verbosity = (verbose == null) ? 1 : verbose;
      Integer concurrency = (Integer) map.remove("jobs");
      int tasks = ((concurrency == null) || (concurrency == 0)) ? Runtime.getRuntime().availableProcessors() : concurrency;

      if (tasks > MAX_CONCURRENCY)
      {
         printOut("Warning: the number of jobs is too high, defaulting to "+MAX_CONCURRENCY, this.verbosity>0);
         tasks = MAX_CONCURRENCY;
      }

      if (tasks < 0)
         throw new IllegalArgumentException("Invalid number of jobs: " + tasks);

      this.jobs = tasks;
      this.pool = (this.jobs > 1) ? Executors.newFixedThreadPool(this.jobs) : null;
      this.listeners = new ArrayList<>(10);

      if (this.verbosity > 2)
         this.addListener(new InfoPrinter(this.verbosity, InfoPrinter.Type.ENCODING, System.out));

      if ((this.verbosity > 0) && (map.size() > 0))
      {
         for (String k : map.keySet())
            printOut("Warning: Ignoring invalid option [" + k + "]", true);
      }
   }


   static String defaultOutputName(String inputName)
   {
      String name = inputName;

      while ((name.length() > 1) && ((name.endsWith("/") == true) || (name.endsWith("\\") == true)))
         name = name.substring(0, name.length()-1);

      return name + EXTENSION;
   }


   public void dispose()
   {
      if (this.pool != null)
         this.pool.shutdown();
   }


   @Override
   public void run()
   {
      this.call();
   }


   /**
    * Runs the compression.
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
         printOut("Using "+this.jobs+" job"+((this.jobs > 1) ? "s" : ""), true);
         printOut("Using "+TransformFactory.getVolumePipeline(this.predictive, this.rle)+" pipeline (level "
            +this.level+", deflate tier "+DeflateCodec.getTier(this.level)+")", true);
      }

      Map<String, Object> ctx = new HashMap<>();
      ctx.put("verbosity", this.verbosity);
      ctx.put("overwrite", this.overwrite);
      ctx.put("inputName", this.inputName);
      ctx.put("outputName", this.outputName);
      ctx.put("level", this.level);
      ctx.put("predictive", this.predictive);
      ctx.put("rle", this.rle);
      ctx.put("jobs", this.jobs);

      if (this.pool != null)
         ctx.put("pool", this.pool);

      FileCompressTask task = new FileCompressTask(ctx, this.listeners);

      try
      {
         return task.call().code;
      }
      finally
      {
         this.dispose();
      }
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


   static class FileCompressResult
   {
      final int code;
      final long read;
      final long written;


      public FileCompressResult(int code, long read, long written)
      {
         this.code = code;
         this.read = read;
         this.written = written;
      }
   }


   static class FileCompressTask implements Callable<FileCompressResult>
   {
      private final Map<String, Object> ctx;
      private final List<Listener> listeners;


      public FileCompressTask(Map<String, Object> ctx, List<Listener> listeners)
      {
         this.ctx = ctx;
         this.listeners = listeners;
      }


      @Override
      public FileCompressResult call()
      {
         int verbosity = (Integer) this.ctx.get("verbosity");
         String inputName = (String) this.ctx.get("inputName");
         String outputName = (String) this.ctx.get("outputName");
         boolean overwrite = (Boolean) this.ctx.get("overwrite");
         Path[] inputs;

         try
         {
            inputs = IOUtil.locateInputs(Paths.get(inputName));
         }
         catch (VolumeIOException e)
         {
            System.err.println(e.getMessage());
            return new FileCompressResult(e.getErrorCode(), 0, 0);
         }
         catch (IOException e)
         {
            System.err.println("Cannot access input '"+inputName+"': "+e.getMessage());
            return new FileCompressResult(Error.ERR_OPEN_FILE, 0, 0);
         }

         if (verbosity > 2)
         {
            printOut("Input volume file: '" + inputs[0] + "'", true);

            if (inputs[1] != null)
               printOut("Input label file: '" + inputs[1] + "'", true);

            printOut("Output file name: '" + outputName + "'", true);
         }

         Path output = Paths.get(outputName);

         if (Files.exists(output))
         {
            if (Files.isDirectory(output))
            {
               System.err.println("The output file is a directory");
               return new FileCompressResult(Error.ERR_OUTPUT_IS_DIR, 0, 0);
            }

            if (overwrite == false)
            {
               System.err.println("File '" + outputName + "' exists and " +
                  "the 'force' command line option has not been provided");
               return new FileCompressResult(Error.ERR_OVERWRITE_FILE, 0, 0);
            }

            for (Path p : inputs)
            {
               if ((p != null) && (p.toAbsolutePath().equals(output.toAbsolutePath())))
               {
                  System.err.println("The input and output files must be different");
                  return new FileCompressResult(Error.ERR_CREATE_FILE, 0, 0);
               }
            }
         }

         MappedChunkSource volume = null;
         MappedChunkSource labels = null;
         long read = 0;

         try
         {
            volume = MappedChunkSource.openVolume(inputs[0]);
            read += volume.getVolumeHeader().getFileSize();

            if (inputs[1] != null)
            {
               labels = MappedChunkSource.openLabels(inputs[1]);
               read += labels.getLabelHeader().getFileSize();
            }
         }
         catch (IOException e)
         {
            closeQuietly(volume);
            System.err.println("Cannot open input file: " + e.getMessage());
            int code = (e instanceof VolumeIOException) ? ((VolumeIOException) e).getErrorCode() : Error.ERR_OPEN_FILE;
            return new FileCompressResult(code, 0, 0);
         }

         printOut("\nCompressing "+inputName+" ...", verbosity>1);
         final VolumeHeader header = volume.getVolumeHeader();
         long written = 0;
         int code = 0;
         boolean created = false;
         long before = System.nanoTime();

         try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(output), DEFAULT_BUFFER_SIZE))
         {
            created = true;
            CompressedVolumeWriter writer;

            try
            {
               writer = new CompressedVolumeWriter(os, this.ctx);
            }
            catch (Exception e)
            {
               System.err.println("Cannot create compressor: "+e.getMessage());
               code = Error.ERR_CREATE_COMPRESSOR;
               return new FileCompressResult(code, read, 0);
            }

            for (Listener bl : this.listeners)
               writer.addListener(bl);

            writer.write(header, volume, labels);
            written = writer.getWritten();
         }
         catch (VolumeIOException e)
         {
            System.err.println("Compression failure for '"+inputName+"': "+e.getMessage());
            code = e.getErrorCode();
         }
         catch (IOException e)
         {
            System.err.println("Cannot write output file '"+outputName+"': "+e.getMessage());
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
            closeQuietly(volume);
            closeQuietly(labels);

            // A partial container is useless
            if ((code != 0) && (created == true))
               IOUtil.deleteQuietly(output);
         }

         if (code != 0)
            return new FileCompressResult(code, read, 0);

         long delta = (System.nanoTime() - before) / 1000000L; // convert to ms

         if (verbosity >= 1)
         {
            String str = (delta >= 100000) ? String.format("%1$.1f", (float) delta/1000) + " s" : delta + " ms";

            if (verbosity > 1)
            {
               printOut("", true);
               printOut("Compression time:  "+str, true);
               printOut("Input size:        "+read, true);
               printOut("Output size:       "+written, true);

               if (read != 0)
                  printOut("Compression ratio: "+String.format("%1$.6f", (written / (float) read)), true);

               if ((delta != 0) && (read != 0))
                  printOut("Throughput (KiB/s): "+(((read * 1000L) >> 10) / delta), true);

               printOut("", true);
            }
            else
            {
               float f = (read == 0) ? 0 : written / (float) read;
               printOut(String.format("Compressed %s: %d => %d (%.2f%%) in %s", inputName, read, written, 100*f, str), true);
            }
         }

         return new FileCompressResult(0, read, written);
      }


      private static void closeQuietly(MappedChunkSource source)
      {
         if (source == null)
            return;

         try
         {
            source.close();
         }
         catch (IOException e)
         {
            System.err.println("Failed to close input: "+e.getMessage());
         }
      }
   }
}
