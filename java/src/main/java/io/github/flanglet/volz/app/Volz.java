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

import java.util.HashMap;
import java.util.Map;
import io.github.flanglet.volz.Error;



/**
 * Command line entry point: compresses a chunked CT volume or decompresses a
 * compressed volume back into its raw containers.
 */
public class Volz
{
   private static final String[] CMD_LINE_ARGS = new String[]
   {
      "-c", "-d", "-i", "-o", "-l", "-j", "-v", "-f", "-h"
   };

   //private static final int ARG_IDX_COMPRESS = 0;
   //private static final int ARG_IDX_DECOMPRESS = 1;
   private static final int ARG_IDX_INPUT = 2;
   private static final int ARG_IDX_OUTPUT = 3;
   private static final int ARG_IDX_LEVEL = 4;
   private static final int ARG_IDX_JOBS = 5;
   private static final int ARG_IDX_VERBOSE = 6;

   private static final String VOLZ_VERSION = "1.0.0";
   private static final String APP_HEADER = "Volz " + VOLZ_VERSION + " (c) Frederic Langlet";
   private static final String APP_SUB_HEADER = "Chunked CT volume compressor.";
   private static final String APP_USAGE = "Usage: java -jar volz.jar [-c|-d] [flags and files in any order]";


   public static void main(String[] args)
   {
      Map<String, Object> map = new HashMap<>();
      int status = processCommandLine(args, map);

      // Command line processing error ?
      if (status != 0)
         System.exit(status);

      // Help mode only ?
      if (map.containsKey("mode") == false)
         System.exit(0);

      System.exit(execute(map));
   }


   /**
    * Runs the compressor or the decompressor selected by the "mode" entry.
    *
    * @param map the options produced by the command line parser
    * @return 0 on success, an error code otherwise
    */
   static int execute(Map<String, Object> map)
   {
      char mode = (char) map.remove("mode");

      if (mode == 'c')
      {
         VolumeCompressor vc;

         try
         {
            vc = new VolumeCompressor(map);
         }
         catch (Exception e)
         {
            System.err.println("Could not create the compressor: "+e.getMessage());
            return Error.ERR_CREATE_COMPRESSOR;
         }

         return vc.call();
      }

      if (mode == 'd')
      {
         VolumeDecompressor vd;

         try
         {
            vd = new VolumeDecompressor(map);
         }
         catch (Exception e)
         {
            System.err.println("Could not create the decompressor: "+e.getMessage());
            return Error.ERR_CREATE_DECOMPRESSOR;
         }

         return vd.call();
      }

      System.out.println("Missing arguments: try --help or -h");
      return Error.ERR_MISSING_PARAM;
   }


    /**
     * Parses the command line into the option map.
     *
     * @param args the command line arguments
     * @param map receives the options
     * @return 0 on success, an error code otherwise
     */
    static int processCommandLine(String[] args, Map<String, Object> map)
    {
        int verbose = 1;
        boolean overwrite = false;
        boolean predictive = true;
        boolean rle = true;
        String inputName = "";
        String outputName = "";
        String verboseLevel = null;
        int tasks = -1;
        int ctx = -1;
        int level = -1;
        char mode = ' ';
        boolean showHelp = false;

        // First pass: mode, verbosity and help
        for (String arg : args)
        {
           arg = arg.trim();

           if (arg.startsWith("--verbose=") || arg.equals("-v"))
           {
              ctx = ARG_IDX_VERBOSE;

              if (arg.equals("-v"))
                 continue;
           }

           if (arg.equals("--compress") || arg.equals("-c"))
           {
              if (mode == 'd')
              {
                  System.err.println("Both compression and decompression options were provided.");
                  return Error.ERR_INVALID_PARAM;
              }

              mode = 'c';
              ctx = -1;
              continue;
           }

           if (arg.equals("--decompress") || arg.equals("-d"))
           {
              if (mode == 'c')
              {
                  System.err.println("Both compression and decompression options were provided.");
                  return Error.ERR_INVALID_PARAM;
              }

              mode = 'd';
              ctx = -1;
              continue;
           }

           if (ctx == ARG_IDX_VERBOSE)
           {
              if (verboseLevel != null)
              {
                 printWarning("--verbose", " (duplicate verbosity).", verbose);
              }
              else
              {
                 verboseLevel = arg.startsWith("--verbose=") ? arg.substring(10).trim() : arg;

                 try
                 {
                    verbose = Integer.parseInt(verboseLevel);

                    if ((verbose < 0) || (verbose > 5))
                       throw new NumberFormatException();
                 }
                 catch (NumberFormatException e)
                 {
                    System.err.println("Invalid verbosity level provided on command line: "+arg);
                    return Error.ERR_INVALID_PARAM;
                 }
              }
           }
           else if (arg.equals("--help") || arg.equals("-h"))
           {
              showHelp = true;
           }

           ctx = -1;
        }

        if ((showHelp == true) || (args.length == 0))
        {
            printHelp(mode);
            return 0;
        }

        printOut("\n"+APP_HEADER+"\n", verbose>=1);
        printOut(APP_SUB_HEADER, verbose>1);
        ctx = -1;

        for (String arg : args)
        {
           arg = arg.trim();

           if (arg.equals("--compress") || arg.equals("-c") || arg.equals("--decompress") || arg.equals("-d"))
           {
              if (ctx != -1)
                 printWarning(CMD_LINE_ARGS[ctx], " with no value.", verbose);

              ctx = -1;
              continue;
           }

           if (arg.equals("--force") || arg.equals("-f"))
           {
              if (ctx != -1)
                 printWarning(CMD_LINE_ARGS[ctx], " with no value.", verbose);

              overwrite = true;
              ctx = -1;
              continue;
           }

           if (arg.equals("--no-predictive") || arg.equals("--no-rle"))
           {
              if (ctx != -1)
                 printWarning(CMD_LINE_ARGS[ctx], " with no value.", verbose);

              ctx = -1;

              if (mode != 'c')
              {
                 printWarning(arg, " Only applicable in compress mode.", verbose);
                 continue;
              }

              if (arg.equals("--no-rle"))
                 rle = false;
              else
                 predictive = false;

              continue;
           }

           if (ctx == -1)
           {
              int idx = -1;

              for (int i=0; i<CMD_LINE_ARGS.length; i++)
              {
                 if (CMD_LINE_ARGS[i].equals(arg))
                 {
                    idx = i;
                    break;
                 }
              }

              if (idx != -1)
              {
                 ctx = idx;
                 continue;
              }
           }

           if (arg.startsWith("--output=") || (ctx == ARG_IDX_OUTPUT))
           {
              String name = arg.startsWith("--output=") ? arg.substring(9).trim() : arg;

              if (outputName.isEmpty() == false)
                 printWarning("--output", " (duplicate output name).", verbose);
              else
                 outputName = name;

              ctx = -1;
              continue;
           }

           if (arg.startsWith("--input=") || (ctx == ARG_IDX_INPUT))
           {
              String name = arg.startsWith("--input=") ? arg.substring(8).trim() : arg;

              if (inputName.isEmpty() == false)
                 printWarning("--input", " (duplicate input name).", verbose);
              else
                 inputName = name;

              ctx = -1;
              continue;
           }

           if (arg.startsWith("--level=") || (ctx == ARG_IDX_LEVEL))
           {
              String name = arg.startsWith("--level=") ? arg.substring(8).trim() : arg;

              if (level != -1)
              {
                 printWarning("--level", " (duplicate level).", verbose);
                 ctx = -1;
                 continue;
              }

              try
              {
                 level = Integer.parseInt(name);
              }
              catch (NumberFormatException e)
              {
                 System.err.println("Invalid compression level provided on command line: "+arg);
                 return Error.ERR_INVALID_PARAM;
              }

              if ((level < 1) || (level > 9))
              {
                 System.err.println("Invalid compression level provided on command line: "+arg);
                 return Error.ERR_INVALID_PARAM;
              }

              ctx = -1;
              continue;
           }

           if (arg.startsWith("--jobs=") || (ctx == ARG_IDX_JOBS))
           {
              String name = arg.startsWith("--jobs=") ? arg.substring(7).trim() : arg;

              if (tasks != -1)
              {
                 printWarning("--jobs", " (duplicate jobs).", verbose);
                 ctx = -1;
                 continue;
              }

              try
              {
                 tasks = Integer.parseInt(name);

                 if (tasks < 0)
                    throw new NumberFormatException();
              }
              catch (NumberFormatException e)
              {
                 System.err.println("Invalid number of jobs provided on command line: "+arg);
                 return Error.ERR_INVALID_PARAM;
              }

              ctx = -1;
              continue;
           }

           if ((ctx == -1) && (arg.startsWith("--verbose=") == false) && (arg.equals("--help") == false)
              && (arg.equals("-h") == false))
           {
              printWarning(arg, " (unknown option).", verbose);
           }

           ctx = -1;
        }

        if (ctx != -1)
           printWarning(CMD_LINE_ARGS[ctx], " (missing value).", verbose);

        if (inputName.isEmpty() == true)
        {
           System.err.println("Missing input name: use -i or --input=");
           return Error.ERR_MISSING_PARAM;
        }

        if (mode == 'c')
        {
           if (level != -1)
              map.put("level", level);

           map.put("predictive", predictive);
           map.put("rle", rle);

           if (tasks >= 0)
              map.put("jobs", tasks);
        }
        else
        {
           if (level != -1)
              printWarning("level", "(only valid for compression).", verbose);

           if (tasks >= 0)
              printWarning("jobs", "(only valid for compression).", verbose);
        }

        map.put("verbose", verbose);
        map.put("mode", mode);

        if (overwrite == true)
           map.put("overwrite", true);

        map.put("inputName", inputName);
        map.put("outputName", outputName);
        return 0;
    }


    private static void printHelp(char mode)
    {
      printOut("", true);
      printOut(APP_HEADER+"\n", true);
      printOut(APP_SUB_HEADER, true);
      printOut(APP_USAGE, true);
      printOut("", true);
      printOut("   -h, --help", true);
      printOut("        Display this message\n", true);

      if ((mode != 'c') && (mode != 'd'))
      {
         printOut("   -c, --compress", true);
         printOut("        Compress mode\n", true);
         printOut("   -d, --decompress", true);
         printOut("        Decompress mode\n", true);
      }

      printOut("   -i, --input=<inputName>", true);

      if (mode == 'd')
         printOut("        Compressed volume file\n", true);
      else
         printOut("        Folder holding volume.bin (and labels.bin) or path to volume.bin\n", true);

      printOut("   -o, --output=<outputName>", true);

      if (mode == 'd')
         printOut("        Output folder (receives volume.bin, labels.bin and volume.chk)\n", true);
      else
         printOut("        Compressed file (default is <inputName>.vlz)\n", true);

      if (mode != 'd')
      {
         printOut("   -l, --level=<compression>", true);
         printOut("        Compression level in [1..9] (default is 5)", true);
         printOut("        1 to 3: fastest deflate, 4 to 6: stored deflate blocks, 7 to 9: strongest deflate\n", true);
         printOut("   --no-predictive", true);
         printOut("        Disable the 3D predictive coding of volume chunks\n", true);
         printOut("   --no-rle", true);
         printOut("        Disable the run length coding of volume chunks\n", true);
         printOut("   -j, --jobs=<jobs>", true);
         printOut("        Maximum number of chunks compressed concurrently", true);
         printOut("        (default is the number of available cores, maximum is 64).\n", true);
      }

      printOut("   -v, --verbose=<level>", true);
      printOut("        0=silent, 1=default, 2=display details, 3=display configuration", true);
      printOut("        and progress, 4=display chunk sizes, 5=display all events\n", true);
      printOut("   -f, --force", true);
      printOut("        Overwrite the output if it already exists\n", true);

      if (mode == 'c')
      {
         printOut("EG. java -jar volz.jar -c -i scan/ -o scan.vlz -l 7 -j 4\n", true);
         printOut("EG. java -jar volz.jar --compress --input=scan/volume.bin --force --no-rle\n", true);
      }

      if (mode == 'd')
      {
         printOut("EG. java -jar volz.jar -d -i scan.vlz -o scan/ -f\n", true);
      }
    }


    private static void printWarning(String val, String reason, int verbose)
    {
       String msg = String.format("Warning: Ignoring option [%s] %s", val, reason);
       printOut(msg, verbose>0);
    }


    private static void printOut(String msg, boolean print)
    {
       if ((print == true) && (msg != null))
          System.out.println(msg);
    }
}
