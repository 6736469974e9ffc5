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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;


public class TestVolz {
  @Test
  void testCompressOptions() {
    Map<String, Object> map = new HashMap<>();
    int res = Volz.processCommandLine(new String[] { "-c", "-i", "vol", "--output=vol.vlz", "-l", "9",
        "--jobs=3", "--no-rle", "-f", "-v", "0" }, map);
    Assertions.assertEquals(0, res);
    Assertions.assertEquals('c', map.get("mode"));
    Assertions.assertEquals("vol", map.get("inputName"));
    Assertions.assertEquals("vol.vlz", map.get("outputName"));
    Assertions.assertEquals(9, map.get("level"));
    Assertions.assertEquals(3, map.get("jobs"));
    Assertions.assertEquals(Boolean.TRUE, map.get("predictive"));
    Assertions.assertEquals(Boolean.FALSE, map.get("rle"));
    Assertions.assertEquals(Boolean.TRUE, map.get("overwrite"));
    Assertions.assertEquals(0, map.get("verbose"));
  }

  @Test
  void testDecompressOptions() {
    Map<String, Object> map = new HashMap<>();
    int res = Volz.processCommandLine(new String[] { "-d", "--input=vol.vlz", "--verbose=0", "-j", "4" }, map);
    Assertions.assertEquals(0, res);
    Assertions.assertEquals('d', map.get("mode"));
    Assertions.assertFalse(map.containsKey("jobs"));
    Assertions.assertFalse(map.containsKey("level"));
    Assertions.assertEquals("vol", VolumeDecompressor.defaultOutputName("vol.vlz"));
    Assertions.assertEquals("vol.bin.out", VolumeDecompressor.defaultOutputName("vol.bin"));
    Assertions.assertEquals("data/vol.vlz", VolumeCompressor.defaultOutputName("data/vol/"));
  }

  @Test
  void testInvalidOptions() {
    Assertions.assertEquals(Error.ERR_INVALID_PARAM,
        Volz.processCommandLine(new String[] { "-c", "-i", "vol", "-l", "0", "-v", "0" }, new HashMap<String, Object>()));
    Assertions.assertEquals(Error.ERR_INVALID_PARAM,
        Volz.processCommandLine(new String[] { "-c", "-i", "vol", "-v", "7" }, new HashMap<String, Object>()));
    Assertions.assertEquals(Error.ERR_INVALID_PARAM,
        Volz.processCommandLine(new String[] { "-c", "-d", "-i", "vol", "-v", "0" }, new HashMap<String, Object>()));
    Assertions.assertEquals(Error.ERR_MISSING_PARAM,
        Volz.processCommandLine(new String[] { "-c", "-v", "0" }, new HashMap<String, Object>()));
  }
}
