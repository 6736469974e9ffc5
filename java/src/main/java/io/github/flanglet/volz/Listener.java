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

package io.github.flanglet.volz;

/**
 * Receives the events emitted by the volume writer and reader.
 * <p>
 * Chunk events may be delivered from pool threads. Progress events are
 * delivered in non-decreasing order of percentage.
 * </p>
 */
public interface Listener {

  /**
   * Processes the given event. Exceptions thrown here are ignored by the
   * emitter.
   *
   * @param evt the event, never {@code null}
   */
  public void processEvent(Event evt);
}
