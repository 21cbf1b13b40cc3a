/*
 * Copyright 2026 qrforge authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.qrforge;

/**
 * Thrown when a payload, together with its mode indicator, character count and terminator,
 * does not fit into the data codewords of the requested version and error correction level.
 */
public final class CapacityExceededException extends WriterException {

  private final int requiredBits;
  private final int capacityBits;

  public CapacityExceededException(int requiredBits, int capacityBits) {
    super("Data too big: " + requiredBits + " bits needed but only " + capacityBits + " bits available");
    this.requiredBits = requiredBits;
    this.capacityBits = capacityBits;
  }

  public int getRequiredBits() {
    return requiredBits;
  }

  public int getCapacityBits() {
    return capacityBits;
  }

}
