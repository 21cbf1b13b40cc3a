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

package com.qrforge.common.reedsolomon;

import java.util.ArrayList;
import java.util.List;

/**
 * <p>Implements Reed-Solomon encoding, as the name implies.</p>
 *
 * <p>Generator polynomials only depend on their degree, so they are built once and cached.
 * Instances are not thread-safe.</p>
 */
public final class ReedSolomonEncoder {

  private final GenericGF field;
  private final List<GenericGFPoly> cachedGenerators;

  public ReedSolomonEncoder(GenericGF field) {
    this.field = field;
    this.cachedGenerators = new ArrayList<>();
    cachedGenerators.add(field.getOne());
  }

  /**
   * @return (x + a^b)(x + a^(b+1))...(x + a^(b+degree-1)), b being the field's generator base
   */
  public GenericGFPoly buildGenerator(int degree) {
    if (degree < 0) {
      throw new IllegalArgumentException("Degree must be non-negative");
    }
    if (degree >= cachedGenerators.size()) {
      GenericGFPoly lastGenerator = cachedGenerators.get(cachedGenerators.size() - 1);
      for (int d = cachedGenerators.size(); d <= degree; d++) {
        GenericGFPoly nextGenerator = lastGenerator.multiply(
            new GenericGFPoly(field, new int[] { 1, field.exp(d - 1 + field.getGeneratorBase()) }));
        cachedGenerators.add(nextGenerator);
        lastGenerator = nextGenerator;
      }
    }
    return cachedGenerators.get(degree);
  }

  /**
   * Computes the error correction codewords of a message block.
   *
   * @param message data codewords, each in [0, field size)
   * @param ecCount number of error correction codewords to produce
   * @return exactly {@code ecCount} error correction codewords, or none if {@code ecCount <= 0}
   */
  public int[] encode(int[] message, int ecCount) {
    if (ecCount <= 0) {
      return new int[0];
    }
    GenericGFPoly generator = buildGenerator(ecCount);
    GenericGFPoly info = new GenericGFPoly(field, message);
    info = info.multiplyByMonomial(ecCount, 1);
    GenericGFPoly remainder = info.divide(generator)[1];
    int[] coefficients = remainder.getCoefficients();
    int[] result = new int[ecCount];
    if (remainder.isZero()) {
      return result;
    }
    int numZeroCoefficients = ecCount - coefficients.length;
    System.arraycopy(coefficients, 0, result, numZeroCoefficients, coefficients.length);
    return result;
  }

}
