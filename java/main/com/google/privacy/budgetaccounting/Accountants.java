//
// Copyright 2020 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//

package com.google.privacy.budgetaccounting;

import javax.annotation.Nullable;

/**
 * Entry point for mechanisms that report their privacy cost. Each method charges the accountant
 * chosen by {@link AccountantResolver#global()}: the one passed explicitly if any, otherwise the
 * innermost scope of the current thread, otherwise the shared default, otherwise an unbounded
 * accountant.
 *
 * <p>A typical mechanism charges its cost before releasing a result and lets a {@link
 * BudgetExceededException} propagate to its caller:
 *
 * <pre>{@code
 * public double noisyMean(Collection<Double> values, double epsilon,
 *     @Nullable BudgetAccountant accountant) {
 *   Accountants.spend(epsilon, 0.0, accountant);
 *   return ...;
 * }
 * }</pre>
 */
public final class Accountants {

  private Accountants() {}

  /** Charges a pure {@code epsilon} spend. */
  public static BudgetAccountant spend(double epsilon) {
    return spend(epsilon, 0.0, null);
  }

  /** Charges a spend of {@code (epsilon, delta)}. */
  public static BudgetAccountant spend(double epsilon, double delta) {
    return spend(epsilon, delta, null);
  }

  /**
   * Charges a spend of {@code (epsilon, delta)} to {@code accountant}, or to the resolved
   * accountant if {@code accountant} is null.
   *
   * @return the accountant that was charged.
   * @throws IllegalArgumentException if epsilon is not positive and finite or delta is not in [0,
   *     1).
   * @throws BudgetExceededException if the spend is not affordable.
   */
  public static BudgetAccountant spend(
      double epsilon, double delta, @Nullable BudgetAccountant accountant) {
    return AccountantResolver.global().resolve(accountant).spend(epsilon, delta);
  }

  /** Returns the accountant that a spend naming {@code accountant} would be charged to. */
  public static BudgetAccountant resolve(@Nullable BudgetAccountant accountant) {
    return AccountantResolver.global().resolve(accountant);
  }
}
