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

import com.google.auto.value.AutoValue;
import java.io.Serializable;

/**
 * An {@code (epsilon, delta)} pair. Describes the total budget of a {@link BudgetAccountant} as
 * well as the composed privacy loss of a collection of {@link Spend}s and the budget that is
 * still available.
 */
@AutoValue
public abstract class PrivacyBudget implements Serializable {
  private static final long serialVersionUID = 1L;

  public static PrivacyBudget create(double epsilon, double delta) {
    return new AutoValue_PrivacyBudget(epsilon, delta);
  }

  public abstract double epsilon();

  public abstract double delta();

  /**
   * Returns true if {@code other} does not exceed this budget in either coordinate, i.e., if a
   * privacy loss of {@code other} is covered by this budget.
   */
  public boolean covers(PrivacyBudget other) {
    return other.epsilon() <= epsilon() && other.delta() <= delta();
  }
}
