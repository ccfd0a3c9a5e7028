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
 * The privacy cost of a single mechanism invocation, i.e., one {@code (epsilon,
 * delta)}-differentially private release against the protected dataset.
 *
 * <p>Instances do not validate their parameters. Spends are validated by the {@link
 * BudgetAccountant} before they are committed, while hypothetical spends (e.g., the candidates
 * evaluated by {@link Composition#maxAffordableEpsilon}) may carry an epsilon of zero.
 */
@AutoValue
public abstract class Spend implements Serializable {
  private static final long serialVersionUID = 1L;

  public static Spend create(double epsilon, double delta) {
    return new AutoValue_Spend(epsilon, delta);
  }

  public abstract double epsilon();

  public abstract double delta();
}
