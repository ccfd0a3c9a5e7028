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

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities which validate budget and spend parameters. */
public class AccountingPreconditions {

  private AccountingPreconditions() {}

  static void checkEpsilonBudget(double epsilon) {
    // Positive infinity is a valid budget: it disables epsilon enforcement.
    checkArgument(epsilon >= 0, "epsilon budget must be >= 0. Provided value: %s", epsilon);
  }

  static void checkDeltaBudget(double delta) {
    checkArgument(
        delta >= 0 && delta < 1, "delta budget must be >= 0 and < 1. Provided value: %s", delta);
  }

  static void checkSlack(double slack, double delta) {
    checkArgument(
        delta > 0 || slack == 0,
        "slack must be 0 when the delta budget is 0. Provided value: %s",
        slack);
    checkArgument(
        slack >= 0 && slack <= delta,
        "slack must be >= 0 and <= delta. Provided values: slack = %s delta = %s",
        slack,
        delta);
  }

  static void checkSpendEpsilon(double epsilon) {
    checkArgument(
        Double.isFinite(epsilon) && epsilon > 0,
        "epsilon must be > 0 and < infinity. Provided value: %s",
        epsilon);
  }

  static void checkSpendDelta(double delta) {
    checkArgument(delta >= 0 && delta < 1, "delta must be >= 0 and < 1. Provided value: %s", delta);
  }

  static void checkSpend(Spend spend) {
    checkSpendEpsilon(spend.epsilon());
    checkSpendDelta(spend.delta());
  }

  static void checkQueryCount(int k) {
    checkArgument(k >= 0, "number of queries must be >= 0. Provided value: %s", k);
  }

  static void checkAccuracy(double accuracy) {
    checkArgument(
        accuracy > 0 && accuracy < 1,
        "accuracy should be strictly between 0 and 1. Provided value: %s",
        accuracy);
  }
}
