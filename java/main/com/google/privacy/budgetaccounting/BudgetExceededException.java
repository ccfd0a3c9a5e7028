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

/**
 * Thrown when a well-formed spend would push the composed privacy loss of a {@link
 * BudgetAccountant} past its budget. The accountant's ledger is left unchanged.
 *
 * <p>A mechanism that receives this exception must not release its result. Whether to retry at a
 * lower cost is up to the caller; {@link #remaining()} reports what is still affordable.
 */
public class BudgetExceededException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Spend requested;
  private final PrivacyBudget remaining;

  BudgetExceededException(Spend requested, PrivacyBudget remaining) {
    super(
        String.format(
            "Privacy spend of (epsilon = %s, delta = %s) not permissible; it would exceed the"
                + " remaining privacy budget of (epsilon = %s, delta = %s).",
            requested.epsilon(), requested.delta(), remaining.epsilon(), remaining.delta()));
    this.requested = requested;
    this.remaining = remaining;
  }

  /** The rejected spend. */
  public Spend requested() {
    return requested;
  }

  /** The budget that was available for a single further spend when the request was rejected. */
  public PrivacyBudget remaining() {
    return remaining;
  }
}
