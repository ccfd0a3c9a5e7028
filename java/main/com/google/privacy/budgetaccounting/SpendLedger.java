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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of the spends committed by a single {@link BudgetAccountant}, in commit
 * order. There is no way to remove or replace an entry, since privacy loss that has been
 * incurred cannot be returned.
 *
 * <p>The ledger performs no budget checks. Admitting a spend is the responsibility of the owning
 * accountant, which also serializes all access to the ledger.
 *
 * <p>Note: this class is not thread-safe.
 */
final class SpendLedger {
  private final List<Spend> spends = new ArrayList<>();
  private final List<Spend> view = Collections.unmodifiableList(spends);

  void append(Spend spend) {
    spends.add(checkNotNull(spend));
  }

  /**
   * Returns a read-only live view of the committed spends. The view reflects later appends, so it
   * must only be read while holding the owner's lock.
   */
  List<Spend> spends() {
    return view;
  }

  int size() {
    return spends.size();
  }
}
