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
 * A scope in which a {@link BudgetAccountant} is the resolution target of {@link Accountants#spend}
 * calls on the current thread. Closing the scope restores the previous target, also when the scope
 * is left through an exception.
 *
 * <p>Closing a scope more than once has no effect.
 *
 * <p>Note: this class is not thread-safe. A scope must be closed on the thread that entered it.
 */
public final class AccountantScope implements AutoCloseable {
  private final AccountantResolver resolver;
  private final BudgetAccountant accountant;
  private boolean closed;

  AccountantScope(AccountantResolver resolver, BudgetAccountant accountant) {
    this.resolver = resolver;
    this.accountant = accountant;
  }

  /** Returns the accountant this scope charges spends to. */
  public BudgetAccountant accountant() {
    return accountant;
  }

  /**
   * Leaves the scope.
   *
   * @throws IllegalStateException if a scope entered after this one on the same thread is still
   *     open, or if called from another thread.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    resolver.exitScope(accountant);
    closed = true;
  }
}
