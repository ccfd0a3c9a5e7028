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
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines which {@link BudgetAccountant} a spend is charged to when the caller does not name
 * one. The candidates are tried in this order:
 *
 * <ol>
 *   <li>the accountant passed explicitly by the caller;
 *   <li>the innermost scope entered on the current thread, see {@link #enterScope};
 *   <li>the shared default installed by {@link #setDefault}, visible to all threads;
 *   <li>a new {@linkplain BudgetAccountant#isUnbounded() unbounded} accountant, so that code
 *       written without accounting still runs. Spends charged to it are not enforced.
 * </ol>
 *
 * <p>Scopes are thread-local: a scope entered on one thread does not affect resolution on any
 * other thread.
 */
@ThreadSafe
public final class AccountantResolver {
  private static final Logger logger = LoggerFactory.getLogger(AccountantResolver.class);

  private static final AccountantResolver GLOBAL = new AccountantResolver();

  private final ThreadLocal<Deque<BudgetAccountant>> scopes =
      ThreadLocal.withInitial(ArrayDeque::new);

  private final Object defaultLock = new Object();

  @GuardedBy("defaultLock")
  @Nullable
  private BudgetAccountant sharedDefault;

  /**
   * Returns a resolver with no scopes and no default. Most callers should use {@link #global()},
   * which is the resolver consulted by {@link Accountants} and {@link BudgetAccountant}.
   */
  public AccountantResolver() {}

  /** Returns the process-wide resolver. */
  public static AccountantResolver global() {
    return GLOBAL;
  }

  /** Returns the accountant to charge, see the class documentation for the resolution order. */
  public BudgetAccountant resolve(@Nullable BudgetAccountant explicit) {
    if (explicit != null) {
      return explicit;
    }
    Optional<BudgetAccountant> current = current();
    if (current.isPresent()) {
      return current.get();
    }
    logger.warn(
        "No budget accountant is in scope and no default is set; spending against an unbounded"
            + " accountant. The privacy loss of this computation is not enforced.");
    return BudgetAccountant.unbounded();
  }

  /**
   * Returns the accountant that {@link #resolve} would use when none is passed explicitly, or
   * {@link Optional#empty} if it would fall back to an unbounded accountant.
   */
  public Optional<BudgetAccountant> current() {
    BudgetAccountant scoped = scopes.get().peek();
    if (scoped != null) {
      return Optional.of(scoped);
    }
    return getDefault();
  }

  /** Returns the shared default, if one is installed. */
  public Optional<BudgetAccountant> getDefault() {
    synchronized (defaultLock) {
      return Optional.ofNullable(sharedDefault);
    }
  }

  /** Installs {@code accountant} as the shared default, replacing any previous default. */
  public void setDefault(BudgetAccountant accountant) {
    checkNotNull(accountant);
    synchronized (defaultLock) {
      sharedDefault = accountant;
    }
    logger.debug("Installed default budget accountant {}", accountant);
  }

  /**
   * Removes the shared default.
   *
   * @return the removed default, or {@link Optional#empty} if none was installed.
   */
  public Optional<BudgetAccountant> popDefault() {
    BudgetAccountant removed;
    synchronized (defaultLock) {
      removed = sharedDefault;
      sharedDefault = null;
    }
    if (removed != null) {
      logger.debug("Removed default budget accountant {}", removed);
    }
    return Optional.ofNullable(removed);
  }

  /**
   * Makes {@code accountant} the resolution target on the current thread until the returned scope
   * is closed. Scopes nest; closing a scope restores whatever was resolved before it was entered.
   */
  public AccountantScope enterScope(BudgetAccountant accountant) {
    checkNotNull(accountant);
    Deque<BudgetAccountant> stack = scopes.get();
    stack.push(accountant);
    logger.debug("Entered scope of budget accountant {} at depth {}", accountant, stack.size());
    return new AccountantScope(this, accountant);
  }

  /**
   * Leaves the innermost scope of the current thread.
   *
   * @throws IllegalStateException if the innermost scope does not belong to {@code accountant},
   *     i.e., if scopes are closed out of order or on a different thread than they were entered.
   */
  void exitScope(BudgetAccountant accountant) {
    Deque<BudgetAccountant> stack = scopes.get();
    checkState(
        stack.peek() == accountant,
        "Scopes must be closed on the thread that entered them, innermost first.");
    stack.pop();
    logger.debug("Left scope of budget accountant {} at depth {}", accountant, stack.size() + 1);
    if (stack.isEmpty()) {
      scopes.remove();
    }
  }
}
