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
import static java.lang.Double.POSITIVE_INFINITY;

import com.google.auto.value.AutoValue;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Tracks the privacy budget spent by the mechanisms run against a single dataset and rejects any
 * spend that would make the composed privacy loss exceed a fixed {@code (epsilon, delta)} budget.
 *
 * <p>Mechanisms report the cost of each release through {@link #spend} before the result is
 * published. A spend is committed only if {@link Composition#compose} over all committed spends
 * and the new one stays within the budget; otherwise a {@link BudgetExceededException} is thrown
 * and nothing is recorded. The check and the commit happen atomically, so concurrent callers
 * cannot jointly overspend.
 *
 * <p>A positive {@code slack} sets aside part of the delta budget in exchange for the (often much
 * tighter) advanced composition bound on epsilon. See {@link Composition} for the bounds used.
 *
 * <p>Instead of passing an accountant to every mechanism, an accountant can be made the target of
 * {@link Accountants#spend} calls that do not name one, either for the duration of a scope via
 * {@link #enterScope} or until further notice via {@link #setDefault}.
 *
 * <p>For general details and key definitions, see <a href=
 * "https://github.com/google/differential-privacy/blob/main/differential_privacy.md#key-definitions">
 * this</a> introduction to Differential Privacy.
 */
@ThreadSafe
public class BudgetAccountant {
  private static final int MAX_SPENDS_IN_STRING = 5;

  private final Params params;
  private final PrivacyBudget budget;

  private final Object lock = new Object();

  @GuardedBy("lock")
  private final SpendLedger ledger = new SpendLedger();

  private BudgetAccountant(Params params) {
    this.params = params;
    this.budget = PrivacyBudget.create(params.epsilon(), params.delta());
    for (Spend spend : params.spentBudget()) {
      ledger.append(spend);
    }
  }

  public static Params.Builder builder() {
    return Params.Builder.newBuilder();
  }

  /** Returns an accountant with the given budget, no slack and no spends. */
  public static BudgetAccountant create(double epsilon, double delta) {
    return builder().epsilon(epsilon).delta(delta).build();
  }

  /**
   * Returns an accountant that admits every well-formed spend. Its epsilon budget is infinite and
   * its delta budget is 1, values that cannot be configured through {@link #builder}. Such an
   * accountant records spends but enforces no privacy guarantee.
   */
  static BudgetAccountant unbounded() {
    return new BudgetAccountant(
        Params.Builder.newBuilder().epsilon(POSITIVE_INFINITY).delta(1.0).autoBuild());
  }

  /** Returns the total {@code (epsilon, delta)} budget of this accountant. */
  public PrivacyBudget getBudget() {
    return budget;
  }

  /** Returns the delta reserved for the advanced composition bound. */
  public double getSlack() {
    return params.slack();
  }

  /** Returns true if this accountant does not bound epsilon, and hence enforces no guarantee. */
  public boolean isUnbounded() {
    return budget.epsilon() == POSITIVE_INFINITY;
  }

  /** Same as {@link #spend(double, double)} with a delta of 0. */
  public BudgetAccountant spend(double epsilon) {
    return spend(epsilon, 0.0);
  }

  /**
   * Records a spend of {@code (epsilon, delta)} if the composed privacy loss of all spends,
   * including this one, stays within the budget.
   *
   * @return this accountant, to allow chaining.
   * @throws IllegalArgumentException if epsilon is not positive and finite or delta is not in [0,
   *     1).
   * @throws BudgetExceededException if the spend is not affordable. No spend is recorded in that
   *     case.
   */
  public BudgetAccountant spend(double epsilon, double delta) {
    Spend spend = checkedSpend(epsilon, delta);
    synchronized (lock) {
      if (!Composition.admits(ledger.spends(), budget, params.slack(), spend)) {
        throw new BudgetExceededException(spend, remainingLocked(1));
      }
      ledger.append(spend);
    }
    return this;
  }

  /**
   * Returns true if a spend of {@code (epsilon, delta)} would currently be admitted by {@link
   * #spend}. Nothing is recorded.
   *
   * @throws IllegalArgumentException if epsilon is not positive and finite or delta is not in [0,
   *     1).
   */
  public boolean isAffordable(double epsilon, double delta) {
    Spend spend = checkedSpend(epsilon, delta);
    synchronized (lock) {
      return Composition.admits(ledger.spends(), budget, params.slack(), spend);
    }
  }

  /**
   * Same as {@link #isAffordable} but throws instead of returning false.
   *
   * @throws BudgetExceededException if the spend is not affordable.
   */
  public void check(double epsilon, double delta) {
    Spend spend = checkedSpend(epsilon, delta);
    synchronized (lock) {
      if (!Composition.admits(ledger.spends(), budget, params.slack(), spend)) {
        throw new BudgetExceededException(spend, remainingLocked(1));
      }
    }
  }

  /** Returns the composed privacy loss of all spends recorded so far. */
  public PrivacyBudget total() {
    synchronized (lock) {
      return Composition.compose(ledger.spends(), params.slack());
    }
  }

  /** Same as {@link #remaining(int)} for a single further spend. */
  public PrivacyBudget remaining() {
    return remaining(1);
  }

  /**
   * Returns the budget available to each of {@code k} further spends of equal cost. The epsilon is
   * the largest per-spend epsilon such that {@code k} pure (delta = 0) spends are affordable, see
   * {@link Composition#maxAffordableEpsilon}. The delta is the delta budget not yet consumed by
   * spends or reserved as slack.
   *
   * @throws IllegalArgumentException if k is negative.
   */
  public PrivacyBudget remaining(int k) {
    AccountingPreconditions.checkQueryCount(k);
    synchronized (lock) {
      return remainingLocked(k);
    }
  }

  @GuardedBy("lock")
  private PrivacyBudget remainingLocked(int k) {
    double epsilon =
        Composition.maxAffordableEpsilon(ledger.spends(), budget, params.slack(), k, 0.0);
    double delta = budget.delta() - Composition.compose(ledger.spends(), params.slack()).delta();
    return PrivacyBudget.create(epsilon, delta);
  }

  /** Returns the number of spends recorded so far. */
  public int size() {
    synchronized (lock) {
      return ledger.size();
    }
  }

  /** Returns the spends recorded so far, in the order in which they were committed. */
  public ImmutableList<Spend> spends() {
    synchronized (lock) {
      return ImmutableList.copyOf(ledger.spends());
    }
  }

  /**
   * Makes this accountant the target of every {@link Accountants#spend} call on the current thread
   * that does not name an accountant, until the returned scope is closed. Use with
   * try-with-resources:
   *
   * <pre>{@code
   * try (AccountantScope scope = accountant.enterScope()) {
   *   Accountants.spend(epsilon);
   * }
   * }</pre>
   */
  public AccountantScope enterScope() {
    return AccountantResolver.global().enterScope(this);
  }

  /**
   * Installs this accountant as the process-wide default, used by {@link Accountants#spend} calls
   * that neither name an accountant nor run inside a scope.
   *
   * @return this accountant, to allow chaining.
   */
  public BudgetAccountant setDefault() {
    AccountantResolver.global().setDefault(this);
    return this;
  }

  @Override
  public String toString() {
    ImmutableList<Spend> spends = spends();
    MoreObjects.ToStringHelper helper =
        MoreObjects.toStringHelper(this)
            .add("epsilon", budget.epsilon())
            .add("delta", budget.delta());
    if (params.slack() > 0) {
      helper.add("slack", params.slack());
    }
    helper.add("spends", spends.subList(0, Math.min(spends.size(), MAX_SPENDS_IN_STRING)));
    if (spends.size() > MAX_SPENDS_IN_STRING) {
      helper.add("moreSpends", spends.size() - MAX_SPENDS_IN_STRING);
    }
    return helper.toString();
  }

  private static Spend checkedSpend(double epsilon, double delta) {
    AccountingPreconditions.checkSpendEpsilon(epsilon);
    AccountingPreconditions.checkSpendDelta(delta);
    return Spend.create(epsilon, delta);
  }

  @AutoValue
  public abstract static class Params {
    abstract double epsilon();

    abstract double delta();

    abstract double slack();

    abstract ImmutableList<Spend> spentBudget();

    @AutoValue.Builder
    public abstract static class Builder {
      private static Builder newBuilder() {
        Params.Builder builder = new AutoValue_BudgetAccountant_Params.Builder();
        // A pure epsilon budget without slack unless configured otherwise.
        builder.delta(0.0);
        builder.slack(0.0);
        builder.spentBudget(ImmutableList.of());
        return builder;
      }

      /** Total epsilon budget. May be positive infinity to leave epsilon unconstrained. */
      public abstract Builder epsilon(double value);

      /** Total delta budget. */
      public abstract Builder delta(double value);

      /**
       * Part of the delta budget set aside for the advanced composition bound. A larger slack
       * yields a tighter bound on epsilon but leaves less delta for spends. Must not exceed the
       * delta budget.
       */
      public abstract Builder slack(double value);

      /**
       * Spends that have already been incurred against the dataset, e.g., by releases made before
       * this accountant was created. They must fit within the budget.
       */
      public abstract Builder spentBudget(Iterable<Spend> value);

      abstract Params autoBuild();

      public BudgetAccountant build() {
        Params params = autoBuild();
        AccountingPreconditions.checkEpsilonBudget(params.epsilon());
        AccountingPreconditions.checkDeltaBudget(params.delta());
        AccountingPreconditions.checkSlack(params.slack(), params.delta());
        for (Spend spend : params.spentBudget()) {
          AccountingPreconditions.checkSpend(spend);
        }
        PrivacyBudget spent = Composition.compose(params.spentBudget(), params.slack());
        checkArgument(
            Composition.admits(
                ImmutableList.of(),
                PrivacyBudget.create(params.epsilon(), params.delta()),
                params.slack(),
                params.spentBudget()),
            "spentBudget exceeds the budget. Composed spend: (epsilon = %s, delta = %s)",
            spent.epsilon(),
            spent.delta());
        return new BudgetAccountant(params);
      }
    }
  }
}
