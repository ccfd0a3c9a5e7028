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
import static java.lang.Math.min;

import com.google.common.collect.ImmutableList;

/**
 * Bounds the cumulative privacy loss of a collection of {@link Spend}s. All methods are pure and
 * accept any restartable {@link Iterable} of spends, so they can be used to evaluate hypothetical
 * spend sequences as well as the ledger of a {@link BudgetAccountant}.
 *
 * <p>Two composition theorems are implemented:
 *
 * <ul>
 *   <li>Naive (basic) composition, which sums epsilons and deltas. It is exact for pure
 *       differential privacy and always valid.
 *   <li>Advanced (strong) composition for heterogeneous spends, which trades an additional {@code
 *       slack} in delta for an epsilon bound that grows with the square root of the number of
 *       spends rather than linearly. This is the heterogeneous form of Theorem 3.20 of Dwork and
 *       Roth's "The Algorithmic Foundations of Differential Privacy".
 * </ul>
 *
 * <p>When a positive slack is available, {@link #compose} reports the smaller of the two epsilon
 * bounds. The slack is reserved as soon as it is configured, so the reported delta always includes
 * it. This keeps the composed loss monotone in both coordinates as spends are added.
 *
 * <p>All sums are compensated, so spends that are small compared to the running total still count
 * towards it. Admission under naive composition is decided exactly: a spend is admitted only if it
 * fits into the unspent headroom of the budget.
 */
public final class Composition {
  /**
   * The relative accuracy at which {@link #maxAffordableEpsilon} stops its binary search. The
   * returned epsilon deviates from the tightest affordable value by at most this fraction of the
   * final search interval's upper end.
   */
  public static final double DEFAULT_EPSILON_ACCURACY = 1e-9;

  /**
   * Affordable epsilons below this value are reported as 0. It is the smallest epsilon accepted by
   * the aggregations of the differential privacy library.
   */
  private static final double MIN_AFFORDABLE_EPSILON = 1.0 / (1L << 50);

  /**
   * Relative bound on the rounding error of an advanced composition epsilon computed from
   * compensated sums. Spends are only admitted under advanced composition if the computed bound
   * stays below the budget by at least this fraction.
   */
  private static final double ADVANCED_EPSILON_ROUNDING_MARGIN = 1e-14;

  private Composition() {}

  /** Returns {@code (Σ epsilon_i, Σ delta_i)}. */
  public static PrivacyBudget naiveCompose(Iterable<Spend> spends) {
    return LossSums.of(spends).naive();
  }

  /**
   * Returns the strong composition bound of the given spends:
   *
   * <pre>
   *   epsilon = sqrt(2 * ln(1 / slack) * Σ epsilon_i^2) + Σ epsilon_i * (exp(epsilon_i) - 1)
   *   delta = Σ delta_i + slack
   * </pre>
   *
   * <p>The bound is valid for every {@code slack} in (0, 1). It is tighter than {@link
   * #naiveCompose} for many spends with small epsilon, and looser for few spends or large epsilon.
   */
  public static PrivacyBudget advancedCompose(Iterable<Spend> spends, double slack) {
    checkArgument(
        slack > 0 && slack < 1,
        "slack should be strictly between 0 and 1. Provided value: %s",
        slack);
    LossSums sums = LossSums.of(spends);
    return PrivacyBudget.create(sums.advancedEpsilon(slack), sums.deltaWithSlack(slack).value());
  }

  /**
   * Returns the tightest bound this class can prove on the privacy loss of the given spends. With
   * zero slack this is {@link #naiveCompose}. Otherwise the epsilon is the minimum of the naive and
   * the advanced bound and the delta is {@code Σ delta_i + slack}.
   */
  public static PrivacyBudget compose(Iterable<Spend> spends, double slack) {
    checkSlack(slack);
    return LossSums.of(spends).compose(slack);
  }

  /**
   * Returns true if the composition of {@code spends} and {@code candidate} stays within {@code
   * budget}. Composition is monotonically increasing in the epsilon and delta of every spend, hence
   * so is this predicate in the cost of the candidate.
   */
  public static boolean admits(
      Iterable<Spend> spends, PrivacyBudget budget, double slack, Spend candidate) {
    return admits(spends, budget, slack, ImmutableList.of(candidate));
  }

  static boolean admits(
      Iterable<Spend> spends, PrivacyBudget budget, double slack, Iterable<Spend> candidates) {
    checkSlack(slack);
    LossSums sums = LossSums.of(spends);
    for (Spend candidate : candidates) {
      sums.add(1, candidate.epsilon(), candidate.delta());
    }
    return sums.fits(budget, slack);
  }

  /**
   * Same as {@link #maxAffordableEpsilon(Iterable, PrivacyBudget, double, int, double, double)}
   * with an accuracy of {@link #DEFAULT_EPSILON_ACCURACY}.
   */
  public static double maxAffordableEpsilon(
      Iterable<Spend> spends, PrivacyBudget budget, double slack, int k, double deltaPerQuery) {
    return maxAffordableEpsilon(
        spends, budget, slack, k, deltaPerQuery, DEFAULT_EPSILON_ACCURACY);
  }

  /**
   * Returns the largest epsilon such that {@code k} further spends of {@code (epsilon,
   * deltaPerQuery)} are admitted by {@link #admits}. The result errs on the safe side: it is itself
   * affordable and deviates from the supremum by at most {@code accuracy} relative to the final
   * search interval.
   *
   * <p>Returns the epsilon of {@code budget} if {@code k} is 0, and 0 if no positive epsilon is
   * affordable, e.g., because the delta budget cannot accommodate {@code k} further spends of
   * {@code deltaPerQuery}.
   *
   * <p>This implementation uses a binary search over {@code [0, budget.epsilon()]}. The spends are
   * summed once and the {@code k} hypothetical spends are added in closed form, so each of the
   * roughly log(1 / accuracy) steps takes constant time regardless of {@code k}.
   */
  public static double maxAffordableEpsilon(
      Iterable<Spend> spends,
      PrivacyBudget budget,
      double slack,
      int k,
      double deltaPerQuery,
      double accuracy) {
    AccountingPreconditions.checkQueryCount(k);
    AccountingPreconditions.checkAccuracy(accuracy);
    checkSlack(slack);
    double upperBound = budget.epsilon();
    if (k == 0) {
      return upperBound;
    }
    LossSums spent = LossSums.of(spends);
    // Also covers an infinite epsilon budget, which admits any epsilon as long as delta allows it.
    if (affords(spent, budget, slack, k, upperBound, deltaPerQuery)) {
      return upperBound;
    }
    if (!affords(spent, budget, slack, k, 0.0, deltaPerQuery)) {
      return 0.0;
    }

    // Invariant: lowerBound is affordable and upperBound is not.
    double lowerBound = 0.0;
    while (upperBound - lowerBound > accuracy * upperBound
        && upperBound >= MIN_AFFORDABLE_EPSILON) {
      double middle = lowerBound * 0.5 + upperBound * 0.5;
      if (affords(spent, budget, slack, k, middle, deltaPerQuery)) {
        lowerBound = middle;
      } else {
        upperBound = middle;
      }
    }
    return lowerBound < MIN_AFFORDABLE_EPSILON ? 0.0 : lowerBound;
  }

  private static boolean affords(
      LossSums spent, PrivacyBudget budget, double slack, int k, double epsilon, double delta) {
    LossSums sums = spent.copy();
    sums.add(k, epsilon, delta);
    return sums.fits(budget, slack);
  }

  private static void checkSlack(double slack) {
    checkArgument(slack >= 0 && slack < 1, "slack must be >= 0 and < 1. Provided value: %s", slack);
  }

  /** The sums over a collection of spends that both composition theorems are computed from. */
  private static final class LossSums {
    private final CompensatedSum epsilon;
    private final CompensatedSum delta;
    private final CompensatedSum epsilonSquared;
    // Σ epsilon_i * expm1(epsilon_i); expm1 keeps precision for small epsilons.
    private final CompensatedSum epsilonExpm1;

    private LossSums(
        CompensatedSum epsilon,
        CompensatedSum delta,
        CompensatedSum epsilonSquared,
        CompensatedSum epsilonExpm1) {
      this.epsilon = epsilon;
      this.delta = delta;
      this.epsilonSquared = epsilonSquared;
      this.epsilonExpm1 = epsilonExpm1;
    }

    static LossSums of(Iterable<Spend> spends) {
      LossSums sums =
          new LossSums(
              new CompensatedSum(),
              new CompensatedSum(),
              new CompensatedSum(),
              new CompensatedSum());
      for (Spend spend : spends) {
        sums.add(1, spend.epsilon(), spend.delta());
      }
      return sums;
    }

    LossSums copy() {
      return new LossSums(
          epsilon.copy(), delta.copy(), epsilonSquared.copy(), epsilonExpm1.copy());
    }

    /** Adds {@code count} spends of {@code (spendEpsilon, spendDelta)}. */
    void add(int count, double spendEpsilon, double spendDelta) {
      epsilon.addProduct(count, spendEpsilon);
      delta.addProduct(count, spendDelta);
      epsilonSquared.addProduct(count, spendEpsilon * spendEpsilon);
      epsilonExpm1.addProduct(count, spendEpsilon * Math.expm1(spendEpsilon));
    }

    PrivacyBudget naive() {
      return PrivacyBudget.create(epsilon.value(), delta.value());
    }

    double advancedEpsilon(double slack) {
      return Math.sqrt(2.0 * Math.log(1.0 / slack) * epsilonSquared.value())
          + epsilonExpm1.value();
    }

    CompensatedSum deltaWithSlack(double slack) {
      CompensatedSum deltaWithSlack = delta.copy();
      deltaWithSlack.add(slack);
      return deltaWithSlack;
    }

    PrivacyBudget compose(double slack) {
      if (slack == 0) {
        return naive();
      }
      return PrivacyBudget.create(
          min(epsilon.value(), advancedEpsilon(slack)), deltaWithSlack(slack).value());
    }

    /** Returns true if {@code budget} covers the composed loss. Rounding never causes admission. */
    boolean fits(PrivacyBudget budget, double slack) {
      if (!deltaWithSlack(slack).isAtMost(budget.delta())) {
        return false;
      }
      if (epsilon.isAtMost(budget.epsilon())) {
        return true;
      }
      return slack > 0
          && advancedEpsilon(slack) * (1 + ADVANCED_EPSILON_ROUNDING_MARGIN) <= budget.epsilon();
    }
  }

  /**
   * A sum of doubles with a running compensation term (Neumaier's variant of Kahan summation).
   * {@code sum + compensation} is the exact sum of the added values up to second-order rounding
   * errors, as long as it is finite.
   */
  private static final class CompensatedSum {
    private double sum;
    private double compensation;

    CompensatedSum copy() {
      CompensatedSum copy = new CompensatedSum();
      copy.sum = sum;
      copy.compensation = compensation;
      return copy;
    }

    void add(double value) {
      double total = sum + value;
      if (Double.isFinite(total)) {
        compensation +=
            Math.abs(sum) >= Math.abs(value) ? (sum - total) + value : (value - total) + sum;
      }
      sum = total;
    }

    /** Adds {@code count * value}, including the rounding error of the product. */
    void addProduct(int count, double value) {
      double product = count * value;
      add(product);
      if (Double.isFinite(product)) {
        add(Math.fma(count, value, -product));
      }
    }

    double value() {
      return Double.isFinite(sum) ? sum + compensation : sum;
    }

    /** Returns true if the exact sum is at most {@code bound}. */
    boolean isAtMost(double bound) {
      if (bound == POSITIVE_INFINITY) {
        return true;
      }
      return Double.isFinite(sum) && (bound - sum) - compensation >= 0;
    }
  }
}
