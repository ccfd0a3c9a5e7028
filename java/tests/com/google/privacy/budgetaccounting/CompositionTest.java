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

import static com.google.common.truth.Truth.assertThat;
import static java.lang.Double.NaN;
import static java.lang.Double.POSITIVE_INFINITY;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.google.testing.junit.testparameterinjector.TestParameters;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests for {@link Composition}. */
@RunWith(TestParameterInjector.class)
public class CompositionTest {
  private static final double TOLERANCE = 1e-12;

  private static final ImmutableList<Spend> HUNDRED_SMALL_SPENDS =
      ImmutableList.copyOf(Collections.nCopies(100, Spend.create(0.01, 0.0)));

  @Test
  public void naiveCompose_noSpends_returnsZero() {
    assertThat(Composition.naiveCompose(ImmutableList.of()))
        .isEqualTo(PrivacyBudget.create(0.0, 0.0));
  }

  @Test
  public void naiveCompose_sumsBothCoordinates() {
    PrivacyBudget total =
        Composition.naiveCompose(
            ImmutableList.of(
                Spend.create(1.0, 0.001), Spend.create(2.0, 0.002), Spend.create(0.5, 0.0)));

    assertThat(total.epsilon()).isWithin(TOLERANCE).of(3.5);
    assertThat(total.delta()).isWithin(TOLERANCE).of(0.003);
  }

  @Test
  public void advancedCompose_singleSpend_matchesFormula() {
    PrivacyBudget total =
        Composition.advancedCompose(ImmutableList.of(Spend.create(1.0, 0.01)), 0.5);

    assertThat(total.epsilon()).isWithin(TOLERANCE).of(Math.sqrt(2 * Math.log(2)) + Math.E - 1);
    assertThat(total.delta()).isWithin(TOLERANCE).of(0.51);
  }

  @Test
  public void advancedCompose_manySmallSpends_beatsNaiveComposition() {
    double slack = 1e-5;

    PrivacyBudget advanced = Composition.advancedCompose(HUNDRED_SMALL_SPENDS, slack);
    PrivacyBudget naive = Composition.naiveCompose(HUNDRED_SMALL_SPENDS);

    // sqrt(2 * ln(1e5) * 100 * 0.01^2) + 100 * 0.01 * (exp(0.01) - 1) ~ 0.4899
    assertThat(advanced.epsilon()).isWithin(1e-4).of(0.4899);
    assertThat(advanced.epsilon()).isLessThan(naive.epsilon());
    assertThat(advanced.delta()).isEqualTo(slack);
  }

  @Test
  public void advancedCompose_fewLargeSpends_isLooserThanNaiveComposition() {
    ImmutableList<Spend> spends = ImmutableList.of(Spend.create(2.0, 0.0));

    assertThat(Composition.advancedCompose(spends, 1e-5).epsilon())
        .isGreaterThan(Composition.naiveCompose(spends).epsilon());
  }

  @Test
  public void advancedCompose_invalidSlack_throwsException(
      @TestParameter({"0.0", "1.0", "-0.5", "1.5"}) double slack) {
    assertThrows(
        IllegalArgumentException.class,
        () -> Composition.advancedCompose(HUNDRED_SMALL_SPENDS, slack));
  }

  @Test
  public void advancedCompose_nanSlack_throwsException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Composition.advancedCompose(HUNDRED_SMALL_SPENDS, NaN));
  }

  @Test
  public void compose_zeroSlack_equalsNaiveComposition() {
    ImmutableList<Spend> spends =
        ImmutableList.of(Spend.create(0.3, 0.0001), Spend.create(1.2, 0.0), Spend.create(0.1, 0.0));

    assertThat(Composition.compose(spends, 0.0)).isEqualTo(Composition.naiveCompose(spends));
  }

  @Test
  public void compose_positiveSlack_takesSmallerEpsilonAndReservesSlack() {
    double slack = 1e-5;

    PrivacyBudget manySmall = Composition.compose(HUNDRED_SMALL_SPENDS, slack);
    PrivacyBudget oneLarge = Composition.compose(ImmutableList.of(Spend.create(2.0, 0.0)), slack);

    assertThat(manySmall.epsilon())
        .isEqualTo(Composition.advancedCompose(HUNDRED_SMALL_SPENDS, slack).epsilon());
    assertThat(manySmall.delta()).isEqualTo(slack);
    assertThat(oneLarge.epsilon()).isEqualTo(2.0);
    assertThat(oneLarge.delta()).isEqualTo(slack);
  }

  @Test
  public void compose_positiveSlackNoSpends_reportsSlack() {
    assertThat(Composition.compose(ImmutableList.of(), 0.01))
        .isEqualTo(PrivacyBudget.create(0.0, 0.01));
  }

  @Test
  public void compose_invalidSlack_throwsException(
      @TestParameter({"1.0", "-0.5"}) double slack) {
    assertThrows(
        IllegalArgumentException.class, () -> Composition.compose(HUNDRED_SMALL_SPENDS, slack));
  }

  @Test
  public void compose_nanSlack_throwsException() {
    assertThrows(
        IllegalArgumentException.class, () -> Composition.compose(HUNDRED_SMALL_SPENDS, NaN));
  }

  @Test
  public void compose_isIndependentOfOrder() {
    ImmutableList<Spend> spends =
        ImmutableList.of(Spend.create(0.25, 0.0), Spend.create(0.5, 0.0), Spend.create(0.125, 0.0));

    PrivacyBudget forward = Composition.compose(spends, 1e-3);
    PrivacyBudget backward = Composition.compose(spends.reverse(), 1e-3);

    assertThat(backward.epsilon()).isWithin(TOLERANCE).of(forward.epsilon());
    assertThat(backward.delta()).isWithin(TOLERANCE).of(forward.delta());
  }

  @Test
  @TestParameters("{epsilon: 0.5, admitted: true}")
  @TestParameters("{epsilon: 0.25, admitted: true}")
  @TestParameters("{epsilon: 0.5000001, admitted: false}")
  @TestParameters("{epsilon: 1.0, admitted: false}")
  public void admits_epsilonBudget(double epsilon, boolean admitted) {
    PrivacyBudget budget = PrivacyBudget.create(1.5, 0.0);

    assertThat(
            Composition.admits(
                ImmutableList.of(Spend.create(1.0, 0.0)),
                budget,
                0.0,
                Spend.create(epsilon, 0.0)))
        .isEqualTo(admitted);
  }

  @Test
  public void admits_deltaBudgetIncludesSlack() {
    PrivacyBudget budget = PrivacyBudget.create(10.0, 0.1);

    assertThat(Composition.admits(ImmutableList.of(), budget, 0.05, Spend.create(1.0, 0.05)))
        .isTrue();
    assertThat(Composition.admits(ImmutableList.of(), budget, 0.05, Spend.create(1.0, 0.06)))
        .isFalse();
  }

  @Test
  public void naiveCompose_spendsBelowRoundingError_areNotLost() {
    ImmutableList<Spend> spends =
        ImmutableList.<Spend>builder()
            .add(Spend.create(1e6, 0.0))
            .addAll(Collections.nCopies(1000, Spend.create(5e-11, 0.0)))
            .build();

    assertThat(Composition.naiveCompose(spends).epsilon()).isWithin(1e-9).of(1e6 + 5e-8);
  }

  @Test
  public void admits_exhaustedBudget_rejectsSpendBelowRoundingError() {
    ImmutableList<Spend> spends = ImmutableList.of(Spend.create(1e6, 0.0));
    PrivacyBudget budget = PrivacyBudget.create(1e6, 0.0);

    assertThat(Composition.admits(spends, budget, 0.0, Spend.create(5e-11, 0.0))).isFalse();
    assertThat(Composition.maxAffordableEpsilon(spends, budget, 0.0, 1, 0.0)).isEqualTo(0.0);
  }

  @Test
  public void maxAffordableEpsilon_singleQuery_returnsUnspentEpsilon() {
    double epsilon =
        Composition.maxAffordableEpsilon(
            ImmutableList.of(Spend.create(1.0, 0.0)), PrivacyBudget.create(5.0, 0.0), 0.0, 1, 0.0);

    assertThat(epsilon).isWithin(1e-8).of(4.0);
    assertThat(epsilon).isAtMost(4.0);
  }

  @Test
  public void maxAffordableEpsilon_multipleQueries_splitsUnspentEpsilon() {
    double epsilon =
        Composition.maxAffordableEpsilon(
            ImmutableList.of(Spend.create(1.0, 0.0)), PrivacyBudget.create(5.0, 0.0), 0.0, 4, 0.0);

    assertThat(epsilon).isWithin(1e-8).of(1.0);
  }

  @Test
  public void maxAffordableEpsilon_zeroQueries_returnsEpsilonBudget() {
    assertThat(
            Composition.maxAffordableEpsilon(
                ImmutableList.of(Spend.create(1.0, 0.0)),
                PrivacyBudget.create(5.0, 0.0),
                0.0,
                0,
                0.0))
        .isEqualTo(5.0);
  }

  @Test
  public void maxAffordableEpsilon_nothingSpent_returnsEpsilonBudget() {
    assertThat(
            Composition.maxAffordableEpsilon(
                ImmutableList.of(), PrivacyBudget.create(5.0, 0.0), 0.0, 1, 0.0))
        .isEqualTo(5.0);
  }

  @Test
  public void maxAffordableEpsilon_exhaustedBudget_returnsZero() {
    assertThat(
            Composition.maxAffordableEpsilon(
                ImmutableList.of(Spend.create(5.0, 0.0)),
                PrivacyBudget.create(5.0, 0.0),
                0.0,
                1,
                0.0))
        .isEqualTo(0.0);
  }

  @Test
  public void maxAffordableEpsilon_deltaBudgetTooSmall_returnsZero() {
    assertThat(
            Composition.maxAffordableEpsilon(
                ImmutableList.of(), PrivacyBudget.create(5.0, 0.1), 0.0, 2, 0.06))
        .isEqualTo(0.0);
  }

  @Test
  public void maxAffordableEpsilon_infiniteEpsilonBudget_returnsInfinity() {
    assertThat(
            Composition.maxAffordableEpsilon(
                ImmutableList.of(Spend.create(3.0, 0.1)),
                PrivacyBudget.create(POSITIVE_INFINITY, 0.5),
                0.0,
                3,
                0.0))
        .isPositiveInfinity();
  }

  @Test
  public void maxAffordableEpsilon_positiveSlack_affordsMoreThanNaiveSplit() {
    PrivacyBudget budget = PrivacyBudget.create(1.0, 1e-5);
    double slack = 1e-5;
    int k = 100;

    double epsilon = Composition.maxAffordableEpsilon(ImmutableList.of(), budget, slack, k, 0.0);

    // Naive composition would only afford 1.0 / k per query.
    assertThat(epsilon).isGreaterThan(0.01);
    assertThat(Composition.admits(ImmutableList.of(), budget, slack, queries(k, epsilon)))
        .isTrue();
    assertThat(
            Composition.admits(ImmutableList.of(), budget, slack, queries(k, epsilon * 1.000001)))
        .isFalse();
  }

  @Test
  public void maxAffordableEpsilon_maximalQueryCount_usesAdvancedComposition() {
    double epsilon =
        Composition.maxAffordableEpsilon(
            ImmutableList.of(), PrivacyBudget.create(1.0, 1e-5), 1e-5, Integer.MAX_VALUE, 0.0);

    // sqrt(2 * ln(1e5) * k) * epsilon ~ 1 for k = Integer.MAX_VALUE.
    assertThat(epsilon).isWithin(1e-9).of(4.317060707e-6);
  }

  @Test
  public void maxAffordableEpsilon_coarseAccuracy_staysAffordable() {
    ImmutableList<Spend> spent = ImmutableList.of(Spend.create(0.7, 0.0));
    PrivacyBudget budget = PrivacyBudget.create(2.0, 0.0);

    double epsilon = Composition.maxAffordableEpsilon(spent, budget, 0.0, 3, 0.0, 0.1);

    assertThat(epsilon).isAtMost(1.3 / 3);
    assertThat(epsilon).isAtLeast(0.9 * 1.3 / 3);
  }

  @Test
  public void maxAffordableEpsilon_negativeQueryCount_throwsException() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            Composition.maxAffordableEpsilon(
                ImmutableList.of(), PrivacyBudget.create(1.0, 0.0), 0.0, -1, 0.0));
  }

  @Test
  public void maxAffordableEpsilon_invalidAccuracy_throwsException(
      @TestParameter({"0.0", "1.0", "-0.1"}) double accuracy) {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            Composition.maxAffordableEpsilon(
                ImmutableList.of(), PrivacyBudget.create(1.0, 0.0), 0.0, 1, 0.0, accuracy));
  }

  private static List<Spend> queries(int k, double epsilon) {
    return Collections.nCopies(k, Spend.create(epsilon, 0.0));
  }
}
