package com.example.licensing.service;

import com.example.licensing.model.BindingOutcome;

/**
 * 事前判定の結果。outcome が確定していればそのまま返し、未確定なら原子的な activation へ進む。
 *
 * @param outcome 確定した結果。activation へ進む場合は null
 */
public record BindingDecision(BindingOutcome outcome) {

  private static final BindingDecision PROCEED_TO_ACTIVATION = new BindingDecision(null);

  public static BindingDecision settled(BindingOutcome outcome) {
    if (outcome == null) {
      throw new IllegalArgumentException("outcome is required");
    }
    return new BindingDecision(outcome);
  }

  public static BindingDecision proceedToActivation() {
    return PROCEED_TO_ACTIVATION;
  }

  public boolean requiresActivation() {
    return outcome == null;
  }
}
