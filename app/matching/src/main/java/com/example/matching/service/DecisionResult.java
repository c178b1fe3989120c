package com.example.matching.service;

import com.example.matching.model.MatchRecord;
import com.example.matching.model.PreferenceRecord;

/** recordDecision の結果。match は matched=true の場合のみ非 null。 */
public record DecisionResult(PreferenceRecord preference, boolean matched, MatchRecord match) {

  static DecisionResult unmatched(PreferenceRecord preference) {
    return new DecisionResult(preference, false, null);
  }

  static DecisionResult matched(PreferenceRecord preference, MatchRecord match) {
    return new DecisionResult(preference, true, match);
  }
}
