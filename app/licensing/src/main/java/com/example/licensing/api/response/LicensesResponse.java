package com.example.licensing.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LicensesResponse(boolean success, List<LicenseSummary> licenses) {
  public LicensesResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを不変コピーにする
    licenses = licenses == null ? List.of() : List.copyOf(licenses);
  }
}
