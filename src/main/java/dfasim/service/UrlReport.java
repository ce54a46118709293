package dfasim.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dfasim.validate.SecurityIssue;
import dfasim.validate.UrlComponents;
import java.util.List;
import java.util.Map;

/**
 * Everything known about one URL: verdict, path through the automaton, and
 * whatever looked suspicious.
 *
 * @param valid whether the URL was accepted
 * @param stateSequence states visited
 * @param securityIssues matched substrings per issue
 * @param rejectionReason explanation ({@code null} when valid)
 * @param components URL pieces ({@code null} when invalid)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UrlReport(
  @JsonProperty("valid") boolean valid,
  @JsonProperty("state_sequence") List<String> stateSequence,
  @JsonProperty("security_issues") Map<SecurityIssue, List<String>> securityIssues,
  @JsonProperty("rejection_reason") String rejectionReason,
  @JsonProperty("components") UrlComponents components
) { }
