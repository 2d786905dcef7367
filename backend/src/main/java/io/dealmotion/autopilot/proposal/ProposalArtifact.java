package io.dealmotion.autopilot.proposal;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An outcome record attached to a completed proposal: either a produced artifact ({@code type} +
 * {@code id}) or a route hint the client should navigate to.
 */
public record ProposalArtifact(String type, String id, String route) {

  public static ProposalArtifact of(String type, String id) {
    return new ProposalArtifact(type, id, null);
  }

  public static ProposalArtifact redirect(String route) {
    return new ProposalArtifact("redirect", null, route);
  }

  Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    map.put("type", type);
    if (id != null) {
      map.put("id", id);
    }
    if (route != null) {
      map.put("route", route);
    }
    return map;
  }

  static ProposalArtifact fromMap(Map<String, Object> map) {
    return new ProposalArtifact(
        (String) map.get("type"), (String) map.get("id"), (String) map.get("route"));
  }
}
