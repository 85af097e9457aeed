package edu.jhu.hlt.beamsearch;

import java.util.List;
import java.util.Set;

/**
 * Scores and expands a grouped {@link State}.
 *
 * IMPORTANT: {@link BeamSearch} never sorts what you return here. Results must
 * come back ordered by non-increasing score (over all group members, not per
 * member), and every returned state must be a singleton group.
 */
public interface TransitionFunction<S extends State<S>> {

  /**
   * @param state a grouped state, possibly mixing several batch indices.
   * @param maxActions at most this many children may be produced for each
   * group member (fewer if there are not that many actions).
   * @param allowedActions null if nothing is restricted, otherwise one entry
   * per group member giving the only actions that member may take. A null
   * entry leaves that member unrestricted.
   * @return singleton-group children, best first.
   */
  public Iterable<S> takeStep(S state, int maxActions, List<Set<Integer>> allowedActions);
}
