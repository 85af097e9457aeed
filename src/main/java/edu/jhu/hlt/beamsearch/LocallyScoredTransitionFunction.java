package edu.jhu.hlt.beamsearch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * A {@link TransitionFunction} for systems where each group member can list
 * its next actions along with a local score. This class takes care of the
 * ranking contract: allowed-action filtering, keeping the best
 * {@code maxActions} per member, and returning every child sorted by
 * cumulative score.
 *
 * Sorting is stable, so ties are broken by member order and then by the order
 * in which {@link #candidates(State, int)} listed the actions.
 */
public abstract class LocallyScoredTransitionFunction<S extends State<S>> implements TransitionFunction<S> {

  /**
   * An action and the score taking it would add.
   */
  public static class Candidate {
    private final int action;
    private final double score;

    public Candidate(int action, double score) {
      this.action = action;
      this.score = score;
    }

    public int getAction() { return action; }
    public double getScore() { return score; }

    @Override
    public String toString() {
      return String.format("(Candidate %d %+.2f)", action, score);
    }
  }

  // + 0.0 so that -0.0 and 0.0 tie
  private static final Comparator<Candidate> BY_LOCAL_SCORE =
      (a, b) -> Double.compare(b.getScore() + 0.0, a.getScore() + 0.0);

  /**
   * Every action group member {@code member} of {@code state} could take next.
   * Order matters only for breaking ties.
   */
  protected abstract List<Candidate> candidates(S state, int member);

  /**
   * Build the singleton state reached when group member {@code member} of
   * {@code state} takes {@code action}.
   *
   * @param newScore cumulative score of the child (parent plus local score).
   */
  protected abstract S apply(S state, int member, int action, double newScore);

  @Override
  public List<S> takeStep(S state, int maxActions, List<Set<Integer>> allowedActions) {
    if (allowedActions != null && allowedActions.size() != state.groupSize()) {
      throw new IllegalArgumentException("allowedActions.size=" + allowedActions.size()
          + " groupSize=" + state.groupSize());
    }
    List<S> children = new ArrayList<>();
    for (int i = 0; i < state.groupSize(); i++) {
      Set<Integer> allowed = allowedActions == null ? null : allowedActions.get(i);
      List<Candidate> cands = new ArrayList<>();
      for (Candidate c : candidates(state, i)) {
        if (allowed == null || allowed.contains(c.getAction()))
          cands.add(c);
      }
      cands.sort(BY_LOCAL_SCORE);
      double prefix = state.getScore().get(i);
      for (int j = 0; j < cands.size() && j < maxActions; j++) {
        Candidate c = cands.get(j);
        children.add(apply(state, i, c.getAction(), prefix + c.getScore()));
      }
    }
    children.sort(BeamSearch.bestFirst());
    return children;
  }
}
