package edu.jhu.hlt.beamsearch;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Expands {@link BinaryTreeState}s with a configurable number of children per
 * member and remembers every call it gets.
 *
 * Action a gets local score {@code offset - a * step}, plus Gaussian noise if a
 * {@link Random} is given. With {@code step = 0} and no noise every action
 * ties, and ties are broken in favor of lower actions.
 */
public class RecordingTransitionFunction extends LocallyScoredTransitionFunction<BinaryTreeState> {

  private final int numChildren;
  private final double offset;
  private final double step;
  private final Random rand;    // may be null

  public final List<BinaryTreeState> groupedStates = new ArrayList<>();
  public final List<Integer> maxActions = new ArrayList<>();
  public final List<List<Set<Integer>>> allowedActions = new ArrayList<>();
  public final List<List<BinaryTreeState>> returned = new ArrayList<>();

  public RecordingTransitionFunction(int numChildren, double offset, double step, Random rand) {
    this.numChildren = numChildren;
    this.offset = offset;
    this.step = step;
    this.rand = rand;
  }

  /** Two children (bit 0 then bit 1), each adding log(0.5) */
  public static RecordingTransitionFunction binary() {
    return new RecordingTransitionFunction(2, Math.log(0.5), 0, null);
  }

  @Override
  protected List<Candidate> candidates(BinaryTreeState state, int member) {
    List<Candidate> c = new ArrayList<>();
    for (int a = 0; a < numChildren; a++) {
      double s = offset - a * step;
      if (rand != null)
        s += rand.nextGaussian();
      c.add(new Candidate(a, s));
    }
    return c;
  }

  @Override
  protected BinaryTreeState apply(BinaryTreeState state, int member, int action, double newScore) {
    return state.child(member, action, newScore);
  }

  @Override
  public List<BinaryTreeState> takeStep(BinaryTreeState state, int maxActions, List<Set<Integer>> allowedActions) {
    groupedStates.add(state);
    this.maxActions.add(maxActions);
    this.allowedActions.add(allowedActions);
    List<BinaryTreeState> next = super.takeStep(state, maxActions, allowedActions);
    returned.add(next);
    return next;
  }

  public int numCalls() {
    return groupedStates.size();
  }
}
