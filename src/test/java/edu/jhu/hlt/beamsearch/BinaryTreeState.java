package edu.jhu.hlt.beamsearch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A hypothesis is a bit string; it is finished once it has {@code depth} bits.
 */
public class BinaryTreeState extends AbstractState<BinaryTreeState> {

  private final int depth;

  public BinaryTreeState(int depth, List<Integer> batchIndices, List<Double> score, List<List<Integer>> actionHistory) {
    super(batchIndices, score, actionHistory);
    this.depth = depth;
  }

  /** A group with one empty hypothesis per batch index */
  public static BinaryTreeState initial(int depth, Integer... batchIndices) {
    List<Double> score = new ArrayList<>();
    List<List<Integer>> histories = new ArrayList<>();
    for (int i = 0; i < batchIndices.length; i++) {
      score.add(0d);
      histories.add(Collections.<Integer>emptyList());
    }
    return new BinaryTreeState(depth, Arrays.asList(batchIndices), score, histories);
  }

  public int getDepth() {
    return depth;
  }

  /** Singleton state reached by member {@code member} taking {@code action} */
  public BinaryTreeState child(int member, int action, double newScore) {
    List<Integer> h = new ArrayList<>(actionHistory.get(member));
    h.add(action);
    return new BinaryTreeState(depth,
        Collections.singletonList(batchIndices.get(member)),
        Collections.singletonList(newScore),
        Collections.singletonList(h));
  }

  @Override
  protected boolean isFinishedMember() {
    return actionHistory.get(0).size() >= depth;
  }

  @Override
  public BinaryTreeState combineStates(List<BinaryTreeState> states) {
    return new BinaryTreeState(depth,
        concat(states, BinaryTreeState::getBatchIndices),
        concat(states, BinaryTreeState::getScore),
        concat(states, BinaryTreeState::getActionHistory));
  }
}
