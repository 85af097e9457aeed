package edu.jhu.hlt.beamsearch;

import java.util.List;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

/**
 * Holds the bookkeeping every {@link State} needs (batch indices, scores and
 * action histories) so that implementations only have to say when a single
 * hypothesis is done and how to merge their own extra fields.
 *
 * All lists are copied into immutable lists on construction, so states can be
 * shared freely between beams and the trajectory log.
 */
public abstract class AbstractState<S extends AbstractState<S>> implements State<S> {

  protected final ImmutableList<Integer> batchIndices;
  protected final ImmutableList<Double> score;
  protected final ImmutableList<List<Integer>> actionHistory;

  public AbstractState(List<Integer> batchIndices, List<Double> score, List<List<Integer>> actionHistory) {
    if (batchIndices.size() != score.size() || batchIndices.size() != actionHistory.size()) {
      throw new IllegalArgumentException("group members disagree: batchIndices=" + batchIndices.size()
          + " score=" + score.size() + " actionHistory=" + actionHistory.size());
    }
    this.batchIndices = ImmutableList.copyOf(batchIndices);
    this.score = ImmutableList.copyOf(score);
    ImmutableList.Builder<List<Integer>> b = ImmutableList.builder();
    for (List<Integer> h : actionHistory)
      b.add(ImmutableList.copyOf(h));
    this.actionHistory = b.build();
  }

  @Override
  public List<Integer> getBatchIndices() {
    return batchIndices;
  }

  @Override
  public List<Double> getScore() {
    return score;
  }

  @Override
  public List<List<Integer>> getActionHistory() {
    return actionHistory;
  }

  @Override
  public final boolean isFinished() {
    if (groupSize() != 1) {
      throw new IllegalStateException("isFinished is only defined for a group of size 1,"
          + " this group has " + groupSize() + " members");
    }
    return isFinishedMember();
  }

  /**
   * Whether the lone member of this (singleton) group is a complete
   * hypothesis.
   */
  protected abstract boolean isFinishedMember();

  /**
   * Concatenates one per-member field of each state, in order. Meant for
   * {@link #combineStates(List)} implementations.
   */
  protected static <X extends State<X>, T> List<T> concat(List<X> states, Function<X, List<T>> field) {
    ImmutableList.Builder<T> b = ImmutableList.builder();
    for (X s : states)
      b.addAll(field.apply(s));
    return b.build();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(batchIndices=" + batchIndices
        + " score=" + score + " actionHistory=" + actionHistory + ")";
  }
}
