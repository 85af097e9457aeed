package edu.jhu.hlt.beamsearch;

import java.util.List;

/**
 * One or more partial hypotheses grouped together so that a
 * {@link TransitionFunction} can expand all of them in a single call.
 *
 * The three per-member lists ({@link #getBatchIndices()}, {@link #getScore()}
 * and {@link #getActionHistory()}) always have the same length, the group
 * size. {@link BeamSearch} only ever holds singleton groups between steps; it
 * uses {@link #combineStates(List)} to batch them up before calling the
 * transition function.
 *
 * @param <S> the concrete state type, so that combining returns the same type
 */
public interface State<S extends State<S>> {

  /**
   * Which instance in the batch each group member came from.
   */
  public List<Integer> getBatchIndices();

  /**
   * Cumulative score of each group member (higher is better).
   */
  public List<Double> getScore();

  /**
   * The actions taken so far by each group member.
   */
  public List<List<Integer>> getActionHistory();

  default public int groupSize() {
    return getBatchIndices().size();
  }

  /**
   * Only defined for singleton groups.
   *
   * @throws IllegalStateException if this group has more than one member.
   */
  public boolean isFinished();

  /**
   * Concatenates the members of all of the given states, in order, into a
   * single group. Implementations should not depend on this instance being
   * one of the arguments.
   */
  public S combineStates(List<S> states);
}
