package edu.jhu.hlt.beamsearch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A record of what {@link BeamSearch} looked at, for debugging a model (e.g.
 * "did the gold derivation fall off the beam, and where?").
 *
 * Entry i holds the (score, action history) of every hypothesis whose history
 * has length i+1: the unfinished candidates seen at step i+1, followed by any
 * finished ones added by {@link #addFinished(double, List)}.
 */
public class BeamDetails implements Iterable<List<BeamDetails.Item>> {

  public static class Item {
    private final double score;
    private final List<Integer> actionHistory;

    public Item(double score, List<Integer> actionHistory) {
      this.score = score;
      this.actionHistory = ImmutableList.copyOf(actionHistory);
    }

    public double getScore() { return score; }
    public List<Integer> getActionHistory() { return actionHistory; }

    @Override
    public String toString() {
      return String.format("(BeamDetails.Item %s %+.2f)", actionHistory, score);
    }
  }

  private final List<List<Item>> steps = new ArrayList<>();

  void clear() {
    steps.clear();
  }

  void addStep(List<Item> step) {
    steps.add(step);
  }

  /**
   * Adds a finished hypothesis to the entry matching the length of its
   * history, adding empty entries if the log is not that long yet.
   */
  void addFinished(double score, List<Integer> actionHistory) {
    int depth = Math.max(1, actionHistory.size());
    while (steps.size() < depth)
      steps.add(new ArrayList<>());
    steps.get(depth - 1).add(new Item(score, actionHistory));
  }

  public int numSteps() {
    return steps.size();
  }

  public boolean isEmpty() {
    return steps.isEmpty();
  }

  public List<Item> getStep(int i) {
    return Collections.unmodifiableList(steps.get(i));
  }

  @Override
  public Iterator<List<Item>> iterator() {
    List<List<Item>> view = new ArrayList<>(steps.size());
    for (List<Item> s : steps)
      view.add(Collections.unmodifiableList(s));
    return view.iterator();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("(BeamDetails numSteps=" + steps.size() + "\n");
    for (int i = 0; i < steps.size(); i++)
      sb.append(String.format("  %d %s\n", i, steps.get(i)));
    sb.append(')');
    return sb.toString();
  }
}
