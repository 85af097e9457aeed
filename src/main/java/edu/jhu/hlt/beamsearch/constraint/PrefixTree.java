package edu.jhu.hlt.beamsearch.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps "actions taken so far" to "actions allowed next", built from one or
 * more target action sequences. A search can follow a known derivation by
 * only allowing the actions stored here for as long as its history is a key.
 *
 * With a single target sequence every prefix has exactly one allowed action.
 * When several alternatives share a prefix their next actions are unioned, in
 * the order the sequences were given.
 */
public class PrefixTree {
  private final Map<ActionPrefix, Set<Integer>> allowed;

  private PrefixTree() {
    this.allowed = new LinkedHashMap<>();
  }

  /**
   * @param targets indexed by [batch element][alternative][position].
   * @return one tree per batch element.
   */
  public static List<PrefixTree> construct(List<List<List<Integer>>> targets) {
    return construct(targets, null);
  }

  /**
   * @param targets indexed by [batch element][alternative][position].
   * @param masks same shape as targets, or null. A sequence ends at its first
   * false entry (everything after is treated as padding).
   * @return one tree per batch element.
   */
  public static List<PrefixTree> construct(List<List<List<Integer>>> targets, List<List<List<Boolean>>> masks) {
    if (masks != null && masks.size() != targets.size()) {
      throw new IllegalArgumentException("targets.size=" + targets.size() + " masks.size=" + masks.size());
    }
    List<PrefixTree> trees = new ArrayList<>(targets.size());
    for (int b = 0; b < targets.size(); b++) {
      List<List<Integer>> alternatives = targets.get(b);
      List<List<Boolean>> altMasks = masks == null ? null : masks.get(b);
      if (altMasks != null && altMasks.size() != alternatives.size()) {
        throw new IllegalArgumentException("batch element " + b + " has " + alternatives.size()
            + " target sequences but " + altMasks.size() + " masks");
      }
      PrefixTree t = new PrefixTree();
      for (int i = 0; i < alternatives.size(); i++) {
        List<Integer> seq = alternatives.get(i);
        List<Boolean> mask = altMasks == null ? null : altMasks.get(i);
        if (mask != null && mask.size() != seq.size()) {
          throw new IllegalArgumentException("target " + b + "/" + i + " has length " + seq.size()
              + " but its mask has length " + mask.size());
        }
        t.add(seq, mask);
      }
      trees.add(t);
    }
    return trees;
  }

  /**
   * A tree which forces exactly one sequence.
   */
  public static PrefixTree of(List<Integer> sequence) {
    return construct(Collections.singletonList(Collections.singletonList(sequence))).get(0);
  }

  private void add(List<Integer> sequence, List<Boolean> mask) {
    ActionPrefix history = ActionPrefix.EMPTY;
    for (int j = 0; j < sequence.size(); j++) {
      if (mask != null && !mask.get(j))
        break;
      int action = sequence.get(j);
      allowed.computeIfAbsent(history, k -> new LinkedHashSet<>()).add(action);
      history = history.append(action);
    }
  }

  /**
   * @return the actions allowed after {@code history}, or null if
   * {@code history} is not a prefix in this tree (i.e. it is unconstrained).
   */
  public Set<Integer> allowedActions(List<Integer> history) {
    return allowedActions(ActionPrefix.of(history));
  }

  public Set<Integer> allowedActions(ActionPrefix history) {
    Set<Integer> a = allowed.get(history);
    return a == null ? null : Collections.unmodifiableSet(a);
  }

  public boolean contains(List<Integer> history) {
    return allowed.containsKey(ActionPrefix.of(history));
  }

  /** Number of prefixes with a constraint */
  public int size() {
    return allowed.size();
  }

  public boolean isEmpty() {
    return allowed.isEmpty();
  }

  @Override
  public String toString() {
    return "(PrefixTree " + allowed + ")";
  }
}
