package edu.jhu.hlt.beamsearch.constraint;

import java.util.Arrays;
import java.util.List;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

/**
 * A sequence of action ids with value-based hashCode and equals, used as the
 * key of a {@link PrefixTree}. The empty prefix is allowed.
 *
 * Immutable: the ids are copied out of whatever they were built from.
 */
public class ActionPrefix {

  public static final ActionPrefix EMPTY = new ActionPrefix(new int[0]);

  private final int[] actions;
  private final long hash;

  private ActionPrefix(int[] actions) {
    this.actions = actions;
    Hasher h = Hashing.murmur3_128().newHasher();
    for (int a : actions)
      h.putInt(a);
    this.hash = h.hash().asLong();
  }

  public static ActionPrefix of(List<Integer> actions) {
    int[] a = new int[actions.size()];
    for (int i = 0; i < a.length; i++)
      a[i] = actions.get(i);
    return new ActionPrefix(a);
  }

  public static ActionPrefix of(int... actions) {
    return new ActionPrefix(Arrays.copyOf(actions, actions.length));
  }

  /** Returns a new prefix one action longer than this one */
  public ActionPrefix append(int action) {
    int[] a = Arrays.copyOf(actions, actions.length + 1);
    a[actions.length] = action;
    return new ActionPrefix(a);
  }

  public int get(int i) {
    return actions[i];
  }

  public int length() {
    return actions.length;
  }

  @Override
  public int hashCode() {
    return (int) (hash ^ (hash >>> 32));
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof ActionPrefix) {
      ActionPrefix a = (ActionPrefix) other;
      if (hash != a.hash)
        return false;
      return Arrays.equals(actions, a.actions);
    }
    return false;
  }

  @Override
  public String toString() {
    return Arrays.toString(actions);
  }
}
