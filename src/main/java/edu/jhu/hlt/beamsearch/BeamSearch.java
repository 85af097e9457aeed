package edu.jhu.hlt.beamsearch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import edu.jhu.hlt.beamsearch.constraint.PrefixTree;
import edu.jhu.hlt.beamsearch.util.ExperimentProperties;
import edu.jhu.hlt.beamsearch.util.Timer;

/**
 * Beam search over transition sequences given an initial {@link State} and a
 * {@link TransitionFunction}, returning the highest scoring final states found
 * by the beam (the states keep track of their own action sequences).
 *
 * The initial state is assumed to be batched: the search keeps up to
 * {@code beamSize} states around for each batch index, and returns a map from
 * batch index to ranked finished states.
 *
 * IMPORTANT: the {@link TransitionFunction} must return next states in sorted
 * order. No additional sort is done inside the step loop; finished states are
 * sorted once, at the end.
 *
 * Setting {@code perNodeBeamSize} smaller than {@code beamSize} limits how
 * many children each hypothesis may contribute per step, which can add
 * diversity to the beam (Freitag and Al-Onaizan 2017, "Beam Search Strategies
 * for Neural Machine Translation").
 *
 * If {@code keepBeamDetails} is set this instance records every step of its
 * last search (see {@link #getBeams()}) and must not be shared across threads.
 */
public class BeamSearch<S extends State<S>> {
  public static final Logger LOG = Logger.getLogger(BeamSearch.class);

  private final int beamSize;
  private final int perNodeBeamSize;
  private final List<Integer> initialSequence;    // null or non-empty
  private final PrefixTree allowedTransitions;    // null iff initialSequence is
  private final BeamDetails beams;                // null unless keeping details

  public BeamSearch(int beamSize) {
    this(beamSize, beamSize);
  }

  public BeamSearch(int beamSize, int perNodeBeamSize) {
    this(beamSize, perNodeBeamSize, null, false);
  }

  /**
   * @param initialSequence if not null or empty, the first steps of search are
   * forced to follow these actions.
   * @param keepBeamDetails record each step's candidates, see {@link #getBeams()}.
   */
  public BeamSearch(int beamSize, int perNodeBeamSize, List<Integer> initialSequence, boolean keepBeamDetails) {
    if (beamSize <= 0)
      throw new IllegalArgumentException("beamSize must be positive: " + beamSize);
    if (perNodeBeamSize <= 0)
      throw new IllegalArgumentException("perNodeBeamSize must be positive: " + perNodeBeamSize);
    this.beamSize = beamSize;
    this.perNodeBeamSize = perNodeBeamSize;
    if (initialSequence != null && !initialSequence.isEmpty()) {
      this.initialSequence = ImmutableList.copyOf(initialSequence);
      this.allowedTransitions = PrefixTree.of(this.initialSequence);
    } else {
      this.initialSequence = null;
      this.allowedTransitions = null;
    }
    this.beams = keepBeamDetails ? new BeamDetails() : null;
  }

  /**
   * Reads beamSize, perNodeBeamSize, keepBeamDetails and initialSequence (a
   * comma separated list of action ids).
   */
  public static <S extends State<S>> BeamSearch<S> fromConfig(ExperimentProperties config) {
    int beamSize = config.getInt("beamSize", 10);
    int perNodeBeamSize = config.getInt("perNodeBeamSize", beamSize);
    boolean keepBeamDetails = config.getBoolean("keepBeamDetails", false);
    List<Integer> initialSequence = config.getIntList("initialSequence");
    return new BeamSearch<>(beamSize, perNodeBeamSize, initialSequence, keepBeamDetails);
  }

  /**
   * A new instance like this one but forced to follow {@code initialSequence},
   * keeping beam details. An empty sequence forces nothing.
   */
  public BeamSearch<S> constrainedTo(List<Integer> initialSequence) {
    return constrainedTo(initialSequence, true);
  }

  /**
   * A new instance like this one but forced to follow {@code initialSequence}.
   */
  public BeamSearch<S> constrainedTo(List<Integer> initialSequence, boolean keepBeamDetails) {
    return new BeamSearch<>(beamSize, perNodeBeamSize, initialSequence, keepBeamDetails);
  }

  public Map<Integer, List<S>> search(int numSteps, S initialState, TransitionFunction<S> transitionFunction) {
    return search(numSteps, initialState, transitionFunction, true);
  }

  /**
   * @param numSteps an upper bound on the number of steps taken. Search may
   * stop earlier if every hypothesis finishes or runs out of actions.
   * @param initialState the (batched) starting state.
   * @param keepFinalUnfinishedStates if we run out of steps before a state is
   * finished, should it be returned in the results anyway?
   * @return batch index to its best states, at most beamSize of them, best
   * first. Batch indices with nothing finished are absent.
   */
  public Map<Integer, List<S>> search(int numSteps, S initialState, TransitionFunction<S> transitionFunction,
      boolean keepFinalUnfinishedStates) {
    if (numSteps <= 0)
      throw new IllegalArgumentException("numSteps must be positive: " + numSteps);
    if (LOG.isDebugEnabled()) {
      LOG.debug("[search] numSteps=" + numSteps + " beamSize=" + beamSize
          + " perNodeBeamSize=" + perNodeBeamSize + " constrainedTo=" + initialSequence
          + " keepFinalUnfinishedStates=" + keepFinalUnfinishedStates);
    }

    ListMultimap<Integer, S> finishedStates = MultimapBuilder.treeKeys().arrayListValues().build();
    List<S> states = new ArrayList<>();
    states.add(initialState);
    int stepNum = 1;
    // Histories only grow, so once every member is off the tree it stays off
    boolean forced = allowedTransitions != null;
    Timer stepTimer = new Timer("BeamSearch.takeStep");

    if (beams != null)
      beams.clear();

    while (!states.isEmpty() && stepNum <= numSteps) {
      // Batch indices appear in the order they were first produced
      ListMultimap<Integer, S> nextStates = MultimapBuilder.linkedHashKeys().arrayListValues().build();
      S groupedState = states.get(0).combineStates(states);

      List<Set<Integer>> allowedActions = forced ? allowedActions(groupedState) : null;
      if (forced && allowedActions == null) {
        LOG.debug("[search] constraint exhausted at step " + stepNum + ", searching freely");
        forced = false;
      }

      stepTimer.start();
      Iterable<S> children = transitionFunction.takeStep(groupedState, perNodeBeamSize, allowedActions);
      for (S next : children) {
        // isFinished checks that the group size is 1, which is what lets us
        // read the first (only) batch index, score and history below.
        int batchIndex = next.getBatchIndices().get(0);
        if (next.isFinished()) {
          finishedStates.put(batchIndex, next);
        } else {
          if (stepNum == numSteps && keepFinalUnfinishedStates)
            finishedStates.put(batchIndex, next);
          nextStates.put(batchIndex, next);
        }
      }
      stepTimer.stop();

      states = new ArrayList<>();
      List<BeamDetails.Item> step = beams == null ? null : new ArrayList<>();
      for (Integer batchIndex : nextStates.keySet()) {
        List<S> batchStates = nextStates.get(batchIndex);
        // Already sorted by the transition function
        states.addAll(batchStates.subList(0, Math.min(beamSize, batchStates.size())));
        if (step != null) {
          for (S s : batchStates)
            step.add(new BeamDetails.Item(s.getScore().get(0), s.getActionHistory().get(0)));
        }
      }
      if (step != null)
        beams.addStep(step);
      if (LOG.isDebugEnabled()) {
        LOG.debug("[search] step=" + stepNum + " unfinished=" + nextStates.size()
            + " kept=" + states.size() + " finished=" + finishedStates.size());
      }
      stepNum++;
    }

    if (beams != null) {
      for (S s : finishedStates.get(0))
        beams.addFinished(s.getScore().get(0), s.getActionHistory().get(0));
    }

    Map<Integer, List<S>> bestStates = new TreeMap<>();
    Comparator<S> byScore = bestFirst();
    for (Integer batchIndex : finishedStates.keySet()) {
      // List.sort is stable: ties stay in the order they were found
      List<S> batchStates = new ArrayList<>(finishedStates.get(batchIndex));
      batchStates.sort(byScore);
      bestStates.put(batchIndex, new ArrayList<>(batchStates.subList(0, Math.min(beamSize, batchStates.size()))));
    }
    if (LOG.isDebugEnabled())
      LOG.debug("[search] done after " + (stepNum - 1) + " steps, " + stepTimer);
    return bestStates;
  }

  /**
   * Orders singleton states by descending score. Adding 0.0 maps -0.0 to 0.0
   * so that equal scores tie (Double.compare puts -0.0 first).
   */
  static <S extends State<S>> Comparator<S> bestFirst() {
    return (a, b) -> Double.compare(b.getScore().get(0) + 0.0, a.getScore().get(0) + 0.0);
  }

  /**
   * Looks up each group member's history in the prefix tree. Returns null if
   * there is no constraint or no member's history is still a prefix of it.
   */
  private List<Set<Integer>> allowedActions(S groupedState) {
    if (allowedTransitions == null)
      return null;
    List<List<Integer>> histories = groupedState.getActionHistory();
    List<Set<Integer>> allowed = new ArrayList<>(histories.size());
    boolean any = false;
    for (List<Integer> h : histories) {
      Set<Integer> a = allowedTransitions.allowedActions(h);
      any |= a != null;
      allowed.add(a);
    }
    return any ? allowed : null;
  }

  /**
   * What the last call to search looked at, or null if this instance was not
   * asked to keep beam details.
   */
  public BeamDetails getBeams() {
    return beams;
  }

  public int getBeamSize() {
    return beamSize;
  }

  public int getPerNodeBeamSize() {
    return perNodeBeamSize;
  }

  /** May be null */
  public List<Integer> getInitialSequence() {
    return initialSequence;
  }

  public boolean isConstrained() {
    return allowedTransitions != null;
  }

  public boolean keepsBeamDetails() {
    return beams != null;
  }
}
