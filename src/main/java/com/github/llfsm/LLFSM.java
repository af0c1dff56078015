package com.github.llfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.github.llfsm.LLFSMException.Code;

/**
 * A logic-labelled finite state machine: an ordered set of states, an ordered set of labelled
 * transitions between them and an optional suspend state.
 * 
 * Notes:<br>
 * 1. The initial state is always the first element of {@link #getStates()}. Setting the initial
 * state moves it to the front, so generated state arrays start with it.<br>
 * 2. States cannot be removed, so transitions never end up referencing non-member states.<br>
 * 3. Instances are not thread-safe.<br>
 */
public final class LLFSM {
  static final String synthesizedStateName = "Initial";

  private final List<StateID> states = new ArrayList<>();
  private final List<TransitionID> transitions = new ArrayList<>();
  private final Map<StateID, State> stateMap = new HashMap<>();
  private final Map<TransitionID, Transition> transitionMap = new HashMap<>();
  private StateID suspendState;

  public LLFSM() {}

  public LLFSM(final List<State> states, final List<Transition> transitions,
      final StateID suspendState) throws LLFSMException {
    for (final State state : states) {
      addState(state);
    }
    for (final Transition transition : transitions) {
      addTransition(transition);
    }
    setSuspendState(suspendState);
  }

  public List<StateID> getStates() {
    return Collections.unmodifiableList(states);
  }

  public List<TransitionID> getTransitions() {
    return Collections.unmodifiableList(transitions);
  }

  public boolean isEmpty() {
    return states.isEmpty();
  }

  public int stateCount() {
    return states.size();
  }

  public int transitionCount() {
    return transitions.size();
  }

  /**
   * @return the initial state, or null if this LLFSM has no states yet
   */
  public StateID getInitialState() {
    return states.isEmpty() ? null : states.get(0);
  }

  /**
   * On an empty LLFSM this synthesizes exactly one state carrying the given id. Otherwise the id
   * must name a member state, which then becomes the first state.
   */
  public void setInitialState(final StateID initialState) throws LLFSMException {
    if (initialState == null) {
      throw new LLFSMException(Code.INVALID_STATE);
    }
    if (states.isEmpty()) {
      addState(new State(initialState, synthesizedStateName));
      return;
    }
    if (!stateMap.containsKey(initialState)) {
      throw new LLFSMException(Code.UNKNOWN_STATE, "Initial state " + initialState
          + " is not a member of this LLFSM");
    }
    states.remove(initialState);
    states.add(0, initialState);
  }

  public Optional<StateID> getSuspendState() {
    return Optional.ofNullable(suspendState);
  }

  /**
   * @param suspendState member state to suspend into, or null for a non-suspensible machine
   */
  public void setSuspendState(final StateID suspendState) throws LLFSMException {
    if (suspendState != null && !stateMap.containsKey(suspendState)) {
      throw new LLFSMException(Code.UNKNOWN_STATE, "Suspend state " + suspendState
          + " is not a member of this LLFSM");
    }
    this.suspendState = suspendState;
  }

  public void addState(final State state) throws LLFSMException {
    if (state == null) {
      throw new LLFSMException(Code.INVALID_STATE);
    }
    if (stateMap.put(state.getId(), state) == null) {
      states.add(state.getId());
    }
  }

  public void addTransition(final Transition transition) throws LLFSMException {
    requireMember(transition.getSource(), "source");
    requireMember(transition.getTarget(), "target");
    if (transitionMap.put(transition.getId(), transition) == null) {
      transitions.add(transition.getId());
    }
  }

  public State getState(final StateID stateID) {
    return stateMap.get(stateID);
  }

  public Transition getTransition(final TransitionID transitionID) {
    return transitionMap.get(transitionID);
  }

  public String stateName(final StateID stateID) {
    final State state = stateMap.get(stateID);
    return state == null ? null : state.getName();
  }

  /**
   * Renames the given state, or appends a new state with that id if it is not a member yet.
   */
  public void setName(final String name, final StateID stateID) throws LLFSMException {
    final State state = stateMap.get(stateID);
    if (state != null) {
      stateMap.put(stateID, state.withName(name));
    } else {
      addState(new State(stateID, name));
    }
  }

  public String label(final TransitionID transitionID) {
    final Transition transition = transitionMap.get(transitionID);
    return transition == null ? null : transition.getLabel();
  }

  /**
   * Relabels the given transition. An unknown id attaches a new self transition to the last state,
   * synthesizing an initial state first if there are no states.
   */
  public void setLabel(final String label, final TransitionID transitionID)
      throws LLFSMException {
    final Transition transition = transitionMap.get(transitionID);
    if (transition != null) {
      transitionMap.put(transitionID, transition.withLabel(label));
      return;
    }
    if (states.isEmpty()) {
      addState(new State(synthesizedStateName));
    }
    final StateID last = states.get(states.size() - 1);
    addTransition(new Transition(transitionID, label, last, last));
  }

  /**
   * @return the transitions whose source is the given state, in attachment order
   */
  public List<Transition> transitionsFrom(final StateID source) {
    final List<Transition> outgoing = new ArrayList<>();
    for (final TransitionID id : transitions) {
      final Transition transition = transitionMap.get(id);
      if (transition.getSource().equals(source)) {
        outgoing.add(transition);
      }
    }
    return outgoing;
  }

  /**
   * @return the state names in state order, with the id string standing in for a missing name
   */
  public List<String> stateNames() {
    final List<String> names = new ArrayList<>(states.size());
    for (final StateID id : states) {
      final String name = stateName(id);
      names.add(name == null ? id.toString() : name);
    }
    return names;
  }

  /**
   * @return the index of the state in state order, or -1
   */
  public int stateIndex(final StateID stateID) {
    return states.indexOf(stateID);
  }

  public Optional<State> findState(final String name) {
    for (final StateID id : states) {
      final State state = stateMap.get(id);
      if (state.getName().equals(name)) {
        return Optional.of(state);
      }
    }
    return Optional.empty();
  }

  private void requireMember(final StateID stateID, final String role) throws LLFSMException {
    if (stateID == null || !stateMap.containsKey(stateID)) {
      throw new LLFSMException(Code.UNKNOWN_STATE, "Transition " + role + " " + stateID
          + " is not a member of this LLFSM");
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(states, transitions, stateMap, transitionMap, suspendState);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final LLFSM other = (LLFSM) obj;
    return states.equals(other.states) && transitions.equals(other.transitions)
        && stateMap.equals(other.stateMap) && transitionMap.equals(other.transitionMap)
        && Objects.equals(suspendState, other.suspendState);
  }

  @Override
  public String toString() {
    return "LLFSM [states=" + stateNames() + ", transitions=" + transitions.size()
        + ", suspendState=" + (suspendState == null ? "(none)" : stateName(suspendState)) + "]";
  }

}
