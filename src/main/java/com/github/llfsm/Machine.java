package com.github.llfsm;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.github.llfsm.binding.Boilerplate;
import com.github.llfsm.binding.CBinding;
import com.github.llfsm.binding.OutputLanguage;
import com.github.llfsm.layout.Path;
import com.github.llfsm.layout.Point2D;
import com.github.llfsm.layout.StateLayout;
import com.github.llfsm.layout.TransitionLayout;

/**
 * Aggregate of one {@link LLFSM}, the language binding it was read with, its layouts and the
 * boilerplate code sections of the machine and of each of its states.
 * 
 * Machines are never persisted implicitly; see {@code MachineCodec}.
 */
public final class Machine {
  private OutputLanguage language;
  private final LLFSM llfsm;
  private final Map<StateID, StateLayout> stateLayouts = new LinkedHashMap<>();
  private final Map<TransitionID, TransitionLayout> transitionLayouts = new LinkedHashMap<>();
  private byte[] windowLayout;
  private Boilerplate boilerplate = new Boilerplate();
  private final Map<StateID, Boilerplate> stateBoilerplates = new LinkedHashMap<>();

  public Machine() {
    this(new CBinding(), new LLFSM());
  }

  public Machine(final OutputLanguage language, final LLFSM llfsm) {
    this.language = Objects.requireNonNull(language);
    this.llfsm = Objects.requireNonNull(llfsm);
  }

  public OutputLanguage getLanguage() {
    return language;
  }

  public void setLanguage(final OutputLanguage language) {
    this.language = Objects.requireNonNull(language);
  }

  public LLFSM getLlfsm() {
    return llfsm;
  }

  public Map<StateID, StateLayout> getStateLayouts() {
    return stateLayouts;
  }

  public Map<TransitionID, TransitionLayout> getTransitionLayouts() {
    return transitionLayouts;
  }

  /**
   * @return the layout of the given state, or its default grid layout
   */
  public StateLayout stateLayout(final StateID stateID) {
    final StateLayout layout = stateLayouts.get(stateID);
    return layout != null ? layout : StateLayout.grid(Math.max(0, llfsm.stateIndex(stateID)));
  }

  /**
   * @return the layout of the given transition, or a straight path between the closed layouts of
   *         its source and target
   */
  public TransitionLayout transitionLayout(final TransitionID transitionID) {
    final TransitionLayout layout = transitionLayouts.get(transitionID);
    if (layout != null) {
      return layout;
    }
    final Transition transition = llfsm.getTransition(transitionID);
    final Point2D begin = stateLayout(transition.getSource()).getClosedLayout().getCentre();
    final Point2D end = stateLayout(transition.getTarget()).getClosedLayout().getCentre();
    final Point2D third = new Point2D((end.getX() - begin.getX()) / 3,
        (end.getY() - begin.getY()) / 3);
    final Point2D control1 = begin.plus(third);
    return new TransitionLayout(new Path(begin, control1, control1.plus(third), end));
  }

  public Optional<byte[]> getWindowLayout() {
    return Optional.ofNullable(windowLayout).map(byte[]::clone);
  }

  public void setWindowLayout(final byte[] windowLayout) {
    this.windowLayout = windowLayout == null ? null : windowLayout.clone();
  }

  public Boilerplate getBoilerplate() {
    return boilerplate;
  }

  public void setBoilerplate(final Boilerplate boilerplate) {
    this.boilerplate = Objects.requireNonNull(boilerplate);
  }

  /**
   * @return the boilerplate of the given state, created empty on first access
   */
  public Boilerplate getStateBoilerplate(final StateID stateID) {
    return stateBoilerplates.computeIfAbsent(stateID, id -> new Boilerplate());
  }

  public void setStateBoilerplate(final StateID stateID, final Boilerplate boilerplate) {
    stateBoilerplates.put(stateID, Objects.requireNonNull(boilerplate));
  }

  /**
   * Machines are interchangeable when they would be written as the same machine directory: same
   * language, state names, transitions, suspend state, boilerplate and layouts. State and
   * transition ids are not compared, they are not stable across a read.
   */
  public boolean isEquivalentTo(final Machine other) {
    return other != null && persistedContent().equals(other.persistedContent());
  }

  /**
   * @return what a machine directory records, with states and transitions in persisted order and
   *         referenced by name
   */
  private List<Object> persistedContent() {
    final List<Object> content = new ArrayList<>();
    content.add(language.getName());
    content.add(llfsm.stateNames());
    content.add(llfsm.getSuspendState().isPresent()
        ? llfsm.stateName(llfsm.getSuspendState().get()) : null);
    for (final String section : language.getMachineSections()) {
      content.add(boilerplate.get(section));
    }
    for (final StateID stateID : llfsm.getStates()) {
      final List<Object> state = new ArrayList<>();
      state.add(stateLayout(stateID));
      final Boilerplate stateBoilerplate = stateBoilerplates.get(stateID);
      for (final String section : language.getStateSections()) {
        state.add(stateBoilerplate == null ? "" : stateBoilerplate.get(section));
      }
      for (final Transition transition : llfsm.transitionsFrom(stateID)) {
        state.add(Arrays.asList(transition.getLabel(), llfsm.stateName(transition.getTarget()),
            transitionLayout(transition.getId())));
      }
      content.add(state);
    }
    content.add(windowLayout == null ? null : ByteBuffer.wrap(windowLayout));
    return content;
  }

  @Override
  public String toString() {
    return "Machine [language=" + language.getName() + ", llfsm=" + llfsm + ", windowLayout="
        + (windowLayout == null ? "none" : windowLayout.length + " bytes") + "]";
  }

}
