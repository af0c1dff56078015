package com.github.llfsm;

import java.util.Arrays;
import java.util.Collections;

import com.github.llfsm.binding.CBinding;
import com.github.llfsm.binding.OutputLanguage;

/**
 * Machines shared by the tests.
 */
public final class MachineFixtures {

  private MachineFixtures() {}

  /**
   * Red and Green, each moving to the other on {@code timer}.
   */
  public static Machine redGreen(final boolean suspendInGreen) throws LLFSMException {
    return redGreen(new CBinding(), suspendInGreen);
  }

  public static Machine redGreen(final OutputLanguage language, final boolean suspendInGreen)
      throws LLFSMException {
    final State red = new State("Red");
    final State green = new State("Green");
    final LLFSM llfsm = new LLFSM(Arrays.asList(red, green),
        Arrays.asList(new Transition("timer", red.getId(), green.getId()),
            new Transition("timer", green.getId(), red.getId())),
        suspendInGreen ? green.getId() : null);
    return new Machine(language, llfsm);
  }

  public static Machine single(final String stateName) throws LLFSMException {
    final State state = new State(stateName);
    return new Machine(new CBinding(), new LLFSM(Arrays.asList(state),
        Collections.<Transition>emptyList(), null));
  }

}
