package com.github.llfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.github.llfsm.LLFSMException.Code;
import com.github.llfsm.binding.CBinding;
import com.github.llfsm.binding.CFamilyBinding;
import com.github.llfsm.binding.VHDLBinding;

/**
 * Tests to maintain the sanity and correctness of the LLFSM graph.
 */
public class LLFSMTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testInitialStateDefaultsToFirstState() throws LLFSMException {
    final State a = new State("A");
    final State b = new State("B");
    final LLFSM llfsm =
        new LLFSM(Arrays.asList(a, b), Collections.<Transition>emptyList(), null);
    assertEquals(a.getId(), llfsm.getInitialState());
    assertFalse(llfsm.getSuspendState().isPresent());
    assertEquals(Arrays.asList("A", "B"), llfsm.stateNames());
  }

  @Test
  public void testEmptyLLFSMSynthesizesInitialState() throws LLFSMException {
    final LLFSM llfsm = new LLFSM();
    assertTrue(llfsm.isEmpty());
    assertNull(llfsm.getInitialState());

    final StateID fresh = StateID.random();
    llfsm.setInitialState(fresh);
    assertEquals(1, llfsm.stateCount());
    assertEquals(fresh, llfsm.getInitialState());
    assertEquals(Collections.singletonList(fresh), llfsm.getStates());
    assertEquals("Initial", llfsm.stateName(fresh));
  }

  @Test
  public void testSetInitialStateMovesMemberToFront() throws LLFSMException {
    final State a = new State("A");
    final State b = new State("B");
    final LLFSM llfsm =
        new LLFSM(Arrays.asList(a, b), Collections.<Transition>emptyList(), null);
    llfsm.setInitialState(b.getId());
    assertEquals(b.getId(), llfsm.getInitialState());
    assertEquals(Arrays.asList("B", "A"), llfsm.stateNames());
    try {
      llfsm.setInitialState(StateID.random());
      fail("expected an unknown state");
    } catch (LLFSMException expected) {
      assertEquals(Code.UNKNOWN_STATE, expected.getCode());
    }
  }

  @Test
  public void testTransitionsMustReferenceMembers() throws LLFSMException {
    final State a = new State("A");
    try {
      new LLFSM(Arrays.asList(a),
          Arrays.asList(new Transition("true", a.getId(), StateID.random())), null);
      fail("expected an unknown target");
    } catch (LLFSMException expected) {
      assertEquals(Code.UNKNOWN_STATE, expected.getCode());
    }
    try {
      new LLFSM(Arrays.asList(a), Collections.<Transition>emptyList(), StateID.random());
      fail("expected an unknown suspend state");
    } catch (LLFSMException expected) {
      assertEquals(Code.UNKNOWN_STATE, expected.getCode());
    }
  }

  @Test
  public void testTransitionsFromKeepsAttachmentOrder() throws LLFSMException {
    final State a = new State("A");
    final State b = new State("B");
    final State c = new State("C");
    final Transition ab = new Transition("x", a.getId(), b.getId());
    final Transition bc = new Transition("y", b.getId(), c.getId());
    final Transition ac = new Transition("z", a.getId(), c.getId());
    final Transition aa = new Transition("after(1)", a.getId(), a.getId());
    final LLFSM llfsm =
        new LLFSM(Arrays.asList(a, b, c), Arrays.asList(ab, bc, ac, aa), null);

    assertEquals(Arrays.asList(ab, ac, aa), llfsm.transitionsFrom(a.getId()));
    assertEquals(Arrays.asList(bc), llfsm.transitionsFrom(b.getId()));
    assertTrue(llfsm.transitionsFrom(c.getId()).isEmpty());
    int total = 0;
    for (final StateID stateID : llfsm.getStates()) {
      final List<Transition> outgoing = llfsm.transitionsFrom(stateID);
      for (final Transition transition : outgoing) {
        assertEquals(stateID, transition.getSource());
      }
      total += outgoing.size();
    }
    assertEquals(llfsm.transitionCount(), total);
  }

  @Test
  public void testRenameAndRelabel() throws LLFSMException {
    final Machine machine = MachineFixtures.redGreen(false);
    final LLFSM llfsm = machine.getLlfsm();
    final StateID red = llfsm.getStates().get(0);
    llfsm.setName("Amber", red);
    assertEquals("Amber", llfsm.stateName(red));
    assertEquals(red, llfsm.findState("Amber").get().getId());
    assertFalse(llfsm.findState("Red").isPresent());

    final TransitionID first = llfsm.getTransitions().get(0);
    llfsm.setLabel("after_ms(500)", first);
    assertEquals("after_ms(500)", llfsm.label(first));

    // unknown ids append
    final StateID extra = StateID.random();
    llfsm.setName("Extra", extra);
    assertEquals(3, llfsm.stateCount());
    final TransitionID loop = TransitionID.random();
    llfsm.setLabel("true", loop);
    assertEquals(extra, llfsm.getTransition(loop).getSource());
    assertEquals(extra, llfsm.getTransition(loop).getTarget());
  }

  @Test
  public void testSetLabelOnEmptyLLFSM() throws LLFSMException {
    final LLFSM llfsm = new LLFSM();
    final TransitionID id = TransitionID.random();
    llfsm.setLabel("true", id);
    assertEquals(1, llfsm.stateCount());
    assertEquals("Initial", llfsm.stateName(llfsm.getInitialState()));
    assertEquals(1, llfsm.transitionsFrom(llfsm.getInitialState()).size());
  }

  @Test
  public void testNullStateNameIsRejected() {
    try {
      new State(null);
      fail("expected an invalid state");
    } catch (LLFSMException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
  }

  @Test
  public void testMachineEquivalence() throws LLFSMException {
    final Machine machine = MachineFixtures.redGreen(true);
    final Machine sameGraph = new Machine(new CBinding(true),
        machine.getLlfsm());
    assertTrue(machine.isEquivalentTo(sameGraph));
    assertFalse(machine.isEquivalentTo(
        new Machine(new VHDLBinding(), machine.getLlfsm())));
  }

  @Test
  public void testEquivalenceIgnoresIds() throws LLFSMException {
    // 1. same names, labels and targets under fresh ids
    final Machine machine = MachineFixtures.redGreen(true);
    final Machine copy = MachineFixtures.redGreen(true);
    assertFalse(machine.getLlfsm().equals(copy.getLlfsm()));
    assertTrue(machine.isEquivalentTo(copy));

    // 2. any persisted difference breaks it
    assertFalse(machine.isEquivalentTo(MachineFixtures.redGreen(false)));
    final Machine relabelled = MachineFixtures.redGreen(true);
    relabelled.getLlfsm().setLabel("after(2)", relabelled.getLlfsm().getTransitions().get(0));
    assertFalse(machine.isEquivalentTo(relabelled));
    final Machine withCode = MachineFixtures.redGreen(true);
    withCode.getStateBoilerplate(withCode.getLlfsm().getStates().get(1))
        .set(CFamilyBinding.ON_ENTRY, "go();");
    assertFalse(machine.isEquivalentTo(withCode));
    final Machine withWindow = MachineFixtures.redGreen(true);
    withWindow.setWindowLayout(new byte[] {1});
    assertFalse(machine.isEquivalentTo(withWindow));
  }

}
