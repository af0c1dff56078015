package com.github.llfsm.binding;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.github.llfsm.Instance;
import com.github.llfsm.LLFSM;
import com.github.llfsm.LLFSMException;
import com.github.llfsm.Machine;
import com.github.llfsm.MachineFixtures;
import com.github.llfsm.State;
import com.github.llfsm.fs.DirectoryNode;

/**
 * Tests for the generated Objective-C++ sources.
 */
public class ObjCPPBindingTest {

  @Test
  public void testSectionFilesUseMachineName() {
    final ObjCPPBinding binding = new ObjCPPBinding();
    assertEquals("objc++", binding.getName());
    assertEquals("Lights_Includes.h",
        binding.machineSectionFile("Lights", CFamilyBinding.INCLUDES));
    assertEquals("Lights_Methods.h", binding.machineSectionFile("Lights", CFamilyBinding.FUNCTIONS));
    assertEquals("IncludePath", binding.machineSectionFile("Lights", CFamilyBinding.INCLUDE_PATH));
    assertEquals("Machine_Lights_Includes.h",
        new CBinding().machineSectionFile("Lights", CFamilyBinding.INCLUDES));
    assertEquals("State_Red_OnResume.mm",
        binding.stateSectionFile("Red", CFamilyBinding.ON_RESUME));
  }

  @Test
  public void testMachineClass() throws LLFSMException {
    final LLFSM llfsm = MachineFixtures.redGreen(true).getLlfsm();
    final ObjCPPBinding binding = new ObjCPPBinding();
    final String header = binding.machineHeader(llfsm, "Lights");
    assertTrue(header.contains("#ifndef CLFSM_MACHINE_LIGHTS"));
    assertTrue(header.contains("class Lights: public CLMachine"));
    assertTrue(header.contains("CLState *_states[2];"));
    assertTrue(header.contains("virtual int numberOfStates() const { return 2; }"));
    assertTrue(header.contains("FSM::CLM::Lights *CLM_Create_Lights(int mid, const char *name);"));

    final String suspensible = binding.machineImplementation(llfsm, "Lights", true);
    assertTrue(suspensible.contains("_states[0] = new FSMLights::State::Red;"));
    assertTrue(suspensible.contains("_states[1] = new FSMLights::State::Green;"));
    assertTrue(suspensible.contains("setSuspendState(_states[1]);"));
    assertTrue(suspensible.contains("setInitialState(_states[0]);"));
    assertFalse(binding.machineImplementation(llfsm, "Lights", false).contains("setSuspendState"));
  }

  @Test
  public void testStateClass() throws LLFSMException {
    final LLFSM llfsm = MachineFixtures.redGreen(false).getLlfsm();
    final State red = llfsm.getState(llfsm.getStates().get(0));
    final ObjCPPBinding binding = new ObjCPPBinding();
    final String header = binding.stateHeader(red, llfsm, "Lights");
    assertTrue(header.contains("class Red: public CLState"));
    assertTrue(header.contains("class Transition_0: public CLTransition"));
    assertFalse(header.contains("class Transition_1"));
    assertTrue(header.contains("virtual int numberOfTransitions() const { return 1; }"));

    final String implementation = binding.stateImplementation(red, llfsm, "Lights");
    assertTrue(implementation.contains("_transitions[0] = new Transition_0(1);"));
    assertTrue(implementation.contains("#\t\tinclude \"State_Red_Transition_0.expr\""));
    assertTrue(implementation.contains("#\tinclude \"State_Red_OnEntry.mm\""));
  }

  @Test
  public void testArrangementCreatesEveryInstance() throws LLFSMException {
    final Machine lights = MachineFixtures.redGreen(false);
    final List<Instance> instances = Arrays.asList(
        new Instance("north", "Lights.machine", lights),
        new Instance("south", "Lights.machine", lights));
    final ObjCPPBinding binding = new ObjCPPBinding();
    final DirectoryNode directory = new DirectoryNode("Junction.arrangement");
    binding.addArrangementInterface(instances, "Junction", directory, false);
    binding.addArrangementCode(instances, "Junction", directory, false);
    binding.addArrangementBuildFiles(instances, "Junction", directory, false);

    assertTrue(directory.getText("Arrangement_Junction.h").get()
        .contains("int create_arrangement_junction(CLMachine **machines);"));
    final String code = directory.getText("Arrangement_Junction.mm").get();
    final String include = "#include \"Lights.machine/Lights.h\"";
    assertTrue(code.contains(include));
    assertEquals(code.indexOf(include), code.lastIndexOf(include));
    assertTrue(code.contains("machines[0] = CLM_Create_Lights(0, \"north\");"));
    assertTrue(code.contains("machines[1] = CLM_Create_Lights(1, \"south\");"));
    assertTrue(code.contains("return 2;"));
    assertTrue(directory.getText("project.cmake").get()
        .contains("    Lights.machine/Lights.mm\n    Lights.machine/State_Red.mm"));
  }

}
