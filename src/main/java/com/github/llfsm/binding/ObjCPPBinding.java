package com.github.llfsm.binding;

import static com.github.llfsm.binding.Identifiers.symbol;

import java.util.ArrayList;
import java.util.List;

import com.github.llfsm.Instance;
import com.github.llfsm.LLFSM;
import com.github.llfsm.Machine;
import com.github.llfsm.State;
import com.github.llfsm.Transition;
import com.github.llfsm.fs.DirectoryNode;

/**
 * Binding generating CLFSM style Objective-C++ machines: a {@code CLMachine} subclass per machine
 * and a {@code CLState} subclass per state, with one {@code CLTransition} subclass per transition.
 */
public final class ObjCPPBinding extends CFamilyBinding {
  private static final String[] actions = {"OnEntry", "OnExit", "Internal", "OnSuspend",
      "OnResume"};

  @Override
  public String getName() {
    return Format.OBJCX.getFormatName();
  }

  @Override
  protected String machineFilePrefix(final String machineName) {
    return machineName;
  }

  @Override
  public void addInterface(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    directory.putText(name + ".h", machineHeader(machine.getLlfsm(), name));
  }

  @Override
  public void addStateInterface(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    final LLFSM llfsm = machine.getLlfsm();
    for (final State state : states(llfsm)) {
      directory.putText("State_" + state.getName() + ".h", stateHeader(state, llfsm, name));
    }
  }

  @Override
  public void addCode(final Machine machine, final String name, final DirectoryNode directory,
      final boolean isSuspensible) {
    directory.putText(name + ".mm",
        machineImplementation(machine.getLlfsm(), name, isSuspensible));
  }

  @Override
  public void addStateCode(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    final LLFSM llfsm = machine.getLlfsm();
    for (final State state : states(llfsm)) {
      directory.putText("State_" + state.getName() + ".mm",
          stateImplementation(state, llfsm, name));
    }
  }

  @Override
  public void addBuildFiles(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    directory.putText("project.cmake", Code.block(
        "# Sources for the " + name + " Objective-C++ FSM.", "set(" + name + "_FSM_SOURCES",
        "    " + name + ".mm",
        Code.forEach(states(machine.getLlfsm()), state -> "    State_" + state.getName() + ".mm"),
        ")", "") + "\n");
    directory.putText("CMakeLists.txt",
        Code.block(cmakePreamble(name, "CXX", "CMAKE_CXX_STANDARD"),
            "add_library(" + name + "_fsm STATIC ${" + name + "_FSM_SOURCES})",
            "target_include_directories(" + name + "_fsm PRIVATE",
            "  $<BUILD_INTERFACE:${CMAKE_CURRENT_SOURCE_DIR}>",
            "  $<BUILD_INTERFACE:${CMAKE_SOURCE_DIR}>",
            "  $<INSTALL_INTERFACE:fsms/" + name + Filenames.MACHINE_EXTENSION + ">",
            Code.forEach(includePaths(machine), path -> "  " + path), ")", "") + "\n");
  }

  String machineHeader(final LLFSM llfsm, final String name) {
    final int count = llfsm.stateCount();
    return header(name + ".h") + Code.includeFile("clfsm_machine_" + name + "_",
        "#include \"CLMachine.h\"", "", "namespace FSM",
        Code.bracedBlock("class CLState;", "", "namespace CLM",
            Code.bracedBlock("class " + name + ": public CLMachine",
                Code.bracedBlock("CLState *_states[" + count + "];",
                    "public:",
                    name + "(int mid = 0, const char *name = \"" + name + "\");",
                    "virtual ~" + name + "();",
                    "virtual CLState * const * states() const { return _states; }",
                    "virtual int numberOfStates() const { return " + count + "; }",
                    "#include \"" + name + "_Variables.h\"",
                    "#include \"" + name + "_Methods.h\"")
                    + ";")),
        "", "extern \"C\"",
        Code.bracedBlock("FSM::CLM::" + name + " *CLM_Create_" + name
            + "(int mid, const char *name);"));
  }

  String machineImplementation(final LLFSM llfsm, final String name,
      final boolean isSuspensible) {
    final List<State> states = states(llfsm);
    final int suspendIndex =
        llfsm.getSuspendState().isPresent() ? llfsm.stateIndex(llfsm.getSuspendState().get()) : -1;
    return header(name + ".mm") + Code.block("#include \"" + name + "_Includes.h\"",
        "#include \"" + name + ".h\"",
        Code.forEach(states, state -> "#include \"State_" + state.getName() + ".h\""), "",
        "using namespace FSM;", "using namespace CLM;", "", "extern \"C\"",
        Code.bracedBlock(name + " *CLM_Create_" + name + "(int mid, const char *name)",
            Code.bracedBlock("return new " + name + "(mid, name);")),
        "",
        name + "::" + name + "(int mid, const char *name): CLMachine(mid, name)",
        Code.bracedBlock(
            Code.enumerating(states, (i, state) -> "_states[" + i + "] = new FSM" + name
                + "::State::" + state.getName() + ";"),
            Code.when(isSuspensible && suspendIndex >= 0,
                "setSuspendState(_states[" + suspendIndex + "]);"),
            Code.when(!states.isEmpty(), "setInitialState(_states[0]);")),
        "", name + "::~" + name + "()",
        Code.bracedBlock(
            Code.enumerating(states, (i, state) -> "delete _states[" + i + "];")))
        + "\n";
  }

  String stateHeader(final State state, final LLFSM llfsm, final String name) {
    final String className = state.getName();
    final int count = llfsm.transitionsFrom(state.getId()).size();
    final List<String> members = new ArrayList<>();
    for (final String action : actions) {
      members.add("class " + action + ": public CLAction");
      members.add(Code.bracedBlock("virtual void perform(CLMachine *, CLState *) const;") + ";");
      members.add("");
    }
    for (int i = 0; i < count; i++) {
      members.add("class Transition_" + i + ": public CLTransition");
      members.add(Code.bracedBlock("public:",
          "Transition_" + i + "(int toState = 0): CLTransition(toState) {}", "",
          "virtual bool check(CLMachine *, CLState *) const;") + ";");
      members.add("");
    }
    members.add("CLTransition *_transitions[" + count + "];");
    members.add("");
    members.add("public:");
    members.add(className + "(const char *name = \"" + className + "\");");
    members.add("virtual ~" + className + "();");
    members.add("virtual CLTransition * const *transitions() const { return _transitions; }");
    members.add("virtual int numberOfTransitions() const { return " + count + "; }");
    members.add("#include \"State_" + className + "_Variables.h\"");
    members.add("#include \"State_" + className + "_Methods.h\"");
    return header("State_" + className + ".h") + Code.includeFile(
        "clfsm_" + name + "_State_" + className + "_h", "#include \"CLState.h\"",
        "#include \"CLAction.h\"", "#include \"CLTransition.h\"", "", "namespace FSM",
        Code.bracedBlock("namespace CLM",
            Code.bracedBlock("namespace FSM" + name,
                Code.bracedBlock("namespace State",
                    Code.bracedBlock("class " + className + ": public CLState",
                        Code.bracedBlock(Code.block(members)) + ";")))));
  }

  String stateImplementation(final State state, final LLFSM llfsm, final String name) {
    final String className = state.getName();
    final List<Transition> transitions = llfsm.transitionsFrom(state.getId());
    final String references = Code.block("#\tinclude \"" + name + "_VarRefs.mm\"",
        "#\tinclude \"State_" + className + "_VarRefs.mm\"",
        "#\tinclude \"" + name + "_FuncRefs.mm\"",
        "#\tinclude \"State_" + className + "_FuncRefs.mm\"");
    final List<String> bodies = new ArrayList<>();
    for (final String action : actions) {
      bodies.add("void " + className + "::" + action
          + "::perform(CLMachine *_machine, CLState *_state) const");
      bodies.add(Code.block("{", references,
          "#\tinclude \"State_" + className + "_" + action + ".mm\"", "}", ""));
    }
    for (int i = 0; i < transitions.size(); i++) {
      bodies.add("bool " + className + "::Transition_" + i
          + "::check(CLMachine *_machine, CLState *_state) const");
      bodies.add(Code.block("{", references, "", "\treturn", "\t(",
          "#\t\tinclude \"" + transitionFile(className, i) + "\"", "\t);", "}", ""));
    }
    return header("State_" + className + ".mm") + Code.block(
        "#include \"" + name + "_Includes.h\"", "#include \"" + name + ".h\"",
        "#include \"State_" + className + ".h\"", "",
        "#include \"State_" + className + "_Includes.h\"", "",
        "using namespace FSM;", "using namespace CLM;", "using namespace FSM" + name + ";",
        "using namespace State;", "",
        className + "::" + className + "(const char *name): CLState(name, *new " + className
            + "::OnEntry, *new " + className + "::OnExit, *new " + className
            + "::Internal, NULLPTR, new " + className + "::OnSuspend, new " + className
            + "::OnResume)",
        Code.bracedBlock(Code.enumerating(transitions,
            (i, transition) -> "_transitions[" + i + "] = new Transition_" + i + "("
                + llfsm.stateIndex(transition.getTarget()) + ");")),
        "", className + "::~" + className + "()",
        Code.bracedBlock("delete &onEntryAction();", "delete &onExitAction();",
            "delete &internalAction();", "delete onSuspendAction();", "delete onResumeAction();",
            Code.enumerating(transitions, (i, transition) -> "delete _transitions[" + i + "];")),
        "", Code.block(bodies));
  }

  @Override
  public void addArrangementInterface(final List<Instance> instances, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    directory.putText("Arrangement_" + name + ".h", header("Arrangement_" + name + ".h")
        + Code.includeFile("clfsm_arrangement_" + name + "_h", "#include \"CLMachine.h\"", "",
            "#define ARRANGEMENT_" + Identifiers.macro(name) + "_NUMBER_OF_INSTANCES "
                + instances.size(),
            "", "namespace FSM",
            Code.bracedBlock("/// Create the machines of the " + name + " arrangement.",
                "/// - Returns: the number of machines stored in `machines`.",
                "int create_arrangement_" + symbol(name) + "(CLMachine **machines);")));
  }

  @Override
  public void addArrangementCode(final List<Instance> instances, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    directory.putText("Arrangement_" + name + ".mm", header("Arrangement_" + name + ".mm")
        + Code.block("#include \"Arrangement_" + name + ".h\"",
            Code.forEach(distinctTypes(instances), instance -> "#include \""
                + instance.getTypeFile() + "/" + instance.typeName() + ".h\""),
            "", "using namespace FSM;", "using namespace CLM;", "",
            "int FSM::create_arrangement_" + symbol(name) + "(CLMachine **machines)",
            Code.bracedBlock(
                Code.enumerating(instances, (i, instance) -> "machines[" + i + "] = CLM_Create_"
                    + instance.typeName() + "(" + i + ", \"" + instance.getName() + "\");"),
                "return " + instances.size() + ";"))
        + "\n");
  }

  @Override
  public void addArrangementBuildFiles(final List<Instance> instances, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    directory.putText("project.cmake", Code.block(
        "# Sources for the " + name + " Objective-C++ FSM arrangement.",
        "set(" + name + "_ARRANGEMENT_SOURCES", "    Arrangement_" + name + ".mm",
        Code.forEach(distinctTypes(instances), instance -> Code.block(
            "    " + instance.getTypeFile() + "/" + instance.typeName() + ".mm",
            Code.forEach(states(instance.getMachine().getLlfsm()), state -> "    "
                + instance.getTypeFile() + "/State_" + state.getName() + ".mm"))),
        ")", "") + "\n");
    directory.putText("CMakeLists.txt",
        Code.block(cmakePreamble(name + "_arrangement", "CXX", "CMAKE_CXX_STANDARD"),
            "add_library(" + name + "_arrangement STATIC ${" + name + "_ARRANGEMENT_SOURCES})",
            "target_include_directories(" + name + "_arrangement PRIVATE",
            "  $<BUILD_INTERFACE:${CMAKE_CURRENT_SOURCE_DIR}>",
            Code.forEach(distinctTypes(instances),
                instance -> "  $<BUILD_INTERFACE:${CMAKE_CURRENT_SOURCE_DIR}/"
                    + instance.getTypeFile() + ">"),
            ")", "") + "\n");
  }

  @Override
  public String toString() {
    return "ObjCPPBinding";
  }

}
