package com.github.llfsm.binding;

import static com.github.llfsm.binding.Identifiers.macro;
import static com.github.llfsm.binding.Identifiers.symbol;

import java.util.List;

import com.github.llfsm.Instance;
import com.github.llfsm.LLFSM;
import com.github.llfsm.Machine;
import com.github.llfsm.State;
import com.github.llfsm.Transition;
import com.github.llfsm.fs.DirectoryNode;

/**
 * Binding generating plain C LLFSMs. Each machine becomes a {@code Machine_<Name>} struct holding
 * an array of states in state order; each state gets its own header and implementation whose
 * transition check evaluates the transition expressions in attachment order.
 *
 * With introspection enabled, the machine additionally carries a table of its state names.
 */
public final class CBinding extends CFamilyBinding {
  private static final String actionSignature = "void (*)(struct LLFSMachine *, struct LLFSMState *)";
  private final boolean introspectable;

  public CBinding() {
    this(false);
  }

  public CBinding(final boolean introspectable) {
    this.introspectable = introspectable;
  }

  @Override
  public String getName() {
    return Format.C.getFormatName();
  }

  public boolean isIntrospectable() {
    return introspectable;
  }

  @Override
  protected String machineFilePrefix(final String machineName) {
    return "Machine_" + machineName;
  }

  @Override
  public void addInterface(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    directory.putText("Machine_" + name + ".h",
        machineInterface(machine.getLlfsm(), name, isSuspensible));
  }

  @Override
  public void addStateInterface(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    final LLFSM llfsm = machine.getLlfsm();
    for (final State state : states(llfsm)) {
      directory.putText("State_" + state.getName() + ".h",
          stateInterface(state, llfsm, name, isSuspensible));
    }
  }

  @Override
  public void addCode(final Machine machine, final String name, final DirectoryNode directory,
      final boolean isSuspensible) {
    directory.putText("Machine_" + name + ".c",
        machineCode(machine.getLlfsm(), name, isSuspensible));
  }

  @Override
  public void addStateCode(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    final LLFSM llfsm = machine.getLlfsm();
    for (final State state : states(llfsm)) {
      directory.putText("State_" + state.getName() + ".c",
          stateCode(state, llfsm, name, isSuspensible));
    }
  }

  @Override
  public void addBuildFiles(final Machine machine, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    final LLFSM llfsm = machine.getLlfsm();
    directory.putText("project.cmake", Code.block("# Sources for the " + name + " LLFSM.",
        "set(" + name + "_SOURCES", "    Machine_" + name + ".c",
        Code.forEach(states(llfsm), state -> "    State_" + state.getName() + ".c"), ")", "")
        + "\n");
    directory.putText("CMakeLists.txt",
        Code.block(cmakePreamble(name, "C", "CMAKE_C_STANDARD"),
            "add_library(" + name + " STATIC ${" + name + "_SOURCES})",
            "target_include_directories(" + name + " PRIVATE",
            "  $<BUILD_INTERFACE:${CMAKE_CURRENT_SOURCE_DIR}>",
            "  $<BUILD_INTERFACE:${CMAKE_SOURCE_DIR}>",
            Code.forEach(includePaths(machine), path -> "  " + path), ")", "") + "\n");
  }

  String machineInterface(final LLFSM llfsm, final String name, final boolean isSuspensible) {
    final String sym = symbol(name);
    final String mac = macro(name);
    return header("Machine_" + name + ".h") + Code.includeFile("LLFSM_MACHINE_" + name + "_h",
        "#include <stdbool.h>", "",
        "#define MACHINE_" + mac + "_NUMBER_OF_STATES " + llfsm.stateCount(), "",
        "#undef IS_SUSPENDED", "#undef IS_SUSPENSIBLE",
        Code.either(isSuspensible,
            Code.block("#define IS_SUSPENSIBLE(m) (!!(m)->suspend_state)",
                "#define IS_SUSPENDED(m) ((m)->suspend_state == (m)->current_state)",
                "#define MACHINE_" + mac + "_IS_SUSPENSIBLE true"),
            Code.block("#define IS_SUSPENSIBLE(m) false", "#define IS_SUSPENDED(m)   false",
                "#define MACHINE_" + mac + "_IS_SUSPENSIBLE false")),
        "", "#pragma GCC diagnostic push",
        "#pragma GCC diagnostic ignored \"-Wunknown-pragmas\"", "",
        "#pragma clang diagnostic push", "#pragma clang diagnostic ignored \"-Wpadded\"", "",
        "struct LLFSMachine;", "struct LLFSMState;", "",
        "/// A " + name + " LLFSM.", "struct Machine_" + sym, "{",
        Code.indentedBlock("struct LLFSMState *current_state;",
            "struct LLFSMState *previous_state;", "unsigned long      state_time;",
            Code.when(isSuspensible, "struct LLFSMState *suspend_state;",
                "struct LLFSMState *resume_state;"),
            "struct LLFSMState * const states[MACHINE_" + mac + "_NUMBER_OF_STATES];"),
        "#   include \"Machine_" + name + "_Variables.h\"", "};", "",
        "/// Initialise a `Machine_" + sym + "` LLFSM.",
        "void fsm_" + sym + "_init(struct Machine_" + sym + " * const machine);", "",
        "/// Validate a `Machine_" + sym + "` LLFSM.",
        "bool fsm_" + sym + "_validate(struct Machine_" + sym + " * const machine);",
        Code.when(introspectable, "",
            "/// - Returns: the name of the given state, or `NULL` if it is not one of ours.",
            "const char *fsm_" + sym + "_state_name(const struct Machine_" + sym
                + " * const machine, const struct LLFSMState * const state);"),
        "", "#pragma clang diagnostic pop", "#pragma GCC diagnostic pop");
  }

  String machineCode(final LLFSM llfsm, final String name, final boolean isSuspensible) {
    final String sym = symbol(name);
    final String mac = macro(name);
    final List<State> states = states(llfsm);
    final int suspendIndex =
        llfsm.getSuspendState().isPresent() ? llfsm.stateIndex(llfsm.getSuspendState().get()) : -1;
    return header("Machine_" + name + ".c") + Code.block(
        "#include \"Machine_" + name + ".h\"",
        "#include \"Machine_" + name + "_Includes.h\"",
        Code.forEach(states, state -> "#include \"State_" + state.getName() + ".h\""), "",
        "#ifndef NULL", "#define NULL ((void*)0)", "#endif", "",
        Code.when(introspectable,
            "static const char * const fsm_" + sym + "_state_names[MACHINE_" + mac
                + "_NUMBER_OF_STATES] =",
            Code.bracedBlock(Code.enumerating(states, (i, state) -> "\"" + state.getName() + "\""
                + (i < states.size() - 1 ? "," : ""))) + ";",
            ""),
        "/// Initialise an instance of `Machine_" + sym + "`.",
        "void fsm_" + sym + "_init(struct Machine_" + sym + " * const machine)",
        Code.bracedBlock("machine->current_state = machine->states[0];",
            "machine->previous_state = NULL;", "machine->state_time = 0;",
            Code.when(isSuspensible,
                "machine->suspend_state = "
                    + (suspendIndex >= 0 ? "machine->states[" + suspendIndex + "];" : "NULL;"),
                "machine->resume_state = NULL;")),
        "",
        "/// Validate an instance of `Machine_" + sym + "`.",
        "///",
        "/// - Returns: `true` iff the machine and all its states appear valid.",
        "bool fsm_" + sym + "_validate(struct Machine_" + sym + " * const machine)",
        Code.bracedBlock("return machine->current_state != NULL"
            + (states.isEmpty() ? ";" : " &&"),
            Code.enumerating(states, (i, state) -> "    fsm_" + sym + "_" + symbol(state.getName())
                + "_validate(machine, (const struct FSM_" + sym + "_State_"
                + symbol(state.getName()) + " *) machine->states[" + i + "])"
                + (i < states.size() - 1 ? " &&" : ";"))),
        Code.when(introspectable, "",
            "const char *fsm_" + sym + "_state_name(const struct Machine_" + sym
                + " * const machine, const struct LLFSMState * const state)",
            Code.bracedBlock(
                "for (int i = 0; i < MACHINE_" + mac + "_NUMBER_OF_STATES; i++)",
                Code.bracedBlock("if (machine->states[i] == state) return fsm_" + sym
                    + "_state_names[i];"),
                "return NULL;")))
        + "\n";
  }

  String stateInterface(final State state, final LLFSM llfsm, final String name,
      final boolean isSuspensible) {
    final String sym = symbol(name);
    final String ssym = symbol(state.getName());
    final String struct = "struct FSM_" + sym + "_State_" + ssym;
    final String machineParameters =
        "(struct Machine_" + sym + " * const machine, " + struct + " * const state);";
    return header("State_" + state.getName() + ".h") + Code.includeFile(
        "LLFSM_" + name + "_" + state.getName() + "_h", "#include <stdbool.h>", "",
        "#define MACHINE_" + macro(name) + "_" + macro(state.getName())
            + "_NUMBER_OF_TRANSITIONS " + llfsm.transitionsFrom(state.getId()).size(),
        "", "struct LLFSMachine;", "struct LLFSMState;", "struct Machine_" + sym + ";", "",
        "/// The " + state.getName() + " state of the " + name + " LLFSM.", struct, "{",
        Code.indentedBlock(
            "struct LLFSMState *(*check_transitions)(const struct LLFSMachine *, const struct LLFSMState *);",
            "void (*on_entry)(struct LLFSMachine *, struct LLFSMState *);",
            "void (*on_exit) (struct LLFSMachine *, struct LLFSMState *);",
            "void (*internal)(struct LLFSMachine *, struct LLFSMState *);",
            Code.when(isSuspensible,
                "void (*on_suspend)(struct LLFSMachine *, struct LLFSMState *);",
                "void (*on_resume) (struct LLFSMachine *, struct LLFSMState *);")),
        "#   include \"State_" + state.getName() + "_Variables.h\"", "};", "",
        "void fsm_" + sym + "_" + ssym + "_init(" + struct + " * const state);",
        "bool fsm_" + sym + "_" + ssym + "_validate(const struct Machine_" + sym
            + " * const machine, const " + struct + " * const state);",
        "struct LLFSMState *fsm_" + sym + "_" + ssym + "_check_transitions(const struct Machine_"
            + sym + " * const machine, const " + struct + " * const state);",
        "void fsm_" + sym + "_" + ssym + "_on_entry" + machineParameters,
        "void fsm_" + sym + "_" + ssym + "_on_exit" + machineParameters,
        "void fsm_" + sym + "_" + ssym + "_internal" + machineParameters,
        Code.when(isSuspensible, "void fsm_" + sym + "_" + ssym + "_on_suspend" + machineParameters,
            "void fsm_" + sym + "_" + ssym + "_on_resume" + machineParameters));
  }

  String stateCode(final State state, final LLFSM llfsm, final String name,
      final boolean isSuspensible) {
    final String sym = symbol(name);
    final String ssym = symbol(state.getName());
    final String prefix = "fsm_" + sym + "_" + ssym;
    final String struct = "struct FSM_" + sym + "_State_" + ssym;
    final List<Transition> transitions = llfsm.transitionsFrom(state.getId());
    return header("State_" + state.getName() + ".c") + Code.block(
        "#include \"Machine_" + name + ".h\"", "#include \"State_" + state.getName() + ".h\"",
        "#include \"Machine_" + name + "_Includes.h\"",
        "#include \"State_" + state.getName() + "_Includes.h\"", "",
        "#ifndef NULL", "#define NULL ((void*)0)", "#endif", "",
        "#pragma clang diagnostic push",
        "#pragma clang diagnostic ignored \"-Wincompatible-function-pointer-types\"",
        "#pragma clang diagnostic ignored \"-Wunused-parameter\"", "",
        "void " + prefix + "_init(" + struct + " * const state)",
        Code.bracedBlock(
            "state->check_transitions = (struct LLFSMState *(*)(const struct LLFSMachine *, const struct LLFSMState *))"
                + prefix + "_check_transitions;",
            "state->on_entry = (" + actionSignature + ")" + prefix + "_on_entry;",
            "state->on_exit = (" + actionSignature + ")" + prefix + "_on_exit;",
            "state->internal = (" + actionSignature + ")" + prefix + "_internal;",
            Code.when(isSuspensible,
                "state->on_suspend = (" + actionSignature + ")" + prefix + "_on_suspend;",
                "state->on_resume = (" + actionSignature + ")" + prefix + "_on_resume;")),
        "",
        "bool " + prefix + "_validate(const struct Machine_" + sym + " * const machine, const "
            + struct + " * const state)",
        Code.bracedBlock("(void)machine;",
            "return state->on_entry == (" + actionSignature + ")" + prefix + "_on_entry &&",
            "       state->on_exit == (" + actionSignature + ")" + prefix + "_on_exit &&",
            "       state->internal == (" + actionSignature + ")" + prefix + "_internal"
                + (isSuspensible ? " &&" : ";"),
            Code.when(isSuspensible,
                "       state->on_suspend == (" + actionSignature + ")" + prefix
                    + "_on_suspend &&",
                "       state->on_resume == (" + actionSignature + ")" + prefix
                    + "_on_resume;")),
        "",
        action(prefix + "_on_entry", sym, struct, state.getName(), "OnEntry"), "",
        action(prefix + "_on_exit", sym, struct, state.getName(), "OnExit"), "",
        action(prefix + "_internal", sym, struct, state.getName(), "Internal"),
        Code.when(isSuspensible, "",
            action(prefix + "_on_suspend", sym, struct, state.getName(), "OnSuspend"), "",
            action(prefix + "_on_resume", sym, struct, state.getName(), "OnResume")),
        "",
        "/// Check the transitions of " + state.getName() + " in order; the first to fire wins.",
        "///",
        "/// - Returns: The state the machine transitions to (`NULL` if no transition fired).",
        "struct LLFSMState *" + prefix + "_check_transitions(const struct Machine_" + sym
            + " * const machine, const " + struct + " * const state)",
        Code.bracedBlock(
            Code.enumerating(transitions, (i, transition) -> Code.block("if (",
                "#   include \"" + transitionFile(state.getName(), i) + "\"",
                ") return machine->states[" + llfsm.stateIndex(transition.getTarget()) + "];")),
            "return NULL; // None of the transitions fired."),
        "", "#pragma clang diagnostic pop") + "\n";
  }

  private static String action(final String function, final String sym, final String struct,
      final String stateName, final String section) {
    return Code.block(
        "void " + function + "(struct Machine_" + sym + " * const machine, " + struct
            + " * const state)",
        "{", "#   include \"State_" + stateName + "_" + section + ".mm\"", "}");
  }

  @Override
  public void addArrangementInterface(final List<Instance> instances, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    directory.putText("Machine_Common.h", commonInterface(instances, isSuspensible));
    directory.putText("Arrangement_" + name + ".h", arrangementInterface(instances, name));
    directory.putText("Static_Arrangement_" + name + ".h",
        staticArrangementInterface(instances, name));
  }

  @Override
  public void addArrangementCode(final List<Instance> instances, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    directory.putText("Machine_Common.c", commonCode(isSuspensible));
    directory.putText("Arrangement_" + name + ".c", arrangementCode(instances, name));
    directory.putText("Static_Arrangement_" + name + ".c",
        staticArrangementCode(instances, name, isSuspensible));
    final String lname = symbol(name);
    directory.putText("static_main.c", header("static_main.c") + Code.block(
        "#include <stdio.h>", "#include \"Static_Arrangement_" + name + ".h\"", "",
        "int main(void)",
        Code.bracedBlock("arrangement_" + lname + "_init(&static_arrangement_" + lname + ");",
            "if (!arrangement_" + lname + "_validate(&static_arrangement_" + lname + "))",
            Code.bracedBlock("fprintf(stderr, \"Arrangement " + name + " is invalid.\\n\");",
                "return 1;"),
            "return 0;"))
        + "\n");
  }

  @Override
  public void addArrangementBuildFiles(final List<Instance> instances, final String name,
      final DirectoryNode directory, final boolean isSuspensible) {
    directory.putText("project.cmake", Code.block(
        "# Sources for the " + name + " LLFSM arrangement.", "set(" + name + "_ARRANGEMENT_SOURCES",
        "    Machine_Common.c", "    Arrangement_" + name + ".c",
        "    Static_Arrangement_" + name + ".c", "    static_main.c",
        Code.forEach(distinctTypes(instances), instance -> Code.block(
            "    " + instance.getTypeFile() + "/Machine_" + instance.typeName() + ".c",
            Code.forEach(states(instance.getMachine().getLlfsm()), state -> "    "
                + instance.getTypeFile() + "/State_" + state.getName() + ".c"))),
        ")", "") + "\n");
    directory.putText("CMakeLists.txt",
        Code.block(cmakePreamble(name + "_arrangement", "C", "CMAKE_C_STANDARD"),
            "add_executable(" + name + "_arrangement ${" + name + "_ARRANGEMENT_SOURCES})",
            "target_include_directories(" + name + "_arrangement PRIVATE",
            "  $<BUILD_INTERFACE:${CMAKE_CURRENT_SOURCE_DIR}>",
            Code.forEach(distinctTypes(instances),
                instance -> "  $<BUILD_INTERFACE:${CMAKE_CURRENT_SOURCE_DIR}/"
                    + instance.getTypeFile() + ">"),
            ")", "") + "\n");
  }

  String commonInterface(final List<Instance> instances, final boolean isSuspensible) {
    return header("Machine_Common.h") + Code.includeFile("LLFSM_ARRANGEMENT_COMMON_H",
        "#include <inttypes.h>", "#include <stdbool.h>", "",
        Code.either(isSuspensible, Code.block(
            "#ifndef IS_SUSPENSIBLE", "#define IS_SUSPENSIBLE(m) (!!(m)->suspend_state)", "#endif",
            "#ifndef IS_SUSPENDED",
            "#define IS_SUSPENDED(m) ((m)->suspend_state == (m)->current_state)", "#endif"),
            Code.block("#define IS_SUSPENSIBLE(m) false", "#define IS_SUSPENDED(m)   false")),
        "", "struct LLFSMState;", "", "/// A generic LLFSM.", "struct LLFSMachine",
        Code.bracedBlock("struct LLFSMState *current_state;",
            "struct LLFSMState *previous_state;", "uintptr_t          state_time;",
            Code.when(isSuspensible, "struct LLFSMState *suspend_state;",
                "struct LLFSMState *resume_state;"),
            "struct LLFSMState * const states[1];") + ";",
        "", "/// A generic LLFSM state.", "struct LLFSMState",
        Code.bracedBlock(
            "struct LLFSMState *(*check_transitions)(const struct LLFSMachine *, const struct LLFSMState *);",
            "void (*on_entry)(struct LLFSMachine *, struct LLFSMState *);",
            "void (*on_exit) (struct LLFSMachine *, struct LLFSMState *);",
            "void (*internal)(struct LLFSMachine *, struct LLFSMState *);",
            Code.when(isSuspensible,
                "void (*on_suspend)(struct LLFSMachine *, struct LLFSMState *);",
                "void (*on_resume) (struct LLFSMachine *, struct LLFSMState *);"))
            + ";",
        "", "/// A generic LLFSM arrangement.", "struct LLFSMArrangement",
        Code.bracedBlock("uintptr_t number_of_instances;",
            "struct LLFSMachine *machines[" + instances.size() + "];") + ";",
        "", "void fsm_arrangement_restart_all(struct LLFSMArrangement * const arrangement);",
        Code.when(isSuspensible,
            "void fsm_arrangement_suspend_all(struct LLFSMArrangement * const arrangement);",
            "void fsm_arrangement_resume_all(struct LLFSMArrangement * const arrangement);"));
  }

  String commonCode(final boolean isSuspensible) {
    return header("Machine_Common.c") + Code.block("#include \"Machine_Common.h\"", "",
        "void fsm_arrangement_restart_all(struct LLFSMArrangement * const arrangement)",
        Code.bracedBlock("for (uintptr_t i = 0; i < arrangement->number_of_instances; i++)",
            Code.bracedBlock("struct LLFSMachine * const machine = arrangement->machines[i];",
                "machine->previous_state = machine->current_state;",
                "machine->current_state = machine->states[0];")),
        Code.when(isSuspensible, "",
            "void fsm_arrangement_suspend_all(struct LLFSMArrangement * const arrangement)",
            Code.bracedBlock("for (uintptr_t i = 0; i < arrangement->number_of_instances; i++)",
                Code.bracedBlock("struct LLFSMachine * const machine = arrangement->machines[i];",
                    "if (!IS_SUSPENSIBLE(machine) || IS_SUSPENDED(machine)) continue;",
                    "machine->resume_state = machine->current_state;",
                    "machine->previous_state = machine->current_state;",
                    "machine->current_state = machine->suspend_state;")),
            "",
            "void fsm_arrangement_resume_all(struct LLFSMArrangement * const arrangement)",
            Code.bracedBlock("for (uintptr_t i = 0; i < arrangement->number_of_instances; i++)",
                Code.bracedBlock("struct LLFSMachine * const machine = arrangement->machines[i];",
                    "if (!IS_SUSPENDED(machine)) continue;",
                    "machine->previous_state = machine->suspend_state;",
                    "machine->current_state = machine->resume_state ? machine->resume_state : machine->states[0];"))))
        + "\n";
  }

  String arrangementInterface(final List<Instance> instances, final String name) {
    final String sym = symbol(name);
    final String mac = macro(name);
    return header("Arrangement_" + name + ".h") + Code.includeFile(
        "LLFSM_ARRANGEMENT_" + mac + "_H", "#include <inttypes.h>", "#include <stdbool.h>", "",
        "#define ARRANGEMENT_" + mac + "_NUMBER_OF_INSTANCES " + instances.size(), "",
        "struct LLFSMachine;",
        Code.forEach(distinctTypes(instances),
            instance -> "struct Machine_" + symbol(instance.typeName()) + ";"),
        "", "/// The " + name + " LLFSM arrangement.", "struct Arrangement_" + sym,
        Code.bracedBlock("uintptr_t number_of_instances;", "union",
            Code.bracedBlock(
                "struct LLFSMachine *machines[ARRANGEMENT_" + mac + "_NUMBER_OF_INSTANCES];",
                "struct",
                Code.bracedBlock(Code.forEach(instances,
                    instance -> "struct Machine_" + symbol(instance.typeName()) + " *fsm_"
                        + symbol(instance.getName()) + ";"))
                    + ";")
                + ";")
            + ";",
        "",
        "void arrangement_" + sym + "_init(struct Arrangement_" + sym + " * const arrangement);",
        "bool arrangement_" + sym + "_validate(struct Arrangement_" + sym
            + " * const arrangement);");
  }

  String arrangementCode(final List<Instance> instances, final String name) {
    final String sym = symbol(name);
    final String mac = macro(name);
    return header("Arrangement_" + name + ".c") + Code.block("#include \"Machine_Common.h\"",
        "#include \"Arrangement_" + name + ".h\"",
        Code.forEach(distinctTypes(instances), instance -> "#include \""
            + instance.getTypeFile() + "/Machine_" + instance.typeName() + ".h\""),
        "",
        "/// Initialise every instance of the " + name + " arrangement.",
        "void arrangement_" + sym + "_init(struct Arrangement_" + sym + " * const arrangement)",
        Code.bracedBlock(
            "arrangement->number_of_instances = ARRANGEMENT_" + mac + "_NUMBER_OF_INSTANCES;",
            Code.forEach(instances, instance -> "fsm_" + symbol(instance.typeName())
                + "_init(arrangement->fsm_" + symbol(instance.getName()) + ");")),
        "",
        "/// Validate every instance of the " + name + " arrangement.",
        "bool arrangement_" + sym + "_validate(struct Arrangement_" + sym
            + " * const arrangement)",
        Code.bracedBlock("return arrangement->number_of_instances == ARRANGEMENT_" + mac
            + "_NUMBER_OF_INSTANCES" + (instances.isEmpty() ? ";" : " &&"),
            Code.enumerating(instances, (i, instance) -> "    fsm_"
                + symbol(instance.typeName()) + "_validate(arrangement->fsm_"
                + symbol(instance.getName()) + ")" + (i < instances.size() - 1 ? " &&" : ";"))))
        + "\n";
  }

  String staticArrangementInterface(final List<Instance> instances, final String name) {
    final String sym = symbol(name);
    return header("Static_Arrangement_" + name + ".h") + Code.includeFile(
        "LLFSM_STATIC_ARRANGEMENT_" + macro(name) + "_H", "#include \"Machine_Common.h\"",
        "#include \"Arrangement_" + name + ".h\"",
        Code.forEach(distinctTypes(instances), instance -> "#include \""
            + instance.getTypeFile() + "/Machine_" + instance.typeName() + ".h\""),
        "",
        Code.forEach(instances, instance -> Code.block(
            "/// Static instantiation of " + instance.getName() + " (" + instance.typeName()
                + ").",
            "extern struct Machine_" + symbol(instance.typeName()) + " static_fsm_"
                + symbol(instance.getName()) + ";")),
        "", "/// Static instantiation of the " + name + " arrangement.",
        "extern struct Arrangement_" + sym + " static_arrangement_" + sym + ";");
  }

  String staticArrangementCode(final List<Instance> instances, final String name,
      final boolean isSuspensible) {
    final String sym = symbol(name);
    return header("Static_Arrangement_" + name + ".c") + Code.block(
        "#include \"Static_Arrangement_" + name + ".h\"",
        Code.forEach(distinctTypes(instances), instance -> Code.forEach(
            states(instance.getMachine().getLlfsm()), state -> "#include \""
                + instance.getTypeFile() + "/State_" + state.getName() + ".h\"")),
        "", "#ifndef NULL", "#define NULL ((void*)0)", "#endif", "",
        Code.forEach(instances, instance -> staticInstance(instance, isSuspensible)),
        "struct Arrangement_" + sym + " static_arrangement_" + sym + " =",
        Code.bracedBlock(
            ".number_of_instances = ARRANGEMENT_" + macro(name) + "_NUMBER_OF_INSTANCES,",
            Code.bracedBlock(Code.enumerating(instances,
                (i, instance) -> ".fsm_" + symbol(instance.getName()) + " = &static_fsm_"
                    + symbol(instance.getName()) + (i < instances.size() - 1 ? "," : ""))))
            + ";")
        + "\n";
  }

  private String staticInstance(final Instance instance, final boolean isSuspensible) {
    final LLFSM llfsm = instance.getMachine().getLlfsm();
    final String tsym = symbol(instance.typeName());
    final String isym = symbol(instance.getName());
    final List<State> states = states(llfsm);
    final String suspendName = llfsm.getSuspendState().isPresent()
        ? symbol(llfsm.stateName(llfsm.getSuspendState().get())) : null;
    return Code.block(
        Code.forEach(states, state -> {
          final String prefix = "fsm_" + tsym + "_" + symbol(state.getName());
          return Code.block("struct FSM_" + tsym + "_State_" + symbol(state.getName())
              + " static_" + isym + "_state_" + symbol(state.getName()) + " =",
              Code.bracedBlock(
                  ".check_transitions = (struct LLFSMState *(*)(const struct LLFSMachine *, const struct LLFSMState *)) "
                      + prefix + "_check_transitions,",
                  ".on_entry = (" + actionSignature + ") " + prefix + "_on_entry,",
                  ".on_exit = (" + actionSignature + ") " + prefix + "_on_exit,",
                  ".internal = (" + actionSignature + ") " + prefix + "_internal"
                      + (isSuspensible ? "," : ""),
                  Code.when(isSuspensible,
                      ".on_suspend = (" + actionSignature + ") " + prefix + "_on_suspend,",
                      ".on_resume = (" + actionSignature + ") " + prefix + "_on_resume"))
                  + ";",
              "");
        }),
        "struct Machine_" + tsym + " static_fsm_" + isym + " =",
        Code.bracedBlock(
            Code.when(!states.isEmpty(), ".current_state = (struct LLFSMState *) &static_" + isym
                + "_state_" + (states.isEmpty() ? "" : symbol(states.get(0).getName())) + ","),
            Code.when(isSuspensible && suspendName != null,
                ".suspend_state = (struct LLFSMState *) &static_" + isym + "_state_"
                    + suspendName + ","),
            ".states =",
            Code.bracedBlock(Code.enumerating(states,
                (i, state) -> "(struct LLFSMState *) &static_" + isym + "_state_"
                    + symbol(state.getName()) + (i < states.size() - 1 ? "," : ""))))
            + ";",
        "");
  }

  @Override
  public String toString() {
    return "CBinding [introspectable=" + introspectable + "]";
  }

}
