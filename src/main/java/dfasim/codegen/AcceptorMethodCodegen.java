package dfasim.codegen;

import dfasim.Automaton;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Generates the body of {@link Acceptor#accepts(CharSequence)}.
 *
 * <p>This uses the natural mapping of a DFA into the control-flow graph of the
 * bytecode method: states are represented by blocks with transitions encoded
 * as jumps to other blocks. Each block bumps the offset, returns if the input
 * is exhausted, and otherwise switches on the next character.
 *
 * <p>Characters with no transition out of a state fall through to a shared
 * block which decides between a rejection (the character is in the alphabet)
 * and an {@code UnknownSymbolException}.
 */
class AcceptorMethodCodegen extends BytecodeHelpers {

  /**
   * Automaton for which code is generated.
   */
  private final Automaton automaton;

  /**
   * Offset for argument of type {@code CharSequence}, corresponding to the
   * input string.
   */
  private final int inputLocal;

  /**
   * Offset for a local of type {@code int} tracking the offset of the
   * character last read.
   */
  private final int offsetLocal;

  /**
   * Offset for a local of type {@code int} holding the input length.
   */
  private final int lengthLocal;

  /**
   * Offset for a local of type {@code char} holding the character last read.
   */
  private final int charTempLocal;

  /**
   * Labels associated with automaton states.
   *
   * <p>Going to a new state is as simple as jumping to its label. This map is
   * unmodifiable.
   */
  private final Map<String, Label> stateLabels;

  private final Label returnSuccess = new Label();
  private final Label returnFailure = new Label();
  private final Label missingTransition = new Label();
  private final Label unknownSymbol = new Label();

  public AcceptorMethodCodegen(MethodVisitor mv, Automaton automaton) {
    super(mv);
    this.automaton = automaton;

    // Local 0 is `this`
    int nextLocal = 1;
    this.inputLocal = nextLocal++;
    this.offsetLocal = nextLocal++;
    this.lengthLocal = nextLocal++;
    this.charTempLocal = nextLocal++;

    final var labels = new LinkedHashMap<String, Label>();
    for (String state : automaton.states()) {
      labels.put(state, new Label());
    }
    this.stateLabels = Collections.unmodifiableMap(labels);
  }

  public void visitAcceptor() {
    initializeLocals();

    // Jump to the first state
    mv.visitJumpInsn(Opcodes.GOTO, stateLabels.get(automaton.start()));

    // Lay out the blocks for each state
    for (Map.Entry<String, Label> entry : stateLabels.entrySet()) {
      mv.visitLabel(entry.getValue());
      visitState(entry.getKey());
    }

    visitMissingTransition();

    // Unknown symbol: throw new UnknownSymbolException(char, offset)
    mv.visitLabel(unknownSymbol);
    mv.visitTypeInsn(Opcodes.NEW, Method.UNKNOWNSYMBOL_CLASS_NAME);
    mv.visitInsn(Opcodes.DUP);
    mv.visitVarInsn(Opcodes.ILOAD, charTempLocal);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    Method.UNKNOWNSYMBOLINIT_M.invokeMethod(mv, Method.UNKNOWNSYMBOL_CLASS_NAME);
    mv.visitInsn(Opcodes.ATHROW);

    mv.visitLabel(returnFailure);
    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);

    mv.visitLabel(returnSuccess);
    mv.visitInsn(Opcodes.ICONST_1);
    mv.visitInsn(Opcodes.IRETURN);
  }

  // Locals must all be set before the first jump so that frames agree
  private void initializeLocals() {
    mv.visitInsn(Opcodes.ICONST_M1);
    mv.visitVarInsn(Opcodes.ISTORE, offsetLocal);

    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    Method.LENGTH_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
    mv.visitVarInsn(Opcodes.ISTORE, lengthLocal);

    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitVarInsn(Opcodes.ISTORE, charTempLocal);
  }

  private void visitState(String state) {

    // The sink ends the run without reading anything more
    if (automaton.sink().filter(state::equals).isPresent()) {
      mv.visitJumpInsn(Opcodes.GOTO, returnFailure);
      return;
    }

    // increment the offset and, if it reaches length, return whether we are in an accepting state
    mv.visitIincInsn(offsetLocal, 1);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    mv.visitVarInsn(Opcodes.ILOAD, lengthLocal);
    final Label inputDone = automaton.accept().contains(state) ? returnSuccess : returnFailure;
    mv.visitJumpInsn(Opcodes.IF_ICMPGE, inputDone);

    // get the next character
    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    Method.CHARAT_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
    mv.visitInsn(Opcodes.DUP);
    mv.visitVarInsn(Opcodes.ISTORE, charTempLocal);

    final SortedMap<Character, String> targets = new TreeMap<>(automaton.transitionsMap(state));
    final int[] values = new int[targets.size()];
    final Label[] labels = new Label[targets.size()];
    int i = 0;
    for (Map.Entry<Character, String> target : targets.entrySet()) {
      values[i] = target.getKey();
      labels[i] = stateLabels.get(target.getValue());
      i++;
    }
    visitLookupBranch(missingTransition, values, labels);
  }

  // A character with no transition: in the alphabet it rejects, otherwise it is an error
  private void visitMissingTransition() {
    mv.visitLabel(missingTransition);
    mv.visitVarInsn(Opcodes.ILOAD, charTempLocal);

    final int[] values = automaton
      .alphabet()
      .stream()
      .mapToInt(c -> c.charValue())
      .toArray();
    final Label[] labels = new Label[values.length];
    Arrays.fill(labels, returnFailure);
    visitLookupBranch(unknownSymbol, values, labels);
  }
}
