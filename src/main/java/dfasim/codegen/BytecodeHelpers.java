package dfasim.codegen;

import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Superclass containing utility methods for emitting bytecode.
 *
 * <p>Method bodies are limited in length by the fact the code array must have
 * length fitting in an unsigned 16-bit number, so these helpers prefer the
 * shortest instruction sequence with the right behaviour.
 */
class BytecodeHelpers {

  /**
   * Method visitor into which code will be emitted.
   */
  protected final MethodVisitor mv;

  public BytecodeHelpers(MethodVisitor mv) {
    this.mv = mv;
  }

  /**
   * Branch on the {@code int} at the top of the stack.
   *
   * <p>Equivalent to {@code mv.visitLookupSwitchInsn(dflt, values, labels)},
   * but uses a comparison for single values and a {@code tableswitch} when the
   * values are contiguous.
   *
   * @param dflt label to jump to if nothing else matches
   * @param values test values in the switch (sorted in ascending order)
   * @param labels labels to jump to if the scrutinee is in the test values
   */
  protected void visitLookupBranch(
    Label dflt,
    int[] values,
    Label[] labels
  ) {
    if (values.length == 0) {
      mv.visitInsn(Opcodes.POP);
      mv.visitJumpInsn(Opcodes.GOTO, dflt);
    } else if (values.length == 1) {
      visitConstantInt(values[0]);
      mv.visitJumpInsn(Opcodes.IF_ICMPEQ, labels[0]);
      mv.visitJumpInsn(Opcodes.GOTO, dflt);
    } else if (values[values.length - 1] - values[0] == values.length - 1) {
      mv.visitTableSwitchInsn(values[0], values[values.length - 1], dflt, labels);
    } else {
      mv.visitLookupSwitchInsn(dflt, values, labels);
    }
  }

  /**
   * Push an integer constant onto the stack.
   *
   * @param constant integer constant
   */
  protected void visitConstantInt(int constant) {
    if (-1 <= constant && constant <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + constant);
    } else if (Byte.MIN_VALUE <= constant && constant <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, constant);
    } else if (Short.MIN_VALUE <= constant && constant <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, constant);
    } else {
      mv.visitLdcInsn(constant);
    }
  }
}
