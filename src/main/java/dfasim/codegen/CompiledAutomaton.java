package dfasim.codegen;

import dfasim.Automaton;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Automaton compiled into JVM bytecode.
 *
 * <p>Compilation generates a fresh hidden class implementing {@link Acceptor}
 * where states are blocks and transitions are {@code GOTO}s. Compared to
 * {@link dfasim.Simulator} this answers only whether an input is accepted (no
 * trace), but does so without any map lookups or boxing. Acceptance, early
 * stops and unknown symbols behave exactly like the interpreter.
 *
 * <p>Very large automata may not compile, since a method body is limited to
 * 64KB of bytecode.
 */
public final class CompiledAutomaton implements Acceptor {

  private static final Logger log = LoggerFactory.getLogger(CompiledAutomaton.class);

  private static final String CLASS_NAME = "dfasim/codegen/CompiledAutomaton$Generated";

  private final Automaton automaton;
  private final Acceptor acceptor;

  private CompiledAutomaton(Automaton automaton, Acceptor acceptor) {
    this.automaton = automaton;
    this.acceptor = acceptor;
  }

  /**
   * Compile an automaton.
   *
   * @param automaton automaton to compile
   * @return compiled acceptor
   */
  public static CompiledAutomaton compile(Automaton automaton) {
    final int classFlags = Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC;
    final byte[] classBytes = generateAcceptorClass(automaton, CLASS_NAME, classFlags).toByteArray();
    log.debug("Generated {} bytes of bytecode for {}", classBytes.length, automaton);

    try {
      // Load the class and get a handle on the constructor
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      final MethodHandle constructor = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );
      return new CompiledAutomaton(automaton, (Acceptor) constructor.invoke());
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to load compiled automaton", error);
    }
  }

  /**
   * Code generator for an acceptor class.
   *
   * @param automaton automaton to compile
   * @param className internal name of the class to generate
   * @param classFlags class flags to set (visibility, `final`, `synthetic` etc.)
   * @return class implementing {@code Acceptor}
   */
  static ClassWriter generateAcceptorClass(
    Automaton automaton,
    String className,
    int classFlags
  ) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V17,
      Opcodes.ACC_SUPER | classFlags,
      className,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.ACCEPTOR_CLASS_NAME }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `accepts` method
    {
      final var mv = Method.ACCEPTS_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new AcceptorMethodCodegen(mv, automaton).visitAcceptor();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }

  public Automaton automaton() {
    return automaton;
  }

  @Override
  public boolean accepts(CharSequence input) {
    return acceptor.accepts(input);
  }

  @Override
  public String toString() {
    return "CompiledAutomaton(" + automaton + ")";
  }
}
