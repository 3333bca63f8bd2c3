package ows;

import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** Checks an instruction's arguments against its signature before the call is assembled. */
final class InstructionValidator {
  private final Vocabulary vocabulary;

  InstructionValidator(Vocabulary vocabulary) {
    this.vocabulary = vocabulary;
  }

  InstructionSignature validate(Node.Instruction instruction, ImmutableList<String> renderedArgs)
      throws CompilerException {
    Optional<InstructionSignature> found = vocabulary.instruction(instruction.name());
    if (!found.isPresent()) {
      throw new CompilerException(
          CompilerException.Kind.NAME_RESOLUTION,
          instruction.pos(),
          String.format("unknown instruction '%s'", Names.title(instruction.name())));
    }

    InstructionSignature signature = found.get();
    ImmutableList<InstructionSignature.ParameterType> params = signature.parameters();
    if (params.size() != renderedArgs.size()) {
      throw new CompilerException(
          CompilerException.Kind.STRUCTURAL,
          instruction.pos(),
          String.format(
              "'%s' expected %d arguments (%s), received %d",
              signature.name(),
              params.size(),
              Joiner.on(", ").join(params),
              renderedArgs.size()));
    }

    for (int i = 0; i < params.size(); i++) {
      if (!params.get(i).accepts(renderedArgs.get(i))) {
        Node arg = instruction.args().get(i);
        throw new CompilerException(
            CompilerException.Kind.PARAMETER_TYPE,
            arg.pos(),
            String.format(
                "'%s' expected type %s for argument %d, received %s",
                signature.name(),
                params.get(i),
                i + 1,
                arg.type().displayName()));
      }
    }
    return signature;
  }
}
