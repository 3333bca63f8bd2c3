package ows;

import java.util.Optional;

/** The target's instruction signatures and attribute templates. Names match case-insensitively. */
public interface Vocabulary {
  Optional<InstructionSignature> instruction(String name);

  // A template with one "{}" for the rendered owner, such as "Position Of({})".
  Optional<String> attributeTemplate(String ownerKey, String attribute);
}
