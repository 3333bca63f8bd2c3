package ows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import com.google.common.io.Resources;

/**
 * A {@link Vocabulary} read from a line-based table.
 *
 * <pre>
 * # comment
 * values ROUNDING: UP | DOWN | TO NEAREST
 * instruction Round To Integer: ANY, ROUNDING
 * instruction Event Player
 * attributes Event Player | Attacker: position = Position Of({}); health = Health({})
 * </pre>
 *
 * A {@code values} line must precede the instructions that use its type. Attribute owners are
 * instruction names or node kinds such as {@code VECTOR} and {@code ARRAY}.
 */
public final class WorkshopVocabulary implements Vocabulary {
  private static final Logger LOG = Logger.getLogger(WorkshopVocabulary.class.getName());

  private static final String RESOURCE = "workshop.vocab";

  private static final Splitter LINES = Splitter.on('\n');
  private static final Splitter PARAMS = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter ALTERNATIVES = Splitter.on('|').trimResults().omitEmptyStrings();
  private static final Splitter TEMPLATES = Splitter.on(';').trimResults().omitEmptyStrings();

  private final ImmutableMap<String, InstructionSignature> instructions;
  private final ImmutableTable<String, String, String> attributes;

  private WorkshopVocabulary(
      ImmutableMap<String, InstructionSignature> instructions,
      ImmutableTable<String, String, String> attributes) {
    this.instructions = instructions;
    this.attributes = attributes;
  }

  /** The default table bundled with the compiler. */
  public static WorkshopVocabulary load() throws IOException {
    String text =
        Resources.toString(
            Resources.getResource(WorkshopVocabulary.class, RESOURCE), StandardCharsets.UTF_8);
    WorkshopVocabulary vocabulary = parse(text);
    LOG.fine(
        () ->
            String.format(
                "loaded %d instructions, %d attribute templates from %s",
                vocabulary.instructions.size(), vocabulary.attributes.size(), RESOURCE));
    return vocabulary;
  }

  /** @throws IllegalArgumentException naming the offending line */
  public static WorkshopVocabulary parse(String text) {
    Parser parser = new Parser();
    int lineNumber = 0;
    for (String raw : LINES.split(text)) {
      lineNumber++;
      String line = raw.trim();
      if (line.isEmpty() || line.startsWith("#")) continue;
      try {
        parser.parseLine(line);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(
            String.format("line %d: %s", lineNumber, ex.getMessage()), ex);
      }
    }
    return new WorkshopVocabulary(
        ImmutableMap.copyOf(parser.instructions), ImmutableTable.copyOf(parser.attributes));
  }

  @Override
  public Optional<InstructionSignature> instruction(String name) {
    return Optional.ofNullable(instructions.get(key(name)));
  }

  @Override
  public Optional<String> attributeTemplate(String ownerKey, String attribute) {
    return Optional.ofNullable(attributes.get(key(ownerKey), attribute.toLowerCase()));
  }

  private static String key(String name) {
    return name.trim().toUpperCase();
  }

  private static final class Parser {
    private final Map<String, InstructionSignature.ParameterType> types = new HashMap<>();
    private final Map<String, InstructionSignature> instructions = new LinkedHashMap<>();
    private final Table<String, String, String> attributes = HashBasedTable.create();

    Parser() {
      InstructionSignature.ParameterType any = InstructionSignature.ParameterType.any();
      types.put(any.name(), any);
    }

    void parseLine(String line) {
      int space = line.indexOf(' ');
      Preconditions.checkArgument(space > 0, "expected a directive: %s", line);
      String directive = line.substring(0, space);
      String body = line.substring(space + 1).trim();
      switch (directive) {
        case "values":
          parseValues(body);
          break;
        case "instruction":
          parseInstruction(body);
          break;
        case "attributes":
          parseAttributes(body);
          break;
        default:
          throw new IllegalArgumentException("unknown directive '" + directive + "'");
      }
    }

    private void parseValues(String body) {
      List<String> parts = splitHeader(body);
      Preconditions.checkArgument(parts.size() == 2, "expected 'values NAME: A | B'");
      String name = key(parts.get(0));
      Preconditions.checkArgument(!types.containsKey(name), "type %s defined twice", name);
      ImmutableList.Builder<String> values = ImmutableList.builder();
      for (String value : ALTERNATIVES.split(parts.get(1))) {
        values.add(key(value));
      }
      types.put(name, InstructionSignature.ParameterType.of(name, values.build()));
    }

    private void parseInstruction(String body) {
      List<String> parts = splitHeader(body);
      String name = parts.get(0).trim();
      ImmutableList.Builder<InstructionSignature.ParameterType> params = ImmutableList.builder();
      if (parts.size() == 2) {
        for (String param : PARAMS.split(parts.get(1))) {
          InstructionSignature.ParameterType type = types.get(key(param));
          Preconditions.checkArgument(type != null, "unknown parameter type '%s'", param);
          params.add(type);
        }
      }
      Preconditions.checkArgument(
          instructions.put(key(name), InstructionSignature.create(name, params.build())) == null,
          "instruction '%s' defined twice",
          name);
    }

    private void parseAttributes(String body) {
      List<String> parts = splitHeader(body);
      Preconditions.checkArgument(
          parts.size() == 2, "expected 'attributes OWNER: name = Template'");
      for (String template : TEMPLATES.split(parts.get(1))) {
        int equals = template.indexOf('=');
        Preconditions.checkArgument(equals > 0, "expected 'name = Template': %s", template);
        String attribute = template.substring(0, equals).trim().toLowerCase();
        String format = template.substring(equals + 1).trim();
        Preconditions.checkArgument(
            format.contains("{}"), "template for '%s' has no {} placeholder", attribute);
        for (String owner : ALTERNATIVES.split(parts.get(0))) {
          attributes.put(key(owner), attribute, format);
        }
      }
    }

    // "head: tail" -> [head, tail]; "head" -> [head]
    private static List<String> splitHeader(String body) {
      int colon = body.indexOf(':');
      if (colon < 0) return ImmutableList.of(body);
      return ImmutableList.of(body.substring(0, colon).trim(), body.substring(colon + 1).trim());
    }
  }
}
