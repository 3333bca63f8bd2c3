package ows;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Compiles a script into Workshop rule text.
 *
 * <p>A Compiler is single use: it owns the scope tree and the slot counters of one compilation.
 */
public class Compiler {
  private static final Logger LOG = Logger.getLogger(Compiler.class.getName());

  private final Node.Script script;
  private final Vocabulary vocabulary;
  private final CompilerOptions options;
  private final SlotAllocator slots = new SlotAllocator();

  private boolean compiled = false;

  public Compiler(Node.Script script, Vocabulary vocabulary) {
    this(script, vocabulary, CompilerOptions.defaults());
  }

  public Compiler(Node.Script script, Vocabulary vocabulary, CompilerOptions options) {
    this.script = script;
    this.vocabulary = vocabulary;
    this.options = options;
  }

  // The root scope every rule is lowered in; it starts out with the builtins only.
  static Scope globalScope() {
    Scope scope = Scope.root("global");
    Builtin.registerAll(scope);
    return scope;
  }

  public SlotAllocator slots() {
    return slots;
  }

  /** @throws CompilerException the first error found; nothing is emitted on failure */
  public String compile() throws CompilerException {
    Preconditions.checkState(!compiled, "already compiled");
    compiled = true;

    ImmutableList<CompilerException> errors = new ASTValidator(script).computeErrors();
    if (!errors.isEmpty()) throw errors.get(0);

    Scope global = globalScope();
    Lowering lowering = new Lowering(slots, vocabulary, options);
    StringBuilder document = new StringBuilder();
    if (!options.preamble().isEmpty()) {
      document.append(options.preamble()).append('\n');
    }
    for (Node child : script.children()) {
      switch (child.type()) {
        case FUNCTION:
          {
            Node.Function function = child.cast();
            global.bind(Symbol.global(function.name()), Variable.function(function));
            break;
          }
        case RULE:
          document.append(compileRule(child.cast(), global, lowering));
          break;
        default:
          throw new AssertionError("Unexpected top-level node: " + child.type());
      }
    }

    LOG.fine(
        () ->
            String.format(
                "compiled %d top-level nodes using %d global and %d player slots",
                script.children().size(),
                slots.count(Symbol.Domain.GLOBAL),
                slots.count(Symbol.Domain.ENTITY)));
    return CharMatcher.is('\n').trimTrailingFrom(document);
  }

  // Rules share the global scope: a variable stored by one rule is the same slot in all of them.
  private String compileRule(Node.Rule rule, Scope global, Lowering lowering)
      throws CompilerException {
    String name = ruleName(rule, global, lowering);
    List<String> ruleblocks = new ArrayList<>();
    for (Node.Ruleblock ruleblock : rule.ruleblocks()) {
      ruleblocks.add(compileRuleblock(rule, ruleblock, global, lowering));
    }

    StringBuilder sb = new StringBuilder();
    if (rule.disabled()) sb.append("disabled ");
    sb.append("rule(\"").append(name).append("\") {\n");
    Joiner.on('\n').appendTo(sb, ruleblocks);
    return sb.append("}\n").toString();
  }

  private static String ruleName(Node.Rule rule, Scope global, Lowering lowering)
      throws CompilerException {
    ImmutableList<String> text = rule.nameText();
    StringBuilder sb = new StringBuilder(text.get(0));
    for (int i = 0; i < rule.nameArgs().size(); i++) {
      sb.append(lowering.render(rule.nameArgs().get(i), global)).append(text.get(i + 1));
    }
    return sb.toString();
  }

  private String compileRuleblock(
      Node.Rule rule, Node.Ruleblock ruleblock, Scope scope, Lowering lowering)
      throws CompilerException {
    ImmutableList<String> lines = lowering.lowerRuleblock(ruleblock, scope).resolve();
    LOG.fine(
        () ->
            String.format(
                "rule '%s' %s: %d lines", rule.name(), ruleblock.name(), lines.size()));

    String indent = Strings.repeat(" ", options.indentSize());
    String suffix = ruleblock.isConditions() ? " == True;\n" : ";\n";
    StringBuilder sb = new StringBuilder(ruleblock.name()).append(" {\n");
    for (String line : lines) {
      if (line.isEmpty()) continue;
      sb.append(indent).append(line).append(suffix);
    }
    return sb.append("}\n").toString();
  }
}
