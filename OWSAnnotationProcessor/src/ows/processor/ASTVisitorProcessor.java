package ows.processor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing for classes annotated with {@link ASTNode}.
 *
 * <p>For every node class {@code Outer.Inner} an interface {@code Outer_Inner_ASTNode} is written,
 * declaring each {@link ASTChild} accessor and implementing {@code accept} / {@code visitChildren}.
 * Once all rounds are over, {@code ASTVisitor}, {@code DefaultASTVisitor} and {@code
 * VoidDefaultASTVisitor} are written with one method per node class, so a visitor that implements
 * {@code ASTVisitor} directly fails to compile until it handles every node kind.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {
  private static final TypeVariableName V = TypeVariableName.get("V");
  private static final TypeName VOID = ClassName.get(Void.class);

  // Keyed by qualified name, so the generated visitors list nodes in a stable order.
  private final Map<String, ClassName> nodeClasses = new TreeMap<>();
  private String packageName = null;

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        if (packageName != null) writeVisitors();
      } else {
        for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
          processNode((TypeElement) element);
        }
      }
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return true;
  }

  private void processNode(TypeElement element) throws IOException {
    String elementPackage =
        processingEnv.getElementUtils().getPackageOf(element).getQualifiedName().toString();
    if (packageName == null) {
      packageName = elementPackage;
    } else if (!packageName.equals(elementPackage)) {
      error(
          element,
          "All @ASTNode classes must share one package; found %s and %s",
          packageName,
          elementPackage);
      return;
    }

    ClassName nodeClass = ClassName.get(element);
    nodeClasses.put(nodeClass.canonicalName(), nodeClass);
    writeNodeInterface(element, nodeClass);
  }

  private static String interfaceName(ClassName nodeClass) {
    return Joiner.on('_').join(nodeClass.simpleNames()) + "_ASTNode";
  }

  private ClassName local(String simpleName) {
    return ClassName.get(packageName, simpleName);
  }

  private static MethodSpec.Builder visitorMethod(String name, TypeName visitor, TypeName result) {
    return MethodSpec.methodBuilder(name)
        .addAnnotation(Override.class)
        .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
        .addTypeVariable(V)
        .returns(result)
        .addParameter(visitor, "visitor")
        .addParameter(V, "value");
  }

  private void writeNodeInterface(TypeElement element, ClassName nodeClass) throws IOException {
    String name = interfaceName(nodeClass);
    boolean declared =
        element.getInterfaces().stream().anyMatch(i -> TypeName.get(i).toString().endsWith(name));
    if (!declared) {
      error(element, "Missing interface: %s", name);
      return;
    }

    TypeName visitor = ParameterizedTypeName.get(local("ASTVisitor"), V);
    MethodSpec.Builder visitChildren = visitorMethod("visitChildren", visitor, V);
    TypeSpec.Builder type =
        TypeSpec.interfaceBuilder(name)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(local("ASTNodeInterface"))
            .addMethod(
                visitorMethod("accept", visitor, V)
                    .addStatement("return visitor.visit(($T) this, value)", nodeClass)
                    .build());

    for (Element member : element.getEnclosedElements()) {
      if (member.getKind() != ElementKind.METHOD) continue;
      if (member.getAnnotation(ASTChild.class) == null) continue;
      if (member.getAnnotation(Override.class) == null) {
        error(member, "Missing @Override");
      }

      ExecutableElement child = (ExecutableElement) member;
      String accessor = child.getSimpleName().toString();
      type.addMethod(
          MethodSpec.methodBuilder(accessor)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(child.getReturnType()))
              .build());
      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)", local("ASTNodeUtils"), accessor);
    }
    type.addMethod(visitChildren.addStatement("return value").build());

    write(type.build());
  }

  private void writeVisitors() throws IOException {
    ClassName visitor = local("ASTVisitor");
    ClassName defaultVisitor = local("DefaultASTVisitor");

    TypeSpec.Builder visitorType = TypeSpec.interfaceBuilder(visitor).addTypeVariable(V);
    TypeSpec.Builder defaultType =
        TypeSpec.classBuilder(defaultVisitor)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(visitor, V));
    TypeSpec.Builder voidType =
        TypeSpec.classBuilder(local("VoidDefaultASTVisitor"))
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(defaultVisitor, VOID));

    for (ClassName node : nodeClasses.values()) {
      visitorType.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .build());
      defaultType.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
      // Void visitors override visitImpl and never see the threaded value.
      voidType.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(VOID)
              .addParameter(node, "node")
              .addParameter(VOID, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      voidType.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(node, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }

    write(visitorType.build());
    write(defaultType.build());
    write(voidType.build());
  }

  private void write(TypeSpec type) throws IOException {
    JavaFile.builder(packageName, type).build().writeTo(processingEnv.getFiler());
  }

  private void error(Element element, String format, Object... args) {
    processingEnv.getMessager().printMessage(Kind.ERROR, String.format(format, args), element);
  }
}
