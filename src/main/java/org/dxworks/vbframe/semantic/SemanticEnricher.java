package org.dxworks.vbframe.semantic;

import org.dxworks.vbframe.ModuleKind;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.DiagnosticCodes;
import org.dxworks.vbframe.diagnostics.DiagnosticsCollector;
import org.dxworks.vbframe.diagnostics.Severity;
import org.dxworks.vbframe.ir.BindingStatus;
import org.dxworks.vbframe.ir.ControlElementNode;
import org.dxworks.vbframe.ir.DeclarationNode;
import org.dxworks.vbframe.ir.ErrorNode;
import org.dxworks.vbframe.ir.EventBindingNode;
import org.dxworks.vbframe.ir.ExpressionNode;
import org.dxworks.vbframe.ir.IrNode;
import org.dxworks.vbframe.ir.IrVisitor;
import org.dxworks.vbframe.ir.ModuleNode;
import org.dxworks.vbframe.ir.ProcedureNode;
import org.dxworks.vbframe.ir.SemanticInfo;
import org.dxworks.vbframe.ir.StatementNode;
import org.dxworks.vbframe.ir.TriviaNode;
import org.dxworks.vbframe.ir.TypeRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Annotates a module's IR with resolved types, the control hierarchy, event bindings and resource
 * references, without changing the tree's shape.
 * <p>
 * Given an open collector, enrichment never fails: inconsistencies become semantic diagnostics and the affected annotation keeps
 * its unresolved value. Annotations are recomputed from the tree on every run and repeated diagnostics
 * carry identical span, code and message, so a second run changes nothing after de-duplication.
 */
public class SemanticEnricher {

    private static final Pattern RESOURCE = Pattern.compile("^\\$?\"([^\"]+\\.(?:frx|ctx|dsx))\":([0-9a-f]+)$",
            Pattern.CASE_INSENSITIVE);

    /**
     * @throws IllegalArgumentException if {@code diagnostics} was already finalized; enrichment needs an
     *                                  open collector
     */
    public void enrich(ModuleNode module, DiagnosticsCollector diagnostics) {
        if (diagnostics.isFinalized()) {
            throw new IllegalArgumentException("Enrichment needs a collector that is not finalized yet");
        }
        SymbolIndex index = SymbolIndex.build(module);
        module.accept(new Pass(index, diagnostics));
        reportDuplicateControls(index, diagnostics);
    }

    // control names are unique per form; members of a control array differ by Index
    private static void reportDuplicateControls(SymbolIndex index, DiagnosticsCollector diagnostics) {
        for (List<ControlElementNode> sameName : index.controlsByName().values()) {
            for (int i = 1; i < sameName.size(); i++) {
                ControlElementNode duplicate = sameName.get(i);
                for (int j = 0; j < i; j++) {
                    ControlElementNode earlier = sameName.get(j);
                    if (sameIndex(earlier, duplicate)) {
                        diagnostics.add(Diagnostic.semantic(Severity.WARNING, DiagnosticCodes.DUPLICATE_CONTROL_NAME,
                                        "Control name '" + duplicate.getName() + "' is declared more than once",
                                        duplicate.getSpan())
                                .withRelatedSpans(List.of(earlier.getSpan(), duplicate.getSpan()))
                                .withHint("Rename one of the controls or give both an Index to form a control array"));
                        break;
                    }
                }
            }
        }
    }

    private static boolean sameIndex(ControlElementNode a, ControlElementNode b) {
        return a.getIndex() == null ? b.getIndex() == null : a.getIndex().equals(b.getIndex());
    }

    private static final class Pass implements IrVisitor<Void> {

        private final SymbolIndex index;
        private final DiagnosticsCollector diagnostics;
        private final TypeResolver types;
        private final Deque<ControlElementNode> controls = new ArrayDeque<>();
        private final Set<String> reportedResources = new HashSet<>();

        private Pass(SymbolIndex index, DiagnosticsCollector diagnostics) {
            this.index = index;
            this.diagnostics = diagnostics;
            this.types = new TypeResolver(index.getUserTypes());
        }

        private void visitChildren(IrNode node) {
            for (IrNode child : node.getChildren()) {
                child.accept(this);
            }
        }

        @Override
        public Void visitModule(ModuleNode node) {
            visitChildren(node);
            return null;
        }

        @Override
        public Void visitDeclaration(DeclarationNode node) {
            switch (node.getDeclarationKind()) {
                case VARIABLE:
                case PARAMETER:
                case TYPE_MEMBER:
                    annotateType(node, types.resolve(node.getDeclaredType(), node.getName(), node.isArray()),
                            node.getName());
                    break;
                case CONSTANT:
                    TypeRef constant = node.getDeclaredType() != null
                            ? types.resolveName(node.getDeclaredType())
                            : TypeResolver.literalType(valueLiteralType(node), node.getName());
                    annotateType(node, constant, node.getName());
                    break;
                case EXTERNAL_PROCEDURE:
                    if (node.hasModifier("function")) {
                        annotateType(node, types.resolve(node.getDeclaredType(), node.getName(), false),
                                node.getName());
                    }
                    break;
                case IMPLEMENTS:
                    annotateType(node, types.resolveName(node.getDeclaredType()), node.getName());
                    break;
                default:
                    break;
            }
            visitChildren(node);
            return null;
        }

        @Override
        public Void visitProcedure(ProcedureNode node) {
            ProcedureNode.Kind kind = node.getProcedureKind();
            if (kind == ProcedureNode.Kind.FUNCTION || kind == ProcedureNode.Kind.PROPERTY_GET) {
                annotateType(node, types.resolve(node.getReturnType(), node.getName(), false), node.getName());
            }
            visitChildren(node);
            return null;
        }

        @Override
        public Void visitStatement(StatementNode node) {
            if (node.getStatementKind() == StatementNode.Kind.PROPERTY && node.getValue() != null) {
                Matcher m = RESOURCE.matcher(node.getValue().trim());
                if (m.matches()) {
                    String file = m.group(1);
                    node.setSemanticInfo(SemanticInfo.builder().resourceRef(file + ":" + m.group(2)).build());
                    if (reportedResources.add(file.toLowerCase(Locale.ROOT))) {
                        diagnostics.add(Diagnostic.semantic(Severity.INFO, DiagnosticCodes.RESOURCE_REFERENCE,
                                "Property '" + node.getName() + "' refers to resource file '" + file
                                        + "', which is recorded but not read", node.getSpan()));
                    }
                }
            }
            visitChildren(node);
            return null;
        }

        @Override
        public Void visitExpression(ExpressionNode node) {
            visitChildren(node);
            return null;
        }

        @Override
        public Void visitControlElement(ControlElementNode node) {
            TypeRef type;
            if (KnownEvents.isKnownType(node.getControlType())) {
                type = TypeRef.objectReference(node.getControlType());
            } else {
                type = TypeRef.unresolved(node.getControlType());
                diagnostics.add(Diagnostic.semantic(Severity.INFO, DiagnosticCodes.UNKNOWN_CONTROL_TYPE,
                        "Control type '" + node.getControlType() + "' of '" + node.getName()
                                + "' is not an intrinsic control; its events are not verified", node.getSpan()));
            }
            List<String> childIds = new ArrayList<>();
            for (IrNode child : node.getChildren()) {
                if (child instanceof ControlElementNode) {
                    childIds.add(child.getId());
                }
            }
            ControlElementNode parent = controls.peek();
            node.setSemanticInfo(SemanticInfo.builder()
                    .type(type)
                    .parentControlId(parent != null ? parent.getId() : null)
                    .childControlIds(childIds)
                    .build());
            controls.push(node);
            visitChildren(node);
            controls.pop();
            return null;
        }

        @Override
        public Void visitEventBinding(EventBindingNode node) {
            Resolution resolution = bind(node);
            node.setSemanticInfo(SemanticInfo.builder().binding(resolution.status, resolution.targetId).build());
            if (resolution.problem != null) {
                diagnostics.add(resolution.problem);
            }
            return null;
        }

        @Override
        public Void visitTrivia(TriviaNode node) {
            return null;
        }

        @Override
        public Void visitError(ErrorNode node) {
            return null;
        }

        private Resolution bind(EventBindingNode node) {
            String source = node.getSourceName();
            String event = node.getEventName();
            ModuleKind moduleKind = index.getModule().getModuleKind();

            if (moduleKind == ModuleKind.FORM && isFormKeyword(source)) {
                ControlElementNode form = index.getRootControl();
                if (form != null) {
                    return checked(node, form.getId(), form.getControlType(), form.getName());
                }
            }
            if (moduleKind == ModuleKind.CLASS && "Class".equalsIgnoreCase(source)) {
                if ("Initialize".equalsIgnoreCase(event) || "Terminate".equalsIgnoreCase(event)) {
                    return new Resolution(BindingStatus.BOUND, index.getModule().getId(), null);
                }
                return unknownEvent(node, "the class");
            }
            List<ControlElementNode> named = index.controlsNamed(source);
            if (!named.isEmpty()) {
                ControlElementNode control = named.get(0);
                return checked(node, control.getId(), control.getControlType(), control.getName());
            }
            DeclarationNode variable = index.withEventsVariable(source);
            if (variable != null) {
                if (KnownEvents.isKnownType(variable.getDeclaredType())) {
                    return checked(node, variable.getId(), variable.getDeclaredType(), variable.getName());
                }
                return new Resolution(BindingStatus.BOUND, variable.getId(), null);
            }
            Diagnostic problem = Diagnostic.semantic(Severity.WARNING, DiagnosticCodes.UNMATCHED_EVENT_BINDING,
                            "Procedure '" + source + "_" + event + "' follows the event handler convention but no "
                                    + "control or WithEvents variable named '" + source + "' exists", node.getSpan())
                    .withHint("Declare the event source or rename the procedure");
            return new Resolution(BindingStatus.UNMATCHED, null, problem);
        }

        private Resolution checked(EventBindingNode node, String targetId, String type, String sourceName) {
            if (!KnownEvents.isKnownType(type)) {
                return new Resolution(BindingStatus.UNVERIFIED, targetId, null);
            }
            if (KnownEvents.supports(type, node.getEventName())) {
                return new Resolution(BindingStatus.BOUND, targetId, null);
            }
            return unknownEvent(node, "'" + sourceName + "' (" + type + ")");
        }

        private Resolution unknownEvent(EventBindingNode node, String sourceDescription) {
            Diagnostic problem = Diagnostic.semantic(Severity.WARNING, DiagnosticCodes.UNKNOWN_EVENT,
                    "Event '" + node.getEventName() + "' is not raised by " + sourceDescription, node.getSpan());
            return new Resolution(BindingStatus.UNMATCHED, null, problem);
        }

        private static boolean isFormKeyword(String source) {
            return "Form".equalsIgnoreCase(source) || "MDIForm".equalsIgnoreCase(source);
        }

        private void annotateType(IrNode node, TypeRef type, String declaredName) {
            node.setSemanticInfo(SemanticInfo.builder().type(type).build());
            TypeRef element = type.getCategory() == TypeRef.Category.ARRAY_OF ? type.getElementType() : type;
            if (element.isUnresolved()) {
                diagnostics.add(Diagnostic.semantic(Severity.INFO, DiagnosticCodes.UNRESOLVED_TYPE,
                        "Type '" + element.getName() + "' of '" + declaredName + "' is not declared in this module",
                        node.getSpan()));
            }
        }

        private static String valueLiteralType(DeclarationNode constant) {
            for (IrNode child : constant.getChildren()) {
                if ("value".equals(child.getRole()) && child instanceof ExpressionNode) {
                    return ((ExpressionNode) child).getLiteralType();
                }
            }
            return null;
        }
    }

    private static final class Resolution {
        private final BindingStatus status;
        private final String targetId;
        private final Diagnostic problem;

        private Resolution(BindingStatus status, String targetId, Diagnostic problem) {
            this.status = status;
            this.targetId = targetId;
            this.problem = problem;
        }
    }
}
