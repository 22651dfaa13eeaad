package org.dxworks.vbframe.builder;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.dxworks.vbframe.ModuleKind;
import org.dxworks.vbframe.SourceFile;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.DiagnosticCodes;
import org.dxworks.vbframe.diagnostics.DiagnosticsCollector;
import org.dxworks.vbframe.diagnostics.Severity;
import org.dxworks.vbframe.ingest.IngestionResult;
import org.dxworks.vbframe.ingest.SourceText;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Parser;
import org.dxworks.vbframe.ir.ErrorNode;
import org.dxworks.vbframe.ir.IrNode;
import org.dxworks.vbframe.ir.IrWalker;
import org.dxworks.vbframe.ir.ModuleNode;
import org.dxworks.vbframe.ir.ProcedureNode;
import org.dxworks.vbframe.ir.SourceSpan;
import org.dxworks.vbframe.ir.StatementNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a VB6 parse tree into the IR of one module.
 * <p>
 * Every construct the parser could not derive becomes an {@link ErrorNode} covering the raw text; the
 * builder never guesses what was meant. Each error node is guaranteed a diagnostic overlapping its span,
 * reported here when ingestion did not already produce one. A builder instance holds no state between
 * calls.
 */
public class IrBuilder {

    /**
     * @throws IllegalArgumentException if {@code diagnostics} was already finalized
     */
    public ModuleNode build(IngestionResult ingestion, SourceFile file, DiagnosticsCollector diagnostics) {
        if (diagnostics.isFinalized()) {
            throw new IllegalArgumentException("IR construction needs a collector that is not finalized yet");
        }
        SourceText source = ingestion.getSource();
        NodeFactory factory = new NodeFactory(source, ingestion.getTokens());
        ModuleKind kind = file.getModuleKind();
        int[] whole = {0, source.length()};

        ModuleNode module;
        if (!ingestion.hasTree()) {
            List<IrNode> children = List.of(factory.error(whole, "module"));
            module = module(factory, whole, children, kind, fileStem(file.getPath()));
        } else {
            ModuleElements elements = new ModuleElements(factory, kind);
            List<IrNode> children = elements.build(ingestion.getTree());
            module = module(factory, whole, children, kind, fileStem(file.getPath()));
            new TriviaAttacher(factory).attach(module);
        }
        pairErrors(module, diagnostics);
        return module;
    }

    private static ModuleNode module(NodeFactory factory, int[] whole, List<IrNode> children, ModuleKind kind,
                                     String fallbackName) {
        String name = null;
        String version = null;
        Set<String> options = new LinkedHashSet<>();
        for (IrNode child : children) {
            if (!(child instanceof StatementNode)) {
                continue;
            }
            StatementNode stmt = (StatementNode) child;
            switch (stmt.getStatementKind()) {
                case VERSION:
                    if (version == null) {
                        version = stmt.getValue();
                    }
                    break;
                case ATTRIBUTE:
                    if (name == null && "VB_Name".equalsIgnoreCase(stmt.getName()) && !stmt.getChildren().isEmpty()) {
                        name = Literals.unquote(stmt.getChildren().get(0).getText());
                    }
                    break;
                case OPTION:
                    options.add(stmt.getValue() == null ? stmt.getName() : stmt.getName() + "=" + stmt.getValue());
                    break;
                default:
                    break;
            }
        }
        int[] r = factory.covering(whole, children);
        SourceSpan span = factory.span(r);
        return factory.register(new ModuleNode(factory.id("module", span), span, factory.text(r), children, kind,
                name != null ? name : fallbackName, version, options.contains("privateModule"),
                new ArrayList<>(options)), r);
    }

    private static void pairErrors(ModuleNode module, DiagnosticsCollector diagnostics) {
        List<Diagnostic> known = diagnostics.snapshot();
        for (ErrorNode error : IrWalker.collect(module, ErrorNode.class)) {
            boolean paired = false;
            for (Diagnostic d : known) {
                if (d.getSpan().intersects(error.getSpan())) {
                    paired = true;
                    break;
                }
            }
            if (!paired) {
                Diagnostic added = Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.UNRECOGNIZED_CONSTRUCT,
                        "Unrecognized " + error.getConstruct(), error.getSpan());
                diagnostics.add(added);
                known = new ArrayList<>(known);
                known.add(added);
            }
        }
    }

    static String fileStem(String path) {
        String name = path;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Module-level elements and procedures.
     */
    private static final class ModuleElements {

        private final NodeFactory factory;
        private final ModuleKind kind;
        private final ExpressionBuilder expressions;
        private final DeclarationBuilder declarations;
        private final StatementBuilder statements;
        private final DesignerBuilder designer;

        private ModuleElements(NodeFactory factory, ModuleKind kind) {
            this.factory = factory;
            this.kind = kind;
            this.expressions = new ExpressionBuilder(factory);
            this.declarations = new DeclarationBuilder(factory, expressions);
            this.statements = new StatementBuilder(factory, expressions, declarations);
            this.designer = new DesignerBuilder(factory);
        }

        List<IrNode> build(VisualBasic6Parser.StartRuleContext tree) {
            List<IrNode> children = new ArrayList<>();
            for (VisualBasic6Parser.ModuleElementContext element : tree.moduleElement()) {
                children.add(element(element));
            }
            return factory.withStrayTokens(tree, children);
        }

        private IrNode element(VisualBasic6Parser.ModuleElementContext ctx) {
            if (factory.isBroken(ctx) || ctx.getChildCount() == 0) {
                return factory.error(ctx);
            }
            ParseTree inner = ctx.getChild(0);
            if (inner instanceof VisualBasic6Parser.VersionStmtContext) {
                return designer.version((VisualBasic6Parser.VersionStmtContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.ObjectStmtContext) {
                return designer.objectReference((VisualBasic6Parser.ObjectStmtContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.DesignerBlockContext) {
                return designer.block((VisualBasic6Parser.DesignerBlockContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.AttributeStmtContext) {
                return guarded((ParserRuleContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.OptionStmtContext) {
                return option((VisualBasic6Parser.OptionStmtContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.ImplementsStmtContext) {
                return declarations.implementsClause((VisualBasic6Parser.ImplementsStmtContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.DeclareStmtContext) {
                return declarations.external((VisualBasic6Parser.DeclareStmtContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.EventStmtContext) {
                return declarations.event((VisualBasic6Parser.EventStmtContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.TypeStmtContext) {
                return declarations.userType((VisualBasic6Parser.TypeStmtContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.EnumStmtContext) {
                return declarations.enumeration((VisualBasic6Parser.EnumStmtContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.ConstStmtContext) {
                return declarations.constants((VisualBasic6Parser.ConstStmtContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.VariableStmtContext) {
                return declarations.variables((VisualBasic6Parser.VariableStmtContext) inner);
            }
            if (inner instanceof VisualBasic6Parser.SubStmtContext) {
                VisualBasic6Parser.SubStmtContext sub = (VisualBasic6Parser.SubStmtContext) inner;
                return procedure(sub, ProcedureNode.Kind.SUB, sub.visibility(), sub.STATIC() != null, sub.name,
                        sub.argList(), null, sub.block());
            }
            if (inner instanceof VisualBasic6Parser.FunctionStmtContext) {
                VisualBasic6Parser.FunctionStmtContext fn = (VisualBasic6Parser.FunctionStmtContext) inner;
                return procedure(fn, ProcedureNode.Kind.FUNCTION, fn.visibility(), fn.STATIC() != null, fn.name,
                        fn.argList(), fn.asTypeClause(), fn.block());
            }
            if (inner instanceof VisualBasic6Parser.PropertyStmtContext) {
                VisualBasic6Parser.PropertyStmtContext prop = (VisualBasic6Parser.PropertyStmtContext) inner;
                return procedure(prop, accessorKind(prop), prop.visibility(), prop.STATIC() != null, prop.name,
                        prop.argList(), prop.asTypeClause(), prop.block());
            }
            return factory.error((ParserRuleContext) inner);
        }

        private IrNode guarded(ParserRuleContext ctx) {
            return factory.isBroken(ctx) ? factory.error(ctx) : ctx.accept(statements);
        }

        private IrNode option(VisualBasic6Parser.OptionStmtContext ctx) {
            if (factory.isBroken(ctx)) {
                return factory.error(ctx);
            }
            String name;
            String value = null;
            if (ctx instanceof VisualBasic6Parser.OptionBaseContext) {
                name = "base";
                value = ((VisualBasic6Parser.OptionBaseContext) ctx).base.getText();
            } else if (ctx instanceof VisualBasic6Parser.OptionCompareContext) {
                name = "compare";
                value = Literals.lower(((VisualBasic6Parser.OptionCompareContext) ctx).compareMode.getText());
            } else if (ctx instanceof VisualBasic6Parser.OptionPrivateModuleContext) {
                name = "privateModule";
            } else {
                name = "explicit";
            }
            return factory.statement(factory.range(ctx), List.of(), StatementNode.Kind.OPTION, name, value);
        }

        private static ProcedureNode.Kind accessorKind(VisualBasic6Parser.PropertyStmtContext ctx) {
            switch (Literals.lower(ctx.accessor.getText())) {
                case "let":
                    return ProcedureNode.Kind.PROPERTY_LET;
                case "set":
                    return ProcedureNode.Kind.PROPERTY_SET;
                default:
                    return ProcedureNode.Kind.PROPERTY_GET;
            }
        }

        private IrNode procedure(ParserRuleContext ctx, ProcedureNode.Kind procedureKind,
                                 VisualBasic6Parser.VisibilityContext visibility, boolean isStatic,
                                 VisualBasic6Parser.AmbiguousIdentifierContext name,
                                 VisualBasic6Parser.ArgListContext args,
                                 VisualBasic6Parser.AsTypeClauseContext returns,
                                 VisualBasic6Parser.BlockContext body) {
            if (factory.isBroken(ctx, true)) {
                return factory.error(ctx);
            }
            int[] r = factory.range(ctx);
            String id = factory.id("proc", factory.span(r));
            List<IrNode> children = new ArrayList<>();
            String procedureName = name.getText();
            if (procedureKind == ProcedureNode.Kind.SUB && kind != ModuleKind.STANDARD) {
                int underscore = procedureName.lastIndexOf('_');
                if (underscore > 0 && underscore < procedureName.length() - 1) {
                    children.add(factory.binding(factory.range(name), id, procedureName.substring(0, underscore),
                            procedureName.substring(underscore + 1)).withRole("binding"));
                }
            }
            children.addAll(declarations.parameters(args));
            children.addAll(statements.block(body, "body"));
            children = factory.withStrayTokens(ctx, children);
            return factory.procedure(id, r, children, procedureKind, procedureName,
                    DeclarationBuilder.visibility(visibility), isStatic ? List.of("static") : List.of(),
                    DeclarationBuilder.typeName(returns));
        }
    }
}
