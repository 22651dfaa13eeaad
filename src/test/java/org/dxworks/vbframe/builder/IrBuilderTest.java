package org.dxworks.vbframe.builder;

import org.dxworks.vbframe.ModuleKind;
import org.dxworks.vbframe.SourceFile;
import org.dxworks.vbframe.TestUtils;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.DiagnosticCodes;
import org.dxworks.vbframe.diagnostics.DiagnosticsCollector;
import org.dxworks.vbframe.diagnostics.Stage;
import org.dxworks.vbframe.ingest.IngestionResult;
import org.dxworks.vbframe.ingest.SourceText;
import org.dxworks.vbframe.ingest.TreeIngestor;
import org.dxworks.vbframe.ir.ControlElementNode;
import org.dxworks.vbframe.ir.DeclarationNode;
import org.dxworks.vbframe.ir.ErrorNode;
import org.dxworks.vbframe.ir.EventBindingNode;
import org.dxworks.vbframe.ir.ExpressionNode;
import org.dxworks.vbframe.ir.IrNode;
import org.dxworks.vbframe.ir.IrWalker;
import org.dxworks.vbframe.ir.ModuleNode;
import org.dxworks.vbframe.ir.ProcedureNode;
import org.dxworks.vbframe.ir.StatementNode;
import org.dxworks.vbframe.ir.TriviaNode;
import org.dxworks.vbframe.pipeline.FileResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class IrBuilderTest {

    static List<String> samples() {
        return TestUtils.ALL_SAMPLES;
    }

    private static ModuleNode build(String path, String text, DiagnosticsCollector diagnostics) {
        SourceText source = SourceText.of(text);
        IngestionResult ingestion = new TreeIngestor().ingest(source, path, diagnostics);
        SourceFile file = new SourceFile(path, null, "UTF-8", ModuleKind.detect(java.nio.file.Paths.get(path))
                .orElseThrow());
        return new IrBuilder().build(ingestion, file, diagnostics);
    }

    @Test
    void analyze_standard_singleAssignment() {
        FileResult result = TestUtils.process("standard/Simple.bas");

        ModuleNode module = result.getModule();
        List<ProcedureNode> procedures = IrWalker.collect(module, ProcedureNode.class);
        assertEquals(1, procedures.size());
        ProcedureNode main = procedures.get(0);
        assertEquals("Main", main.getName());
        assertEquals(ProcedureNode.Kind.SUB, main.getProcedureKind());
        assertEquals("public", main.getVisibility());
        assertEquals(1, main.getChildren().size());
        StatementNode statement = (StatementNode) main.getChildren().get(0);
        assertEquals(StatementNode.Kind.ASSIGNMENT, statement.getStatementKind());
        assertEquals("body", statement.getRole());
        assertEquals("x = 1", statement.getText());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void analyze_class_missingEndType() {
        FileResult result = TestUtils.process("class/Broken.cls");

        assertEquals(FileResult.Status.OK, result.getStatus());
        ModuleNode module = result.getModule();
        assertNotNull(module);
        List<ErrorNode> errors = IrWalker.collect(module, ErrorNode.class);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).getText().startsWith("Private Type Point"));
        List<Diagnostic> syntax = TestUtils.ofStage(result.getDiagnostics(), Stage.SYNTAX);
        assertEquals(1, syntax.size());
        assertTrue(syntax.get(0).getSpan().intersects(errors.get(0).getSpan()));
        assertEquals("Broken", module.getName());
    }

    @Test
    void analyze_standard_moduleMetadata() {
        ModuleNode module = TestUtils.process("standard/Module1.bas").getModule();

        assertEquals(ModuleKind.STANDARD, module.getModuleKind());
        assertEquals("Utilities", module.getName());
        assertNull(module.getVersion());
        assertEquals(List.of("explicit", "base=1", "compare=text"), module.getOptions());
        assertFalse(module.isPrivateModule());
    }

    @Test
    void analyze_class_headerAndVersion() {
        ModuleNode module = TestUtils.process("class/Account.cls").getModule();

        assertEquals("Account", module.getName());
        assertEquals("1.0", module.getVersion());
        StatementNode header = TestUtils.single(module, StatementNode.class,
                s -> s.getStatementKind() == StatementNode.Kind.CLASS_HEADER);
        Set<String> properties = header.getChildren().stream()
                .map(c -> ((StatementNode) c).getName())
                .collect(Collectors.toSet());
        assertEquals(Set.of("MultiUse", "Persistable"), properties);
    }

    @Test
    void analyze_standard_fallsBackToFileStemForModuleName() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ModuleNode module = build("src/Helpers.bas", "Option Private Module\nSub Foo()\nEnd Sub\n", diagnostics);

        assertEquals("Helpers", module.getName());
        assertTrue(module.isPrivateModule());
        assertEquals(List.of("privateModule"), module.getOptions());
    }

    @Test
    void analyze_standard_declarations() {
        ModuleNode module = TestUtils.process("standard/Module1.bas").getModule();

        DeclarationNode sleep = TestUtils.single(module, DeclarationNode.class, d -> "Sleep".equals(d.getName()));
        assertEquals(DeclarationNode.Kind.EXTERNAL_PROCEDURE, sleep.getDeclarationKind());
        assertEquals("kernel32", sleep.getLibrary());
        assertEquals("Sleep", sleep.getAlias());
        assertEquals(List.of("sub"), sleep.getModifiers());

        DeclarationNode items = TestUtils.single(module, DeclarationNode.class, d -> "items".equals(d.getName()));
        assertEquals(DeclarationNode.Kind.VARIABLE, items.getDeclarationKind());
        assertTrue(items.isArray());
        assertEquals("Item", items.getDeclaredType());

        DeclarationNode name = TestUtils.single(module, DeclarationNode.class,
                d -> d.getDeclarationKind() == DeclarationNode.Kind.TYPE_MEMBER && "Name".equals(d.getName()));
        assertEquals("String", name.getDeclaredType());
        assertTrue(name.getChildren().stream().anyMatch(c -> "length".equals(c.getRole())));

        List<DeclarationNode> parameters = TestUtils.find(module, DeclarationNode.class,
                d -> d.getDeclarationKind() == DeclarationNode.Kind.PARAMETER && "price".equals(d.getName()));
        assertEquals(1, parameters.size());
        assertTrue(parameters.get(0).hasModifier("optional"));
        assertTrue(parameters.get(0).hasModifier("byval"));
        assertTrue(parameters.get(0).getChildren().stream().anyMatch(c -> "defaultValue".equals(c.getRole())));
    }

    @Test
    void analyze_standard_controlFlowStatements() {
        ModuleNode module = TestUtils.process("standard/Module1.bas").getModule();

        StatementNode forLoop = TestUtils.single(module, StatementNode.class,
                s -> s.getStatementKind() == StatementNode.Kind.FOR);
        assertEquals("i", forLoop.getName());

        StatementNode ifStatement = TestUtils.single(module, StatementNode.class,
                s -> s.getStatementKind() == StatementNode.Kind.IF);
        assertEquals("block", ifStatement.getName());
        assertEquals(1, ifStatement.getChildren().stream().filter(c -> "elseIf".equals(c.getRole())).count());
        assertEquals(1, ifStatement.getChildren().stream().filter(c -> "else".equals(c.getRole())).count());

        StatementNode select = TestUtils.single(module, StatementNode.class,
                s -> s.getStatementKind() == StatementNode.Kind.SELECT_CASE);
        List<IrNode> cases = select.getChildren().stream().filter(c -> "case".equals(c.getRole()))
                .collect(Collectors.toList());
        assertEquals(3, cases.size());
        assertEquals("else", ((StatementNode) cases.get(2)).getName());
        assertEquals(2, cases.get(1).getChildren().stream().filter(c -> "condition".equals(c.getRole())).count());
    }

    @Test
    void analyze_form_controlTree() {
        ModuleNode module = TestUtils.process("form/Form1.frm").getModule();

        assertEquals("frmOrders", module.getName());
        assertEquals("5.00", module.getVersion());
        List<ControlElementNode> controls = IrWalker.collect(module, ControlElementNode.class);
        assertEquals(List.of("Form1", "Frame1", "txtName", "Command1", "Command1", "lvOrders"),
                controls.stream().map(ControlElementNode::getName).collect(Collectors.toList()));
        assertEquals(Integer.valueOf(1), controls.get(4).getIndex());
        assertNull(controls.get(0).getIndex());

        StatementNode font = TestUtils.single(module, StatementNode.class,
                s -> s.getStatementKind() == StatementNode.Kind.PROPERTY_GROUP);
        assertEquals("Font", font.getName());
        assertEquals(2, font.getChildren().size());
    }

    @Test
    void analyze_form_eventBindingsOnlyForUnderscoredSubs() {
        ModuleNode module = TestUtils.process("form/Form1.frm").getModule();

        List<String> sources = IrWalker.collect(module, EventBindingNode.class).stream()
                .map(b -> b.getSourceName() + "." + b.getEventName())
                .collect(Collectors.toList());

        assertEquals(List.of("Form.Load", "Command1.Click", "txtName.Change", "lvOrders.ItemClick",
                "Helper.Refresh"), sources);
    }

    @Test
    void analyze_standard_noEventBindingsInStandardModules() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ModuleNode module = build("Main.bas", "Sub Command1_Click()\nEnd Sub\n", diagnostics);

        assertTrue(IrWalker.collect(module, EventBindingNode.class).isEmpty());
    }

    @Test
    void analyze_standard_commentsBecomeTrivia() {
        ModuleNode module = TestUtils.process("standard/Module1.bas").getModule();

        DeclarationNode constants = TestUtils.find(module, DeclarationNode.class,
                d -> d.getDeclarationKind() == DeclarationNode.Kind.CONSTANT_LIST).get(0);
        assertTrue(constants.getLeadingTrivia().stream()
                .anyMatch(t -> t.getTriviaKind() == TriviaNode.Kind.COMMENT && t.getText().equals("' Shared helpers")));

        ProcedureNode total = TestUtils.single(module, ProcedureNode.class, p -> "Total".equals(p.getName()));
        assertTrue(total.getLeadingTrivia().stream().anyMatch(t -> t.getText().equals("' Sums the price qty times")));

        StatementNode bump = TestUtils.single(module, StatementNode.class,
                s -> s.getStatementKind() == StatementNode.Kind.ASSIGNMENT && s.getText().startsWith("counter ="));
        assertEquals(1, bump.getTrailingTrivia().size());
        assertEquals("' bump", bump.getTrailingTrivia().get(0).getText());
    }

    @Test
    void analyze_standard_blankLinesAreCounted() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ModuleNode module = build("Main.bas", "Dim a\n\n\nDim b\n", diagnostics);

        DeclarationNode second = (DeclarationNode) module.getChildren().get(1);
        assertEquals(1, second.getLeadingTrivia().size());
        TriviaNode blank = second.getLeadingTrivia().get(0);
        assertEquals(TriviaNode.Kind.BLANK_LINES, blank.getTriviaKind());
        assertEquals(2, blank.getLineCount());
    }

    @Test
    void analyze_standard_everyErrorNodeHasADiagnostic() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ModuleNode module = build("Bad.bas", "Sub Foo(\n    x = \nEnd Sub\n@@@\nSub Bar()\n    y = 2\nEnd Sub\n",
                diagnostics);

        List<ErrorNode> errors = IrWalker.collect(module, ErrorNode.class);
        assertFalse(errors.isEmpty());
        for (ErrorNode error : errors) {
            assertTrue(diagnostics.snapshot().stream().anyMatch(d -> d.getSpan().intersects(error.getSpan())),
                    "no diagnostic for " + error);
        }
        assertTrue(IrWalker.collect(module, ProcedureNode.class).stream().anyMatch(p -> "Bar".equals(p.getName())));
    }

    @Test
    void analyze_standard_unrecognizedCharacterKeepsTheProcedure() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ModuleNode module = build("A.bas", "Sub A()\n x = 1\n \u00a4\n y = 3\nEnd Sub\n", diagnostics);

        ProcedureNode procedure = TestUtils.single(module, ProcedureNode.class, p -> "A".equals(p.getName()));
        List<IrNode> body = procedure.getChildren();
        assertEquals(3, body.size());
        assertEquals("x = 1", body.get(0).getText());
        ErrorNode error = (ErrorNode) body.get(1);
        assertEquals("invalidLine", error.getConstruct());
        assertEquals("\u00a4", error.getText());
        assertEquals("body", error.getRole());
        assertEquals("y = 3", body.get(2).getText());
        List<Diagnostic> reported = diagnostics.finalizeDiagnostics();
        assertEquals(1, reported.size());
        assertEquals(DiagnosticCodes.UNKNOWN_TOKEN, reported.get(0).getCode());
        assertTrue(reported.get(0).getSpan().intersects(error.getSpan()));
    }

    @Test
    void analyze_standard_unicodeIdentifiersAreDeclarations() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ModuleNode module = build("A.bas", "Sub A()\n    Dim Gr\u00f6\u00dfe As Long\nEnd Sub\n", diagnostics);

        DeclarationNode variable = TestUtils.single(module, DeclarationNode.class,
                d -> d.getDeclarationKind() == DeclarationNode.Kind.VARIABLE);
        assertEquals("Gr\u00f6\u00dfe", variable.getName());
        assertEquals("Long", variable.getDeclaredType());
        assertTrue(IrWalker.collect(module, ErrorNode.class).isEmpty());
    }

    @Test
    void analyze_standard_longConcatenationChainIsLeftNested() {
        int terms = 2500;
        StringBuilder line = new StringBuilder("    s = a0");
        for (int i = 1; i < terms; i++) {
            line.append(" & a").append(i);
        }
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ModuleNode module = build("Long.bas", "Sub A()\n" + line + "\nEnd Sub\n", diagnostics);

        assertTrue(diagnostics.snapshot().isEmpty());
        StatementNode assignment = TestUtils.single(module, StatementNode.class,
                st -> st.getStatementKind() == StatementNode.Kind.ASSIGNMENT);
        ExpressionNode value = (ExpressionNode) assignment.getChildren().get(1);
        int depth = 0;
        ExpressionNode current = value;
        while (current.getExpressionKind() == ExpressionNode.Kind.BINARY) {
            assertEquals("&", current.getOperator());
            assertEquals("a" + (terms - 1 - depth), current.getChildren().get(1).getText());
            current = (ExpressionNode) current.getChildren().get(0);
            depth++;
        }
        assertEquals(terms - 1, depth);
        assertEquals("a0", current.getText());
        assertEquals("left", current.getRole());
    }

    static List<String> brokenSources() {
        return List.of(
                "Sub Foo(\n    x = \nEnd Sub\n",
                "Sub A()\n    If x Then\n        y = 1\nEnd Sub\n",
                "Sub A()\n    x = (1 + \nEnd Sub\n",
                "@@@\nSub A()\nEnd Sub\n",
                "Sub A()\n    \u00a4 \u00a4\n    Call B(,\nEnd Sub\n",
                "Private Type P\n    X As\nEnd Type\nFunction F() As\nEnd Function\n",
                "Sub A()\n    Select Case x\n    Case\n    End Select\nEnd Sub\n");
    }

    @ParameterizedTest
    @MethodSource("brokenSources")
    void analyze_everyErrorNodeIsPairedWithADiagnostic(String text) {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ModuleNode module = build("Bad.bas", text, diagnostics);

        List<ErrorNode> errors = IrWalker.collect(module, ErrorNode.class);
        assertFalse(errors.isEmpty(), "expected at least one error node");
        List<Diagnostic> reported = diagnostics.finalizeDiagnostics();
        for (ErrorNode error : errors) {
            assertTrue(reported.stream().anyMatch(d -> d.getSpan().intersects(error.getSpan())),
                    "no diagnostic for " + error);
        }
    }

    @Test
    void analyze_rejectsFinalizedCollector() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();
        SourceText source = SourceText.of("Sub Foo()\nEnd Sub\n");
        IngestionResult ingestion = new TreeIngestor().ingest(source, "Foo.bas", diagnostics);
        diagnostics.finalizeDiagnostics();

        assertThrows(IllegalArgumentException.class, () -> new IrBuilder().build(ingestion,
                new SourceFile("Foo.bas", null, "UTF-8", ModuleKind.STANDARD), diagnostics));
    }

    @Test
    void analyze_standard_errorNodeWithoutParserDiagnosticGetsOne() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();
        SourceText source = SourceText.of("Sub Foo()\nEnd Sub\n");
        IngestionResult failed = new IngestionResult(null, null, source);

        ModuleNode module = new IrBuilder().build(failed,
                new SourceFile("Foo.bas", null, "UTF-8", ModuleKind.STANDARD), diagnostics);

        ErrorNode error = TestUtils.single(module, ErrorNode.class, e -> true);
        assertEquals(source.length(), error.getText().length());
        assertEquals(1, diagnostics.snapshot().size());
        assertEquals(DiagnosticCodes.UNRECOGNIZED_CONSTRUCT, diagnostics.snapshot().get(0).getCode());
    }

    @ParameterizedTest
    @MethodSource("samples")
    void analyze_spansNestAndSiblingsAreOrdered(String sample) {
        ModuleNode module = TestUtils.process(sample).getModule();

        for (IrNode parent : IrWalker.preorder(module)) {
            IrNode previous = null;
            for (IrNode child : parent.getChildren()) {
                assertTrue(parent.getSpan().contains(child.getSpan()), child + " escapes " + parent);
                if (previous != null) {
                    assertTrue(previous.getSpan().precedes(child.getSpan()), previous + " overlaps " + child);
                }
                previous = child;
            }
        }
    }

    @ParameterizedTest
    @MethodSource("samples")
    void analyze_idsAreUnique(String sample) {
        ModuleNode module = TestUtils.process(sample).getModule();

        Set<String> ids = new HashSet<>();
        for (IrNode node : IrWalker.preorder(module)) {
            assertTrue(ids.add(node.getId()), "duplicate id " + node.getId());
            node.getLeadingTrivia().forEach(t -> assertTrue(ids.add(t.getId())));
            node.getTrailingTrivia().forEach(t -> assertTrue(ids.add(t.getId())));
        }
    }
}
