package org.dxworks.vbframe.ir;

/**
 * Exhaustive dispatch over the IR variants. Adding a node kind means adding a method here,
 * which every consumer then has to implement.
 */
public interface IrVisitor<R> {
    R visitModule(ModuleNode node);

    R visitDeclaration(DeclarationNode node);

    R visitProcedure(ProcedureNode node);

    R visitStatement(StatementNode node);

    R visitExpression(ExpressionNode node);

    R visitControlElement(ControlElementNode node);

    R visitEventBinding(EventBindingNode node);

    R visitTrivia(TriviaNode node);

    R visitError(ErrorNode node);
}
