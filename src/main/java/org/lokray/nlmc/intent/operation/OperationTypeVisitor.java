package org.lokray.nlmc.intent.operation;

public interface OperationTypeVisitor<R>
{
	R visitArithmetic(ArithmeticOperation operation);

	R visitComparison(ComparisonOperation operation);

	R visitAssignment(AssignmentOperation operation);

	R visitFunctionCall(FunctionCallOperation operation);

	R visitLoop(LoopOperation operation);

	R visitConditional(ConditionalOperation operation);

	R visitInput(InputOperation operation);

	R visitOutput(OutputOperation operation);

	R visitMemoryAllocation(MemoryAllocationOperation operation);

	R visitSystemCall(SystemCallOperation operation);
}
