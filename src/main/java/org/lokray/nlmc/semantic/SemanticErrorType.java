package org.lokray.nlmc.semantic;

public enum SemanticErrorType
{
	UNDEFINED_VARIABLE, TYPE_MISMATCH, INVALID_OPERATION, SCOPE_VIOLATION, MEMORY_LEAK, UNREACHABLE_CODE, INFINITE_LOOP
}
