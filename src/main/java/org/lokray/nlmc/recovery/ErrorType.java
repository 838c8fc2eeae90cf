package org.lokray.nlmc.recovery;

public enum ErrorType
{
	SYNTAX_ERROR,
	SEMANTIC_ERROR,
	TYPE_ERROR,
	RUNTIME_ERROR,
	TYPE_MISMATCH,
	UNDEFINED_REFERENCE,
	AMBIGUITY_RESOLUTION_FAILURE,
	MEMORY_LAYOUT_ERROR,
	OPTIMIZATION_FAILURE,
	CODE_GENERATION_ERROR,
	LLM_COMMUNICATION_ERROR,
	SYSTEM_ERROR
}
